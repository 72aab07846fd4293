package me.shadowbot.orchestrator.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;
import java.util.List;

/**
 * Fixed table of backoff delays indexed by attempt number.
 *
 * <p>
 * Used when a throttled response carries no reset time and for transient
 * network failures. Attempts past the end of the table reuse the last entry.
 *
 * @since 1.0
 */
public final class BackoffSchedule {

    private final List<Duration> delays;

    public BackoffSchedule(List<Duration> delays) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("Backoff schedule must have at least one delay");
        }
        this.delays = List.copyOf(delays);
    }

    public static BackoffSchedule ofMillis(List<Long> delaysMs) {
        if (delaysMs == null) {
            throw new IllegalArgumentException("Backoff schedule must have at least one delay");
        }
        return new BackoffSchedule(delaysMs.stream().map(Duration::ofMillis).toList());
    }

    /**
     * Delay to apply after the given (1-based) attempt failed.
     */
    public Duration delayForAttempt(int attempt) {
        int index = Math.min(Math.max(attempt, 1), delays.size()) - 1;
        return delays.get(index);
    }

    public List<Duration> getDelays() {
        return delays;
    }
}
