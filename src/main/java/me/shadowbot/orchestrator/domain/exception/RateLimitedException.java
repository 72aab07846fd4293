package me.shadowbot.orchestrator.domain.exception;

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

import lombok.Getter;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.RateLimitState;

/**
 * Throttling signal from a single attempt (HTTP 429).
 *
 * <p>
 * {@code resetAtEpochMillis} is {@code null} when the provider gave no
 * machine-readable reset time; callers then fall back to a fixed backoff.
 *
 * @since 1.0
 */
@Getter
public class RateLimitedException extends OrchestrationException {

    private final Long resetAtEpochMillis;
    private final Long limit;
    private final Long remaining;

    public RateLimitedException(EndpointCategory category, Long resetAtEpochMillis, Long limit, Long remaining) {
        super(category, "Rate limited on " + (category != null ? category.getKey() : "unknown")
                + (resetAtEpochMillis != null ? " until " + resetAtEpochMillis : " (no reset time)"));
        this.resetAtEpochMillis = resetAtEpochMillis;
        this.limit = limit;
        this.remaining = remaining;
    }

    public boolean hasReset() {
        return resetAtEpochMillis != null;
    }

    /**
     * Limit state implied by this signal. Remaining defaults to zero since the
     * provider just refused the call.
     */
    public RateLimitState toState(long observedAtEpochMillis) {
        return RateLimitState.builder()
                .remaining(remaining != null ? remaining : 0L)
                .resetAtEpochMillis(resetAtEpochMillis)
                .limit(limit)
                .observedAtEpochMillis(observedAtEpochMillis)
                .build();
    }
}
