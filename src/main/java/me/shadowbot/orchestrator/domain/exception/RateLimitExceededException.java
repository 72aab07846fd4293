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

/**
 * Every attempt of an operation was throttled.
 *
 * @since 1.0
 */
@Getter
public class RateLimitExceededException extends OrchestrationException {

    private final Long lastResetAtEpochMillis;
    private final int attempts;

    public RateLimitExceededException(EndpointCategory category, int attempts, Long lastResetAtEpochMillis,
            Throwable cause) {
        super(category, "Rate limit exceeded after " + attempts + " attempts on " + category.getKey(), cause);
        this.attempts = attempts;
        this.lastResetAtEpochMillis = lastResetAtEpochMillis;
    }

    public boolean hasReset() {
        return lastResetAtEpochMillis != null;
    }
}
