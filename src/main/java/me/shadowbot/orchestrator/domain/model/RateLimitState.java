package me.shadowbot.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Last observed provider rate-limit window for one endpoint category.
 *
 * <p>
 * Every field except {@code observedAtEpochMillis} is optional because
 * providers do not always send all limit headers. A state whose reset time has
 * passed says nothing about the current window: it is kept, but
 * {@link #isExhaustedAt(long)} no longer reports exhaustion.
 *
 * @since 1.0
 */
@Value
@Builder
public class RateLimitState {

    Long remaining;
    Long resetAtEpochMillis;
    Long limit;
    long observedAtEpochMillis;

    public boolean hasReset() {
        return resetAtEpochMillis != null;
    }

    /**
     * Whether this observation proves that a call made at {@code nowMillis}
     * would be throttled.
     */
    public boolean isExhaustedAt(long nowMillis) {
        return remaining != null && remaining <= 0
                && resetAtEpochMillis != null && resetAtEpochMillis > nowMillis;
    }

    public boolean carriesLimitData() {
        return remaining != null || resetAtEpochMillis != null || limit != null;
    }
}
