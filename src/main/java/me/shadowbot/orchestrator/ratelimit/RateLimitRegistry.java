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

import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.RateLimitState;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide record of the last observed rate-limit window per endpoint
 * category.
 *
 * <p>
 * Entries are created lazily on first observation and replaced wholesale on
 * every later one. Only {@link RetryExecutor} reads or writes entries. Every
 * access holds the registry monitor.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class RateLimitRegistry {

    private final Map<EndpointCategory, RateLimitState> states = new EnumMap<>(EndpointCategory.class);

    synchronized void observe(EndpointCategory category, RateLimitState state) {
        states.put(category, state);
        log.debug("[RateLimit] {}: remaining={}, limit={}, resetAt={}",
                category.getKey(), state.getRemaining(), state.getLimit(), state.getResetAtEpochMillis());
    }

    synchronized Optional<RateLimitState> find(EndpointCategory category) {
        return Optional.ofNullable(states.get(category));
    }

    /**
     * Milliseconds to wait before a call in {@code category} can succeed, or
     * zero when nothing proves the window is exhausted.
     */
    synchronized long millisUntilAvailable(EndpointCategory category, long nowMillis, long bufferMillis) {
        RateLimitState state = states.get(category);
        if (state == null || !state.isExhaustedAt(nowMillis)) {
            return 0L;
        }
        return Math.max(0L, state.getResetAtEpochMillis() + bufferMillis - nowMillis);
    }
}
