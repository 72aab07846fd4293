package me.shadowbot.orchestrator.domain.service;

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
import me.shadowbot.orchestrator.domain.model.UserIdentity;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.SocialApiPort;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * TTL cache for the bot's own account identity.
 *
 * <p>
 * An expired entry triggers one {@code USER_LOOKUP} call through the
 * orchestrator. Concurrent callers may both refresh; the lookup is idempotent.
 */
@Service
@Slf4j
public class IdentityCache {

    private final RequestOrchestrator orchestrator;
    private final SocialApiPort socialApiPort;
    private final Clock clock;
    private final long ttlMs;

    private volatile CachedIdentity cached;

    public IdentityCache(RequestOrchestrator orchestrator, SocialApiPort socialApiPort, Clock clock,
            BotProperties properties) {
        this.orchestrator = orchestrator;
        this.socialApiPort = socialApiPort;
        this.clock = clock;
        this.ttlMs = properties.getIdentity().getTtlMs();
    }

    /**
     * Id of the authenticated account.
     */
    public String getCachedIdentity() {
        return getIdentity().id();
    }

    public UserIdentity getIdentity() {
        CachedIdentity current = cached;
        if (current != null && clock.millis() - current.fetchedAtMillis() < ttlMs) {
            return current.identity();
        }

        UserIdentity fresh = orchestrator.execute(EndpointCategory.USER_LOOKUP, null, socialApiPort::getIdentity);
        if (fresh == null || fresh.id() == null || fresh.id().isBlank()) {
            throw new IllegalStateException("User lookup returned no account id");
        }
        cached = new CachedIdentity(fresh, clock.millis());
        log.debug("[Identity] refreshed: id={}, username={}", fresh.id(), fresh.username());
        return fresh;
    }

    public void invalidate() {
        cached = null;
    }

    private record CachedIdentity(UserIdentity identity, long fetchedAtMillis) {
    }
}
