package me.shadowbot.orchestrator.adapter.outbound.auth;

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

import lombok.RequiredArgsConstructor;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.AccessTokenPort;
import org.springframework.stereotype.Component;

/**
 * Bearer token taken verbatim from {@code bot.x-api.bearer-token}.
 */
@Component
@RequiredArgsConstructor
public class StaticAccessTokenAdapter implements AccessTokenPort {

    private final BotProperties properties;

    @Override
    public String getAccessToken() {
        return properties.getXApi().getBearerToken();
    }
}
