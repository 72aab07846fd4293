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
import lombok.Data;

/**
 * Result of a quota reservation check.
 *
 * @since 1.0
 */
@Data
@Builder
public class QuotaDecision {

    private boolean allowed;
    private String reason;

    public static QuotaDecision allowed() {
        return QuotaDecision.builder()
                .allowed(true)
                .build();
    }

    public static QuotaDecision denied(String reason) {
        return QuotaDecision.builder()
                .allowed(false)
                .reason(reason)
                .build();
    }
}
