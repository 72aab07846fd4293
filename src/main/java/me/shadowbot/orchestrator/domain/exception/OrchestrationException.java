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
 * Base type of every failure raised by the request orchestration core.
 *
 * @since 1.0
 */
@Getter
public abstract class OrchestrationException extends RuntimeException {

    private final EndpointCategory category;

    protected OrchestrationException(EndpointCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected OrchestrationException(EndpointCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
