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

import me.shadowbot.orchestrator.domain.model.EndpointCategory;

/**
 * Connection failure, timeout or 5xx. Retried with the generic backoff.
 */
public class TransientNetworkException extends OrchestrationException {

    public TransientNetworkException(EndpointCategory category, String message) {
        super(category, message);
    }

    public TransientNetworkException(EndpointCategory category, String message, Throwable cause) {
        super(category, message, cause);
    }
}
