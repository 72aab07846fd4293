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
 * Authentication, validation or other non-retryable client error.
 */
@Getter
public class PermanentApiException extends OrchestrationException {

    private final int statusCode;

    public PermanentApiException(EndpointCategory category, int statusCode, String message) {
        super(category, "[" + statusCode + "] " + message);
        this.statusCode = statusCode;
    }

    public PermanentApiException(EndpointCategory category, int statusCode, String message, Throwable cause) {
        super(category, "[" + statusCode + "] " + message, cause);
        this.statusCode = statusCode;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
