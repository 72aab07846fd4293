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

/**
 * Successful result of a single remote attempt together with the rate-limit
 * metadata the provider sent along with it.
 *
 * @param value
 *            decoded response value, may be {@code null} for empty bodies
 * @param rateLimit
 *            limit metadata, {@code null} when the response carried none
 */
public record ApiResponse<T>(T value, RateLimitState rateLimit) {

    public static <T> ApiResponse<T> of(T value) {
        return new ApiResponse<>(value, null);
    }

    public static <T> ApiResponse<T> of(T value, RateLimitState rateLimit) {
        return new ApiResponse<>(value, rateLimit);
    }
}
