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

import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * One requested call travelling through quota gate, endpoint lane and retry
 * loop.
 *
 * <p>
 * Instances are transient and confined to the lane that executes them.
 *
 * @since 1.0
 */
@Getter
@ToString
public class ScheduledOperation {

    private final String id;
    private final EndpointCategory category;
    private final Object payload;
    private final int maxAttempts;
    private int attempt;
    private OperationStatus status;

    public ScheduledOperation(EndpointCategory category, Object payload, int maxAttempts) {
        if (category == null) {
            throw new IllegalArgumentException("category is required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.id = UUID.randomUUID().toString();
        this.category = category;
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.attempt = 1;
        this.status = OperationStatus.QUEUED;
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public void markExecuting() {
        status = OperationStatus.EXECUTING;
    }

    public void markWaiting() {
        status = OperationStatus.WAITING;
    }

    public void nextAttempt() {
        attempt++;
    }

    public void markSucceeded() {
        status = OperationStatus.SUCCEEDED;
    }

    public void markFailed() {
        status = OperationStatus.FAILED;
    }
}
