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
import me.shadowbot.orchestrator.domain.exception.QuotaExceededException;
import me.shadowbot.orchestrator.domain.model.ActivityType;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.QuotaDecision;
import me.shadowbot.orchestrator.domain.model.ScheduledOperation;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.ratelimit.AttemptFunction;
import me.shadowbot.orchestrator.ratelimit.RetryExecutor;
import me.shadowbot.orchestrator.usage.QuotaTracker;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for every outbound API call.
 *
 * <p>
 * A call reserves its quota slot, waits for its endpoint lane and runs through
 * the {@link RetryExecutor}. The reservation is committed once the call
 * succeeded and released when it failed or never reached the lane.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class RequestOrchestrator {

    private final QuotaTracker quotaTracker;
    private final EndpointQueue endpointQueue;
    private final RetryExecutor retryExecutor;
    private final int maxAttempts;

    public RequestOrchestrator(QuotaTracker quotaTracker, EndpointQueue endpointQueue, RetryExecutor retryExecutor,
            BotProperties properties) {
        this.quotaTracker = quotaTracker;
        this.endpointQueue = endpointQueue;
        this.retryExecutor = retryExecutor;
        this.maxAttempts = properties.getRetry().getMaxAttempts();
    }

    /**
     * Submit a call. A spent quota fails the returned future immediately,
     * without touching the lane; otherwise the call holds its quota slot until
     * it settles.
     */
    public <T> CompletableFuture<T> submit(EndpointCategory category, Object payload,
            AttemptFunction<T> attemptFunction) {
        ActivityType activity = category.getActivityType();
        QuotaDecision decision = quotaTracker.tryReserve(category, activity);
        if (!decision.isAllowed()) {
            return CompletableFuture.failedFuture(new QuotaExceededException(category, decision.getReason()));
        }
        ScheduledOperation operation = new ScheduledOperation(category, payload, maxAttempts);
        log.debug("[Orchestrator] submitted {} ({})", operation.getId(), category.getKey());
        AtomicBoolean started = new AtomicBoolean(false);
        CompletableFuture<T> future = endpointQueue.submit(category, () -> {
            started.set(true);
            return run(operation, attemptFunction);
        });
        future.whenComplete((result, error) -> {
            if (error != null && !started.get()) {
                quotaTracker.release(category, activity);
            }
        });
        return future;
    }

    /**
     * Blocking variant of {@link #submit}. Failures are rethrown unwrapped.
     */
    public <T> T execute(EndpointCategory category, Object payload, AttemptFunction<T> attemptFunction) {
        try {
            return submit(category, payload, attemptFunction).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Operation failed on " + category.getKey(), cause);
        }
    }

    private <T> T run(ScheduledOperation operation, AttemptFunction<T> attemptFunction) {
        EndpointCategory category = operation.getCategory();
        ActivityType activity = category.getActivityType();
        T result;
        try {
            result = retryExecutor.execute(operation, attemptFunction);
        } catch (RuntimeException | Error e) {
            quotaTracker.release(category, activity);
            throw e;
        }
        quotaTracker.commit(category, activity);
        log.debug("[Orchestrator] {} ({}) succeeded after {} attempt(s)", operation.getId(), category.getKey(),
                operation.getAttempt());
        return result;
    }
}
