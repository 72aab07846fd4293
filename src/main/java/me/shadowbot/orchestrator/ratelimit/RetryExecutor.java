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
import me.shadowbot.orchestrator.domain.exception.RateLimitExceededException;
import me.shadowbot.orchestrator.domain.exception.RateLimitedException;
import me.shadowbot.orchestrator.domain.exception.TransientNetworkException;
import me.shadowbot.orchestrator.domain.model.ApiResponse;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.RateLimitState;
import me.shadowbot.orchestrator.domain.model.ScheduledOperation;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.PersistencePort;
import me.shadowbot.orchestrator.usage.ActivityMetrics;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs one operation with bounded retries driven by provider rate-limit
 * signals.
 *
 * <p>
 * Retry policy:
 * <ul>
 * <li>Before each attempt, waits out a window the registry knows to be
 * exhausted (reset time plus a safety buffer).</li>
 * <li>Throttled with a reset time: records the window and sleeps until reset
 * plus buffer.</li>
 * <li>Throttled without a reset time, or a transient network failure: sleeps
 * by the fixed {@link BackoffSchedule}.</li>
 * <li>Anything else fails on first occurrence.</li>
 * </ul>
 * When the operation runs out of attempts while throttled the caller gets a
 * {@link RateLimitExceededException} carrying the last reset time.
 *
 * <p>
 * This is the only writer of {@link RateLimitRegistry}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class RetryExecutor {

    private static final String LOG_PREFIX = "[RetryExecutor]";

    private final RateLimitRegistry registry;
    private final PersistencePort persistencePort;
    private final ActivityMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final BackoffSchedule backoffSchedule;
    private final long resetBufferMs;

    public RetryExecutor(RateLimitRegistry registry, PersistencePort persistencePort, ActivityMetrics metrics,
            Sleeper sleeper, Clock clock, BotProperties properties) {
        this.registry = registry;
        this.persistencePort = persistencePort;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.clock = clock;
        this.backoffSchedule = BackoffSchedule.ofMillis(properties.getRetry().getBackoffScheduleMs());
        this.resetBufferMs = properties.getRetry().getResetBufferMs();
    }

    public <T> T execute(ScheduledOperation operation, AttemptFunction<T> attemptFunction) {
        EndpointCategory category = operation.getCategory();
        while (true) {
            awaitWindow(operation);
            operation.markExecuting();
            metrics.recordApiCall();
            try {
                ApiResponse<T> response = attemptFunction.attempt();
                if (response != null && response.rateLimit() != null && response.rateLimit().carriesLimitData()) {
                    observe(category, response.rateLimit());
                }
                operation.markSucceeded();
                return response != null ? response.value() : null;
            } catch (RateLimitedException e) {
                metrics.recordRateLimitHit();
                Duration delay = handleThrottle(category, operation, e);
                if (!operation.hasAttemptsLeft()) {
                    operation.markFailed();
                    metrics.recordError();
                    log.warn("{} {} throttled on final attempt {}/{}", LOG_PREFIX, category.getKey(),
                            operation.getAttempt(), operation.getMaxAttempts());
                    throw new RateLimitExceededException(category, operation.getAttempt(),
                            lastKnownReset(category, e), e);
                }
                log.warn("{} {} throttled (attempt {}/{}), retrying in {}ms", LOG_PREFIX, category.getKey(),
                        operation.getAttempt(), operation.getMaxAttempts(), delay.toMillis());
                retryAfter(operation, delay);
            } catch (TransientNetworkException e) {
                if (!operation.hasAttemptsLeft()) {
                    operation.markFailed();
                    metrics.recordError();
                    log.warn("{} {} failed on final attempt {}/{}: {}", LOG_PREFIX, category.getKey(),
                            operation.getAttempt(), operation.getMaxAttempts(), e.getMessage());
                    throw e;
                }
                Duration delay = backoffSchedule.delayForAttempt(operation.getAttempt());
                log.warn("{} {} transient failure (attempt {}/{}), retrying in {}ms: {}", LOG_PREFIX,
                        category.getKey(), operation.getAttempt(), operation.getMaxAttempts(), delay.toMillis(),
                        e.getMessage());
                retryAfter(operation, delay);
            } catch (RuntimeException e) {
                operation.markFailed();
                metrics.recordError();
                log.debug("{} {} failed without retry: {}", LOG_PREFIX, category.getKey(), e.getMessage());
                throw e;
            }
        }
    }

    private Duration handleThrottle(EndpointCategory category, ScheduledOperation operation,
            RateLimitedException e) {
        if (!e.hasReset()) {
            return backoffSchedule.delayForAttempt(operation.getAttempt());
        }
        long now = clock.millis();
        observe(category, e.toState(now));
        return Duration.ofMillis(Math.max(0L, e.getResetAtEpochMillis() + resetBufferMs - now));
    }

    /**
     * Reset carried by the final throttle, else the latest one observed for
     * the category.
     */
    private Long lastKnownReset(EndpointCategory category, RateLimitedException e) {
        if (e.hasReset()) {
            return e.getResetAtEpochMillis();
        }
        return registry.find(category)
                .map(RateLimitState::getResetAtEpochMillis)
                .orElse(null);
    }

    private void awaitWindow(ScheduledOperation operation) {
        EndpointCategory category = operation.getCategory();
        long waitMs = registry.millisUntilAvailable(category, clock.millis(), resetBufferMs);
        if (waitMs <= 0) {
            return;
        }
        log.info("{} {} window exhausted, waiting {}ms before attempt {}", LOG_PREFIX, category.getKey(),
                waitMs, operation.getAttempt());
        operation.markWaiting();
        sleep(Duration.ofMillis(waitMs));
    }

    private void retryAfter(ScheduledOperation operation, Duration delay) {
        operation.markWaiting();
        sleep(delay);
        operation.nextAttempt();
    }

    private void observe(EndpointCategory category, RateLimitState state) {
        registry.observe(category, state);
        try {
            persistencePort.recordRateLimitObservation(category, state);
        } catch (RuntimeException e) { // NOSONAR - best-effort
            log.debug("{} Failed to persist rate limit for {}: {}", LOG_PREFIX, category.getKey(), e.getMessage());
        }
    }

    private void sleep(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry wait interrupted", e);
        }
    }
}
