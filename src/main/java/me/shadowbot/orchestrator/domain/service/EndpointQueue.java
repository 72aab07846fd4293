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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.exception.LaneCapacityExceededException;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single-flight execution lanes, one per {@link EndpointCategory}.
 *
 * <p>
 * Guarantees:
 * </p>
 * <ul>
 * <li>At most one task per category runs at any instant.</li>
 * <li>Tasks of one category run in submission order; a task starts only after
 * the previous one settled.</li>
 * <li>Categories are independent and run concurrently on the shared lane
 * executor.</li>
 * </ul>
 */
@Service
@Slf4j
public class EndpointQueue {

    private final ExecutorService laneExecutor;
    private final int maxPendingPerCategory;

    private final Map<EndpointCategory, Lane> lanes = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public EndpointQueue(@Qualifier("endpointLaneExecutor") ExecutorService laneExecutor,
            BotProperties properties) {
        this.laneExecutor = laneExecutor;
        this.maxPendingPerCategory = properties.getQueue().getMaxPendingPerCategory();
    }

    public <T> CompletableFuture<T> submit(EndpointCategory category, Callable<T> task) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(task, "task");
        if (shutdown) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Endpoint queue is shut down, rejected " + category.getKey()));
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        lanes.computeIfAbsent(category, Lane::new).enqueue(new PendingTask<>(task, future));
        return future;
    }

    /**
     * Number of tasks waiting behind the running one in {@code category}.
     */
    public int pendingCount(EndpointCategory category) {
        Lane lane = lanes.get(category);
        return lane != null ? lane.pendingCount() : 0;
    }

    /**
     * Stop accepting submissions. Tasks already queued still run.
     */
    @PreDestroy
    public void shutdown() {
        shutdown = true;
        log.info("[EndpointQueue] shut down, no further submissions accepted");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private final class Lane {

        private final EndpointCategory category;
        private final Object lock = new Object();
        private final Deque<PendingTask<?>> pending = new ArrayDeque<>();

        private boolean running = false;

        private Lane(EndpointCategory category) {
            this.category = category;
        }

        void enqueue(PendingTask<?> task) {
            synchronized (lock) {
                if (running) {
                    if (pending.size() >= maxPendingPerCategory) {
                        log.warn("[EndpointQueue] {} lane full ({}), rejecting submission",
                                category.getKey(), maxPendingPerCategory);
                        task.fail(new LaneCapacityExceededException(category, maxPendingPerCategory));
                        return;
                    }
                    pending.addLast(task);
                    log.debug("[EndpointQueue] {} queued behind running task ({} pending)",
                            category.getKey(), pending.size());
                    return;
                }
                running = true;
            }
            start(task);
        }

        int pendingCount() {
            synchronized (lock) {
                return pending.size();
            }
        }

        private void start(PendingTask<?> task) {
            try {
                laneExecutor.execute(() -> {
                    try {
                        task.run();
                    } finally {
                        onTaskComplete();
                    }
                });
            } catch (RejectedExecutionException e) {
                log.error("[EndpointQueue] {} executor rejected task", category.getKey(), e);
                task.fail(e);
                onTaskComplete();
            }
        }

        private void onTaskComplete() {
            PendingTask<?> next;
            synchronized (lock) {
                next = pending.pollFirst();
                if (next == null) {
                    running = false;
                    return;
                }
            }
            start(next);
        }
    }

    private record PendingTask<T>(Callable<T> task, CompletableFuture<T> future) {

        void run() {
            try {
                future.complete(task.call());
            } catch (Exception e) { // NOSONAR - failure belongs to the submitter
                future.completeExceptionally(e);
            }
        }

        void fail(Throwable error) {
            future.completeExceptionally(error);
        }
    }
}
