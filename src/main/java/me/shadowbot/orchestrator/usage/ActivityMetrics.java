package me.shadowbot.orchestrator.usage;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.model.ActivityMetricsSnapshot;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.PersistencePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide activity counters with periodic JSONL snapshots.
 *
 * <p>
 * Counters are cumulative since startup. When enabled via
 * {@code bot.metrics.enabled}, a daemon thread persists a snapshot every
 * {@code bot.metrics.snapshot-interval-minutes} and once more on shutdown.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ActivityMetrics {

    private static final String LOG_PREFIX = "[Metrics]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final PersistencePort persistencePort;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicLong tweetsPosted = new AtomicLong();
    private final AtomicLong repliesSent = new AtomicLong();
    private final AtomicLong apiCalls = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong rateLimitHits = new AtomicLong();

    private final ScheduledExecutorService snapshotExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "metrics-snapshot");
        t.setDaemon(true);
        return t;
    });

    public ActivityMetrics(PersistencePort persistencePort, BotProperties properties, Clock clock) {
        this.persistencePort = persistencePort;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        BotProperties.MetricsProperties metrics = properties.getMetrics();
        if (!metrics.isEnabled()) {
            log.info("{} Snapshots disabled", LOG_PREFIX);
            return;
        }
        int interval = Math.max(1, metrics.getSnapshotIntervalMinutes());
        snapshotExecutor.scheduleAtFixedRate(this::persistSnapshot, interval, interval, TimeUnit.MINUTES);
        log.info("{} Persisting snapshots every {} min", LOG_PREFIX, interval);
    }

    @PreDestroy
    void destroy() {
        snapshotExecutor.shutdownNow();
        try {
            snapshotExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (properties.getMetrics().isEnabled()) {
            persistSnapshot();
        }
    }

    public void recordTweetPosted() {
        tweetsPosted.incrementAndGet();
    }

    public void recordReplySent() {
        repliesSent.incrementAndGet();
    }

    public void recordApiCall() {
        apiCalls.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public void recordRateLimitHit() {
        rateLimitHits.incrementAndGet();
    }

    public ActivityMetricsSnapshot snapshot() {
        return ActivityMetricsSnapshot.builder()
                .tweetsPosted(tweetsPosted.get())
                .repliesSent(repliesSent.get())
                .apiCalls(apiCalls.get())
                .errors(errors.get())
                .rateLimitHits(rateLimitHits.get())
                .timestamp(clock.instant())
                .build();
    }

    void persistSnapshot() {
        try {
            ActivityMetricsSnapshot snapshot = snapshot();
            persistencePort.recordMetrics(snapshot);
            log.debug("{} Snapshot: posted={}, replies={}, calls={}, errors={}, rateLimitHits={}",
                    LOG_PREFIX, snapshot.getTweetsPosted(), snapshot.getRepliesSent(), snapshot.getApiCalls(),
                    snapshot.getErrors(), snapshot.getRateLimitHits());
        } catch (RuntimeException e) { // NOSONAR - keep the snapshot thread alive
            log.warn("{} Failed to persist snapshot: {}", LOG_PREFIX, e.getMessage());
        }
    }
}
