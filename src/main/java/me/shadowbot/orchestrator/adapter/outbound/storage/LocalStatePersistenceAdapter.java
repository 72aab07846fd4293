package me.shadowbot.orchestrator.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.model.ActivityMetricsSnapshot;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.MentionOutcome;
import me.shadowbot.orchestrator.domain.model.RateLimitState;
import me.shadowbot.orchestrator.port.outbound.PersistencePort;
import me.shadowbot.orchestrator.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link PersistencePort} backed by the local workspace.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code state/mention-cursor.json} - last processed mention, written
 * atomically</li>
 * <li>{@code state/rate-limits.json} - latest observation per category,
 * written in the background</li>
 * <li>{@code state/own-posts.txt} - ids of posts the bot authored, one per
 * line</li>
 * <li>{@code state/mention-outcomes.jsonl} - handled mentions</li>
 * <li>{@code metrics/metrics.jsonl} - activity snapshots</li>
 * </ul>
 *
 * <p>
 * The cursor and own-post ids are loaded into memory on startup.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class LocalStatePersistenceAdapter implements PersistencePort {

    private static final String LOG_PREFIX = "[State]";
    private static final String STATE_DIR = "state";
    private static final String METRICS_DIR = "metrics";
    private static final String CURSOR_FILE = "mention-cursor.json";
    private static final String RATE_LIMITS_FILE = "rate-limits.json";
    private static final String OWN_POSTS_FILE = "own-posts.txt";
    private static final String OUTCOMES_FILE = "mention-outcomes.jsonl";
    private static final String METRICS_FILE = "metrics.jsonl";
    private static final String NEWLINE = "\n";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Set<String> ownPosts = ConcurrentHashMap.newKeySet();
    private final Map<String, RateLimitState> rateLimits = new ConcurrentHashMap<>();
    private final ExecutorService rateLimitWriter = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "rate-limit-writer");
        t.setDaemon(true);
        return t;
    });

    private volatile String cursor;

    public LocalStatePersistenceAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        loadPersistedCursor();
        loadOwnPosts();
    }

    @PreDestroy
    public void destroy() {
        rateLimitWriter.shutdown();
        try {
            if (!rateLimitWriter.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                rateLimitWriter.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public Optional<String> loadCursor() {
        return Optional.ofNullable(cursor);
    }

    @Override
    public void saveCursor(String mentionId) {
        if (mentionId == null || mentionId.isBlank()) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(new CursorRecord(mentionId, clock.instant()));
            await(storagePort.putTextAtomic(STATE_DIR, CURSOR_FILE, json), "save cursor");
            cursor = mentionId;
            log.debug("{} Cursor advanced to {}", LOG_PREFIX, mentionId);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cursor", e);
        }
    }

    @Override
    public void recordRateLimitObservation(EndpointCategory category, RateLimitState state) {
        rateLimits.put(category.getKey(), state);
        try {
            rateLimitWriter.execute(this::writeRateLimits);
        } catch (RejectedExecutionException e) {
            log.debug("{} Rate limit writer stopped, observation for {} kept in memory", LOG_PREFIX,
                    category.getKey());
        }
    }

    @Override
    public void recordOwnPost(String tweetId) {
        if (tweetId == null || tweetId.isBlank() || !ownPosts.add(tweetId)) {
            return;
        }
        await(storagePort.appendText(STATE_DIR, OWN_POSTS_FILE, tweetId + NEWLINE), "record own post");
    }

    @Override
    public boolean isOwnPost(String tweetId) {
        return tweetId != null && ownPosts.contains(tweetId);
    }

    @Override
    public void recordMentionOutcome(MentionOutcome outcome) {
        appendJsonLine(STATE_DIR, OUTCOMES_FILE, outcome);
    }

    @Override
    public void recordMetrics(ActivityMetricsSnapshot snapshot) {
        appendJsonLine(METRICS_DIR, METRICS_FILE, snapshot);
    }

    private void writeRateLimits() {
        try {
            String json = objectMapper.writeValueAsString(new TreeMap<>(rateLimits));
            await(storagePort.putTextAtomic(STATE_DIR, RATE_LIMITS_FILE, json), "write rate limits");
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - best-effort
            log.warn("{} Failed to persist rate limits: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private void appendJsonLine(String directory, String file, Object value) {
        try {
            String line = objectMapper.writeValueAsString(value) + NEWLINE;
            await(storagePort.appendText(directory, file, line), "append " + file);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private void loadPersistedCursor() {
        try {
            String json = storagePort.getText(STATE_DIR, CURSOR_FILE).join();
            if (json == null || json.isBlank()) {
                log.info("{} No persisted mention cursor", LOG_PREFIX);
                return;
            }
            CursorRecord record = objectMapper.readValue(json, CursorRecord.class);
            cursor = record.getLastProcessedId();
            log.info("{} Resuming mentions after {}", LOG_PREFIX, cursor);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load mention cursor, starting fresh: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private void loadOwnPosts() {
        try {
            String content = storagePort.getText(STATE_DIR, OWN_POSTS_FILE).join();
            if (content == null) {
                return;
            }
            content.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .forEach(ownPosts::add);
            log.info("{} Loaded {} own post ids", LOG_PREFIX, ownPosts.size());
        } catch (RuntimeException e) {
            log.warn("{} Failed to load own posts: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private static <T> T await(CompletableFuture<T> future, String action) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Failed to " + action + ": " + cause.getMessage(), cause);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CursorRecord {
        private String lastProcessedId;
        private Instant updatedAt;
    }
}
