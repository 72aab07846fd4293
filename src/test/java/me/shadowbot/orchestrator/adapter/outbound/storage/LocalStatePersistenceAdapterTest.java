package me.shadowbot.orchestrator.adapter.outbound.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.shadowbot.orchestrator.domain.model.ActivityMetricsSnapshot;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.MentionOutcome;
import me.shadowbot.orchestrator.domain.model.RateLimitState;
import me.shadowbot.orchestrator.infrastructure.config.AutoConfiguration;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.StoragePort;
import me.shadowbot.orchestrator.testsupport.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LocalStatePersistenceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-14T12:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private LocalStatePersistenceAdapter adapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(NOW);
        adapter = newAdapter();
    }

    @AfterEach
    void tearDown() {
        adapter.destroy();
    }

    // ===== Cursor =====

    @Test
    void shouldStartWithoutCursor() {
        assertEquals(Optional.empty(), adapter.loadCursor());
    }

    @Test
    void shouldKeepCursorAcrossRestart() throws Exception {
        adapter.saveCursor("100");
        adapter.saveCursor("105");
        adapter.destroy();

        LocalStatePersistenceAdapter restarted = newAdapter();
        try {
            assertEquals(Optional.of("105"), restarted.loadCursor());
        } finally {
            restarted.destroy();
        }

        JsonNode file = objectMapper.readTree(tempDir.resolve("state/mention-cursor.json").toFile());
        assertEquals("105", file.get("lastProcessedId").asText());
        assertEquals("2026-03-14T12:00:00Z", file.get("updatedAt").asText());
    }

    @Test
    void shouldIgnoreBlankCursor() {
        adapter.saveCursor("7");
        adapter.saveCursor(" ");

        assertEquals(Optional.of("7"), adapter.loadCursor());
    }

    @Test
    void shouldStartFreshWhenCursorFileIsCorrupt() throws Exception {
        Files.writeString(tempDir.resolve("state/mention-cursor.json"), "{broken");

        LocalStatePersistenceAdapter restarted = newAdapter();
        try {
            assertEquals(Optional.empty(), restarted.loadCursor());
        } finally {
            restarted.destroy();
        }
    }

    @Test
    void shouldNotAdvanceCursorWhenWriteFails() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("read-only")));
        LocalStatePersistenceAdapter broken = new LocalStatePersistenceAdapter(failing, objectMapper, clock);
        broken.init();
        try {
            assertThrows(IllegalStateException.class, () -> broken.saveCursor("9"));
            assertEquals(Optional.empty(), broken.loadCursor());
        } finally {
            broken.destroy();
        }
    }

    // ===== Own posts =====

    @Test
    void shouldRememberOwnPostsAcrossRestart() throws Exception {
        adapter.recordOwnPost("501");
        adapter.recordOwnPost("502");
        adapter.recordOwnPost("501");

        assertTrue(adapter.isOwnPost("501"));
        assertFalse(adapter.isOwnPost("999"));
        assertFalse(adapter.isOwnPost(null));
        assertEquals(List.of("501", "502"), Files.readAllLines(tempDir.resolve("state/own-posts.txt")));

        LocalStatePersistenceAdapter restarted = newAdapter();
        try {
            assertTrue(restarted.isOwnPost("502"));
        } finally {
            restarted.destroy();
        }
    }

    // ===== Journals =====

    @Test
    void shouldAppendMentionOutcomes() throws Exception {
        adapter.recordMentionOutcome(MentionOutcome.replied("10", "11", NOW));
        adapter.recordMentionOutcome(MentionOutcome.skipped("12", "No reply composed", NOW));

        List<String> lines = Files.readAllLines(tempDir.resolve("state/mention-outcomes.jsonl"));
        assertEquals(2, lines.size());
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("10", first.get("mentionId").asText());
        assertEquals("REPLIED", first.get("status").asText());
        assertEquals("11", first.get("replyId").asText());
        assertEquals("SKIPPED", objectMapper.readTree(lines.get(1)).get("status").asText());
    }

    @Test
    void shouldAppendMetricsSnapshots() throws Exception {
        adapter.recordMetrics(ActivityMetricsSnapshot.builder()
                .tweetsPosted(3)
                .repliesSent(4)
                .apiCalls(12)
                .timestamp(NOW)
                .build());

        List<String> lines = Files.readAllLines(tempDir.resolve("metrics/metrics.jsonl"));
        assertEquals(1, lines.size());
        ActivityMetricsSnapshot restored = objectMapper.readValue(lines.get(0), ActivityMetricsSnapshot.class);
        assertEquals(3, restored.getTweetsPosted());
        assertEquals(12, restored.getApiCalls());
        assertEquals(NOW, restored.getTimestamp());
    }

    // ===== Rate limits =====

    @Test
    void shouldWriteLatestRateLimitPerCategory() throws Exception {
        adapter.recordRateLimitObservation(EndpointCategory.TWEET, state(5L, 1_000L));
        adapter.recordRateLimitObservation(EndpointCategory.TWEET, state(4L, 2_000L));
        adapter.recordRateLimitObservation(EndpointCategory.MENTIONS, state(0L, 3_000L));
        adapter.destroy();

        JsonNode file = objectMapper.readTree(tempDir.resolve("state/rate-limits.json").toFile());
        assertEquals(4, file.path("tweet").path("remaining").asLong());
        assertEquals(2_000L, file.path("tweet").path("resetAtEpochMillis").asLong());
        assertEquals(0, file.path("mentions").path("remaining").asLong());
    }

    @Test
    void shouldAcceptObservationsAfterShutdown() {
        adapter.destroy();

        assertDoesNotThrow(() -> adapter.recordRateLimitObservation(EndpointCategory.LIKE, state(1L, 1L)));
    }

    private LocalStatePersistenceAdapter newAdapter() {
        LocalStatePersistenceAdapter created = new LocalStatePersistenceAdapter(storage, objectMapper, clock);
        created.init();
        return created;
    }

    private RateLimitState state(Long remaining, Long resetAt) {
        return RateLimitState.builder()
                .remaining(remaining)
                .resetAtEpochMillis(resetAt)
                .limit(50L)
                .observedAtEpochMillis(clock.millis())
                .build();
    }
}
