package me.shadowbot.orchestrator.adapter.outbound.storage;

import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String STATE = "state";
    private static final String CURSOR_FILE = "mention-cursor.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    // ===== Layout =====

    @Test
    void shouldCreateWorkspaceDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("state")));
        assertTrue(Files.isDirectory(tempDir.resolve("metrics")));
    }

    // ===== Read and write =====

    @Test
    void shouldReadWhatWasWrittenAtomically() throws Exception {
        storageAdapter.putTextAtomic(STATE, "notes.txt", "hello").get();

        assertEquals("hello", storageAdapter.getText(STATE, "notes.txt").get());
        assertEquals("hello", Files.readString(tempDir.resolve("state/notes.txt")));
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(STATE, "missing.json").get());
    }

    @Test
    void shouldAppendJsonLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("metrics", "metrics.jsonl", "{\"n\":1}\n").get();
        storageAdapter.appendText("metrics", "metrics.jsonl", "{\"n\":2}\n").get();

        assertEquals("{\"n\":1}\n{\"n\":2}\n", storageAdapter.getText("metrics", "metrics.jsonl").get());
    }

    @Test
    void shouldCreateParentDirectoriesOnAppend() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(STATE, "archive/2026/outcomes.jsonl", "line\n").get();

        assertEquals("line\n", storageAdapter.getText(STATE, "archive/2026/outcomes.jsonl").get());
    }

    // ===== Atomic write =====

    @Test
    void shouldReplaceContentAtomically() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(STATE, CURSOR_FILE, "{\"lastProcessedId\":\"1\"}").get();
        storageAdapter.putTextAtomic(STATE, CURSOR_FILE, "{\"lastProcessedId\":\"2\"}").get();

        assertEquals("{\"lastProcessedId\":\"2\"}", storageAdapter.getText(STATE, CURSOR_FILE).get());
        assertFalse(Files.exists(tempDir.resolve("state").resolve(CURSOR_FILE + ".tmp")));
    }

    @Test
    void shouldCreateParentDirectoriesOnAtomicWrite() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(STATE, "nested/rate-limits.json", "{}").get();

        assertEquals("{}", storageAdapter.getText(STATE, "nested/rate-limits.json").get());
    }

    // ===== Path traversal =====

    @Test
    void shouldBlockPathTraversalOnAppend() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.appendText(STATE, "../../etc/passwd", "x").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void shouldBlockPathTraversalOnRead() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("..", "secrets.txt").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void shouldBlockPathTraversalOnAtomicWrite() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic("../outside", CURSOR_FILE, "x").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
