package me.shadowbot.orchestrator.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for file operations within the local workspace. Files are organized by
 * directory ("state", "metrics") with support for atomic and append-only
 * (JSONL) writes.
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file
     * does not exist.
     *
     * @param directory
     *            subdirectory (e.g., "state", "metrics")
     * @param path
     *            relative path within directory
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Append text to a file (for logs, JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically replace the content of a file.
     *
     * <p>
     * Writes go to a {@code .tmp} sibling first, are flushed to disk and then
     * renamed over the target, so readers never observe a partial file.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
