package me.golemcore.agents.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations within the local workspace. Provides
 * file operations organized by directory (agents, sessions, messages) with
 * support for text, atomic and append-only (JSONL) writes.
 */
public interface StoragePort {

    /**
     * Write text content to file.
     *
     * @param directory
     *            subdirectory (e.g., "agents", "sessions", "messages")
     * @param path
     *            relative path within directory
     * @param content
     *            text content
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, completing with {@code null} when the file
     * does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (for JSONL). A single call is written with one
     * write, so a batch of lines lands together or not at all on local disks.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically replace a file: write to a temporary sibling, fsync, then
     * rename over the target.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    CompletableFuture<Void> ensureDirectory(String directory);
}
