package me.golemcore.gateway.port.outbound;

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
 * Workspace file access used for session snapshots and turn transcripts.
 * Paths are relative to a named directory under the workspace root; a path
 * that resolves outside the workspace is rejected with
 * {@link IllegalArgumentException}.
 */
public interface StoragePort {

    /**
     * Reads a whole file as UTF-8. Completes with {@code null} for a missing
     * file.
     *
     * @param directory
     *            workspace directory, {@code sessions} or {@code transcripts}
     * @param path
     *            file path inside that directory
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Relative file names under {@code directory} starting with
     * {@code prefix}, sorted. An empty or {@code null} prefix lists everything.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Appends to the file. Concurrent appends to the same file are serialized so
     * JSONL lines never interleave.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Writes through a synced {@code .tmp} sibling and renames it over the
     * target, so readers see either the old or the new snapshot. With
     * {@code backup} the previous file is copied to {@code .bak} first.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
