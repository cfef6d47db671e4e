/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.bookmarkstore.storage;

import dev.mars.bookmarkstore.model.Bookmark;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Multi-root bookmark storage.
 * <p>
 * Each configured {@link StorageRoot} keeps one file per bookmark and an in-memory
 * index rebuilt from those files on {@link #initialize(List)}. The filesystem is the
 * source of truth; the index is a disposable cache.
 * <p>
 * <b>Critical Contract:</b> methods that modify state complete their future only after
 * the file write is done <i>and</i> the index reflects it. A failed future means the
 * index is exactly as it was before the call.
 * <p>
 * Queries read the index directly and never wait on file locks.
 *
 * @see FileBookmarkStorage
 */
public interface BookmarkStorage extends Closeable {

    /**
     * Validates and loads every root, in order.
     * <p>
     * The first inaccessible root fails the whole call with a
     * {@link dev.mars.bookmarkstore.error.StorageException}. Corrupt or conflicting record
     * files do not fail it; they are reported through {@link #loadErrors(String)} and
     * {@link #recentConflicts(int)}.
     *
     * @param roots the configured roots
     * @return a Future that completes when every root is indexed
     */
    CompletableFuture<Void> initialize(List<StorageRoot> roots);

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Writes {@code bookmark} to {@code rootName} under the record's file lock, then
     * updates the index.
     *
     * @param bookmark the record to persist; its {@code storageRoot} must equal {@code rootName}
     * @param rootName target root
     * @return a Future holding the persisted bookmark
     */
    CompletableFuture<Bookmark> save(Bookmark bookmark, String rootName);

    /**
     * Re-reads the indexed record under its file lock, applies {@code change} and writes
     * the result before the lock is released. Concurrent updates of one id never lose
     * each other's changes, and {@code change} always sees the latest persisted version.
     * <p>
     * An exception thrown by {@code change} fails the future and leaves the record untouched.
     *
     * @param id       bookmark id
     * @param rootName root holding the record
     * @param change   derives the next version; must keep the id and root
     * @return a Future holding the persisted bookmark, failed with
     *         {@link dev.mars.bookmarkstore.error.NotFoundException} if the id is not indexed
     */
    CompletableFuture<Bookmark> update(String id, String rootName, UnaryOperator<Bookmark> change);

    /**
     * Removes every file holding {@code id} in {@code rootName} and drops it from the index.
     * A missing file is not an error.
     *
     * @param id       bookmark id
     * @param rootName root holding the record
     * @return a Future that completes when the files are gone
     */
    default CompletableFuture<Void> hardDelete(String id, String rootName) {
        return hardDelete(id, rootName, bookmark -> { });
    }

    /**
     * Like {@link #hardDelete(String, String)}, but first runs {@code precondition} on the
     * indexed record while its file lock is held. If the precondition throws, nothing is
     * deleted and the future fails with that exception. The precondition is skipped when
     * the id is not indexed.
     *
     * @param id           bookmark id
     * @param rootName     root holding the record
     * @param precondition check against the latest persisted version
     * @return a Future that completes when the files are gone
     */
    CompletableFuture<Void> hardDelete(String id, String rootName, Consumer<Bookmark> precondition);

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Looks up a bookmark.
     *
     * @param id       bookmark id
     * @param rootName root to search, or null to search all roots in configuration order
     */
    Optional<Bookmark> get(String id, String rootName);

    /**
     * Lists bookmarks matching {@code filter}.
     *
     * @param rootName root to list, or null for all roots
     */
    List<Bookmark> list(String rootName, BookmarkFilter filter);

    /**
     * Counters for one root.
     *
     * @throws dev.mars.bookmarkstore.error.StorageException if the root is not configured
     */
    StorageStats stats(String rootName);

    /** Configured root names, in configuration order. */
    List<String> rootNames();

    /** The root flagged current, else the first configured root, else empty. */
    Optional<String> currentRootName();

    /** The root flagged default, else the current root. */
    Optional<String> defaultRootName();

    /**
     * Files skipped while loading {@code rootName}.
     *
     * @throws dev.mars.bookmarkstore.error.StorageException if the root is not configured
     */
    List<LoadError> loadErrors(String rootName);

    /**
     * The most recent duplicate-id conflicts across all roots, oldest first.
     *
     * @param limit maximum number of entries
     */
    List<ConflictRecord> recentConflicts(int limit);

    /**
     * Releases the I/O threads. After close, no other methods should be called.
     */
    @Override
    void close();
}
