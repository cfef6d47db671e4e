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
package dev.mars.bookmarkstore.lifecycle;

import dev.mars.bookmarkstore.error.LifecycleException;
import dev.mars.bookmarkstore.error.NotFoundException;
import dev.mars.bookmarkstore.error.StorageException;
import dev.mars.bookmarkstore.model.Bookmark;
import dev.mars.bookmarkstore.storage.BookmarkFilter;
import dev.mars.bookmarkstore.storage.BookmarkStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Create/read/update and two-phase delete of bookmarks on top of a {@link BookmarkStorage}.
 * <p>
 * <b>States:</b>
 * <pre>
 * Active ──delete──► SoftDeleted ──purge──► Gone
 *    ▲                   │
 *    └──────restore──────┘
 * </pre>
 * A record can only be removed from disk after it has been soft-deleted.
 * <p>
 * <b>Errors:</b>
 * Mutating operations never throw. Unknown ids, policy violations and invalid edits
 * complete the returned future exceptionally and leave the record file untouched.
 * <p>
 * <b>Concurrency:</b>
 * Every state check runs inside {@link BookmarkStorage#update} or
 * {@link BookmarkStorage#hardDelete(String, String, java.util.function.Consumer)}, against
 * the version read under the record's file lock. Two racing deletes cannot both succeed,
 * and a purge cannot remove a record that a concurrent restore made active.
 * <p>
 * A {@code rootName} of {@code null} means "search every root" for existing records and
 * "the current root" for {@link #create(BookmarkDraft, String)}.
 */
public class BookmarkLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(BookmarkLifecycle.class);

    private final BookmarkStorage storage;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    /**
     * Creates a lifecycle using the UTC system clock and random UUID ids.
     */
    public BookmarkLifecycle(BookmarkStorage storage) {
        this(storage, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public BookmarkLifecycle(BookmarkStorage storage, Clock clock, Supplier<String> idGenerator) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    // ========================================================================
    // Create / Read
    // ========================================================================

    /**
     * Creates and persists a new bookmark with a fresh id.
     *
     * @param draft    user content
     * @param rootName target root, or null for the current root
     * @return future completing with the stored bookmark
     */
    public CompletableFuture<Bookmark> create(BookmarkDraft draft, String rootName) {
        Objects.requireNonNull(draft, "draft");
        Bookmark bookmark;
        try {
            String root = rootName != null
                    ? rootName
                    : storage.currentRootName().orElseThrow(
                            () -> new StorageException("No current storage root configured"));
            Instant now = clock.instant();
            bookmark = Bookmark.builder()
                    .id(idGenerator.get())
                    .url(draft.url())
                    .title(draft.title())
                    .keywords(draft.keywords())
                    .tags(draft.tags())
                    .description(draft.description())
                    .folderPath(draft.folderPath())
                    .faviconPath(draft.faviconPath())
                    .screenshotPath(draft.screenshotPath())
                    .createdAt(now)
                    .lastModified(now)
                    .storageRoot(root)
                    .build();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return storage.save(bookmark, bookmark.storageRoot())
                .thenApply(saved -> {
                    LOG.info("Created bookmark {} in {}", saved.id(), saved.storageRoot());
                    return saved;
                });
    }

    /**
     * Returns a bookmark.
     *
     * @throws NotFoundException if no root holds the id
     */
    public Bookmark get(String id, String rootName) {
        return storage.get(id, rootName).orElseThrow(() -> new NotFoundException(id));
    }

    public List<Bookmark> list(String rootName, BookmarkFilter filter) {
        return storage.list(rootName, filter);
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    /**
     * Applies a partial edit and stamps {@code lastModified}.
     */
    public CompletableFuture<Bookmark> update(String id, String rootName, BookmarkUpdate update) {
        Objects.requireNonNull(update, "update");
        return transition(id, rootName, current -> {
            Bookmark.Builder edited = update.applyTo(current.toBuilder());
            return edited.lastModified(clock.instant()).build();
        });
    }

    /**
     * Soft-deletes an active bookmark.
     */
    public CompletableFuture<Bookmark> delete(String id, String rootName) {
        return transition(id, rootName, current -> {
            if (current.deleted()) {
                throw LifecycleException.alreadyDeleted(id);
            }
            return current.toBuilder()
                    .deleted(true)
                    .deletedAt(clock.instant())
                    .build();
        }).thenApply(deleted -> {
            LOG.info("Soft deleted bookmark {} in {}", id, deleted.storageRoot());
            return deleted;
        });
    }

    /**
     * Brings a soft-deleted bookmark back to the active state.
     */
    public CompletableFuture<Bookmark> restore(String id, String rootName) {
        return transition(id, rootName, current -> {
            if (!current.deleted()) {
                throw LifecycleException.notDeleted(id);
            }
            return current.toBuilder()
                    .deleted(false)
                    .deletedAt(null)
                    .build();
        }).thenApply(restored -> {
            LOG.info("Restored bookmark {} in {}", id, restored.storageRoot());
            return restored;
        });
    }

    /**
     * Permanently removes a soft-deleted bookmark from disk and index.
     * The soft-deleted check runs under the record's file lock, so a concurrent restore
     * either lands first and blocks the purge, or finds the record gone.
     */
    public CompletableFuture<Void> purge(String id, String rootName) {
        Bookmark current;
        try {
            current = get(id, rootName);
        } catch (NotFoundException e) {
            return CompletableFuture.failedFuture(e);
        }
        return storage.hardDelete(id, current.storageRoot(), latest -> {
                    if (!latest.deleted()) {
                        LOG.warn("Refusing to purge active bookmark {}", id);
                        throw LifecycleException.safetyViolation(id);
                    }
                })
                .thenRun(() -> LOG.info("Purged bookmark {} from {}", id, current.storageRoot()));
    }

    /**
     * Stamps {@code lastAccessed} without touching {@code lastModified}.
     */
    public CompletableFuture<Bookmark> trackAccess(String id, String rootName) {
        return transition(id, rootName, current -> current.toBuilder()
                .lastAccessed(clock.instant())
                .build());
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Locates the record's root, then lets storage re-read and change it under the file
     * lock. Policy checks inside {@code change} therefore always see the latest version.
     */
    private CompletableFuture<Bookmark> transition(String id, String rootName, UnaryOperator<Bookmark> change) {
        Bookmark located;
        try {
            located = get(id, rootName);
        } catch (NotFoundException e) {
            return CompletableFuture.failedFuture(e);
        }
        return storage.update(id, located.storageRoot(), latest -> {
            try {
                return change.apply(latest);
            } catch (RuntimeException e) {
                LOG.debug("Rejected change to bookmark {}: {}", id, e.getMessage());
                throw e;
            }
        });
    }
}
