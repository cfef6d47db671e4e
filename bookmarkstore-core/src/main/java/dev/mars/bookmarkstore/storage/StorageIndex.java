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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory index of one storage root: bookmark id to bookmark, plus the load-error
 * and conflict logs accumulated while the root was loaded.
 * <p>
 * The index is a cache of the records directory and is rebuilt from disk on every
 * {@code initialize}. Only {@link FileBookmarkStorage} holds references to it.
 * <p>
 * <b>Thread Safety:</b> entries live in a {@link ConcurrentHashMap}, logs in
 * copy-on-write lists. Bookmarks are immutable, so handing them out is safe.
 */
final class StorageIndex {

    private static final Logger LOG = LoggerFactory.getLogger(StorageIndex.class);

    private static final Comparator<Bookmark> LISTING_ORDER = Comparator
            .comparing(Bookmark::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Bookmark::id);

    private final String rootName;
    private final Map<String, IndexEntry> entries = new ConcurrentHashMap<>();
    private final List<LoadError> loadErrors = new CopyOnWriteArrayList<>();
    private final List<ConflictRecord> conflicts = new CopyOnWriteArrayList<>();

    StorageIndex(String rootName) {
        this.rootName = rootName;
    }

    String rootName() {
        return rootName;
    }

    // ========================================================================
    // Load-time operations
    // ========================================================================

    /**
     * Adds a record decoded from {@code source} during load.
     * <p>
     * If the id is already indexed, {@link ConflictResolver} picks the survivor and a
     * {@link ConflictRecord} naming both files is logged.
     *
     * @return the entry now indexed for the id
     */
    IndexEntry absorb(Bookmark bookmark, Path source) {
        IndexEntry candidate = new IndexEntry(bookmark, source);
        IndexEntry existing = entries.get(bookmark.id());
        if (existing == null) {
            entries.put(bookmark.id(), candidate);
            return candidate;
        }

        IndexEntry winner = ConflictResolver.choose(existing, candidate);
        IndexEntry loser = winner == candidate ? existing : candidate;

        // the survivor remembers every losing file so later writes and purges can clear them
        List<Path> duplicates = new ArrayList<>(winner.duplicates());
        duplicates.addAll(loser.allSources());
        IndexEntry merged = new IndexEntry(winner.bookmark(), winner.source(), duplicates);
        entries.put(bookmark.id(), merged);

        ConflictRecord conflict = new ConflictRecord(rootName, bookmark.id(),
                winner.fileName(), loser.fileName(), Instant.now());
        conflicts.add(conflict);
        LOG.warn("{} (kept {})", conflict.describe(), winner.fileName());
        return merged;
    }

    void recordLoadError(LoadError error) {
        loadErrors.add(error);
    }

    // ========================================================================
    // Runtime operations
    // ========================================================================

    /**
     * The full entry for {@code id}, including duplicate files, or null.
     */
    IndexEntry entry(String id) {
        return entries.get(id);
    }

    Optional<Bookmark> get(String id) {
        IndexEntry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.bookmark());
    }

    /**
     * Bookmarks matching {@code filter}, oldest first (then by id).
     */
    List<Bookmark> list(BookmarkFilter filter) {
        return entries.values().stream()
                .map(IndexEntry::bookmark)
                .filter(filter::matches)
                .sorted(LISTING_ORDER)
                .toList();
    }

    /**
     * Replaces the entry for the bookmark's id. Call only after the file write succeeded.
     */
    void put(Bookmark bookmark, Path source) {
        put(bookmark, source, List.of());
    }

    /**
     * Replaces the entry, keeping {@code duplicates} as files still to be cleared.
     */
    void put(Bookmark bookmark, Path source, List<Path> duplicates) {
        entries.put(bookmark.id(), new IndexEntry(bookmark, source, duplicates));
    }

    boolean remove(String id) {
        return entries.remove(id) != null;
    }

    int size() {
        return entries.size();
    }

    StorageStats stats() {
        int total = 0;
        int deleted = 0;
        for (IndexEntry entry : entries.values()) {
            total++;
            if (entry.bookmark().deleted()) {
                deleted++;
            }
        }
        return new StorageStats(total, total - deleted, deleted, loadErrors.size(), conflicts.size());
    }

    List<LoadError> loadErrors() {
        return List.copyOf(loadErrors);
    }

    List<ConflictRecord> conflicts() {
        return List.copyOf(conflicts);
    }
}
