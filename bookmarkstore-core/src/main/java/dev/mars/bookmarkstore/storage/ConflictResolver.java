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

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;

/**
 * Picks the surviving record when two files of one root carry the same bookmark id.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Each candidate gets its best available timestamp: {@code lastModified}, else
 *       {@code createdAt}, else the source file's modification time, else {@link Instant#MIN}</li>
 *   <li>The later timestamp wins</li>
 *   <li>On equal timestamps the lexicographically smaller file name wins, so the outcome
 *       never depends on the order in which files were enumerated</li>
 * </ol>
 */
final class ConflictResolver {

    private ConflictResolver() {
    }

    /**
     * Returns whichever of the two entries should stay in the index.
     */
    static IndexEntry choose(IndexEntry existing, IndexEntry candidate) {
        int byTime = bestTimestamp(candidate).compareTo(bestTimestamp(existing));
        if (byTime != 0) {
            return byTime > 0 ? candidate : existing;
        }
        return candidate.fileName().compareTo(existing.fileName()) < 0 ? candidate : existing;
    }

    /**
     * Best available timestamp of an entry, never null.
     */
    static Instant bestTimestamp(IndexEntry entry) {
        Bookmark bookmark = entry.bookmark();
        if (bookmark.lastModified() != null) {
            return bookmark.lastModified();
        }
        if (bookmark.createdAt() != null) {
            return bookmark.createdAt();
        }
        try {
            return Files.getLastModifiedTime(entry.source()).toInstant();
        } catch (IOException e) {
            return Instant.MIN;
        }
    }
}
