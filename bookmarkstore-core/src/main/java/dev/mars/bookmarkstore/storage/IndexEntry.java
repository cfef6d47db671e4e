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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * An indexed bookmark together with the file it was read from or written to.
 * <p>
 * {@code duplicates} lists the other files in the same root that carry this id and lost
 * the load-time conflict. They stay on disk until the record is next written or purged.
 */
record IndexEntry(Bookmark bookmark, Path source, List<Path> duplicates) {

    IndexEntry {
        duplicates = List.copyOf(duplicates);
    }

    IndexEntry(Bookmark bookmark, Path source) {
        this(bookmark, source, List.of());
    }

    String fileName() {
        return source.getFileName().toString();
    }

    /** The source file followed by every duplicate. */
    List<Path> allSources() {
        List<Path> all = new ArrayList<>(duplicates.size() + 1);
        all.add(source);
        all.addAll(duplicates);
        return all;
    }
}
