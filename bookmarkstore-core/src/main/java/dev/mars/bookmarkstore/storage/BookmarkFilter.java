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

import java.util.Objects;
import java.util.Optional;

/**
 * Filter applied when listing bookmarks.
 *
 * @param includeDeleted whether soft-deleted bookmarks are returned
 * @param folderPath     exact folder to match (empty = any folder)
 */
public record BookmarkFilter(boolean includeDeleted, Optional<String> folderPath) {

    private static final BookmarkFilter ACTIVE_ONLY = new BookmarkFilter(false, Optional.empty());
    private static final BookmarkFilter ALL = new BookmarkFilter(true, Optional.empty());

    public BookmarkFilter {
        folderPath = Objects.requireNonNullElse(folderPath, Optional.empty());
    }

    /** Active bookmarks in any folder. */
    public static BookmarkFilter activeOnly() {
        return ACTIVE_ONLY;
    }

    /** Every bookmark, soft-deleted included. */
    public static BookmarkFilter all() {
        return ALL;
    }

    /** Active bookmarks whose folder path equals {@code folderPath}. */
    public static BookmarkFilter inFolder(String folderPath) {
        return new BookmarkFilter(false, Optional.of(folderPath));
    }

    /** Returns a copy that also matches soft-deleted bookmarks. */
    public BookmarkFilter withDeleted() {
        return new BookmarkFilter(true, folderPath);
    }

    public boolean matches(Bookmark bookmark) {
        if (!includeDeleted && bookmark.deleted()) {
            return false;
        }
        return folderPath.map(folder -> folder.equals(bookmark.folderPath())).orElse(true);
    }
}
