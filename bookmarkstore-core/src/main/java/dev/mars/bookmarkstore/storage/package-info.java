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
/**
 * Bookmark Storage Layer - one YAML file per record, indexed in memory per root.
 * <p>
 * This package provides the persistence layer for bookmarks:
 * <ul>
 *   <li>{@link dev.mars.bookmarkstore.storage.BookmarkStorage} - The storage interface</li>
 *   <li>{@link dev.mars.bookmarkstore.storage.FileBookmarkStorage} - File-based implementation</li>
 *   <li>{@link dev.mars.bookmarkstore.storage.BookmarkStorageConfig} - Tunables</li>
 *   <li>{@link dev.mars.bookmarkstore.storage.StorageRootsLoader} - Roots file reader</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Files are the truth:</b> the index is rebuilt from disk on every initialize</li>
 *   <li><b>Load tolerance:</b> one corrupt file never hides the others</li>
 *   <li><b>Read-your-writes:</b> the index is updated before a save completes</li>
 * </ul>
 *
 * @see dev.mars.bookmarkstore.storage.BookmarkStorage
 */
package dev.mars.bookmarkstore.storage;
