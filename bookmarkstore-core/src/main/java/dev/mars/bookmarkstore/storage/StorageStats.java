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

/**
 * Aggregate counters of one root's index.
 *
 * @param total         indexed bookmarks
 * @param active        bookmarks not soft-deleted
 * @param deleted       soft-deleted bookmarks
 * @param errorCount    files skipped at load time
 * @param conflictCount duplicate-id conflicts resolved at load time
 */
public record StorageStats(int total, int active, int deleted, int errorCount, int conflictCount) {
}
