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

import java.time.Instant;

/**
 * Two record files of one root that decoded to the same bookmark id.
 *
 * @param rootName      root in which the conflict was found
 * @param bookmarkId    the duplicated id
 * @param keptFile      file whose record won and is now indexed
 * @param discardedFile file whose record was discarded
 * @param detectedAt    when the conflict was resolved
 */
public record ConflictRecord(String rootName, String bookmarkId, String keptFile, String discardedFile,
                             Instant detectedAt) {

    public String describe() {
        return "[" + rootName + "] Conflict for bookmark ID " + bookmarkId + ": "
                + keptFile + " vs " + discardedFile;
    }
}
