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
 * A record file that could not be loaded into the index.
 *
 * @param rootName name of the root being loaded
 * @param fileName file name inside the records directory
 * @param kind     why the file was skipped
 * @param message  human-readable detail
 */
public record LoadError(String rootName, String fileName, Kind kind, String message) {

    /**
     * Why a file was skipped.
     */
    public enum Kind {
        /** Not a valid bookmark document. */
        MALFORMED,
        /** Valid document lacking a required field. */
        MISSING_FIELD,
        /** The file could not be read. */
        UNREADABLE,
        /** The file exceeds the configured maximum record size. */
        TOO_LARGE
    }

    public String describe() {
        return "[" + rootName + "] " + kind + " in " + fileName + ": " + message;
    }
}
