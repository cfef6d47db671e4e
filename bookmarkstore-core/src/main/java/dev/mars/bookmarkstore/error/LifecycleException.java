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
package dev.mars.bookmarkstore.error;

/**
 * Policy violation of the bookmark lifecycle.
 * <p>
 * Kind is one of {@link ErrorKind#ALREADY_DELETED}, {@link ErrorKind#NOT_DELETED}
 * or {@link ErrorKind#SAFETY_VIOLATION}.
 */
public class LifecycleException extends BookmarkStoreException {

    private final String bookmarkId;

    private LifecycleException(ErrorKind kind, String bookmarkId, String message) {
        super(kind, message);
        this.bookmarkId = bookmarkId;
    }

    public static LifecycleException alreadyDeleted(String bookmarkId) {
        return new LifecycleException(ErrorKind.ALREADY_DELETED, bookmarkId,
                "Bookmark " + bookmarkId + " is already deleted");
    }

    public static LifecycleException notDeleted(String bookmarkId) {
        return new LifecycleException(ErrorKind.NOT_DELETED, bookmarkId,
                "Bookmark " + bookmarkId + " is not deleted");
    }

    public static LifecycleException safetyViolation(String bookmarkId) {
        return new LifecycleException(ErrorKind.SAFETY_VIOLATION, bookmarkId,
                "Bookmark " + bookmarkId + " must be soft-deleted before it can be purged");
    }

    public String bookmarkId() {
        return bookmarkId;
    }
}
