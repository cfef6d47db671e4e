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
 * Closed set of failure kinds raised by the bookmark store.
 * <p>
 * Every {@link BookmarkStoreException} carries exactly one kind, so callers can
 * branch on {@code kind()} without an {@code instanceof} ladder.
 */
public enum ErrorKind {

    /** Input rejected before any disk access (empty title, traversal in folder path, ...). */
    VALIDATION,

    /** Root inaccessible, encode failure or unexpected I/O during save/delete. */
    STORAGE,

    /** The sidecar lock for a record file could not be acquired in time. */
    LOCK_TIMEOUT,

    /** The requested identifier is absent from the addressed root(s). */
    NOT_FOUND,

    /** Soft delete requested on a record that is already soft-deleted. */
    ALREADY_DELETED,

    /** Restore requested on a record that is not soft-deleted. */
    NOT_DELETED,

    /** Purge requested on a record that was never soft-deleted. */
    SAFETY_VIOLATION
}
