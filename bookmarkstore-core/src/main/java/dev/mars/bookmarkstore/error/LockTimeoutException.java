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

import java.nio.file.Path;
import java.time.Duration;

/**
 * Thrown when a sidecar lock is still held by someone else after the timeout elapsed.
 */
public class LockTimeoutException extends StorageException {

    private final Path target;

    public LockTimeoutException(Path target, Duration timeout) {
        super(ErrorKind.LOCK_TIMEOUT,
                "Could not acquire lock on " + target + " after " + timeout.toMillis() + " ms");
        this.target = target;
    }

    /** The file whose lock could not be acquired. */
    public Path target() {
        return target;
    }
}
