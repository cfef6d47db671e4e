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

import dev.mars.bookmarkstore.error.ValidationException;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * A configured storage location (e.g. "work", "personal").
 *
 * @param name        display name, letters, digits, dash and underscore only
 * @param path        root directory
 * @param current     whether this is the currently active root
 * @param defaultRoot whether this is the default root for new bookmarks
 */
public record StorageRoot(String name, Path path, boolean current, boolean defaultRoot) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

    public StorageRoot {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("Storage name cannot be empty");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException(
                    "Storage name must contain only letters, numbers, dashes, and underscores: " + name);
        }
        if (path == null) {
            throw new ValidationException("Storage path cannot be empty for root " + name);
        }
    }

    /** Creates a root that is neither current nor default. */
    public static StorageRoot of(String name, Path path) {
        return new StorageRoot(name, path, false, false);
    }
}
