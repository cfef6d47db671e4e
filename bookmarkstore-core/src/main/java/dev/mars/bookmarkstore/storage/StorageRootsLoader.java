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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.mars.bookmarkstore.error.StorageException;
import dev.mars.bookmarkstore.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the list of storage roots from a YAML roots file:
 * <pre>
 * storage_locations:
 *   - name: work
 *     path: /home/me/bookmarks/work
 *     is_current: true
 *     is_default: false
 * </pre>
 * Relative paths resolve against the directory containing the roots file.
 * Unknown keys are ignored.
 */
public final class StorageRootsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(StorageRootsLoader.class);

    static final String ROOTS_KEY = "storage_locations";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StorageRootsLoader() {
    }

    /**
     * Loads storage roots from the given file.
     *
     * @param rootsFile YAML roots file
     * @return roots in file order
     * @throws StorageException    if the file is missing or unreadable
     * @throws ValidationException if the file is not valid YAML or an entry is invalid
     */
    public static List<StorageRoot> load(Path rootsFile) {
        Objects.requireNonNull(rootsFile, "rootsFile");
        if (!Files.isRegularFile(rootsFile)) {
            throw new StorageException("Roots file not found: " + rootsFile);
        }

        byte[] content;
        try {
            content = Files.readAllBytes(rootsFile);
        } catch (IOException e) {
            throw new StorageException("Failed to read roots file " + rootsFile, e);
        }

        JsonNode tree;
        try {
            tree = YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Roots file is not valid YAML: " + rootsFile, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read roots file " + rootsFile, e);
        }

        JsonNode entries = tree == null ? null : tree.get(ROOTS_KEY);
        if (entries == null || entries.isNull()) {
            LOG.warn("Roots file {} declares no {}", rootsFile, ROOTS_KEY);
            return List.of();
        }
        if (!entries.isArray()) {
            throw new ValidationException(ROOTS_KEY + " must be a list in " + rootsFile);
        }

        Path baseDir = rootsFile.toAbsolutePath().getParent();
        List<StorageRoot> roots = new ArrayList<>(entries.size());
        int position = 0;
        for (JsonNode entry : entries) {
            roots.add(parseEntry(entry, baseDir, position++));
        }
        LOG.debug("Read {} storage roots from {}", roots.size(), rootsFile);
        return List.copyOf(roots);
    }

    private static StorageRoot parseEntry(JsonNode entry, Path baseDir, int position) {
        if (!entry.isObject()) {
            throw new ValidationException("Storage root entry " + position + " is not a mapping");
        }
        String name = text(entry, "name", position);
        String rawPath = text(entry, "path", position);

        Path path = Path.of(rawPath);
        if (!path.isAbsolute()) {
            path = baseDir.resolve(path).normalize();
        }
        return new StorageRoot(name, path,
                entry.path("is_current").asBoolean(false),
                entry.path("is_default").asBoolean(false));
    }

    private static String text(JsonNode entry, String field, int position) {
        JsonNode value = entry.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new ValidationException("Storage root entry " + position + " is missing '" + field + "'");
        }
        return value.asText().strip();
    }
}
