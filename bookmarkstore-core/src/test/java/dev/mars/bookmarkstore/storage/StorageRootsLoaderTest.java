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

import dev.mars.bookmarkstore.error.StorageException;
import dev.mars.bookmarkstore.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading storage roots from a YAML roots file.
 */
class StorageRootsLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws Exception {
        return Files.writeString(tempDir.resolve("config.yaml"), yaml);
    }

    @Test
    @DisplayName("Roots are read in order with their flags")
    void testLoadRoots() throws Exception {
        Path absolute = tempDir.resolve("elsewhere").toAbsolutePath();
        Path file = write("""
                storage_locations:
                  - name: work
                    path: %s
                    is_current: true
                  - name: personal
                    path: personal
                    is_default: true
                    color: blue
                app_version: 2
                """.formatted(absolute));

        List<StorageRoot> roots = StorageRootsLoader.load(file);

        assertEquals(2, roots.size());
        assertEquals(new StorageRoot("work", absolute, true, false), roots.get(0));
        assertEquals("personal", roots.get(1).name());
        assertTrue(roots.get(1).defaultRoot());
        assertFalse(roots.get(1).current());
    }

    @Test
    @DisplayName("Relative paths resolve against the roots file directory")
    void testRelativePath() throws Exception {
        Path file = write("""
                storage_locations:
                  - name: personal
                    path: data/../personal
                """);

        StorageRoot root = StorageRootsLoader.load(file).get(0);
        assertEquals(tempDir.toAbsolutePath().resolve("personal"), root.path());
    }

    @Test
    @DisplayName("File without a roots list yields no roots")
    void testNoRoots() throws Exception {
        assertEquals(List.of(), StorageRootsLoader.load(write("app_version: 2\n")));
    }

    @Test
    @DisplayName("Missing file is a storage error")
    void testMissingFile() {
        assertThrows(StorageException.class, () -> StorageRootsLoader.load(tempDir.resolve("nope.yaml")));
    }

    @Test
    @DisplayName("Unparseable YAML is a validation error")
    void testBadYaml() throws Exception {
        Path file = write("storage_locations: [ {name: work, path: \n");
        assertThrows(ValidationException.class, () -> StorageRootsLoader.load(file));
    }

    @Test
    @DisplayName("Entry without a path is a validation error")
    void testMissingPath() throws Exception {
        Path file = write("""
                storage_locations:
                  - name: work
                """);
        ValidationException e = assertThrows(ValidationException.class, () -> StorageRootsLoader.load(file));
        assertTrue(e.getMessage().contains("path"));
    }

    @Test
    @DisplayName("Invalid root name is a validation error")
    void testBadName() throws Exception {
        Path file = write("""
                storage_locations:
                  - name: my work
                    path: work
                """);
        assertThrows(ValidationException.class, () -> StorageRootsLoader.load(file));
    }

    @Test
    @DisplayName("Non-list roots value is a validation error")
    void testNotAList() throws Exception {
        Path file = write("storage_locations: work\n");
        assertThrows(ValidationException.class, () -> StorageRootsLoader.load(file));
    }
}
