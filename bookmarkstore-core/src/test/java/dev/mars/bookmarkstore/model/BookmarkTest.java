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
package dev.mars.bookmarkstore.model;

import dev.mars.bookmarkstore.error.ErrorKind;
import dev.mars.bookmarkstore.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the invariants enforced by {@link Bookmark}'s canonical constructor.
 */
class BookmarkTest {

    private static Bookmark.Builder valid() {
        return Bookmark.builder()
                .id("b1")
                .url("https://example.com")
                .title("Example")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .storageRoot("work");
    }

    @Test
    @DisplayName("Minimal bookmark gets empty lists and is active")
    void testMinimalBookmark() {
        Bookmark b = valid().keywords(null).tags(null).build();

        assertEquals(List.of(), b.keywords());
        assertEquals(List.of(), b.tags());
        assertFalse(b.deleted());
        assertNull(b.deletedAt());
    }

    // ========================================================================
    // Title / URL
    // ========================================================================

    @Nested
    @DisplayName("Title and URL")
    class TitleAndUrlTests {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        @DisplayName("Blank titles are rejected")
        void testBlankTitle(String title) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> valid().title(title).build());
            assertEquals(ErrorKind.VALIDATION, e.kind());
        }

        @Test
        @DisplayName("Title is stripped")
        void testTitleStripped() {
            assertEquals("Docs", valid().title("  Docs \n").build().title());
        }

        @Test
        @DisplayName("Title over 500 characters is rejected")
        void testTitleTooLong() {
            assertThrows(ValidationException.class, () -> valid().title("x".repeat(501)).build());
            assertEquals(500, valid().title("x".repeat(500)).build().title().length());
        }

        @ParameterizedTest
        @ValueSource(strings = {"ftp://example.com", "example.com", "https://", "not a url", "javascript:alert(1)"})
        @DisplayName("Non http(s) or hostless URLs are rejected")
        void testBadUrls(String url) {
            assertThrows(ValidationException.class, () -> valid().url(url).build());
        }

        @Test
        @DisplayName("URL scheme check is case-insensitive")
        void testUppercaseScheme() {
            assertEquals("HTTPS://example.com/a", valid().url(" HTTPS://example.com/a ").build().url());
        }
    }

    // ========================================================================
    // Keywords / Tags
    // ========================================================================

    @Nested
    @DisplayName("Keywords and tags")
    class KeywordTests {

        @Test
        @DisplayName("Four keywords are accepted, five are rejected")
        void testKeywordLimit() {
            assertEquals(4, valid().keywords(List.of("a", "b", "c", "d")).build().keywords().size());
            assertThrows(ValidationException.class,
                    () -> valid().keywords(List.of("a", "b", "c", "d", "e")).build());
        }

        @Test
        @DisplayName("Blank keywords are dropped and order is kept")
        void testBlankKeywordsDropped() {
            Bookmark b = valid().keywords(Arrays.asList("java", " ", null, " spring ")).build();
            assertEquals(List.of("java", "spring"), b.keywords());
        }

        @Test
        @DisplayName("Keyword list is immutable")
        void testKeywordsImmutable() {
            Bookmark b = valid().keywords(List.of("java")).build();
            assertThrows(UnsupportedOperationException.class, () -> b.keywords().add("x"));
        }
    }

    // ========================================================================
    // Folder path / Id
    // ========================================================================

    @Nested
    @DisplayName("Path safety")
    class PathSafetyTests {

        @ParameterizedTest
        @ValueSource(strings = {"../etc", "a/../b", "/abs", "\\server", " /padded"})
        @DisplayName("Traversal folder paths are rejected")
        void testTraversalRejected(String folder) {
            assertThrows(ValidationException.class, () -> valid().folderPath(folder).build());
        }

        @Test
        @DisplayName("Relative folder path is kept, blank becomes null")
        void testFolderNormalised() {
            assertEquals("development/java", valid().folderPath(" development/java ").build().folderPath());
            assertNull(valid().folderPath("  ").build().folderPath());
        }

        @ParameterizedTest
        @ValueSource(strings = {"../x", "a/b", ".hidden", "a b"})
        @DisplayName("Ids that are not safe file names are rejected")
        void testUnsafeIds(String id) {
            assertThrows(ValidationException.class, () -> valid().id(id).build());
        }

        @Test
        @DisplayName("UUID ids are accepted")
        void testUuidId() {
            String id = "3f2b8c1e-0d7a-4e0b-9a55-2d1f0c4b7e11";
            assertEquals(id, valid().id(id).build().id());
        }
    }

    // ========================================================================
    // Deletion state
    // ========================================================================

    @Nested
    @DisplayName("Deletion state")
    class DeletionStateTests {

        @Test
        @DisplayName("deleted without deletedAt is rejected")
        void testDeletedWithoutTimestamp() {
            assertThrows(ValidationException.class, () -> valid().deleted(true).build());
        }

        @Test
        @DisplayName("deletedAt without deleted is rejected")
        void testTimestampWithoutDeleted() {
            assertThrows(ValidationException.class, () -> valid().deletedAt(Instant.now()).build());
        }

        @Test
        @DisplayName("toBuilder round trip keeps every field")
        void testToBuilderCopy() {
            Bookmark original = valid()
                    .deleted(true)
                    .deletedAt(Instant.parse("2024-02-01T00:00:00Z"))
                    .description("notes")
                    .faviconPath("favicons/b1.png")
                    .build();
            assertEquals(original, original.toBuilder().build());
        }
    }

    @Test
    @DisplayName("Missing storage root is rejected")
    void testMissingStorageRoot() {
        assertThrows(ValidationException.class, () -> valid().storageRoot(" ").build());
    }

    @Test
    @DisplayName("Description over 5000 characters is rejected")
    void testDescriptionLimit() {
        assertThrows(ValidationException.class, () -> valid().description("d".repeat(5001)).build());
    }
}
