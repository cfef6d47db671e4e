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

import dev.mars.bookmarkstore.codec.BookmarkCodec;
import dev.mars.bookmarkstore.error.BookmarkStoreException;
import dev.mars.bookmarkstore.error.ErrorKind;
import dev.mars.bookmarkstore.error.LockTimeoutException;
import dev.mars.bookmarkstore.error.NotFoundException;
import dev.mars.bookmarkstore.error.StorageException;
import dev.mars.bookmarkstore.error.ValidationException;
import dev.mars.bookmarkstore.lock.SidecarLock;
import dev.mars.bookmarkstore.model.Bookmark;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileBookmarkStorage.
 * <p>
 * Verifies:
 * <ul>
 *   <li>Root validation and directory layout</li>
 *   <li>Load completeness with corrupt and oversized files</li>
 *   <li>Duplicate-id conflict resolution on load</li>
 *   <li>Atomic save, read-your-writes and concurrent writers</li>
 *   <li>Lock timeouts leave disk and index untouched</li>
 *   <li>Hard delete idempotence</li>
 *   <li>Locked read-modify-write and guarded delete</li>
 *   <li>Losing duplicate files are cleared by the next write or purge</li>
 * </ul>
 */
class FileBookmarkStorageTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private FileBookmarkStorage storage;
    private Path workDir;

    @BeforeEach
    void setUp() throws Exception {
        workDir = Files.createDirectories(tempDir.resolve("work"));
        storage = new FileBookmarkStorage(testConfig().build());
    }

    @AfterEach
    void tearDown() {
        if (storage != null) {
            storage.close();
        }
    }

    private static BookmarkStorageConfig.Builder testConfig() {
        return BookmarkStorageConfig.builder()
                .lockTimeoutMs(300)
                .lockPollIntervalMs(10)
                .syncEnabled(false)
                .ioThreads(4);
    }

    private static Bookmark bookmark(String id, String root) {
        return Bookmark.builder()
                .id(id)
                .url("https://example.com/" + id)
                .title("Bookmark " + id)
                .createdAt(T0)
                .storageRoot(root)
                .build();
    }

    private void init(StorageRoot... roots) throws Exception {
        storage.initialize(List.of(roots)).get(5, TimeUnit.SECONDS);
    }

    private void writeRecordFile(Path rootDir, String fileName, Bookmark b) throws Exception {
        Path dir = Files.createDirectories(rootDir.resolve(FileBookmarkStorage.RECORDS_DIR));
        Files.write(dir.resolve(fileName), new BookmarkCodec().encode(b));
    }

    private void writeRawFile(Path rootDir, String fileName, String content) throws Exception {
        Path dir = Files.createDirectories(rootDir.resolve(FileBookmarkStorage.RECORDS_DIR));
        Files.writeString(dir.resolve(fileName), content);
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    // ========================================================================
    // Initialize Tests
    // ========================================================================

    @Nested
    @DisplayName("Initialize")
    class InitializeTests {

        @Test
        @DisplayName("Creates bookmarks, favicons and screenshots directories")
        void testCreatesLayout() throws Exception {
            init(new StorageRoot("work", workDir, true, false));

            assertTrue(Files.isDirectory(workDir.resolve("bookmarks")));
            assertTrue(Files.isDirectory(workDir.resolve("favicons")));
            assertTrue(Files.isDirectory(workDir.resolve("screenshots")));
            assertFalse(Files.exists(workDir.resolve(".bookmarkstore_probe")));
            assertEquals(List.of("work"), storage.rootNames());
        }

        @Test
        @DisplayName("Missing root directory fails with StorageException")
        void testMissingRoot() {
            Throwable cause = causeOf(storage.initialize(
                    List.of(StorageRoot.of("ghost", tempDir.resolve("does-not-exist")))));
            assertInstanceOf(StorageException.class, cause);
        }

        @Test
        @DisplayName("Root that is a file fails with StorageException")
        void testRootIsFile() throws Exception {
            Path file = Files.writeString(tempDir.resolve("plain.txt"), "x");
            Throwable cause = causeOf(storage.initialize(List.of(StorageRoot.of("plain", file))));
            assertInstanceOf(StorageException.class, cause);
        }

        @Test
        @DisplayName("Duplicate root names fail with ValidationException")
        void testDuplicateNames() throws Exception {
            Path other = Files.createDirectories(tempDir.resolve("other"));
            Throwable cause = causeOf(storage.initialize(
                    List.of(StorageRoot.of("work", workDir), StorageRoot.of("work", other))));
            assertInstanceOf(ValidationException.class, cause);
        }

        @Test
        @DisplayName("Failed re-initialize keeps the previous roots and index")
        void testFailedReinitKeepsState() throws Exception {
            init(StorageRoot.of("work", workDir));
            storage.save(bookmark("keep", "work"), "work").get(5, TimeUnit.SECONDS);

            causeOf(storage.initialize(List.of(
                    StorageRoot.of("work", workDir),
                    StorageRoot.of("ghost", tempDir.resolve("missing")))));

            assertEquals(List.of("work"), storage.rootNames());
            assertTrue(storage.get("keep", "work").isPresent());
        }

        @Test
        @DisplayName("Current root is the flagged one, else the first")
        void testCurrentRoot() throws Exception {
            Path personal = Files.createDirectories(tempDir.resolve("personal"));
            init(StorageRoot.of("work", workDir), new StorageRoot("personal", personal, true, false));
            assertEquals("personal", storage.currentRootName().orElseThrow());

            init(StorageRoot.of("work", workDir), StorageRoot.of("personal", personal));
            assertEquals("work", storage.currentRootName().orElseThrow());
            assertEquals("work", storage.defaultRootName().orElseThrow());
        }

        @Test
        @DisplayName("No roots means no current root")
        void testNoRoots() throws Exception {
            init();
            assertTrue(storage.currentRootName().isEmpty());
            assertTrue(storage.defaultRootName().isEmpty());
        }
    }

    // ========================================================================
    // Load Tests
    // ========================================================================

    @Nested
    @DisplayName("Load")
    class LoadTests {

        @Test
        @DisplayName("k valid files and m corrupt files give k records and m errors")
        void testLoadCompleteness() throws Exception {
            for (int i = 0; i < 5; i++) {
                writeRecordFile(workDir, "b" + i + ".yaml", bookmark("b" + i, "work"));
            }
            writeRawFile(workDir, "broken.yaml", "id: [unterminated\n");
            writeRawFile(workDir, "empty.yaml", "");
            writeRawFile(workDir, "partial.yaml", "id: p1\ntitle: no url\n");
            writeRawFile(workDir, "notes.txt", "ignored, wrong extension");

            init(StorageRoot.of("work", workDir));

            assertEquals(5, storage.list("work", BookmarkFilter.all()).size());
            List<LoadError> errors = storage.loadErrors("work");
            assertEquals(3, errors.size());
            assertTrue(errors.stream().anyMatch(e -> e.fileName().equals("partial.yaml")
                    && e.kind() == LoadError.Kind.MISSING_FIELD));
            assertTrue(errors.stream().anyMatch(e -> e.fileName().equals("broken.yaml")
                    && e.kind() == LoadError.Kind.MALFORMED));

            StorageStats stats = storage.stats("work");
            assertEquals(5, stats.total());
            assertEquals(3, stats.errorCount());
        }

        @Test
        @DisplayName("Oversized file is reported as TOO_LARGE")
        void testTooLarge() throws Exception {
            storage.close();
            storage = new FileBookmarkStorage(testConfig().maxRecordSizeKb(1).build());
            writeRawFile(workDir, "huge.yaml", "description: " + "x".repeat(2048) + "\n");
            writeRecordFile(workDir, "ok.yaml", bookmark("ok", "work"));

            init(StorageRoot.of("work", workDir));

            assertEquals(1, storage.stats("work").total());
            assertEquals(LoadError.Kind.TOO_LARGE, storage.loadErrors("work").get(0).kind());
        }

        @Test
        @DisplayName("Duplicate id keeps the newer record and logs one conflict")
        void testDuplicateIdConflict() throws Exception {
            Bookmark older = bookmark("dup", "work").toBuilder().title("older").lastModified(T0).build();
            Bookmark newer = bookmark("dup", "work").toBuilder().title("newer").lastModified(T1).build();
            writeRecordFile(workDir, "a-copy.yaml", older);
            writeRecordFile(workDir, "dup.yaml", newer);

            init(StorageRoot.of("work", workDir));

            assertEquals("newer", storage.get("dup", "work").orElseThrow().title());
            List<ConflictRecord> conflicts = storage.recentConflicts(10);
            assertEquals(1, conflicts.size());
            assertEquals("dup.yaml", conflicts.get(0).keptFile());
            assertEquals("a-copy.yaml", conflicts.get(0).discardedFile());
        }

        @Test
        @DisplayName("Record naming another root is re-homed to the root it was loaded from")
        void testRehoming() throws Exception {
            writeRecordFile(workDir, "moved.yaml", bookmark("moved", "elsewhere"));

            init(StorageRoot.of("work", workDir));

            assertEquals("work", storage.get("moved", "work").orElseThrow().storageRoot());
        }

        @Test
        @DisplayName("Legacy file without created_at loads and lists first")
        void testLegacyRecord() throws Exception {
            writeRawFile(workDir, "legacy.yaml", """
                    id: legacy
                    url: https://example.com/old
                    title: Old one
                    storage_location: work
                    """);
            writeRecordFile(workDir, "new.yaml", bookmark("new", "work"));

            init(StorageRoot.of("work", workDir));

            List<Bookmark> all = storage.list("work", BookmarkFilter.all());
            assertEquals("legacy", all.get(0).id());
            assertNull(all.get(0).createdAt());
        }
    }

    // ========================================================================
    // Save Tests
    // ========================================================================

    @Nested
    @DisplayName("Save")
    class SaveTests {

        @BeforeEach
        void initWork() throws Exception {
            init(StorageRoot.of("work", workDir));
        }

        @Test
        @DisplayName("Save writes the file and is visible immediately")
        void testReadYourWrites() throws Exception {
            Bookmark b = bookmark("b1", "work");
            assertEquals(b, storage.save(b, "work").get(5, TimeUnit.SECONDS));

            Path file = workDir.resolve("bookmarks/b1.yaml");
            assertTrue(Files.exists(file));
            assertFalse(Files.exists(workDir.resolve("bookmarks/b1.yaml.tmp")));
            assertFalse(Files.exists(SidecarLock.markerFor(file)));
            assertEquals(b, storage.get("b1", "work").orElseThrow());
            assertEquals(b, storage.get("b1", null).orElseThrow());
        }

        @Test
        @DisplayName("Saved records survive a restart")
        void testReload() throws Exception {
            Bookmark b = bookmark("b1", "work").toBuilder().keywords(List.of("java")).build();
            storage.save(b, "work").get(5, TimeUnit.SECONDS);
            storage.close();

            storage = new FileBookmarkStorage(testConfig().build());
            init(StorageRoot.of("work", workDir));
            assertEquals(b, storage.get("b1", "work").orElseThrow());
        }

        @Test
        @DisplayName("Save to unknown root fails with StorageException")
        void testUnknownRoot() {
            Throwable cause = causeOf(storage.save(bookmark("b1", "nope"), "nope"));
            assertInstanceOf(StorageException.class, cause);
        }

        @Test
        @DisplayName("Save to a root other than the record's own is rejected")
        void testRootMismatch() throws Exception {
            Path personal = Files.createDirectories(tempDir.resolve("personal"));
            init(StorageRoot.of("work", workDir), StorageRoot.of("personal", personal));

            Throwable cause = causeOf(storage.save(bookmark("b1", "work"), "personal"));
            assertEquals(ErrorKind.VALIDATION, ((BookmarkStoreException) cause).kind());
            assertTrue(storage.get("b1", null).isEmpty());
        }

        @Test
        @DisplayName("Held lock makes save time out and leaves disk and index untouched")
        void testLockTimeout() throws Exception {
            Bookmark original = bookmark("b1", "work");
            storage.save(original, "work").get(5, TimeUnit.SECONDS);
            Path file = workDir.resolve("bookmarks/b1.yaml");
            byte[] before = Files.readAllBytes(file);

            try (SidecarLock held = SidecarLock.acquire(file, java.time.Duration.ofSeconds(5))) {
                Bookmark edited = original.toBuilder().title("edited").build();
                Throwable cause = causeOf(storage.save(edited, "work"));
                assertInstanceOf(LockTimeoutException.class, cause);
            }

            assertArrayEquals(before, Files.readAllBytes(file));
            assertEquals("Bookmark b1", storage.get("b1", "work").orElseThrow().title());
        }

        @Test
        @DisplayName("Stale lock left by a crashed writer is reclaimed")
        void testStaleLockReclaimed() throws Exception {
            Path marker = SidecarLock.markerFor(workDir.resolve("bookmarks/b1.yaml"));
            Files.createFile(marker);
            Files.setLastModifiedTime(marker, FileTime.from(Instant.now().minusSeconds(60)));

            storage.save(bookmark("b1", "work"), "work").get(5, TimeUnit.SECONDS);
            assertTrue(storage.get("b1", "work").isPresent());
            assertFalse(Files.exists(marker));
        }

        @Test
        @DisplayName("Concurrent saves of one id leave exactly one consistent file")
        void testConcurrentSameId() throws Exception {
            storage.close();
            storage = new FileBookmarkStorage(testConfig().lockTimeoutMs(5000).build());
            init(StorageRoot.of("work", workDir));

            List<CompletableFuture<Bookmark>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                Bookmark b = bookmark("same", "work").toBuilder().title("writer " + i).build();
                futures.add(storage.save(b, "work"));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

            Bookmark onDisk = new BookmarkCodec().decode(
                    Files.readAllBytes(workDir.resolve("bookmarks/same.yaml")));
            assertTrue(onDisk.title().startsWith("writer "));
            assertEquals(onDisk, storage.get("same", "work").orElseThrow());

            try (Stream<Path> files = Files.list(workDir.resolve("bookmarks"))) {
                assertEquals(List.of("same.yaml"),
                        files.map(p -> p.getFileName().toString()).toList());
            }
        }

        @Test
        @DisplayName("Concurrent saves of different ids all land")
        void testConcurrentDifferentIds() throws Exception {
            List<CompletableFuture<Bookmark>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(storage.save(bookmark("id" + i, "work"), "work"));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

            assertEquals(20, storage.stats("work").total());
        }

        @Test
        @DisplayName("Record over the size limit is rejected before touching disk")
        void testOversizedSave() throws Exception {
            storage.close();
            storage = new FileBookmarkStorage(testConfig().maxRecordSizeKb(1).build());
            init(StorageRoot.of("work", workDir));

            Bookmark big = bookmark("big", "work").toBuilder().description("d".repeat(4000)).build();
            assertInstanceOf(StorageException.class, causeOf(storage.save(big, "work")));
            assertFalse(Files.exists(workDir.resolve("bookmarks/big.yaml")));
            assertTrue(storage.get("big", "work").isEmpty());
        }

        @Test
        @DisplayName("Save after close fails")
        void testSaveAfterClose() {
            storage.close();
            storage.close();
            assertInstanceOf(StorageException.class, causeOf(storage.save(bookmark("b1", "work"), "work")));
        }
    }

    // ========================================================================
    // Query and Delete Tests
    // ========================================================================

    @Nested
    @DisplayName("Queries and hard delete")
    class QueryAndDeleteTests {

        private Path personalDir;

        @BeforeEach
        void initRoots() throws Exception {
            personalDir = Files.createDirectories(tempDir.resolve("personal"));
            init(StorageRoot.of("work", workDir), StorageRoot.of("personal", personalDir));
        }

        @Test
        @DisplayName("Get without a root searches every root")
        void testGetAcrossRoots() throws Exception {
            storage.save(bookmark("p1", "personal"), "personal").get(5, TimeUnit.SECONDS);

            assertTrue(storage.get("p1", null).isPresent());
            assertTrue(storage.get("p1", "work").isEmpty());
            assertTrue(storage.get("p1", "unknown").isEmpty());
            assertEquals(1, storage.list(null, BookmarkFilter.activeOnly()).size());
            assertEquals(List.of(), storage.list("unknown", BookmarkFilter.all()));
        }

        @Test
        @DisplayName("Hard delete removes file and entry and is idempotent")
        void testHardDelete() throws Exception {
            storage.save(bookmark("b1", "work"), "work").get(5, TimeUnit.SECONDS);

            storage.hardDelete("b1", "work").get(5, TimeUnit.SECONDS);
            assertFalse(Files.exists(workDir.resolve("bookmarks/b1.yaml")));
            assertTrue(storage.get("b1", null).isEmpty());

            storage.hardDelete("b1", "work").get(5, TimeUnit.SECONDS);
        }

        @Test
        @DisplayName("Stats for unknown root fail")
        void testStatsUnknownRoot() {
            assertThrows(StorageException.class, () -> storage.stats("unknown"));
            assertThrows(StorageException.class, () -> storage.loadErrors("unknown"));
        }

        @Test
        @DisplayName("recentConflicts returns the newest entries, root order preserved")
        void testRecentConflicts() throws Exception {
            Bookmark w = bookmark("w", "work");
            writeRecordFile(workDir, "w.yaml", w);
            writeRecordFile(workDir, "w-copy.yaml", w);
            Bookmark p = bookmark("p", "personal");
            writeRecordFile(personalDir, "p.yaml", p);
            writeRecordFile(personalDir, "p-copy.yaml", p);

            init(StorageRoot.of("work", workDir), StorageRoot.of("personal", personalDir));

            assertEquals(2, storage.recentConflicts(5).size());
            List<ConflictRecord> last = storage.recentConflicts(1);
            assertEquals(1, last.size());
            assertEquals("personal", last.get(0).rootName());
            assertEquals(List.of(), storage.recentConflicts(0));
        }
    }

    // ========================================================================
    // Update Tests
    // ========================================================================

    @Nested
    @DisplayName("Locked update and guarded delete")
    class UpdateTests {

        @BeforeEach
        void initWork() throws Exception {
            init(StorageRoot.of("work", workDir));
        }

        @Test
        @DisplayName("Update applies the change to the stored version and persists it")
        void testUpdate() throws Exception {
            storage.save(bookmark("u1", "work"), "work").get(5, TimeUnit.SECONDS);

            Bookmark updated = storage.update("u1", "work",
                    b -> b.toBuilder().title("Changed").build()).get(5, TimeUnit.SECONDS);

            assertEquals("Changed", updated.title());
            assertEquals(updated, storage.get("u1", "work").orElseThrow());
            init(StorageRoot.of("work", workDir));
            assertEquals("Changed", storage.get("u1", "work").orElseThrow().title());
        }

        @Test
        @DisplayName("Update of an id that is not indexed fails with NotFoundException")
        void testUpdateUnknown() {
            Throwable cause = causeOf(storage.update("ghost", "work", b -> b));
            assertInstanceOf(NotFoundException.class, cause);
            assertFalse(Files.exists(workDir.resolve("bookmarks/ghost.yaml")));
        }

        @Test
        @DisplayName("Update that moves the record to another root is rejected")
        void testUpdateCannotMoveRoot() throws Exception {
            Bookmark b = bookmark("u2", "work");
            storage.save(b, "work").get(5, TimeUnit.SECONDS);

            Throwable cause = causeOf(storage.update("u2", "work",
                    current -> current.toBuilder().storageRoot("personal").build()));
            assertInstanceOf(ValidationException.class, cause);
            assertEquals(b, storage.get("u2", "work").orElseThrow());
        }

        @Test
        @DisplayName("Change that throws leaves the record untouched")
        void testChangeThrows() throws Exception {
            Bookmark b = bookmark("u3", "work");
            storage.save(b, "work").get(5, TimeUnit.SECONDS);
            byte[] before = Files.readAllBytes(workDir.resolve("bookmarks/u3.yaml"));

            Throwable cause = causeOf(storage.update("u3", "work", current -> {
                throw new IllegalStateException("refused");
            }));
            assertEquals("refused", cause.getMessage());
            assertArrayEquals(before, Files.readAllBytes(workDir.resolve("bookmarks/u3.yaml")));
            assertEquals(b, storage.get("u3", "work").orElseThrow());
        }

        @Test
        @DisplayName("Failing delete precondition keeps file and entry")
        void testDeletePreconditionFails() throws Exception {
            storage.save(bookmark("u4", "work"), "work").get(5, TimeUnit.SECONDS);

            Throwable cause = causeOf(storage.hardDelete("u4", "work", current -> {
                throw new IllegalStateException("still active");
            }));
            assertEquals("still active", cause.getMessage());
            assertTrue(Files.exists(workDir.resolve("bookmarks/u4.yaml")));
            assertTrue(storage.get("u4", "work").isPresent());
        }
    }

    // ========================================================================
    // Duplicate File Tests
    // ========================================================================

    @Nested
    @DisplayName("Duplicate files across restarts")
    class DuplicateFileTests {

        private Path canonical;
        private Path copy;

        @BeforeEach
        void writeDuplicates() throws Exception {
            // the copy is newer, so it wins the load-time conflict
            writeRecordFile(workDir, "abc.yaml", bookmark("abc", "work").toBuilder()
                    .title("older").lastModified(T0).build());
            writeRecordFile(workDir, "abc-copy.yaml", bookmark("abc", "work").toBuilder()
                    .title("newer").lastModified(T1).build());
            canonical = workDir.resolve("bookmarks/abc.yaml");
            copy = workDir.resolve("bookmarks/abc-copy.yaml");
            init(StorageRoot.of("work", workDir));
            assertEquals("newer", storage.get("abc", "work").orElseThrow().title());
        }

        @Test
        @DisplayName("Hard delete of a conflicted id removes every file and stays gone after restart")
        void testHardDeleteRemovesAllCopies() throws Exception {
            storage.hardDelete("abc", "work").get(5, TimeUnit.SECONDS);

            assertFalse(Files.exists(canonical));
            assertFalse(Files.exists(copy));
            init(StorageRoot.of("work", workDir));
            assertTrue(storage.get("abc", "work").isEmpty());
            assertEquals(List.of(), storage.recentConflicts(10));
        }

        @Test
        @DisplayName("Soft delete then hard delete of a conflicted id stays gone after restart")
        void testSoftThenHardDelete() throws Exception {
            storage.update("abc", "work", b -> b.toBuilder().deleted(true).deletedAt(T1).build())
                    .get(5, TimeUnit.SECONDS);
            storage.hardDelete("abc", "work").get(5, TimeUnit.SECONDS);

            init(StorageRoot.of("work", workDir));
            assertTrue(storage.get("abc", "work").isEmpty());
        }

        @Test
        @DisplayName("Writing a conflicted id removes the losing copy so the write survives restart")
        void testWriteClearsDuplicates() throws Exception {
            storage.update("abc", "work", b -> b.toBuilder().deleted(true).deletedAt(T1).build())
                    .get(5, TimeUnit.SECONDS);

            assertTrue(Files.exists(canonical));
            assertFalse(Files.exists(copy));

            init(StorageRoot.of("work", workDir));
            Bookmark reloaded = storage.get("abc", "work").orElseThrow();
            assertTrue(reloaded.deleted());
            assertEquals("newer", reloaded.title());
            assertEquals(List.of(), storage.recentConflicts(10));
        }
    }

    @Test
    @DisplayName("Record file content is readable YAML")
    void testFileFormat() throws Exception {
        init(StorageRoot.of("work", workDir));
        storage.save(bookmark("b1", "work"), "work").get(5, TimeUnit.SECONDS);

        String text = Files.readString(workDir.resolve("bookmarks/b1.yaml"), StandardCharsets.UTF_8);
        assertTrue(text.contains("id: \"b1\""), text);
        assertTrue(text.contains("created_at:"), text);
    }
}
