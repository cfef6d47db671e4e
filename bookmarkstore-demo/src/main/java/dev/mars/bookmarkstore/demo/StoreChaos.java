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
package dev.mars.bookmarkstore.demo;

import dev.mars.bookmarkstore.error.ErrorKind;
import dev.mars.bookmarkstore.error.LifecycleException;
import dev.mars.bookmarkstore.error.LockTimeoutException;
import dev.mars.bookmarkstore.lifecycle.BookmarkDraft;
import dev.mars.bookmarkstore.lifecycle.BookmarkLifecycle;
import dev.mars.bookmarkstore.lock.SidecarLock;
import dev.mars.bookmarkstore.model.Bookmark;
import dev.mars.bookmarkstore.storage.BookmarkFilter;
import dev.mars.bookmarkstore.storage.BookmarkStorageConfig;
import dev.mars.bookmarkstore.storage.ConflictRecord;
import dev.mars.bookmarkstore.storage.FileBookmarkStorage;
import dev.mars.bookmarkstore.storage.LoadError;
import dev.mars.bookmarkstore.storage.StorageRoot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chaos testing for the bookmark store.
 * <p>
 * This class throws hostile scenarios at the store to verify its guarantees end to end:
 * <ul>
 *   <li>Concurrent writer storms</li>
 *   <li>Corrupt file injection</li>
 *   <li>Duplicate-id conflicts on reload</li>
 *   <li>Lock contention and stale locks</li>
 *   <li>The two-phase delete gate</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl bookmarkstore-demo -am
 *
 * # Run all chaos tests
 * java ... dev.mars.bookmarkstore.demo.StoreChaos
 *
 * # Run one group
 * java ... dev.mars.bookmarkstore.demo.StoreChaos concurrent
 * java ... dev.mars.bookmarkstore.demo.StoreChaos corruption
 * java ... dev.mars.bookmarkstore.demo.StoreChaos locking
 * java ... dev.mars.bookmarkstore.demo.StoreChaos lifecycle
 * </pre>
 *
 * @see FileBookmarkStorage
 */
public class StoreChaos {

    private static final String ROOT = "chaos";

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public StoreChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║              BOOKMARK STORE CHAOS SUITE                       ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("bookmark-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        StoreChaos chaos = new StoreChaos(chaosDir);

        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "corruption" -> chaos.runCorruptionTests();
                case "locking" -> chaos.runLockingTests();
                case "lifecycle" -> chaos.runLifecycleTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCorruptionTests();
                    chaos.runLockingTests();
                    chaos.runLifecycleTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, corruption, locking, lifecycle, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Writer Storm (16 threads × 25 bookmarks)", this::writerStorm);
        chaosTest("Same-Record Contention (12 writers, one id)", this::sameRecordContention);
    }

    private void writerStorm() throws Exception {
        Path testDir = createTestDir("writer-storm");
        int numThreads = 16;
        int perThread = 25;
        AtomicInteger errorCount = new AtomicInteger(0);

        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            BookmarkLifecycle lifecycle = new BookmarkLifecycle(storage);
            ExecutorService executor = Executors.newFixedThreadPool(numThreads);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(numThreads);

            for (int t = 0; t < numThreads; t++) {
                final int threadId = t;
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        for (int i = 0; i < perThread; i++) {
                            lifecycle.create(BookmarkDraft.builder(
                                    "https://example.com/" + threadId + "/" + i,
                                    "Thread " + threadId + " #" + i).build(), ROOT).join();
                        }
                    } catch (Exception e) {
                        errorCount.incrementAndGet();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            doneLatch.await(60, TimeUnit.SECONDS);
            executor.shutdown();

            int expected = numThreads * perThread;
            if (errorCount.get() > 0) {
                throw new AssertionError(errorCount.get() + " writer threads failed");
            }
            if (storage.stats(ROOT).total() != expected) {
                throw new AssertionError("Expected " + expected + " indexed, got " + storage.stats(ROOT).total());
            }
        }

        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            int reloaded = storage.stats(ROOT).total();
            if (reloaded != numThreads * perThread || !storage.loadErrors(ROOT).isEmpty()) {
                throw new AssertionError("Reload found " + reloaded + " records and "
                        + storage.loadErrors(ROOT).size() + " errors");
            }
        }
    }

    private void sameRecordContention() throws Exception {
        Path testDir = createTestDir("same-record");
        int writers = 12;

        try (FileBookmarkStorage storage = open(testDir, fastConfig().lockTimeoutMs(10_000).build())) {
            Bookmark base = bookmark("contended");
            List<CompletableFuture<Bookmark>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                futures.add(storage.save(base.toBuilder().title("writer " + i).build(), ROOT));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            Path dir = testDir.resolve(FileBookmarkStorage.RECORDS_DIR);
            try (var files = Files.list(dir)) {
                long count = files.count();
                if (count != 1) {
                    throw new AssertionError("Expected exactly one file, found " + count);
                }
            }
            String onDisk = Files.readString(dir.resolve("contended.yaml"), StandardCharsets.UTF_8);
            String indexed = storage.get("contended", ROOT).orElseThrow().title();
            if (!onDisk.contains(indexed)) {
                throw new AssertionError("Index says '" + indexed + "' but disk disagrees");
            }
        }
    }

    // =========================================================================
    // CORRUPTION CHAOS
    // =========================================================================

    private void runCorruptionTests() {
        printSection("CORRUPTION CHAOS");

        chaosTest("Corrupt File Injection (10 good, 4 bad)", this::corruptFileInjection);
        chaosTest("Duplicate Id Across Files", this::duplicateIdConflict);
    }

    private void corruptFileInjection() throws Exception {
        Path testDir = createTestDir("corrupt-files");
        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            for (int i = 0; i < 10; i++) {
                storage.save(bookmark("good-" + i), ROOT).join();
            }
        }

        Path dir = testDir.resolve(FileBookmarkStorage.RECORDS_DIR);
        Files.writeString(dir.resolve("garbage.yaml"), "{{{{ not yaml");
        Files.write(dir.resolve("binary.yaml"), new byte[]{0, (byte) 0xFF, 0x13, 0x37});
        Files.writeString(dir.resolve("no-url.yaml"), "id: x\ntitle: x\nstorage_root: chaos\n");
        Files.writeString(dir.resolve("traversal.yaml"),
                "id: t\nurl: https://e.com\ntitle: t\nfolder_path: ../../etc\nstorage_root: chaos\n");

        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            int loaded = storage.stats(ROOT).total();
            List<LoadError> errors = storage.loadErrors(ROOT);
            if (loaded != 10 || errors.size() != 4) {
                throw new AssertionError("Expected 10 records and 4 errors, got " + loaded + " and " + errors.size());
            }
        }
    }

    private void duplicateIdConflict() throws Exception {
        Path testDir = createTestDir("duplicate-id");
        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            storage.save(bookmark("dup").toBuilder().lastModified(Instant.now()).build(), ROOT).join();
        }

        Path dir = testDir.resolve(FileBookmarkStorage.RECORDS_DIR);
        String stale = Files.readString(dir.resolve("dup.yaml"))
                .replaceAll("last_modified: .*", "last_modified: \"2000-01-01T00:00:00Z\"")
                .replace("title: \"Chaos dup\"", "title: \"stale copy\"");
        Files.writeString(dir.resolve("dup-backup.yaml"), stale);

        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            List<ConflictRecord> conflicts = storage.recentConflicts(10);
            if (conflicts.size() != 1 || !conflicts.get(0).keptFile().equals("dup.yaml")) {
                throw new AssertionError("Expected dup.yaml to win, conflicts=" + conflicts);
            }
            if (!storage.get("dup", ROOT).orElseThrow().title().equals("Chaos dup")) {
                throw new AssertionError("Stale copy won the conflict");
            }
        }
    }

    // =========================================================================
    // LOCKING CHAOS
    // =========================================================================

    private void runLockingTests() {
        printSection("LOCKING CHAOS");

        chaosTest("Lock Contention Timeout", this::lockContentionTimeout);
        chaosTest("Stale Lock Reclamation", this::staleLockReclamation);
    }

    private void lockContentionTimeout() throws Exception {
        Path testDir = createTestDir("lock-timeout");
        try (FileBookmarkStorage storage = open(testDir, fastConfig().lockTimeoutMs(200).build())) {
            storage.save(bookmark("held"), ROOT).join();
            Path file = testDir.resolve(FileBookmarkStorage.RECORDS_DIR).resolve("held.yaml");

            try (SidecarLock ignored = SidecarLock.acquire(file, Duration.ofSeconds(5))) {
                try {
                    storage.save(bookmark("held").toBuilder().title("intruder").build(), ROOT).join();
                    throw new AssertionError("Save should have timed out");
                } catch (CompletionException e) {
                    if (!(e.getCause() instanceof LockTimeoutException)) {
                        throw new AssertionError("Expected lock timeout, got " + e.getCause());
                    }
                }
            }
            if (!storage.get("held", ROOT).orElseThrow().title().equals("Chaos held")) {
                throw new AssertionError("Index changed despite failed save");
            }
        }
    }

    private void staleLockReclamation() throws Exception {
        Path testDir = createTestDir("stale-lock");
        try (FileBookmarkStorage storage = open(testDir, fastConfig().lockTimeoutMs(200).build())) {
            Path file = testDir.resolve(FileBookmarkStorage.RECORDS_DIR).resolve("orphan.yaml");
            Path marker = SidecarLock.markerFor(file);
            Files.createFile(marker);
            Files.setLastModifiedTime(marker, FileTime.from(Instant.now().minusSeconds(30)));

            storage.save(bookmark("orphan"), ROOT).join();
            if (Files.exists(marker) || storage.get("orphan", ROOT).isEmpty()) {
                throw new AssertionError("Stale lock was not reclaimed");
            }
        }
    }

    // =========================================================================
    // LIFECYCLE CHAOS
    // =========================================================================

    private void runLifecycleTests() {
        printSection("LIFECYCLE CHAOS");

        chaosTest("Purge Refused For Active Records", this::purgeGate);
        chaosTest("Double Delete And Bogus Restore", this::lifecycleRefusals);
    }

    private void purgeGate() throws Exception {
        Path testDir = createTestDir("purge-gate");
        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            BookmarkLifecycle lifecycle = new BookmarkLifecycle(storage);
            Bookmark b = lifecycle.create(BookmarkDraft.builder("https://example.com", "keep me").build(), ROOT).join();

            expectLifecycleFailure(() -> lifecycle.purge(b.id(), ROOT).join(), ErrorKind.SAFETY_VIOLATION);
            if (storage.get(b.id(), ROOT).isEmpty()) {
                throw new AssertionError("Active record was purged");
            }

            lifecycle.delete(b.id(), ROOT).join();
            lifecycle.purge(b.id(), ROOT).join();
            if (!storage.list(ROOT, BookmarkFilter.all()).isEmpty()) {
                throw new AssertionError("Purged record still indexed");
            }
        }
    }

    private void lifecycleRefusals() throws Exception {
        Path testDir = createTestDir("refusals");
        try (FileBookmarkStorage storage = open(testDir, fastConfig().build())) {
            BookmarkLifecycle lifecycle = new BookmarkLifecycle(storage);
            Bookmark b = lifecycle.create(BookmarkDraft.builder("https://example.com", "twice").build(), ROOT).join();

            expectLifecycleFailure(() -> lifecycle.restore(b.id(), ROOT).join(), ErrorKind.NOT_DELETED);
            lifecycle.delete(b.id(), ROOT).join();
            expectLifecycleFailure(() -> lifecycle.delete(b.id(), ROOT).join(), ErrorKind.ALREADY_DELETED);
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private static BookmarkStorageConfig.Builder fastConfig() {
        return BookmarkStorageConfig.builder()
                .syncEnabled(false)
                .lockPollIntervalMs(5);
    }

    private static FileBookmarkStorage open(Path dir, BookmarkStorageConfig config) {
        FileBookmarkStorage storage = new FileBookmarkStorage(config);
        storage.initialize(List.of(new StorageRoot(ROOT, dir, true, true))).join();
        return storage;
    }

    private static Bookmark bookmark(String id) {
        return Bookmark.builder()
                .id(id)
                .url("https://example.com/" + id)
                .title("Chaos " + id)
                .createdAt(Instant.now())
                .storageRoot(ROOT)
                .build();
    }

    private static void expectLifecycleFailure(Runnable action, ErrorKind expected) {
        try {
            action.run();
        } catch (CompletionException e) {
            if (e.getCause() instanceof LifecycleException le && le.kind() == expected) {
                return;
            }
            throw new AssertionError("Expected " + expected + ", got " + e.getCause());
        }
        throw new AssertionError("Expected " + expected + " but the operation succeeded");
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(StoreChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Cleanup failed for " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }
}
