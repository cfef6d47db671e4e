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

import dev.mars.bookmarkstore.lifecycle.BookmarkDraft;
import dev.mars.bookmarkstore.lifecycle.BookmarkLifecycle;
import dev.mars.bookmarkstore.lifecycle.BookmarkUpdate;
import dev.mars.bookmarkstore.model.Bookmark;
import dev.mars.bookmarkstore.storage.BookmarkFilter;
import dev.mars.bookmarkstore.storage.BookmarkStorageConfig;
import dev.mars.bookmarkstore.storage.ConflictRecord;
import dev.mars.bookmarkstore.storage.FileBookmarkStorage;
import dev.mars.bookmarkstore.storage.LoadError;
import dev.mars.bookmarkstore.storage.StorageRoot;
import dev.mars.bookmarkstore.storage.StorageRootsLoader;
import dev.mars.bookmarkstore.storage.StorageStats;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Demo entry point for the bookmark store.
 * <p>
 * This demonstrates the basic record lifecycle:
 * <ul>
 *   <li>Initializing storage roots</li>
 *   <li>Creating and updating a bookmark</li>
 *   <li>Soft delete and restore</li>
 *   <li>Reload on restart</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * The storage location is, in order of priority:
 * <ol>
 *   <li>Command-line argument: a directory, or a roots file ending in {@code .yaml}</li>
 *   <li>System property: {@code -Dbookmarkstore.demoDir=/path}</li>
 *   <li>{@code ~/.bookmarkstore/demo}</li>
 * </ol>
 * Engine tunables come from {@link BookmarkStorageConfig}.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl bookmarkstore-demo -am
 *
 * # Run with the default directory
 * java -cp "bookmarkstore-demo/target/classes:..." dev.mars.bookmarkstore.demo.BookmarkDemo
 *
 * # Run against a directory or a roots file
 * java ... dev.mars.bookmarkstore.demo.BookmarkDemo /path/to/bookmarks
 * java ... dev.mars.bookmarkstore.demo.BookmarkDemo /path/to/config.yaml
 * </pre>
 *
 * @see BookmarkStorageConfig
 */
public class BookmarkDemo {

    private static final String DEMO_DIR_PROPERTY = "bookmarkstore.demoDir";

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|         Bookmark Store Demo           |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        List<StorageRoot> roots = resolveRoots(args);
        BookmarkStorageConfig config = BookmarkStorageConfig.load();
        System.out.println("Configuration: " + config);
        System.out.println();

        try (FileBookmarkStorage storage = new FileBookmarkStorage(config)) {
            storage.initialize(roots).join();
            String root = storage.currentRootName().orElseThrow();
            System.out.println("[OK] Storage initialized: roots=" + storage.rootNames() + ", current=" + root);

            List<Bookmark> existing = storage.list(root, BookmarkFilter.all());
            System.out.println("[OK] Loaded " + existing.size() + " existing bookmarks");
            if (!existing.isEmpty()) {
                System.out.println("\n  Last bookmarks in " + root + ":");
                int start = Math.max(0, existing.size() - 3);
                for (int i = start; i < existing.size(); i++) {
                    Bookmark b = existing.get(i);
                    System.out.printf("    [%s] %s%s%n", b.id(), b.title(), b.deleted() ? " (deleted)" : "");
                }
            }

            BookmarkLifecycle lifecycle = new BookmarkLifecycle(storage);

            Bookmark created = lifecycle.create(BookmarkDraft.builder(
                            "https://docs.oracle.com/en/java/javase/17/", "Java 17 docs")
                    .keywords("java", "reference")
                    .folderPath("development/java")
                    .build(), null).join();
            System.out.println("\n[OK] Created bookmark " + created.id());

            Bookmark updated = lifecycle.update(created.id(), root, BookmarkUpdate.builder()
                    .description("Run " + (existing.size() + 1) + " of the demo")
                    .tags(List.of("demo"))
                    .build()).join();
            System.out.println("[OK] Updated bookmark: " + updated.description());

            lifecycle.delete(created.id(), root).join();
            System.out.println("[OK] Soft deleted; active in " + root + ": "
                    + lifecycle.list(root, BookmarkFilter.activeOnly()).size());

            lifecycle.restore(created.id(), root).join();
            System.out.println("[OK] Restored; active in " + root + ": "
                    + lifecycle.list(root, BookmarkFilter.activeOnly()).size());

            StorageStats stats = storage.stats(root);
            System.out.printf("%n  Stats: total=%d, active=%d, deleted=%d, errors=%d, conflicts=%d%n",
                    stats.total(), stats.active(), stats.deleted(), stats.errorCount(), stats.conflictCount());
            for (LoadError error : storage.loadErrors(root)) {
                System.out.println("  Load error: " + error.describe());
            }
            for (ConflictRecord conflict : storage.recentConflicts(5)) {
                System.out.println("  Conflict: " + conflict.describe());
            }

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see records reloaded.   |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static List<StorageRoot> resolveRoots(String[] args) throws Exception {
        String location = args.length > 0 && !args[0].isBlank()
                ? args[0]
                : System.getProperty(DEMO_DIR_PROPERTY,
                        Path.of(System.getProperty("user.home"), ".bookmarkstore", "demo").toString());

        if (location.endsWith(".yaml") || location.endsWith(".yml")) {
            System.out.println("Roots file: " + Path.of(location).toAbsolutePath());
            return StorageRootsLoader.load(Path.of(location));
        }

        Path dir = Files.createDirectories(Path.of(location));
        System.out.println("Storage directory: " + dir.toAbsolutePath());
        return List.of(new StorageRoot("demo", dir, true, true));
    }
}
