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
import dev.mars.bookmarkstore.codec.CodecException;
import dev.mars.bookmarkstore.error.NotFoundException;
import dev.mars.bookmarkstore.error.StorageException;
import dev.mars.bookmarkstore.error.ValidationException;
import dev.mars.bookmarkstore.lock.SidecarLock;
import dev.mars.bookmarkstore.model.Bookmark;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * File-based implementation of {@link BookmarkStorage}.
 * <p>
 * <b>Files (per root):</b>
 * <pre>
 * root/
 *  ├─ bookmarks/&lt;id&gt;.yaml        // one record per file
 *  ├─ bookmarks/&lt;id&gt;.yaml.lock   // sidecar lock while a write is in flight
 *  ├─ favicons/                   // assets, not parsed here
 *  └─ screenshots/                // assets, not parsed here
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Saves and deletes run on a bounded I/O pool. Writers to the same record file are
 * serialized by its {@link SidecarLock}; writers to different ids proceed in parallel.
 * Queries read the per-root {@link StorageIndex} directly.
 * <p>
 * <b>Durability:</b>
 * Record files use atomic replace (write temp → fsync → rename → fsync dir). The index
 * entry is updated only after the rename, while the lock is still held. Writing a record
 * that was loaded from a conflicting duplicate also removes the losing files, so a
 * restart cannot bring an older copy back.
 * <p>
 * <b>Load Tolerance:</b>
 * An inaccessible root fails {@link #initialize(List)}. A corrupt record file is
 * skipped and reported through {@link #loadErrors(String)}; two files with the same id
 * are resolved by {@link ConflictResolver} and reported through {@link #recentConflicts(int)}.
 *
 * @see BookmarkStorage
 */
public final class FileBookmarkStorage implements BookmarkStorage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileBookmarkStorage.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Directory holding one YAML file per bookmark. */
    public static final String RECORDS_DIR = "bookmarks";

    /** Asset directories created alongside the records directory. */
    public static final List<String> ASSET_DIRS = List.of("favicons", "screenshots");

    /** Record file extension. */
    public static final String RECORD_EXTENSION = ".yaml";

    /** Suffix of the temp file a record is written to before the atomic rename. */
    private static final String TMP_SUFFIX = ".tmp";

    /** Probe file used to verify a root is writable. */
    private static final String PROBE_FILE = ".bookmarkstore_probe";

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Roots and their indices, swapped as a whole by {@link #initialize(List)}.
     */
    private record State(Map<String, StorageRoot> roots, Map<String, StorageIndex> indices) {
        static final State EMPTY = new State(Map.of(), Map.of());
    }

    private final ExecutorService ioExecutor;
    private final BookmarkStorageConfig config;
    private final BookmarkCodec codec = new BookmarkCodec();

    private volatile State state = State.EMPTY;
    private volatile String currentRootName;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a new FileBookmarkStorage with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     *
     * @see BookmarkStorageConfig
     */
    public FileBookmarkStorage() {
        this(BookmarkStorageConfig.load());
    }

    /**
     * Creates a new FileBookmarkStorage with the specified configuration.
     *
     * @param config the storage configuration
     */
    public FileBookmarkStorage(BookmarkStorageConfig config) {
        this.config = Objects.requireNonNull(config, "config");

        AtomicInteger threadCount = new AtomicInteger();
        this.ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), r -> {
            Thread t = new Thread(r, "bookmark-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileBookmarkStorage created: lockTimeout={} ms, ioThreads={}, syncEnabled={}, maxRecordSize={} KB",
                config.lockTimeoutMs(), config.ioThreads(), config.syncEnabled(), config.maxRecordSizeKb());

        if (!config.syncEnabled()) {
            LOG.warn("FileBookmarkStorage created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Returns the configuration used by this storage instance.
     */
    public BookmarkStorageConfig config() {
        return config;
    }

    // ========================================================================
    // Initialize / Close
    // ========================================================================

    @Override
    public CompletableFuture<Void> initialize(List<StorageRoot> roots) {
        Objects.requireNonNull(roots, "roots");
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        return CompletableFuture.runAsync(() -> {
            Map<String, StorageRoot> loadedRoots = new LinkedHashMap<>();
            Map<String, StorageIndex> loadedIndices = new LinkedHashMap<>();

            for (StorageRoot root : roots) {
                if (loadedRoots.containsKey(root.name())) {
                    throw new ValidationException("Duplicate storage root name: " + root.name());
                }
                try {
                    validateRoot(root);
                    loadedIndices.put(root.name(), loadRoot(root));
                    loadedRoots.put(root.name(), root);
                } catch (StorageException e) {
                    LOG.error("Failed to initialize storage {}: {}", root.name(), e.getMessage());
                    throw e;
                }
            }

            State next = new State(Collections.unmodifiableMap(loadedRoots),
                    Collections.unmodifiableMap(loadedIndices));
            this.state = next;
            this.currentRootName = selectCurrentRootName(next);
            LOG.info("Storage initialized: roots={}, current={}", next.roots().keySet(), currentRootName);
        }, ioExecutor);
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Storage already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        ioExecutor.shutdown();
        LOG.info("Bookmark storage closed");
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    @Override
    public CompletableFuture<Bookmark> save(Bookmark bookmark, String rootName) {
        Objects.requireNonNull(bookmark, "bookmark");
        Objects.requireNonNull(rootName, "rootName");
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        State current = state;
        StorageRoot root = current.roots().get(rootName);
        if (root == null) {
            return CompletableFuture.failedFuture(new StorageException("Storage not found: " + rootName));
        }
        if (!rootName.equals(bookmark.storageRoot())) {
            return CompletableFuture.failedFuture(new ValidationException(
                    "Bookmark " + bookmark.id() + " belongs to root " + bookmark.storageRoot()
                            + ", cannot save it to " + rootName));
        }
        StorageIndex index = current.indices().get(rootName);

        return CompletableFuture.supplyAsync(() -> {
            Path file = recordPath(root, bookmark.id());
            LOG.debug("Saving bookmark {} to {}", bookmark.id(), file);
            try (SidecarLock lock = SidecarLock.acquire(file, config.lockTimeout(), config.lockPollInterval())) {
                commit(index, file, bookmark);
            } catch (StorageException e) {
                LOG.error("Failed to save bookmark {} to {}: {}", bookmark.id(), rootName, e.getMessage());
                throw e;
            }
            LOG.debug("Saved bookmark {} ({})", bookmark.id(), rootName);
            return bookmark;
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Bookmark> update(String id, String rootName, UnaryOperator<Bookmark> change) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rootName, "rootName");
        Objects.requireNonNull(change, "change");
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        State current = state;
        StorageRoot root = current.roots().get(rootName);
        if (root == null) {
            return CompletableFuture.failedFuture(new StorageException("Storage not found: " + rootName));
        }
        StorageIndex index = current.indices().get(rootName);

        return CompletableFuture.supplyAsync(() -> {
            Path file = recordPath(root, id);
            try (SidecarLock lock = SidecarLock.acquire(file, config.lockTimeout(), config.lockPollInterval())) {
                // read-modify-write happens entirely under the lock
                IndexEntry entry = index.entry(id);
                if (entry == null) {
                    throw new NotFoundException(id);
                }
                Bookmark next = change.apply(entry.bookmark());
                if (!id.equals(next.id()) || !rootName.equals(next.storageRoot())) {
                    throw new ValidationException("Update of bookmark " + id + " in " + rootName
                            + " may not change its id or root (got " + next.id() + " in " + next.storageRoot() + ")");
                }
                commit(index, file, next);
                LOG.debug("Updated bookmark {} ({})", id, rootName);
                return next;
            } catch (StorageException e) {
                LOG.error("Failed to update bookmark {} in {}: {}", id, rootName, e.getMessage());
                throw e;
            }
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> hardDelete(String id, String rootName, Consumer<Bookmark> precondition) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rootName, "rootName");
        Objects.requireNonNull(precondition, "precondition");
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        State current = state;
        StorageRoot root = current.roots().get(rootName);
        if (root == null) {
            return CompletableFuture.failedFuture(new StorageException("Storage not found: " + rootName));
        }
        StorageIndex index = current.indices().get(rootName);

        return CompletableFuture.runAsync(() -> {
            Path file = recordPath(root, id);
            try (SidecarLock lock = SidecarLock.acquire(file, config.lockTimeout(), config.lockPollInterval())) {
                IndexEntry entry = index.entry(id);
                Set<Path> targets = new LinkedHashSet<>();
                targets.add(file);
                if (entry != null) {
                    precondition.accept(entry.bookmark());
                    targets.addAll(entry.allSources());
                }

                int removed = 0;
                for (Path target : targets) {
                    if (Files.deleteIfExists(target)) {
                        removed++;
                    }
                }
                index.remove(id);
                LOG.info("Hard deleted bookmark {} from {} ({} file(s) removed)", id, rootName, removed);
            } catch (IOException e) {
                LOG.error("Failed to delete bookmark {} from {}: {}", id, rootName, e.getMessage(), e);
                throw new StorageException("Failed to delete bookmark file " + id, e);
            }
        }, ioExecutor);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Override
    public Optional<Bookmark> get(String id, String rootName) {
        State current = state;
        if (rootName != null) {
            StorageIndex index = current.indices().get(rootName);
            return index == null ? Optional.empty() : index.get(id);
        }
        for (StorageIndex index : current.indices().values()) {
            Optional<Bookmark> found = index.get(id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Bookmark> list(String rootName, BookmarkFilter filter) {
        Objects.requireNonNull(filter, "filter");
        State current = state;
        if (rootName != null) {
            StorageIndex index = current.indices().get(rootName);
            return index == null ? List.of() : index.list(filter);
        }
        List<Bookmark> result = new ArrayList<>();
        for (StorageIndex index : current.indices().values()) {
            result.addAll(index.list(filter));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public StorageStats stats(String rootName) {
        return requireIndex(rootName).stats();
    }

    @Override
    public List<String> rootNames() {
        return List.copyOf(state.roots().keySet());
    }

    @Override
    public Optional<String> currentRootName() {
        State current = state;
        String cached = currentRootName;
        if (cached != null && current.roots().containsKey(cached)) {
            return Optional.of(cached);
        }
        cached = selectCurrentRootName(current);
        currentRootName = cached;
        return Optional.ofNullable(cached);
    }

    @Override
    public Optional<String> defaultRootName() {
        for (StorageRoot root : state.roots().values()) {
            if (root.defaultRoot()) {
                return Optional.of(root.name());
            }
        }
        return currentRootName();
    }

    @Override
    public List<LoadError> loadErrors(String rootName) {
        return requireIndex(rootName).loadErrors();
    }

    @Override
    public List<ConflictRecord> recentConflicts(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ConflictRecord> merged = new ArrayList<>();
        for (StorageIndex index : state.indices().values()) {
            merged.addAll(index.conflicts());
        }
        int from = Math.max(0, merged.size() - limit);
        return List.copyOf(merged.subList(from, merged.size()));
    }

    // ========================================================================
    // Root validation and loading
    // ========================================================================

    /**
     * Checks that a root exists, is a directory and can be read and written.
     *
     * @throws StorageException if the root is not usable
     */
    private void validateRoot(StorageRoot root) {
        Path path = root.path();
        if (!Files.exists(path)) {
            throw new StorageException("Storage path does not exist: " + path);
        }
        if (!Files.isDirectory(path)) {
            throw new StorageException("Storage path is not a directory: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new StorageException("Cannot access storage: permission denied reading " + path);
        }

        // Writability can only be trusted by actually writing
        Path probe = path.resolve(PROBE_FILE);
        try {
            Files.write(probe, new byte[0]);
            Files.delete(probe);
        } catch (IOException e) {
            throw new StorageException("Cannot access storage: write probe failed for " + path, e);
        }
        LOG.debug("Validated storage root {} at {}", root.name(), path);
    }

    /**
     * Builds the index of one root from its records directory.
     */
    private StorageIndex loadRoot(StorageRoot root) {
        ensureLayout(root.path());
        Path recordsDir = root.path().resolve(RECORDS_DIR);
        StorageIndex index = new StorageIndex(root.name());

        List<Path> files;
        try (Stream<Path> listing = Files.list(recordsDir)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(RECORD_EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list records in " + recordsDir, e);
        }

        LOG.info("Loading {} bookmarks from {}", files.size(), root.name());
        long startTime = System.currentTimeMillis();
        for (Path file : files) {
            loadRecordFile(root, index, file);
        }

        StorageStats stats = index.stats();
        LOG.info("Loaded {} bookmarks from {} ({} errors, {} conflicts) in {} ms",
                stats.total(), root.name(), stats.errorCount(), stats.conflictCount(),
                System.currentTimeMillis() - startTime);
        return index;
    }

    /**
     * Decodes one record file into the index. Never throws: every failure becomes a
     * {@link LoadError} on the index.
     */
    private void loadRecordFile(StorageRoot root, StorageIndex index, Path file) {
        String fileName = file.getFileName().toString();
        try {
            long size = Files.size(file);
            if (size > config.maxRecordSizeBytes()) {
                recordLoadError(index, fileName, LoadError.Kind.TOO_LARGE,
                        size + " bytes exceeds limit of " + config.maxRecordSizeBytes());
                return;
            }

            Bookmark bookmark = codec.decode(Files.readAllBytes(file));
            if (!root.name().equals(bookmark.storageRoot())) {
                // the directory a file lives in decides its root
                LOG.warn("Bookmark {} in {} names root '{}', re-homing to '{}'",
                        bookmark.id(), fileName, bookmark.storageRoot(), root.name());
                bookmark = bookmark.toBuilder().storageRoot(root.name()).build();
            }
            index.absorb(bookmark, file);
            LOG.trace("Loaded bookmark {} from {}", bookmark.id(), fileName);

        } catch (CodecException e) {
            LoadError.Kind kind = e.kind() == CodecException.Kind.MISSING_FIELD
                    ? LoadError.Kind.MISSING_FIELD
                    : LoadError.Kind.MALFORMED;
            recordLoadError(index, fileName, kind, e.getMessage());
        } catch (IOException e) {
            recordLoadError(index, fileName, LoadError.Kind.UNREADABLE, e.toString());
        }
    }

    private static void recordLoadError(StorageIndex index, String fileName, LoadError.Kind kind, String message) {
        LoadError error = new LoadError(index.rootName(), fileName, kind, message);
        index.recordLoadError(error);
        LOG.warn("Skipping record file: {}", error.describe());
    }

    /**
     * Creates the records and asset directories if missing.
     */
    private static void ensureLayout(Path rootPath) {
        try {
            Files.createDirectories(rootPath.resolve(RECORDS_DIR));
            for (String assetDir : ASSET_DIRS) {
                Files.createDirectories(rootPath.resolve(assetDir));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create storage structure in " + rootPath, e);
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private StorageIndex requireIndex(String rootName) {
        Objects.requireNonNull(rootName, "rootName");
        StorageIndex index = state.indices().get(rootName);
        if (index == null) {
            throw new StorageException("Storage not found: " + rootName);
        }
        return index;
    }

    private static String selectCurrentRootName(State state) {
        for (StorageRoot root : state.roots().values()) {
            if (root.current()) {
                return root.name();
            }
        }
        return state.roots().keySet().stream().findFirst().orElse(null);
    }

    static Path recordPath(StorageRoot root, String id) {
        return root.path().resolve(RECORDS_DIR).resolve(id + RECORD_EXTENSION);
    }

    /**
     * Writes the record to its canonical file, indexes it, then removes any other file
     * that held the same id. Must be called with the record's lock held.
     * <p>
     * A superseded file that cannot be removed stays listed on the entry so the next
     * write or purge retries it.
     */
    private void commit(StorageIndex index, Path file, Bookmark bookmark) {
        IndexEntry previous = index.entry(bookmark.id());
        writeRecord(file, bookmark);

        List<Path> remaining = new ArrayList<>();
        if (previous != null) {
            for (Path stale : previous.allSources()) {
                if (stale.equals(file)) {
                    continue;
                }
                try {
                    Files.deleteIfExists(stale);
                    LOG.info("Removed superseded file {} for bookmark {}", stale.getFileName(), bookmark.id());
                } catch (IOException e) {
                    LOG.warn("Could not remove superseded file {} for bookmark {}: {}",
                            stale, bookmark.id(), e.getMessage());
                    remaining.add(stale);
                }
            }
        }
        // index changes only after the write is durable, still under the lock
        index.put(bookmark, file, remaining);
    }

    /**
     * Encodes and atomically replaces one record file. Must be called with the
     * record's lock held.
     *
     * @throws StorageException if encoding or any file operation fails; the target is untouched
     */
    private void writeRecord(Path file, Bookmark bookmark) {
        byte[] bytes;
        try {
            bytes = codec.encode(bookmark);
        } catch (CodecException e) {
            throw new StorageException("Failed to encode bookmark " + bookmark.id(), e);
        }
        if (bytes.length > config.maxRecordSizeBytes()) {
            throw new StorageException("Bookmark " + bookmark.id() + " encodes to " + bytes.length
                    + " bytes, limit is " + config.maxRecordSizeBytes());
        }

        Path tmpPath = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
        try {
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (config.syncEnabled()) {
                    ch.force(true);
                }
            }

            // Atomic rename
            Files.move(tmpPath, file,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, file);

            if (config.syncEnabled()) {
                syncDirectory(file.getParent());
            }
        } catch (IOException e) {
            deleteQuietly(tmpPath);
            throw new StorageException("Failed to write bookmark " + bookmark.id() + " to " + file, e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    private static void syncDirectory(Path dir) {
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
