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
package dev.mars.bookmarkstore.lock;

import dev.mars.bookmarkstore.error.LockTimeoutException;
import dev.mars.bookmarkstore.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Advisory lock on a single file, held through a sidecar marker at {@code <target>.lock}.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>Create the marker with {@code CREATE_NEW}; success means the lock is held.</li>
 *   <li>If the marker exists and its modification time is older than
 *       {@code 2 x timeout}, the previous holder is assumed dead: the marker is removed
 *       and acquisition retried.</li>
 *   <li>Otherwise poll every {@code pollInterval} until {@code timeout} has elapsed,
 *       then fail with {@link LockTimeoutException}.</li>
 * </ol>
 * Works on any filesystem that honours exclusive create. It only excludes writers that
 * follow the same marker convention.
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * try (SidecarLock lock = SidecarLock.acquire(file, Duration.ofSeconds(5))) {
 *     Files.write(file, bytes);
 * }
 * }</pre>
 */
public final class SidecarLock implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SidecarLock.class);

    /** Suffix appended to the target path to form the marker path. */
    public static final String SUFFIX = ".lock";

    /** Default delay between acquisition attempts. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    /** Serializes stale-marker reclaims within this process. */
    private static final Object RECLAIM_MONITOR = new Object();

    private final Path target;
    private final Path marker;
    private final AtomicBoolean held = new AtomicBoolean(true);

    private SidecarLock(Path target, Path marker) {
        this.target = target;
        this.marker = marker;
    }

    /**
     * Acquires the lock on {@code target}, polling every {@link #DEFAULT_POLL_INTERVAL}.
     *
     * @throws LockTimeoutException if the lock is still held after {@code timeout}
     * @throws StorageException     if the wait is interrupted
     */
    public static SidecarLock acquire(Path target, Duration timeout) {
        return acquire(target, timeout, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Acquires the lock on {@code target}.
     *
     * @param target       file to protect (need not exist)
     * @param timeout      maximum time to wait; markers older than twice this are reclaimed
     * @param pollInterval delay between attempts
     * @throws LockTimeoutException if the lock is still held after {@code timeout}
     * @throws StorageException     if the wait is interrupted
     */
    public static SidecarLock acquire(Path target, Duration timeout, Duration pollInterval) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(pollInterval, "pollInterval");

        Path marker = markerFor(target);
        long timeoutNanos = timeout.toNanos();
        long staleMillis = timeout.multipliedBy(2).toMillis();
        long start = System.nanoTime();
        int attempts = 0;

        while (true) {
            attempts++;
            try {
                Files.createFile(marker);
                LOG.trace("Lock acquired: {} (attempts={})", marker, attempts);
                return new SidecarLock(target, marker);
            } catch (FileAlreadyExistsException e) {
                if (reclaimIfStale(marker, staleMillis) && System.nanoTime() - start <= timeoutNanos) {
                    continue;
                }
            } catch (NoSuchFileException e) {
                // parent directory missing; treat like a transient failure until timeout
                LOG.debug("Cannot create lock marker {}: {}", marker, e.getMessage());
            } catch (IOException e) {
                LOG.debug("Lock attempt on {} failed: {}", marker, e.getMessage());
            }

            if (System.nanoTime() - start > timeoutNanos) {
                LOG.debug("Lock timeout on {} after {} attempts", target, attempts);
                throw new LockTimeoutException(target, timeout);
            }
            LOG.trace("Lock busy: {}, retrying in {} ms", marker, pollInterval.toMillis());
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageException("Interrupted while waiting for lock on " + target, e);
            }
        }
    }

    /**
     * Returns the marker path used for {@code target}.
     */
    public static Path markerFor(Path target) {
        return target.resolveSibling(target.getFileName() + SUFFIX);
    }

    /**
     * Removes the marker if it is older than {@code staleMillis}.
     * <p>
     * Reclaims in this process are serialized and the age is read again just before the
     * delete, so a waiter that judged the marker stale cannot remove the fresh marker
     * another waiter created after reclaiming it first.
     *
     * @return true if the caller should retry immediately (marker removed or already gone)
     */
    private static boolean reclaimIfStale(Path marker, long staleMillis) {
        if (!isStale(marker, staleMillis)) {
            return false;
        }
        synchronized (RECLAIM_MONITOR) {
            long ageMillis;
            try {
                ageMillis = ageMillis(marker);
            } catch (NoSuchFileException e) {
                // reclaimed or released meanwhile
                return true;
            } catch (IOException e) {
                LOG.debug("Cannot stat lock marker {}: {}", marker, e.getMessage());
                return false;
            }
            if (ageMillis <= staleMillis) {
                return false;
            }

            LOG.warn("Reclaiming stale lock {} (age {} ms, threshold {} ms)", marker, ageMillis, staleMillis);
            try {
                Files.deleteIfExists(marker);
                return true;
            } catch (IOException e) {
                LOG.warn("Could not remove stale lock {}: {}", marker, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Unsynchronized first look; a vanished marker counts as stale so the caller retries.
     */
    private static boolean isStale(Path marker, long staleMillis) {
        try {
            return ageMillis(marker) > staleMillis;
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException e) {
            LOG.debug("Cannot stat lock marker {}: {}", marker, e.getMessage());
            return false;
        }
    }

    private static long ageMillis(Path marker) throws IOException {
        FileTime modified = Files.getLastModifiedTime(marker);
        return System.currentTimeMillis() - modified.toMillis();
    }

    /** The protected file. */
    public Path target() {
        return target;
    }

    /** The marker file signalling this lock. */
    public Path marker() {
        return marker;
    }

    /** Whether {@link #release()} has not been called yet. */
    public boolean isHeld() {
        return held.get();
    }

    /**
     * Deletes the marker. Idempotent; deletion failures are logged and ignored.
     */
    public void release() {
        if (!held.compareAndSet(true, false)) {
            return;
        }
        try {
            Files.deleteIfExists(marker);
            LOG.trace("Lock released: {}", marker);
        } catch (IOException e) {
            LOG.warn("Could not release lock {}: {}", marker, e.getMessage());
        }
    }

    @Override
    public void close() {
        release();
    }
}
