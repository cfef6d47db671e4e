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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for bookmark storage.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dbookmarkstore.lockTimeoutMs=2000})</li>
 *   <li>Environment variables (e.g., {@code BOOKMARKSTORE_LOCK_TIMEOUT_MS})</li>
 *   <li>Properties file ({@code bookmarkstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>lockTimeoutMs</td><td>bookmarkstore.lockTimeoutMs</td><td>BOOKMARKSTORE_LOCK_TIMEOUT_MS</td><td>5000</td></tr>
 *   <tr><td>lockPollIntervalMs</td><td>bookmarkstore.lockPollIntervalMs</td><td>BOOKMARKSTORE_LOCK_POLL_INTERVAL_MS</td><td>100</td></tr>
 *   <tr><td>syncEnabled</td><td>bookmarkstore.syncEnabled</td><td>BOOKMARKSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>ioThreads</td><td>bookmarkstore.ioThreads</td><td>BOOKMARKSTORE_IO_THREADS</td><td>4</td></tr>
 *   <tr><td>maxRecordSizeKb</td><td>bookmarkstore.maxRecordSizeKb</td><td>BOOKMARKSTORE_MAX_RECORD_SIZE_KB</td><td>256</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # bookmarkstore.properties
 * bookmarkstore.lockTimeoutMs=5000
 * bookmarkstore.lockPollIntervalMs=100
 * bookmarkstore.syncEnabled=true
 * bookmarkstore.ioThreads=4
 * bookmarkstore.maxRecordSizeKb=256
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * BookmarkStorageConfig config = BookmarkStorageConfig.builder()
 *     .lockTimeoutMs(2000)
 *     .syncEnabled(false)
 *     .build();
 *
 * BookmarkStorage storage = new FileBookmarkStorage(config);
 * storage.initialize(roots).join();
 * </pre>
 */
public final class BookmarkStorageConfig {

    private static final Logger LOG = LoggerFactory.getLogger(BookmarkStorageConfig.class);

    private static final String PROPERTIES_FILE = "bookmarkstore.properties";

    // Property keys
    private static final String PROP_LOCK_TIMEOUT_MS = "bookmarkstore.lockTimeoutMs";
    private static final String PROP_LOCK_POLL_INTERVAL_MS = "bookmarkstore.lockPollIntervalMs";
    private static final String PROP_SYNC_ENABLED = "bookmarkstore.syncEnabled";
    private static final String PROP_IO_THREADS = "bookmarkstore.ioThreads";
    private static final String PROP_MAX_RECORD_SIZE_KB = "bookmarkstore.maxRecordSizeKb";

    // Environment variable keys
    private static final String ENV_LOCK_TIMEOUT_MS = "BOOKMARKSTORE_LOCK_TIMEOUT_MS";
    private static final String ENV_LOCK_POLL_INTERVAL_MS = "BOOKMARKSTORE_LOCK_POLL_INTERVAL_MS";
    private static final String ENV_SYNC_ENABLED = "BOOKMARKSTORE_SYNC_ENABLED";
    private static final String ENV_IO_THREADS = "BOOKMARKSTORE_IO_THREADS";
    private static final String ENV_MAX_RECORD_SIZE_KB = "BOOKMARKSTORE_MAX_RECORD_SIZE_KB";

    // Defaults
    private static final int DEFAULT_LOCK_TIMEOUT_MS = 5000;
    private static final int DEFAULT_LOCK_POLL_INTERVAL_MS = 100;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_IO_THREADS = 4;
    private static final int DEFAULT_MAX_RECORD_SIZE_KB = 256;

    private final int lockTimeoutMs;
    private final int lockPollIntervalMs;
    private final boolean syncEnabled;
    private final int ioThreads;
    private final int maxRecordSizeKb;

    private BookmarkStorageConfig(Builder builder) {
        this.lockTimeoutMs = builder.lockTimeoutMs;
        this.lockPollIntervalMs = builder.lockPollIntervalMs;
        this.syncEnabled = builder.syncEnabled;
        this.ioThreads = builder.ioThreads;
        this.maxRecordSizeKb = builder.maxRecordSizeKb;
    }

    /** Maximum wait for a record's sidecar lock, in milliseconds. */
    public int lockTimeoutMs() {
        return lockTimeoutMs;
    }

    /** Delay between lock acquisition attempts, in milliseconds. */
    public int lockPollIntervalMs() {
        return lockPollIntervalMs;
    }

    /** Whether record writes are fsynced (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Size of the I/O thread pool that runs saves, deletes and loads. */
    public int ioThreads() {
        return ioThreads;
    }

    /** Largest record file, in KB, that will be loaded or written. */
    public int maxRecordSizeKb() {
        return maxRecordSizeKb;
    }

    /** Lock timeout as a {@link Duration}. */
    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }

    /** Lock poll interval as a {@link Duration}. */
    public Duration lockPollInterval() {
        return Duration.ofMillis(lockPollIntervalMs);
    }

    /** Largest record file in bytes. */
    public long maxRecordSizeBytes() {
        return (long) maxRecordSizeKb * 1024;
    }

    @Override
    public String toString() {
        return "BookmarkStorageConfig{" +
                "lockTimeoutMs=" + lockTimeoutMs +
                ", lockPollIntervalMs=" + lockPollIntervalMs +
                ", syncEnabled=" + syncEnabled +
                ", ioThreads=" + ioThreads +
                ", maxRecordSizeKb=" + maxRecordSizeKb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code BookmarkStorageConfig.builder().build()}.
     */
    public static BookmarkStorageConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link BookmarkStorageConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Integer lockTimeoutMs;
        private Integer lockPollIntervalMs;
        private Boolean syncEnabled;
        private Integer ioThreads;
        private Integer maxRecordSizeKb;

        private final Properties fileProperties;

        private Builder() {
            // Load properties file once
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the lock timeout in milliseconds (default: 5000). */
        public Builder lockTimeoutMs(int lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
            return this;
        }

        /** Sets the lock poll interval in milliseconds (default: 100). */
        public Builder lockPollIntervalMs(int lockPollIntervalMs) {
            this.lockPollIntervalMs = lockPollIntervalMs;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the I/O pool size (default: 4). */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /** Sets the maximum record size in KB (default: 256). */
        public Builder maxRecordSizeKb(int maxRecordSizeKb) {
            this.maxRecordSizeKb = maxRecordSizeKb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws ValidationException if a numeric setting is not positive
         */
        public BookmarkStorageConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (lockTimeoutMs == null) {
                lockTimeoutMs = resolveInt(PROP_LOCK_TIMEOUT_MS, ENV_LOCK_TIMEOUT_MS, DEFAULT_LOCK_TIMEOUT_MS);
            }
            if (lockPollIntervalMs == null) {
                lockPollIntervalMs = resolveInt(PROP_LOCK_POLL_INTERVAL_MS, ENV_LOCK_POLL_INTERVAL_MS,
                        DEFAULT_LOCK_POLL_INTERVAL_MS);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (ioThreads == null) {
                ioThreads = resolveInt(PROP_IO_THREADS, ENV_IO_THREADS, DEFAULT_IO_THREADS);
            }
            if (maxRecordSizeKb == null) {
                maxRecordSizeKb = resolveInt(PROP_MAX_RECORD_SIZE_KB, ENV_MAX_RECORD_SIZE_KB,
                        DEFAULT_MAX_RECORD_SIZE_KB);
            }

            requirePositive("lockTimeoutMs", lockTimeoutMs);
            requirePositive("lockPollIntervalMs", lockPollIntervalMs);
            requirePositive("ioThreads", ioThreads);
            requirePositive("maxRecordSizeKb", maxRecordSizeKb);

            return new BookmarkStorageConfig(this);
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new ValidationException(name + " must be positive, got " + value);
            }
        }

        private String lookup(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
            return null;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value '{}' for {}, using default {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = BookmarkStorageConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
