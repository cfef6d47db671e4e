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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.bookmarkstore.error.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A single bookmark, persisted as one YAML file inside a storage root.
 * <p>
 * Instances are immutable and always valid: the canonical constructor normalises
 * and checks every field, throwing {@link ValidationException} on the first violation.
 * <ul>
 *   <li>{@code title} is stripped and never empty (max 500 chars)</li>
 *   <li>{@code keywords} holds at most 4 entries; blank entries are dropped</li>
 *   <li>{@code folderPath} never contains {@code ..} and never starts with a separator</li>
 *   <li>{@code deletedAt} is non-null if and only if {@code deleted} is true</li>
 * </ul>
 * {@code createdAt} is null only for legacy files written without it.
 *
 * @param id             unique id within a root, never reassigned; also the file name stem
 * @param url            absolute http(s) URL
 * @param title          display title
 * @param keywords       ordered keywords, priority first
 * @param tags           ordered user tags
 * @param description    free-form notes
 * @param folderPath     relative folder, e.g. {@code development/java}
 * @param createdAt      creation time
 * @param lastModified   last edit time
 * @param lastAccessed   last access time
 * @param deleted        soft-delete flag
 * @param deletedAt      soft-delete time
 * @param faviconPath    relative favicon asset path (opaque)
 * @param screenshotPath relative screenshot asset path (opaque)
 * @param storageRoot    name of the owning storage root
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Bookmark(
        @JsonProperty("id") String id,
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("description") String description,
        @JsonProperty("folder_path") String folderPath,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_modified") Instant lastModified,
        @JsonProperty("last_accessed") Instant lastAccessed,
        @JsonProperty("deleted") boolean deleted,
        @JsonProperty("deleted_at") Instant deletedAt,
        @JsonProperty("favicon_path") String faviconPath,
        @JsonProperty("screenshot_path") String screenshotPath,
        @JsonProperty("storage_root") @JsonAlias("storage_location") String storageRoot
) {

    public static final int MAX_KEYWORDS = 4;
    public static final int MAX_TITLE_LENGTH = 500;
    public static final int MAX_DESCRIPTION_LENGTH = 5000;

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    public Bookmark {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Bookmark id cannot be empty");
        }
        if (!ID_PATTERN.matcher(id).matches()) {
            // the id doubles as the record file name
            throw new ValidationException("Bookmark id contains illegal characters: " + id);
        }
        url = checkUrl(url);
        title = checkTitle(title);
        keywords = cleanKeywords(keywords);
        tags = cleanList(tags);
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        folderPath = checkFolderPath(folderPath);
        if (deleted && deletedAt == null) {
            throw new ValidationException("Bookmark " + id + " is deleted but has no deleted_at");
        }
        if (!deleted && deletedAt != null) {
            throw new ValidationException("Bookmark " + id + " has deleted_at but is not deleted");
        }
        if (storageRoot == null || storageRoot.isBlank()) {
            throw new ValidationException("Bookmark " + id + " has no storage root");
        }
    }

    /**
     * Checks a folder path against directory traversal.
     *
     * @return the stripped path, or null when blank
     * @throws ValidationException if the path contains {@code ..} or starts with a separator
     */
    public static String checkFolderPath(String folderPath) {
        if (folderPath == null) {
            return null;
        }
        String stripped = folderPath.strip();
        if (stripped.contains("..") || stripped.startsWith("/") || stripped.startsWith("\\")) {
            throw new ValidationException(
                    "Folder path cannot contain '..' or start with / or \\ (directory traversal): " + folderPath);
        }
        return stripped.isEmpty() ? null : stripped;
    }

    private static String checkTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Title cannot be empty or whitespace");
        }
        String stripped = title.strip();
        if (stripped.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("Title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        return stripped;
    }

    private static String checkUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("URL cannot be empty");
        }
        String stripped = url.strip();
        try {
            URI uri = new URI(stripped);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new ValidationException("URL must use http or https: " + url);
            }
            if (uri.getHost() == null) {
                throw new ValidationException("URL has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL: " + url, e);
        }
        return stripped;
    }

    private static List<String> cleanKeywords(List<String> keywords) {
        if (keywords != null && keywords.size() > MAX_KEYWORDS) {
            throw new ValidationException("Maximum " + MAX_KEYWORDS + " keywords allowed, got " + keywords.size());
        }
        return cleanList(keywords);
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                cleaned.add(value.strip());
            }
        }
        return List.copyOf(cleaned);
    }

    /** Starts an empty builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Starts a builder pre-filled with this bookmark's fields. */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .url(url)
                .title(title)
                .keywords(keywords)
                .tags(tags)
                .description(description)
                .folderPath(folderPath)
                .createdAt(createdAt)
                .lastModified(lastModified)
                .lastAccessed(lastAccessed)
                .deleted(deleted)
                .deletedAt(deletedAt)
                .faviconPath(faviconPath)
                .screenshotPath(screenshotPath)
                .storageRoot(storageRoot);
    }

    /**
     * Builder for {@link Bookmark}. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private String id;
        private String url;
        private String title;
        private List<String> keywords = List.of();
        private List<String> tags = List.of();
        private String description;
        private String folderPath;
        private Instant createdAt;
        private Instant lastModified;
        private Instant lastAccessed;
        private boolean deleted;
        private Instant deletedAt;
        private String faviconPath;
        private String screenshotPath;
        private String storageRoot;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder folderPath(String folderPath) {
            this.folderPath = folderPath;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastModified(Instant lastModified) {
            this.lastModified = lastModified;
            return this;
        }

        public Builder lastAccessed(Instant lastAccessed) {
            this.lastAccessed = lastAccessed;
            return this;
        }

        public Builder deleted(boolean deleted) {
            this.deleted = deleted;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Builder faviconPath(String faviconPath) {
            this.faviconPath = faviconPath;
            return this;
        }

        public Builder screenshotPath(String screenshotPath) {
            this.screenshotPath = screenshotPath;
            return this;
        }

        public Builder storageRoot(String storageRoot) {
            this.storageRoot = storageRoot;
            return this;
        }

        public Bookmark build() {
            return new Bookmark(id, url, title, keywords, tags, description, folderPath,
                    createdAt, lastModified, lastAccessed, deleted, deletedAt,
                    faviconPath, screenshotPath, storageRoot);
        }
    }
}
