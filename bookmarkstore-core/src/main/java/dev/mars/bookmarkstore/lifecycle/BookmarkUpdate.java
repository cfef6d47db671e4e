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
package dev.mars.bookmarkstore.lifecycle;

import dev.mars.bookmarkstore.model.Bookmark;

import java.util.List;

/**
 * Partial edit of a bookmark. Only fields set on the builder are applied.
 */
public final class BookmarkUpdate {

    private final String title;
    private final String url;
    private final String description;
    private final List<String> keywords;
    private final List<String> tags;
    private final String folderPath;

    private BookmarkUpdate(Builder b) {
        this.title = b.title;
        this.url = b.url;
        this.description = b.description;
        this.keywords = b.keywords;
        this.tags = b.tags;
        this.folderPath = b.folderPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns true if no field is set. */
    public boolean isEmpty() {
        return title == null && url == null && description == null
                && keywords == null && tags == null && folderPath == null;
    }

    /**
     * Copies the overrides onto a bookmark builder. Identity and timestamps are left alone.
     */
    Bookmark.Builder applyTo(Bookmark.Builder target) {
        if (title != null) {
            target.title(title);
        }
        if (url != null) {
            target.url(url);
        }
        if (description != null) {
            target.description(description);
        }
        if (keywords != null) {
            target.keywords(keywords);
        }
        if (tags != null) {
            target.tags(tags);
        }
        if (folderPath != null) {
            target.folderPath(folderPath);
        }
        return target;
    }

    @Override
    public String toString() {
        return "BookmarkUpdate{title=" + title + ", url=" + url + ", keywords=" + keywords
                + ", tags=" + tags + ", folderPath=" + folderPath
                + ", description=" + (description == null ? null : description.length() + " chars") + "}";
    }

    public static final class Builder {
        private String title;
        private String url;
        private String description;
        private List<String> keywords;
        private List<String> tags;
        private String folderPath;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
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

        public Builder folderPath(String folderPath) {
            this.folderPath = folderPath;
            return this;
        }

        public BookmarkUpdate build() {
            return new BookmarkUpdate(this);
        }
    }
}
