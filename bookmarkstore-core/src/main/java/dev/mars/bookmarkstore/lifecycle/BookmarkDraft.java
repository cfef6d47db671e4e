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

import java.util.List;

/**
 * User-supplied content for a new bookmark. Identity, timestamps and the owning
 * root are assigned by {@link BookmarkLifecycle#create(BookmarkDraft, String)}.
 *
 * @param url            absolute http(s) URL
 * @param title          display title
 * @param keywords       up to four keywords, priority first
 * @param tags           user tags
 * @param description    free-form notes
 * @param folderPath     relative folder
 * @param faviconPath    relative favicon asset path
 * @param screenshotPath relative screenshot asset path
 */
public record BookmarkDraft(
        String url,
        String title,
        List<String> keywords,
        List<String> tags,
        String description,
        String folderPath,
        String faviconPath,
        String screenshotPath
) {

    public static Builder builder(String url, String title) {
        return new Builder(url, title);
    }

    public static final class Builder {
        private final String url;
        private final String title;
        private List<String> keywords = List.of();
        private List<String> tags = List.of();
        private String description;
        private String folderPath;
        private String faviconPath;
        private String screenshotPath;

        private Builder(String url, String title) {
            this.url = url;
            this.title = title;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder keywords(String... keywords) {
            return keywords(List.of(keywords));
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

        public Builder faviconPath(String faviconPath) {
            this.faviconPath = faviconPath;
            return this;
        }

        public Builder screenshotPath(String screenshotPath) {
            this.screenshotPath = screenshotPath;
            return this;
        }

        public BookmarkDraft build() {
            return new BookmarkDraft(url, title, keywords, tags, description,
                    folderPath, faviconPath, screenshotPath);
        }
    }
}
