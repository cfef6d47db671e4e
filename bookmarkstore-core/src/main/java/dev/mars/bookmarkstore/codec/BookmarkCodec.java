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
package dev.mars.bookmarkstore.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.bookmarkstore.error.BookmarkStoreException;
import dev.mars.bookmarkstore.model.Bookmark;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * YAML codec for {@link Bookmark} files.
 * <p>
 * <b>Format:</b>
 * <pre>
 * id: "550e8400-e29b-41d4-a716-446655440000"
 * url: "https://github.com/python/cpython"
 * title: "CPython Official Repository"
 * keywords:
 * - "python"
 * - "cpython"
 * tags: []
 * created_at: "2026-02-03T10:30:00Z"
 * deleted: false
 * storage_root: "work"
 * </pre>
 * Every string is written double-quoted with escapes, so text such as {@code 0x1F},
 * {@code .inf}, {@code yes} or a line break reads back exactly as written. Timestamps are
 * ISO-8601 strings; null fields are omitted. Unknown keys are ignored on read. Files
 * written with the older {@code storage_location} key are accepted.
 * <p>
 * Decoding binds scalars straight to their string fields, so hand-edited files with
 * unquoted values keep their original text.
 * <p>
 * The codec is stateless and thread-safe.
 */
public final class BookmarkCodec {

    private static final ObjectMapper YAML_MAPPER =
            new ObjectMapper(
                    new YAMLFactory()
                            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                            .disable(YAMLGenerator.Feature.SPLIT_LINES)
                            // plain and block scalars let the YAML 1.1 resolver retype or re-break text
                            .disable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                            .disable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE))
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final String LEGACY_ROOT_FIELD = "storage_location";

    private static final List<String> REQUIRED_FIELDS = List.of("id", "url", "title", "storage_root");

    /**
     * Serializes a bookmark to UTF-8 YAML.
     *
     * @throws CodecException with {@link CodecException.Kind#ENCODE_FAILED}
     */
    public byte[] encode(Bookmark bookmark) throws CodecException {
        try {
            return YAML_MAPPER.writeValueAsBytes(bookmark);
        } catch (JsonProcessingException e) {
            throw new CodecException(CodecException.Kind.ENCODE_FAILED,
                    "Failed to serialize bookmark " + bookmark.id() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a bookmark from UTF-8 YAML.
     *
     * @throws CodecException {@link CodecException.Kind#MALFORMED} if the bytes are not a
     *                        valid bookmark document, {@link CodecException.Kind#MISSING_FIELD}
     *                        if a required field is absent
     */
    public Bookmark decode(byte[] bytes) throws CodecException {
        Set<String> present = topLevelFields(bytes);

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            boolean found = present.contains(field)
                    || (field.equals("storage_root") && present.contains(LEGACY_ROOT_FIELD));
            if (!found) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new CodecException(CodecException.Kind.MISSING_FIELD,
                    "Missing required fields: " + String.join(", ", missing));
        }

        try {
            return YAML_MAPPER.readValue(bytes, Bookmark.class);
        } catch (ValueInstantiationException e) {
            // constructor rejected a field value
            Throwable cause = e.getCause() instanceof BookmarkStoreException ? e.getCause() : e;
            throw new CodecException(CodecException.Kind.MALFORMED,
                    "Invalid bookmark: " + cause.getMessage(), cause);
        } catch (JsonProcessingException e) {
            throw new CodecException(CodecException.Kind.MALFORMED,
                    "Failed to deserialize bookmark: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.MALFORMED,
                    "Failed to deserialize bookmark: " + e.getMessage(), e);
        }
    }

    /**
     * Names of the non-null top-level keys. Streams tokens without converting any scalar,
     * so numeric-looking text is never parsed here.
     *
     * @throws CodecException {@link CodecException.Kind#MALFORMED} if the document is empty,
     *                        not a mapping, or not valid YAML
     */
    private static Set<String> topLevelFields(byte[] bytes) throws CodecException {
        try (JsonParser parser = YAML_MAPPER.createParser(bytes)) {
            JsonToken first = parser.nextToken();
            if (first == null || first == JsonToken.VALUE_NULL) {
                throw new CodecException(CodecException.Kind.MALFORMED, "YAML content is empty");
            }
            if (first != JsonToken.START_OBJECT) {
                throw new CodecException(CodecException.Kind.MALFORMED,
                        "Expected a mapping at document root but found " + first);
            }

            Set<String> present = new HashSet<>();
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                JsonToken value = parser.nextToken();
                if (value != JsonToken.VALUE_NULL) {
                    present.add(name);
                }
                parser.skipChildren();
            }
            return present;
        } catch (CodecException e) {
            throw e;
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.MALFORMED, "Invalid YAML format: " + e.getMessage(), e);
        }
    }
}
