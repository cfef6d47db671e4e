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

import java.io.IOException;

/**
 * Raised by {@link BookmarkCodec} when bytes cannot become a bookmark or the other way round.
 * <p>
 * {@link Kind} separates corrupt files from well-formed but incomplete ones.
 */
public class CodecException extends IOException {

    /**
     * Failure kind.
     */
    public enum Kind {
        /** The bytes are not a valid bookmark document. */
        MALFORMED,
        /** Well-formed document lacking one or more required fields. */
        MISSING_FIELD,
        /** The bookmark could not be serialized. */
        ENCODE_FAILED
    }

    private final Kind kind;

    public CodecException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CodecException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
