/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.itemcrypt;

import static java.util.Objects.requireNonNull;

/**
 * Indicates that some key material was of the wrong size or format for the requested {@link Scheme}. The
 * {@linkplain #kind() kind} names the input that was malformed.
 */
public final class ImproperKeyException extends IllegalArgumentException {

    public enum Kind {
        SEED_SIZE("seed"),
        SALT_SIZE("salt"),
        INITIALIZATION_VECTOR_SIZE("initialization vector"),
        MALFORMED_DATA("key data");

        private final String field;

        Kind(String field) {
            this.field = field;
        }
    }

    private final Kind kind;
    private final int expected;
    private final int actual;

    ImproperKeyException(Kind kind, int expected, int actual) {
        super("Invalid " + requireNonNull(kind).field + " size: expected " + expected + " bytes, got " + actual);
        this.kind = kind;
        this.expected = expected;
        this.actual = actual;
    }

    ImproperKeyException(String message) {
        super(message);
        this.kind = Kind.MALFORMED_DATA;
        this.expected = -1;
        this.actual = -1;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The size in bytes the scheme requires, or -1 for {@link Kind#MALFORMED_DATA}.
     */
    public int expected() {
        return expected;
    }

    /**
     * The size in bytes that was supplied, or -1 for {@link Kind#MALFORMED_DATA}.
     */
    public int actual() {
        return actual;
    }
}
