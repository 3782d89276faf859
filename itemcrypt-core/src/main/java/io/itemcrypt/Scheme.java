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

import java.util.Arrays;
import java.util.Optional;

/**
 * An encryption scheme is the complete set of algorithm choices and parameter sizes used to derive keys and to
 * encrypt data for one version of the {@link EncryptedItem} container format. Every parameter is a pure function of
 * the {@linkplain #version() version}, so two schemes are equal exactly when their versions are equal.
 * <p>
 * Two versions are currently supported side by side:
 * <ul>
 *     <li>{@link Format#V1} stretches the password with PBKDF2-HMAC-SHA-256 and encrypts with AES-256 in CBC mode
 *     with PKCS#7 padding. The container carries the IV and the stretched salt.</li>
 *     <li>{@link Format#V2} uses the same key derivation but encrypts with ChaCha20-Poly1305. The container's IV
 *     field carries the 96-bit nonce and the salt field carries the 128-bit authentication tag.</li>
 * </ul>
 */
public final class Scheme {

    /**
     * The versions of the encrypted data format. Each version is identified on the wire by a distinct tag of
     * {@link #TAG_SIZE} bytes that always starts the serialized form.
     */
    public enum Format {
        V1(new byte[] { 0, 0, 1 }),
        V2(new byte[] { 0, 0, 2 });

        /**
         * The width in bytes of every version tag.
         */
        public static final int TAG_SIZE = 3;

        private final byte[] tag;

        Format(byte[] tag) {
            assert tag.length == TAG_SIZE;
            this.tag = tag;
        }

        /**
         * Returns the tag bytes that identify this version on the wire.
         *
         * @return a fresh copy of the tag.
         */
        public byte[] tag() {
            return tag.clone();
        }

        /**
         * Attempts to recognize a version from the first {@link #TAG_SIZE} bytes of the given buffer.
         *
         * @param prefix the start of some serialized data. Any bytes after the tag are ignored.
         * @return the recognized version, or an empty result if the prefix is too short or matches no known tag.
         */
        public static Optional<Format> fromTag(byte[] prefix) {
            requireNonNull(prefix, "prefix");
            if (prefix.length < TAG_SIZE) {
                return Optional.empty();
            }
            for (var format : values()) {
                if (Arrays.equals(format.tag, 0, TAG_SIZE, prefix, 0, TAG_SIZE)) {
                    return Optional.of(format);
                }
            }
            return Optional.empty();
        }
    }

    private static final Scheme V1 = new Scheme(Format.V1);
    private static final Scheme V2 = new Scheme(Format.V2);

    /**
     * The scheme most data is expected to use.
     */
    public static final Scheme DEFAULT = V1;

    /**
     * The newest scheme.
     */
    public static final Scheme LATEST = V2;

    private final Format version;

    private Scheme(Format version) {
        this.version = version;
    }

    /**
     * Returns the scheme for the given format version.
     *
     * @param version the format version.
     * @return the scheme.
     */
    public static Scheme of(Format version) {
        return switch (requireNonNull(version, "version")) {
            case V1 -> V1;
            case V2 -> V2;
        };
    }

    public Format version() {
        return version;
    }

    /**
     * The JCA name of the password-based key derivation function.
     */
    public String passwordKdfAlgorithm() {
        return switch (version) {
            case V1, V2 -> "PBKDF2WithHmacSHA256";
        };
    }

    /**
     * The JCA name of the MAC used to mix the seed with any context keywords.
     */
    public String hmacAlgorithm() {
        return switch (version) {
            case V1, V2 -> "HmacSHA256";
        };
    }

    public int derivedKeyLength() {
        return switch (version) {
            case V1, V2 -> 32;
        };
    }

    /**
     * The size of the buffer used when streaming data through the cipher.
     */
    public int bufferSize() {
        return switch (version) {
            case V1, V2 -> 1024;
        };
    }

    public int seedSize() {
        return switch (version) {
            case V1 -> 16;
            case V2 -> 12;
        };
    }

    public int initializationVectorSize() {
        return switch (version) {
            case V1 -> 16;
            case V2 -> 12;
        };
    }

    /**
     * The size of the salt produced by stretching a seed, which is the output length of the {@linkplain
     * #hmacAlgorithm() HMAC}.
     */
    public int stretchedSaltSize() {
        return switch (version) {
            case V1, V2 -> 32;
        };
    }

    public int iterations() {
        return switch (version) {
            case V1, V2 -> 100_000;
        };
    }

    /**
     * The JCA transformation used to encrypt data.
     */
    public String cipherTransformation() {
        return switch (version) {
            case V1 -> "AES/CBC/PKCS5Padding";
            case V2 -> "ChaCha20-Poly1305";
        };
    }

    /**
     * The JCA key algorithm the derived key data is used as.
     */
    public String cipherKeyAlgorithm() {
        return switch (version) {
            case V1 -> "AES";
            case V2 -> "ChaCha20";
        };
    }

    /**
     * The size of the authentication tag appended by the cipher, or 0 if the cipher is not authenticated.
     */
    public int authenticationTagSize() {
        return switch (version) {
            case V1 -> 0;
            case V2 -> 16;
        };
    }

    /**
     * The width of the IV field of an {@link EncryptedItem} of this version.
     */
    public int ivFieldSize() {
        return initializationVectorSize();
    }

    /**
     * The width of the trailing salt field of an {@link EncryptedItem} of this version. For {@link Format#V2} this
     * field holds the authentication tag rather than a salt.
     */
    public int saltFieldSize() {
        return switch (version) {
            case V1 -> stretchedSaltSize();
            case V2 -> authenticationTagSize();
        };
    }

    /**
     * Whether data can be encrypted and decrypted incrementally with this scheme. Authenticated schemes have to see
     * the whole message before the tag can be produced or checked.
     */
    public boolean supportsStreaming() {
        return switch (version) {
            case V1 -> true;
            case V2 -> false;
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Scheme that)) { return false; }
        return this.version == that.version;
    }

    @Override
    public int hashCode() {
        return version.hashCode();
    }

    @Override
    public String toString() {
        return "Scheme{" + version + '}';
    }
}
