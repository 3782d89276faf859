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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.itemcrypt.ImproperKeyException.Kind;
import io.itemcrypt.Scheme.Format;
import software.pando.crypto.nacl.Bytes;

/**
 * A symmetric key derived from a password, together with the non-secret materials needed to derive it again: the
 * stretched salt and the initialization vector. Neither the salt nor the IV is secret, and both travel alongside
 * the ciphertext in an {@link EncryptedItem}, so that the password alone is enough to recover the key later.
 * <p>
 * Keys are immutable. Two keys are equal when their scheme, IV, salt and key data are all equal; the optional
 * {@linkplain #context() context} label takes no part in equality.
 */
public final class EncryptionKey {
    private static final Logger logger = LoggerFactory.getLogger(EncryptionKey.class);

    private final Scheme scheme;
    private final byte[] keyData;
    private final byte[] initializationVector;
    private final byte[] salt;
    private final String context;

    private EncryptionKey(Scheme scheme, byte[] keyData, byte[] initializationVector, byte[] salt, String context) {
        this.scheme = requireNonNull(scheme, "scheme");
        this.keyData = keyData;
        this.initializationVector = initializationVector;
        this.salt = salt;
        this.context = context;
    }

    /**
     * Derives a new key from the given password with a fresh random seed and IV. Calling this twice with the same
     * arguments produces two different keys.
     *
     * @param password the raw password. It is normalized before use.
     * @param keywords contextual values (an account identifier, an email address) to bind to the key, in order.
     * @param scheme the scheme to derive the key for.
     * @return the new key.
     */
    public static EncryptionKey random(String password, List<String> keywords, Scheme scheme) {
        var seed = EncryptionSerialization.randomBytes(scheme.seedSize());
        var iv = EncryptionSerialization.randomBytes(scheme.initializationVectorSize());
        return derive(password, seed, iv, keywords, scheme);
    }

    /**
     * Derives a key from a password and a seed. The seed is stretched with the keywords into the salt, which is then
     * used by {@link #rederive(String, byte[], byte[], Scheme)}.
     *
     * @param password the raw password. It is normalized before use.
     * @param seed a non-secret seed of {@link Scheme#seedSize()} bytes.
     * @param iv a non-secret initialization vector of {@link Scheme#initializationVectorSize()} bytes.
     * @param keywords contextual values to bind to the key, in order.
     * @param scheme the scheme to derive the key for.
     * @return the key.
     * @throws ImproperKeyException if the seed or IV are the wrong size for the scheme.
     */
    public static EncryptionKey derive(String password, byte[] seed, byte[] iv, List<String> keywords,
            Scheme scheme) {
        var treatedSalt = KeyDerivation.stretchSalt(seed, keywords, scheme);
        return rederive(password, treatedSalt, iv, scheme);
    }

    /**
     * Derives a key from a password and an already stretched salt, as previously taken from an {@link EncryptionKey}
     * or an {@link EncryptedItem}. The same password, salt and IV always produce an equal key.
     *
     * @param password the raw password. It is normalized before use.
     * @param treatedSalt the stretched salt of {@link Scheme#stretchedSaltSize()} bytes.
     * @param iv the initialization vector of {@link Scheme#initializationVectorSize()} bytes.
     * @param scheme the scheme to derive the key for.
     * @return the key.
     * @throws ImproperKeyException if the salt or IV are the wrong size for the scheme.
     */
    public static EncryptionKey rederive(String password, byte[] treatedSalt, byte[] iv, Scheme scheme) {
        requireNonNull(password, "password");
        if (requireNonNull(treatedSalt, "treatedSalt").length != scheme.stretchedSaltSize()) {
            logger.debug("Salt was the wrong size <{}> for the encryption scheme <{}>", treatedSalt.length,
                    scheme.stretchedSaltSize());
            throw new ImproperKeyException(Kind.SALT_SIZE, scheme.stretchedSaltSize(), treatedSalt.length);
        }
        if (requireNonNull(iv, "iv").length != scheme.initializationVectorSize()) {
            logger.debug("IV was the wrong size <{}> for the encryption scheme <{}>", iv.length,
                    scheme.initializationVectorSize());
            throw new ImproperKeyException(Kind.INITIALIZATION_VECTOR_SIZE, scheme.initializationVectorSize(),
                    iv.length);
        }

        var keyData = KeyDerivation.keyData(KeyDerivation.normalizePassword(password), treatedSalt, scheme);
        return new EncryptionKey(scheme, keyData, iv.clone(), treatedSalt.clone(), null);
    }

    /**
     * Reconstructs a key from its {@linkplain #rawData() raw representation}.
     *
     * @param data the raw key data.
     * @return the key.
     * @throws ImproperKeyException if the data is not a valid raw key of any known scheme.
     */
    public static EncryptionKey fromRawData(byte[] data) {
        requireNonNull(data, "data");
        var version = Format.fromTag(data)
                .orElseThrow(() -> new ImproperKeyException("Unrecognized key version"));
        var scheme = Scheme.of(version);

        int keyLength = scheme.derivedKeyLength();
        int ivLength = scheme.initializationVectorSize();
        int saltLength = scheme.stretchedSaltSize();
        int expected = Format.TAG_SIZE + keyLength + ivLength + saltLength;
        if (data.length != expected) {
            throw new ImproperKeyException(Kind.MALFORMED_DATA, expected, data.length);
        }

        int offset = Format.TAG_SIZE;
        var keyData = Arrays.copyOfRange(data, offset, offset + keyLength);
        offset += keyLength;
        var iv = Arrays.copyOfRange(data, offset, offset + ivLength);
        offset += ivLength;
        var salt = Arrays.copyOfRange(data, offset, offset + saltLength);
        return new EncryptionKey(scheme, keyData, iv, salt, null);
    }

    /**
     * Returns a copy of this key carrying the given context label.
     *
     * @param context a label identifying the key, such as an account identifier, or {@code null} to remove it.
     * @return the labelled key.
     */
    public EncryptionKey withContext(String context) {
        return new EncryptionKey(scheme, keyData, initializationVector, salt, context);
    }

    public Scheme scheme() {
        return scheme;
    }

    /**
     * Returns a copy of the secret key data. Callers should wipe the copy once they are done with it.
     */
    public byte[] keyData() {
        return keyData.clone();
    }

    public byte[] initializationVector() {
        return initializationVector.clone();
    }

    public byte[] salt() {
        return salt.clone();
    }

    public Optional<String> context() {
        return Optional.ofNullable(context);
    }

    /**
     * The key as a single block of bytes: {@code version_tag || keyData || iv || salt}. This contains the secret
     * key, so keep it somewhere secure.
     *
     * @return the raw key data.
     */
    public byte[] rawData() {
        return Utils.concat(scheme.version().tag(), keyData, initializationVector, salt);
    }

    DestroyableSecretKey toSecretKey() {
        return new DestroyableSecretKey(keyData, scheme.cipherKeyAlgorithm());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof EncryptionKey that)) { return false; }
        return scheme.equals(that.scheme)
                && Arrays.equals(initializationVector, that.initializationVector)
                && Arrays.equals(salt, that.salt)
                && Bytes.equal(keyData, that.keyData);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(scheme);
        result = 31 * result + Arrays.hashCode(initializationVector);
        result = 31 * result + Arrays.hashCode(salt);
        result = 31 * result + Arrays.hashCode(maskedKeyData());
        return result;
    }

    private byte[] maskedKeyData() {
        try {
            return MessageDigest.getInstance("SHA-256").digest(keyData);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return "EncryptionKey{" +
                "scheme=" + scheme +
                ", context=" + context +
                ", bits=" + keyData.length * 8 +
                '}';
    }
}
