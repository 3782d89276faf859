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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.pando.crypto.nacl.Bytes;

/**
 * The entry point for encrypting and decrypting raw blocks of data. Use
 * {@link io.itemcrypt.codec.EncryptionEncoder} and {@link io.itemcrypt.codec.EncryptionDecoder} to work with typed
 * values instead.
 * <p>
 * Encrypting with a password derives a fresh key from a random seed for every item. The non-secret materials needed
 * to derive that key again are stored in the item, so the same password is all that is needed to decrypt it:
 * <ul>
 *     <li>{@link Scheme.Format#V1} items carry the stretched salt and IV of the key.</li>
 *     <li>{@link Scheme.Format#V2} items use the seed as the cipher nonce, which is carried in the IV field. The key
 *     is derived again from that seed.</li>
 * </ul>
 * All methods are thread-safe.
 */
public final class EncryptionSerialization {
    private static final Logger logger = LoggerFactory.getLogger(EncryptionSerialization.class);

    /**
     * Returns cryptographically random bytes.
     *
     * @param count the number of bytes to generate.
     * @return the random bytes.
     */
    public static byte[] randomBytes(int count) {
        return Bytes.secureRandom(count);
    }

    /**
     * Encrypts data with a new random key derived from the password.
     *
     * @param data the data to encrypt.
     * @param password the password. It is not retained beyond this call.
     * @param scheme the scheme to encrypt with.
     * @return the encrypted item.
     * @throws NoPasswordException if the password is null or empty.
     */
    public static EncryptedItem encryptedItem(byte[] data, String password, Scheme scheme) {
        requireNonNull(data, "data");
        requireNonNull(scheme, "scheme");
        checkPassword(password);

        var seed = randomBytes(scheme.seedSize());
        var key = switch (scheme.version()) {
            case V1 -> EncryptionKey.derive(password, seed, randomBytes(scheme.initializationVectorSize()),
                    List.of(), scheme);
            case V2 -> EncryptionKey.derive(password, seed, seed, List.of(), scheme);
        };
        return CipherEngine.encrypt(data, key, seed);
    }

    /**
     * Encrypts data with the given key. For {@link Scheme.Format#V2} keys a fresh random nonce is drawn for every
     * call.
     *
     * @param data the data to encrypt.
     * @param key the key. This or an equal key is needed to decrypt the item.
     * @return the encrypted item.
     */
    public static EncryptedItem encryptedItem(byte[] data, EncryptionKey key) {
        var nonce = randomBytes(requireNonNull(key, "key").scheme().initializationVectorSize());
        return CipherEngine.encrypt(data, key, nonce);
    }

    /**
     * Decrypts an item with a key derived from the password.
     *
     * @param item the item to decrypt.
     * @param password the password the item was encrypted with.
     * @return the decrypted data.
     * @throws NoPasswordException if the password is null or empty.
     * @throws DecryptionFailedException if the password is wrong or the item has been tampered with.
     */
    public static byte[] data(EncryptedItem item, String password) throws DecryptionFailedException {
        requireNonNull(item, "item");
        checkPassword(password);

        var scheme = Scheme.of(item.version());
        var key = switch (scheme.version()) {
            case V1 -> EncryptionKey.rederive(password, item.salt(), item.iv(), scheme);
            case V2 -> EncryptionKey.derive(password, item.iv(), item.iv(), List.of(), scheme);
        };
        return CipherEngine.decrypt(item, key);
    }

    /**
     * Decrypts an item with the given key.
     *
     * @param item the item to decrypt.
     * @param key the key the item was encrypted with.
     * @return the decrypted data.
     * @throws IncorrectVersionException if the key's scheme does not match the item's version.
     * @throws DecryptionFailedException if the key is wrong or the item has been tampered with.
     */
    public static byte[] data(EncryptedItem item, EncryptionKey key) throws DecryptionFailedException {
        return CipherEngine.decrypt(item, key);
    }

    /**
     * Encrypts everything read from the input stream into the output stream, one buffer at a time. Neither stream
     * is closed. Only schemes that {@linkplain Scheme#supportsStreaming() support streaming} can be used.
     *
     * @param in the plaintext stream.
     * @param key the key to encrypt with.
     * @param out the stream to write ciphertext to.
     * @throws IOException if either stream fails.
     * @throws UnsupportedOperationException if the key's scheme cannot stream.
     */
    public static void encryptStream(InputStream in, EncryptionKey key, OutputStream out) throws IOException {
        CipherEngine.encryptStream(requireNonNull(in, "in"), key, requireNonNull(out, "out"));
    }

    /**
     * Decrypts everything read from the input stream into the output stream, one buffer at a time. Neither stream
     * is closed. Output is written before the final block is checked, so callers must discard it if this throws.
     *
     * @param in the ciphertext stream.
     * @param key the key to decrypt with.
     * @param out the stream to write plaintext to.
     * @throws IOException if either stream fails.
     * @throws DecryptionFailedException if the final block does not unpad correctly.
     * @throws UnsupportedOperationException if the key's scheme cannot stream.
     */
    public static void decryptStream(InputStream in, EncryptionKey key, OutputStream out)
            throws IOException, DecryptionFailedException {
        CipherEngine.decryptStream(requireNonNull(in, "in"), key, requireNonNull(out, "out"));
    }

    private static void checkPassword(String password) {
        if (password == null || password.isEmpty()) {
            logger.debug("Rejecting operation without a password");
            throw new NoPasswordException();
        }
    }

    private EncryptionSerialization() {}
}
