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

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.itemcrypt.Scheme.Format;

/**
 * Dispatches encryption and decryption to the cipher of the key's scheme. Every operation first validates that the
 * key and item agree on the format version, then transforms the data; any failure after that point is reported as
 * a single {@link DecryptionFailedException}.
 */
final class CipherEngine {
    private static final Logger logger = LoggerFactory.getLogger(CipherEngine.class);

    /**
     * Encrypts the plaintext with the key.
     *
     * @param nonce the nonce to use for {@link Format#V2}. Ignored by {@link Format#V1}, which uses the key's IV.
     */
    static EncryptedItem encrypt(byte[] plaintext, EncryptionKey key, byte[] nonce) {
        requireNonNull(plaintext, "plaintext");
        var version = requireNonNull(key, "key").scheme().version();
        logger.debug("Encrypting {} bytes with {}", plaintext.length, version);
        return switch (version) {
            case V1 -> AesCbcCipher.encrypt(plaintext, key);
            case V2 -> ChaChaPolyCipher.encrypt(plaintext, key, requireNonNull(nonce, "nonce"));
        };
    }

    static byte[] decrypt(EncryptedItem item, EncryptionKey key) throws DecryptionFailedException {
        requireNonNull(item, "item");
        checkVersion(item.version(), requireNonNull(key, "key"));
        logger.debug("Decrypting {}", item);
        return switch (item.version()) {
            case V1 -> AesCbcCipher.decrypt(item, key);
            case V2 -> ChaChaPolyCipher.decrypt(item, key);
        };
    }

    static void encryptStream(InputStream in, EncryptionKey key, OutputStream out) throws IOException {
        checkStreaming(key);
        try {
            AesCbcCipher.crypt(Cipher.ENCRYPT_MODE, key, key.initializationVector(), in, out);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new IllegalStateException("Encryption cannot fail to pad", e);
        }
    }

    static void decryptStream(InputStream in, EncryptionKey key, OutputStream out)
            throws IOException, DecryptionFailedException {
        checkStreaming(key);
        try {
            AesCbcCipher.crypt(Cipher.DECRYPT_MODE, key, key.initializationVector(), in, out);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            logger.debug("Stream decryption failed");
            throw new DecryptionFailedException();
        }
    }

    static void checkVersion(Format itemVersion, EncryptionKey key) {
        var keyVersion = key.scheme().version();
        if (itemVersion != keyVersion) {
            logger.debug("Refusing to decrypt {} item with {} key", itemVersion, keyVersion);
            throw new IncorrectVersionException(itemVersion, keyVersion);
        }
    }

    private static void checkStreaming(EncryptionKey key) {
        if (!requireNonNull(key, "key").scheme().supportsStreaming()) {
            throw new UnsupportedOperationException(
                    "Stream operations are not supported by " + key.scheme().version());
        }
    }

    private CipherEngine() {}
}
