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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.ShortBufferException;
import javax.crypto.spec.IvParameterSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256 in CBC mode with PKCS#7 padding, used by {@link Scheme.Format#V1}. Data is pushed through the cipher in
 * chunks of {@link Scheme#bufferSize()} bytes so that arbitrarily large streams never need to be held in memory.
 * This construction is not authenticated: a wrong key is only noticed when the final block fails to unpad.
 */
final class AesCbcCipher {
    private static final Logger logger = LoggerFactory.getLogger(AesCbcCipher.class);

    static EncryptedItem encrypt(byte[] plaintext, EncryptionKey key) {
        var out = new ByteArrayOutputStream(plaintext.length + 16);
        var iv = key.initializationVector();
        try {
            crypt(Cipher.ENCRYPT_MODE, key, iv, new ByteArrayInputStream(plaintext), out);
        } catch (IOException e) {
            // In-memory streams do not fail
            throw new UncheckedIOException(e);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new IllegalStateException("Encryption cannot fail to pad", e);
        }
        return new EncryptedItem(key.scheme().version(), iv, out.toByteArray(), key.salt());
    }

    static byte[] decrypt(EncryptedItem item, EncryptionKey key) throws DecryptionFailedException {
        var out = new ByteArrayOutputStream(item.ciphertext().length);
        try {
            crypt(Cipher.DECRYPT_MODE, key, item.iv(), new ByteArrayInputStream(item.ciphertext()), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            logger.debug("Decryption of {} failed", item);
            throw new DecryptionFailedException();
        }
        return out.toByteArray();
    }

    /**
     * Runs the read-transform-write loop: reads up to one buffer of input at a time, writes whatever the cipher
     * produces, and finalizes the cipher once the input is exhausted. Neither stream is closed.
     */
    static void crypt(int mode, EncryptionKey key, byte[] iv, InputStream in, OutputStream out)
            throws IOException, BadPaddingException, IllegalBlockSizeException {
        var scheme = key.scheme();
        var cipher = init(mode, key, iv);
        var inputBuffer = new byte[scheme.bufferSize()];
        var outputBuffer = new byte[cipher.getOutputSize(scheme.bufferSize()) + cipher.getBlockSize()];

        long total = 0;
        try {
            int read;
            while ((read = in.read(inputBuffer)) != -1) {
                int produced = cipher.update(inputBuffer, 0, read, outputBuffer);
                out.write(outputBuffer, 0, produced);
                total += read;
            }
            if (mode == Cipher.DECRYPT_MODE && total == 0) {
                // PKCS#7 output is never empty
                throw new IllegalBlockSizeException("No ciphertext to decrypt");
            }
            int produced = cipher.doFinal(outputBuffer, 0);
            out.write(outputBuffer, 0, produced);
        } catch (ShortBufferException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(inputBuffer, outputBuffer);
        }
        logger.trace("Processed {} bytes (mode={})", total, mode);
    }

    private static Cipher init(int mode, EncryptionKey key, byte[] iv) {
        var scheme = key.scheme();
        try (var secretKey = key.toSecretKey()) {
            var cipher = Cipher.getInstance(scheme.cipherTransformation());
            cipher.init(mode, secretKey, new IvParameterSpec(iv));
            return cipher;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("JVM doesn't support " + scheme.cipherTransformation(), e);
        }
    }

    private AesCbcCipher() {}
}
