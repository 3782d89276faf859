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

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.IvParameterSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ChaCha20-Poly1305, used by {@link Scheme.Format#V2}. The version tag is authenticated as associated data. The
 * cipher output is split so that the ciphertext goes in the item's ciphertext field and the 16-byte Poly1305 tag in
 * its salt field, with the nonce in the IV field.
 */
final class ChaChaPolyCipher {
    private static final Logger logger = LoggerFactory.getLogger(ChaChaPolyCipher.class);

    static EncryptedItem encrypt(byte[] plaintext, EncryptionKey key, byte[] nonce) {
        var scheme = key.scheme();
        var version = scheme.version();
        var cipher = init(Cipher.ENCRYPT_MODE, key, nonce);
        cipher.updateAAD(version.tag());

        byte[] sealed;
        try {
            sealed = cipher.doFinal(plaintext);
        } catch (IllegalBlockSizeException | BadPaddingException e) {
            throw new IllegalStateException(e);
        }

        int split = sealed.length - scheme.authenticationTagSize();
        var ciphertext = Arrays.copyOfRange(sealed, 0, split);
        var tag = Arrays.copyOfRange(sealed, split, sealed.length);
        return new EncryptedItem(version, nonce.clone(), ciphertext, tag);
    }

    static byte[] decrypt(EncryptedItem item, EncryptionKey key) throws DecryptionFailedException {
        var cipher = init(Cipher.DECRYPT_MODE, key, item.iv());
        cipher.updateAAD(item.version().tag());
        try {
            return cipher.doFinal(Utils.concat(item.ciphertext(), item.salt()));
        } catch (AEADBadTagException e) {
            logger.debug("Authentication tag did not verify for {}", item);
            throw new DecryptionFailedException();
        } catch (IllegalBlockSizeException | BadPaddingException e) {
            logger.debug("Decryption of {} failed", item);
            throw new DecryptionFailedException();
        }
    }

    private static Cipher init(int mode, EncryptionKey key, byte[] nonce) {
        var scheme = key.scheme();
        try (var secretKey = key.toSecretKey()) {
            var cipher = Cipher.getInstance(scheme.cipherTransformation());
            cipher.init(mode, secretKey, new IvParameterSpec(nonce));
            return cipher;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("JVM doesn't support " + scheme.cipherTransformation(), e);
        }
    }

    private ChaChaPolyCipher() {}
}
