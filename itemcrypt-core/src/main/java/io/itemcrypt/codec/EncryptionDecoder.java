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

package io.itemcrypt.codec;

import static java.util.Objects.requireNonNull;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.itemcrypt.DecryptionFailedException;
import io.itemcrypt.EncryptedItem;
import io.itemcrypt.EncryptionKey;
import io.itemcrypt.EncryptionSerialization;

/**
 * Decrypts items and decodes the result with a {@link ValueCodec}. The codec only ever sees data that decrypted
 * successfully.
 */
public final class EncryptionDecoder {
    private static final Logger logger = LoggerFactory.getLogger(EncryptionDecoder.class);

    /**
     * Decrypts the item with a key derived from the password and decodes the result.
     *
     * @throws DecryptionFailedException if the password is wrong or the item is corrupted.
     * @throws IOException if the decrypted data is not a valid encoding for the codec.
     */
    public <T> T decode(EncryptedItem item, ValueCodec<? extends T> codec, String password)
            throws DecryptionFailedException, IOException {
        requireNonNull(codec, "codec");
        return decodeWith(codec, EncryptionSerialization.data(item, password));
    }

    /**
     * Decrypts the item with the key and decodes the result.
     *
     * @throws io.itemcrypt.IncorrectVersionException if the key's scheme does not match the item.
     * @throws DecryptionFailedException if the key is wrong or the item is corrupted.
     * @throws IOException if the decrypted data is not a valid encoding for the codec.
     */
    public <T> T decode(EncryptedItem item, ValueCodec<? extends T> codec, EncryptionKey key)
            throws DecryptionFailedException, IOException {
        requireNonNull(codec, "codec");
        return decodeWith(codec, EncryptionSerialization.data(item, key));
    }

    private static <T> T decodeWith(ValueCodec<? extends T> codec, byte[] data) throws IOException {
        try {
            return codec.decode(data);
        } catch (IOException e) {
            logger.debug("Decrypted {} bytes could not be decoded", data.length);
            throw new IOException("Decrypted data could not be decoded, the key may be incorrect", e);
        }
    }
}
