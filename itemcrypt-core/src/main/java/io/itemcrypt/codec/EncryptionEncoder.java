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

import io.itemcrypt.EncryptedItem;
import io.itemcrypt.EncryptionKey;
import io.itemcrypt.EncryptionSerialization;
import io.itemcrypt.NoPasswordException;
import io.itemcrypt.Scheme;

/**
 * Encodes values with a {@link ValueCodec} and encrypts the result.
 */
public final class EncryptionEncoder {
    private final Scheme scheme;

    public EncryptionEncoder() {
        this(Scheme.DEFAULT);
    }

    /**
     * Creates an encoder that encrypts with the given scheme whenever a password is used.
     *
     * @param scheme the scheme to use for password-based encryption.
     */
    public EncryptionEncoder(Scheme scheme) {
        this.scheme = requireNonNull(scheme, "scheme");
    }

    public Scheme scheme() {
        return scheme;
    }

    /**
     * Encodes a value and encrypts it with a new random key derived from the password.
     *
     * @param value the value.
     * @param codec the codec to encode the value with.
     * @param password the password. It is not retained beyond this call.
     * @param <T> the type of value.
     * @return the encrypted item.
     * @throws NoPasswordException if the password is null or empty.
     */
    public <T> EncryptedItem encode(T value, ValueCodec<? super T> codec, String password) {
        return EncryptionSerialization.encryptedItem(codec.encode(value), password, scheme);
    }

    /**
     * Encodes a value and encrypts it with the given key. The key's own scheme is used, whatever scheme this
     * encoder was created with.
     *
     * @param value the value.
     * @param codec the codec to encode the value with.
     * @param key the key.
     * @param <T> the type of value.
     * @return the encrypted item.
     */
    public <T> EncryptedItem encode(T value, ValueCodec<? super T> codec, EncryptionKey key) {
        return EncryptionSerialization.encryptedItem(codec.encode(value), key);
    }
}
