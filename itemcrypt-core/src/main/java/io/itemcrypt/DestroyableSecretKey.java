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

import javax.crypto.SecretKey;

/**
 * A raw secret key whose {@link #destroy()} method actually wipes the key bytes. The key data of an
 * {@link EncryptionKey} is copied into one of these for the duration of a single cipher or MAC operation.
 */
final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private volatile boolean destroyed = false;

    private final String algorithm;
    private final byte[] keyBytes;

    DestroyableSecretKey(byte[] key, String algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyBytes = requireNonNull(key, "key").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return keyBytes.clone();
    }

    @Override
    public void destroy() {
        Arrays.fill(keyBytes, (byte) 0);
        this.destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "destroyed=" + destroyed +
                ", algorithm='" + algorithm + '\'' +
                ", bits=" + keyBytes.length * 8 +
                '}';
    }
}
