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

package io.itemcrypt.keys;

import java.io.IOException;
import java.util.Optional;

import io.itemcrypt.EncryptionKey;

/**
 * A place to keep {@link EncryptionKey}s between uses, looked up by a tag. Keys are stored as their
 * {@linkplain EncryptionKey#rawData() raw data} together with their context label, which is restored on retrieval.
 * Implementations must keep the stored data somewhere the application trusts, because it contains secret key
 * material.
 */
public interface EncryptionKeyStore {

    /**
     * Retrieves the key stored under the tag.
     *
     * @param tag the tag, usually in reverse-DNS notation.
     * @return the key, or an empty result if there is none.
     * @throws KeyStorageException if the stored data is not a valid key.
     * @throws IOException if the store cannot be read.
     */
    Optional<EncryptionKey> get(String tag) throws IOException;

    /**
     * Stores a key under the tag, replacing any key already stored there.
     *
     * @param tag the tag.
     * @param key the key.
     * @return the key as it was stored.
     * @throws IOException if the store cannot be written.
     */
    EncryptionKey put(String tag, EncryptionKey key) throws IOException;

    /**
     * Deletes the key stored under the tag.
     *
     * @param tag the tag.
     * @return the deleted key, or an empty result if there was none or it was not a valid key.
     * @throws IOException if the store cannot be written.
     */
    Optional<EncryptionKey> delete(String tag) throws IOException;
}
