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

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.itemcrypt.EncryptionKey;

/**
 * A key store that keeps keys in memory for the lifetime of the instance.
 */
public final class InMemoryKeyStore implements EncryptionKeyStore {
    private final ConcurrentMap<String, StoredKey> keys = new ConcurrentHashMap<>();

    @Override
    public Optional<EncryptionKey> get(String tag) {
        return Optional.ofNullable(keys.get(requireNonNull(tag, "tag"))).map(StoredKey::toKey);
    }

    @Override
    public EncryptionKey put(String tag, EncryptionKey key) {
        var stored = new StoredKey(key.rawData(), key.context().orElse(null));
        keys.put(requireNonNull(tag, "tag"), stored);
        return stored.toKey();
    }

    @Override
    public Optional<EncryptionKey> delete(String tag) {
        return Optional.ofNullable(keys.remove(requireNonNull(tag, "tag"))).map(StoredKey::toKey);
    }

    private record StoredKey(byte[] rawData, String context) {
        EncryptionKey toKey() {
            return EncryptionKey.fromRawData(rawData).withContext(context);
        }
    }
}
