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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.itemcrypt.EncryptionKey;
import io.itemcrypt.Scheme;

public class InMemoryKeyStoreTest {

    private InMemoryKeyStore store;

    @BeforeMethod
    public void createStore() {
        store = new InMemoryKeyStore();
    }

    @Test
    public void shouldReturnEmptyForUnknownTag() {
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.delete("missing")).isEmpty();
    }

    @Test
    public void shouldReturnStoredKeyWithContext() {
        var key = EncryptionKey.random("password", List.of(), Scheme.LATEST).withContext("alice");

        var stored = store.put("main", key);

        assertThat(stored).isEqualTo(key);
        assertThat(store.get("main")).hasValueSatisfying(found -> {
            assertThat(found).isEqualTo(key);
            assertThat(found.context()).contains("alice");
            assertThat(found.scheme()).isEqualTo(Scheme.LATEST);
        });
    }

    @Test
    public void shouldReplaceExistingKey() {
        var first = EncryptionKey.random("password", List.of(), Scheme.DEFAULT);
        var second = EncryptionKey.random("password", List.of(), Scheme.DEFAULT);

        store.put("main", first);
        store.put("main", second);

        assertThat(store.get("main")).contains(second);
    }

    @Test
    public void shouldDeleteKey() {
        var key = EncryptionKey.random("password", List.of(), Scheme.DEFAULT);
        store.put("main", key);

        assertThat(store.delete("main")).contains(key);
        assertThat(store.get("main")).isEmpty();
    }
}
