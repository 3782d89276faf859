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

import static io.itemcrypt.EncryptionKeyTest.filled;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.itemcrypt.Scheme.Format;

public class EncryptionSerializationTest {

    @DataProvider
    public Object[][] schemes() {
        return new Object[][] {
                { Scheme.of(Format.V1) },
                { Scheme.of(Format.V2) },
        };
    }

    @Test(dataProvider = "schemes")
    public void shouldRoundTripWithPassword(Scheme scheme) throws Exception {
        var data = "Hello, world!".getBytes(UTF_8);

        var item = EncryptionSerialization.encryptedItem(data, "password", scheme);
        var parsed = EncryptedItem.parse(item.rawData());

        assertThat(parsed.version()).isEqualTo(scheme.version());
        assertThat(EncryptionSerialization.data(parsed, "password")).isEqualTo(data);
    }

    @Test(dataProvider = "schemes")
    public void shouldRoundTripEmptyPayload(Scheme scheme) throws Exception {
        var item = EncryptionSerialization.encryptedItem(new byte[0], "password", scheme);

        assertThat(EncryptionSerialization.data(item, "password")).isEmpty();
    }

    @Test(dataProvider = "schemes")
    public void shouldUseFreshRandomnessForEachItem(Scheme scheme) {
        var data = "Hello, world!".getBytes(UTF_8);

        var first = EncryptionSerialization.encryptedItem(data, "password", scheme);
        var second = EncryptionSerialization.encryptedItem(data, "password", scheme);

        assertThat(first.iv()).isNotEqualTo(second.iv());
        assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
    }

    @Test
    public void shouldRejectWrongPasswordForAuthenticatedScheme() {
        var item = EncryptionSerialization.encryptedItem("Hello, world!".getBytes(UTF_8), "password",
                Scheme.LATEST);

        assertThatThrownBy(() -> EncryptionSerialization.data(item, "wrong"))
                .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    public void shouldNotRecoverPlaintextWithWrongPasswordForLegacyScheme() {
        var data = "Hello, world!".getBytes(UTF_8);
        var item = EncryptionSerialization.encryptedItem(data, "password", Scheme.DEFAULT);

        // CBC padding catches most wrong keys, but is not an integrity check
        try {
            assertThat(EncryptionSerialization.data(item, "wrong")).isNotEqualTo(data);
        } catch (DecryptionFailedException expected) {
            assertThat(expected).hasMessage("failed to decrypt: wrong password or corrupted data");
        }
    }

    @Test
    public void shouldRejectWrongPasswordWhenPaddingDoesNotCheckOut() throws Exception {
        // With this seed and IV, decrypting under "wrong" leaves a final byte of 0xE6, which is not valid padding
        var key = EncryptionKey.derive("password", filled(16, 1), filled(16, 2), List.of(), Scheme.DEFAULT);
        var item = EncryptionSerialization.encryptedItem("Hello, world!".getBytes(UTF_8), key);

        assertThat(EncryptionSerialization.data(item, "password")).isEqualTo("Hello, world!".getBytes(UTF_8));
        assertThatThrownBy(() -> EncryptionSerialization.data(item, "wrong"))
                .isInstanceOf(DecryptionFailedException.class)
                .hasMessage("failed to decrypt: wrong password or corrupted data");
    }

    @Test
    public void shouldTreatEquivalentPasswordsAlike() throws Exception {
        var item = EncryptionSerialization.encryptedItem(new byte[] { 42 }, " caf\u00e9 ", Scheme.LATEST);

        assertThat(EncryptionSerialization.data(item, "cafe\u0301")).containsExactly(42);
    }

    @DataProvider
    public Object[][] missingPasswords() {
        return new Object[][] { { null }, { "" } };
    }

    @Test(dataProvider = "missingPasswords")
    public void shouldRequirePasswordToEncrypt(String password) {
        assertThatThrownBy(() -> EncryptionSerialization.encryptedItem(new byte[1], password, Scheme.DEFAULT))
                .isInstanceOf(NoPasswordException.class);
    }

    @Test(dataProvider = "missingPasswords")
    public void shouldRequirePasswordToDecrypt(String password) {
        var item = EncryptionSerialization.encryptedItem(new byte[1], "password", Scheme.DEFAULT);

        assertThatThrownBy(() -> EncryptionSerialization.data(item, password))
                .isInstanceOf(NoPasswordException.class);
    }

    @Test(dataProvider = "schemes")
    public void shouldRoundTripWithKey(Scheme scheme) throws Exception {
        var key = EncryptionKey.random("password", List.of("alice"), scheme);
        var data = "secret".getBytes(UTF_8);

        var item = EncryptionSerialization.encryptedItem(data, key);

        assertThat(EncryptionSerialization.data(item, key)).isEqualTo(data);
    }

    @Test
    public void shouldDecryptV1KeyItemsWithPasswordWhenNoKeywordsUsed() throws Exception {
        var key = EncryptionKey.random("password", List.of(), Scheme.DEFAULT);
        var item = EncryptionSerialization.encryptedItem("secret".getBytes(UTF_8), key);

        assertThat(EncryptionSerialization.data(item, "password")).isEqualTo("secret".getBytes(UTF_8));
    }

    @Test
    public void shouldDecryptPasswordItemsWithRederivedKey() throws Exception {
        var item = EncryptionSerialization.encryptedItem("secret".getBytes(UTF_8), "password", Scheme.DEFAULT);
        var key = EncryptionKey.rederive("password", item.salt(), item.iv(), Scheme.DEFAULT);

        assertThat(EncryptionSerialization.data(item, key)).isEqualTo("secret".getBytes(UTF_8));
    }

    @Test
    public void shouldRefuseV1ItemWithV2Key() {
        var item = EncryptionSerialization.encryptedItem(new byte[8], "password", Scheme.of(Format.V1));
        var key = EncryptionKey.random("password", List.of(), Scheme.of(Format.V2));

        assertThatThrownBy(() -> EncryptionSerialization.data(item, key))
                .isInstanceOf(IncorrectVersionException.class);
    }

    @Test
    public void shouldRefuseV2ItemWithV1Key() {
        var item = EncryptionSerialization.encryptedItem(new byte[8], "password", Scheme.of(Format.V2));
        var key = EncryptionKey.random("password", List.of(), Scheme.of(Format.V1));

        assertThatThrownBy(() -> EncryptionSerialization.data(item, key))
                .isInstanceOf(IncorrectVersionException.class);
    }

    @Test
    public void shouldStreamWithLegacyKey() throws Exception {
        var key = EncryptionKey.random("password", List.of(), Scheme.DEFAULT);
        var data = new byte[4096 + 7];
        var encrypted = new ByteArrayOutputStream();
        var decrypted = new ByteArrayOutputStream();

        EncryptionSerialization.encryptStream(new ByteArrayInputStream(data), key, encrypted);
        EncryptionSerialization.decryptStream(new ByteArrayInputStream(encrypted.toByteArray()), key, decrypted);

        assertThat(decrypted.toByteArray()).isEqualTo(data);
    }

    @Test
    public void shouldGenerateRandomBytes() {
        assertThat(EncryptionSerialization.randomBytes(32)).hasSize(32)
                .isNotEqualTo(EncryptionSerialization.randomBytes(32));
    }
}
