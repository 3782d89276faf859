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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Random;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.itemcrypt.Scheme.Format;

public class EncryptedItemTest {

    @DataProvider
    public Object[][] items() {
        return new Object[][] {
                { new EncryptedItem(Format.V1, filled(16, 1), new byte[] { 1, 2, 3 }, filled(32, 2)) },
                { new EncryptedItem(Format.V1, filled(16, 1), new byte[0], filled(32, 2)) },
                { new EncryptedItem(Format.V2, filled(12, 3), filled(100, 4), filled(16, 5)) },
                { new EncryptedItem(Format.V2, filled(12, 3), new byte[0], filled(16, 5)) },
        };
    }

    @Test(dataProvider = "items")
    public void shouldParseSerializedForm(EncryptedItem item) throws Exception {
        var parsed = EncryptedItem.parse(item.rawData());

        assertThat(parsed).isEqualTo(item).hasSameHashCodeAs(item);
        assertThat(parsed.rawData()).isEqualTo(item.rawData());
    }

    @Test
    public void shouldLayOutFieldsInOrder() {
        var item = new EncryptedItem(Format.V2, filled(12, 3), new byte[] { 7, 8 }, filled(16, 5));

        var raw = item.rawData();

        assertThat(raw).hasSize(3 + 12 + 2 + 16);
        assertThat(Arrays.copyOfRange(raw, 0, 3)).containsExactly(0, 0, 2);
        assertThat(Arrays.copyOfRange(raw, 3, 15)).isEqualTo(filled(12, 3));
        assertThat(Arrays.copyOfRange(raw, 15, 17)).containsExactly(7, 8);
        assertThat(Arrays.copyOfRange(raw, 17, 33)).isEqualTo(filled(16, 5));
    }

    @Test
    public void shouldSliceVersionDependentFieldWidths() throws Exception {
        var raw = new byte[3 + 16 + 5 + 32];
        raw[2] = 1;
        Arrays.fill(raw, 3, 19, (byte) 'i');
        Arrays.fill(raw, 19, 24, (byte) 'c');
        Arrays.fill(raw, 24, raw.length, (byte) 's');

        var item = EncryptedItem.parse(raw);

        assertThat(item.version()).isEqualTo(Format.V1);
        assertThat(item.iv()).hasSize(16).containsOnly('i');
        assertThat(item.ciphertext()).hasSize(5).containsOnly('c');
        assertThat(item.salt()).hasSize(32).containsOnly('s');
    }

    @Test
    public void shouldRoundTripArbitraryWellFormedBytes() throws Exception {
        var random = new Random(42);
        for (var version : Format.values()) {
            var scheme = Scheme.of(version);
            for (int i = 0; i < 20; ++i) {
                var raw = new byte[3 + scheme.ivFieldSize() + random.nextInt(64) + scheme.saltFieldSize()];
                random.nextBytes(raw);
                System.arraycopy(version.tag(), 0, raw, 0, 3);

                assertThat(EncryptedItem.parse(raw).rawData()).isEqualTo(raw);
            }
        }
    }

    @Test
    public void shouldRejectUnknownVersionTag() {
        var raw = new byte[100];
        raw[2] = 7;

        assertThatThrownBy(() -> EncryptedItem.parse(raw))
                .isInstanceOf(BadDataException.class)
                .hasMessageContaining("version");
    }

    @DataProvider
    public Object[][] truncated() {
        return new Object[][] {
                { new byte[0] },
                { new byte[] { 0, 0 } },
                { new byte[] { 0, 0, 1 } },
                { Arrays.copyOf(new byte[] { 0, 0, 1 }, 3 + 16 + 31) },
                { Arrays.copyOf(new byte[] { 0, 0, 2 }, 3 + 12 + 15) },
        };
    }

    @Test(dataProvider = "truncated")
    public void shouldRejectTruncatedData(byte[] raw) {
        assertThatThrownBy(() -> EncryptedItem.parse(raw)).isInstanceOf(BadDataException.class);
    }

    @Test
    public void shouldAcceptMinimumLengthData() throws Exception {
        var raw = Arrays.copyOf(new byte[] { 0, 0, 2 }, 3 + 12 + 16);

        assertThat(EncryptedItem.parse(raw).ciphertext()).isEmpty();
    }

    @Test
    public void shouldRejectRandomShortBuffers() {
        var random = new Random(1234);
        for (int i = 0; i < 200; ++i) {
            var raw = new byte[random.nextInt(3 + 12 + 16)];
            random.nextBytes(raw);

            assertThatThrownBy(() -> EncryptedItem.parse(raw)).isInstanceOf(BadDataException.class);
        }
    }

    @Test
    public void shouldRejectMisSizedFields() {
        assertThatThrownBy(() -> new EncryptedItem(Format.V1, filled(12, 0), new byte[0], filled(32, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EncryptedItem(Format.V2, filled(12, 0), new byte[0], filled(32, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldDefineEqualityOverRawBytes() throws Exception {
        var item = new EncryptedItem(Format.V1, filled(16, 1), new byte[] { 1, 2, 3 }, filled(32, 2));
        var same = EncryptedItem.parse(item.rawData().clone());
        var other = new EncryptedItem(Format.V1, filled(16, 1), new byte[] { 1, 2, 4 }, filled(32, 2));

        assertThat(same).isEqualTo(item).hasSameHashCodeAs(item);
        assertThat(other).isNotEqualTo(item);
    }

    @Test
    public void shouldWriteToAndReadFromStreams() throws Exception {
        var item = new EncryptedItem(Format.V2, filled(12, 3), filled(10, 4), filled(16, 5));
        var out = new ByteArrayOutputStream();

        item.writeTo(out);
        var read = EncryptedItem.readFrom(new ByteArrayInputStream(out.toByteArray()));

        assertThat(read).isEqualTo(item);
    }

    @Test
    public void shouldReturnDefensiveCopies() {
        var item = new EncryptedItem(Format.V1, filled(16, 1), new byte[] { 1, 2, 3 }, filled(32, 2));

        item.ciphertext()[0] = 99;
        item.iv()[0] = 99;
        item.salt()[0] = 99;

        assertThat(item.ciphertext()).containsExactly(1, 2, 3);
        assertThat(item.iv()).isEqualTo(filled(16, 1));
        assertThat(item.salt()).isEqualTo(filled(32, 2));
    }
}
