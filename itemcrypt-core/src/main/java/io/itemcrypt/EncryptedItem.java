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

import static io.itemcrypt.Utils.require;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

import io.itemcrypt.Scheme.Format;

/**
 * An encrypted payload in its versioned envelope. The envelope holds a version tag, an IV, the ciphertext and a
 * trailing salt. For {@link Format#V2} items the IV field carries the cipher nonce and the salt field carries the
 * authentication tag.
 * <p>
 * Two items are equal exactly when their {@linkplain #rawData() serialized forms} are byte-for-byte identical.
 */
public final class EncryptedItem {
    private final Format version;
    private final byte[] iv;
    private final byte[] ciphertext;
    private final byte[] salt;

    EncryptedItem(Format version, byte[] iv, byte[] ciphertext, byte[] salt) {
        this.version = requireNonNull(version, "version");
        var scheme = Scheme.of(version);
        require(requireNonNull(iv, "iv").length == scheme.ivFieldSize(), "Invalid IV size for " + version);
        require(requireNonNull(salt, "salt").length == scheme.saltFieldSize(), "Invalid salt size for " + version);
        this.iv = iv;
        this.ciphertext = requireNonNull(ciphertext, "ciphertext");
        this.salt = salt;
    }

    /**
     * Parses an item from its serialized form.
     *
     * @param data the serialized item.
     * @return the item.
     * @throws BadDataException if the version tag is not recognized or the data is too short for that version.
     */
    public static EncryptedItem parse(byte[] data) throws BadDataException {
        return ContainerCodec.parse(requireNonNull(data, "data"));
    }

    /**
     * Reads the remainder of the given stream and parses it as an item. The stream is not closed.
     *
     * @param in the stream to read.
     * @return the item.
     * @throws IOException if the stream cannot be read.
     * @throws BadDataException if the content is not a well-formed item.
     */
    public static EncryptedItem readFrom(InputStream in) throws IOException, BadDataException {
        return parse(in.readAllBytes());
    }

    public Format version() {
        return version;
    }

    public byte[] iv() {
        return iv.clone();
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public byte[] salt() {
        return salt.clone();
    }

    /**
     * Returns the serialized form: {@code version_tag || iv || ciphertext || salt}.
     */
    public byte[] rawData() {
        return ContainerCodec.serialize(this);
    }

    /**
     * Writes the serialized form to the given stream. The stream is neither flushed nor closed.
     *
     * @param out the stream to write to.
     * @throws IOException if the stream cannot be written.
     */
    public void writeTo(OutputStream out) throws IOException {
        out.write(rawData());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof EncryptedItem that)) { return false; }
        return Arrays.equals(rawData(), that.rawData());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(rawData());
    }

    @Override
    public String toString() {
        return "EncryptedItem{" +
                "version=" + version +
                ", ciphertext=" + ciphertext.length + " bytes" +
                '}';
    }
}
