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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.itemcrypt.Scheme.Format;

/**
 * Reads and writes the binary form of an {@link EncryptedItem}:
 * <pre>
 *     [version_tag: 3 bytes][iv: ivFieldSize][ciphertext: variable][salt: saltFieldSize]
 * </pre>
 * The version tag always comes first so that the widths of the other fields can be looked up before they are read.
 */
final class ContainerCodec {
    private static final Logger logger = LoggerFactory.getLogger(ContainerCodec.class);

    static byte[] serialize(EncryptedItem item) {
        return Utils.concat(item.version().tag(), item.iv(), item.ciphertext(), item.salt());
    }

    static EncryptedItem parse(byte[] data) throws BadDataException {
        var version = Format.fromTag(data).orElseThrow(() -> {
            logger.debug("Unrecognized version tag in {} bytes of data", data.length);
            return new BadDataException("Unrecognized version tag");
        });
        var scheme = Scheme.of(version);

        int ivSize = scheme.ivFieldSize();
        int saltSize = scheme.saltFieldSize();
        int minimumSize = Format.TAG_SIZE + ivSize + saltSize;
        if (data.length < minimumSize) {
            logger.debug("{} item of {} bytes is shorter than the minimum of {} bytes", version, data.length,
                    minimumSize);
            throw new BadDataException("Data too short for a " + version + " item");
        }

        int ivEnd = Format.TAG_SIZE + ivSize;
        int saltStart = data.length - saltSize;
        var iv = Arrays.copyOfRange(data, Format.TAG_SIZE, ivEnd);
        var ciphertext = Arrays.copyOfRange(data, ivEnd, saltStart);
        var salt = Arrays.copyOfRange(data, saltStart, data.length);

        logger.trace("Parsed {} item: iv={} bytes, ciphertext={} bytes, salt={} bytes", version, iv.length,
                ciphertext.length, salt.length);
        return new EncryptedItem(version, iv, ciphertext, salt);
    }

    private ContainerCodec() {}
}
