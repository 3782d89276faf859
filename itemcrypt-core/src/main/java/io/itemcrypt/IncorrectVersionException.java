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

import io.itemcrypt.Scheme.Format;

/**
 * Thrown when a key of one scheme is used with an item written under a different format version. The check happens
 * before any cryptographic operation is attempted.
 */
public final class IncorrectVersionException extends IllegalArgumentException {
    private final Format itemVersion;
    private final Format keyVersion;

    IncorrectVersionException(Format itemVersion, Format keyVersion) {
        super("Item version " + itemVersion + " does not match key version " + keyVersion);
        this.itemVersion = requireNonNull(itemVersion);
        this.keyVersion = requireNonNull(keyVersion);
    }

    public Format itemVersion() {
        return itemVersion;
    }

    public Format keyVersion() {
        return keyVersion;
    }
}
