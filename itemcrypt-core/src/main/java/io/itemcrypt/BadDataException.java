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

import java.security.GeneralSecurityException;

/**
 * Thrown when some bytes are not a well-formed {@link EncryptedItem}: the version tag is not recognized, or the
 * data is too short to hold the fields its version requires.
 */
public final class BadDataException extends GeneralSecurityException {

    BadDataException(String message) {
        super(message);
    }
}
