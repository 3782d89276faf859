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

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    static byte[] concat(byte[]... parts) {
        int length = 0;
        for (var part : parts) {
            length = Math.addExact(length, part.length);
        }
        var result = new byte[length];
        int offset = 0;
        for (var part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }

    /**
     * Overwrites the given arrays with zero bytes. This is best-effort only, as the garbage collector may already
     * have copied the data elsewhere in the heap. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    /**
     * Attempts to destroy the given keys, ignoring any {@link DestroyFailedException}: most JDK key classes throw it
     * unconditionally without wiping anything.
     */
    static void destroy(Destroyable... toDestroy) {
        for (var it : toDestroy) {
            if (it == null || it.isDestroyed()) {
                continue;
            }
            try {
                it.destroy();
            } catch (DestroyFailedException e) {
                logger.debug("Failed to destroy key: {}", it, e);
            }
        }
    }

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private Utils() {}
}
