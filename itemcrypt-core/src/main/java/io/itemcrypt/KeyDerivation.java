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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;

import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The primitive steps of turning a password into key data. Salts are derived in two stages: a random seed is first
 * stretched into a salt by HMAC, with any context keywords folded in order, and that salt then feeds PBKDF2 along
 * with the normalized password.
 */
public final class KeyDerivation {
    private static final Logger logger = LoggerFactory.getLogger(KeyDerivation.class);

    /**
     * Normalizes a password so that the same password typed on different platforms produces the same key. Leading
     * and trailing whitespace is removed and the result is put into Unicode canonical decomposition (NFD).
     *
     * @param password the raw password.
     * @return the normalized password.
     */
    public static String normalizePassword(String password) {
        return Normalizer.normalize(requireNonNull(password, "password").strip(), Normalizer.Form.NFD);
    }

    /**
     * Stretches a seed into a salt of {@link Scheme#stretchedSaltSize()} bytes. The seed keys an HMAC over the
     * UTF-8 encoding of each keyword in turn, so changing the order of the keywords changes the salt.
     *
     * @param seed the random seed. Must be {@link Scheme#seedSize()} bytes.
     * @param keywords contextual values, such as an account identifier, to bind to the key. May be empty.
     * @param scheme the scheme.
     * @return the stretched salt.
     * @throws ImproperKeyException if the seed is the wrong size.
     */
    public static byte[] stretchSalt(byte[] seed, List<String> keywords, Scheme scheme) {
        requireNonNull(keywords, "keywords");
        if (requireNonNull(seed, "seed").length != scheme.seedSize()) {
            logger.debug("Seed was the wrong size <{}> for the encryption scheme <{}>", seed.length,
                    scheme.seedSize());
            throw new ImproperKeyException(ImproperKeyException.Kind.SEED_SIZE, scheme.seedSize(), seed.length);
        }

        var seedKey = new DestroyableSecretKey(seed, scheme.hmacAlgorithm());
        try {
            var hmac = Mac.getInstance(scheme.hmacAlgorithm());
            hmac.init(seedKey);
            for (var keyword : keywords) {
                hmac.update(requireNonNull(keyword, "keyword").getBytes(UTF_8));
            }
            return hmac.doFinal();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        } finally {
            Utils.destroy(seedKey);
        }
    }

    /**
     * Derives key data from a password using PBKDF2 with the scheme's PRF, iteration count and key length. The
     * password is used exactly as given; callers normally {@linkplain #normalizePassword(String) normalize} it first.
     *
     * @param password the password.
     * @param salt the stretched salt.
     * @param scheme the scheme.
     * @return {@link Scheme#derivedKeyLength()} bytes of key data.
     */
    public static byte[] keyData(String password, byte[] salt, Scheme scheme) {
        var passwordChars = requireNonNull(password, "password").toCharArray();
        var spec = new PBEKeySpec(passwordChars, requireNonNull(salt, "salt"), scheme.iterations(),
                scheme.derivedKeyLength() * 8);
        try {
            var factory = SecretKeyFactory.getInstance(scheme.passwordKdfAlgorithm());
            return factory.generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException(e);
        } finally {
            spec.clearPassword();
            Arrays.fill(passwordChars, '\0');
        }
    }

    private KeyDerivation() {}
}
