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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

import io.itemcrypt.EncryptionKey;

/**
 * A key store backed by a single JSON file. Each tag maps to an object holding the URL-safe base64 encoding of the
 * key's raw data and, if present, its context label:
 * <pre>
 *     {"com.example.documents": {"key": "AAAB...", "account": "alice@example.com"}}
 * </pre>
 * Updates rewrite the whole file through a temporary file that is then atomically moved into place. The file is
 * not encrypted, so it must be kept somewhere only the application can read.
 */
public final class JsonFileKeyStore implements EncryptionKeyStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileKeyStore.class);

    static final String KEY = "key";
    static final String ACCOUNT = "account";

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final Path file;

    public JsonFileKeyStore(Path file) {
        this.file = requireNonNull(file, "file").toAbsolutePath();
    }

    @Override
    public synchronized Optional<EncryptionKey> get(String tag) throws IOException {
        var entry = readAll().get(requireNonNull(tag, "tag"));
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(toKey(tag, entry));
    }

    @Override
    public synchronized EncryptionKey put(String tag, EncryptionKey key) throws IOException {
        requireNonNull(tag, "tag");
        var entry = new JsonObject();
        entry.put(KEY, ENCODER.encodeToString(key.rawData()));
        key.context().ifPresent(context -> entry.put(ACCOUNT, context));

        var all = readAll();
        all.put(tag, entry);
        writeAll(all);
        logger.debug("Stored {} key under tag {}", key.scheme().version(), tag);
        return toKey(tag, entry);
    }

    @Override
    public synchronized Optional<EncryptionKey> delete(String tag) throws IOException {
        var all = readAll();
        var entry = all.remove(requireNonNull(tag, "tag"));
        if (entry == null) {
            return Optional.empty();
        }
        writeAll(all);
        logger.debug("Deleted key under tag {}", tag);

        try {
            return Optional.of(toKey(tag, entry));
        } catch (KeyStorageException e) {
            logger.debug("Deleted entry under tag {} was not a valid key", tag, e);
            return Optional.empty();
        }
    }

    private JsonObject readAll() throws IOException {
        String json;
        try {
            json = Files.readString(file, UTF_8);
        } catch (NoSuchFileException e) {
            return new JsonObject();
        }
        try {
            return JsonParser.object().from(json);
        } catch (JsonParserException e) {
            throw new KeyStorageException("Key store file is not a JSON object: " + file, e);
        }
    }

    private void writeAll(JsonObject all) throws IOException {
        var directory = file.getParent();
        Files.createDirectories(directory);
        var temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, JsonWriter.string(all), UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static EncryptionKey toKey(String tag, Object entry) throws KeyStorageException {
        if (!(entry instanceof JsonObject object) || !(object.get(KEY) instanceof String encoded)) {
            throw new KeyStorageException("Incorrect contents for tag " + tag);
        }
        var account = object.get(ACCOUNT);
        if (account != null && !(account instanceof String)) {
            throw new KeyStorageException("Incorrect account for tag " + tag);
        }
        try {
            return EncryptionKey.fromRawData(DECODER.decode(encoded)).withContext((String) account);
        } catch (IllegalArgumentException e) {
            throw new KeyStorageException("Incorrect contents for tag " + tag, e);
        }
    }
}
