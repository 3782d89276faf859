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

package io.itemcrypt.codec;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * Turns values of some type into a flat byte sequence and back. The encryption layer never looks inside these
 * bytes.
 *
 * @param <T> the type of value.
 */
public interface ValueCodec<T> {

    byte[] encode(T value);

    /**
     * Decodes a value.
     *
     * @param data the encoded value.
     * @return the value.
     * @throws IOException if the data is not a valid encoding of a value.
     */
    T decode(byte[] data) throws IOException;

    /**
     * A codec for strings as UTF-8. Decoding rejects malformed UTF-8 rather than substituting replacement characters.
     */
    static ValueCodec<String> utf8() {
        return new ValueCodec<>() {
            @Override
            public byte[] encode(String value) {
                return value.getBytes(UTF_8);
            }

            @Override
            public String decode(byte[] data) throws IOException {
                var decoder = UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT);
                try {
                    return decoder.decode(ByteBuffer.wrap(data)).toString();
                } catch (CharacterCodingException e) {
                    throw new IOException("Invalid UTF-8 data", e);
                }
            }
        };
    }

    /**
     * A codec for JSON objects, written as compact UTF-8 JSON text.
     */
    static ValueCodec<JsonObject> json() {
        return new ValueCodec<>() {
            @Override
            public byte[] encode(JsonObject value) {
                return JsonWriter.string(value).getBytes(UTF_8);
            }

            @Override
            public JsonObject decode(byte[] data) throws IOException {
                try {
                    return JsonParser.object().from(utf8().decode(data));
                } catch (JsonParserException e) {
                    throw new IOException("Invalid JSON object", e);
                }
            }
        };
    }
}
