/*
 * Original work: Copyright (c) 2017-2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 * Modified work: Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * Author: Chris Lavin, Xilinx Research Labs.
 *
 * This file is part of RapidNetlist.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidnetlist.json;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.rapidnetlist.util.Params;
import com.xilinx.rapidnetlist.util.function.InputStreamSupplier;

/**
 * A small recursive-descent JSON parser created especially for reading netlists
 * written by Yosys. It is not intended to be a general purpose JSON parser: it
 * only knows strings, non-negative integers, arrays and objects, and it copies
 * escaped characters verbatim instead of decoding them.
 *
 * Commas are treated like whitespace between array elements and between object
 * members, so repeated, leading and trailing commas are accepted.
 */
public class JsonParser implements AutoCloseable {

    private final JsonReader reader;

    private final boolean rejectDuplicateKeys;

    private final int maxDepth;

    private int depth = 0;

    public JsonParser(JsonReader reader, boolean rejectDuplicateKeys, int maxDepth) {
        this.reader = reader;
        this.rejectDuplicateKeys = rejectDuplicateKeys;
        this.maxDepth = maxDepth;
    }

    public JsonParser(JsonReader reader) {
        this(reader, Params.RN_JSON_REJECT_DUPLICATE_KEYS, Params.RN_JSON_MAX_DEPTH);
    }

    public JsonParser(InputStream in) {
        this(new JsonReader(in));
    }

    public JsonParser(Path fileName) {
        this(new JsonReader(fileName, InputStreamSupplier.getInputStream(fileName)));
    }

    /**
     * Parses a complete value from a string.
     * @param text JSON text holding one value.
     * @return The root of the parsed value tree.
     */
    public static JsonValue parse(String text) {
        return parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Parses one value from the front of a stream, together with the whitespace
     * around it. The stream is not closed and is left positioned right after
     * the trailing whitespace. If the stream does not support mark/reset it is
     * read one byte at a time, and the one byte of lookahead that ends the
     * trailing whitespace is lost.
     * @param in Stream positioned at the start of the value.
     * @return The root of the parsed value tree.
     */
    public static JsonValue parse(InputStream in) {
        JsonReader reader = in.markSupported()
                ? new JsonReader(null, in, JsonReader.DEFAULT_BUFFER_SIZE, true)
                : new JsonReader(null, in, 1);
        JsonValue value = new JsonParser(reader).parse();
        reader.releaseUnconsumed();
        return value;
    }

    /**
     * Parses exactly one value from the front of the stream, consuming the
     * whitespace before and after it. Anything following that whitespace is left
     * unread in {@link #getReader()}.
     * @return The root of the parsed value tree.
     */
    public JsonValue parse() {
        JsonValue value = parseValue();
        while (isWhitespace(reader.peek())) {
            reader.read();
        }
        return value;
    }

    public JsonReader getReader() {
        return reader;
    }

    static boolean isWhitespace(int ch) {
        return ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n';
    }

    private static boolean isDigit(int ch) {
        return '0' <= ch && ch <= '9';
    }

    private static String describe(int ch) {
        if (ch >= 0x20 && ch < 0x7f) {
            return "'" + (char) ch + "'";
        }
        return String.format("0x%02x", ch);
    }

    private JsonParseException error(String message) {
        return new JsonParseException(message, reader.getByteOffset());
    }

    private JsonUnexpectedEOFException unexpectedEOF(String where) {
        return new JsonUnexpectedEOFException("Unexpected EOF in JSON " + where + ".", reader.getByteOffset());
    }

    private JsonValue parseValue() {
        int ch;
        do {
            ch = reader.read();
        } while (isWhitespace(ch));

        switch (ch) {
            case -1:
                throw unexpectedEOF("file");
            case '"':
                return new JsonString(parseStringBody());
            case '[':
                return parseArray();
            case '{':
                return parseObject();
            default:
                if (isDigit(ch)) {
                    return parseInteger(ch);
                }
                throw error("Unexpected character in JSON file: " + describe(ch));
        }
    }

    /**
     * The opening quote is expected to have already been read. Reads up to and
     * including the closing quote.
     * @return Everything between the quotes, escape backslashes removed.
     */
    private String parseStringBody() {
        reader.beginString();
        while (true) {
            int ch = reader.read();
            if (ch == -1) {
                throw unexpectedEOF("string");
            }
            if (ch == '"') {
                break;
            }
            if (ch == '\\') {
                ch = reader.read();
                if (ch == -1) {
                    throw unexpectedEOF("string");
                }
            }
            reader.appendStringByte(ch);
        }
        return reader.endString();
    }

    private JsonInteger parseInteger(int firstDigit) {
        long value = firstDigit - '0';
        while (isDigit(reader.peek())) {
            value = value * 10 + (reader.read() - '0');
            if (value > Integer.MAX_VALUE) {
                throw error("JSON integer exceeds maximum value of " + Integer.MAX_VALUE);
            }
        }
        return new JsonInteger((int) value);
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw error("JSON nesting exceeds maximum depth of " + maxDepth);
        }
    }

    private JsonArray parseArray() {
        enter();
        List<JsonValue> values = new ArrayList<>();
        while (true) {
            int ch = reader.peek();
            if (ch == -1) {
                throw unexpectedEOF("array");
            }
            if (isWhitespace(ch) || ch == ',') {
                reader.read();
                continue;
            }
            if (ch == ']') {
                reader.read();
                break;
            }
            values.add(parseValue());
        }
        depth--;
        return values.isEmpty() ? JsonArray.EMPTY : new JsonArray(values);
    }

    private JsonObject parseObject() {
        enter();
        Map<String, JsonValue> members = new LinkedHashMap<>();
        while (true) {
            int ch = reader.read();
            if (ch == -1) {
                throw unexpectedEOF("object");
            }
            if (isWhitespace(ch) || ch == ',') {
                continue;
            }
            if (ch == '}') {
                break;
            }
            if (ch != '"') {
                throw error("Unexpected non-string key in JSON object, found " + describe(ch));
            }
            String key = parseStringBody();

            while (isWhitespace(ch = reader.peek()) || ch == ':') {
                reader.read();
            }
            if (ch == -1) {
                throw unexpectedEOF("object");
            }

            JsonValue value = parseValue();
            if (members.put(key, value) != null && rejectDuplicateKeys) {
                throw error("Duplicate key '" + key + "' in JSON object");
            }
        }
        depth--;
        return members.isEmpty() ? JsonObject.EMPTY : new JsonObject(members);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
