/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
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

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestJsonParser {

    private static JsonParser parserFor(String text, boolean rejectDuplicateKeys, int maxDepth) {
        JsonReader reader = new JsonReader(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        return new JsonParser(reader, rejectDuplicateKeys, maxDepth);
    }

    @Test
    public void testParseShape() {
        JsonValue v = JsonParser.parse("{\"a\":[1,\"x\",{}],\"b\":7}");
        Assertions.assertTrue(v.isObject());
        JsonObject o = v.asObject();
        Assertions.assertEquals(Arrays.asList("a", "b"), Arrays.asList(o.keySet().toArray()));

        JsonArray a = o.get("a").asArray();
        Assertions.assertEquals(3, a.size());
        Assertions.assertEquals(1, a.get(0).asInteger().getValue());
        Assertions.assertEquals("x", a.get(1).asString().getValue());
        Assertions.assertTrue(a.get(2).asObject().isEmpty());
        Assertions.assertEquals(7, o.get("b").asInteger().getValue());
        Assertions.assertNull(o.get("c"));
    }

    @Test
    public void testKeyOrderIsDocumentOrder() {
        JsonObject o = JsonParser.parse("{ \"z\": 1, \"a\": 2, \"m\": 3 }").asObject();
        Assertions.assertEquals(Arrays.asList("z", "a", "m"), Arrays.asList(o.keySet().toArray()));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[ 1 , 2 ,, 3 ]",
            "[1,2,3]",
            "[,1 2\n3,]",
            "\t[\r\n1,\n2,\n3\n]  ",
    })
    public void testArraySeparators(String text) {
        JsonArray a = JsonParser.parse(text).asArray();
        Assertions.assertEquals(3, a.size());
        for (int i = 0; i < 3; i++) {
            Assertions.assertEquals(i + 1, a.get(i).asInteger().getValue());
        }
    }

    @Test
    public void testObjectSeparators() {
        JsonObject o = JsonParser.parse("{,\"a\" :: 1,, \"b\" 2 ,}").asObject();
        Assertions.assertEquals(2, o.size());
        Assertions.assertEquals(1, o.get("a").asInteger().getValue());
        Assertions.assertEquals(2, o.get("b").asInteger().getValue());
    }

    @Test
    public void testEmptyContainers() {
        Assertions.assertTrue(JsonParser.parse("[]").asArray().isEmpty());
        Assertions.assertTrue(JsonParser.parse("{ }").asObject().isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "''|file",
            "'   '|file",
            "'\"abc'|string",
            "'\"ab\\'|string",
            "'[1, 2'|array",
            "'{\"a\": 1'|object",
            "'{\"a\"'|object",
            "'{\"a\": '|object",
            "'{\"a\": ['|array",
    })
    public void testUnexpectedEOF(String text, String where) {
        JsonUnexpectedEOFException e = Assertions.assertThrows(JsonUnexpectedEOFException.class,
                () -> JsonParser.parse(text));
        Assertions.assertTrue(e.getMessage().startsWith("Unexpected EOF in JSON " + where + "."), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"-1", "true", "null", ".5", "[1, -2]", "{\"a\": false}"})
    public void testUnexpectedCharacter(String text) {
        JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> JsonParser.parse(text));
        Assertions.assertFalse(e instanceof JsonUnexpectedEOFException);
        Assertions.assertTrue(e.getMessage().startsWith("Unexpected character in JSON file: "), e.getMessage());
    }

    @Test
    public void testUnexpectedCharacterOffset() {
        JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> JsonParser.parse("[1, ?]"));
        Assertions.assertEquals("Unexpected character in JSON file: '?' (before byte offset 5)", e.getMessage());
        Assertions.assertEquals(5, e.getByteOffset());
    }

    @Test
    public void testNonPrintableCharacter() {
        JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> JsonParser.parse("\u0001"));
        Assertions.assertTrue(e.getMessage().contains("0x01"), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{1: 2}", "{a: 2}", "{\"a\": 1, [2]}"})
    public void testNonStringKey(String text) {
        JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> JsonParser.parse(text));
        Assertions.assertTrue(e.getMessage().startsWith("Unexpected non-string key in JSON object"), e.getMessage());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "'\"a\\\"b\"'|'a\"b'",
            "'\"a\\\\b\"'|'a\\b'",
            "'\"a\\nb\"'|'anb'",
            "'\"\\u0041\"'|'u0041'",
            "'\"\"'|''",
    })
    public void testEscapesCopiedVerbatim(String text, String expected) {
        Assertions.assertEquals(expected, JsonParser.parse(text).asString().getValue());
    }

    @Test
    public void testUTF8String() {
        String s = "\u00e9t\u00e9 \u6f22\u5b57 \ud83d\ude00";
        Assertions.assertEquals(s, JsonParser.parse("\"" + s + "\"").asString().getValue());
    }

    @Test
    public void testUTF8StringAcrossBufferRefills() throws IOException {
        String s = "\u00e9\u00e9\u00e9\u00e9\u00e9";
        byte[] bytes = ("\"" + s + "\"").getBytes(StandardCharsets.UTF_8);
        try (JsonParser p = new JsonParser(new JsonReader(null, new ByteArrayInputStream(bytes), 3), false, 8)) {
            Assertions.assertEquals(s, p.parse().asString().getValue());
        }
    }

    @Test
    public void testLongString() {
        String s = String.join("", Collections.nCopies(1000, "abcdefgh"));
        Assertions.assertEquals(s, JsonParser.parse("\"" + s + "\"").asString().getValue());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0",
            "007, 7",
            "2147483647, 2147483647",
    })
    public void testIntegers(String text, int expected) {
        Assertions.assertEquals(expected, JsonParser.parse(text).asInteger().getValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2147483648", "99999999999999999999", "[1, 4294967296]"})
    public void testIntegerOverflow(String text) {
        JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> JsonParser.parse(text));
        Assertions.assertTrue(e.getMessage().startsWith("JSON integer exceeds maximum value of 2147483647"),
                e.getMessage());
    }

    @Test
    public void testTrailingContentLeftUnread() throws IOException {
        try (JsonParser p = parserFor("[1]  \n x", false, 8)) {
            Assertions.assertEquals(1, p.parse().asArray().size());
            Assertions.assertEquals('x', p.getReader().read());
            Assertions.assertTrue(p.getReader().isAtEOF());
        }
        try (JsonParser p = parserFor("{} ", false, 8)) {
            p.parse();
            Assertions.assertTrue(p.getReader().isAtEOF());
        }
    }

    @Test
    public void testStreamLeftAfterValue() throws IOException {
        InputStream in = new ByteArrayInputStream("[1] x".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals(1, JsonParser.parse(in).asArray().size());
        Assertions.assertEquals('x', in.read());
        Assertions.assertEquals(-1, in.read());

        in = new ByteArrayInputStream("12,3".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals(12, JsonParser.parse(in).asInteger().getValue());
        Assertions.assertEquals(',', in.read());
    }

    @Test
    public void testStreamHoldsSeveralDocuments() throws IOException {
        String big = "\"" + String.join("", Collections.nCopies(100000, "a")) + "\"";
        InputStream in = new BufferedInputStream(new ByteArrayInputStream(
                ("{\"a\": 1}\n" + big + "\n[2]\n").getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(1, JsonParser.parse(in).asObject().get("a").asInteger().getValue());
        Assertions.assertEquals(100000, JsonParser.parse(in).asString().getValue().length());
        Assertions.assertEquals(2, JsonParser.parse(in).asArray().get(0).asInteger().getValue());
        Assertions.assertEquals(-1, in.read());
    }

    @Test
    public void testStreamWithoutMarkSupport() throws IOException {
        InputStream in = new FilterInputStream(new ByteArrayInputStream("{} xy".getBytes(StandardCharsets.UTF_8))) {
            @Override
            public boolean markSupported() {
                return false;
            }
        };
        Assertions.assertTrue(JsonParser.parse(in).asObject().isEmpty());
        // Only the lookahead byte ending the whitespace is consumed
        Assertions.assertEquals('y', in.read());
    }

    @Test
    public void testConsecutiveValues() throws IOException {
        try (JsonParser p = parserFor("1 \"two\" [3]", false, 8)) {
            Assertions.assertEquals(1, p.parse().asInteger().getValue());
            Assertions.assertEquals("two", p.parse().asString().getValue());
            Assertions.assertEquals(3, p.parse().asArray().get(0).asInteger().getValue());
        }
    }

    @Test
    public void testDuplicateKeysLastWins() throws IOException {
        try (JsonParser p = parserFor("{\"a\": 1, \"b\": 2, \"a\": 3}", false, 8)) {
            JsonObject o = p.parse().asObject();
            Assertions.assertEquals(2, o.size());
            Assertions.assertEquals(3, o.get("a").asInteger().getValue());
            Assertions.assertEquals(Arrays.asList("a", "b"), Arrays.asList(o.keySet().toArray()));
        }
    }

    @Test
    public void testDuplicateKeysRejected() throws IOException {
        try (JsonParser p = parserFor("{\"a\": 1, \"a\": 3}", true, 8)) {
            JsonParseException e = Assertions.assertThrows(JsonParseException.class, p::parse);
            Assertions.assertTrue(e.getMessage().startsWith("Duplicate key 'a' in JSON object"), e.getMessage());
        }
    }

    @Test
    public void testMaxDepth() throws IOException {
        try (JsonParser p = parserFor("[[[1]]]", false, 3)) {
            Assertions.assertEquals(1, p.parse().asArray().get(0).asArray().get(0).asArray().size());
        }
        try (JsonParser p = parserFor("[[{\"a\": [1]}]]", false, 3)) {
            JsonParseException e = Assertions.assertThrows(JsonParseException.class, p::parse);
            Assertions.assertTrue(e.getMessage().startsWith("JSON nesting exceeds maximum depth of 3"), e.getMessage());
        }
    }

    @Test
    public void testDeepNestingDoesNotOverflowStack() {
        String text = String.join("", Collections.nCopies(100000, "["));
        Assertions.assertThrows(JsonParseException.class, () -> JsonParser.parse(text));
    }

    @Test
    public void testWrongTypeAccess() {
        JsonValue v = JsonParser.parse("[1]");
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, v::asObject);
        Assertions.assertEquals("ERROR: Expected JSON object but found array: [1]", e.getMessage());
    }

    @Test
    public void testTypeDescriptionIgnoresDefaultLocale() {
        Locale defaultLocale = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            Assertions.assertEquals("integer", JsonValueType.INTEGER.getDescription());
            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                    () -> JsonParser.parse("7").asString());
            Assertions.assertEquals("ERROR: Expected JSON string but found integer: 7", e.getMessage());
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test
    public void testValueEquality() {
        Assertions.assertEquals(JsonParser.parse("{\"a\": [1, \"b\"]}"), JsonParser.parse("{ \"a\" : [ 1 \"b\" ] }"));
        Assertions.assertNotEquals(JsonParser.parse("[1, 2]"), JsonParser.parse("[2, 1]"));
    }
}
