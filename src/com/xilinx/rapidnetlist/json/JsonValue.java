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

/**
 * A node of the immutable value tree produced by {@link JsonParser}. Each node
 * exclusively owns its children.
 */
public abstract class JsonValue {

    public abstract JsonValueType getType();

    public boolean isString() {
        return getType() == JsonValueType.STRING;
    }

    public boolean isInteger() {
        return getType() == JsonValueType.INTEGER;
    }

    public boolean isArray() {
        return getType() == JsonValueType.ARRAY;
    }

    public boolean isObject() {
        return getType() == JsonValueType.OBJECT;
    }

    public JsonString asString() {
        return cast(JsonString.class, JsonValueType.STRING);
    }

    public JsonInteger asInteger() {
        return cast(JsonInteger.class, JsonValueType.INTEGER);
    }

    public JsonArray asArray() {
        return cast(JsonArray.class, JsonValueType.ARRAY);
    }

    public JsonObject asObject() {
        return cast(JsonObject.class, JsonValueType.OBJECT);
    }

    private <T extends JsonValue> T cast(Class<T> c, JsonValueType expected) {
        if (getType() != expected) {
            throw new IllegalStateException("ERROR: Expected JSON " + expected.getDescription()
                    + " but found " + getType().getDescription() + ": " + this);
        }
        return c.cast(this);
    }

    /**
     * Writes this value in compact JSON syntax.
     * @param sb The builder to append to.
     */
    protected abstract void appendTo(StringBuilder sb);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }
}
