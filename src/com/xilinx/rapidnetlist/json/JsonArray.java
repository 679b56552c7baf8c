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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of JSON values.
 */
public final class JsonArray extends JsonValue implements Iterable<JsonValue> {

    public static final JsonArray EMPTY = new JsonArray(Collections.emptyList());

    private final List<JsonValue> values;

    public JsonArray(List<JsonValue> values) {
        this.values = values.isEmpty() ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public JsonValue get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public Iterator<JsonValue> iterator() {
        return values.iterator();
    }

    @Override
    public JsonValueType getType() {
        return JsonValueType.ARRAY;
    }

    @Override
    protected void appendTo(StringBuilder sb) {
        sb.append('[');
        boolean first = true;
        for (JsonValue v : values) {
            if (!first) sb.append(',');
            first = false;
            v.appendTo(sb);
        }
        sb.append(']');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((JsonArray) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
