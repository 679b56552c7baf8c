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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A mapping from unique keys to JSON values that iterates in document order.
 */
public final class JsonObject extends JsonValue {

    public static final JsonObject EMPTY = new JsonObject(Collections.emptyMap());

    private final Map<String, JsonValue> members;

    public JsonObject(Map<String, JsonValue> members) {
        this.members = members.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    /**
     * @param key Name of the member
     * @return The value of the member, or null if this object has no such key.
     */
    public JsonValue get(String key) {
        return members.get(key);
    }

    public boolean containsKey(String key) {
        return members.containsKey(key);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public Set<String> keySet() {
        return members.keySet();
    }

    /**
     * @return An unmodifiable view of the members, in document order
     */
    public Set<Map.Entry<String, JsonValue>> entrySet() {
        return members.entrySet();
    }

    @Override
    public JsonValueType getType() {
        return JsonValueType.OBJECT;
    }

    @Override
    protected void appendTo(StringBuilder sb) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, JsonValue> e : members.entrySet()) {
            if (!first) sb.append(',');
            first = false;
            new JsonString(e.getKey()).appendTo(sb);
            sb.append(':');
            e.getValue().appendTo(sb);
        }
        sb.append('}');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return members.equals(((JsonObject) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }
}
