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
 * A non-negative JSON integer that fits in an int.
 */
public final class JsonInteger extends JsonValue {

    private final int value;

    public JsonInteger(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public JsonValueType getType() {
        return JsonValueType.INTEGER;
    }

    @Override
    protected void appendTo(StringBuilder sb) {
        sb.append(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((JsonInteger) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }
}
