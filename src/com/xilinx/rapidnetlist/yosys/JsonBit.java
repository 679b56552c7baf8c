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


package com.xilinx.rapidnetlist.yosys;

import com.xilinx.rapidnetlist.json.JsonValue;
import com.xilinx.rapidnetlist.netlist.RTLState;

/**
 * One entry of a "bits" or cell connection array in a Yosys JSON netlist: either
 * a constant ("0", "1", "x" or "z") or an integer signal id shared by all bits
 * that are electrically the same.
 */
public final class JsonBit {

    private final RTLState constant;

    private final int signalId;

    private JsonBit(RTLState constant, int signalId) {
        this.constant = constant;
        this.signalId = signalId;
    }

    public static JsonBit constant(RTLState state) {
        return new JsonBit(state, -1);
    }

    public static JsonBit signal(int signalId) {
        return new JsonBit(null, signalId);
    }

    /**
     * Classifies one element of a bits array.
     * @param value The array element
     * @param context Description of the node holding the array, used in error
     * messages (e.g. "JSON port node 'a' of module 'top'")
     * @param index Position of the element within its array
     * @return The classified bit
     * @throws JsonSchemaException if the element is neither an integer nor one of
     * the four constant strings
     */
    public static JsonBit fromJson(JsonValue value, String context, int index) {
        if (value.isInteger()) {
            return signal(value.asInteger().getValue());
        }
        if (value.isString()) {
            String s = value.asString().getValue();
            RTLState state = RTLState.fromString(s);
            if (state == null) {
                throw new JsonSchemaException(context + " has invalid '" + s
                        + "' bit string value on bit " + index + ".");
            }
            return constant(state);
        }
        throw new JsonSchemaException(context + " has invalid bit value on bit " + index + ".");
    }

    public boolean isConstant() {
        return constant != null;
    }

    public RTLState getConstant() {
        return constant;
    }

    public int getSignalId() {
        return signalId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonBit)) return false;
        JsonBit other = (JsonBit) o;
        return constant == other.constant && signalId == other.signalId;
    }

    @Override
    public int hashCode() {
        return isConstant() ? constant.hashCode() : signalId;
    }

    @Override
    public String toString() {
        return isConstant() ? "\"" + constant.getChar() + "\"" : Integer.toString(signalId);
    }
}
