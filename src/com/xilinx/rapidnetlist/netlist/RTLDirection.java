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

package com.xilinx.rapidnetlist.netlist;

/**
 * Provides basic directional options for module ports.
 */
public enum RTLDirection {
    INPUT("input"),
    OUTPUT("output"),
    INOUT("inout");

    private final String jsonName;

    RTLDirection(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * Gets the spelling of this direction in a Yosys JSON netlist.
     * @return "input", "output" or "inout"
     */
    public String getJsonName() {
        return jsonName;
    }

    /**
     * @param s Direction as spelled in a Yosys JSON netlist (case sensitive).
     * @return The matching direction, or null if s is not a known direction.
     */
    public static RTLDirection fromJsonName(String s) {
        for (RTLDirection d : values()) {
            if (d.jsonName.equals(s)) return d;
        }
        return null;
    }

    public boolean isInput() {
        return this != OUTPUT;
    }

    public boolean isOutput() {
        return this != INPUT;
    }
}
