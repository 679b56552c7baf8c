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
 * The four logic values a bit can be tied to.
 */
public enum RTLState {
    /** Logic 0 */
    S0('0'),
    /** Logic 1 */
    S1('1'),
    /** Undefined */
    Sx('x'),
    /** High impedance */
    Sz('z');

    private final char c;

    RTLState(char c) {
        this.c = c;
    }

    public char getChar() {
        return c;
    }

    /**
     * Looks up the state spelled by a single character string.
     * @param s One of "0", "1", "x" or "z".
     * @return The matching state, or null if s spells none of them.
     */
    public static RTLState fromString(String s) {
        if (s.length() != 1) return null;
        switch (s.charAt(0)) {
            case '0': return S0;
            case '1': return S1;
            case 'x': return Sx;
            case 'z': return Sz;
            default: return null;
        }
    }

    @Override
    public String toString() {
        return "1'" + c;
    }
}
