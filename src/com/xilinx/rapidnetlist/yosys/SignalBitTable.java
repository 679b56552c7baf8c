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

import java.util.HashMap;
import java.util.Map;

import com.xilinx.rapidnetlist.netlist.RTLSigBit;

/**
 * Maps the integer signal ids of one module's JSON description to the wire bit
 * currently standing for each id. Ids are local to a module, so every module
 * gets a fresh table.
 */
public class SignalBitTable {

    private final Map<Integer, RTLSigBit> bits = new HashMap<>();

    /**
     * @return The representative bit of the id, or null if the id has not been
     * seen yet
     */
    public RTLSigBit get(int signalId) {
        return bits.get(signalId);
    }

    public void put(int signalId, RTLSigBit bit) {
        bits.put(signalId, bit);
    }
}
