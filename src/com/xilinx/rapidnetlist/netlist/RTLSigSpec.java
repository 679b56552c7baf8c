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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered sequence of signal bits, least significant bit first, such as the
 * signal bound to a cell port.
 */
public class RTLSigSpec {

    private final List<RTLSigBit> bits;

    public RTLSigSpec() {
        bits = new ArrayList<>();
    }

    /**
     * Creates a signal covering every bit of a wire.
     * @param wire The wire to reference
     */
    public RTLSigSpec(RTLWire wire) {
        bits = new ArrayList<>(wire.getWidth());
        for (int i = 0; i < wire.getWidth(); i++) {
            bits.add(wire.getBit(i));
        }
    }

    public RTLSigSpec(List<RTLSigBit> bits) {
        this.bits = new ArrayList<>(bits);
    }

    public RTLSigSpec append(RTLSigBit bit) {
        bits.add(bit);
        return this;
    }

    public RTLSigSpec append(RTLState state) {
        return append(new RTLSigBit(state));
    }

    public RTLSigSpec append(RTLSigSpec other) {
        bits.addAll(other.bits);
        return this;
    }

    public int size() {
        return bits.size();
    }

    public RTLSigBit getBit(int index) {
        return bits.get(index);
    }

    public List<RTLSigBit> getBits() {
        return Collections.unmodifiableList(bits);
    }

    public boolean isFullyConst() {
        for (RTLSigBit bit : bits) {
            if (bit.isWire()) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return bits.equals(((RTLSigSpec) o).bits);
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public String toString() {
        if (bits.size() == 1) {
            return bits.get(0).toString();
        }
        StringBuilder sb = new StringBuilder("{");
        for (int i = bits.size() - 1; i >= 0; i--) {
            sb.append(' ').append(bits.get(i));
        }
        return sb.append(" }").toString();
    }
}
