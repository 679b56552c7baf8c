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

import java.util.Objects;

/**
 * A single bit of a signal: either one bit of a wire or a constant.
 * Instances are immutable.
 */
public final class RTLSigBit {

    private final RTLWire wire;

    private final int offset;

    private final RTLState state;

    public RTLSigBit(RTLState state) {
        this.wire = null;
        this.offset = 0;
        this.state = Objects.requireNonNull(state);
    }

    public RTLSigBit(RTLWire wire, int offset) {
        if (offset < 0 || offset >= wire.getWidth()) {
            throw new IndexOutOfBoundsException("ERROR: Bit " + offset + " is out of range for wire "
                    + wire.getName() + " of width " + wire.getWidth() + ".");
        }
        this.wire = wire;
        this.offset = offset;
        this.state = null;
    }

    public boolean isWire() {
        return wire != null;
    }

    public boolean isConstant() {
        return wire == null;
    }

    /**
     * @return The wire this bit belongs to, or null for a constant
     */
    public RTLWire getWire() {
        return wire;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * @return The constant value, or null for a wire bit
     */
    public RTLState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RTLSigBit other = (RTLSigBit) o;
        return offset == other.offset && state == other.state && Objects.equals(wire, other.wire);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wire, offset, state);
    }

    @Override
    public String toString() {
        if (isConstant()) {
            return state.toString();
        }
        if (wire.getWidth() == 1) {
            return wire.getName();
        }
        return wire.getName() + " [" + offset + "]";
    }
}
