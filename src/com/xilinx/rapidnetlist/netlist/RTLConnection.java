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
 * A directed connection inside a module: the value of the left hand side bit
 * is determined by the right hand side bit or constant.
 */
public final class RTLConnection {

    private final RTLSigBit lhs;

    private final RTLSigBit rhs;

    public RTLConnection(RTLSigBit lhs, RTLSigBit rhs) {
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    /**
     * @return The driven bit
     */
    public RTLSigBit getLhs() {
        return lhs;
    }

    /**
     * @return The driving bit or constant
     */
    public RTLSigBit getRhs() {
        return rhs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RTLConnection other = (RTLConnection) o;
        return lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }

    @Override
    public String toString() {
        return "assign " + lhs + " = " + rhs;
    }
}
