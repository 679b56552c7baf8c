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
 * A named, fixed-width bit vector inside an {@link RTLModule}. A wire that is
 * flagged as input and/or output is one of its module's ports.
 */
public class RTLWire extends RTLName {

    private final RTLModule module;

    private final int width;

    private boolean portInput;

    private boolean portOutput;

    /** Position of this wire in its module's port list, starting at 1, or 0 if not a port */
    private int portId;

    protected RTLWire(RTLModule module, String name, int width) {
        super(name);
        if (width < 0) {
            throw new RuntimeException("ERROR: Wire " + name + " cannot have negative width " + width + ".");
        }
        this.module = module;
        this.width = width;
    }

    public RTLModule getModule() {
        return module;
    }

    public int getWidth() {
        return width;
    }

    public boolean isPortInput() {
        return portInput;
    }

    public void setPortInput(boolean portInput) {
        this.portInput = portInput;
    }

    public boolean isPortOutput() {
        return portOutput;
    }

    public void setPortOutput(boolean portOutput) {
        this.portOutput = portOutput;
    }

    public boolean isPort() {
        return portInput || portOutput;
    }

    public int getPortId() {
        return portId;
    }

    public void setPortId(int portId) {
        this.portId = portId;
    }

    /**
     * Gets the direction of this wire when it is a port.
     * @return The port direction, or null if this wire is not a port.
     */
    public RTLDirection getDirection() {
        if (portInput && portOutput) return RTLDirection.INOUT;
        if (portInput) return RTLDirection.INPUT;
        if (portOutput) return RTLDirection.OUTPUT;
        return null;
    }

    /**
     * @param offset Bit index within this wire
     * @return A reference to the requested bit
     */
    public RTLSigBit getBit(int offset) {
        return new RTLSigBit(this, offset);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        RTLWire other = (RTLWire) obj;
        if (module != other.module)
            return false;
        return super.equals(obj);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), System.identityHashCode(module));
    }
}
