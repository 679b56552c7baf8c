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
 * The operations a netlist reader needs from the netlist it populates. Readers
 * only ever add to the container; they never remove or resize anything.
 */
public interface NetlistContainer {

    /**
     * @param name Escaped module name
     * @return True if a module of that name already exists.
     */
    public boolean hasModule(String name);

    /**
     * Creates an empty module.
     * @param name Escaped module name
     * @return The new module
     * @throws RuntimeException if a module of that name already exists
     */
    public RTLModule createModule(String name);

    /**
     * Gets the wire of the given name, creating it with the given width if the
     * module does not have one yet. An existing wire keeps its width.
     */
    public RTLWire getOrCreateWire(RTLModule module, String name, int width);

    public void setWireFlags(RTLWire wire, boolean isInput, boolean isOutput);

    /**
     * Finalizes port numbering and order after all port wires have been flagged.
     */
    public void commitPorts(RTLModule module);

    /**
     * Records that dst is driven by src.
     */
    public void connect(RTLModule module, RTLSigBit dst, RTLSigBit src);

    public RTLCell createCell(RTLModule module, String name, String type);

    /**
     * Creates a wire with a generated, unused name.
     */
    public RTLWire allocateAnonymousWire(RTLModule module, int width);

    public void bindCellPort(RTLCell cell, String portName, RTLSigSpec signal);
}
