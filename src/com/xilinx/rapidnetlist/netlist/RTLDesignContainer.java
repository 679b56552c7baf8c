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
 * {@link NetlistContainer} that populates an {@link RTLDesign}.
 */
public class RTLDesignContainer implements NetlistContainer {

    private final RTLDesign design;

    public RTLDesignContainer(RTLDesign design) {
        this.design = design;
    }

    public RTLDesign getDesign() {
        return design;
    }

    @Override
    public boolean hasModule(String name) {
        return design.hasModule(name);
    }

    @Override
    public RTLModule createModule(String name) {
        return design.createModule(name);
    }

    @Override
    public RTLWire getOrCreateWire(RTLModule module, String name, int width) {
        RTLWire wire = module.getWire(name);
        if (wire == null) {
            wire = module.addWire(name, width);
        }
        return wire;
    }

    @Override
    public void setWireFlags(RTLWire wire, boolean isInput, boolean isOutput) {
        wire.setPortInput(isInput);
        wire.setPortOutput(isOutput);
    }

    @Override
    public void commitPorts(RTLModule module) {
        module.fixupPorts();
    }

    @Override
    public void connect(RTLModule module, RTLSigBit dst, RTLSigBit src) {
        module.connect(dst, src);
    }

    @Override
    public RTLCell createCell(RTLModule module, String name, String type) {
        return module.addCell(name, type);
    }

    @Override
    public RTLWire allocateAnonymousWire(RTLModule module, int width) {
        return module.addAnonymousWire(width);
    }

    @Override
    public void bindCellPort(RTLCell cell, String portName, RTLSigSpec signal) {
        cell.setPort(portName, signal);
    }
}
