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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A module of an {@link RTLDesign}: its wires, cells and the connections
 * between wire bits.
 */
public class RTLModule extends RTLName {

    public static final String ANONYMOUS_WIRE_PREFIX = "$auto$json$";

    private RTLDesign design;

    private final Map<String, RTLWire> wires = new LinkedHashMap<>();

    private final Map<String, RTLCell> cells = new LinkedHashMap<>();

    private final List<RTLConnection> connections = new ArrayList<>();

    private final List<RTLWire> ports = new ArrayList<>();

    private int autoIdx = 0;

    public RTLModule(String name) {
        super(name);
    }

    public RTLDesign getDesign() {
        return design;
    }

    protected void setDesign(RTLDesign design) {
        this.design = design;
    }

    /**
     * Creates a new wire in this module.
     * @param name Escaped name of the wire, unique within this module
     * @param width Number of bits
     * @return The new wire
     */
    public RTLWire addWire(String name, int width) {
        if (wires.containsKey(name) || cells.containsKey(name)) {
            throw new RuntimeException("ERROR: Failed to add wire " + name + " to module "
                    + getName() + ". The module already contains an object with the same name.");
        }
        RTLWire wire = new RTLWire(this, name, width);
        wires.put(name, wire);
        return wire;
    }

    /**
     * Creates a wire with a generated name that is not used by any other wire or
     * cell of this module.
     * @param width Number of bits
     * @return The new wire
     */
    public RTLWire addAnonymousWire(int width) {
        String name;
        do {
            name = ANONYMOUS_WIRE_PREFIX + (++autoIdx);
        } while (wires.containsKey(name) || cells.containsKey(name));
        return addWire(name, width);
    }

    public RTLWire getWire(String name) {
        return wires.get(name);
    }

    public Collection<RTLWire> getWires() {
        return Collections.unmodifiableCollection(wires.values());
    }

    /**
     * Creates a new cell instance in this module.
     * @param name Escaped name of the cell, unique within this module
     * @param type Escaped type of the cell
     * @return The new cell
     */
    public RTLCell addCell(String name, String type) {
        if (cells.containsKey(name) || wires.containsKey(name)) {
            throw new RuntimeException("ERROR: Failed to add cell " + name + " to module "
                    + getName() + ". The module already contains an object with the same name.");
        }
        RTLCell cell = new RTLCell(this, name, type);
        cells.put(name, cell);
        return cell;
    }

    public RTLCell getCell(String name) {
        return cells.get(name);
    }

    public Collection<RTLCell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    /**
     * Records that lhs is driven by rhs.
     * @param lhs A bit of a wire of this module
     * @param rhs A bit of a wire of this module, or a constant
     */
    public void connect(RTLSigBit lhs, RTLSigBit rhs) {
        if (lhs.isConstant()) {
            throw new RuntimeException("ERROR: Cannot drive constant " + lhs + " in module " + getName() + ".");
        }
        checkOwnBit(lhs);
        checkOwnBit(rhs);
        connections.add(new RTLConnection(lhs, rhs));
    }

    private void checkOwnBit(RTLSigBit bit) {
        if (bit.isWire() && bit.getWire().getModule() != this) {
            throw new RuntimeException("ERROR: Bit " + bit + " belongs to module "
                    + bit.getWire().getModule().getName() + ", not " + getName() + ".");
        }
    }

    public List<RTLConnection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    /**
     * Rebuilds the port list from the wires flagged as input or output. Wires that
     * already carry a port id keep their relative order and come first, the rest
     * follow sorted by name. Ports are then numbered from 1 and every other wire
     * gets port id 0.
     */
    public void fixupPorts() {
        List<RTLWire> portWires = new ArrayList<>();
        for (RTLWire w : wires.values()) {
            if (w.isPort()) {
                portWires.add(w);
            } else {
                w.setPortId(0);
            }
        }
        portWires.sort(Comparator.<RTLWire>comparingInt(w -> w.getPortId() == 0 ? Integer.MAX_VALUE : w.getPortId())
                .thenComparing(RTLWire::getName));
        ports.clear();
        for (RTLWire w : portWires) {
            ports.add(w);
            w.setPortId(ports.size());
        }
    }

    /**
     * @return The port wires in port order, as of the last {@link #fixupPorts()}
     */
    public List<RTLWire> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        RTLModule other = (RTLModule) obj;
        if (design != other.design)
            return false;
        return super.equals(obj);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
