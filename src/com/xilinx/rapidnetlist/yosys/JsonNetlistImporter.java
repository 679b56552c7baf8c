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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;

import com.xilinx.rapidnetlist.json.JsonArray;
import com.xilinx.rapidnetlist.json.JsonObject;
import com.xilinx.rapidnetlist.json.JsonValue;
import com.xilinx.rapidnetlist.netlist.NetlistContainer;
import com.xilinx.rapidnetlist.netlist.RTLCell;
import com.xilinx.rapidnetlist.netlist.RTLDirection;
import com.xilinx.rapidnetlist.netlist.RTLModule;
import com.xilinx.rapidnetlist.netlist.RTLSigBit;
import com.xilinx.rapidnetlist.netlist.RTLSigSpec;
import com.xilinx.rapidnetlist.netlist.RTLTools;
import com.xilinx.rapidnetlist.netlist.RTLWire;
import com.xilinx.rapidnetlist.util.MessageGenerator;
import com.xilinx.rapidnetlist.util.Params;
import org.jetbrains.annotations.NotNull;

/**
 * Turns the value tree of a Yosys JSON netlist (as written by "write_json") into
 * modules, wires, cells and connections of a {@link NetlistContainer}.
 *
 * Each module is imported in three passes over its "ports", "netnames" and
 * "cells" members. Bits that share a signal id are tied together through
 * connections to a representative bit kept in a per-module
 * {@link SignalBitTable}. Attributes and parameters are not imported.
 *
 * Any violation of the netlist schema aborts the import with a
 * {@link JsonSchemaException}. Changes applied to the container before the
 * failure are not rolled back.
 */
public class JsonNetlistImporter {

    public static final String MODULES = "modules";
    public static final String PORTS = "ports";
    public static final String NETNAMES = "netnames";
    public static final String CELLS = "cells";
    public static final String DIRECTION = "direction";
    public static final String BITS = "bits";
    public static final String TYPE = "type";
    public static final String CONNECTIONS = "connections";

    private final NetlistContainer container;

    private boolean verbose = Params.RN_VERBOSE_JSON_IMPORT;

    public JsonNetlistImporter(@NotNull NetlistContainer container) {
        this.container = container;
    }

    /**
     * Imports every module of a parsed JSON netlist into a container.
     * @param root Root of the parsed document
     * @param container Receives the imported modules
     * @return The modules created, in document order
     */
    public static List<RTLModule> importDesign(JsonValue root, NetlistContainer container) {
        return new JsonNetlistImporter(container).importDesign(root);
    }

    public NetlistContainer getContainer() {
        return container;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Imports every module of a parsed JSON netlist.
     * @param root Root of the parsed document, expected to be an object with an
     * optional "modules" member.
     * @return The modules created, in document order
     */
    public List<RTLModule> importDesign(JsonValue root) {
        if (!root.isObject()) {
            throw new JsonSchemaException("JSON root node is not an object.");
        }
        JsonValue modules = root.asObject().get(MODULES);
        if (modules == null) {
            return Collections.emptyList();
        }
        if (!modules.isObject()) {
            throw new JsonSchemaException("JSON modules node is not an object.");
        }
        List<RTLModule> imported = new ArrayList<>();
        for (Entry<String, JsonValue> e : modules.asObject().entrySet()) {
            imported.add(importModule(e.getKey(), e.getValue()));
        }
        return imported;
    }

    /**
     * Imports a single module.
     * @param moduleName Name of the module as it appears in the document
     * @param moduleNode The module's member of the "modules" object
     * @return The new module
     * @throws ModuleNameConflictException if the container already has a module
     * of that name
     */
    public RTLModule importModule(String moduleName, JsonValue moduleNode) {
        String name = RTLTools.escapeId(moduleName);
        if (!moduleNode.isObject()) {
            throw new JsonSchemaException("JSON module node '" + moduleName + "' is not an object.");
        }
        if (container.hasModule(name)) {
            throw new ModuleNameConflictException(RTLTools.unescapeId(name));
        }
        if (verbose) {
            MessageGenerator.briefMessage("Importing module " + RTLTools.unescapeId(name) + " from JSON tree.");
        }

        JsonObject node = moduleNode.asObject();
        RTLModule module = container.createModule(name);
        String where = " of module '" + moduleName + "'";
        SignalBitTable table = new SignalBitTable();

        JsonValue ports = node.get(PORTS);
        if (ports != null) {
            for (Entry<String, JsonValue> e : getMembers(ports, "JSON ports node" + where).entrySet()) {
                importPort(module, table, e.getKey(), e.getValue(), where);
            }
            container.commitPorts(module);
        }

        JsonValue netnames = node.get(NETNAMES);
        if (netnames != null) {
            for (Entry<String, JsonValue> e : getMembers(netnames, "JSON netnames node" + where).entrySet()) {
                importNetname(module, table, e.getKey(), e.getValue(), where);
            }
        }

        JsonValue cells = node.get(CELLS);
        if (cells != null) {
            for (Entry<String, JsonValue> e : getMembers(cells, "JSON cells node" + where).entrySet()) {
                importCell(module, table, e.getKey(), e.getValue(), where);
            }
        }
        return module;
    }

    private static JsonObject getMembers(JsonValue value, String context) {
        if (!value.isObject()) {
            throw new JsonSchemaException(context + " is not an object.");
        }
        return value.asObject();
    }

    private static JsonArray getBits(JsonObject node, String context) {
        JsonValue bits = node.get(BITS);
        if (bits == null) {
            throw new JsonSchemaException(context + " has no bits attribute.");
        }
        if (!bits.isArray()) {
            throw new JsonSchemaException(context + " has non-array bits attribute.");
        }
        return bits.asArray();
    }

    private static List<JsonBit> classifyBits(JsonArray bits, String context) {
        List<JsonBit> result = new ArrayList<>(bits.size());
        for (int i = 0; i < bits.size(); i++) {
            result.add(JsonBit.fromJson(bits.get(i), context, i));
        }
        return result;
    }

    /**
     * Returns the wire of the given name, creating it if needed. A wire that
     * already exists must be wide enough for every bit listed in the document.
     */
    private RTLWire getWire(RTLModule module, String name, int width, String context) {
        RTLWire wire = container.getOrCreateWire(module, name, width);
        if (wire.getWidth() < width) {
            throw new JsonSchemaException(context + " has " + width
                    + " bits but the existing wire " + RTLTools.unescapeId(name)
                    + " is only " + wire.getWidth() + " bits wide.");
        }
        return wire;
    }

    private void importPort(RTLModule module, SignalBitTable table, String portName, JsonValue portNode,
                            String where) {
        String context = "JSON port node '" + portName + "'" + where;
        if (!portNode.isObject()) {
            throw new JsonSchemaException(context + " is not an object.");
        }
        JsonObject port = portNode.asObject();
        JsonValue dirNode = port.get(DIRECTION);
        if (dirNode == null) {
            throw new JsonSchemaException(context + " has no direction attribute.");
        }
        if (!dirNode.isString()) {
            throw new JsonSchemaException(context + " has non-string direction attribute.");
        }
        RTLDirection dir = RTLDirection.fromJsonName(dirNode.asString().getValue());
        if (dir == null) {
            throw new JsonSchemaException(context + " has invalid direction '"
                    + dirNode.asString().getValue() + "'.");
        }
        List<JsonBit> bits = classifyBits(getBits(port, context), context);

        RTLWire wire = getWire(module, RTLTools.escapeId(portName), bits.size(), context);
        container.setWireFlags(wire, wire.isPortInput() || dir.isInput(), wire.isPortOutput() || dir.isOutput());

        for (int i = 0; i < bits.size(); i++) {
            JsonBit bit = bits.get(i);
            RTLSigBit sigbit = wire.getBit(i);
            if (bit.isConstant()) {
                container.connect(module, sigbit, new RTLSigBit(bit.getConstant()));
                continue;
            }
            int id = bit.getSignalId();
            RTLSigBit rep = table.get(id);
            if (rep == null) {
                table.put(id, sigbit);
            } else if (wire.isPortOutput()) {
                container.connect(module, sigbit, rep);
            } else {
                container.connect(module, rep, sigbit);
                table.put(id, sigbit);
            }
        }
    }

    private void importNetname(RTLModule module, SignalBitTable table, String netName, JsonValue netNode,
                               String where) {
        String context = "JSON netname node '" + netName + "'" + where;
        if (!netNode.isObject()) {
            throw new JsonSchemaException(context + " is not an object.");
        }
        List<JsonBit> bits = classifyBits(getBits(netNode.asObject(), context), context);

        RTLWire wire = getWire(module, RTLTools.escapeId(netName), bits.size(), context);
        for (int i = 0; i < bits.size(); i++) {
            JsonBit bit = bits.get(i);
            RTLSigBit sigbit = wire.getBit(i);
            if (bit.isConstant()) {
                container.connect(module, sigbit, new RTLSigBit(bit.getConstant()));
                continue;
            }
            int id = bit.getSignalId();
            RTLSigBit rep = table.get(id);
            if (rep == null) {
                table.put(id, sigbit);
            } else if (!sigbit.equals(rep)) {
                container.connect(module, sigbit, rep);
            }
        }
    }

    private void importCell(RTLModule module, SignalBitTable table, String cellName, JsonValue cellNode,
                            String where) {
        String context = "JSON cells node '" + cellName + "'" + where;
        if (!cellNode.isObject()) {
            throw new JsonSchemaException(context + " is not an object.");
        }
        JsonObject cellObj = cellNode.asObject();
        JsonValue typeNode = cellObj.get(TYPE);
        if (typeNode == null) {
            throw new JsonSchemaException(context + " has no type attribute.");
        }
        if (!typeNode.isString()) {
            throw new JsonSchemaException(context + " has a non-string type.");
        }
        JsonValue connNode = cellObj.get(CONNECTIONS);
        if (connNode == null) {
            throw new JsonSchemaException(context + " has no connections attribute.");
        }
        if (!connNode.isObject()) {
            throw new JsonSchemaException(context + " has non-object connections attribute.");
        }
        String name = RTLTools.escapeId(cellName);
        if (module.getWire(name) != null || module.getCell(name) != null) {
            throw new JsonSchemaException(context + " has the same name as an existing wire or cell.");
        }

        RTLCell cell = container.createCell(module, name, RTLTools.escapeId(typeNode.asString().getValue()));
        for (Entry<String, JsonValue> e : connNode.asObject().entrySet()) {
            String connContext = context + " connection '" + e.getKey() + "'";
            if (!e.getValue().isArray()) {
                throw new JsonSchemaException(connContext + " is not an array.");
            }
            List<JsonBit> bits = classifyBits(e.getValue().asArray(), connContext);
            RTLSigSpec sig = new RTLSigSpec();
            for (JsonBit bit : bits) {
                if (bit.isConstant()) {
                    sig.append(bit.getConstant());
                    continue;
                }
                RTLSigBit rep = table.get(bit.getSignalId());
                if (rep == null) {
                    rep = container.allocateAnonymousWire(module, 1).getBit(0);
                    table.put(bit.getSignalId(), rep);
                }
                sig.append(rep);
            }
            container.bindCellPort(cell, RTLTools.escapeId(e.getKey()), sig);
        }
    }
}
