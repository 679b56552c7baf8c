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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An instance of a primitive or black-box operation inside an
 * {@link RTLModule}, with named ports bound to signals.
 */
public class RTLCell extends RTLName {

    private final RTLModule module;

    private final String type;

    private Map<String, RTLSigSpec> connections;

    protected RTLCell(RTLModule module, String name, String type) {
        super(name);
        this.module = module;
        this.type = Objects.requireNonNull(type);
    }

    public RTLModule getModule() {
        return module;
    }

    public String getType() {
        return type;
    }

    /**
     * Binds a signal to a port of this cell, replacing any earlier binding.
     * @param portName Escaped name of the port
     * @param signal The signal driving or driven by the port
     */
    public void setPort(String portName, RTLSigSpec signal) {
        if (connections == null) connections = new LinkedHashMap<>();
        connections.put(portName, Objects.requireNonNull(signal));
    }

    /**
     * @param portName Escaped name of the port
     * @return The signal bound to the port, or null if the port is unconnected
     */
    public RTLSigSpec getPort(String portName) {
        return connections == null ? null : connections.get(portName);
    }

    public boolean hasPort(String portName) {
        return connections != null && connections.containsKey(portName);
    }

    public Map<String, RTLSigSpec> getConnections() {
        return connections == null ? Collections.emptyMap() : Collections.unmodifiableMap(connections);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        RTLCell other = (RTLCell) obj;
        if (module != other.module)
            return false;
        return super.equals(obj);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), System.identityHashCode(module));
    }
}
