/*
 * Original work: Copyright (c) 2017-2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 * Modified work: Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * Author: Chris Lavin, Xilinx Research Labs.
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
 * Common ancestor of the named RTL netlist objects. Names are stored in their
 * escaped form, see {@link RTLTools#escapeId(String)}.
 */
public class RTLName implements Comparable<RTLName> {
    /** Name of the RTL object */
    private final String name;

    public RTLName(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        RTLName other = (RTLName) obj;
        return Objects.equals(name, other.name);
    }

    public String toString() {
        return name;
    }

    public int compareTo(RTLName o) {
        return this.getName().compareTo(o.getName());
    }
}
