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
 * A collection of utility methods for RTL names and netlists.
 */
public class RTLTools {

    /** Prefix of names given by the user */
    public static final char PUBLIC_PREFIX = '\\';

    /** Prefix of names generated by tools */
    public static final char INTERNAL_PREFIX = '$';

    /**
     * Converts a name to its escaped form: names that already start with '\' or
     * '$' are kept as is, any other name gets a '\' prefix.
     * @param name The name to escape
     * @return The escaped name
     */
    public static String escapeId(String name) {
        if (name.length() > 0 && (name.charAt(0) == PUBLIC_PREFIX || name.charAt(0) == INTERNAL_PREFIX)) {
            return name;
        }
        return PUBLIC_PREFIX + name;
    }

    /**
     * Reverses {@link #escapeId(String)} where that does not make the name
     * ambiguous. Names of the form "\$..", "\\.." or "\<digit>.." as well as
     * internal "$" names are returned unchanged.
     * @param name An escaped name
     * @return The name for display to the user
     */
    public static String unescapeId(String name) {
        if (name.length() < 2 || name.charAt(0) != PUBLIC_PREFIX) {
            return name;
        }
        char c = name.charAt(1);
        if (c == INTERNAL_PREFIX || c == PUBLIC_PREFIX || Character.isDigit(c)) {
            return name;
        }
        return name.substring(1);
    }

    public static boolean isPublicName(String name) {
        return name.length() > 0 && name.charAt(0) == PUBLIC_PREFIX;
    }

    /**
     * Finds the bit driving the given bit by following the module's connections,
     * for example from a net name bit to the port bit it aliases.
     * @param module The module owning the connections
     * @param bit The bit to start from
     * @return The first bit along the chain that is not driven by another
     * connection, which may be bit itself or a constant.
     */
    public static RTLSigBit getDriver(RTLModule module, RTLSigBit bit) {
        RTLSigBit curr = bit;
        int steps = 0;
        int maxSteps = module.getConnections().size();
        boolean found = true;
        while (found && curr.isWire()) {
            found = false;
            for (RTLConnection c : module.getConnections()) {
                if (c.getLhs().equals(curr)) {
                    curr = c.getRhs();
                    found = true;
                    break;
                }
            }
            if (found && ++steps > maxSteps) {
                throw new RuntimeException("ERROR: Combinational connection loop through " + bit
                        + " in module " + module.getName() + ".");
            }
        }
        return curr;
    }
}
