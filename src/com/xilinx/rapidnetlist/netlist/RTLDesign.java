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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top level container of an RTL netlist: a set of uniquely named modules.
 */
public class RTLDesign {

    private final Map<String, RTLModule> modules = new LinkedHashMap<>();

    /**
     * Adds the provided module to the design. All modules must be unique by their name.
     * @param module The module to add.
     * @return The module that has been added.
     */
    public RTLModule addModule(RTLModule module) {
        if (module.getDesign() != null) {
            throw new RuntimeException("ERROR: Module " + module.getName() + " already belongs to a design.");
        }
        RTLModule existing = modules.putIfAbsent(module.getName(), module);
        if (existing != null) {
            throw new RuntimeException("ERROR: Failed to add module " + module.getName()
                    + ". The design already contains a module with the same name.");
        }
        module.setDesign(this);
        return module;
    }

    public RTLModule createModule(String name) {
        return addModule(new RTLModule(name));
    }

    public RTLModule getModule(String name) {
        return modules.get(name);
    }

    public boolean hasModule(String name) {
        return modules.containsKey(name);
    }

    public Collection<RTLModule> getModules() {
        return Collections.unmodifiableCollection(modules.values());
    }
}
