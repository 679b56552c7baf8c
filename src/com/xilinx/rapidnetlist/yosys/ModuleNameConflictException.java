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

/**
 * Thrown when a module in the JSON document has the same name as a module that
 * already exists in the target design.
 */
public class ModuleNameConflictException extends JsonSchemaException {

    private final String moduleName;

    public ModuleNameConflictException(String moduleName) {
        super("Re-definition of module " + moduleName + ".");
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
