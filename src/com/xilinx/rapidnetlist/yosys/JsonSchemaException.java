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

import com.xilinx.rapidnetlist.json.JsonReadException;

/**
 * Thrown when a document is well-formed JSON but does not describe a valid
 * netlist, for example a port without a direction or a bit that is neither a
 * signal id nor a constant.
 */
public class JsonSchemaException extends JsonReadException {

    public JsonSchemaException(String message) {
        super(message);
    }
}
