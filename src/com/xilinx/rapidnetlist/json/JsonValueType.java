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

package com.xilinx.rapidnetlist.json;

import java.util.Locale;

/**
 * The kinds of values produced by {@link JsonParser}.
 */
public enum JsonValueType {
    STRING,
    INTEGER,
    ARRAY,
    OBJECT;

    /**
     * Gets the lower case name used in error messages.
     * @return The name of the type, for example "object".
     */
    public String getDescription() {
        return name().toLowerCase(Locale.ROOT);
    }
}
