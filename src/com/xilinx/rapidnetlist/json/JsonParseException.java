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

/**
 * Thrown when the JSON text itself cannot be parsed.
 */
public class JsonParseException extends JsonReadException {

    /** Number of bytes consumed when the problem was detected, -1 if unknown */
    private final long byteOffset;

    public JsonParseException(String message, long byteOffset) {
        super(byteOffset < 0 ? message : message + " (before byte offset " + byteOffset + ")");
        this.byteOffset = byteOffset;
    }

    public JsonParseException(String message) {
        this(message, -1);
    }

    public long getByteOffset() {
        return byteOffset;
    }
}
