/*
 * Original work: Copyright (c) 2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 * Modified work: Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * Author: Jakob Wenzel, Xilinx Research Labs.
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

package com.xilinx.rapidnetlist.util.function;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

import org.apache.commons.io.function.IOSupplier;

public interface InputStreamSupplier extends IOSupplier<InputStream> {
    static InputStreamSupplier fromPath(Path p) {
        return () -> getInputStream(p);
    }

    /**
     * Gets the InputStream for the provided file path. If the file is gzipped (*.gz
     * extension), the returned stream decompresses it on the fly.
     *
     * @param fileName Path to the file or gzipped file from which to get an
     *                 InputStream.
     * @return An InputStream of the file's (decompressed) contents.
     */
    public static InputStream getInputStream(Path fileName) {
        InputStream in = null;
        try {
            in = new FileInputStream(fileName.toString());
            if (fileName.toString().endsWith(".gz")) {
                // Using a larger buffer size for GZIPInputStream improves runtime
                in = new GZIPInputStream(in, 65536);
            }
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
        return in;
    }
}
