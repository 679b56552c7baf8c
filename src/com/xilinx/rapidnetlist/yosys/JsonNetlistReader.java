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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import com.xilinx.rapidnetlist.json.JsonParser;
import com.xilinx.rapidnetlist.json.JsonReader;
import com.xilinx.rapidnetlist.json.JsonValue;
import com.xilinx.rapidnetlist.netlist.NetlistContainer;
import com.xilinx.rapidnetlist.netlist.RTLDesign;
import com.xilinx.rapidnetlist.netlist.RTLDesignContainer;
import com.xilinx.rapidnetlist.netlist.RTLModule;
import com.xilinx.rapidnetlist.util.CodePerfTracker;
import com.xilinx.rapidnetlist.util.function.InputStreamSupplier;

/**
 * Entry points for reading Yosys JSON netlist files (optionally gzipped) into an
 * {@link RTLDesign}.
 */
public class JsonNetlistReader {

    public static final String PARSE_SEGMENT = "Parse JSON";

    public static final String IMPORT_SEGMENT = "Import Netlist";

    public static RTLDesign readJsonFile(Path fileName) {
        RTLDesign design = new RTLDesign();
        readJsonFile(fileName, new RTLDesignContainer(design));
        return design;
    }

    public static RTLDesign readJsonFile(String fileName) {
        return readJsonFile(Paths.get(fileName));
    }

    public static List<RTLModule> readJsonFile(Path fileName, NetlistContainer container) {
        return readJsonFile(fileName, container, CodePerfTracker.SILENT);
    }

    /**
     * Reads a JSON netlist file into a container, timing the parse and import
     * phases separately.
     * @param fileName The file to read; a name ending in ".gz" is decompressed
     * @param container Receives the imported modules
     * @param t Tracker for the runtime of each phase
     * @return The modules created, in document order
     */
    public static List<RTLModule> readJsonFile(Path fileName, NetlistContainer container, CodePerfTracker t) {
        return readJsonFile(fileName, new JsonNetlistImporter(container), t);
    }

    public static List<RTLModule> readJsonFile(Path fileName, JsonNetlistImporter importer, CodePerfTracker t) {
        return readJson(fileName, InputStreamSupplier.fromPath(fileName), importer, t);
    }

    /**
     * Parses one JSON document from a stream and imports it. The stream is not
     * closed, see {@link JsonParser#parse(InputStream)} for where it is left.
     */
    public static List<RTLModule> loadJsonStream(InputStream in, NetlistContainer container) {
        JsonValue root = JsonParser.parse(in);
        return JsonNetlistImporter.importDesign(root, container);
    }

    public static RTLDesign readJsonString(String json) {
        RTLDesign design = new RTLDesign();
        JsonNetlistImporter.importDesign(JsonParser.parse(json), new RTLDesignContainer(design));
        return design;
    }

    private static List<RTLModule> readJson(Path fileName, InputStreamSupplier supplier,
                                            JsonNetlistImporter importer, CodePerfTracker t) {
        JsonValue root;
        t.start(PARSE_SEGMENT);
        try (JsonParser p = new JsonParser(new JsonReader(fileName, supplier.get()))) {
            root = p.parse();
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't read file : " + fileName, e);
        }
        t.stop().start(IMPORT_SEGMENT);
        List<RTLModule> modules = importer.importDesign(root);
        t.stop();
        return modules;
    }
}
