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
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.xilinx.rapidnetlist.json.JsonReadException;
import com.xilinx.rapidnetlist.netlist.RTLDesign;
import com.xilinx.rapidnetlist.netlist.RTLDesignContainer;
import com.xilinx.rapidnetlist.netlist.RTLModule;
import com.xilinx.rapidnetlist.netlist.RTLTools;
import com.xilinx.rapidnetlist.netlist.RTLWire;
import com.xilinx.rapidnetlist.util.CodePerfTracker;
import com.xilinx.rapidnetlist.util.MessageGenerator;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import org.apache.commons.io.FilenameUtils;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Reads one or more Yosys JSON netlist files into a single design and reports a
 * summary of every module that was imported.
 */
public class ReadJson {

    private static final List<String> HELP_OPTS = Arrays.asList("h", "help");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> SUMMARY_OPTS = Arrays.asList("s", "summary");

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(SUMMARY_OPTS, "Write the JSON summary to this file instead of standard out").withRequiredArg();
                acceptsAll(VERBOSE_OPTS, "Print each module as it is imported and the runtime of each phase");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
                nonOptions("Yosys JSON netlist files (*.json or *.json.gz)");
            }
        };
    }

    private static void printHelp(OptionParser p) {
        MessageGenerator.printHeader("ReadJson");
        System.out.println("Reads Yosys JSON netlists into one design and summarizes its modules.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            e.printStackTrace();
        }
    }

    /**
     * Reads the given files, in order, into a new design.
     * @param fileNames JSON netlist files
     * @param verbose Print each imported module
     * @param t Tracks the runtime of parsing and importing each file
     * @return The design holding the modules of all files
     */
    public static RTLDesign readFiles(List<Path> fileNames, boolean verbose, CodePerfTracker t) {
        RTLDesign design = new RTLDesign();
        JsonNetlistImporter importer = new JsonNetlistImporter(new RTLDesignContainer(design));
        importer.setVerbose(verbose);
        for (Path fileName : fileNames) {
            JsonNetlistReader.readJsonFile(fileName, importer, t);
        }
        return design;
    }

    /**
     * Summarizes a design: per module its ports in port order and the number of
     * wires, cells and connections.
     * @param design The design to summarize
     * @return A JSON object with one member per module, keyed by the unescaped
     * module name
     */
    public static JSONObject createSummary(RTLDesign design) {
        JSONObject modules = new JSONObject();
        for (RTLModule m : design.getModules()) {
            JSONObject module = new JSONObject();
            JSONArray ports = new JSONArray();
            for (RTLWire w : m.getPorts()) {
                JSONObject port = new JSONObject();
                port.put("name", RTLTools.unescapeId(w.getName()));
                port.put("id", w.getPortId());
                port.put("direction", w.getDirection().getJsonName());
                port.put("width", w.getWidth());
                ports.put(port);
            }
            module.put("ports", ports);
            module.put("wires", m.getWires().size());
            module.put("cells", m.getCells().size());
            module.put("connections", m.getConnections().size());
            modules.put(RTLTools.unescapeId(m.getName()), module);
        }
        JSONObject summary = new JSONObject();
        summary.put("modules", modules);
        return summary;
    }

    public static void main(String[] args) {
        OptionParser p = createOptionParser();
        OptionSet options = null;
        try {
            options = p.parse(args);
        } catch (OptionException e) {
            MessageGenerator.briefErrorAndExit("ERROR: " + e.getMessage());
        }
        if (options.has(HELP_OPTS.get(0)) || options.nonOptionArguments().isEmpty()) {
            printHelp(p);
            return;
        }

        boolean verbose = options.has(VERBOSE_OPTS.get(0));
        CodePerfTracker t = verbose ? new CodePerfTracker(ReadJson.class.getSimpleName()) : CodePerfTracker.SILENT;

        List<Path> fileNames = new ArrayList<>();
        for (Object arg : options.nonOptionArguments()) {
            String fileName = arg.toString();
            if (!"json".equals(FilenameUtils.getExtension(FilenameUtils.removeExtension(fileName)))
                    && !"json".equals(FilenameUtils.getExtension(fileName))) {
                MessageGenerator.briefError("WARNING: " + fileName + " does not have a .json extension.");
            }
            fileNames.add(Paths.get(fileName));
        }

        RTLDesign design = null;
        try {
            design = readFiles(fileNames, verbose, t);
        } catch (JsonReadException | UncheckedIOException e) {
            MessageGenerator.briefErrorAndExit("ERROR: " + e.getMessage());
        }

        String summary = createSummary(design).toString(4);
        if (options.has(SUMMARY_OPTS.get(0))) {
            Path out = Paths.get((String) options.valueOf(SUMMARY_OPTS.get(0)));
            try {
                Files.write(out, summary.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("ERROR: Couldn't write file : " + out, e);
            }
        } else {
            System.out.println(summary);
        }
        t.printSummary();
    }
}
