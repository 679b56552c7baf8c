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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import com.xilinx.rapidnetlist.netlist.RTLDesign;
import com.xilinx.rapidnetlist.util.CodePerfTracker;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestReadJson {

    private static final String SUB_JSON = "{\"modules\": {\"sub\": {"
            + "\"ports\": {\"io\": {\"direction\": \"inout\", \"bits\": [2, 3, 4]}},"
            + "\"netnames\": {\"n\": {\"bits\": [2]}}}}}";

    @Test
    public void testCreateSummary() {
        RTLDesign design = JsonNetlistReader.readJsonString(TestJsonNetlistReader.COUNTER_JSON);
        JSONObject summary = ReadJson.createSummary(design);
        JSONObject counter = summary.getJSONObject("modules").getJSONObject("counter");

        Assertions.assertEquals(4, counter.getInt("wires"));
        Assertions.assertEquals(2, counter.getInt("cells"));
        Assertions.assertEquals(0, counter.getInt("connections"));

        JSONArray ports = counter.getJSONArray("ports");
        Assertions.assertEquals(2, ports.length());
        JSONObject clk = ports.getJSONObject(0);
        Assertions.assertEquals("clk", clk.getString("name"));
        Assertions.assertEquals(1, clk.getInt("id"));
        Assertions.assertEquals("input", clk.getString("direction"));
        Assertions.assertEquals(1, clk.getInt("width"));
        JSONObject q = ports.getJSONObject(1);
        Assertions.assertEquals("q", q.getString("name"));
        Assertions.assertEquals("output", q.getString("direction"));
        Assertions.assertEquals(2, q.getInt("width"));
    }

    @Test
    public void testReadFiles(@TempDir Path tempDir) throws IOException {
        Path counter = TestJsonNetlistReader.writeFile(tempDir, "counter.json", TestJsonNetlistReader.COUNTER_JSON);
        Path sub = TestJsonNetlistReader.writeFile(tempDir, "sub.json.gz", SUB_JSON);

        RTLDesign design = ReadJson.readFiles(Arrays.asList(counter, sub), false, CodePerfTracker.SILENT);
        Assertions.assertEquals(2, design.getModules().size());

        JSONObject sum = ReadJson.createSummary(design).getJSONObject("modules").getJSONObject("sub");
        Assertions.assertEquals("inout", sum.getJSONArray("ports").getJSONObject(0).getString("direction"));
        Assertions.assertEquals(1, sum.getInt("connections"));

        Assertions.assertThrows(ModuleNameConflictException.class,
                () -> ReadJson.readFiles(Arrays.asList(counter, counter), false, CodePerfTracker.SILENT));
    }

    @Test
    public void testMainWritesSummary(@TempDir Path tempDir) throws IOException {
        Path counter = TestJsonNetlistReader.writeFile(tempDir, "counter.json", TestJsonNetlistReader.COUNTER_JSON);
        Path out = tempDir.resolve("summary.json");
        ReadJson.main(new String[] {"--summary", out.toString(), counter.toString()});

        JSONObject summary = new JSONObject(new String(Files.readAllBytes(out), StandardCharsets.UTF_8));
        Assertions.assertTrue(summary.getJSONObject("modules").has("counter"));
    }

    @Test
    public void testHelp() {
        Assertions.assertDoesNotThrow(() -> ReadJson.main(new String[] {"-h"}));
        Assertions.assertDoesNotThrow(() -> ReadJson.main(new String[0]));
    }
}
