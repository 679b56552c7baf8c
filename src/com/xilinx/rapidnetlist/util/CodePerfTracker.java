/*
 * Original work: Copyright (c) 2017-2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 * Modified work: Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * Author: Chris Lavin, Xilinx Research Labs.
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

package com.xilinx.rapidnetlist.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple tool for measuring and reporting the runtime of consecutive
 * segments of code.
 */
public class CodePerfTracker {

    private String name;

    private List<Long> runtimes;

    private List<String> segmentNames;

    private int maxRuntimeSize = 9;
    private int maxSegmentNameSize = 24;
    private boolean printProgress = true;
    private boolean verbose = true;

    public static final CodePerfTracker SILENT;

    static {
        SILENT = new CodePerfTracker("", false);
        SILENT.setVerbose(false);
    }

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        this.name = name;
        this.printProgress = printProgress;
        runtimes = new ArrayList<>();
        segmentNames = new ArrayList<>();
        if (this.printProgress && isVerbose() && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public String getName() {
        return name;
    }

    /**
     * Gets the recorded runtime of a finished segment.
     * @param segmentName Name the segment was started with.
     * @return Runtime in nanoseconds, or null if no segment of that name exists.
     */
    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    public CodePerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    public CodePerfTracker stop() {
        if (this == SILENT) return this;
        long end = System.nanoTime();
        int idx = runtimes.size()-1;
        if (idx < 0) return null;
        long start = runtimes.get(idx);
        runtimes.set(idx, end-start);
        if (printProgress && isVerbose()) {
            print(segmentNames.get(idx), runtimes.get(idx));
        }
        return this;
    }

    private void print(String segmentName, long runtime) {
        System.out.printf("%" + maxSegmentNameSize + "s: %" + maxRuntimeSize + ".3fs%n",
                segmentName, runtime / 1000000000.0);
    }

    public void printSummary() {
        if (this == SILENT || !isVerbose()) return;
        if (!printProgress) {
            MessageGenerator.printHeader(name);
            for (int i=0; i < runtimes.size(); i++) {
                print(segmentNames.get(i), runtimes.get(i));
            }
        }
        long totalRuntime = 0L;
        for (Long runtime : runtimes) {
            totalRuntime += runtime;
        }
        System.out.println("------------------------------------------------------------------------------");
        print("*Total*", totalRuntime);
    }
}
