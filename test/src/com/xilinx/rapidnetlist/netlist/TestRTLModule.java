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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestRTLModule {

    private static List<String> names(List<RTLWire> wires) {
        return wires.stream().map(RTLWire::getName).collect(Collectors.toList());
    }

    @Test
    public void testAddWire() {
        RTLModule m = new RTLModule("\\top");
        RTLWire w = m.addWire("\\a", 4);
        Assertions.assertSame(w, m.getWire("\\a"));
        Assertions.assertSame(m, w.getModule());
        Assertions.assertEquals(4, w.getWidth());
        Assertions.assertFalse(w.isPort());
        Assertions.assertNull(w.getDirection());
        Assertions.assertNull(m.getWire("\\b"));
    }

    @Test
    public void testDuplicateNames() {
        RTLModule m = new RTLModule("\\top");
        m.addWire("\\a", 1);
        m.addCell("\\c", "\\BUF");
        Assertions.assertThrows(RuntimeException.class, () -> m.addWire("\\a", 2));
        Assertions.assertThrows(RuntimeException.class, () -> m.addWire("\\c", 1));
        Assertions.assertThrows(RuntimeException.class, () -> m.addCell("\\a", "\\BUF"));
        Assertions.assertEquals(1, m.getWires().size());
        Assertions.assertEquals(1, m.getCells().size());
    }

    @Test
    public void testNegativeWidth() {
        RTLModule m = new RTLModule("\\top");
        Assertions.assertThrows(RuntimeException.class, () -> m.addWire("\\a", -1));
    }

    @Test
    public void testAnonymousWires() {
        RTLModule m = new RTLModule("\\top");
        m.addWire("$auto$json$2", 1);
        Assertions.assertEquals("$auto$json$1", m.addAnonymousWire(1).getName());
        Assertions.assertEquals("$auto$json$3", m.addAnonymousWire(1).getName());

        RTLModule other = new RTLModule("\\other");
        Assertions.assertEquals("$auto$json$1", other.addAnonymousWire(2).getName());
    }

    @Test
    public void testConnect() {
        RTLModule m = new RTLModule("\\top");
        RTLWire a = m.addWire("\\a", 2);
        RTLWire b = m.addWire("\\b", 1);
        m.connect(a.getBit(1), b.getBit(0));
        m.connect(a.getBit(0), new RTLSigBit(RTLState.S1));

        Assertions.assertEquals(Arrays.asList(
                new RTLConnection(a.getBit(1), b.getBit(0)),
                new RTLConnection(a.getBit(0), new RTLSigBit(RTLState.S1))), m.getConnections());
        Assertions.assertEquals("assign \\a [1] = \\b", m.getConnections().get(0).toString());
        Assertions.assertEquals("assign \\a [0] = 1'1", m.getConnections().get(1).toString());
    }

    @Test
    public void testConnectInvalid() {
        RTLModule m = new RTLModule("\\top");
        RTLModule other = new RTLModule("\\other");
        RTLWire a = m.addWire("\\a", 1);
        RTLWire x = other.addWire("\\x", 1);
        Assertions.assertThrows(RuntimeException.class, () -> m.connect(new RTLSigBit(RTLState.S0), a.getBit(0)));
        Assertions.assertThrows(RuntimeException.class, () -> m.connect(a.getBit(0), x.getBit(0)));
        Assertions.assertTrue(m.getConnections().isEmpty());
    }

    @Test
    public void testBitOutOfRange() {
        RTLModule m = new RTLModule("\\top");
        RTLWire a = m.addWire("\\a", 2);
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> a.getBit(2));
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> a.getBit(-1));
    }

    @Test
    public void testFixupPorts() {
        RTLModule m = new RTLModule("\\top");
        RTLWire b = m.addWire("\\b", 1);
        RTLWire a = m.addWire("\\a", 1);
        RTLWire c = m.addWire("\\c", 1);
        RTLWire d = m.addWire("\\d", 1);
        b.setPortInput(true);
        a.setPortOutput(true);
        c.setPortInput(true);
        c.setPortOutput(true);
        c.setPortId(5);
        d.setPortId(7);

        m.fixupPorts();

        Assertions.assertEquals(Arrays.asList("\\c", "\\a", "\\b"), names(m.getPorts()));
        Assertions.assertEquals(1, c.getPortId());
        Assertions.assertEquals(2, a.getPortId());
        Assertions.assertEquals(3, b.getPortId());
        Assertions.assertEquals(0, d.getPortId());
        Assertions.assertEquals(RTLDirection.INOUT, c.getDirection());
        Assertions.assertEquals(RTLDirection.OUTPUT, a.getDirection());
        Assertions.assertEquals(RTLDirection.INPUT, b.getDirection());

        // A second fix-up keeps the established order
        RTLWire aa = m.addWire("\\aa", 1);
        aa.setPortInput(true);
        m.fixupPorts();
        Assertions.assertEquals(Arrays.asList("\\c", "\\a", "\\b", "\\aa"), names(m.getPorts()));
    }

    @Test
    public void testCellPorts() {
        RTLModule m = new RTLModule("\\top");
        RTLWire a = m.addWire("\\a", 1);
        RTLCell c = m.addCell("\\c1", "\\BUF");
        Assertions.assertEquals("\\BUF", c.getType());
        Assertions.assertFalse(c.hasPort("\\A"));
        Assertions.assertNull(c.getPort("\\A"));
        Assertions.assertTrue(c.getConnections().isEmpty());

        c.setPort("\\A", new RTLSigSpec(a));
        c.setPort("\\Y", new RTLSigSpec().append(RTLState.Sx));
        c.setPort("\\A", new RTLSigSpec().append(RTLState.S0));
        Assertions.assertEquals(new RTLSigSpec().append(RTLState.S0), c.getPort("\\A"));
        Assertions.assertEquals(Arrays.asList("\\A", "\\Y"), Arrays.asList(c.getConnections().keySet().toArray()));
    }

    @Test
    public void testDesignModules() {
        RTLDesign d = new RTLDesign();
        RTLModule top = d.createModule("\\top");
        Assertions.assertSame(d, top.getDesign());
        Assertions.assertTrue(d.hasModule("\\top"));
        Assertions.assertSame(top, d.getModule("\\top"));
        Assertions.assertThrows(RuntimeException.class, () -> d.createModule("\\top"));
        Assertions.assertThrows(RuntimeException.class, () -> new RTLDesign().addModule(top));
        Assertions.assertEquals(1, d.getModules().size());
    }
}
