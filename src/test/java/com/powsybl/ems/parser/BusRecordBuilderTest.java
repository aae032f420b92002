/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsBus;
import com.powsybl.ems.parser.heuristics.BusFieldHeuristics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
class BusRecordBuilderTest {

    private final BusRecordBuilder builder = new BusRecordBuilder();

    private final List<ParseWarning> warnings = new ArrayList<>();

    private List<EmsBus> build(List<String> lines) {
        return builder.build(lines, new SectionRange(EmsSection.BUS, 0, lines.size()), warnings);
    }

    @Test
    void testBuild() {
        List<EmsBus> buses = build(List.of("101 'NORTH 110' 110.0 1 0.0 0.0 1 1 1.02 -2.5 1 1 1.1 0.9"));
        assertEquals(1, buses.size());
        EmsBus bus = buses.get(0);
        assertEquals(101, bus.number());
        assertEquals("NORTH 110", bus.name());
        assertEquals(110.0, bus.baseKv(), 0.0);
        assertEquals(1.02, bus.voltageMagnitude(), 0.0);
        assertEquals(-2.5, bus.voltageAngle(), 0.0);
        assertEquals(EmsBus.DEFAULT_MAX_VOLTAGE, bus.maxVoltage(), 0.0);
        assertEquals(EmsBus.DEFAULT_MIN_VOLTAGE, bus.minVoltage(), 0.0);
        assertEquals("Bus NORTH 110 101 110.0kV", bus.description());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testTooFewTokens() {
        List<EmsBus> buses = build(List.of(
                "101 'A' 110.0 1 0 0 1 1 1.02",
                "102 'B' 110.0 1 0 0 1 1 1.02 0.0"));
        assertEquals(1, buses.size());
        assertEquals(102, buses.get(0).number());
        assertEquals(1, warnings.size());
        ParseWarning warning = warnings.get(0);
        assertEquals(EmsSection.BUS, warning.section());
        assertEquals(1, warning.lineNumber());
        assertEquals("expected at least 10 tokens, found 9", warning.reason());
    }

    @Test
    void testQuotedNameCountsAsOneToken() {
        List<EmsBus> buses = build(List.of("1 'A B C D' 110.0 1 0 0 1 1 1.0 0.0"));
        assertEquals(1, buses.size());
        assertEquals("A B C D", buses.get(0).name());
        assertEquals(110.0, buses.get(0).baseKv(), 0.0);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testMalformedRowDoesNotStopScan() {
        List<EmsBus> buses = build(List.of(
                "BAD 'WEST' 110.0 1 0.0 0.0 1 1 1.00 0.0 1 1",
                "103 'EAST' 33.0 1 0.0 0.0 1 1 1.00 0.0 1 1"));
        assertEquals(1, buses.size());
        assertEquals(103, buses.get(0).number());
        assertEquals(1, warnings.size());
        assertEquals(1, warnings.get(0).lineNumber());
        assertTrue(warnings.get(0).reason().startsWith("NumberFormatException"));
    }

    @Test
    void testIgnoredRows() {
        List<EmsBus> buses = build(List.of("", "   ", "0 / End of Bus Data", "  0 comment with enough tokens a b c d e f g"));
        assertTrue(buses.isEmpty());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void testRowsOutsideRangeNotRead() {
        List<String> lines = List.of(
                "1 'A' 110.0 1 0 0 1 1 1.0 0.0",
                "2 'B' 110.0 1 0 0 1 1 1.0 0.0",
                "3 'C' 110.0 1 0 0 1 1 1.0 0.0");
        List<EmsBus> buses = builder.build(lines, new SectionRange(EmsSection.BUS, 1, 2), warnings);
        assertEquals(1, buses.size());
        assertEquals(2, buses.get(0).number());
    }

    @Test
    void testPreview() {
        BusRecordBuilder shortPreview = new BusRecordBuilder(new BusFieldHeuristics(), 5);
        shortPreview.build(List.of("X 'A' 110.0 1 0 0 1 1 1.0 0.0"), new SectionRange(EmsSection.BUS, 0, 1), warnings);
        assertEquals("X 'A'", warnings.get(0).preview());
    }
}
