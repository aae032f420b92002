/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
class SectionLocatorTest {

    private static final List<String> LINES = List.of(
            "header",
            "101 'A' 110.0",
            "0 / End of Load Data",
            "102 'B' 110.0",
            "0 / End of Bus Data",
            "1 '1' 10.0 1.0 1",
            "0 / End of Load Data");

    @Test
    void testFindSectionEnd() {
        assertEquals(4, SectionLocator.findSectionEnd(LINES, 0, "End of Bus Data"));
        assertEquals(2, SectionLocator.findSectionEnd(LINES, 0, "End of Load Data"));
        assertEquals(6, SectionLocator.findSectionEnd(LINES, 5, "End of Load Data"));
        assertEquals(4, SectionLocator.findSectionEnd(LINES, 4, "End of Bus Data"));
    }

    @Test
    void testMissingMarkerRunsToEndOfInput() {
        assertEquals(LINES.size(), SectionLocator.findSectionEnd(LINES, 0, "End of Branch Data"));
        assertEquals(LINES.size(), SectionLocator.findSectionEnd(LINES, LINES.size() + 3, "End of Bus Data"));
    }

    @Test
    void testMarkerIsCaseSensitive() {
        assertEquals(LINES.size(), SectionLocator.findSectionEnd(LINES, 0, "end of bus data"));
    }

    @Test
    void testOtherSectionMarkerInsideBusData() {
        SectionRange range = SectionLocator.locate(LINES, 1, EmsSection.BUS);
        assertEquals(1, range.start());
        assertEquals(4, range.end());
        assertEquals(3, range.size());

        SectionRange loadRange = SectionLocator.locate(LINES, range.nextSectionStart(), EmsSection.LOAD);
        assertEquals(5, loadRange.start());
        assertEquals(6, loadRange.end());
    }

    @Test
    void testStartBeyondInput() {
        SectionRange range = SectionLocator.locate(LINES, LINES.size() + 1, EmsSection.TRANSFORMER);
        assertTrue(range.isEmpty());
        assertEquals(LINES.size(), range.start());
        assertEquals(LINES.size(), range.end());
    }

    @Test
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new SectionRange(EmsSection.BUS, 3, 2));
    }
}
