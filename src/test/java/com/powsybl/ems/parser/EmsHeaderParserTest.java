/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsHeader;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
class EmsHeaderParserTest {

    @Test
    void testDescription() {
        EmsHeader header = EmsHeaderParser.parse(List.of("SYS / Test System", "", ""));
        assertEquals("Test System", header.description());
        assertEquals(EmsHeader.DEFAULT_SYSTEM_NAME, header.systemName());
        assertEquals(50.0, header.baseFrequency(), 0.0);
    }

    @Test
    void testNoDescription() {
        assertEquals(EmsHeader.DEFAULT_DESCRIPTION, EmsHeaderParser.parse(List.of("no separator here")).description());
        assertEquals(EmsHeader.DEFAULT_DESCRIPTION, EmsHeaderParser.parse(Collections.emptyList()).description());
        assertEquals("", EmsHeaderParser.parse(List.of("SYS /")).description());
        assertEquals("B", EmsHeaderParser.parse(List.of("A/ B /C")).description());
    }

    @Test
    void testBaseFrequency() {
        assertEquals(60.0, EmsHeaderParser.parse(List.of("0 / x", "BASEFREQ = 60.0")).baseFrequency(), 0.0);
        assertEquals(60.0, EmsHeaderParser.parse(List.of("0 / x", "basefreq 60")).baseFrequency(), 0.0);
        // number before the keyword is not taken
        assertEquals(50.0, EmsHeaderParser.parse(List.of("0 / x", "16.7 BASEFREQ")).baseFrequency(), 0.0);
    }

    @Test
    void testLastBaseFrequencyWins() {
        assertEquals(16.7, EmsHeaderParser.parse(List.of("BASEFREQ 60", "BASEFREQ 16.7")).baseFrequency(), 0.0);
    }

    @Test
    void testBaseFrequencyOutsideScannedLines() {
        List<String> lines = List.of("a", "b", "c", "BASEFREQ 60");
        assertEquals(50.0, EmsHeaderParser.parse(lines, 3, 50.0).baseFrequency(), 0.0);
        assertEquals(60.0, EmsHeaderParser.parse(lines, 4, 50.0).baseFrequency(), 0.0);
        assertEquals(40.0, EmsHeaderParser.parse(List.of("a"), 10, 40.0).baseFrequency(), 0.0);
    }
}
