/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
class NumericTokensTest {

    @Test
    void testIsNumeric() {
        assertTrue(NumericTokens.isNumeric("110"));
        assertTrue(NumericTokens.isNumeric("110.0"));
        assertTrue(NumericTokens.isNumeric("-2.5"));
        assertTrue(NumericTokens.isNumeric("+.5"));
        assertTrue(NumericTokens.isNumeric("1."));
        assertTrue(NumericTokens.isNumeric("1.5E-3"));
        assertFalse(NumericTokens.isNumeric("'1'"));
        assertFalse(NumericTokens.isNumeric("1d"));
        assertFalse(NumericTokens.isNumeric("NaN"));
        assertFalse(NumericTokens.isNumeric("Infinity"));
        assertFalse(NumericTokens.isNumeric("0x1p3"));
        assertFalse(NumericTokens.isNumeric("."));
        assertFalse(NumericTokens.isNumeric(""));
        assertFalse(NumericTokens.isNumeric(null));
    }

    @Test
    void testParse() {
        assertEquals(1.02, NumericTokens.parseDouble("1.02"), 0.0);
        assertThrows(NumberFormatException.class, () -> NumericTokens.parseDouble("1d"));
        assertEquals(101, NumericTokens.parseInt("101"));
        assertThrows(NumberFormatException.class, () -> NumericTokens.parseInt("101.0"));
    }

    @Test
    void testTruncate() {
        assertEquals(1, NumericTokens.truncate("1.0"));
        assertEquals(2, NumericTokens.truncate("2.9"));
        assertEquals(-1, NumericTokens.truncate("-1.7"));
        assertThrows(NumberFormatException.class, () -> NumericTokens.truncate("PQ"));
    }

    @Test
    void testOrDefault() {
        List<String> tokens = List.of("1", "x", "3.5");
        assertEquals(3, NumericTokens.truncateOrDefault(tokens, 2, 7));
        assertEquals(7, NumericTokens.truncateOrDefault(tokens, 1, 7));
        assertEquals(7, NumericTokens.truncateOrDefault(tokens, 3, 7));
        assertEquals(3.5, NumericTokens.parseDoubleOrDefault(tokens, 2, 0.0), 0.0);
        assertEquals(0.0, NumericTokens.parseDoubleOrDefault(tokens, -1, 0.0), 0.0);
    }
}
