/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsBranch;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
class BranchRecordBuilderTest {

    private final BranchRecordBuilder builder = new BranchRecordBuilder();

    private final List<ParseWarning> warnings = new ArrayList<>();

    @Test
    void testBuild() {
        List<String> lines = List.of(
                "101 102 '1' 0.01 0.1 0.02 150.0 1",
                "102 101 'B2' 0.02 0.2 0.04 80.0 1 trailing",
                "101 103 '2' 0.02 0.2 0.04 80.0",
                "101 103 '2' 0.02 x 0.04 80.0 1");
        List<EmsBranch> branches = builder.build(lines, new SectionRange(EmsSection.BRANCH, 0, lines.size()), warnings);
        assertEquals(2, branches.size());

        EmsBranch branch = branches.get(0);
        assertEquals(101, branch.fromBus());
        assertEquals(102, branch.toBus());
        assertEquals("1", branch.circuitId());
        assertEquals(0.01, branch.resistance(), 0.0);
        assertEquals(0.1, branch.reactance(), 0.0);
        assertEquals(0.02, branch.chargingSusceptance(), 0.0);
        assertEquals(150.0, branch.mvaRating(), 0.0);
        assertEquals(BranchRecordBuilder.DEFAULT_LENGTH_KM, branch.lengthKm(), 0.0);
        assertEquals(BranchRecordBuilder.UNKNOWN, branch.conductorType());
        assertEquals(BranchRecordBuilder.UNKNOWN, branch.towerType());
        assertEquals(BranchRecordBuilder.UNKNOWN, branch.brand());
        assertEquals(BranchRecordBuilder.DEFAULT_YEAR_INSTALLED, branch.yearInstalled());

        // from and to are kept as written
        assertEquals(102, branches.get(1).fromBus());
        assertEquals(101, branches.get(1).toBus());
        assertEquals("B2", branches.get(1).circuitId());

        assertEquals(2, warnings.size());
        assertEquals(3, warnings.get(0).lineNumber());
        assertEquals(4, warnings.get(1).lineNumber());
    }
}
