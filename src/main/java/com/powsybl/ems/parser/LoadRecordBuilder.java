/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsLoad;
import com.powsybl.ems.parser.heuristics.NumericTokens;

import java.util.List;

/**
 * Load lines have reliable columns: bus number, id, P, Q, load type.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class LoadRecordBuilder extends AbstractSingleLineRecordBuilder<EmsLoad> {

    public static final int MIN_TOKEN_COUNT = 5;

    private static final int DEFAULT_VOLTAGE_DEPENDENCE = 1;

    private static final int DEFAULT_AREA = 1;

    private static final int DEFAULT_ZONE = 1;

    public LoadRecordBuilder() {
        this(PREVIEW_LENGTH_DEFAULT_VALUE);
    }

    public LoadRecordBuilder(int previewLength) {
        super(previewLength);
    }

    @Override
    public EmsSection getSection() {
        return EmsSection.LOAD;
    }

    @Override
    protected int getMinTokenCount() {
        return MIN_TOKEN_COUNT;
    }

    @Override
    protected EmsLoad buildRecord(List<String> tokens) {
        int busNumber = NumericTokens.parseInt(tokens.get(0));
        String id = EmsTokenizer.stripQuotes(tokens.get(1));
        double activePower = NumericTokens.parseDouble(tokens.get(2));
        double reactivePower = NumericTokens.parseDouble(tokens.get(3));
        String loadType = tokens.get(4);
        return new EmsLoad(busNumber, id, activePower, reactivePower, loadType, DEFAULT_VOLTAGE_DEPENDENCE,
                DEFAULT_AREA, DEFAULT_ZONE, "Load at bus " + busNumber);
    }
}
