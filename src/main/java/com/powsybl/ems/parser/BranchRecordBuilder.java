/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsBranch;
import com.powsybl.ems.parser.heuristics.NumericTokens;

import java.util.List;

/**
 * Branch lines: from bus, to bus, circuit id, R, X, B, MVA rating, in this order.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class BranchRecordBuilder extends AbstractSingleLineRecordBuilder<EmsBranch> {

    public static final int MIN_TOKEN_COUNT = 8;

    public static final double DEFAULT_MVA_RATING = 100.0;

    public static final double DEFAULT_LENGTH_KM = 1.0;

    public static final String UNKNOWN = "Unknown";

    public static final int DEFAULT_YEAR_INSTALLED = 2000;

    public BranchRecordBuilder() {
        this(PREVIEW_LENGTH_DEFAULT_VALUE);
    }

    public BranchRecordBuilder(int previewLength) {
        super(previewLength);
    }

    @Override
    public EmsSection getSection() {
        return EmsSection.BRANCH;
    }

    @Override
    protected int getMinTokenCount() {
        return MIN_TOKEN_COUNT;
    }

    private static double parseOrDefault(List<String> tokens, int index, double defaultValue) {
        return index < tokens.size() ? NumericTokens.parseDouble(tokens.get(index)) : defaultValue;
    }

    @Override
    protected EmsBranch buildRecord(List<String> tokens) {
        int fromBus = NumericTokens.parseInt(tokens.get(0));
        int toBus = NumericTokens.parseInt(tokens.get(1));
        String circuitId = tokens.size() > 2 ? EmsTokenizer.stripQuotes(tokens.get(2)) : "1";
        double resistance = parseOrDefault(tokens, 3, 0.0);
        double reactance = parseOrDefault(tokens, 4, 0.0);
        double chargingSusceptance = parseOrDefault(tokens, 5, 0.0);
        double mvaRating = parseOrDefault(tokens, 6, DEFAULT_MVA_RATING);
        return new EmsBranch(fromBus, toBus, circuitId, resistance, reactance, chargingSusceptance, mvaRating,
                DEFAULT_LENGTH_KM, UNKNOWN, UNKNOWN, UNKNOWN, DEFAULT_YEAR_INSTALLED);
    }
}
