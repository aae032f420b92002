/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.DoublePredicate;

/**
 * Recovers a field as the first numeric token of a window {@code [fromIndex, toIndex)} whose value is
 * accepted by a predicate. The window is cut to the tokens actually present.
 *
 * @param field name of the recovered field, used in diagnostics
 * @param fromIndex first token index scanned
 * @param toIndex token index where the scan stops, excluded
 * @param accept plausibility filter applied to the numeric value
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record TokenScanRule(String field, int fromIndex, int toIndex, DoublePredicate accept) {

    public TokenScanRule {
        Objects.requireNonNull(field);
        Objects.requireNonNull(accept);
        if (fromIndex < 0 || toIndex < fromIndex) {
            throw new IllegalArgumentException("Invalid token window [" + fromIndex + ", " + toIndex + ") for field " + field);
        }
    }

    public static TokenScanRule anyNumeric(String field, int fromIndex, int toIndex) {
        return new TokenScanRule(field, fromIndex, toIndex, value -> true);
    }

    public static TokenScanRule inRange(String field, int fromIndex, int toIndex, double min, double max) {
        return new TokenScanRule(field, fromIndex, toIndex, value -> value >= min && value <= max);
    }

    /**
     * Index of the matching token, empty if no token of the window matches.
     */
    public OptionalInt find(List<String> tokens) {
        int end = Math.min(tokens.size(), toIndex);
        for (int i = fromIndex; i < end; i++) {
            String token = tokens.get(i);
            if (NumericTokens.isNumeric(token) && accept.test(Double.parseDouble(token))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "TokenScanRule(" + field + ", [" + fromIndex + ", " + toIndex + "))";
    }
}
