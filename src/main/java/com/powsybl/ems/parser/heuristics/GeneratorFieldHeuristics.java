/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

import com.powsybl.ems.parser.EmsTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers generator fields from whitespace tokens. Bus number and id are positional. The numeric
 * tokens found in {@code [2, 15)} are taken in order as P, Q, max |Q|, min Q, voltage setpoint and MVA
 * base. A token starting with a quote opens a free text description giving brand and model.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class GeneratorFieldHeuristics {

    public static final int MIN_TOKEN_COUNT = 8;

    public static final int NUMERIC_WINDOW_START = 2;

    public static final int NUMERIC_WINDOW_END = 15;

    public static final double DEFAULT_MAX_REACTIVE_POWER = 999.0;

    public static final double DEFAULT_MIN_REACTIVE_POWER = -999.0;

    public static final double DEFAULT_VOLTAGE_SETPOINT = 1.0;

    public static final double DEFAULT_MVA_BASE = 100.0;

    private static final String DESCRIPTION_QUOTES = "'\"";

    private static final int MAX_MODEL_WORDS = 2;

    private GeneratorFieldHeuristics() {
    }

    /**
     * Numeric values of the window {@code [2, 15)}, in token order.
     */
    public static List<Double> collectNumericValues(List<String> tokens) {
        List<Double> values = new ArrayList<>();
        int end = Math.min(tokens.size(), NUMERIC_WINDOW_END);
        for (int i = NUMERIC_WINDOW_START; i < end; i++) {
            if (NumericTokens.isNumeric(tokens.get(i))) {
                values.add(Double.parseDouble(tokens.get(i)));
            }
        }
        return values;
    }

    /**
     * Index of the first token starting with a single or double quote, -1 if none.
     */
    public static int findDescriptionStart(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token.startsWith("'") || token.startsWith("\"")) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Words of the description, quotes removed. The first token of the line never opens a description.
     */
    public static List<String> descriptionWords(List<String> tokens) {
        int start = findDescriptionStart(tokens);
        if (start <= 0) {
            return List.of();
        }
        String description = EmsTokenizer.stripQuotes(String.join(" ", tokens.subList(start, tokens.size())), DESCRIPTION_QUOTES);
        return EmsTokenizer.tokenizeWhitespace(description);
    }

    /**
     * @throws NumberFormatException if the first token is not an integer bus number
     */
    public static GeneratorFields recover(List<String> tokens) {
        int busNumber = NumericTokens.parseInt(tokens.get(0));
        String id = tokens.size() > 1 ? EmsTokenizer.stripQuotes(tokens.get(1)) : "1";

        double activePower = 0.0;
        double reactivePower = 0.0;
        double maxReactivePower = DEFAULT_MAX_REACTIVE_POWER;
        double minReactivePower = DEFAULT_MIN_REACTIVE_POWER;
        double voltageSetpoint = DEFAULT_VOLTAGE_SETPOINT;
        double mvaBase = DEFAULT_MVA_BASE;

        List<Double> values = collectNumericValues(tokens);
        if (values.size() >= 2) {
            activePower = values.get(0);
            reactivePower = values.get(1);
            if (values.size() > 2) {
                maxReactivePower = Math.abs(values.get(2));
                minReactivePower = values.size() > 3 ? -Math.abs(values.get(3)) : -maxReactivePower;
            }
            if (values.size() > 4) {
                voltageSetpoint = values.get(4);
            }
            if (values.size() > 5) {
                mvaBase = values.get(5);
            }
        }

        String brand = "";
        String model = "";
        List<String> words = descriptionWords(tokens);
        if (!words.isEmpty()) {
            brand = words.get(0);
            model = String.join(" ", words.subList(1, Math.min(words.size(), 1 + MAX_MODEL_WORDS)));
        }

        return new GeneratorFields(busNumber, id, activePower, reactivePower, maxReactivePower, minReactivePower,
                voltageSetpoint, mvaBase, brand, model);
    }
}
