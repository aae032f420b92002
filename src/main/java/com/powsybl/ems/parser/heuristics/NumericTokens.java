/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Numeric checks and conversions applied to tokens.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class NumericTokens {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericTokens() {
    }

    /**
     * True if the token is a plain decimal literal: optional sign, digits, optional fraction and
     * exponent. Java specific forms such as {@code 1d}, {@code NaN} or hexadecimal are rejected.
     */
    public static boolean isNumeric(String token) {
        return token != null && DECIMAL.matcher(token).matches();
    }

    public static boolean isNumericAt(List<String> tokens, int index) {
        return index >= 0 && index < tokens.size() && isNumeric(tokens.get(index));
    }

    public static double parseDouble(String token) {
        if (!isNumeric(token)) {
            throw new NumberFormatException("Not a number: '" + token + "'");
        }
        return Double.parseDouble(token);
    }

    public static int parseInt(String token) {
        return Integer.parseInt(token);
    }

    /**
     * Parses a decimal literal and drops its fractional part, so that {@code "1.0"} gives 1.
     */
    public static int truncate(String token) {
        return (int) parseDouble(token);
    }

    /**
     * {@link #truncate(String)} of the token at {@code index}, or {@code defaultValue} if that token is
     * missing or not numeric.
     */
    public static int truncateOrDefault(List<String> tokens, int index, int defaultValue) {
        return isNumericAt(tokens, index) ? truncate(tokens.get(index)) : defaultValue;
    }

    public static double parseDoubleOrDefault(List<String> tokens, int index, double defaultValue) {
        return isNumericAt(tokens, index) ? Double.parseDouble(tokens.get(index)) : defaultValue;
    }
}
