/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

import com.powsybl.ems.parser.EmsTokenizer;

import java.util.List;
import java.util.OptionalInt;

/**
 * Recovers bus fields from quote aware tokens. Bus lines have no fixed columns after the name, so base
 * voltage, voltage magnitude and area are each searched in a token window.
 * <p>
 * The area window {@code [6, 10)} overlaps the base voltage window {@code [2, 8)}: depending on the
 * line, one token may be read as both bus type and area. This is the behaviour of the format readers
 * we replace and is kept until a real sample tells which columns are meant.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class BusFieldHeuristics {

    public static final int MIN_TOKEN_COUNT = 10;

    public static final double MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE = 0.8;

    public static final double MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE = 1.5;

    public static final double DEFAULT_BASE_KV = 0.0;

    public static final int DEFAULT_BUS_TYPE = 1;

    public static final double DEFAULT_VOLTAGE_MAGNITUDE = 1.0;

    public static final double DEFAULT_VOLTAGE_ANGLE = 0.0;

    public static final int DEFAULT_AREA = 1;

    public static final int DEFAULT_ZONE = 1;

    public static final String BASE_KV = "baseKv";
    public static final String VOLTAGE_MAGNITUDE = "voltageMagnitude";
    public static final String AREA = "area";

    private final TokenScanRule baseKvRule;

    private final TokenScanRule voltageMagnitudeRule;

    private final TokenScanRule areaRule;

    public BusFieldHeuristics() {
        this(MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE, MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE);
    }

    public BusFieldHeuristics(double minPlausibleVoltageMagnitude, double maxPlausibleVoltageMagnitude) {
        baseKvRule = TokenScanRule.anyNumeric(BASE_KV, 2, 8);
        voltageMagnitudeRule = TokenScanRule.inRange(VOLTAGE_MAGNITUDE, 8, 12, minPlausibleVoltageMagnitude, maxPlausibleVoltageMagnitude);
        areaRule = TokenScanRule.anyNumeric(AREA, 6, 10);
    }

    /**
     * Scan rules in the order they are applied.
     */
    public List<TokenScanRule> getRules() {
        return List.of(baseKvRule, voltageMagnitudeRule, areaRule);
    }

    public TokenScanRule getBaseKvRule() {
        return baseKvRule;
    }

    public TokenScanRule getVoltageMagnitudeRule() {
        return voltageMagnitudeRule;
    }

    public TokenScanRule getAreaRule() {
        return areaRule;
    }

    /**
     * @throws NumberFormatException if the first token is not an integer bus number
     */
    public BusFields recover(List<String> tokens) {
        int number = NumericTokens.parseInt(tokens.get(0));
        String name = tokens.size() > 1 ? EmsTokenizer.stripQuotes(tokens.get(1)) : "BUS_" + number;

        double baseKv = DEFAULT_BASE_KV;
        int busType = DEFAULT_BUS_TYPE;
        OptionalInt baseKvIndex = baseKvRule.find(tokens);
        if (baseKvIndex.isPresent()) {
            int i = baseKvIndex.getAsInt();
            baseKv = Double.parseDouble(tokens.get(i));
            busType = NumericTokens.truncateOrDefault(tokens, i + 1, DEFAULT_BUS_TYPE);
        }

        double voltageMagnitude = DEFAULT_VOLTAGE_MAGNITUDE;
        double voltageAngle = DEFAULT_VOLTAGE_ANGLE;
        OptionalInt magnitudeIndex = voltageMagnitudeRule.find(tokens);
        if (magnitudeIndex.isPresent()) {
            int i = magnitudeIndex.getAsInt();
            voltageMagnitude = Double.parseDouble(tokens.get(i));
            voltageAngle = NumericTokens.parseDoubleOrDefault(tokens, i + 1, DEFAULT_VOLTAGE_ANGLE);
        }

        int area = DEFAULT_AREA;
        int zone = DEFAULT_ZONE;
        OptionalInt areaIndex = areaRule.find(tokens);
        if (areaIndex.isPresent()) {
            int i = areaIndex.getAsInt();
            area = NumericTokens.truncate(tokens.get(i));
            zone = NumericTokens.truncateOrDefault(tokens, i + 1, DEFAULT_ZONE);
        }

        return new BusFields(number, name, baseKv, busType, voltageMagnitude, voltageAngle, area, zone);
    }
}
