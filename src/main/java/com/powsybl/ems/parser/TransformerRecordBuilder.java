/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsTransformer;
import com.powsybl.ems.parser.heuristics.NumericTokens;

import java.util.ArrayList;
import java.util.List;

/**
 * Transformers take four consecutive lines:
 * <ol>
 *     <li>header: from bus, to bus and at least six more tokens,</li>
 *     <li>impedance: R, X, nominal MVA,</li>
 *     <li>tap position and from side voltage,</li>
 *     <li>to side voltage (second token) followed by an optional name.</li>
 * </ol>
 * Once a header is found the whole block is consumed, even if one of its fields cannot be read.
 * Ratings, tap and phase ranges and descriptive data are not in the format and get fixed values.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class TransformerRecordBuilder extends AbstractRecordBuilder<EmsTransformer> {

    public static final int BLOCK_SIZE = 4;

    public static final int HEADER_MIN_TOKEN_COUNT = 8;

    public static final double DEFAULT_NOMINAL_MVA = 100.0;

    public static final double DEFAULT_TAP_POSITION = 1.0;

    public static final double DEFAULT_FROM_BUS_VOLTAGE = 110.0;

    public static final double DEFAULT_TO_BUS_VOLTAGE = 33.0;

    private static final String CIRCUIT_ID = "1";
    private static final int WINDING_TYPE = 2;
    private static final int CONTROL_METHOD = 1;
    private static final double MIN_TAP = 0.9;
    private static final double MAX_TAP = 1.1;
    private static final double TAP_STEP = 0.01;
    private static final double MIN_ANGLE = -30.0;
    private static final double MAX_ANGLE = 30.0;
    private static final double ANGLE_STEP = 1.0;
    private static final String BRAND = "Unknown";
    private static final String MODEL = "Standard";
    private static final int YEAR_MANUFACTURED = 2000;
    private static final String COOLING_TYPE = "ONAN";
    private static final String VECTOR_GROUP = "YNd11";

    public TransformerRecordBuilder() {
        this(PREVIEW_LENGTH_DEFAULT_VALUE);
    }

    public TransformerRecordBuilder(int previewLength) {
        super(previewLength);
    }

    @Override
    public EmsSection getSection() {
        return EmsSection.TRANSFORMER;
    }

    @Override
    public List<EmsTransformer> build(List<String> lines, SectionRange range, List<ParseWarning> warnings) {
        List<EmsTransformer> transformers = new ArrayList<>();
        int i = range.start();
        while (i < range.end()) {
            String line = lines.get(i).strip();
            if (isIgnored(line)) {
                i++;
                continue;
            }
            List<String> header = EmsTokenizer.tokenizeWhitespace(line);
            if (header.size() < HEADER_MIN_TOKEN_COUNT) {
                warn(warnings, i, line, tooFewTokens(HEADER_MIN_TOKEN_COUNT, header.size()));
                i++;
                continue;
            }
            if (i + BLOCK_SIZE > range.end()) {
                warn(warnings, i, line, "incomplete transformer block, " + BLOCK_SIZE + " lines expected, "
                        + (range.end() - i) + " left in section");
                i++;
                continue;
            }
            try {
                transformers.add(buildTransformer(header, lines.get(i + 1), lines.get(i + 2), lines.get(i + 3)));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                warn(warnings, i, line, e);
            }
            i += BLOCK_SIZE;
        }
        return transformers;
    }

    static EmsTransformer buildTransformer(List<String> header, String impedanceLine, String tapLine, String voltageLine) {
        int fromBus = NumericTokens.parseInt(header.get(0));
        int toBus = NumericTokens.parseInt(header.get(1));

        double resistance = 0.0;
        double reactance = 0.0;
        double nominalMva = DEFAULT_NOMINAL_MVA;
        List<String> impedance = EmsTokenizer.tokenizeWhitespace(impedanceLine);
        if (impedance.size() >= 3) {
            resistance = NumericTokens.parseDouble(impedance.get(0));
            reactance = NumericTokens.parseDouble(impedance.get(1));
            nominalMva = NumericTokens.parseDouble(impedance.get(2));
        }

        double tapPosition = DEFAULT_TAP_POSITION;
        double fromBusVoltage = DEFAULT_FROM_BUS_VOLTAGE;
        List<String> tap = EmsTokenizer.tokenizeWhitespace(tapLine);
        if (tap.size() >= 2) {
            tapPosition = NumericTokens.parseDouble(tap.get(0));
            fromBusVoltage = NumericTokens.parseDouble(tap.get(1));
        }

        double toBusVoltage = DEFAULT_TO_BUS_VOLTAGE;
        String name = "TX_" + fromBus + "_" + toBus;
        List<String> voltage = EmsTokenizer.tokenizeWhitespace(voltageLine);
        if (voltage.size() >= 2) {
            toBusVoltage = NumericTokens.parseDouble(voltage.get(1));
            if (voltage.size() > 2) {
                List<String> nameWords = EmsTokenizer.tokenizeWhitespace(
                        EmsTokenizer.stripQuotes(String.join(" ", voltage.subList(2, voltage.size())), "\""));
                if (!nameWords.isEmpty()) {
                    name = nameWords.get(0);
                }
            }
        }

        return new EmsTransformer(fromBus, toBus, CIRCUIT_ID, WINDING_TYPE, CONTROL_METHOD,
                                  resistance, reactance, 0.0, 0.0, nominalMva,
                                  fromBusVoltage, toBusVoltage,
                                  MIN_TAP, MAX_TAP, TAP_STEP, MIN_ANGLE, MAX_ANGLE, ANGLE_STEP,
                                  tapPosition, 0.0, name,
                                  BRAND, MODEL, YEAR_MANUFACTURED, COOLING_TYPE, VECTOR_GROUP);
    }
}
