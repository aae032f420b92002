/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems;

import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.ems.model.EmsHeader;
import com.powsybl.ems.parser.AbstractRecordBuilder;
import com.powsybl.ems.parser.EmsHeaderParser;
import com.powsybl.ems.parser.heuristics.BusFieldHeuristics;

/**
 * Tuning of the EMS reader.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class EmsReaderParameters {

    public static final String MODULE_NAME = "ems-reader-default-parameters";

    /**
     * Bus records start after a fixed size preamble.
     */
    public static final int BUS_SECTION_START_DEFAULT_VALUE = 3;

    public static final int HEADER_SCAN_LINE_COUNT_DEFAULT_VALUE = EmsHeaderParser.HEADER_SCAN_LINE_COUNT_DEFAULT_VALUE;

    public static final double DEFAULT_BASE_FREQUENCY_DEFAULT_VALUE = EmsHeader.DEFAULT_BASE_FREQUENCY;

    public static final int PREVIEW_LENGTH_DEFAULT_VALUE = AbstractRecordBuilder.PREVIEW_LENGTH_DEFAULT_VALUE;

    public static final double MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE = BusFieldHeuristics.MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE;

    public static final double MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE = BusFieldHeuristics.MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE;

    public static final String BUS_SECTION_START_PARAM_NAME = "busSectionStart";

    public static final String HEADER_SCAN_LINE_COUNT_PARAM_NAME = "headerScanLineCount";

    public static final String DEFAULT_BASE_FREQUENCY_PARAM_NAME = "defaultBaseFrequency";

    public static final String PREVIEW_LENGTH_PARAM_NAME = "previewLength";

    public static final String MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME = "minPlausibleVoltageMagnitude";

    public static final String MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME = "maxPlausibleVoltageMagnitude";

    private int busSectionStart = BUS_SECTION_START_DEFAULT_VALUE;

    private int headerScanLineCount = HEADER_SCAN_LINE_COUNT_DEFAULT_VALUE;

    private double defaultBaseFrequency = DEFAULT_BASE_FREQUENCY_DEFAULT_VALUE;

    private int previewLength = PREVIEW_LENGTH_DEFAULT_VALUE;

    private double minPlausibleVoltageMagnitude = MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE;

    private double maxPlausibleVoltageMagnitude = MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE;

    public static EmsReaderParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static EmsReaderParameters load(PlatformConfig platformConfig) {
        EmsReaderParameters parameters = new EmsReaderParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setBusSectionStart(config.getIntProperty(BUS_SECTION_START_PARAM_NAME, BUS_SECTION_START_DEFAULT_VALUE))
                .setHeaderScanLineCount(config.getIntProperty(HEADER_SCAN_LINE_COUNT_PARAM_NAME, HEADER_SCAN_LINE_COUNT_DEFAULT_VALUE))
                .setDefaultBaseFrequency(config.getDoubleProperty(DEFAULT_BASE_FREQUENCY_PARAM_NAME, DEFAULT_BASE_FREQUENCY_DEFAULT_VALUE))
                .setPreviewLength(config.getIntProperty(PREVIEW_LENGTH_PARAM_NAME, PREVIEW_LENGTH_DEFAULT_VALUE))
                .setPlausibleVoltageMagnitudeRange(
                        config.getDoubleProperty(MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME, MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE),
                        config.getDoubleProperty(MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME, MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_DEFAULT_VALUE)));
        return parameters;
    }

    private static int checkNotNegative(int value, String name) {
        if (value < 0) {
            throw new PowsyblException("Invalid value for parameter " + name + ": " + value);
        }
        return value;
    }

    public int getBusSectionStart() {
        return busSectionStart;
    }

    public EmsReaderParameters setBusSectionStart(int busSectionStart) {
        this.busSectionStart = checkNotNegative(busSectionStart, BUS_SECTION_START_PARAM_NAME);
        return this;
    }

    public int getHeaderScanLineCount() {
        return headerScanLineCount;
    }

    public EmsReaderParameters setHeaderScanLineCount(int headerScanLineCount) {
        this.headerScanLineCount = checkNotNegative(headerScanLineCount, HEADER_SCAN_LINE_COUNT_PARAM_NAME);
        return this;
    }

    public double getDefaultBaseFrequency() {
        return defaultBaseFrequency;
    }

    public EmsReaderParameters setDefaultBaseFrequency(double defaultBaseFrequency) {
        if (defaultBaseFrequency <= 0 || Double.isNaN(defaultBaseFrequency)) {
            throw new PowsyblException("Invalid value for parameter " + DEFAULT_BASE_FREQUENCY_PARAM_NAME + ": " + defaultBaseFrequency);
        }
        this.defaultBaseFrequency = defaultBaseFrequency;
        return this;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public EmsReaderParameters setPreviewLength(int previewLength) {
        this.previewLength = checkNotNegative(previewLength, PREVIEW_LENGTH_PARAM_NAME);
        return this;
    }

    public double getMinPlausibleVoltageMagnitude() {
        return minPlausibleVoltageMagnitude;
    }

    public double getMaxPlausibleVoltageMagnitude() {
        return maxPlausibleVoltageMagnitude;
    }

    public EmsReaderParameters setMinPlausibleVoltageMagnitude(double minPlausibleVoltageMagnitude) {
        return setPlausibleVoltageMagnitudeRange(minPlausibleVoltageMagnitude, maxPlausibleVoltageMagnitude);
    }

    public EmsReaderParameters setMaxPlausibleVoltageMagnitude(double maxPlausibleVoltageMagnitude) {
        return setPlausibleVoltageMagnitudeRange(minPlausibleVoltageMagnitude, maxPlausibleVoltageMagnitude);
    }

    /**
     * Window of voltage magnitudes, in per unit, accepted when looking for a bus voltage.
     */
    public EmsReaderParameters setPlausibleVoltageMagnitudeRange(double min, double max) {
        if (min > max) {
            throw new PowsyblException("Invalid plausible voltage magnitude range: [" + min + ", " + max + "]");
        }
        this.minPlausibleVoltageMagnitude = min;
        this.maxPlausibleVoltageMagnitude = max;
        return this;
    }

    @Override
    public String toString() {
        return "EmsReaderParameters(" +
                "busSectionStart=" + busSectionStart +
                ", headerScanLineCount=" + headerScanLineCount +
                ", defaultBaseFrequency=" + defaultBaseFrequency +
                ", previewLength=" + previewLength +
                ", minPlausibleVoltageMagnitude=" + minPlausibleVoltageMagnitude +
                ", maxPlausibleVoltageMagnitude=" + maxPlausibleVoltageMagnitude +
                ')';
    }
}
