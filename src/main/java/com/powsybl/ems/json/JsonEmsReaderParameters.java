/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.json.JsonUtil;
import com.powsybl.ems.EmsReaderParameters;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import static com.powsybl.ems.EmsReaderParameters.*;

/**
 * JSON form of {@link EmsReaderParameters}.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class JsonEmsReaderParameters {

    public static final String VERSION = "1.0";

    private static final String VERSION_FIELD = "version";

    private JsonEmsReaderParameters() {
    }

    public static void write(EmsReaderParameters parameters, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(parameters, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(EmsReaderParameters parameters, Writer writer) {
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = JsonUtil.createObjectMapper().getFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField(VERSION_FIELD, VERSION);
            jsonGenerator.writeNumberField(BUS_SECTION_START_PARAM_NAME, parameters.getBusSectionStart());
            jsonGenerator.writeNumberField(HEADER_SCAN_LINE_COUNT_PARAM_NAME, parameters.getHeaderScanLineCount());
            jsonGenerator.writeNumberField(DEFAULT_BASE_FREQUENCY_PARAM_NAME, parameters.getDefaultBaseFrequency());
            jsonGenerator.writeNumberField(PREVIEW_LENGTH_PARAM_NAME, parameters.getPreviewLength());
            jsonGenerator.writeNumberField(MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME, parameters.getMinPlausibleVoltageMagnitude());
            jsonGenerator.writeNumberField(MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME, parameters.getMaxPlausibleVoltageMagnitude());
            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static EmsReaderParameters read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static PowsyblException invalidValue(Map.Entry<String, JsonNode> field) {
        return new PowsyblException("Invalid value for parameter " + field.getKey() + ": " + field.getValue());
    }

    private static int readInt(Map.Entry<String, JsonNode> field) {
        if (!field.getValue().isInt()) {
            throw invalidValue(field);
        }
        return field.getValue().intValue();
    }

    private static double readDouble(Map.Entry<String, JsonNode> field) {
        if (!field.getValue().isNumber()) {
            throw invalidValue(field);
        }
        return field.getValue().doubleValue();
    }

    /**
     * Missing fields keep their default value.
     *
     * @throws PowsyblException on an unknown field, a value of the wrong type or an unsupported version
     */
    public static EmsReaderParameters read(Reader reader) {
        JsonNode root;
        try {
            root = JsonUtil.createObjectMapper().readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.isObject()) {
            throw new PowsyblException("EMS reader parameters must be a JSON object");
        }
        EmsReaderParameters parameters = new EmsReaderParameters();
        double minVoltageMagnitude = parameters.getMinPlausibleVoltageMagnitude();
        double maxVoltageMagnitude = parameters.getMaxPlausibleVoltageMagnitude();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            switch (field.getKey()) {
                case VERSION_FIELD -> {
                    if (!VERSION.equals(value.asText())) {
                        throw new PowsyblException("Unsupported EMS reader parameters version: " + value.asText());
                    }
                }
                case BUS_SECTION_START_PARAM_NAME -> parameters.setBusSectionStart(readInt(field));
                case HEADER_SCAN_LINE_COUNT_PARAM_NAME -> parameters.setHeaderScanLineCount(readInt(field));
                case DEFAULT_BASE_FREQUENCY_PARAM_NAME -> parameters.setDefaultBaseFrequency(readDouble(field));
                case PREVIEW_LENGTH_PARAM_NAME -> parameters.setPreviewLength(readInt(field));
                case MIN_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME -> minVoltageMagnitude = readDouble(field);
                case MAX_PLAUSIBLE_VOLTAGE_MAGNITUDE_PARAM_NAME -> maxVoltageMagnitude = readDouble(field);
                default -> throw new PowsyblException("Unexpected field: " + field.getKey());
            }
        }
        return parameters.setPlausibleVoltageMagnitudeRange(minVoltageMagnitude, maxVoltageMagnitude);
    }
}
