/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.json;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.PowsyblException;
import com.powsybl.ems.EmsReaderParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
class JsonEmsReaderParametersTest {

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testWrite() {
        StringWriter writer = new StringWriter();
        JsonEmsReaderParameters.write(new EmsReaderParameters().setPreviewLength(30), writer);
        String json = writer.toString();
        assertTrue(json.contains("\"version\" : \"1.0\""));
        assertTrue(json.contains("\"previewLength\" : 30"));
        assertTrue(json.contains("\"maxPlausibleVoltageMagnitude\" : 1.5"));
    }

    @Test
    void testWriteRead() {
        EmsReaderParameters parameters = new EmsReaderParameters()
                .setBusSectionStart(4)
                .setHeaderScanLineCount(3)
                .setDefaultBaseFrequency(60.0)
                .setPreviewLength(80)
                .setPlausibleVoltageMagnitudeRange(0.85, 1.2);
        Path file = fileSystem.getPath("/parameters.json");
        JsonEmsReaderParameters.write(parameters, file);
        EmsReaderParameters read = JsonEmsReaderParameters.read(file);
        assertEquals(parameters.toString(), read.toString());
    }

    @Test
    void testReadPartial() {
        EmsReaderParameters parameters = JsonEmsReaderParameters.read(new StringReader(
                "{\"version\": \"1.0\", \"maxPlausibleVoltageMagnitude\": 1.3, \"minPlausibleVoltageMagnitude\": 1.25, \"defaultBaseFrequency\": 60}"));
        assertEquals(1.25, parameters.getMinPlausibleVoltageMagnitude(), 0.0);
        assertEquals(1.3, parameters.getMaxPlausibleVoltageMagnitude(), 0.0);
        assertEquals(60.0, parameters.getDefaultBaseFrequency(), 0.0);
        assertEquals(EmsReaderParameters.BUS_SECTION_START_DEFAULT_VALUE, parameters.getBusSectionStart());
    }

    @Test
    void testReadErrors() {
        StringReader unknownField = new StringReader("{\"unknown\": 1}");
        PowsyblException e = assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(unknownField));
        assertEquals("Unexpected field: unknown", e.getMessage());

        StringReader badVersion = new StringReader("{\"version\": \"0.1\"}");
        assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(badVersion));

        StringReader notAnObject = new StringReader("[1, 2]");
        assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(notAnObject));

        StringReader stringValue = new StringReader("{\"previewLength\": \"abc\"}");
        e = assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(stringValue));
        assertEquals("Invalid value for parameter previewLength: \"abc\"", e.getMessage());

        StringReader booleanValue = new StringReader("{\"busSectionStart\": true}");
        e = assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(booleanValue));
        assertEquals("Invalid value for parameter busSectionStart: true", e.getMessage());

        StringReader fractionValue = new StringReader("{\"headerScanLineCount\": 2.9}");
        e = assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(fractionValue));
        assertEquals("Invalid value for parameter headerScanLineCount: 2.9", e.getMessage());

        StringReader stringFrequency = new StringReader("{\"defaultBaseFrequency\": \"60\"}");
        assertThrows(PowsyblException.class, () -> JsonEmsReaderParameters.read(stringFrequency));

        Path missing = fileSystem.getPath("/missing.json");
        assertThrows(UncheckedIOException.class, () -> JsonEmsReaderParameters.read(missing));
    }
}
