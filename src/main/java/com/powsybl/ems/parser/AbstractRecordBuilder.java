/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

import static com.powsybl.ems.util.Markers.MALFORMED_ROW_MARKER;

/**
 * Builds the records of one section. A row that cannot be read is reported as a {@link ParseWarning}
 * and the scan goes on with the next row.
 *
 * @param <T> record type
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public abstract class AbstractRecordBuilder<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRecordBuilder.class);

    public static final int PREVIEW_LENGTH_DEFAULT_VALUE = 50;

    protected final int previewLength;

    protected AbstractRecordBuilder(int previewLength) {
        if (previewLength < 0) {
            throw new IllegalArgumentException("Preview length should be >= 0");
        }
        this.previewLength = previewLength;
    }

    public abstract EmsSection getSection();

    /**
     * Rows of this builder's section, starting the marker search at {@code start}.
     */
    public SectionRange locate(List<String> lines, int start) {
        return SectionLocator.locate(lines, start, getSection());
    }

    /**
     * Reads the records of {@code range}, adding a warning to {@code warnings} for each skipped row.
     */
    public abstract List<T> build(List<String> lines, SectionRange range, List<ParseWarning> warnings);

    /**
     * Blank rows and rows starting with {@code 0} (section trailers, comments) carry no record.
     */
    protected static boolean isIgnored(String strippedLine) {
        return strippedLine.isEmpty() || strippedLine.startsWith("0");
    }

    protected static String tooFewTokens(int expected, int actual) {
        return "expected at least " + expected + " tokens, found " + actual;
    }

    protected void warn(List<ParseWarning> warnings, int lineIndex, String line, String reason) {
        Objects.requireNonNull(warnings);
        ParseWarning warning = new ParseWarning(getSection(), lineIndex + 1, StringUtils.left(line, previewLength), reason);
        warnings.add(warning);
        LOGGER.warn(MALFORMED_ROW_MARKER, "{}", warning);
    }

    protected void warn(List<ParseWarning> warnings, int lineIndex, String line, RuntimeException e) {
        warn(warnings, lineIndex, line, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
