/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsHeader;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the system description and base frequency from the first lines of an EMS file.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class EmsHeaderParser {

    public static final int HEADER_SCAN_LINE_COUNT_DEFAULT_VALUE = 10;

    private static final Pattern BASE_FREQUENCY = Pattern.compile("BASEFREQ.*?(\\d+\\.?\\d*)", Pattern.CASE_INSENSITIVE);

    private EmsHeaderParser() {
    }

    public static EmsHeader parse(List<String> lines) {
        return parse(lines, HEADER_SCAN_LINE_COUNT_DEFAULT_VALUE, EmsHeader.DEFAULT_BASE_FREQUENCY);
    }

    public static EmsHeader parse(List<String> lines, int scanLineCount, double defaultBaseFrequency) {
        String description = EmsHeader.DEFAULT_DESCRIPTION;
        if (!lines.isEmpty()) {
            String[] parts = lines.get(0).strip().split("/", -1);
            if (parts.length > 1) {
                description = parts[1].strip();
            }
        }

        // last matching line wins
        double baseFrequency = defaultBaseFrequency;
        for (String line : lines.subList(0, Math.min(scanLineCount, lines.size()))) {
            Matcher matcher = BASE_FREQUENCY.matcher(line);
            if (matcher.find()) {
                baseFrequency = Double.parseDouble(matcher.group(1));
            }
        }

        return new EmsHeader(EmsHeader.DEFAULT_SYSTEM_NAME, description, baseFrequency);
    }
}
