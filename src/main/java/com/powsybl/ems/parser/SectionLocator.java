/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import java.util.List;
import java.util.Objects;

/**
 * Finds the rows of a section from the marker line that closes it.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class SectionLocator {

    private SectionLocator() {
    }

    /**
     * Index of the first line at or after {@code start} containing {@code marker}, or the number of
     * lines if there is none.
     */
    public static int findSectionEnd(List<String> lines, int start, String marker) {
        Objects.requireNonNull(lines);
        Objects.requireNonNull(marker);
        for (int i = Math.max(start, 0); i < lines.size(); i++) {
            if (lines.get(i).contains(marker)) {
                return i;
            }
        }
        return lines.size();
    }

    public static SectionRange locate(List<String> lines, int start, EmsSection section) {
        int clampedStart = Math.min(Math.max(start, 0), lines.size());
        int end = findSectionEnd(lines, clampedStart, section.getEndMarker());
        return new SectionRange(section, clampedStart, end);
    }
}
