/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import java.util.Objects;

/**
 * Rows {@code [start, end)} of a section, {@code end} being the index of its marker line or the
 * input size when the marker is missing.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record SectionRange(EmsSection section, int start, int end) {

    public SectionRange {
        Objects.requireNonNull(section);
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ") for section " + section);
        }
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * First row of the section that follows this one.
     */
    public int nextSectionStart() {
        return end + 1;
    }
}
