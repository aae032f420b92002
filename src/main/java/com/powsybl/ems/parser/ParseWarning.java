/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import java.util.Locale;

/**
 * A row skipped while reading a section.
 *
 * @param section section being scanned
 * @param lineNumber 1-based line number in the input
 * @param preview beginning of the offending line
 * @param reason why the row was skipped
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record ParseWarning(EmsSection section, int lineNumber, String preview, String reason) {

    @Override
    public String toString() {
        return "Error parsing " + section.name().toLowerCase(Locale.ROOT) + " line " + lineNumber + ": " + preview + "... - " + reason;
    }
}
