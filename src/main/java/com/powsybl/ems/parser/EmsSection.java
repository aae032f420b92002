/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

/**
 * Sections of an EMS file, in the order they appear.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public enum EmsSection {
    BUS("End of Bus Data"),
    LOAD("End of Load Data"),
    GENERATOR("End of Generator Data"),
    BRANCH("End of Branch Data"),
    TRANSFORMER("End of Transformer Data");

    private final String endMarker;

    EmsSection(String endMarker) {
        this.endMarker = endMarker;
    }

    public String getEndMarker() {
        return endMarker;
    }
}
