/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.model;

import java.util.Objects;

/**
 * @param baseFrequency system base frequency in Hz
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsHeader(String systemName, String description, double baseFrequency) {

    public static final String DEFAULT_SYSTEM_NAME = "EMS Power System";

    public static final String DEFAULT_DESCRIPTION = "Converted from EMS system format";

    public static final double DEFAULT_BASE_FREQUENCY = 50.0;

    public EmsHeader {
        Objects.requireNonNull(systemName);
        Objects.requireNonNull(description);
    }

    public static EmsHeader createDefault() {
        return new EmsHeader(DEFAULT_SYSTEM_NAME, DEFAULT_DESCRIPTION, DEFAULT_BASE_FREQUENCY);
    }
}
