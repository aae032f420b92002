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
 * @param busNumber number of the connection bus, not checked against the bus section
 * @param activePower active power in MW
 * @param reactivePower reactive power in MVar
 * @param loadType load type code, kept as written
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsLoad(int busNumber, String id, double activePower, double reactivePower, String loadType,
                      int voltageDependence, int area, int zone, String description) {

    public EmsLoad {
        Objects.requireNonNull(id);
        Objects.requireNonNull(loadType);
        Objects.requireNonNull(description);
    }
}
