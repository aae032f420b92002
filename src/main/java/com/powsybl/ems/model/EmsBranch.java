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
 * Line between two buses. Resistance, reactance and charging susceptance are in per unit. Length,
 * conductor, tower, brand and installation year are not in the source format and always hold defaults.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsBranch(int fromBus, int toBus, String circuitId, double resistance, double reactance,
                        double chargingSusceptance, double mvaRating, double lengthKm, String conductorType,
                        String towerType, String brand, int yearInstalled) {

    public EmsBranch {
        Objects.requireNonNull(circuitId);
        Objects.requireNonNull(conductorType);
        Objects.requireNonNull(towerType);
        Objects.requireNonNull(brand);
    }
}
