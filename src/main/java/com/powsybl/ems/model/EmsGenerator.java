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
 * Generator. Power values are in MW and MVar, the voltage setpoint in per unit. Brand and model come
 * from the free text description of the line and are empty when there is none.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsGenerator(int busNumber, String id, double activePower, double reactivePower,
                           double maxReactivePower, double minReactivePower, double voltageSetpoint, double mvaBase,
                           double inertia, double damping, String brand, String model, String fuelType,
                           double efficiency, int yearCommissioned) {

    public EmsGenerator {
        Objects.requireNonNull(id);
        Objects.requireNonNull(brand);
        Objects.requireNonNull(model);
        Objects.requireNonNull(fuelType);
    }

    public boolean hasBrand() {
        return !brand.isEmpty();
    }
}
