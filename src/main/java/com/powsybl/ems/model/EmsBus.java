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
 * @param number bus number, unique in a model
 * @param baseKv base voltage in kV
 * @param busType bus type code
 * @param voltageMagnitude voltage magnitude in per unit
 * @param voltageAngle voltage angle in degrees
 * @param maxVoltage upper voltage limit in per unit
 * @param minVoltage lower voltage limit in per unit
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsBus(int number, String name, double baseKv, int busType, double voltageMagnitude, double voltageAngle,
                     int area, int zone, double maxVoltage, double minVoltage, String description) {

    public static final double DEFAULT_MAX_VOLTAGE = 1.1;

    public static final double DEFAULT_MIN_VOLTAGE = 0.9;

    public EmsBus {
        Objects.requireNonNull(name);
        Objects.requireNonNull(description);
    }
}
