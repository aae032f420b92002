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
 * Two winding transformer, read from a block of four lines.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsTransformer(int fromBus, int toBus, String circuitId, int windingType, int controlMethod,
                             double resistance, double reactance, double magnetizingConductance,
                             double magnetizingSusceptance, double nominalMva, double fromBusVoltage,
                             double toBusVoltage, double minTap, double maxTap, double stepSize, double minAngle,
                             double maxAngle, double angleStep, double tapPosition, double phaseAngle, String name,
                             String brand, String model, int yearManufactured, String coolingType,
                             String vectorGroup) {

    public EmsTransformer {
        Objects.requireNonNull(circuitId);
        Objects.requireNonNull(name);
        Objects.requireNonNull(brand);
        Objects.requireNonNull(model);
        Objects.requireNonNull(coolingType);
        Objects.requireNonNull(vectorGroup);
    }

    /**
     * Key of the transformer in brand dictionaries.
     */
    public String getKey() {
        return "TX_" + fromBus + "_" + toBus;
    }

    public String getVoltageRatio() {
        return fromBusVoltage + "/" + toBusVoltage + "kV";
    }
}
