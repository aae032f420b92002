/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

/**
 * Fields recovered from a generator line. Brand and model are empty when the line has no description.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record GeneratorFields(int busNumber, String id, double activePower, double reactivePower,
                              double maxReactivePower, double minReactivePower, double voltageSetpoint,
                              double mvaBase, String brand, String model) {
}
