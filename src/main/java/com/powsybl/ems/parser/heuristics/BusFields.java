/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser.heuristics;

/**
 * Fields recovered from a bus line, before limits and description are attached.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record BusFields(int number, String name, double baseKv, int busType,
                        double voltageMagnitude, double voltageAngle, int area, int zone) {
}
