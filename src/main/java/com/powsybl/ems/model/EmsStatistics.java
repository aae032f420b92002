/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.model;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Summary of a model. Always computed from the full collections of the model, see
 * {@link EmsModel#getStatistics()}.
 *
 * @param voltageLevels sorted distinct bus base voltages in kV
 * @param areas sorted distinct bus areas
 * @param zones sorted distinct bus zones
 * @param totalGenerationCapacityMva sum of generator MVA bases
 * @param totalLoadDemandMw sum of load active powers
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsStatistics(int totalBuses, int totalLoads, int totalGenerators, int totalBranches,
                            int totalTransformers, List<Double> voltageLevels, List<Integer> areas,
                            List<Integer> zones, double totalGenerationCapacityMva, double totalLoadDemandMw) {

    public EmsStatistics {
        voltageLevels = List.copyOf(voltageLevels);
        areas = List.copyOf(areas);
        zones = List.copyOf(zones);
    }

    public static EmsStatistics compute(EmsModel model) {
        Objects.requireNonNull(model);
        TreeSet<Double> voltageLevels = new TreeSet<>();
        TreeSet<Integer> areas = new TreeSet<>();
        TreeSet<Integer> zones = new TreeSet<>();
        for (EmsBus bus : model.getBuses()) {
            // -0.0 and 0.0 are the same level
            voltageLevels.add(bus.baseKv() + 0.0);
            areas.add(bus.area());
            zones.add(bus.zone());
        }
        double generationCapacity = model.getGenerators().stream().mapToDouble(EmsGenerator::mvaBase).sum();
        double loadDemand = model.getLoads().stream().mapToDouble(EmsLoad::activePower).sum();
        return new EmsStatistics(model.getBuses().size(),
                                 model.getLoads().size(),
                                 model.getGenerators().size(),
                                 model.getBranches().size(),
                                 model.getTransformers().size(),
                                 List.copyOf(voltageLevels),
                                 List.copyOf(areas),
                                 List.copyOf(zones),
                                 generationCapacity,
                                 loadDemand);
    }
}
