/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Network recovered from an EMS file. Buses are indexed by number: when a number is defined several
 * times the last definition replaces the previous one, keeping its position. The other elements are
 * kept in file order, duplicates included. Bus numbers referenced by loads, generators, branches and
 * transformers are not checked.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class EmsModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmsModel.class);

    private final EmsHeader header;

    private final Map<Integer, EmsBus> busesByNumber;

    private final List<EmsLoad> loads;

    private final List<EmsGenerator> generators;

    private final List<EmsBranch> branches;

    private final List<EmsTransformer> transformers;

    public EmsModel(EmsHeader header, List<EmsBus> buses, List<EmsLoad> loads, List<EmsGenerator> generators,
                    List<EmsBranch> branches, List<EmsTransformer> transformers) {
        this.header = Objects.requireNonNull(header);
        Map<Integer, EmsBus> indexed = new LinkedHashMap<>();
        for (EmsBus bus : Objects.requireNonNull(buses)) {
            EmsBus replaced = indexed.put(bus.number(), bus);
            if (replaced != null) {
                LOGGER.warn("Bus {} is defined several times, '{}' replaces '{}'", bus.number(), bus.name(), replaced.name());
            }
        }
        this.busesByNumber = Collections.unmodifiableMap(indexed);
        this.loads = List.copyOf(loads);
        this.generators = List.copyOf(generators);
        this.branches = List.copyOf(branches);
        this.transformers = List.copyOf(transformers);
    }

    public static EmsModel empty() {
        return new EmsModel(EmsHeader.createDefault(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public EmsHeader getHeader() {
        return header;
    }

    public Collection<EmsBus> getBuses() {
        return busesByNumber.values();
    }

    public Map<Integer, EmsBus> getBusesByNumber() {
        return busesByNumber;
    }

    public Optional<EmsBus> getBus(int number) {
        return Optional.ofNullable(busesByNumber.get(number));
    }

    public List<EmsLoad> getLoads() {
        return loads;
    }

    public List<EmsGenerator> getGenerators() {
        return generators;
    }

    public List<EmsBranch> getBranches() {
        return branches;
    }

    public List<EmsTransformer> getTransformers() {
        return transformers;
    }

    /**
     * Computes the statistics from the current collections. Nothing is cached.
     */
    public EmsStatistics getStatistics() {
        return EmsStatistics.compute(this);
    }

    /**
     * Generator brands, by brand name. The last generator of a brand gives the entry.
     */
    public Map<String, EquipmentBrands.GeneratorBrand> getGeneratorBrands() {
        Map<String, EquipmentBrands.GeneratorBrand> brands = new LinkedHashMap<>();
        for (EmsGenerator generator : generators) {
            if (generator.hasBrand()) {
                brands.put(generator.brand(), EquipmentBrands.of(generator));
            }
        }
        return brands;
    }

    /**
     * Transformer descriptions, by {@link EmsTransformer#getKey()}.
     */
    public Map<String, EquipmentBrands.TransformerBrand> getTransformerBrands() {
        Map<String, EquipmentBrands.TransformerBrand> brands = new LinkedHashMap<>();
        for (EmsTransformer transformer : transformers) {
            brands.put(transformer.getKey(), EquipmentBrands.of(transformer));
        }
        return brands;
    }

    @Override
    public String toString() {
        return "EmsModel(" + header.systemName() + ", buses=" + busesByNumber.size()
                + ", loads=" + loads.size()
                + ", generators=" + generators.size()
                + ", branches=" + branches.size()
                + ", transformers=" + transformers.size() + ")";
    }
}
