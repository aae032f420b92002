/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.model;

/**
 * Brand dictionary entries derived from generators and transformers.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class EquipmentBrands {

    public static final String GENERATOR_TYPE = "Synchronous Generator";

    public static final String TRANSFORMER_TYPE = "Power Transformer";

    private EquipmentBrands() {
    }

    public record GeneratorBrand(String model, String type, String fuelType) {
    }

    /**
     * @param voltageRatio from and to side voltages, formatted as {@code <from>/<to>kV}
     */
    public record TransformerBrand(String type, String voltageRatio, double mvaRating, String vectorGroup, String coolingType) {
    }

    static GeneratorBrand of(EmsGenerator generator) {
        return new GeneratorBrand(generator.model(), GENERATOR_TYPE, generator.fuelType());
    }

    static TransformerBrand of(EmsTransformer transformer) {
        return new TransformerBrand(TRANSFORMER_TYPE, transformer.getVoltageRatio(), transformer.nominalMva(),
                transformer.vectorGroup(), transformer.coolingType());
    }
}
