/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsGenerator;
import com.powsybl.ems.parser.heuristics.GeneratorFieldHeuristics;
import com.powsybl.ems.parser.heuristics.GeneratorFields;

import java.util.List;

/**
 * Generator rows. Fields after the id are recovered by {@link GeneratorFieldHeuristics}.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class GeneratorRecordBuilder extends AbstractSingleLineRecordBuilder<EmsGenerator> {

    public static final double DEFAULT_INERTIA = 3.0;

    public static final double DEFAULT_DAMPING = 0.0;

    public static final String DEFAULT_FUEL_TYPE = "Unknown";

    public static final double DEFAULT_EFFICIENCY = 0.95;

    public static final int DEFAULT_YEAR_COMMISSIONED = 2000;

    public GeneratorRecordBuilder() {
        this(PREVIEW_LENGTH_DEFAULT_VALUE);
    }

    public GeneratorRecordBuilder(int previewLength) {
        super(previewLength);
    }

    @Override
    public EmsSection getSection() {
        return EmsSection.GENERATOR;
    }

    @Override
    protected int getMinTokenCount() {
        return GeneratorFieldHeuristics.MIN_TOKEN_COUNT;
    }

    @Override
    protected EmsGenerator buildRecord(List<String> tokens) {
        GeneratorFields fields = GeneratorFieldHeuristics.recover(tokens);
        return new EmsGenerator(fields.busNumber(),
                                fields.id(),
                                fields.activePower(),
                                fields.reactivePower(),
                                fields.maxReactivePower(),
                                fields.minReactivePower(),
                                fields.voltageSetpoint(),
                                fields.mvaBase(),
                                DEFAULT_INERTIA,
                                DEFAULT_DAMPING,
                                fields.brand(),
                                fields.model(),
                                DEFAULT_FUEL_TYPE,
                                DEFAULT_EFFICIENCY,
                                DEFAULT_YEAR_COMMISSIONED);
    }
}
