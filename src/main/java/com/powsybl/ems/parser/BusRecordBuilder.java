/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import com.powsybl.ems.model.EmsBus;
import com.powsybl.ems.parser.heuristics.BusFieldHeuristics;
import com.powsybl.ems.parser.heuristics.BusFields;

import java.util.List;
import java.util.Objects;

/**
 * Bus lines: number, quoted name, then fields without fixed columns.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class BusRecordBuilder extends AbstractSingleLineRecordBuilder<EmsBus> {

    private final BusFieldHeuristics heuristics;

    public BusRecordBuilder() {
        this(new BusFieldHeuristics(), PREVIEW_LENGTH_DEFAULT_VALUE);
    }

    public BusRecordBuilder(BusFieldHeuristics heuristics, int previewLength) {
        super(previewLength);
        this.heuristics = Objects.requireNonNull(heuristics);
    }

    @Override
    public EmsSection getSection() {
        return EmsSection.BUS;
    }

    @Override
    protected int getMinTokenCount() {
        return BusFieldHeuristics.MIN_TOKEN_COUNT;
    }

    @Override
    protected List<String> tokenize(String line) {
        // names may contain spaces
        return EmsTokenizer.tokenizeQuoted(line);
    }

    @Override
    protected EmsBus buildRecord(List<String> tokens) {
        BusFields fields = heuristics.recover(tokens);
        return new EmsBus(fields.number(),
                          fields.name(),
                          fields.baseKv(),
                          fields.busType(),
                          fields.voltageMagnitude(),
                          fields.voltageAngle(),
                          fields.area(),
                          fields.zone(),
                          EmsBus.DEFAULT_MAX_VOLTAGE,
                          EmsBus.DEFAULT_MIN_VOLTAGE,
                          "Bus " + fields.name() + " " + fields.number() + " " + fields.baseKv() + "kV");
    }
}
