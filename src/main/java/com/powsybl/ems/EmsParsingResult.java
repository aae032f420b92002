/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems;

import com.powsybl.ems.model.EmsModel;
import com.powsybl.ems.parser.EmsSection;
import com.powsybl.ems.parser.ParseWarning;

import java.util.List;
import java.util.Objects;

/**
 * @param model the recovered network
 * @param warnings rows skipped while reading, in file order
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public record EmsParsingResult(EmsModel model, List<ParseWarning> warnings) {

    public EmsParsingResult {
        Objects.requireNonNull(model);
        warnings = List.copyOf(warnings);
    }

    public List<ParseWarning> getWarnings(EmsSection section) {
        return warnings.stream().filter(w -> w.section() == section).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
