/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder of sections where each row holds one record.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public abstract class AbstractSingleLineRecordBuilder<T> extends AbstractRecordBuilder<T> {

    protected AbstractSingleLineRecordBuilder(int previewLength) {
        super(previewLength);
    }

    protected abstract int getMinTokenCount();

    protected List<String> tokenize(String line) {
        return EmsTokenizer.tokenizeWhitespace(line);
    }

    /**
     * @throws NumberFormatException if a numeric field is not a number
     * @throws IndexOutOfBoundsException if a positional field is missing
     */
    protected abstract T buildRecord(List<String> tokens);

    @Override
    public List<T> build(List<String> lines, SectionRange range, List<ParseWarning> warnings) {
        List<T> records = new ArrayList<>();
        for (int i = range.start(); i < range.end(); i++) {
            String line = lines.get(i).strip();
            if (isIgnored(line)) {
                continue;
            }
            List<String> tokens = tokenize(line);
            if (tokens.size() < getMinTokenCount()) {
                warn(warnings, i, line, tooFewTokens(getMinTokenCount(), tokens.size()));
                continue;
            }
            try {
                records.add(buildRecord(tokens));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                warn(warnings, i, line, e);
            }
        }
        return records;
    }
}
