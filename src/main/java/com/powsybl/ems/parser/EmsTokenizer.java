/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems.parser;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits EMS record lines into tokens.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public final class EmsTokenizer {

    public static final char QUOTE = '\'';

    private static final String SINGLE_QUOTE = "'";

    private EmsTokenizer() {
    }

    /**
     * Splits a line on runs of spaces, keeping single-quoted spans as one token. Quote characters stay
     * part of the token. An unbalanced quote makes the rest of the line a single quoted span.
     */
    public static List<String> tokenizeQuoted(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
                current.append(c);
            } else if (c == ' ' && !inQuotes) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Splits a line on any run of whitespace, without quote handling.
     */
    public static List<String> tokenizeWhitespace(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(stripped.split("\\s+"));
    }

    public static String stripQuotes(String token) {
        return stripQuotes(token, SINGLE_QUOTE);
    }

    /**
     * Removes any leading and trailing character found in {@code quoteChars}.
     */
    public static String stripQuotes(String token, String quoteChars) {
        return StringUtils.strip(token, quoteChars);
    }
}
