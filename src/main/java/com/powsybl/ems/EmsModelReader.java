/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.ems;

import com.google.common.base.Stopwatch;
import com.powsybl.ems.model.*;
import com.powsybl.ems.parser.*;
import com.powsybl.ems.parser.heuristics.BusFieldHeuristics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.powsybl.ems.util.Markers.PERFORMANCE_MARKER;

/**
 * Reads an EMS flat text file into an {@link EmsModel}.
 * <p>
 * Sections are read in file order, bus, load, generator, branch and transformer, each one starting right
 * after the marker line of the previous one. Malformed rows are skipped and reported in the result. Only
 * an unreadable input makes the read fail.
 *
 * @author Camille Perrin {@literal <camille.perrin at rte-france.com>}
 */
public class EmsModelReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmsModelReader.class);

    private final EmsReaderParameters parameters;

    private final BusRecordBuilder busBuilder;

    private final LoadRecordBuilder loadBuilder;

    private final GeneratorRecordBuilder generatorBuilder;

    private final BranchRecordBuilder branchBuilder;

    private final TransformerRecordBuilder transformerBuilder;

    public EmsModelReader() {
        this(new EmsReaderParameters());
    }

    public EmsModelReader(EmsReaderParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        int previewLength = parameters.getPreviewLength();
        busBuilder = new BusRecordBuilder(new BusFieldHeuristics(parameters.getMinPlausibleVoltageMagnitude(),
                                                                 parameters.getMaxPlausibleVoltageMagnitude()),
                                          previewLength);
        loadBuilder = new LoadRecordBuilder(previewLength);
        generatorBuilder = new GeneratorRecordBuilder(previewLength);
        branchBuilder = new BranchRecordBuilder(previewLength);
        transformerBuilder = new TransformerRecordBuilder(previewLength);
    }

    public EmsReaderParameters getParameters() {
        return parameters;
    }

    /**
     * @throws UncheckedIOException if the file cannot be read
     */
    public EmsParsingResult read(Path file) {
        Objects.requireNonNull(file);
        LOGGER.info("Parsing EMS file {}", file);
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return read(lines);
    }

    /**
     * Reads the whole stream as UTF-8. The stream is not closed.
     */
    public EmsParsingResult read(InputStream is) {
        Objects.requireNonNull(is);
        BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        return read(reader.lines().collect(Collectors.toList()));
    }

    public EmsParsingResult read(List<String> lines) {
        Objects.requireNonNull(lines);
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<ParseWarning> warnings = new ArrayList<>();

        EmsHeader header = EmsHeaderParser.parse(lines, parameters.getHeaderScanLineCount(), parameters.getDefaultBaseFrequency());

        SectionRange busRange = busBuilder.locate(lines, parameters.getBusSectionStart());
        List<EmsBus> buses = readSection(busBuilder, lines, busRange, warnings);

        SectionRange loadRange = loadBuilder.locate(lines, busRange.nextSectionStart());
        List<EmsLoad> loads = readSection(loadBuilder, lines, loadRange, warnings);

        SectionRange generatorRange = generatorBuilder.locate(lines, loadRange.nextSectionStart());
        List<EmsGenerator> generators = readSection(generatorBuilder, lines, generatorRange, warnings);

        SectionRange branchRange = branchBuilder.locate(lines, generatorRange.nextSectionStart());
        List<EmsBranch> branches = readSection(branchBuilder, lines, branchRange, warnings);

        SectionRange transformerRange = transformerBuilder.locate(lines, branchRange.nextSectionStart());
        List<EmsTransformer> transformers = readSection(transformerBuilder, lines, transformerRange, warnings);

        EmsModel model = new EmsModel(header, buses, loads, generators, branches, transformers);

        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "{} read from {} lines in {} ms ({} rows skipped)",
                model, lines.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS), warnings.size());

        return new EmsParsingResult(model, warnings);
    }

    private static <T> List<T> readSection(AbstractRecordBuilder<T> builder, List<String> lines, SectionRange range,
                                           List<ParseWarning> warnings) {
        if (range.end() == lines.size()) {
            LOGGER.debug("No '{}' marker found, {} section runs to the end of input", builder.getSection().getEndMarker(), builder.getSection());
        }
        int warningCount = warnings.size();
        List<T> records = builder.build(lines, range, warnings);
        LOGGER.debug("{} section, lines [{}, {}): {} records read, {} rows skipped", builder.getSection(),
                range.start() + 1, range.end() + 1, records.size(), warnings.size() - warningCount);
        return records;
    }
}
