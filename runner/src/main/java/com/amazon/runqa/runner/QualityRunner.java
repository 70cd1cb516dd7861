/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.runqa.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.runqa.QualityReport;
import com.amazon.runqa.RunQualityAnalyzer;
import com.amazon.runqa.serialize.CauseRuleTableSerDe;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.verdict.SensorHealth;
import com.amazon.runqa.verdict.ThresholdBounds;

/**
 * Reads long-format metric rows {@code metric,run,value,stat_err,entries},
 * analyzes every metric and writes the selected report.
 */
public class QualityRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(QualityRunner.class);

    public static final int INPUT_COLUMNS = 5;

    protected final ArgumentParser argumentParser;
    protected final Map<String, MetricSeries.Builder> builders;
    protected final Map<String, Set<Integer>> seenRuns;
    protected int lineNumber;

    public QualityRunner() {
        this(new ArgumentParser(QualityRunner.class.getName(),
                "Assess the data quality of every run from per-run metric rows and write verdicts."));
    }

    public QualityRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
        this.builders = new LinkedHashMap<>();
        this.seenRuns = new HashMap<>();
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(Pattern.quote(argumentParser.getDelimiter()), -1);
            if (lineNumber == 1 && CsvInputReader.isHeader(values)) {
                continue;
            }
            processLine(values);
        }

        QualityReport report = analyze();
        argumentParser.getReport().write(report, out);
        out.flush();
    }

    protected void processLine(String[] values) {
        if (values.length != INPUT_COLUMNS) {
            throw new IllegalArgumentException(String.format("Wrong number of values on line %d. Expected %d but found %d.",
                    lineNumber, INPUT_COLUMNS, values.length));
        }
        String metric = values[0].trim();
        if (metric.isEmpty()) {
            LOGGER.warn("skipping line {}: empty metric name", lineNumber);
            return;
        }
        int run = parseRun(values[1]);
        if (!seenRuns.computeIfAbsent(metric, k -> new HashSet<>()).add(run)) {
            throw new IllegalArgumentException(
                    String.format("Duplicate run %d for metric %s on line %d.", run, metric, lineNumber));
        }
        SamplePoint point = new SamplePoint(run, parseValue(values[2]), parseValue(values[3]),
                parseValue(values[4]));
        builders.computeIfAbsent(metric, MetricSeries::builder).add(point);
    }

    protected QualityReport analyze() throws IOException {
        CsvInputReader reader = new CsvInputReader(argumentParser.getDelimiter());

        Map<String, ThresholdBounds> thresholds = Collections.emptyMap();
        if (argumentParser.getThresholdsPath().isPresent()) {
            try (BufferedReader in = open(argumentParser.getThresholdsPath().get())) {
                thresholds = reader.readThresholds(in);
            }
            thresholds.keySet().stream().filter(metric -> !builders.containsKey(metric))
                    .forEach(metric -> LOGGER.warn("threshold for metric {} has no data", metric));
        }

        Map<Integer, SensorHealth> sensorHealth = Collections.emptyMap();
        if (argumentParser.getSensorHealthPath().isPresent()) {
            try (BufferedReader in = open(argumentParser.getSensorHealthPath().get())) {
                sensorHealth = reader.readSensorHealth(in);
            }
        }

        RunQualityAnalyzer.Builder builder = RunQualityAnalyzer.builder().windowHalfWidth(argumentParser.getWindow())
                .zScoreConvention(argumentParser.getZConvention()).controlZThreshold(argumentParser.getControlZ())
                .cusumK(argumentParser.getCusumK()).cusumH(argumentParser.getCusumH())
                .parallelExecutionEnabled(argumentParser.getParallel());
        argumentParser.getThreads().ifPresent(builder::threadPoolSize);
        if (argumentParser.getCauseRulesPath().isPresent()) {
            builder.ruleTable(new CauseRuleTableSerDe().read(argumentParser.getCauseRulesPath().get()));
        }
        if (argumentParser.getSymptomClustersPath().isPresent()) {
            try (BufferedReader in = open(argumentParser.getSymptomClustersPath().get())) {
                builder.symptomClusters(reader.readSymptomClusters(in));
            }
        }

        List<MetricSeries> series = new ArrayList<>();
        builders.values().forEach(b -> series.add(b.build()));
        return builder.build().analyzeAll(series, thresholds, sensorHealth);
    }

    private static BufferedReader open(Path path) throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    private int parseRun(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid run '%s' on line %d.", value.trim(), lineNumber), e);
        }
    }

    private double parseValue(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty() || "nan".equalsIgnoreCase(trimmed)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid number '%s' on line %d.", trimmed, lineNumber), e);
        }
    }

    public static void main(String... args) throws IOException {
        QualityRunner runner = new QualityRunner();
        runner.parse(args);
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }
}
