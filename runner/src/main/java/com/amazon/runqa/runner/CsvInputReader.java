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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.runqa.symptom.SymptomCluster;
import com.amazon.runqa.verdict.SensorHealth;
import com.amazon.runqa.verdict.ThresholdBounds;

/**
 * Readers for the side inputs of the runner. Each file may start with a header
 * row, recognized by its first column name. Blank lines are ignored.
 * Malformed threshold rows are skipped; the other files fail on the first
 * malformed row.
 */
public class CsvInputReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvInputReader.class);

    private static final Set<String> HEADER_NAMES = Set.of("metric", "run", "cluster");

    private final String delimiter;

    private int lineNumber;

    public CsvInputReader(String delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * reads {@code metric,lo,hi} rows; an empty bound is open. A row that
     * cannot be used (wrong column count, a bound that is not a number, a lower
     * bound above the upper one, a metric already seen) is logged and skipped,
     * which leaves its metric without a threshold.
     */
    public Map<String, ThresholdBounds> readThresholds(BufferedReader in) throws IOException {
        Map<String, ThresholdBounds> result = new LinkedHashMap<>();
        lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(Pattern.quote(delimiter), -1);
            if (lineNumber == 1 && isHeader(values)) {
                continue;
            }
            String metric = values[0].trim();
            if (values.length != 3) {
                LOGGER.warn("skipping threshold on line {} for metric {}: expected 3 values but found {}",
                        lineNumber, metric, values.length);
                continue;
            }
            if (result.containsKey(metric)) {
                LOGGER.warn("skipping threshold on line {}: metric {} already has one", lineNumber, metric);
                continue;
            }
            Optional<ThresholdBounds> bounds = parseBounds(metric, values[1], values[2]);
            bounds.ifPresent(b -> result.put(metric, b));
        }
        return result;
    }

    private Optional<ThresholdBounds> parseBounds(String metric, String lo, String hi) {
        OptionalDouble lower;
        OptionalDouble upper;
        try {
            lower = bound(lo);
            upper = bound(hi);
        } catch (NumberFormatException e) {
            LOGGER.warn("skipping threshold on line {} for metric {}: {}", lineNumber, metric, e.getMessage());
            return Optional.empty();
        }
        if (lower.isPresent() && upper.isPresent() && lower.getAsDouble() > upper.getAsDouble()) {
            LOGGER.warn("skipping threshold on line {} for metric {}: lower bound {} exceeds upper bound {}",
                    lineNumber, metric, lower.getAsDouble(), upper.getAsDouble());
            return Optional.empty();
        }
        return Optional.of(new ThresholdBounds(lower, upper));
    }

    /**
     * reads {@code run,dead,hot,total} rows
     */
    public Map<Integer, SensorHealth> readSensorHealth(BufferedReader in) throws IOException {
        Map<Integer, SensorHealth> result = new LinkedHashMap<>();
        for (String[] values : rows(in, 4)) {
            int run = integer(values[0]);
            result.put(run, new SensorHealth(run, integer(values[1]), integer(values[2]), integer(values[3])));
        }
        return result;
    }

    /**
     * reads {@code cluster,metric} rows; clusters keep the order in which they
     * first appear
     */
    public List<SymptomCluster> readSymptomClusters(BufferedReader in) throws IOException {
        Map<String, List<String>> members = new LinkedHashMap<>();
        for (String[] values : rows(in, 2)) {
            members.computeIfAbsent(values[0].trim(), k -> new ArrayList<>()).add(values[1].trim());
        }
        List<SymptomCluster> result = new ArrayList<>();
        members.forEach((name, metrics) -> result.add(new SymptomCluster(name, metrics)));
        return result;
    }

    private List<String[]> rows(BufferedReader in, int columns) throws IOException {
        List<String[]> rows = new ArrayList<>();
        lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(Pattern.quote(delimiter), -1);
            if (lineNumber == 1 && isHeader(values)) {
                continue;
            }
            if (values.length != columns) {
                throw new IllegalArgumentException(String.format(
                        "Wrong number of values on line %d. Expected %d but found %d.", lineNumber, columns,
                        values.length));
            }
            rows.add(values);
        }
        return rows;
    }

    static boolean isHeader(String[] values) {
        return HEADER_NAMES.contains(values[0].trim().toLowerCase(Locale.ROOT));
    }

    private static OptionalDouble bound(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(Double.parseDouble(trimmed));
    }

    private int integer(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid integer '%s' on line %d.", value.trim(), lineNumber), e);
        }
    }
}
