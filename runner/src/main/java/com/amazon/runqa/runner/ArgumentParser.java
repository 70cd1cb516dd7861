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

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.runqa.anomalydetection.RobustOutlierDetector;
import com.amazon.runqa.anomalydetection.ZScoreConvention;
import com.amazon.runqa.control.ControlChartEvaluator;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/runqa-runner-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument delimiter;
    private final StringArgument thresholds;
    private final StringArgument sensorHealth;
    private final StringArgument causeRules;
    private final StringArgument symptomClusters;
    private final IntegerArgument window;
    private final StringArgument zConvention;
    private final DoubleArgument controlZ;
    private final DoubleArgument cusumK;
    private final DoubleArgument cusumH;
    private final StringArgument report;
    private final BooleanArgument parallel;
    private final IntegerArgument threads;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.", ",",
                s -> checkArgument(!s.isEmpty(), "delimiter should not be empty"));
        addArgument(delimiter);

        thresholds = new StringArgument("-t", "--thresholds",
                "CSV file of acceptance ranges, one 'metric,lo,hi' row per metric; an empty bound is open.", "");
        addArgument(thresholds);

        sensorHealth = new StringArgument(null, "--sensor-health",
                "CSV file of 'run,dead,hot,total' sensor counts used as diagnosis context.", "");
        addArgument(sensorHealth);

        causeRules = new StringArgument(null, "--cause-rules",
                "JSON cause rule table replacing the built-in silicon tracker table.", "");
        addArgument(causeRules);

        symptomClusters = new StringArgument(null, "--symptom-clusters",
                "CSV file of 'cluster,metric' rows defining the symptom clusters.", "");
        addArgument(symptomClusters);

        window = new IntegerArgument("-w", "--window", "Half width of the neighbour window, in positions.",
                RobustOutlierDetector.DEFAULT_WINDOW_HALF_WIDTH,
                n -> checkArgument(n > 0, "window should be greater than 0"));
        addArgument(window);

        zConvention = new StringArgument(null, "--z-convention",
                "Local z thresholds: 'local_mad' (2/3) or 'pipeline_documented' (3/5).",
                RobustOutlierDetector.DEFAULT_CONVENTION.name().toLowerCase(Locale.ROOT),
                s -> parseConvention(s));
        addArgument(zConvention);

        controlZ = new DoubleArgument(null, "--control-z", "Shewhart limit on the robust z of the control chart.",
                ControlChartEvaluator.DEFAULT_Z_THRESHOLD, x -> checkArgument(x > 0, "control z should be positive"));
        addArgument(controlZ);

        cusumK = new DoubleArgument(null, "--cusum-k", "CUSUM allowance k, in sigma.",
                ControlChartEvaluator.DEFAULT_CUSUM_K, x -> checkArgument(x >= 0, "k should be non-negative"));
        addArgument(cusumK);

        cusumH = new DoubleArgument(null, "--cusum-h", "CUSUM decision interval H, in sigma.",
                ControlChartEvaluator.DEFAULT_CUSUM_H, x -> checkArgument(x > 0, "H should be positive"));
        addArgument(cusumH);

        report = new StringArgument("-r", "--report", "Report to write: " + ReportFormat.labels() + ".",
                ReportFormat.RUN_VERDICTS.getLabel(), s -> ReportFormat.fromLabel(s));
        addArgument(report);

        parallel = new BooleanArgument(null, "--parallel", "Set to 'true' to analyze metrics in parallel.", false);
        addArgument(parallel);

        threads = new IntegerArgument(null, "--threads",
                "Thread pool size for parallel analysis, 0 for one less than the number of processors.", 0,
                n -> checkArgument(n >= 0, "threads should be non-negative"));
        addArgument(threads);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public Optional<Path> getThresholdsPath() {
        return toPath(thresholds);
    }

    public Optional<Path> getSensorHealthPath() {
        return toPath(sensorHealth);
    }

    public Optional<Path> getCauseRulesPath() {
        return toPath(causeRules);
    }

    public Optional<Path> getSymptomClustersPath() {
        return toPath(symptomClusters);
    }

    public int getWindow() {
        return window.getValue();
    }

    public ZScoreConvention getZConvention() {
        return parseConvention(zConvention.getValue());
    }

    public double getControlZ() {
        return controlZ.getValue();
    }

    public double getCusumK() {
        return cusumK.getValue();
    }

    public double getCusumH() {
        return cusumH.getValue();
    }

    public ReportFormat getReport() {
        return ReportFormat.fromLabel(report.getValue());
    }

    public boolean getParallel() {
        return parallel.getValue();
    }

    /**
     * @return the thread pool size, empty when the analyzer should pick it
     */
    public Optional<Integer> getThreads() {
        return threads.getValue() > 0 ? Optional.of(threads.getValue()) : Optional.empty();
    }

    private static Optional<Path> toPath(StringArgument argument) {
        return argument.getValue().isEmpty() ? Optional.empty() : Optional.of(Paths.get(argument.getValue()));
    }

    static ZScoreConvention parseConvention(String value) {
        try {
            return ZScoreConvention.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown z convention: " + value, e);
        }
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
