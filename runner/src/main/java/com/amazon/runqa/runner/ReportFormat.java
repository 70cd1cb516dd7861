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

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

import com.amazon.runqa.QualityReport;
import com.amazon.runqa.serialize.QualityReportSerDe;

/**
 * The reports the runner can write, by command line label.
 */
public enum ReportFormat {

    RUN_VERDICTS("run-verdicts", CsvReportWriter::writeRunVerdicts),
    METRIC_VERDICTS("metric-verdicts", CsvReportWriter::writeMetricVerdicts),
    TREND("trend", CsvReportWriter::writeTrend),
    CONTROL("control", CsvReportWriter::writeControl),
    ROBUST("robust", CsvReportWriter::writeRobust),
    QUALITY("quality", CsvReportWriter::writeQuality),
    SYMPTOMS("symptoms", CsvReportWriter::writeSymptoms),
    MARKDOWN("markdown", MarkdownReportWriter::write),
    JSON("json", (report, out) -> new QualityReportSerDe().write(report, out));

    private final String label;

    private final BiConsumer<QualityReport, PrintWriter> writer;

    ReportFormat(String label, BiConsumer<QualityReport, PrintWriter> writer) {
        this.label = label;
        this.writer = writer;
    }

    public String getLabel() {
        return label;
    }

    public void write(QualityReport report, PrintWriter out) {
        writer.accept(report, out);
    }

    public static ReportFormat fromLabel(String label) {
        return Arrays.stream(values()).filter(f -> f.label.equals(label)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown report: " + label));
    }

    static String labels() {
        return Arrays.stream(values()).map(ReportFormat::getLabel).collect(Collectors.joining(", "));
    }
}
