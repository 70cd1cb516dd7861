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

import static com.amazon.runqa.runner.CsvReportWriter.fixed;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.amazon.runqa.MetricAnalysis;
import com.amazon.runqa.QualityReport;
import com.amazon.runqa.trend.TrendStats;
import com.amazon.runqa.verdict.RunMetricVerdict;
import com.amazon.runqa.verdict.RunVerdict;
import com.amazon.runqa.verdict.Verdict;

/**
 * Human readable verdict report: totals, one table row per run, the diagnosis
 * of every flagged run, the flag rate per metric and the trend of each metric.
 */
public class MarkdownReportWriter {

    static final int BRIEF_CAUSE_LENGTH = 60;

    static final double TREND_ALPHA = 0.01;

    private MarkdownReportWriter() {
    }

    public static void write(QualityReport report, PrintWriter out) {
        List<RunVerdict> runs = report.getRunVerdicts();
        long good = runs.stream().filter(r -> r.getVerdict() == Verdict.GOOD).count();
        long suspect = runs.stream().filter(r -> r.getVerdict() == Verdict.SUSPECT).count();
        long bad = runs.stream().filter(r -> r.getVerdict() == Verdict.BAD).count();

        out.println("# QA Verdict Report");
        out.println();
        out.println("## Summary");
        out.println();
        out.println("| | Count |");
        out.println("|---|---|");
        out.println("| Total runs | " + runs.size() + " |");
        out.println("| GOOD | " + good + " |");
        out.println("| SUSPECT | " + suspect + " |");
        out.println("| BAD | " + bad + " |");
        out.println();
        if (bad > 0) {
            out.println("**Overall: " + bad + " run(s) recommended for exclusion from physics analysis.**");
        } else if (suspect > 0) {
            out.println("**Overall: " + suspect + " run(s) flagged for review. No exclusions yet.**");
        } else {
            out.println("**Overall: All runs pass QA. No exclusions recommended.**");
        }
        out.println();

        out.println("## Per-Run Verdicts");
        out.println();
        out.println("| Run | Verdict | Good | Suspect | Bad | Worst Metric |");
        out.println("|-----|---------|------|---------|-----|--------------|");
        for (RunVerdict r : runs) {
            String badge = r.getVerdict() == Verdict.BAD ? "**BAD**" : r.getVerdict().name();
            out.println("| " + r.getRun() + " | " + badge + " | " + r.getNGood() + " | " + r.getNSuspect() + " | "
                    + r.getNBad() + " | " + r.getWorstMetric().orElse("") + " |");
        }
        out.println();

        out.println("## Flagged Runs");
        out.println();
        for (RunVerdict r : runs) {
            if (r.getVerdict() != Verdict.GOOD) {
                writeFlaggedRun(r, flagged(report, r.getRun()), out);
            }
        }

        writeMetricHealth(report, out);
        writeTrends(report, out);
        out.flush();
    }

    static List<RunMetricVerdict> flagged(QualityReport report, int run) {
        return report.getMetricVerdicts().stream().filter(v -> v.getRun() == run && v.getVerdict() != Verdict.GOOD)
                .collect(Collectors.toList());
    }

    static void writeFlaggedRun(RunVerdict run, List<RunMetricVerdict> verdicts, PrintWriter out) {
        out.println("### Run " + run.getRun() + " - " + run.getVerdict());
        out.println();
        out.println("| Metric | Value | z | Verdict | Pattern | Diagnosis |");
        out.println("|--------|-------|---|---------|---------|-----------|");
        for (RunMetricVerdict v : verdicts) {
            out.println("| " + v.getMetric() + " | " + fixed(v.getValue()) + " | " + fixed(v.getZLocal()) + " | "
                    + v.getVerdict() + " | " + v.getPattern().getLabel() + " | " + brief(v.getCauses()) + " |");
        }
        out.println();
        for (RunMetricVerdict v : verdicts) {
            out.println("**" + v.getMetric() + "** (" + v.getSeverity().getLabel() + "):");
            out.println("- Pattern: " + v.getPattern().getLabel());
            out.println("- Possible causes:");
            v.getCauses().forEach(c -> out.println("  - " + c));
            out.println("- Recommended action: " + v.getAction());
            out.println();
        }
        out.println("---");
        out.println();
    }

    static String brief(List<String> causes) {
        if (causes.isEmpty()) {
            return "";
        }
        String cause = causes.get(0);
        return cause.length() > BRIEF_CAUSE_LENGTH ? cause.substring(0, BRIEF_CAUSE_LENGTH - 3) + "..." : cause;
    }

    static void writeMetricHealth(QualityReport report, PrintWriter out) {
        out.println("## Metric Health Overview");
        out.println();
        out.println("| Metric | Runs | Flagged | Flag Rate |");
        out.println("|--------|------|---------|-----------|");
        for (MetricAnalysis analysis : report.getAnalyses()) {
            List<RunMetricVerdict> verdicts = analysis.getVerdicts();
            if (verdicts.isEmpty()) {
                continue;
            }
            long flagged = verdicts.stream().filter(v -> v.getVerdict() != Verdict.GOOD).count();
            out.println("| " + analysis.getMetric() + " | " + verdicts.size() + " | " + flagged + " | "
                    + String.format(Locale.ROOT, "%.1f", 100.0 * flagged / verdicts.size()) + "% |");
        }
        out.println();
    }

    static void writeTrends(QualityReport report, PrintWriter out) {
        out.println("## Trend Analysis");
        out.println();
        out.println("| Metric | Slope | p-value | Changepoint Run | dBIC | Interpretation |");
        out.println("|--------|-------|---------|-----------------|------|----------------|");
        for (MetricAnalysis analysis : report.getAnalyses()) {
            TrendStats t = analysis.getTrendStats();
            String slope = t.getSlope().isPresent() ? String.format(Locale.ROOT, "%.2e", t.getSlope().getAsDouble())
                    : "-";
            String run = t.getChangepoint().map(c -> Integer.toString(c.getRun())).orElse("-");
            String deltaBic = t.getChangepoint().map(c -> String.format(Locale.ROOT, "%.1f", c.getDeltaBic()))
                    .orElse("-");
            out.println("| " + t.getMetric() + " | " + slope + " | " + String.format(Locale.ROOT, "%.4f", t.getPValue())
                    + " | " + run + " | " + deltaBic + " | " + interpret(t) + " |");
        }
        out.println();
    }

    static String interpret(TrendStats trend) {
        if (trend.hasSignificantTrend(TREND_ALPHA)) {
            return "Significant trend detected";
        }
        return trend.getStrongChangepoint().map(c -> "Level shift at run " + c.getRun()).orElse("Stable");
    }
}
