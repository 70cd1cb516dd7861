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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

import com.amazon.runqa.MetricAnalysis;
import com.amazon.runqa.QualityReport;
import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.control.ControlFlag;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.symptom.RunSymptoms;
import com.amazon.runqa.trend.Changepoint;
import com.amazon.runqa.trend.TrendStats;
import com.amazon.runqa.verdict.QualityStatus;
import com.amazon.runqa.verdict.RunMetricVerdict;
import com.amazon.runqa.verdict.RunVerdict;

/**
 * Comma separated reports. Free text columns are quoted, metric and cluster
 * names only when they hold a comma, a quote or a line break. Undefined numbers
 * are written as {@code nan}.
 */
public class CsvReportWriter {

    public static final String RUN_VERDICTS_HEADER = "run,verdict,n_good,n_suspect,n_bad,worst_metric,summary";
    public static final String METRIC_VERDICTS_HEADER = "run,metric,verdict,severity,pattern,cause,action,z_local,value";
    public static final String TREND_HEADER = "metric,N,median,robust_sigma,slope,eslope,pval,cp_run,dBIC,dBIC_vs_trend,cp_strong";
    public static final String CONTROL_HEADER = "metric,run,z_robust,shewhart_ooc,cusum_pos,cusum_neg,cusum_ooc,status";
    public static final String ROBUST_HEADER = "metric,run,value,stat_err,entries,neighbors_median,neighbors_mad,"
            + "z_local,is_outlier_weak,is_outlier_strong";
    public static final String QUALITY_HEADER = "metric,run,value,status,reason";
    public static final String SYMPTOMS_HEADER = "run,cluster,score,label";

    private CsvReportWriter() {
    }

    public static void writeRunVerdicts(QualityReport report, PrintWriter out) {
        out.println(RUN_VERDICTS_HEADER);
        for (RunVerdict v : report.getRunVerdicts()) {
            out.println(v.getRun() + "," + v.getVerdict() + "," + v.getNGood() + "," + v.getNSuspect() + ","
                    + v.getNBad() + "," + name(v.getWorstMetric().orElse("")) + "," + quote(v.getSummary()));
        }
    }

    public static void writeMetricVerdicts(QualityReport report, PrintWriter out) {
        out.println(METRIC_VERDICTS_HEADER);
        for (RunMetricVerdict v : report.getMetricVerdicts()) {
            out.println(v.getRun() + "," + name(v.getMetric()) + "," + v.getVerdict() + ","
                    + v.getSeverity().getLabel() + "," + v.getPattern().getLabel() + ","
                    + quote(String.join("; ", v.getCauses())) + "," + quote(v.getAction()) + "," + fixed(v.getZLocal()) + "," + fixed(v.getValue()));
        }
    }

    public static void writeTrend(QualityReport report, PrintWriter out) {
        out.println(TREND_HEADER);
        for (MetricAnalysis analysis : report.getAnalyses()) {
            TrendStats t = analysis.getTrendStats();
            StringBuilder line = new StringBuilder();
            line.append(name(t.getMetric())).append(',').append(t.getN()).append(',').append(number(t.getMedian()))
                    .append(',').append(number(t.getRobustSigma())).append(',').append(number(t.getSlope()))
                    .append(',').append(number(t.getSlopeError())).append(',').append(number(t.getPValue()));
            if (t.getChangepoint().isPresent()) {
                Changepoint c = t.getChangepoint().get();
                line.append(',').append(c.getRun()).append(',').append(number(c.getDeltaBic())).append(',')
                        .append(number(c.getDeltaBicVersusTrend())).append(',').append(flag(c.isStrong()));
            } else {
                line.append(",,,,0");
            }
            out.println(line);
        }
    }

    public static void writeControl(QualityReport report, PrintWriter out) {
        out.println(CONTROL_HEADER);
        for (MetricAnalysis analysis : report.getAnalyses()) {
            for (ControlFlag f : analysis.getControlFlags()) {
                out.println(name(analysis.getMetric()) + "," + f.getRun() + "," + number(f.getZRobust()) + ","
                        + flag(f.isShewhartOutOfControl()) + "," + number(f.getCusumPos()) + ","
                        + number(f.getCusumNeg()) + "," + flag(f.isCusumOutOfControl()) + "," + f.getStatus());
            }
        }
    }

    public static void writeRobust(QualityReport report, PrintWriter out) {
        out.println(ROBUST_HEADER);
        for (MetricAnalysis analysis : report.getAnalyses()) {
            MetricSeries series = analysis.getSeries();
            List<RobustStats> stats = analysis.getRobustStats();
            for (int i = 0; i < series.size(); i++) {
                SamplePoint p = series.get(i);
                RobustStats s = stats.get(i);
                out.println(name(series.getName()) + "," + p.getRun() + "," + number(p.getValue()) + ","
                        + number(p.getStatErr()) + "," + number(p.getEntries()) + ","
                        + number(s.getNeighborsMedian()) + "," + number(s.getNeighborsMad()) + ","
                        + number(s.getZLocal()) + "," + flag(s.isWeak()) + "," + flag(s.isStrong()));
            }
        }
    }

    public static void writeQuality(QualityReport report, PrintWriter out) {
        out.println(QUALITY_HEADER);
        for (MetricAnalysis analysis : report.getAnalyses()) {
            for (QualityStatus q : analysis.getQualityStatuses()) {
                out.println(name(analysis.getMetric()) + "," + q.getRun() + "," + number(q.getValue()) + ","
                        + q.getStatus() + "," + q.getReason());
            }
        }
    }

    public static void writeSymptoms(QualityReport report, PrintWriter out) {
        out.println(SYMPTOMS_HEADER);
        for (RunSymptoms symptoms : report.getSymptoms()) {
            for (Map.Entry<String, Integer> score : symptoms.getScores().entrySet()) {
                out.println(symptoms.getRun() + "," + name(score.getKey()) + "," + score.getValue() + ","
                        + symptoms.getLabel(score.getKey()).getLabel());
            }
        }
    }

    static String quote(String text) {
        return "\"" + text.replace("\"", "\"\"") + "\"";
    }

    static String name(String name) {
        return name.indexOf(',') >= 0 || name.indexOf('"') >= 0 || name.indexOf('\n') >= 0
                || name.indexOf('\r') >= 0 ? quote(name) : name;
    }

    static String fixed(double value) {
        return Double.isNaN(value) ? "nan" : String.format(Locale.ROOT, "%.3f", value);
    }

    static String number(double value) {
        return Double.isNaN(value) ? "nan" : Double.toString(value);
    }

    static String number(OptionalDouble value) {
        return value.isPresent() ? Double.toString(value.getAsDouble()) : "nan";
    }

    static String flag(boolean value) {
        return value ? "1" : "0";
    }
}
