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

package com.amazon.runqa.state.report;

import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import com.amazon.runqa.MetricAnalysis;
import com.amazon.runqa.QualityReport;
import com.amazon.runqa.symptom.RunSymptoms;
import com.amazon.runqa.trend.TrendStats;
import com.amazon.runqa.verdict.RunMetricVerdict;
import com.amazon.runqa.verdict.RunVerdict;

/**
 * Creates a {@link QualityReportState} from a {@link QualityReport}. Reports are
 * outputs only, there is no way back to the model.
 */
public class QualityReportMapper {

    public static final String VERSION = "1.0";

    public QualityReportState toState(QualityReport report) {
        checkNotNull(report, "report must not be null");
        QualityReportState state = new QualityReportState();
        state.setVersion(VERSION);
        state.setRunVerdicts(report.getRunVerdicts().stream().map(this::toState).collect(Collectors.toList()));
        state.setMetricVerdicts(report.getMetricVerdicts().stream().map(this::toState).collect(Collectors.toList()));
        state.setTrends(report.getAnalyses().stream().map(MetricAnalysis::getTrendStats).map(this::toState)
                .collect(Collectors.toList()));
        state.setSymptoms(report.getSymptoms().stream().map(this::toState).collect(Collectors.toList()));
        return state;
    }

    RunVerdictState toState(RunVerdict verdict) {
        RunVerdictState state = new RunVerdictState();
        state.setRun(verdict.getRun());
        state.setVerdict(verdict.getVerdict().name());
        state.setGoodCount(verdict.getNGood());
        state.setSuspectCount(verdict.getNSuspect());
        state.setBadCount(verdict.getNBad());
        state.setWorstMetric(verdict.getWorstMetric().orElse(null));
        state.setSummary(verdict.getSummary());
        return state;
    }

    RunMetricVerdictState toState(RunMetricVerdict verdict) {
        RunMetricVerdictState state = new RunMetricVerdictState();
        state.setRun(verdict.getRun());
        state.setMetric(verdict.getMetric());
        state.setVerdict(verdict.getVerdict().name());
        state.setSeverity(verdict.getSeverity().getLabel());
        state.setPattern(verdict.getPattern().getLabel());
        state.setCauses(new ArrayList<>(verdict.getCauses()));
        state.setAction(verdict.getAction());
        state.setLocalZ(finiteOrNull(verdict.getZLocal()));
        state.setValue(finiteOrNull(verdict.getValue()));
        state.setMeasured(verdict.isMeasured());
        return state;
    }

    TrendState toState(TrendStats trend) {
        TrendState state = new TrendState();
        state.setMetric(trend.getMetric());
        state.setMeasuredCount(trend.getN());
        state.setMedian(finiteOrNull(trend.getMedian()));
        state.setRobustSigma(finiteOrNull(trend.getRobustSigma()));
        state.setSlope(boxed(trend.getSlope()));
        state.setSlopeError(boxed(trend.getSlopeError()));
        state.setSlopePValue(trend.getPValue());
        trend.getChangepoint().ifPresent(c -> {
            state.setChangepointRun(c.getRun());
            state.setChangepointDeltaBic(c.getDeltaBic());
            state.setChangepointStrong(c.isStrong());
        });
        return state;
    }

    RunSymptomsState toState(RunSymptoms symptoms) {
        RunSymptomsState state = new RunSymptomsState();
        state.setRun(symptoms.getRun());
        state.setScores(new LinkedHashMap<>(symptoms.getScores()));
        Map<String, String> labels = new LinkedHashMap<>();
        symptoms.getLabels().forEach((cluster, label) -> labels.put(cluster, label.getLabel()));
        state.setLabels(labels);
        return state;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
