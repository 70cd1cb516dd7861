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

package com.amazon.runqa;

import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.runqa.symptom.RunSymptoms;
import com.amazon.runqa.verdict.RunMetricVerdict;
import com.amazon.runqa.verdict.RunVerdict;

/**
 * The result of a pass over all metrics: analyses and verdicts in metric
 * order, run verdicts and symptoms in run order.
 */
@Getter
public class QualityReport {

    private final List<MetricAnalysis> analyses;

    private final List<RunMetricVerdict> metricVerdicts;

    private final List<RunVerdict> runVerdicts;

    private final List<RunSymptoms> symptoms;

    public QualityReport(List<MetricAnalysis> analyses, List<RunMetricVerdict> metricVerdicts,
            List<RunVerdict> runVerdicts, List<RunSymptoms> symptoms) {
        this.analyses = List.copyOf(analyses);
        this.metricVerdicts = List.copyOf(metricVerdicts);
        this.runVerdicts = List.copyOf(runVerdicts);
        this.symptoms = List.copyOf(symptoms);
    }

    public Optional<MetricAnalysis> getAnalysis(String metric) {
        return analyses.stream().filter(a -> a.getMetric().equals(metric)).findFirst();
    }

    public Optional<RunVerdict> getRunVerdict(int run) {
        return runVerdicts.stream().filter(v -> v.getRun() == run).findFirst();
    }
}
