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

package com.amazon.runqa.symptom;

import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import lombok.Getter;

/**
 * Scores symptom clusters per run. Each metric of a cluster contributes the
 * weight of its symptom level; metrics without a defined z in the run are
 * skipped.
 */
@Getter
public class SymptomScorer {

    private final List<SymptomCluster> clusters;

    private final SeverityThresholds globalThresholds;

    private final Map<String, SeverityThresholds> metricThresholds;

    public SymptomScorer(List<SymptomCluster> clusters) {
        this(clusters, SeverityThresholds.DEFAULT, Collections.emptyMap());
    }

    public SymptomScorer(List<SymptomCluster> clusters, SeverityThresholds globalThresholds,
            Map<String, SeverityThresholds> metricThresholds) {
        this.clusters = List.copyOf(checkNotNull(clusters, "clusters must not be null"));
        this.globalThresholds = checkNotNull(globalThresholds, "global thresholds must not be null");
        this.metricThresholds = Map.copyOf(checkNotNull(metricThresholds, "metric thresholds must not be null"));
    }

    /**
     * @param run       the run
     * @param zByMetric z-scores of the run keyed by metric, NaN or absent when
     *                  undefined
     * @return the scores of every cluster
     */
    public RunSymptoms score(int run, Map<String, Double> zByMetric) {
        checkNotNull(zByMetric, "z map must not be null");
        Map<String, Integer> scores = new LinkedHashMap<>();
        List<SymptomRecord> records = new ArrayList<>();
        for (SymptomCluster cluster : clusters) {
            int score = 0;
            for (String metric : cluster.getMetrics()) {
                Double z = zByMetric.get(metric);
                if (z == null || z.isNaN()) {
                    continue;
                }
                SymptomLevel level = metricThresholds.getOrDefault(metric, globalThresholds).classify(z);
                score += level.getWeight();
                records.add(new SymptomRecord(metric, z, level, cluster.getName()));
            }
            scores.put(cluster.getName(), score);
        }
        return new RunSymptoms(run, scores, records);
    }

    public List<RunSymptoms> scoreRuns(SortedMap<Integer, Map<String, Double>> zByRun) {
        checkNotNull(zByRun, "z map must not be null");
        List<RunSymptoms> result = new ArrayList<>(zByRun.size());
        zByRun.forEach((run, z) -> result.add(score(run, z)));
        return result;
    }
}
