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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;

/**
 * Cluster scores and labels of one run, clusters in configuration order.
 */
@Getter
@ToString
public class RunSymptoms {

    private final int run;

    private final Map<String, Integer> scores;

    private final List<SymptomRecord> records;

    public RunSymptoms(int run, Map<String, Integer> scores, List<SymptomRecord> records) {
        this.run = run;
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        this.records = List.copyOf(records);
    }

    public ClusterLabel getLabel(String cluster) {
        return ClusterLabel.fromScore(scores.getOrDefault(cluster, 0));
    }

    public Map<String, ClusterLabel> getLabels() {
        Map<String, ClusterLabel> labels = new LinkedHashMap<>();
        scores.forEach((k, v) -> labels.put(k, ClusterLabel.fromScore(v)));
        return labels;
    }
}
