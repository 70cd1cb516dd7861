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

import lombok.Getter;

import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.control.ControlFlag;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.trend.TrendStats;
import com.amazon.runqa.verdict.QualityStatus;
import com.amazon.runqa.verdict.RunMetricVerdict;

/**
 * Everything derived from one metric series. The per point lists are aligned
 * with the points of the series.
 */
@Getter
public class MetricAnalysis {

    private final MetricSeries series;

    private final List<RobustStats> robustStats;

    private final TrendStats trendStats;

    private final List<ControlFlag> controlFlags;

    private final List<QualityStatus> qualityStatuses;

    private final List<RunMetricVerdict> verdicts;

    public MetricAnalysis(MetricSeries series, List<RobustStats> robustStats, TrendStats trendStats,
            List<ControlFlag> controlFlags, List<QualityStatus> qualityStatuses, List<RunMetricVerdict> verdicts) {
        this.series = series;
        this.robustStats = robustStats;
        this.trendStats = trendStats;
        this.controlFlags = controlFlags;
        this.qualityStatuses = qualityStatuses;
        this.verdicts = verdicts;
    }

    public String getMetric() {
        return series.getName();
    }
}
