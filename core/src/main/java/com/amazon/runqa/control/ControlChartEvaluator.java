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

package com.amazon.runqa.control;

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;
import static java.lang.Math.max;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.statistics.RobustStatistics;

/**
 * Shewhart limit and two sided CUSUM around the global robust center of a
 * series. This chart works on raw values rather than on the windowed z-score
 * and accumulates evidence over time, so it picks up slow shifts that a local
 * window absorbs.
 */
@Getter
public class ControlChartEvaluator {

    public static final double DEFAULT_Z_THRESHOLD = 3.0;

    public static final double DEFAULT_CUSUM_K = 0.5;

    public static final double DEFAULT_CUSUM_H = 5.0;

    public static final int MINIMUM_POINTS = 3;

    private final double zThreshold;

    private final double cusumK;

    private final double cusumH;

    public ControlChartEvaluator() {
        this(DEFAULT_Z_THRESHOLD, DEFAULT_CUSUM_K, DEFAULT_CUSUM_H);
    }

    public ControlChartEvaluator(double zThreshold, double cusumK, double cusumH) {
        checkArgument(zThreshold > 0, "z threshold must be positive");
        checkArgument(cusumK >= 0, "k must be non-negative");
        checkArgument(cusumH > 0, "decision interval must be positive");
        this.zThreshold = zThreshold;
        this.cusumK = cusumK;
        this.cusumH = cusumH;
    }

    public List<ControlFlag> evaluate(MetricSeries series) {
        checkNotNull(series, "series must not be null");
        List<ControlFlag> flags = new ArrayList<>(series.size());
        double[] finite = series.finiteValues();
        if (finite.length < MINIMUM_POINTS) {
            for (SamplePoint point : series.getPoints()) {
                flags.add(ControlFlag.pass(point.getRun(), 0, 0));
            }
            return Collections.unmodifiableList(flags);
        }

        double median = RobustStatistics.median(finite);
        double sigma = RobustStatistics.robustSigma(finite);
        if (!(sigma > 0) || !Double.isFinite(sigma)) {
            sigma = 1.0;
        }

        double cusumPos = 0;
        double cusumNeg = 0;
        for (SamplePoint point : series.getPoints()) {
            if (!Double.isFinite(point.getValue())) {
                flags.add(ControlFlag.pass(point.getRun(), cusumPos, cusumNeg));
                continue;
            }
            double z = (point.getValue() - median) / sigma;
            boolean shewhart = Math.abs(z) > zThreshold;
            cusumPos = max(0.0, cusumPos + z - cusumK);
            cusumNeg = max(0.0, cusumNeg - z - cusumK);
            boolean cusum = cusumPos > cusumH || cusumNeg > cusumH;
            flags.add(new ControlFlag(point.getRun(), z, shewhart, cusumPos, cusumNeg, cusum));
        }
        return Collections.unmodifiableList(flags);
    }
}
