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

package com.amazon.runqa.trend;

import static com.amazon.runqa.CommonUtils.checkNotNull;
import static com.amazon.runqa.CommonUtils.inverseVarianceWeight;

import java.util.List;

import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.statistics.RobustStatistics;

public class TrendAnalyzer {

    private final ChangepointDetector changepointDetector;

    public TrendAnalyzer() {
        this(new ChangepointDetector());
    }

    public TrendAnalyzer(ChangepointDetector changepointDetector) {
        this.changepointDetector = checkNotNull(changepointDetector, "detector must not be null");
    }

    public TrendStats analyze(MetricSeries series) {
        return analyze(series, new boolean[series.size()]);
    }

    /**
     * Analyzes a series whose points already carry local robust statistics.
     * Points that are strong local outliers do not take part in the changepoint
     * search, so a single excursion cannot masquerade as a level shift.
     *
     * @param series      the series
     * @param robustStats the local statistics, one per point
     * @return the trend summary
     */
    public TrendStats analyze(MetricSeries series, List<RobustStats> robustStats) {
        checkNotNull(robustStats, "robust statistics must not be null");
        boolean[] excluded = new boolean[series.size()];
        for (int i = 0; i < excluded.length && i < robustStats.size(); i++) {
            excluded[i] = robustStats.get(i).isStrong();
        }
        return analyze(series, excluded);
    }

    public TrendStats analyze(MetricSeries series, boolean[] excludedFromChangepoint) {
        checkNotNull(series, "series must not be null");
        int n = 0;
        double[] x = new double[series.size()];
        double[] y = new double[series.size()];
        double[] w = new double[series.size()];
        for (SamplePoint point : series.getPoints()) {
            if (point.isMeasured()) {
                x[n] = point.getRun();
                y[n] = point.getValue();
                w[n] = inverseVarianceWeight(point.getStatErr());
                n++;
            }
        }
        double[] values = new double[n];
        System.arraycopy(y, 0, values, 0, n);
        double median = RobustStatistics.median(values);
        double robustSigma = RobustStatistics.robustSigma(values);

        double[] xs = new double[n];
        double[] ws = new double[n];
        System.arraycopy(x, 0, xs, 0, n);
        System.arraycopy(w, 0, ws, 0, n);
        WeightedLinearFit fit = WeightedLinearFit.fit(xs, values, ws);

        return new TrendStats(series.getName(), n, median, robustSigma, fit,
                changepointDetector.detect(series, excludedFromChangepoint));
    }
}
