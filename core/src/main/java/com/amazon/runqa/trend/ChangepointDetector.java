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

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;
import static com.amazon.runqa.CommonUtils.inverseVarianceWeight;
import static java.lang.Math.log;
import static java.lang.Math.max;

import java.util.Optional;

import lombok.Getter;

import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;

/**
 * Single changepoint search by exhaustive comparison of two-mean splits against
 * a one-mean baseline under the Bayesian information criterion. Every split
 * pays {@code 2 ln N}, the baseline pays {@code ln N}.
 */
@Getter
public class ChangepointDetector {

    public static final int MINIMUM_POINTS = 6;

    public static final int MINIMUM_SIDE = 3;

    private final double strongEvidence;

    public ChangepointDetector() {
        this(Changepoint.DEFAULT_STRONG_EVIDENCE);
    }

    public ChangepointDetector(double strongEvidence) {
        checkArgument(strongEvidence > 0, "strong evidence threshold must be positive");
        this.strongEvidence = strongEvidence;
    }

    public Optional<Changepoint> detect(MetricSeries series) {
        return detect(series, new boolean[series.size()]);
    }

    /**
     * searches the measured points of the series that are not excluded
     *
     * @param series   the series
     * @param excluded positions to leave out of the fit, same length as the
     *                 series
     * @return the best split, empty when fewer than six points take part
     */
    public Optional<Changepoint> detect(MetricSeries series, boolean[] excluded) {
        checkNotNull(series, "series must not be null");
        checkNotNull(excluded, "exclusion mask must not be null");
        checkArgument(excluded.length == series.size(), "incorrect mask length");

        int[] positions = new int[series.size()];
        int n = 0;
        for (int i = 0; i < series.size(); i++) {
            if (!excluded[i] && series.get(i).isMeasured()) {
                positions[n++] = i;
            }
        }
        if (n < MINIMUM_POINTS) {
            return Optional.empty();
        }
        double[] x = new double[n];
        double[] y = new double[n];
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            SamplePoint point = series.get(positions[i]);
            x[i] = point.getRun();
            y[i] = point.getValue();
            w[i] = inverseVarianceWeight(point.getStatErr());
        }

        double logN = log(n);
        double baseline = segmentSse(y, w, 0, n) + logN;
        int minimumSide = max(MINIMUM_SIDE, n / 10);
        double best = Double.POSITIVE_INFINITY;
        int bestK = -1;
        for (int k = minimumSide; k <= n - minimumSide; k++) {
            double bic = segmentSse(y, w, 0, k) + segmentSse(y, w, k, n) + 2 * logN;
            if (bic < best) {
                best = bic;
                bestK = k;
            }
        }
        if (bestK < 0) {
            return Optional.empty();
        }

        double deltaBic = baseline - best;
        WeightedLinearFit line = WeightedLinearFit.fit(x, y, w);
        double deltaBicVersusTrend = line.isDegenerate() ? deltaBic : line.getWeightedSse() + 2 * logN - best;
        boolean strong = deltaBic >= strongEvidence && deltaBicVersusTrend >= strongEvidence;
        int index = positions[bestK];
        return Optional.of(new Changepoint(index, series.get(index).getRun(), deltaBic, deltaBicVersusTrend, strong));
    }

    /**
     * weighted sum of squared deviations from the weighted mean of the segment
     * [from, to)
     */
    static double segmentSse(double[] y, double[] w, int from, int to) {
        double sw = 0;
        double swy = 0;
        for (int i = from; i < to; i++) {
            sw += w[i];
            swy += w[i] * y[i];
        }
        if (sw <= 0) {
            return 0;
        }
        double mean = swy / sw;
        double sse = 0;
        for (int i = from; i < to; i++) {
            double d = y[i] - mean;
            sse += w[i] * d * d;
        }
        return sse;
    }
}
