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

import java.util.Optional;
import java.util.OptionalDouble;

import lombok.Getter;
import lombok.ToString;

/**
 * Consistency summary of one metric: location and spread of the measured
 * values, the straight line trend and the best level shift.
 */
@Getter
@ToString
public class TrendStats {

    private final String metric;

    /**
     * number of measured points
     */
    private final int n;

    /**
     * median of the measured values, NaN when nothing was measured
     */
    private final double median;

    /**
     * 1.4826 * MAD of the measured values, NaN when nothing was measured
     */
    private final double robustSigma;

    private final OptionalDouble slope;

    private final OptionalDouble slopeError;

    private final double pValue;

    private final Optional<Changepoint> changepoint;

    public TrendStats(String metric, int n, double median, double robustSigma, WeightedLinearFit fit,
            Optional<Changepoint> changepoint) {
        this.metric = metric;
        this.n = n;
        this.median = median;
        this.robustSigma = robustSigma;
        this.slope = fit.getSlope();
        this.slopeError = fit.getSlopeError();
        this.pValue = fit.getPValue();
        this.changepoint = changepoint;
    }

    public Optional<Changepoint> getStrongChangepoint() {
        return changepoint.filter(Changepoint::isStrong);
    }

    /**
     * @param alpha significance level
     * @return true if the slope is nonzero with p-value below alpha
     */
    public boolean hasSignificantTrend(double alpha) {
        return pValue < alpha && slope.isPresent() && slope.getAsDouble() != 0;
    }
}
