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
import static java.lang.Math.max;
import static java.lang.Math.sqrt;

import java.util.OptionalDouble;

import org.apache.commons.math3.special.Erf;

import lombok.Getter;

/**
 * Weighted least squares fit of a straight line y = a + b x, with a two sided
 * significance test of the slope based on the normal approximation.
 */
@Getter
public class WeightedLinearFit {

    private static final WeightedLinearFit DEGENERATE = new WeightedLinearFit(OptionalDouble.empty(),
            OptionalDouble.empty(), OptionalDouble.empty(), 1.0, Double.NaN);

    private final OptionalDouble intercept;

    private final OptionalDouble slope;

    private final OptionalDouble slopeError;

    private final double pValue;

    /**
     * weighted sum of squared residuals, NaN for a degenerate fit
     */
    private final double weightedSse;

    WeightedLinearFit(OptionalDouble intercept, OptionalDouble slope, OptionalDouble slopeError, double pValue,
            double weightedSse) {
        this.intercept = intercept;
        this.slope = slope;
        this.slopeError = slopeError;
        this.pValue = pValue;
        this.weightedSse = weightedSse;
    }

    public boolean isDegenerate() {
        return slope.isEmpty();
    }

    /**
     * fits the line
     *
     * @param x       the abscissae
     * @param y       the ordinates, all finite
     * @param weights the weights, all positive
     * @return the fit; degenerate (no slope, p = 1) when the abscissae do not
     *         determine a line
     */
    public static WeightedLinearFit fit(double[] x, double[] y, double[] weights) {
        checkNotNull(x, "x must not be null");
        checkNotNull(y, "y must not be null");
        checkNotNull(weights, "weights must not be null");
        checkArgument(x.length == y.length && y.length == weights.length, "incorrect lengths");
        int n = x.length;
        if (n < 2) {
            return DEGENERATE;
        }
        double sw = 0;
        double sx = 0;
        double sy = 0;
        double sxx = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            double w = weights[i];
            sw += w;
            sx += w * x[i];
            sy += w * y[i];
            sxx += w * x[i] * x[i];
            sxy += w * x[i] * y[i];
        }
        double denominator = sw * sxx - sx * sx;
        if (!(denominator > 0)) {
            return DEGENERATE;
        }
        double b = (sw * sxy - sx * sy) / denominator;
        double a = (sy - b * sx) / sw;
        double rss = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (a + b * x[i]);
            rss += weights[i] * residual * residual;
        }
        double dof = max(1.0, n - 2.0);
        double varianceB = (rss / dof) * sw / denominator;
        double eb = sqrt(max(0.0, varianceB));
        double p;
        if (eb > 0) {
            p = Erf.erfc(Math.abs(b / eb) / sqrt(2.0));
        } else {
            // an exact fit: any nonzero slope is certain
            p = (b != 0) ? 0.0 : 1.0;
        }
        return new WeightedLinearFit(OptionalDouble.of(a), OptionalDouble.of(b), OptionalDouble.of(eb), p, rss);
    }
}
