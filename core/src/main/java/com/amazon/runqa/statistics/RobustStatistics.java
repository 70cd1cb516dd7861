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

package com.amazon.runqa.statistics;

import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Order statistics that are insensitive to the outliers they are used to find.
 * All methods copy their input; the arrays passed in are never reordered.
 */
public class RobustStatistics {

    /**
     * scale that turns a MAD into a consistent estimate of the standard deviation
     * of a normal distribution
     */
    public static final double MAD_TO_SIGMA = 1.4826;

    /**
     * the reciprocal of MAD_TO_SIGMA as used in the modified z-score of Iglewicz
     * and Hoaglin
     */
    public static final double MODIFIED_Z_SCALE = 0.6745;

    private RobustStatistics() {
    }

    /**
     * @param values the values, all assumed finite
     * @return the median, the mean of the two central values for an even count,
     *         NaN for an empty array
     */
    public static double median(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int n = sorted.length;
        return (n % 2 == 1) ? sorted[n / 2] : 0.5 * (sorted[n / 2 - 1] + sorted[n / 2]);
    }

    /**
     * median absolute deviation around a given center
     *
     * @param values the values, all assumed finite
     * @param center the center, typically the median of the same values
     * @return the MAD, NaN for an empty array
     */
    public static double mad(double[] values, double center) {
        checkNotNull(values, "values must not be null");
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    public static double mad(double[] values) {
        return mad(values, median(values));
    }

    /**
     * @param values the values, all assumed finite
     * @return 1.4826 * MAD, NaN for an empty array
     */
    public static double robustSigma(double[] values) {
        return MAD_TO_SIGMA * mad(values);
    }

    /**
     * @param values any values
     * @return the finite values in their original order
     */
    public static double[] finite(double[] values) {
        checkNotNull(values, "values must not be null");
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }
}
