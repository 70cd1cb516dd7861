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

package com.amazon.runqa.anomalydetection;

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;
import static com.amazon.runqa.statistics.RobustStatistics.MODIFIED_Z_SCALE;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.runqa.series.MetricSeries;
import com.amazon.runqa.series.SamplePoint;
import com.amazon.runqa.statistics.RobustStatistics;

/**
 * Sliding window outlier detector. Each point is compared against the median
 * and MAD of the measured points within {@code windowHalfWidth} positions on
 * either side of it, the point itself excluded. Positions, not run numbers,
 * define the window so missing measurements keep their slot.
 */
@Getter
public class RobustOutlierDetector {

    public static final int DEFAULT_WINDOW_HALF_WIDTH = 5;

    public static final int DEFAULT_MINIMUM_NEIGHBORS = 3;

    public static final double DEFAULT_EPSILON = 1e-6;

    public static final ZScoreConvention DEFAULT_CONVENTION = ZScoreConvention.LOCAL_MAD;

    private final int windowHalfWidth;

    private final int minimumNeighbors;

    private final double epsilon;

    private final double weakThreshold;

    private final double strongThreshold;

    public RobustOutlierDetector() {
        this(builder());
    }

    protected RobustOutlierDetector(Builder builder) {
        checkArgument(builder.windowHalfWidth >= 1, "window half width must be at least 1");
        checkArgument(builder.minimumNeighbors >= 1, "minimum neighbors must be at least 1");
        checkArgument(builder.epsilon > 0, "epsilon must be positive");
        windowHalfWidth = builder.windowHalfWidth;
        minimumNeighbors = builder.minimumNeighbors;
        epsilon = builder.epsilon;
        weakThreshold = builder.weakThreshold.orElse(builder.convention.getWeakThreshold());
        strongThreshold = builder.strongThreshold.orElse(builder.convention.getStrongThreshold());
        checkArgument(weakThreshold > 0 && weakThreshold < strongThreshold,
                "thresholds must satisfy 0 < weak < strong");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * computes the local robust statistics of every point of the series
     *
     * @param series the series
     * @return one entry per point, in the order of the series
     */
    public List<RobustStats> detect(MetricSeries series) {
        checkNotNull(series, "series must not be null");
        List<RobustStats> result = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            result.add(evaluate(series, i));
        }
        return Collections.unmodifiableList(result);
    }

    RobustStats evaluate(MetricSeries series, int index) {
        int lo = max(0, index - windowHalfWidth);
        int hi = min(series.size() - 1, index + windowHalfWidth);
        double[] buffer = new double[hi - lo + 1];
        int count = 0;
        for (int j = lo; j <= hi; j++) {
            SamplePoint neighbor = series.get(j);
            if (j != index && neighbor.isMeasured()) {
                buffer[count++] = neighbor.getValue();
            }
        }
        if (count < minimumNeighbors) {
            return RobustStats.UNDEFINED;
        }
        double[] neighbors = new double[count];
        System.arraycopy(buffer, 0, neighbors, 0, count);
        double median = RobustStatistics.median(neighbors);
        double mad = RobustStatistics.mad(neighbors, median);

        SamplePoint center = series.get(index);
        if (!center.isMeasured()) {
            return new RobustStats(median, mad, Double.NaN, false, false);
        }
        double deviation = center.getValue() - median;
        if (deviation == 0 && mad == 0) {
            // no spread and no departure from it carries no evidence either way
            return new RobustStats(median, mad, Double.NaN, false, false);
        }
        double z = MODIFIED_Z_SCALE * deviation / (mad + epsilon);
        double absZ = Math.abs(z);
        boolean strong = absZ >= strongThreshold;
        boolean weak = !strong && absZ >= weakThreshold;
        return new RobustStats(median, mad, z, weak, strong);
    }

    public static class Builder {

        private int windowHalfWidth = DEFAULT_WINDOW_HALF_WIDTH;
        private int minimumNeighbors = DEFAULT_MINIMUM_NEIGHBORS;
        private double epsilon = DEFAULT_EPSILON;
        private ZScoreConvention convention = DEFAULT_CONVENTION;
        private Optional<Double> weakThreshold = Optional.empty();
        private Optional<Double> strongThreshold = Optional.empty();

        public Builder windowHalfWidth(int windowHalfWidth) {
            this.windowHalfWidth = windowHalfWidth;
            return this;
        }

        public Builder minimumNeighbors(int minimumNeighbors) {
            this.minimumNeighbors = minimumNeighbors;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder convention(ZScoreConvention convention) {
            this.convention = checkNotNull(convention, "convention must not be null");
            return this;
        }

        /**
         * overrides the thresholds of the convention
         */
        public Builder thresholds(double weak, double strong) {
            this.weakThreshold = Optional.of(weak);
            this.strongThreshold = Optional.of(strong);
            return this;
        }

        public RobustOutlierDetector build() {
            return new RobustOutlierDetector(this);
        }
    }
}
