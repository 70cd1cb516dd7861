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

package com.amazon.runqa.classify;

import static com.amazon.runqa.CommonUtils.checkArgument;
import static com.amazon.runqa.CommonUtils.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.List;
import java.util.Optional;

import com.amazon.runqa.anomalydetection.RobustStats;
import com.amazon.runqa.trend.Changepoint;
import com.amazon.runqa.trend.TrendStats;

/**
 * Assigns an {@link AnomalyPattern} to a flagged point. The rules are tried in
 * a fixed order and the first one that applies wins:
 * <ol>
 * <li>a strong changepoint within {@code neighborhood} positions gives
 * {@code STEP_CHANGE}</li>
 * <li>|z| above {@code spikeZ} with no flagged neighbour gives
 * {@code SPIKE}</li>
 * <li>a significant nonzero slope with at least {@code minimumFlaggedNeighbors}
 * flagged neighbours gives {@code GRADUAL_DRIFT}</li>
 * <li>at least {@code minimumFlaggedNeighbors} flagged neighbours gives
 * {@code SUSTAINED_SHIFT}</li>
 * <li>|z| above {@code neighborZ} gives {@code ISOLATED_OUTLIER}</li>
 * <li>anything else is a {@code STATISTICAL_FLUCTUATION}</li>
 * </ol>
 * An undefined z-score counts as zero, for the point as well as for its
 * neighbours.
 */
public class PatternClassifier {

    public static final int DEFAULT_NEIGHBORHOOD = 2;

    public static final double DEFAULT_NEIGHBOR_Z = 2.0;

    public static final double DEFAULT_SPIKE_Z = 4.0;

    public static final double DEFAULT_TREND_ALPHA = 0.01;

    public static final int DEFAULT_MINIMUM_FLAGGED_NEIGHBORS = 2;

    private final int neighborhood;

    private final double neighborZ;

    private final double spikeZ;

    private final double trendAlpha;

    private final int minimumFlaggedNeighbors;

    public PatternClassifier() {
        this(DEFAULT_NEIGHBORHOOD, DEFAULT_NEIGHBOR_Z, DEFAULT_SPIKE_Z, DEFAULT_TREND_ALPHA,
                DEFAULT_MINIMUM_FLAGGED_NEIGHBORS);
    }

    public PatternClassifier(int neighborhood, double neighborZ, double spikeZ, double trendAlpha,
            int minimumFlaggedNeighbors) {
        checkArgument(neighborhood >= 1, "neighborhood must be at least 1");
        checkArgument(neighborZ > 0 && spikeZ > 0, "z cut-offs must be positive");
        checkArgument(trendAlpha > 0 && trendAlpha < 1, "alpha must be in (0,1)");
        checkArgument(minimumFlaggedNeighbors >= 1, "minimum flagged neighbors must be at least 1");
        this.neighborhood = neighborhood;
        this.neighborZ = neighborZ;
        this.spikeZ = spikeZ;
        this.trendAlpha = trendAlpha;
        this.minimumFlaggedNeighbors = minimumFlaggedNeighbors;
    }

    public AnomalyPattern classify(int index, List<RobustStats> robustStats, TrendStats trend) {
        checkNotNull(trend, "trend must not be null");
        double slope = trend.getSlope().orElse(0.0);
        return classify(index, robustStats, slope, trend.getPValue(), trend.getStrongChangepoint());
    }

    /**
     * @param index        position of the flagged point
     * @param robustStats  local statistics of every point of the series
     * @param slope        the trend slope, 0 when undefined
     * @param pValue       the p-value of the slope
     * @param changepoint  a strong changepoint, if any
     * @return the pattern of the point
     */
    public AnomalyPattern classify(int index, List<RobustStats> robustStats, double slope, double pValue,
            Optional<Changepoint> changepoint) {
        checkNotNull(robustStats, "robust statistics must not be null");
        checkArgument(index >= 0 && index < robustStats.size(), "index out of range");

        if (changepoint.isPresent() && Math.abs(changepoint.get().getIndex() - index) <= neighborhood) {
            return AnomalyPattern.STEP_CHANGE;
        }
        double z = absoluteZ(robustStats.get(index));
        int flaggedNeighbors = countFlaggedNeighbors(index, robustStats);
        if (z > spikeZ && flaggedNeighbors == 0) {
            return AnomalyPattern.SPIKE;
        }
        if (flaggedNeighbors >= minimumFlaggedNeighbors) {
            if (pValue < trendAlpha && slope != 0) {
                return AnomalyPattern.GRADUAL_DRIFT;
            }
            return AnomalyPattern.SUSTAINED_SHIFT;
        }
        if (z > neighborZ) {
            return AnomalyPattern.ISOLATED_OUTLIER;
        }
        return AnomalyPattern.STATISTICAL_FLUCTUATION;
    }

    int countFlaggedNeighbors(int index, List<RobustStats> robustStats) {
        int count = 0;
        for (int j = max(0, index - neighborhood); j <= min(robustStats.size() - 1, index + neighborhood); j++) {
            if (j != index && absoluteZ(robustStats.get(j)) > neighborZ) {
                ++count;
            }
        }
        return count;
    }

    static double absoluteZ(RobustStats stats) {
        return stats.hasZ() ? Math.abs(stats.getZLocal()) : 0.0;
    }
}
