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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Local robust statistics of one point. NaN marks a quantity that could not be
 * defined; the flags are then false.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RobustStats {

    public static final RobustStats UNDEFINED = new RobustStats(Double.NaN, Double.NaN, Double.NaN, false, false);

    private final double neighborsMedian;

    private final double neighborsMad;

    private final double zLocal;

    private final boolean weak;

    private final boolean strong;

    public RobustStats(double neighborsMedian, double neighborsMad, double zLocal, boolean weak, boolean strong) {
        this.neighborsMedian = neighborsMedian;
        this.neighborsMad = neighborsMad;
        this.zLocal = zLocal;
        this.weak = weak;
        this.strong = strong;
    }

    public boolean isFlagged() {
        return weak || strong;
    }

    public boolean hasZ() {
        return !Double.isNaN(zLocal);
    }
}
