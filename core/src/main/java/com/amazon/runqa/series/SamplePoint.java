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

package com.amazon.runqa.series;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One measurement of a metric in one run. A NaN value stands for a missing
 * measurement; the point is kept so that windows stay aligned with run
 * positions.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SamplePoint {

    private final int run;

    private final double value;

    private final double statErr;

    private final double entries;

    public SamplePoint(int run, double value, double statErr, double entries) {
        this.run = run;
        this.value = value;
        this.statErr = statErr;
        this.entries = entries;
    }

    /**
     * @return true if the value is finite and the point carries positive weight
     */
    public boolean isMeasured() {
        return Double.isFinite(value) && entries > 0;
    }
}
