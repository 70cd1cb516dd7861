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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The best single level shift of a series. {@code index} is the position of
 * the first point after the shift within the full series and {@code run} is
 * the run of that point.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Changepoint {

    public static final double DEFAULT_STRONG_EVIDENCE = 10.0;

    private final int index;

    private final int run;

    /**
     * BIC of the one-mean model minus BIC of the best two-mean split
     */
    private final double deltaBic;

    /**
     * BIC of the straight line model minus BIC of the best two-mean split
     */
    private final double deltaBicVersusTrend;

    private final boolean strong;

    public Changepoint(int index, int run, double deltaBic, double deltaBicVersusTrend, boolean strong) {
        this.index = index;
        this.run = run;
        this.deltaBic = deltaBic;
        this.deltaBicVersusTrend = deltaBicVersusTrend;
        this.strong = strong;
    }
}
