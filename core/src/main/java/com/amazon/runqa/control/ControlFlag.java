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

package com.amazon.runqa.control;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Control chart state after one point. {@code zRobust} is NaN for a point that
 * was not measured or when the chart had too few points to be set up.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ControlFlag {

    private final int run;

    private final double zRobust;

    private final boolean shewhartOutOfControl;

    private final double cusumPos;

    private final double cusumNeg;

    private final boolean cusumOutOfControl;

    private final ControlStatus status;

    public ControlFlag(int run, double zRobust, boolean shewhartOutOfControl, double cusumPos, double cusumNeg,
            boolean cusumOutOfControl) {
        this.run = run;
        this.zRobust = zRobust;
        this.shewhartOutOfControl = shewhartOutOfControl;
        this.cusumPos = cusumPos;
        this.cusumNeg = cusumNeg;
        this.cusumOutOfControl = cusumOutOfControl;
        this.status = (shewhartOutOfControl || cusumOutOfControl) ? ControlStatus.WARN : ControlStatus.PASS;
    }

    static ControlFlag pass(int run, double cusumPos, double cusumNeg) {
        return new ControlFlag(run, Double.NaN, false, cusumPos, cusumNeg, false);
    }
}
