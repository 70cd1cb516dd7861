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

package com.amazon.runqa.verdict;

import static com.amazon.runqa.CommonUtils.checkArgument;

import java.util.OptionalDouble;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Acceptance range of a metric. A missing side is unbounded.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ThresholdBounds {

    private final OptionalDouble lo;

    private final OptionalDouble hi;

    public ThresholdBounds(OptionalDouble lo, OptionalDouble hi) {
        checkArgument(lo.isEmpty() || hi.isEmpty() || lo.getAsDouble() <= hi.getAsDouble(),
                "lower bound exceeds upper bound");
        this.lo = lo;
        this.hi = hi;
    }

    public static ThresholdBounds of(double lo, double hi) {
        return new ThresholdBounds(OptionalDouble.of(lo), OptionalDouble.of(hi));
    }

    public static ThresholdBounds atLeast(double lo) {
        return new ThresholdBounds(OptionalDouble.of(lo), OptionalDouble.empty());
    }

    public static ThresholdBounds atMost(double hi) {
        return new ThresholdBounds(OptionalDouble.empty(), OptionalDouble.of(hi));
    }

    public boolean contains(double value) {
        if (lo.isPresent() && value < lo.getAsDouble()) {
            return false;
        }
        return hi.isEmpty() || value <= hi.getAsDouble();
    }
}
