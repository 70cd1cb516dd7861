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

import java.util.OptionalDouble;
import java.util.OptionalInt;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A conjunction of numeric bounds on a {@link CauseContext}. Unset bounds are
 * ignored, so the empty condition matches everything. "Above" and "below" are
 * strict, "at most" is inclusive.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RuleCondition {

    public static final RuleCondition ALWAYS = builder().build();

    private final OptionalDouble valueAbove;
    private final OptionalDouble valueBelow;
    private final OptionalDouble valueAtMost;
    private final OptionalDouble zAbove;
    private final OptionalDouble zAtMost;
    private final OptionalInt deadAbove;
    private final OptionalInt deadAtMost;
    private final OptionalInt hotAbove;
    private final OptionalInt hotAtMost;

    protected RuleCondition(Builder builder) {
        valueAbove = builder.valueAbove;
        valueBelow = builder.valueBelow;
        valueAtMost = builder.valueAtMost;
        zAbove = builder.zAbove;
        zAtMost = builder.zAtMost;
        deadAbove = builder.deadAbove;
        deadAtMost = builder.deadAtMost;
        hotAbove = builder.hotAbove;
        hotAtMost = builder.hotAtMost;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(CauseContext context) {
        double value = context.getValue();
        double z = context.getZ();
        return (valueAbove.isEmpty() || value > valueAbove.getAsDouble())
                && (valueBelow.isEmpty() || value < valueBelow.getAsDouble())
                && (valueAtMost.isEmpty() || value <= valueAtMost.getAsDouble())
                && (zAbove.isEmpty() || z > zAbove.getAsDouble())
                && (zAtMost.isEmpty() || z <= zAtMost.getAsDouble())
                && (deadAbove.isEmpty() || context.getDeadCount() > deadAbove.getAsInt())
                && (deadAtMost.isEmpty() || context.getDeadCount() <= deadAtMost.getAsInt())
                && (hotAbove.isEmpty() || context.getHotCount() > hotAbove.getAsInt())
                && (hotAtMost.isEmpty() || context.getHotCount() <= hotAtMost.getAsInt());
    }

    public boolean isAlways() {
        return this.equals(ALWAYS);
    }

    public static class Builder {

        private OptionalDouble valueAbove = OptionalDouble.empty();
        private OptionalDouble valueBelow = OptionalDouble.empty();
        private OptionalDouble valueAtMost = OptionalDouble.empty();
        private OptionalDouble zAbove = OptionalDouble.empty();
        private OptionalDouble zAtMost = OptionalDouble.empty();
        private OptionalInt deadAbove = OptionalInt.empty();
        private OptionalInt deadAtMost = OptionalInt.empty();
        private OptionalInt hotAbove = OptionalInt.empty();
        private OptionalInt hotAtMost = OptionalInt.empty();

        public Builder valueAbove(double bound) {
            valueAbove = OptionalDouble.of(bound);
            return this;
        }

        public Builder valueBelow(double bound) {
            valueBelow = OptionalDouble.of(bound);
            return this;
        }

        public Builder valueAtMost(double bound) {
            valueAtMost = OptionalDouble.of(bound);
            return this;
        }

        public Builder zAbove(double bound) {
            zAbove = OptionalDouble.of(bound);
            return this;
        }

        public Builder zAtMost(double bound) {
            zAtMost = OptionalDouble.of(bound);
            return this;
        }

        public Builder deadAbove(int bound) {
            deadAbove = OptionalInt.of(bound);
            return this;
        }

        public Builder deadAtMost(int bound) {
            deadAtMost = OptionalInt.of(bound);
            return this;
        }

        public Builder hotAbove(int bound) {
            hotAbove = OptionalInt.of(bound);
            return this;
        }

        public Builder hotAtMost(int bound) {
            hotAtMost = OptionalInt.of(bound);
            return this;
        }

        public RuleCondition build() {
            return new RuleCondition(this);
        }
    }
}
