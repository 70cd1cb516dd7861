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

package com.amazon.runqa.symptom;

import static com.amazon.runqa.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Cut-offs on |z| for the mild, moderate and severe symptom levels, all
 * inclusive.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SeverityThresholds {

    public static final SeverityThresholds DEFAULT = new SeverityThresholds(1.0, 2.0, 3.0);

    private final double mild;

    private final double moderate;

    private final double severe;

    public SeverityThresholds(double mild, double moderate, double severe) {
        checkArgument(0 < mild && mild <= moderate && moderate <= severe, "thresholds must be increasing");
        this.mild = mild;
        this.moderate = moderate;
        this.severe = severe;
    }

    public SymptomLevel classify(double z) {
        double a = Math.abs(z);
        if (a >= severe) {
            return SymptomLevel.SEVERE;
        } else if (a >= moderate) {
            return SymptomLevel.MODERATE;
        } else if (a >= mild) {
            return SymptomLevel.MILD;
        }
        return SymptomLevel.NORMAL;
    }
}
