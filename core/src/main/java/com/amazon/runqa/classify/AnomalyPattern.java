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

import java.util.Arrays;
import java.util.Optional;

/**
 * The shape of an anomaly, as seen from one flagged point and its surroundings.
 */
public enum AnomalyPattern {

    /** a level shift close to the point */
    STEP_CHANGE("step_change", Severity.WARNING),
    /** a large excursion with quiet neighbours */
    SPIKE("spike", Severity.CRITICAL),
    /** flagged neighbours on top of a significant slope */
    GRADUAL_DRIFT("gradual_drift", Severity.WARNING),
    /** flagged neighbours without a significant slope */
    SUSTAINED_SHIFT("sustained_shift", Severity.CRITICAL),
    ISOLATED_OUTLIER("isolated_outlier", Severity.INFO),
    STATISTICAL_FLUCTUATION("statistical_fluctuation", Severity.INFO),
    NORMAL("normal", Severity.INFO);

    private final String label;

    private final Severity severity;

    AnomalyPattern(String label, Severity severity) {
        this.label = label;
        this.severity = severity;
    }

    public String getLabel() {
        return label;
    }

    public Severity getSeverity() {
        return severity;
    }

    public static Optional<AnomalyPattern> fromLabel(String label) {
        return Arrays.stream(values()).filter(p -> p.label.equalsIgnoreCase(label) || p.name().equalsIgnoreCase(label))
                .findFirst();
    }
}
