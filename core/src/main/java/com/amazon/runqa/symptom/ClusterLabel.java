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

import java.util.Locale;

/**
 * Strength of the evidence that a cluster of symptoms is present in a run.
 */
public enum ClusterLabel {
    NONE, WEAK, MODERATE, STRONG;

    public static final int WEAK_SCORE = 1;

    public static final int MODERATE_SCORE = 3;

    public static final int STRONG_SCORE = 6;

    public static ClusterLabel fromScore(int score) {
        if (score >= STRONG_SCORE) {
            return STRONG;
        } else if (score >= MODERATE_SCORE) {
            return MODERATE;
        } else if (score >= WEAK_SCORE) {
            return WEAK;
        }
        return NONE;
    }

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
