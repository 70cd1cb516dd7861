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

/**
 * The two weak/strong threshold pairs in use for the local robust z-score. They
 * disagree and the choice between them is still open, so neither is merged
 * into the other.
 */
public enum ZScoreConvention {

    /**
     * weak at |z| &gt;= 2, strong at |z| &gt;= 3; the pair the local robust z
     * stage applies
     */
    LOCAL_MAD(2.0, 3.0),

    /**
     * weak at |z| &gt;= 3, strong at |z| &gt;= 5; the pair quoted in the pipeline
     * level documentation
     */
    PIPELINE_DOCUMENTED(3.0, 5.0);

    private final double weakThreshold;

    private final double strongThreshold;

    ZScoreConvention(double weakThreshold, double strongThreshold) {
        this.weakThreshold = weakThreshold;
        this.strongThreshold = strongThreshold;
    }

    public double getWeakThreshold() {
        return weakThreshold;
    }

    public double getStrongThreshold() {
        return strongThreshold;
    }
}
