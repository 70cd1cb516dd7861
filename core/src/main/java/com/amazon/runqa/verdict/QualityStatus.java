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

import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of the threshold and global robust checks for one point. The reasons
 * are {@code threshold} and/or {@code robust_z}, in that order.
 */
@Getter
@ToString
@EqualsAndHashCode
public class QualityStatus {

    public static final String THRESHOLD = "threshold";

    public static final String ROBUST_Z = "robust_z";

    private final int run;

    private final double value;

    private final CheckStatus status;

    private final List<String> reasons;

    public QualityStatus(int run, double value, CheckStatus status, List<String> reasons) {
        this.run = run;
        this.value = value;
        this.status = status;
        this.reasons = Collections.unmodifiableList(reasons);
    }

    public String getReason() {
        return String.join("+", reasons);
    }
}
