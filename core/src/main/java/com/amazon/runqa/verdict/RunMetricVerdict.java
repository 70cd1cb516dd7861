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

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;

/**
 * The verdict on one metric in one run. {@code measured} is false when the run
 * had no usable measurement of the metric; such a point is GOOD because
 * nothing can be flagged, and the flag lets reports tell it apart from a point
 * that passed every check.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RunMetricVerdict {

    public static final String ALL_CHECKS_PASSED = "All checks passed";

    public static final String NO_ACTION = "No action needed";

    private final int run;

    private final String metric;

    private final Verdict verdict;

    private final Severity severity;

    private final AnomalyPattern pattern;

    private final List<String> causes;

    private final String action;

    private final double zLocal;

    private final double value;

    private final boolean measured;

    public RunMetricVerdict(int run, String metric, Verdict verdict, Severity severity, AnomalyPattern pattern,
            List<String> causes, String action, double zLocal, double value, boolean measured) {
        this.run = run;
        this.metric = metric;
        this.verdict = verdict;
        this.severity = severity;
        this.pattern = pattern;
        this.causes = List.copyOf(causes);
        this.action = action;
        this.zLocal = zLocal;
        this.value = value;
        this.measured = measured;
    }

    static RunMetricVerdict good(int run, String metric, double zLocal, double value, boolean measured) {
        return new RunMetricVerdict(run, metric, Verdict.GOOD, Severity.INFO, AnomalyPattern.NORMAL,
                List.of(ALL_CHECKS_PASSED), NO_ACTION, zLocal, value, measured);
    }
}
