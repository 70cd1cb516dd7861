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

import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class RunVerdict {

    private final int run;

    private final Verdict verdict;

    private final int nGood;

    private final int nSuspect;

    private final int nBad;

    private final Optional<String> worstMetric;

    public RunVerdict(int run, int nGood, int nSuspect, int nBad, Optional<String> worstMetric) {
        this.run = run;
        this.nGood = nGood;
        this.nSuspect = nSuspect;
        this.nBad = nBad;
        this.worstMetric = worstMetric;
        if (nBad > 0) {
            verdict = Verdict.BAD;
        } else if (nSuspect > 0) {
            verdict = Verdict.SUSPECT;
        } else {
            verdict = Verdict.GOOD;
        }
    }

    /**
     * @return a line such as {@code 3 good, 1 suspect, 0 bad (worst: adc_peak)}
     */
    public String getSummary() {
        StringBuilder builder = new StringBuilder();
        builder.append(nGood).append(" good, ").append(nSuspect).append(" suspect, ").append(nBad).append(" bad");
        worstMetric.ifPresent(m -> builder.append(" (worst: ").append(m).append(")"));
        return builder.toString();
    }
}
