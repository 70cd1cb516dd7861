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

import java.util.Locale;

import lombok.Getter;
import lombok.ToString;

/**
 * What a cause rule may look at besides the metric name and the pattern.
 */
@Getter
@ToString
public class CauseContext {

    private final double value;

    /**
     * the local robust z, 0 when undefined
     */
    private final double z;

    private final int deadCount;

    private final int hotCount;

    public CauseContext(double value, double z, int deadCount, int hotCount) {
        this.value = value;
        this.z = Double.isNaN(z) ? 0.0 : z;
        this.deadCount = deadCount;
        this.hotCount = hotCount;
    }

    /**
     * replaces {@code {dead}}, {@code {hot}}, {@code {value}} and {@code {z}} in
     * a cause template
     */
    public String render(String template) {
        return template.replace("{dead}", Integer.toString(deadCount))
                .replace("{hot}", Integer.toString(hotCount))
                .replace("{value}", String.format(Locale.ROOT, "%.3f", value))
                .replace("{z}", String.format(Locale.ROOT, "%.3f", z));
    }
}
