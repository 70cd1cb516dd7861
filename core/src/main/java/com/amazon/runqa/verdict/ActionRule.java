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

import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;

/**
 * Recommended action for a flagged point. Empty sets and lists match anything.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ActionRule {

    private final Set<Severity> severities;

    private final Set<AnomalyPattern> patterns;

    private final List<String> metricContains;

    private final String action;

    public ActionRule(Set<Severity> severities, Set<AnomalyPattern> patterns, List<String> metricContains,
            String action) {
        checkNotNull(severities, "severities must not be null");
        checkNotNull(patterns, "patterns must not be null");
        this.severities = severities.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(severities));
        this.patterns = patterns.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(patterns));
        this.metricContains = List.copyOf(checkNotNull(metricContains, "metric substrings must not be null"));
        this.action = checkNotNull(action, "action must not be null");
    }

    public boolean matches(String metric, AnomalyPattern pattern, Severity severity) {
        return (severities.isEmpty() || severities.contains(severity))
                && (patterns.isEmpty() || patterns.contains(pattern))
                && (metricContains.isEmpty() || metricContains.stream().anyMatch(metric::contains));
    }
}
