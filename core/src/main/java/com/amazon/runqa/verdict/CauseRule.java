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

/**
 * One line of a cause family: when the pattern is one of {@code patterns} (any
 * pattern if empty) and the condition holds, the causes are appended. Matching
 * stops after this rule unless {@code continueMatching} is set.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CauseRule {

    private final Set<AnomalyPattern> patterns;

    private final RuleCondition condition;

    private final List<String> causes;

    private final boolean continueMatching;

    public CauseRule(Set<AnomalyPattern> patterns, RuleCondition condition, List<String> causes,
            boolean continueMatching) {
        checkNotNull(patterns, "patterns must not be null");
        this.patterns = patterns.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(patterns));
        this.condition = checkNotNull(condition, "condition must not be null");
        this.causes = List.copyOf(checkNotNull(causes, "causes must not be null"));
        this.continueMatching = continueMatching;
    }

    public static CauseRule always(String... causes) {
        return new CauseRule(Collections.emptySet(), RuleCondition.ALWAYS, List.of(causes), false);
    }

    public static CauseRule forPatterns(Set<AnomalyPattern> patterns, String... causes) {
        return new CauseRule(patterns, RuleCondition.ALWAYS, List.of(causes), false);
    }

    public static CauseRule when(RuleCondition condition, String... causes) {
        return new CauseRule(Collections.emptySet(), condition, List.of(causes), false);
    }

    public CauseRule thenContinue() {
        return new CauseRule(patterns, condition, causes, true);
    }

    public boolean matches(AnomalyPattern pattern, CauseContext context) {
        return (patterns.isEmpty() || patterns.contains(pattern)) && condition.matches(context);
    }
}
