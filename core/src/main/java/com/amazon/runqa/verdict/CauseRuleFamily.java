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

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.runqa.classify.AnomalyPattern;

/**
 * The cause rules of a group of metrics. A metric belongs to the family when its
 * name contains one of {@code anyOf} (or {@code anyOf} is empty) and all of
 * {@code allOf}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CauseRuleFamily {

    private final String name;

    private final List<String> anyOf;

    private final List<String> allOf;

    private final List<CauseRule> rules;

    public CauseRuleFamily(String name, List<String> anyOf, List<String> allOf, List<CauseRule> rules) {
        this.name = checkNotNull(name, "name must not be null");
        this.anyOf = List.copyOf(checkNotNull(anyOf, "anyOf must not be null"));
        this.allOf = List.copyOf(checkNotNull(allOf, "allOf must not be null"));
        this.rules = List.copyOf(checkNotNull(rules, "rules must not be null"));
    }

    public boolean appliesTo(String metric) {
        return (anyOf.isEmpty() || anyOf.stream().anyMatch(metric::contains)) && allOf.stream().allMatch(metric::contains);
    }

    /**
     * @return the rendered causes of the matching rules, possibly empty
     */
    public List<String> infer(AnomalyPattern pattern, CauseContext context) {
        List<String> causes = new ArrayList<>();
        for (CauseRule rule : rules) {
            if (rule.matches(pattern, context)) {
                rule.getCauses().forEach(c -> causes.add(context.render(c)));
                if (!rule.isContinueMatching()) {
                    break;
                }
            }
        }
        return causes;
    }
}
