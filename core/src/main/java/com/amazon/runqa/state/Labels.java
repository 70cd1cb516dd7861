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

package com.amazon.runqa.state;

import static com.amazon.runqa.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.amazon.runqa.classify.AnomalyPattern;
import com.amazon.runqa.classify.Severity;

/**
 * Label conversions shared by the rule mappers.
 */
final class Labels {

    private Labels() {
    }

    static List<String> ofPatterns(Collection<AnomalyPattern> patterns) {
        return patterns.stream().sorted().map(AnomalyPattern::getLabel).collect(Collectors.toList());
    }

    static Set<AnomalyPattern> toPatterns(List<String> labels) {
        Set<AnomalyPattern> patterns = EnumSet.noneOf(AnomalyPattern.class);
        for (String label : orEmpty(labels)) {
            Optional<AnomalyPattern> pattern = AnomalyPattern.fromLabel(label);
            checkArgument(pattern.isPresent(), "unknown pattern: " + label);
            patterns.add(pattern.get());
        }
        return patterns;
    }

    static List<String> ofSeverities(Collection<Severity> severities) {
        return severities.stream().sorted().map(Severity::getLabel).collect(Collectors.toList());
    }

    static Set<Severity> toSeverities(List<String> labels) {
        Set<Severity> severities = EnumSet.noneOf(Severity.class);
        for (String label : orEmpty(labels)) {
            try {
                severities.add(Severity.valueOf(label.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown severity: " + label, e);
            }
        }
        return severities;
    }

    static List<String> orEmpty(List<String> list) {
        return list == null ? new ArrayList<>() : list;
    }
}
