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

import static com.amazon.runqa.CommonUtils.checkNotNull;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named group of metrics that tend to move together when one underlying
 * problem is present.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SymptomCluster {

    private final String name;

    private final List<String> metrics;

    public SymptomCluster(String name, List<String> metrics) {
        this.name = checkNotNull(name, "name must not be null");
        this.metrics = List.copyOf(checkNotNull(metrics, "metrics must not be null"));
    }
}
