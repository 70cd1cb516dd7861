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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Dead and hot channel counts of one run, supplied by whoever monitors the
 * sensors. Used only as context for cause inference.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SensorHealth {

    private final int run;

    private final int deadCount;

    private final int hotCount;

    private final int totalChannels;

    public SensorHealth(int run, int deadCount, int hotCount, int totalChannels) {
        this.run = run;
        this.deadCount = deadCount;
        this.hotCount = hotCount;
        this.totalChannels = totalChannels;
    }
}
