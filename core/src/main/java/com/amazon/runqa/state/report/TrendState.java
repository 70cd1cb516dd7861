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

package com.amazon.runqa.state.report;

import java.io.Serializable;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class TrendState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String metric;
    private int measuredCount;
    private Double median;
    private Double robustSigma;
    private Double slope;
    private Double slopeError;
    private double slopePValue;
    private Integer changepointRun;
    private Double changepointDeltaBic;
    private Boolean changepointStrong;
}
