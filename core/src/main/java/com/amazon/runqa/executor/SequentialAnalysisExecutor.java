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

package com.amazon.runqa.executor;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An implementation of the analysis executor that handles the inputs one after
 * another in the calling thread.
 */
public class SequentialAnalysisExecutor extends AbstractAnalysisExecutor {

    @Override
    public <T, R> List<R> map(List<T> inputs, Function<T, R> analysis) {
        return inputs.stream().map(analysis).collect(Collectors.toList());
    }
}
