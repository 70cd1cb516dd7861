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

import static com.amazon.runqa.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An implementation of the analysis executor that uses a private thread pool
 * to analyze inputs in parallel.
 */
public class ParallelAnalysisExecutor extends AbstractAnalysisExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelAnalysisExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <T, R> List<R> map(List<T> inputs, Function<T, R> analysis) {
        // an ordered stream keeps the encounter order when collected
        return submitAndJoin(() -> inputs.parallelStream().map(analysis).collect(Collectors.toList()));
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
