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

package com.amazon.anomalyscore.executor;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.amazon.anomalyscore.returntypes.AnomalyResult;

/**
 * Scores rows in parallel on a private thread pool. The ordered stream keeps
 * the results in row order.
 */
public class ParallelRowScoringExecutor extends RowScoringExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelRowScoringExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "thread pool size should be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    public List<AnomalyResult> scoreRows(int rowCount, IntFunction<AnomalyResult> rowScorer) {
        return submitAndJoin(
                () -> IntStream.range(0, rowCount).parallel().mapToObj(rowScorer).collect(Collectors.toList()));
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return getForkJoinPool().submit(callable).join();
    }

    private synchronized ForkJoinPool getForkJoinPool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }
}
