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

package com.amazon.ecod.executor;

import static com.amazon.ecod.CommonUtils.checkArgument;

import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;
import java.util.stream.IntStream;

/**
 * An implementation of the scoring operations that uses a private thread pool
 * to process rows in parallel. Results are collected in row order, so they are
 * identical to those of {@link SequentialScoringExecutor}.
 */
public class ParallelScoringExecutor extends AbstractScoringExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelScoringExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    protected double[][] mapRows(int numberOfRows, IntFunction<double[]> rowFunction) {
        return submitAndJoin(
                () -> IntStream.range(0, numberOfRows).parallel().mapToObj(rowFunction).toArray(double[][]::new));
    }

    @Override
    protected double[] mapRowsToDouble(int numberOfRows, IntToDoubleFunction rowFunction) {
        return submitAndJoin(() -> IntStream.range(0, numberOfRows).parallel().mapToDouble(rowFunction).toArray());
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
