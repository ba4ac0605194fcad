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

import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;
import java.util.stream.IntStream;

/**
 * Scores the rows of a matrix sequentially on the calling thread.
 */
public class SequentialScoringExecutor extends AbstractScoringExecutor {

    @Override
    protected double[][] mapRows(int numberOfRows, IntFunction<double[]> rowFunction) {
        return IntStream.range(0, numberOfRows).mapToObj(rowFunction).toArray(double[][]::new);
    }

    @Override
    protected double[] mapRowsToDouble(int numberOfRows, IntToDoubleFunction rowFunction) {
        return IntStream.range(0, numberOfRows).mapToDouble(rowFunction).toArray();
    }
}
