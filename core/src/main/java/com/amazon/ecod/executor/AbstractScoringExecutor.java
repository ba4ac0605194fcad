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

import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;

import com.amazon.ecod.cdf.EmpiricalCDF;
import com.amazon.ecod.cdf.Tail;
import com.amazon.ecod.scoring.ScoreAggregator;
import com.amazon.ecod.scoring.TailScorer;

/**
 * Batched numeric operations of the scoring pipeline. Every operation works on
 * whole matrices and is independent across rows; subclasses only decide how
 * the rows are scheduled.
 */
public abstract class AbstractScoringExecutor {

    /**
     * Evaluates one tail of every feature for every row of a matrix.
     *
     * @param references one reference distribution per feature, built for the
     *                   given tail
     * @param points     query matrix with {@code references.length} columns
     * @param tail       the tail the references were built for
     * @return {@code result[i][f] = references[f].probability(tail.orient(points[i][f]))}
     */
    public double[][] tailProbabilities(EmpiricalCDF[] references, double[][] points, Tail tail) {
        return mapRows(points.length, i -> {
            double[] point = points[i];
            checkArgument(point.length == references.length, "incorrect dimensions");
            double[] probabilities = new double[point.length];
            for (int f = 0; f < point.length; f++) {
                probabilities[f] = references[f].probability(tail.orient(point[f]));
            }
            return probabilities;
        });
    }

    /**
     * @param leftProbabilities  left-tail probability matrix
     * @param rightProbabilities right-tail probability matrix of the same shape
     * @return the per-feature extremity matrix
     */
    public double[][] extremities(double[][] leftProbabilities, double[][] rightProbabilities) {
        checkArgument(leftProbabilities.length == rightProbabilities.length, "row counts differ");
        return mapRows(leftProbabilities.length,
                i -> TailScorer.extremities(leftProbabilities[i], rightProbabilities[i]));
    }

    /**
     * @param extremities per-feature extremity matrix
     * @return one aggregate score per row
     */
    public double[] aggregate(double[][] extremities) {
        return mapRowsToDouble(extremities.length, i -> ScoreAggregator.aggregate(extremities[i]));
    }

    /**
     * Applies a function to every row index and collects the results in row order.
     *
     * @param numberOfRows number of rows
     * @param rowFunction  function from row index to row result
     * @return the row results
     */
    protected abstract double[][] mapRows(int numberOfRows, IntFunction<double[]> rowFunction);

    /**
     * Applies a function to every row index and collects the scalar results in row
     * order.
     *
     * @param numberOfRows number of rows
     * @param rowFunction  function from row index to row result
     * @return the row results
     */
    protected abstract double[] mapRowsToDouble(int numberOfRows, IntToDoubleFunction rowFunction);
}
