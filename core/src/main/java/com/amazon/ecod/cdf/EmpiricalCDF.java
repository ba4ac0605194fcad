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

package com.amazon.ecod.cdf;

import static com.amazon.ecod.CommonUtils.checkArgument;
import static com.amazon.ecod.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.ecod.util.ArrayUtils;

/**
 * An empirical cumulative distribution function over a frozen reference sample
 * of one feature. The reference is copied and sorted on construction and never
 * changes afterwards, so instances can be shared between threads.
 *
 * <p>
 * {@link #probability(double)} returns {@code |{r in R : r <= x}| / n}. The
 * count is floored at one, so a query strictly below the smallest reference
 * value yields {@code 1 / n} instead of zero and the negative log of the result
 * is always finite. A constant reference has probability 1 everywhere, so a
 * constant feature never contributes to an anomaly score.
 */
public class EmpiricalCDF {

    private final double[] sortedReference;

    private final boolean constant;

    /**
     * Creates a distribution from a reference sample. The array is not retained.
     *
     * @param reference one feature's reference values, at least one
     */
    public EmpiricalCDF(double[] reference) {
        checkNotNull(reference, "reference must not be null");
        checkArgument(reference.length > 0, "reference must contain at least one value");
        sortedReference = ArrayUtils.cleanCopy(reference);
        Arrays.sort(sortedReference);
        constant = sortedReference[0] == sortedReference[sortedReference.length - 1];
    }

    /**
     * Creates the distribution for one tail of a feature.
     *
     * @param column the raw training column
     * @param tail   the tail; for {@link Tail#RIGHT} the column is negated
     * @return the reference distribution for the tail
     */
    public static EmpiricalCDF forTail(double[] column, Tail tail) {
        double[] oriented = new double[column.length];
        for (int i = 0; i < column.length; i++) {
            oriented[i] = tail.orient(column[i]);
        }
        return new EmpiricalCDF(oriented);
    }

    /**
     * Restores a distribution from values that are already sorted, as produced by
     * {@link #getSortedReference()}.
     *
     * @param sortedReference sorted reference values
     * @return the distribution
     */
    public static EmpiricalCDF fromSorted(double[] sortedReference) {
        checkNotNull(sortedReference, "reference must not be null");
        for (int i = 1; i < sortedReference.length; i++) {
            checkArgument(sortedReference[i - 1] <= sortedReference[i], "reference values must be sorted");
        }
        return new EmpiricalCDF(sortedReference);
    }

    /**
     * @param value the query value
     * @return the fraction of reference values less than or equal to the value,
     *         never smaller than {@code 1 / n}
     */
    public double probability(double value) {
        if (constant) {
            return 1.0;
        }
        int count = countAtMost(value);
        return Math.max(count, 1) / (double) sortedReference.length;
    }

    /**
     * Batched evaluation of {@link #probability(double)}.
     *
     * @param values query values
     * @return one probability per query value, in the same order
     */
    public double[] probabilities(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = probability(values[i]);
        }
        return result;
    }

    public boolean isConstant() {
        return constant;
    }

    public int size() {
        return sortedReference.length;
    }

    /**
     * @return a copy of the sorted reference values
     */
    public double[] getSortedReference() {
        return Arrays.copyOf(sortedReference, sortedReference.length);
    }

    /**
     * The number of reference values {@code <= value}; the first index whose
     * value is strictly greater, found by binary search.
     */
    int countAtMost(double value) {
        int low = 0;
        int high = sortedReference.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sortedReference[mid] <= value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
