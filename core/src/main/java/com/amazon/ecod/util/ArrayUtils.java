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

package com.amazon.ecod.util;

import static com.amazon.ecod.CommonUtils.checkInput;

import java.util.Arrays;

import com.amazon.ecod.InvalidInputException;

/**
 * A utility class for data arrays.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    /**
     * Returns a clean deep copy of the point. Current clean-ups include changing
     * negative zero -0.0 to positive zero 0.0.
     *
     * @param point The original data point.
     * @return a clean deep copy of the original point.
     */
    public static double[] cleanCopy(double[] point) {
        double[] pointCopy = Arrays.copyOf(point, point.length);
        for (int i = 0; i < point.length; i++) {
            if (pointCopy[i] == 0.0) {
                pointCopy[i] = 0.0;
            }
        }
        return pointCopy;
    }

    /**
     * Returns a deep copy of a matrix; rows are copied, not shared.
     *
     * @param matrix the matrix to copy
     * @return a copy of the matrix
     */
    public static double[][] deepCopy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = Arrays.copyOf(matrix[i], matrix[i].length);
        }
        return copy;
    }

    /**
     * Extracts one column of a rectangular matrix.
     *
     * @param matrix the matrix
     * @param column the column index
     * @param negate if true every value is negated
     * @return the (possibly negated) column
     */
    public static double[] column(double[][] matrix, int column, boolean negate) {
        double[] values = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            values[i] = negate ? -matrix[i][column] : matrix[i][column];
        }
        return values;
    }

    /**
     * Validates that a data matrix is non-null, has at least {@code minRows} rows,
     * at least one column, equal row lengths and only finite entries.
     *
     * @param matrix  the matrix to validate
     * @param minRows the minimum number of rows
     * @return the number of columns
     * @throws InvalidInputException if any of the conditions fail
     */
    public static int checkMatrix(double[][] matrix, int minRows) {
        checkInput(matrix != null, "data matrix must not be null");
        if (matrix.length < minRows) {
            throw new InvalidInputException(
                    String.format("data matrix must have at least %d rows, found %d", minRows, matrix.length));
        }
        checkInput(matrix[0] != null, "row 0 must not be null");
        int columns = matrix[0].length;
        checkInput(columns > 0, "data matrix must have at least 1 column");
        for (int i = 0; i < matrix.length; i++) {
            double[] row = matrix[i];
            if (row == null) {
                throw new InvalidInputException(String.format("row %d must not be null", i));
            }
            if (row.length != columns) {
                throw new InvalidInputException(
                        String.format("row %d has %d columns, expected %d", i, row.length, columns));
            }
            for (int j = 0; j < columns; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new InvalidInputException(
                            String.format("non-finite value %s at row %d, column %d", row[j], i, j));
                }
            }
        }
        return columns;
    }
}
