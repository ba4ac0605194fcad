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

package com.amazon.ecod.testutils;

import java.util.Random;

public class ExampleDataSets {

    /**
     * @return the single-feature rows {@code [[0], [1], ..., [size - 1]]}
     */
    public static double[][] generateSequence(int size) {
        double[][] data = new double[size][1];
        for (int i = 0; i < size; i++) {
            data[i][0] = i;
        }
        return data;
    }

    /**
     * Uniform rows in {@code [0, 1)} where one column holds the same value in
     * every row.
     */
    public static double[][] generateWithConstantFeature(int size, int dimensions, int constantColumn,
            double constantValue, long seed) {
        Random prg = new Random(seed);
        double[][] data = new double[size][dimensions];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < dimensions; j++) {
                data[i][j] = (j == constantColumn) ? constantValue : prg.nextDouble();
            }
        }
        return data;
    }
}
