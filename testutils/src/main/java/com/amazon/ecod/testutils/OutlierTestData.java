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

import java.util.Arrays;
import java.util.Random;

/**
 * This class samples points from a multi-variate normal distribution with
 * covariance matrix of the form sigma * I and plants a number of outliers among
 * them. An outlier row has every feature shifted by {@code anomalyShift}
 * standard deviations, in a random direction per feature, away from the base
 * mean.
 */
public class OutlierTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyShift;

    public OutlierTestData(double baseMu, double baseSigma, double anomalyShift) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyShift = anomalyShift;
    }

    public OutlierTestData() {
        this(0.0, 1.0, 8.0);
    }

    /**
     * @return inlier rows only
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        for (double[] row : result) {
            fillRow(row, dist, baseMu, baseSigma);
        }
        return result;
    }

    /**
     * @return rows with {@code numberOfOutliers} planted outliers; the keys are the
     *         sorted outlier row indices
     */
    public MultiDimDataWithKey generateTestDataWithKey(int numberOfRows, int numberOfColumns, int numberOfOutliers,
            long seed) {
        if (numberOfOutliers > numberOfRows) {
            throw new IllegalArgumentException("more outliers than rows");
        }
        Random rng = new Random(seed);
        double[][] data = generateTestData(numberOfRows, numberOfColumns, rng.nextLong());

        // partial Fisher-Yates shuffle picks distinct rows
        int[] indices = new int[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < numberOfOutliers; i++) {
            int j = i + rng.nextInt(numberOfRows - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] outliers = Arrays.copyOf(indices, numberOfOutliers);
        Arrays.sort(outliers);

        NormalDistribution noise = new NormalDistribution(rng);
        for (int index : outliers) {
            for (int j = 0; j < numberOfColumns; j++) {
                double direction = rng.nextBoolean() ? 1 : -1;
                data[index][j] = noise.nextDouble(baseMu + direction * anomalyShift * baseSigma, 0.1 * baseSigma);
            }
        }
        return new MultiDimDataWithKey(data, outliers);
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
