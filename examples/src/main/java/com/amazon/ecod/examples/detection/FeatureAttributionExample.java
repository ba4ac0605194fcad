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

package com.amazon.ecod.examples.detection;

import java.util.Random;

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.examples.Example;
import com.amazon.ecod.testutils.OutlierTestData;

/**
 * Uses the per-feature extremities of a row to explain which feature made it
 * an outlier.
 */
public class FeatureAttributionExample implements Example {

    public static void main(String[] args) throws Exception {
        new FeatureAttributionExample().run();
    }

    @Override
    public String command() {
        return "attribution";
    }

    @Override
    public String description() {
        return "find the feature responsible for each outlier";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 8;
        int trainingSize = 1000;

        ECODModel model = ECOD.defaultDetector()
                .fit(new OutlierTestData().generateTestData(trainingSize, dimensions, 7));

        // each query row is normal except for a single shifted feature
        Random rng = new Random(8);
        int queries = 20;
        double[][] query = new OutlierTestData().generateTestData(queries, dimensions, 9);
        int[] shifted = new int[queries];
        for (int i = 0; i < queries; i++) {
            shifted[i] = rng.nextInt(dimensions);
            query[i][shifted[i]] += rng.nextBoolean() ? 10.0 : -10.0;
        }

        double[][] extremities = model.featureScores(query);
        double[] scores = model.decisionFunction(query);

        int correct = 0;
        for (int i = 0; i < queries; i++) {
            int top = 0;
            for (int f = 1; f < dimensions; f++) {
                if (extremities[i][f] > extremities[i][top]) {
                    top = f;
                }
            }
            System.out.printf("row %2d: score = %.3f, shifted feature = %d, top feature = %d (%.3f)%n", i, scores[i],
                    shifted[i], top, extremities[i][top]);
            if (top == shifted[i]) {
                correct++;
            }
        }

        System.out.printf("attributed %d of %d rows correctly%n", correct, queries);
        if (correct < queries * 0.9) {
            throw new IllegalStateException("feature attribution disagrees with the shifted features");
        }

        System.out.println("Looks good!");
    }
}
