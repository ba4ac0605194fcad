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

import java.util.Arrays;

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.config.ProbabilityMethod;
import com.amazon.ecod.examples.Example;
import com.amazon.ecod.testutils.MultiDimDataWithKey;
import com.amazon.ecod.testutils.OutlierTestData;

/**
 * Fit on one data set with planted outliers, then label a holdout set against
 * the frozen training references and compare the labels with the known outlier
 * rows.
 */
public class HoldoutScoringExample implements Example {

    public static void main(String[] args) throws Exception {
        new HoldoutScoringExample().run();
    }

    @Override
    public String command() {
        return "holdout";
    }

    @Override
    public String description() {
        return "fit ECOD on training data and label a holdout set";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 5;
        int trainingSize = 2000;
        int holdoutSize = 500;
        double contamination = 0.02;

        OutlierTestData testData = new OutlierTestData(10.0, 2.0, 6.0);
        MultiDimDataWithKey training = testData.generateTestDataWithKey(trainingSize, dimensions, 40, 101);
        MultiDimDataWithKey holdout = testData.generateTestDataWithKey(holdoutSize, dimensions, 10, 102);

        ECODModel model = ECOD.builder().contamination(contamination).build().fit(training.data);
        System.out.printf("dimensions = %d, trainingSize = %d, contamination = %s, threshold = %.4f%n", dimensions,
                trainingSize, contamination, model.getThreshold());

        int[] labels = model.predict(holdout.data);
        double[][] probabilities = model.predictProba(holdout.data, ProbabilityMethod.UNIFY);

        int truePositives = 0;
        for (int index : holdout.outlierIndices) {
            truePositives += labels[index];
            System.out.printf("row %3d: label = %d, outlier probability = %.3f%n", index, labels[index],
                    probabilities[index][1]);
        }
        int flagged = Arrays.stream(labels).sum();

        double precision = flagged == 0 ? 0 : (double) truePositives / flagged;
        double recall = (double) truePositives / holdout.outlierIndices.length;
        System.out.printf("flagged = %d, precision = %.3f, recall = %.3f%n", flagged, precision, recall);

        if (recall < 1.0) {
            throw new IllegalStateException("a planted outlier was not labeled");
        }

        System.out.println("Looks good!");
    }
}
