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

package com.amazon.ecod.scoring;

/**
 * Sums the per-feature extremities of one observation into its anomaly score.
 * Higher scores are more abnormal; the same convention is used for training and
 * query scores and for the calibrated threshold.
 */
public class ScoreAggregator {

    private ScoreAggregator() {
    }

    /**
     * @param extremities per-feature extremities of one observation
     * @return the anomaly score of the observation
     */
    public static double aggregate(double[] extremities) {
        double sum = 0;
        for (double value : extremities) {
            sum += value;
        }
        return sum;
    }
}
