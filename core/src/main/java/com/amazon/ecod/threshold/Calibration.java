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

package com.amazon.ecod.threshold;

import static com.amazon.ecod.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * The result of calibrating a set of scores: a threshold, and a label per score
 * where 1 marks an anomaly and 0 an inlier.
 */
public final class Calibration {

    private final double threshold;
    private final int[] labels;

    public Calibration(double threshold, int[] labels) {
        checkNotNull(labels, "labels must not be null");
        this.threshold = threshold;
        this.labels = Arrays.copyOf(labels, labels.length);
    }

    public double getThreshold() {
        return threshold;
    }

    public int[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public int getNumberOfAnomalies() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }
}
