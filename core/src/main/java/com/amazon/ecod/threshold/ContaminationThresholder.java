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

import static com.amazon.ecod.CommonUtils.checkArgument;
import static com.amazon.ecod.CommonUtils.checkNotNull;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Sets the threshold at the {@code 100 * (1 - contamination)} percentile of the
 * training scores, interpolating linearly between order statistics, and labels
 * every score strictly above the threshold as an anomaly.
 */
public class ContaminationThresholder implements IThresholder {

    public static final double MAX_CONTAMINATION = 0.5;

    @Override
    public Calibration calibrate(double[] scores, double contamination) {
        checkNotNull(scores, "scores must not be null");
        checkArgument(scores.length > 0, "scores must not be empty");
        checkContamination(contamination);

        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        double threshold = percentile.evaluate(scores, 100 * (1 - contamination));
        return new Calibration(threshold, label(scores, threshold));
    }

    /**
     * @param scores    anomaly scores
     * @param threshold a decision threshold
     * @return 1 for every score strictly greater than the threshold, 0 otherwise
     */
    public static int[] label(double[] scores, double threshold) {
        int[] labels = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = scores[i] > threshold ? 1 : 0;
        }
        return labels;
    }

    public static void checkContamination(double contamination) {
        checkArgument(contamination > 0 && contamination <= MAX_CONTAMINATION,
                "contamination must be in (0, 0.5]");
    }
}
