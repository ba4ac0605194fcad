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

import static com.amazon.ecod.CommonUtils.checkArgument;

/**
 * Converts tail probabilities into extremity scores. A probability {@code u}
 * in {@code (0, 1]} maps to {@code -ln(u)}, which is zero for {@code u = 1} and
 * grows as the value becomes rarer. Both tails of a feature are scored and the
 * larger of the two is kept, so a value far out on either side is extreme.
 */
public class TailScorer {

    private TailScorer() {
    }

    /**
     * @param probability a tail probability in {@code (0, 1]}
     * @return {@code -ln(probability)}
     */
    public static double negativeLog(double probability) {
        checkArgument(probability > 0 && probability <= 1, "tail probability must be in (0, 1]");
        // positive zero for probability 1
        return 0.0 - Math.log(probability);
    }

    /**
     * @param leftProbability  left-tail probability of a value
     * @param rightProbability right-tail probability of the same value
     * @return {@code max(-ln(left), -ln(right))}
     */
    public static double extremity(double leftProbability, double rightProbability) {
        return Math.max(negativeLog(leftProbability), negativeLog(rightProbability));
    }

    /**
     * Row-wise {@link #extremity(double, double)} for one observation.
     *
     * @param leftProbabilities  left-tail probabilities, one per feature
     * @param rightProbabilities right-tail probabilities, one per feature
     * @return extremity per feature
     */
    public static double[] extremities(double[] leftProbabilities, double[] rightProbabilities) {
        checkArgument(leftProbabilities.length == rightProbabilities.length, "tail lengths differ");
        double[] result = new double[leftProbabilities.length];
        for (int f = 0; f < result.length; f++) {
            result[f] = extremity(leftProbabilities[f], rightProbabilities[f]);
        }
        return result;
    }
}
