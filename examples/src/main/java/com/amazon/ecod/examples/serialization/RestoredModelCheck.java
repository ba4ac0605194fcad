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

package com.amazon.ecod.examples.serialization;

import com.amazon.ecod.ECODModel;

/**
 * Shared check for the serialization examples: a restored model must reproduce
 * the scores and labels of the original on unseen rows.
 */
final class RestoredModelCheck {

    private RestoredModelCheck() {
    }

    static void verify(ECODModel original, ECODModel restored, double[][] query) {
        double[] scores = original.decisionFunction(query);
        double[] restoredScores = restored.decisionFunction(query);
        int[] labels = original.predict(query);
        int[] restoredLabels = restored.predict(query);

        int differences = 0;
        int anomalies = 0;
        for (int i = 0; i < query.length; i++) {
            anomalies += labels[i];
            if (scores[i] != restoredScores[i] || labels[i] != restoredLabels[i]) {
                differences++;
            }
        }

        // first validate that this was a nontrivial test
        if (anomalies == 0) {
            throw new IllegalStateException("test data did not produce any anomalies");
        }

        if (differences > 0) {
            throw new IllegalStateException(
                    String.format("restored model disagrees with the original model on %d rows", differences));
        }
    }
}
