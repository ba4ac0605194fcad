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

package com.amazon.ecod.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ecod.ECODModel;

/**
 * Appends the extremity of every feature to each row; the columns of a row sum
 * to its anomaly score.
 */
public class FeatureScoreRunner extends SimpleRunner {

    private static final Logger log = LoggerFactory.getLogger(FeatureScoreRunner.class);

    public FeatureScoreRunner() {
        super(FeatureScoreRunner.class.getName(),
                "Compute the per-feature extremity scores of the input rows and append them to the output rows.",
                FeatureScoreTransformer::new);
    }

    public static void main(String... args) throws IOException {
        FeatureScoreRunner runner = new FeatureScoreRunner();
        runner.parse(args);
        log.info("Reading from stdin... (Ctrl-d to finish input)");
        runner.runOrExit(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        log.info("Done.");
    }

    public static class FeatureScoreTransformer implements LineTransformer {
        private final ECODModel model;

        public FeatureScoreTransformer(ECODModel model) {
            this.model = model;
        }

        @Override
        public List<String> getResultValues(double... point) {
            double[] extremities = model.featureScores(new double[][] { point })[0];
            List<String> result = new ArrayList<>(extremities.length);
            for (double value : extremities) {
                result.add(Double.toString(value));
            }
            return result;
        }

        @Override
        public List<String> getResultColumnNames() {
            List<String> names = new ArrayList<>(model.getDimensions());
            for (int f = 0; f < model.getDimensions(); f++) {
                names.add("feature_score_" + f);
            }
            return names;
        }

        @Override
        public ECODModel getModel() {
            return model;
        }
    }
}
