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
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ecod.ECODModel;

public class AnomalyScoreRunner extends SimpleRunner {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScoreRunner.class);

    public AnomalyScoreRunner() {
        super(AnomalyScoreRunner.class.getName(),
                "Compute anomaly scores and labels from the input rows and append them to the output rows.",
                AnomalyScoreTransformer::new);
    }

    public static void main(String... args) throws IOException {
        AnomalyScoreRunner runner = new AnomalyScoreRunner();
        runner.parse(args);
        log.info("Reading from stdin... (Ctrl-d to finish input)");
        runner.runOrExit(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        log.info("Done.");
    }

    public static class AnomalyScoreTransformer implements LineTransformer {
        private final ECODModel model;

        public AnomalyScoreTransformer(ECODModel model) {
            this.model = model;
        }

        @Override
        public List<String> getResultValues(double... point) {
            double score = model.decisionFunction(new double[][] { point })[0];
            int label = score > model.getThreshold() ? 1 : 0;
            return Arrays.asList(Double.toString(score), Integer.toString(label));
        }

        @Override
        public List<String> getResultColumnNames() {
            return Arrays.asList("anomaly_score", "anomaly_label");
        }

        @Override
        public ECODModel getModel() {
            return model;
        }
    }
}
