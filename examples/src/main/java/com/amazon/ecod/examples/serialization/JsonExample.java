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

import java.nio.charset.StandardCharsets;

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.examples.Example;
import com.amazon.ecod.state.ECODModelMapper;
import com.amazon.ecod.state.ECODModelState;
import com.amazon.ecod.testutils.OutlierTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialize a fitted ECOD model to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a fitted ECOD model as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Fit a model

        int dimensions = 4;
        int trainingSize = 1000;
        double contamination = 0.05;

        OutlierTestData testData = new OutlierTestData();
        ECODModel model = ECOD.builder().contamination(contamination).parallelExecutionEnabled(true).build()
                .fit(testData.generateTestDataWithKey(trainingSize, dimensions, 50, 17).data);

        // Convert to JSON and print the number of bytes

        ECODModelMapper mapper = new ECODModelMapper();
        mapper.setSaveExecutorContext(true);
        ObjectMapper jsonMapper = new ObjectMapper();

        String json = jsonMapper.writeValueAsString(mapper.toState(model));

        System.out.printf("dimensions = %d, trainingSize = %d, contamination = %s%n", dimensions, trainingSize,
                contamination);
        System.out.printf("JSON size = %d bytes%n", json.getBytes(StandardCharsets.UTF_8).length);

        // Restore from JSON and compare the two models on new rows

        ECODModel model2 = mapper.toModel(jsonMapper.readValue(json, ECODModelState.class));
        RestoredModelCheck.verify(model, model2, testData.generateTestDataWithKey(100, dimensions, 5, 18).data);

        System.out.println("Looks good!");
    }
}
