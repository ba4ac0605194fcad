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

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.examples.Example;
import com.amazon.ecod.state.ECODModelMapper;
import com.amazon.ecod.state.ECODModelState;
import com.amazon.ecod.testutils.OutlierTestData;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serialize a fitted ECOD model using the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> library.
 */
public class ProtostuffExample implements Example {

    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize a fitted ECOD model with the protostuff library";
    }

    @Override
    public void run() throws Exception {
        // Fit a model

        int dimensions = 10;
        int trainingSize = 5000;
        double contamination = 0.01;

        OutlierTestData testData = new OutlierTestData();
        ECODModel model = ECOD.builder().contamination(contamination).build()
                .fit(testData.generateTestDataWithKey(trainingSize, dimensions, 50, 23).data);

        // Convert to an array of bytes and print the size

        ECODModelMapper mapper = new ECODModelMapper();

        Schema<ECODModelState> schema = RuntimeSchema.getSchema(ECODModelState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            ECODModelState state = mapper.toState(model);
            bytes = ProtostuffIOUtil.toByteArray(state, schema, buffer);
        } finally {
            buffer.clear();
        }

        System.out.printf("dimensions = %d, trainingSize = %d, contamination = %s%n", dimensions, trainingSize,
                contamination);
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        // Restore from protostuff and compare the two models on new rows

        ECODModelState state2 = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state2, schema);
        ECODModel model2 = mapper.toModel(state2);
        RestoredModelCheck.verify(model, model2, testData.generateTestDataWithKey(100, dimensions, 5, 24).data);

        System.out.println("Looks good!");
    }
}
