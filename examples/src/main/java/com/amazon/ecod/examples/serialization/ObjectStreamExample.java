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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.examples.Example;
import com.amazon.ecod.state.ECODModelMapper;
import com.amazon.ecod.state.ECODModelState;
import com.amazon.ecod.testutils.OutlierTestData;

public class ObjectStreamExample implements Example {

    public static void main(String[] args) throws Exception {
        new ObjectStreamExample().run();
    }

    @Override
    public String command() {
        return "object_stream";
    }

    @Override
    public String description() {
        return "serialize a fitted ECOD model with object stream";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 6;
        int trainingSize = 2000;

        OutlierTestData testData = new OutlierTestData();
        ECODModel model = ECOD.defaultDetector()
                .fit(testData.generateTestDataWithKey(trainingSize, dimensions, 40, 31).data);

        ECODModelMapper mapper = new ECODModelMapper();
        System.out.printf("dimensions = %d, trainingSize = %d%n", dimensions, trainingSize);
        byte[] bytes = serialize(mapper.toState(model));
        System.out.printf("Object output stream size = %d bytes%n", bytes.length);

        ECODModel model2 = mapper.toModel((ECODModelState) deserialize(bytes));
        RestoredModelCheck.verify(model, model2, testData.generateTestDataWithKey(100, dimensions, 5, 32).data);

        System.out.println("Looks good!");
    }

    private byte[] serialize(Object state) throws IOException {
        try (ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
                ObjectOutputStream objectOutputStream = new ObjectOutputStream(byteArrayOutputStream)) {
            objectOutputStream.writeObject(state);
            objectOutputStream.flush();
            return byteArrayOutputStream.toByteArray();
        }
    }

    private Object deserialize(byte[] bytes) throws IOException, ClassNotFoundException {
        try (ObjectInputStream objectInputStream = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return objectInputStream.readObject();
        }
    }
}
