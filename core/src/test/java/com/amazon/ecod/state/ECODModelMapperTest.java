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

package com.amazon.ecod.state;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.cdf.Tail;
import com.amazon.ecod.executor.ParallelScoringExecutor;
import com.amazon.ecod.executor.SequentialScoringExecutor;
import com.amazon.ecod.testutils.ExampleDataSets;
import com.amazon.ecod.testutils.OutlierTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ECODModelMapperTest {

    private ECODModelMapper mapper;

    private static Stream<Arguments> modelProvider() {
        double[][] data = new OutlierTestData().generateTestDataWithKey(300, 4, 10, 101).data;
        return Stream.of(Arguments.of(ECOD.defaultDetector().fit(data)),
                Arguments.of(ECOD.builder().contamination(0.05).parallelExecutionEnabled(true).threadPoolSize(2)
                        .build().fit(data)),
                Arguments.of(ECOD.builder().contamination(0.2).build().fit(ExampleDataSets.generateSequence(10))),
                Arguments.of(ECOD.defaultDetector().fit(ExampleDataSets.generateWithConstantFeature(50, 3, 2, -1.0, 7))));
    }

    @BeforeEach
    public void setUp() {
        mapper = new ECODModelMapper();
    }

    @ParameterizedTest
    @MethodSource("modelProvider")
    public void testRoundTrip(ECODModel model) {
        ECODModel restored = mapper.toModel(mapper.toState(model));
        assertModelsEqual(model, restored);
    }

    @ParameterizedTest
    @MethodSource("modelProvider")
    public void testRoundTripThroughJson(ECODModel model) throws Exception {
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(model));
        ECODModelState state = jsonMapper.readValue(json, ECODModelState.class);
        assertEquals(Version.V1_0, state.getVersion());
        assertModelsEqual(model, mapper.toModel(state));
    }

    @Test
    public void testExecutorContextNotSavedByDefault() {
        ECODModel model = ECOD.builder().parallelExecutionEnabled(true).threadPoolSize(3).build()
                .fit(ExampleDataSets.generateSequence(20));
        ECODModelState state = mapper.toState(model);
        assertFalse(state.isParallelExecutionEnabled());
        assertEquals(0, state.getThreadPoolSize());
        assertTrue(mapper.toModel(state).getExecutor() instanceof SequentialScoringExecutor);
    }

    @Test
    public void testExecutorContextSaved() {
        mapper.setSaveExecutorContext(true);
        ECODModel model = ECOD.builder().parallelExecutionEnabled(true).threadPoolSize(3).build()
                .fit(ExampleDataSets.generateSequence(20));
        ECODModelState state = mapper.toState(model);
        assertTrue(state.isParallelExecutionEnabled());
        assertEquals(3, state.getThreadPoolSize());

        ECODModel restored = mapper.toModel(state);
        assertTrue(restored.getExecutor() instanceof ParallelScoringExecutor);
        assertEquals(3, ((ParallelScoringExecutor) restored.getExecutor()).getThreadPoolSize());

        ECODModel sequential = ECOD.defaultDetector().fit(ExampleDataSets.generateSequence(20));
        assertFalse(mapper.toState(sequential).isParallelExecutionEnabled());
    }

    @Test
    public void testInvalidState() {
        assertThrows(NullPointerException.class, () -> mapper.toModel(null));
        assertThrows(NullPointerException.class, () -> mapper.toState(null));

        ECODModelState state = mapper.toState(ECOD.defaultDetector().fit(ExampleDataSets.generateSequence(10)));
        state.setDimensions(2);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        ECODModelState unsorted = mapper.toState(ECOD.defaultDetector().fit(ExampleDataSets.generateSequence(10)));
        unsorted.getReferences()[0][0] = 100.0;
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(unsorted));
    }

    @Test
    public void testReferenceSizeMustMatchTrainingRows() {
        ECODModelState truncated = mapper.toState(ECOD.defaultDetector().fit(ExampleDataSets.generateSequence(10)));
        truncated.setReferences(new double[][] { { 0.0, 1.0, 2.0 } });
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(truncated));

        ECODModelState missing = mapper.toState(ECOD.defaultDetector().fit(ExampleDataSets.generateSequence(10)));
        missing.setReferences(new double[][] { null });
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(missing));

        ECODModelState noScores = mapper.toState(ECOD.defaultDetector().fit(ExampleDataSets.generateSequence(10)));
        noScores.setDecisionScores(null);
        assertThrows(NullPointerException.class, () -> mapper.toModel(noScores));
    }

    private static void assertModelsEqual(ECODModel expected, ECODModel actual) {
        assertEquals(expected.getDimensions(), actual.getDimensions());
        assertEquals(expected.getContamination(), actual.getContamination());
        assertEquals(expected.getThreshold(), actual.getThreshold());
        assertArrayEquals(expected.getDecisionScores(), actual.getDecisionScores());
        assertArrayEquals(expected.getLabels(), actual.getLabels());
        for (int f = 0; f < expected.getDimensions(); f++) {
            for (Tail tail : Tail.values()) {
                assertArrayEquals(expected.getReference(f, tail).getSortedReference(),
                        actual.getReference(f, tail).getSortedReference());
                assertEquals(expected.getReference(f, tail).isConstant(), actual.getReference(f, tail).isConstant());
            }
        }

        double[][] query = new OutlierTestData(0.0, 3.0, 0.0).generateTestData(25, expected.getDimensions(), 5);
        assertArrayEquals(expected.decisionFunction(query), actual.decisionFunction(query));
        assertArrayEquals(expected.predict(query), actual.predict(query));
    }
}
