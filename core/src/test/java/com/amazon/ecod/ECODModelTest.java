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

package com.amazon.ecod;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.ecod.cdf.EmpiricalCDF;
import com.amazon.ecod.cdf.Tail;
import com.amazon.ecod.config.ProbabilityMethod;
import com.amazon.ecod.executor.SequentialScoringExecutor;
import com.amazon.ecod.testutils.ExampleDataSets;
import com.amazon.ecod.testutils.OutlierTestData;
import com.amazon.ecod.threshold.Calibration;

public class ECODModelTest {

    private ECODModel model;

    @BeforeEach
    public void setUp() {
        model = ECOD.builder().contamination(0.2).build().fit(ExampleDataSets.generateSequence(10));
    }

    @Test
    public void testDecisionFunction() {
        double[] scores = model.decisionFunction(new double[][] { { -5.0 }, { 4.5 }, { 20.0 }, { 2.0 } });
        assertEquals(Math.log(10), scores[0], 1e-12);
        assertEquals(Math.log(2), scores[1], 1e-12);
        assertEquals(Math.log(10), scores[2], 1e-12);
        assertEquals(Math.log(10.0 / 3), scores[3], 1e-12);
    }

    @Test
    public void testFeatureScoresSumToDecisionScores() {
        double[][] data = new OutlierTestData().generateTestDataWithKey(100, 5, 4, 17).data;
        ECODModel fitted = ECOD.defaultDetector().fit(data);
        double[][] query = new OutlierTestData().generateTestData(20, 5, 18);
        double[][] extremities = fitted.featureScores(query);
        double[] scores = fitted.decisionFunction(query);
        for (int i = 0; i < query.length; i++) {
            assertEquals(5, extremities[i].length);
            assertEquals(scores[i], StatUtils.sum(extremities[i]), 1e-9);
        }
    }

    @Test
    public void testPredict() {
        assertArrayEquals(new int[] { 1, 0, 1 }, model.predict(new double[][] { { -5.0 }, { 4.5 }, { 20.0 } }));
    }

    @Test
    public void testPredictProbaLinear() {
        double[][] probabilities = model.predictProba(new double[][] { { 2.0 }, { 4.5 }, { 20.0 }, { -100.0 } },
                ProbabilityMethod.LINEAR);
        double expected = Math.log(5.0 / 3) / Math.log(5);
        assertEquals(expected, probabilities[0][1], 1e-9);
        assertEquals(1 - expected, probabilities[0][0], 1e-9);
        assertEquals(0.0, probabilities[1][1], 1e-12);
        assertEquals(1.0, probabilities[2][1], 1e-12);
        assertEquals(1.0, probabilities[3][1], 1e-12);
    }

    @Test
    public void testPredictProbaUnify() {
        double[] training = model.getDecisionScores();
        double mean = StatUtils.mean(training);
        double std = new StandardDeviation(false).evaluate(training);

        double[][] probabilities = model.predictProba(new double[][] { { 4.5 }, { 20.0 } }, ProbabilityMethod.UNIFY);
        assertEquals(0.0, probabilities[0][1]);
        assertEquals(Erf.erf((Math.log(10) - mean) / (std * Math.sqrt(2))), probabilities[1][1], 1e-12);
        assertThat(probabilities[1][1], greaterThan(0.5));
        assertThat(probabilities[1][1], lessThan(1.0));
    }

    @ParameterizedTest
    @EnumSource(ProbabilityMethod.class)
    public void testProbabilitiesAreComplementary(ProbabilityMethod method) {
        double[][] query = new OutlierTestData(4.5, 6.0, 0.0).generateTestData(40, 1, 23);
        for (double[] row : model.predictProba(query, method)) {
            assertEquals(1.0, row[0] + row[1], 1e-12);
            assertThat(row[1], closeTo(0.5, 0.5));
        }
    }

    @ParameterizedTest
    @EnumSource(ProbabilityMethod.class)
    public void testProbabilitiesWithDegenerateTrainingScores(ProbabilityMethod method) {
        ECODModel constant = ECOD.defaultDetector().fit(new double[][] { { 3.0 }, { 3.0 }, { 3.0 } });
        double[][] probabilities = constant.predictProba(new double[][] { { 3.0 }, { 9.0 } }, method);
        assertArrayEquals(new double[] { 1.0, 0.0 }, probabilities[0]);
        assertArrayEquals(new double[] { 1.0, 0.0 }, probabilities[1]);
    }

    @Test
    public void testModelProperties() {
        assertEquals(1, model.getDimensions());
        assertEquals(10, model.getNumberOfTrainingSamples());
        assertEquals(0.2, model.getContamination());
        EmpiricalCDF left = model.getReference(0, Tail.LEFT);
        EmpiricalCDF right = model.getReference(0, Tail.RIGHT);
        assertEquals(10, left.size());
        assertFalse(left.isConstant());
        assertEquals(0.1, left.probability(0.0));
        assertEquals(1.0, right.probability(-0.0));
        assertThrows(IllegalArgumentException.class, () -> model.getReference(1, Tail.LEFT));
        assertThrows(IllegalArgumentException.class, () -> model.getReference(-1, Tail.RIGHT));
    }

    @Test
    public void testAccessorsReturnCopies() {
        double[] scores = model.getDecisionScores();
        int[] labels = model.getLabels();
        scores[0] = -1;
        labels[0] = 0;
        assertEquals(Math.log(10), model.getDecisionScores()[0], 1e-12);
        assertEquals(1, model.getLabels()[0]);
    }

    @Test
    public void testInvalidQuery() {
        assertThrows(InvalidInputException.class, () -> model.decisionFunction(null));
        assertThrows(InvalidInputException.class, () -> model.decisionFunction(new double[0][]));
        assertThrows(InvalidInputException.class, () -> model.decisionFunction(new double[][] { { 1.0, 2.0 } }));
        assertThrows(InvalidInputException.class, () -> model.decisionFunction(new double[][] { { Double.NaN } }));
        assertThrows(InvalidInputException.class, () -> model.predict(new double[][] { {} }));
        assertThrows(InvalidInputException.class, () -> model.featureScores(new double[][] { { 1.0 }, null }));
        assertThrows(NullPointerException.class, () -> model.predictProba(new double[][] { { 1.0 } }, null));
    }

    @Test
    public void testConstructorValidation() {
        EmpiricalCDF[] left = new EmpiricalCDF[] { EmpiricalCDF.forTail(new double[] { 1, 2 }, Tail.LEFT) };
        EmpiricalCDF[] right = new EmpiricalCDF[] { EmpiricalCDF.forTail(new double[] { 1, 2 }, Tail.RIGHT) };
        double[] scores = new double[] { 0.5, 0.5 };
        Calibration calibration = new Calibration(0.5, new int[2]);
        SequentialScoringExecutor executor = new SequentialScoringExecutor();

        assertThrows(IllegalArgumentException.class,
                () -> new ECODModel(left, right, new double[3], calibration, 0.1, executor));
        assertThrows(IllegalArgumentException.class,
                () -> new ECODModel(left, new EmpiricalCDF[2], scores, calibration, 0.1, executor));
        assertThrows(IllegalArgumentException.class,
                () -> new ECODModel(new EmpiricalCDF[0], new EmpiricalCDF[0], scores, calibration, 0.1, executor));
        assertThrows(IllegalArgumentException.class,
                () -> new ECODModel(left, right, scores, calibration, 0.9, executor));
        assertThrows(NullPointerException.class, () -> new ECODModel(left, right, scores, calibration, 0.1, null));
    }

    @Test
    public void testConcurrentScoring() throws Exception {
        double[][] training = new OutlierTestData().generateTestDataWithKey(500, 6, 25, 31).data;
        ECODModel shared = ECOD.builder().parallelExecutionEnabled(true).threadPoolSize(2).build().fit(training);
        double[][] query = new OutlierTestData().generateTestDataWithKey(100, 6, 5, 32).data;
        double[] expected = shared.decisionFunction(query);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<double[]>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> shared.decisionFunction(query)));
            }
            for (Future<double[]> future : futures) {
                assertArrayEquals(expected, future.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
