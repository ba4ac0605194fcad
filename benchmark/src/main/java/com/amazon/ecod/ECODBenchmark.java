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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.ecod.testutils.OutlierTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ECODBenchmark {

    public final static int DATA_SIZE = 50_000;
    public final static int QUERY_SIZE = 10_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1", "16", "256" })
        int dimensions;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        double[][] data;
        double[][] query;
        ECOD detector;
        ECODModel model;

        @Setup(Level.Trial)
        public void setUpData() {
            OutlierTestData testData = new OutlierTestData();
            data = testData.generateTestDataWithKey(DATA_SIZE, dimensions, DATA_SIZE / 100, 99).data;
            query = testData.generateTestDataWithKey(QUERY_SIZE, dimensions, QUERY_SIZE / 100, 100).data;
            detector = ECOD.builder().parallelExecutionEnabled(parallelExecutionEnabled).build();
            model = detector.fit(data);
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public ECODModel fit(BenchmarkState state) {
        return state.detector.fit(state.data);
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_SIZE)
    public void decisionFunction(BenchmarkState state, Blackhole blackhole) {
        blackhole.consume(state.model.decisionFunction(state.query));
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_SIZE)
    public void featureScores(BenchmarkState state, Blackhole blackhole) {
        blackhole.consume(state.model.featureScores(state.query));
    }

    @Benchmark
    @OperationsPerInvocation(QUERY_SIZE)
    public void scoreRowByRow(BenchmarkState state, Blackhole blackhole) {
        double[][] query = state.query;
        double[][] row = new double[1][];
        double score = 0.0;

        for (int i = 0; i < query.length; i++) {
            row[0] = query[i];
            score += state.model.decisionFunction(row)[0];
        }

        blackhole.consume(score);
    }
}
