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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.ecod.ECOD;
import com.amazon.ecod.ECODModel;
import com.amazon.ecod.InvalidInputException;
import com.amazon.ecod.testutils.ExampleDataSets;

public class AnomalyScoreRunnerTest {

    private static final String HALF_SCORE = Double.toString(0.0 - Math.log(0.5));

    private double contamination;
    private String delimiter;
    private boolean headerRow;
    private AnomalyScoreRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        contamination = 0.2;
        delimiter = ",";
        headerRow = true;
        runner = new AnomalyScoreRunner();

        runner.parse("--contamination", Double.toString(contamination), "--delimiter", delimiter, "--header-row",
                Boolean.toString(headerRow));

        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    @Test
    public void testRun() throws IOException {
        when(in.readLine()).thenReturn("a").thenReturn("1.0").thenReturn("4.0").thenReturn(null);
        runner.run(in, out);
        verify(out).println("a,anomaly_score,anomaly_label");
        verify(out).println("1.0," + HALF_SCORE + ",0");
        verify(out).println("4.0," + HALF_SCORE + ",0");
    }

    @Test
    public void testRunWithTrainingFile(@TempDir Path directory) throws IOException {
        Path trainingFile = directory.resolve("train.csv");
        StringBuilder builder = new StringBuilder("a\n");
        for (int i = 0; i < 10; i++) {
            builder.append(i).append(".0\n");
        }
        Files.write(trainingFile, builder.toString().getBytes(StandardCharsets.UTF_8));

        runner.parse("--training-file", trainingFile.toString());
        when(in.readLine()).thenReturn("a").thenReturn("20.0").thenReturn("4.5").thenReturn(null);
        runner.run(in, out);

        verify(out).println("a,anomaly_score,anomaly_label");
        verify(out).println("20.0," + (0.0 - Math.log(0.1)) + ",1");
        verify(out).println("4.5," + HALF_SCORE + ",0");
        assertEquals(10, runner.algorithm.getModel().getNumberOfTrainingSamples());
    }

    @Test
    public void testWrongNumberOfValues() throws IOException {
        when(in.readLine()).thenReturn("a,b").thenReturn("1.0,2.0").thenReturn("3.0").thenReturn(null);
        InvalidInputException exception = assertThrows(InvalidInputException.class, () -> runner.run(in, out));
        assertEquals("Wrong number of values on line 3. Expected 2 but found 1.", exception.getMessage());
    }

    @Test
    public void testNonNumericValue() throws IOException {
        when(in.readLine()).thenReturn("a").thenReturn("1.0").thenReturn("x").thenReturn(null);
        InvalidInputException exception = assertThrows(InvalidInputException.class, () -> runner.run(in, out));
        assertEquals(NumberFormatException.class, exception.getCause().getClass());
    }

    @Test
    public void testWriteHeader() {
        String[] line = new String[] { "a", "b" };
        runner.prepareAlgorithm(new double[][] { { 1.0, 2.0 }, { 3.0, 4.0 } });
        runner.writeHeader(line, out);
        verify(out).println("a,b,anomaly_score,anomaly_label");
    }

    @Test
    public void testProcessLine() {
        String[] line = new String[] { "1.0" };
        runner.prepareAlgorithm(new double[][] { { 1.0 }, { 4.0 } });
        runner.processLine(line, new double[] { 1.0 }, out);
        verify(out).println("1.0," + HALF_SCORE + ",0");
    }

    @Test
    public void testAnomalyScoreTransformer() {
        ECODModel model = ECOD.builder().contamination(0.2).build().fit(ExampleDataSets.generateSequence(10));
        AnomalyScoreRunner.AnomalyScoreTransformer transformer = new AnomalyScoreRunner.AnomalyScoreTransformer(model);

        assertEquals(Arrays.asList(Double.toString(model.decisionFunction(new double[][] { { 20.0 } })[0]), "1"),
                transformer.getResultValues(20.0));
        assertEquals(Arrays.asList("anomaly_score", "anomaly_label"), transformer.getResultColumnNames());
        assertSame(model, transformer.getModel());
    }
}
