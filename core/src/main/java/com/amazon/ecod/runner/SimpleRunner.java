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
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ecod.ECODModel;
import com.amazon.ecod.InvalidInputException;

/**
 * Reads delimited rows, fits a detector and writes every input row followed by
 * the result columns of a {@link LineTransformer}. The detector is fitted on the
 * input rows themselves, or on the rows of a separate training file when one is
 * given, in which case the input rows are scored against it.
 */
public class SimpleRunner {

    private static final Logger log = LoggerFactory.getLogger(SimpleRunner.class);

    protected final ArgumentParser argumentParser;
    protected final Function<ECODModel, LineTransformer> algorithmInitializer;
    protected LineTransformer algorithm;
    protected int lineNumber;

    public SimpleRunner(String runnerClass, String runnerDescription,
            Function<ECODModel, LineTransformer> algorithmInitializer) {
        this(new ArgumentParser(runnerClass, runnerDescription), algorithmInitializer);
    }

    public SimpleRunner(ArgumentParser argumentParser, Function<ECODModel, LineTransformer> algorithmInitializer) {
        this.argumentParser = argumentParser;
        this.algorithmInitializer = algorithmInitializer;
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        List<String[]> rows = new ArrayList<>();
        String[] header = null;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                header = values;
                continue;
            }

            rows.add(values);
        }

        int firstDataLine = (header == null) ? 1 : 2;
        double[][] points = parsePoints(rows, firstDataLine);
        log.info("read {} rows", points.length);

        if (argumentParser.getTrainingFile() == null) {
            prepareAlgorithm(points);
        } else {
            prepareAlgorithm(readTrainingFile(argumentParser.getTrainingFile()));
        }

        if (header != null) {
            writeHeader(header, out);
        }

        for (int i = 0; i < rows.size(); i++) {
            processLine(rows.get(i), points[i], out);
        }

        out.flush();
    }

    /**
     * Runs the transformation and reports invalid input rows the way flag errors
     * are reported: an error message, the usage message and exit status 1.
     */
    public void runOrExit(BufferedReader in, PrintWriter out) throws IOException {
        try {
            run(in, out);
        } catch (InvalidInputException e) {
            argumentParser.printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
        }
    }

    protected void prepareAlgorithm(double[][] trainingPoints) {
        ECODModel model = argumentParser.buildDetector().fit(trainingPoints);
        log.info("fitted {} rows with {} features, threshold {}", model.getNumberOfTrainingSamples(),
                model.getDimensions(), model.getThreshold());
        algorithm = algorithmInitializer.apply(model);
    }

    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultColumnNames().forEach(joiner::add);
        out.println(joiner.toString());
    }

    protected void processLine(String[] values, double[] point, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultValues(point).forEach(joiner::add);
        out.println(joiner.toString());
    }

    protected double[][] readTrainingFile(String trainingFile) throws IOException {
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(Paths.get(trainingFile), StandardCharsets.UTF_8)) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (first && argumentParser.getHeaderRow()) {
                    first = false;
                    continue;
                }
                first = false;
                rows.add(line.split(argumentParser.getDelimiter()));
            }
        }
        log.info("read {} training rows from {}", rows.size(), trainingFile);
        return parsePoints(rows, argumentParser.getHeaderRow() ? 2 : 1);
    }

    protected double[][] parsePoints(List<String[]> rows, int firstLineNumber) {
        double[][] points = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            String[] values = rows.get(i);
            if (i > 0 && values.length != points[0].length) {
                throw new InvalidInputException(
                        String.format("Wrong number of values on line %d. Expected %d but found %d.",
                                firstLineNumber + i, points[0].length, values.length));
            }
            points[i] = parsePoint(values, firstLineNumber + i);
        }
        return points;
    }

    protected double[] parsePoint(String[] stringValues, int line) {
        double[] point = new double[stringValues.length];
        for (int i = 0; i < point.length; i++) {
            try {
                point[i] = Double.parseDouble(stringValues[i]);
            } catch (NumberFormatException e) {
                throw new InvalidInputException(
                        String.format("Non-numeric value '%s' on line %d", stringValues[i], line), e);
            }
        }
        return point;
    }
}
