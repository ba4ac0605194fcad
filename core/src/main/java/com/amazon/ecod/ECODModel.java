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

import static com.amazon.ecod.CommonUtils.checkArgument;
import static com.amazon.ecod.CommonUtils.checkInput;
import static com.amazon.ecod.CommonUtils.checkNotNull;

import java.util.Arrays;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import com.amazon.ecod.cdf.EmpiricalCDF;
import com.amazon.ecod.cdf.Tail;
import com.amazon.ecod.config.ProbabilityMethod;
import com.amazon.ecod.executor.AbstractScoringExecutor;
import com.amazon.ecod.threshold.Calibration;
import com.amazon.ecod.threshold.ContaminationThresholder;
import com.amazon.ecod.util.ArrayUtils;

/**
 * A fitted ECOD detector. The per-feature reference distributions, training
 * scores, threshold and labels are fixed at construction time; scoring never
 * modifies them, so a model can be shared between threads and every row is
 * scored independently of the other rows in the same call.
 */
public final class ECODModel {

    private final EmpiricalCDF[] leftReferences;
    private final EmpiricalCDF[] rightReferences;
    private final double[] decisionScores;
    private final double threshold;
    private final int[] labels;
    private final double contamination;
    private final AbstractScoringExecutor executor;

    public ECODModel(EmpiricalCDF[] leftReferences, EmpiricalCDF[] rightReferences, double[] decisionScores,
            Calibration calibration, double contamination, AbstractScoringExecutor executor) {
        checkNotNull(leftReferences, "leftReferences must not be null");
        checkNotNull(rightReferences, "rightReferences must not be null");
        checkNotNull(decisionScores, "decisionScores must not be null");
        checkNotNull(calibration, "calibration must not be null");
        checkArgument(leftReferences.length > 0, "at least one feature is required");
        checkArgument(leftReferences.length == rightReferences.length, "tail references differ in dimensions");
        checkArgument(calibration.getLabels().length == decisionScores.length,
                "labels and decision scores differ in length");
        ContaminationThresholder.checkContamination(contamination);

        this.leftReferences = Arrays.copyOf(leftReferences, leftReferences.length);
        this.rightReferences = Arrays.copyOf(rightReferences, rightReferences.length);
        this.decisionScores = Arrays.copyOf(decisionScores, decisionScores.length);
        this.threshold = calibration.getThreshold();
        this.labels = calibration.getLabels();
        this.contamination = contamination;
        this.executor = checkNotNull(executor, "executor must not be null");
    }

    /**
     * Computes the raw anomaly score of each row against the frozen training
     * references. Higher scores are more abnormal, in the same units as
     * {@link #getDecisionScores()} and {@link #getThreshold()}.
     *
     * @param points query matrix with {@link #getDimensions()} columns
     * @return one score per row, in row order
     * @throws InvalidInputException if the matrix is structurally invalid
     */
    public double[] decisionFunction(double[][] points) {
        checkQuery(points);
        return executor.aggregate(featureScores(executor, leftReferences, rightReferences, points));
    }

    /**
     * The per-feature extremity of each row, {@code max(-ln(left), -ln(right))}
     * for every feature; each row sums to its {@link #decisionFunction} score.
     *
     * @param points query matrix with {@link #getDimensions()} columns
     * @return extremity matrix of the same shape as the query
     */
    public double[][] featureScores(double[][] points) {
        checkQuery(points);
        return featureScores(executor, leftReferences, rightReferences, points);
    }

    /**
     * @param points query matrix
     * @return 1 for each row whose score exceeds the fitted threshold, 0 otherwise
     */
    public int[] predict(double[][] points) {
        return ContaminationThresholder.label(decisionFunction(points), threshold);
    }

    /**
     * Converts the scores of new rows into outlier probabilities relative to the
     * training scores.
     *
     * @param points query matrix
     * @param method the conversion to use
     * @return one row {@code [inlier probability, outlier probability]} per query
     *         row
     */
    public double[][] predictProba(double[][] points, ProbabilityMethod method) {
        checkNotNull(method, "method must not be null");
        double[] scores = decisionFunction(points);
        double[][] probabilities = new double[scores.length][2];

        if (method == ProbabilityMethod.LINEAR) {
            double min = StatUtils.min(decisionScores);
            double max = StatUtils.max(decisionScores);
            for (int i = 0; i < scores.length; i++) {
                double p = (max > min) ? clip((scores[i] - min) / (max - min)) : (scores[i] > max ? 1 : 0);
                probabilities[i][0] = 1 - p;
                probabilities[i][1] = p;
            }
        } else {
            double mean = StatUtils.mean(decisionScores);
            double std = new StandardDeviation(false).evaluate(decisionScores);
            for (int i = 0; i < scores.length; i++) {
                double p = (std > 0) ? clip(Erf.erf((scores[i] - mean) / (std * Math.sqrt(2))))
                        : (scores[i] > mean ? 1 : 0);
                probabilities[i][0] = 1 - p;
                probabilities[i][1] = p;
            }
        }
        return probabilities;
    }

    /**
     * @return the anomaly scores of the training rows
     */
    public double[] getDecisionScores() {
        return Arrays.copyOf(decisionScores, decisionScores.length);
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return the binary labels of the training rows, 1 for anomalies
     */
    public int[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public double getContamination() {
        return contamination;
    }

    public int getDimensions() {
        return leftReferences.length;
    }

    public int getNumberOfTrainingSamples() {
        return decisionScores.length;
    }

    /**
     * @param feature feature index
     * @param tail    the tail
     * @return the frozen reference distribution of the feature for the tail
     */
    public EmpiricalCDF getReference(int feature, Tail tail) {
        checkArgument(feature >= 0 && feature < leftReferences.length, "feature index out of range");
        return (tail == Tail.LEFT) ? leftReferences[feature] : rightReferences[feature];
    }

    public AbstractScoringExecutor getExecutor() {
        return executor;
    }

    static double[][] featureScores(AbstractScoringExecutor executor, EmpiricalCDF[] leftReferences,
            EmpiricalCDF[] rightReferences, double[][] points) {
        double[][] left = executor.tailProbabilities(leftReferences, points, Tail.LEFT);
        double[][] right = executor.tailProbabilities(rightReferences, points, Tail.RIGHT);
        return executor.extremities(left, right);
    }

    private void checkQuery(double[][] points) {
        int dimensions = ArrayUtils.checkMatrix(points, 1);
        checkInput(dimensions == getDimensions(),
                String.format("expected %d features, found %d", getDimensions(), dimensions));
    }

    private static double clip(double p) {
        return Math.min(1, Math.max(0, p));
    }
}
