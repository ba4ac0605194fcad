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
import static com.amazon.ecod.CommonUtils.checkNotNull;
import static com.amazon.ecod.CommonUtils.checkState;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ecod.cdf.EmpiricalCDF;
import com.amazon.ecod.cdf.Tail;
import com.amazon.ecod.executor.AbstractScoringExecutor;
import com.amazon.ecod.executor.ParallelScoringExecutor;
import com.amazon.ecod.executor.SequentialScoringExecutor;
import com.amazon.ecod.threshold.Calibration;
import com.amazon.ecod.threshold.ContaminationThresholder;
import com.amazon.ecod.threshold.IThresholder;
import com.amazon.ecod.util.ArrayUtils;

/**
 * Unsupervised outlier detection using empirical cumulative distribution
 * functions (ECOD).
 *
 * <p>
 * Every feature of the training data becomes its own reference sample. A value
 * is scored by how far it lies in either tail of its feature's empirical
 * distribution, measured as the negative log of the tail probability, and an
 * observation's score is the sum of these extremities over all features. There
 * are no learned parameters besides the reference samples themselves.
 *
 * <p>
 * An {@code ECOD} instance only holds configuration. {@link #fit(double[][])}
 * returns an immutable {@link ECODModel} which scores new observations against
 * the frozen training references; the detector itself can be reused to fit
 * other data sets.
 *
 * <pre>
 * ECODModel model = ECOD.builder().contamination(0.05).build().fit(trainingData);
 * double[] scores = model.decisionFunction(newData);
 * int[] labels = model.predict(newData);
 * </pre>
 */
public class ECOD {

    private static final Logger log = LoggerFactory.getLogger(ECOD.class);

    /**
     * Default expected fraction of anomalies.
     */
    public static final double DEFAULT_CONTAMINATION = 0.1;

    /**
     * Parallel execution is disabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * Fewer training rows give no meaningful tail statistics.
     */
    public static final int MIN_TRAINING_ROWS = 2;

    /**
     * The expected fraction of anomalies in the training data.
     */
    protected final double contamination;

    /**
     * Enable parallel execution.
     */
    protected final boolean parallelExecutionEnabled;

    /**
     * Number of threads to use in the thread pool if parallel execution is enabled.
     */
    protected final int threadPoolSize;

    /**
     * Calibrates the training scores into a threshold and labels.
     */
    protected final IThresholder thresholder;

    protected ECOD(Builder<?> builder) {
        ContaminationThresholder.checkContamination(builder.contamination);
        builder.threadPoolSize.ifPresent(n -> checkArgument((n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. To disable thread pool, set parallel execution to 'false'."));

        contamination = builder.contamination;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        thresholder = checkNotNull(builder.thresholder, "thresholder must not be null");

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        } else {
            threadPoolSize = 0;
        }
    }

    /**
     * @return a new ECOD builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a detector with every option set to its default value.
     */
    public static ECOD defaultDetector() {
        return builder().build();
    }

    /**
     * Builds the per-feature reference distributions from the training data,
     * scores every training row against them and calibrates the scores.
     *
     * @param points training matrix, at least 2 rows and 1 column, all finite
     * @return the fitted model
     * @throws InvalidInputException if the matrix is structurally invalid
     */
    public ECODModel fit(double[][] points) {
        int dimensions = ArrayUtils.checkMatrix(points, MIN_TRAINING_ROWS);

        EmpiricalCDF[] leftReferences = new EmpiricalCDF[dimensions];
        EmpiricalCDF[] rightReferences = new EmpiricalCDF[dimensions];
        for (int f = 0; f < dimensions; f++) {
            double[] column = ArrayUtils.column(points, f, false);
            leftReferences[f] = EmpiricalCDF.forTail(column, Tail.LEFT);
            rightReferences[f] = EmpiricalCDF.forTail(column, Tail.RIGHT);
        }

        AbstractScoringExecutor executor = createExecutor();
        double[] scores = executor.aggregate(ECODModel.featureScores(executor, leftReferences, rightReferences, points));

        Calibration calibration = thresholder.calibrate(scores, contamination);
        checkState(calibration.getLabels().length == scores.length, "thresholder returned the wrong number of labels");
        log.debug("fitted ECOD on {} rows and {} features, threshold {} labels {} anomalies", points.length,
                dimensions, calibration.getThreshold(), calibration.getNumberOfAnomalies());

        return new ECODModel(leftReferences, rightReferences, scores, calibration, contamination, executor);
    }

    /**
     * Fit detector. Labels are ignored, the method is unsupervised; the overload
     * exists for symmetry with supervised estimators.
     *
     * @param points training matrix
     * @param labels ignored
     * @return the fitted model
     */
    public ECODModel fit(double[][] points, int[] labels) {
        return fit(points);
    }

    /**
     * @param points training matrix
     * @return the binary labels of the training rows, 1 for anomalies
     */
    public int[] fitPredict(double[][] points) {
        return fit(points).getLabels();
    }

    AbstractScoringExecutor createExecutor() {
        if (parallelExecutionEnabled) {
            log.debug("using parallel scoring with {} threads", threadPoolSize);
            return new ParallelScoringExecutor(threadPoolSize);
        }
        return new SequentialScoringExecutor();
    }

    public double getContamination() {
        return contamination;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public IThresholder getThresholder() {
        return thresholder;
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private double contamination = DEFAULT_CONTAMINATION;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private IThresholder thresholder = new ContaminationThresholder();

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T thresholder(IThresholder thresholder) {
            this.thresholder = thresholder;
            return (T) this;
        }

        public ECOD build() {
            return new ECOD(this);
        }
    }
}
