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

package com.amazon.ecod.threshold;

/**
 * Turns a vector of training anomaly scores into a decision threshold and
 * binary labels.
 */
public interface IThresholder {

    /**
     * @param scores        training anomaly scores, higher is more abnormal
     * @param contamination expected fraction of anomalies in {@code (0, 0.5]}
     * @return the threshold and the labels of the scored rows
     */
    Calibration calibrate(double[] scores, double contamination);
}
