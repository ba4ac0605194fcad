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

package com.amazon.ecod.cdf;

/**
 * The two tails of a feature distribution. The right tail is evaluated as the
 * left tail of the negated values, so that a single {@link EmpiricalCDF}
 * implementation serves both.
 */
public enum Tail {

    LEFT(1.0),

    RIGHT(-1.0);

    private final double orientation;

    Tail(double orientation) {
        this.orientation = orientation;
    }

    /**
     * @param value a raw feature value
     * @return the value as seen by a reference distribution built for this tail
     */
    public double orient(double value) {
        return orientation * value;
    }
}
