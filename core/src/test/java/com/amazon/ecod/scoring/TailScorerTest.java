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

package com.amazon.ecod.scoring;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class TailScorerTest {

    @Test
    public void testNegativeLog() {
        assertEquals(0.0, TailScorer.negativeLog(1.0));
        assertEquals(Math.log(2), TailScorer.negativeLog(0.5), 1e-15);
        assertEquals(Math.log(10), TailScorer.negativeLog(0.1), 1e-15);
    }

    @Test
    public void testNegativeLogRejectsInvalidProbability() {
        assertThrows(IllegalArgumentException.class, () -> TailScorer.negativeLog(0.0));
        assertThrows(IllegalArgumentException.class, () -> TailScorer.negativeLog(1.5));
        assertThrows(IllegalArgumentException.class, () -> TailScorer.negativeLog(Double.NaN));
    }

    @Test
    public void testExtremityIsSymmetric() {
        assertEquals(TailScorer.extremity(0.1, 0.9), TailScorer.extremity(0.9, 0.1));
        assertEquals(Math.log(10), TailScorer.extremity(0.1, 1.0), 1e-15);
        assertEquals(Math.log(2), TailScorer.extremity(0.5, 0.6), 1e-15);
        assertEquals(0.0, TailScorer.extremity(1.0, 1.0));
    }

    @Test
    public void testExtremities() {
        double[] result = TailScorer.extremities(new double[] { 1.0, 0.25 }, new double[] { 0.5, 1.0 });
        assertArrayEquals(new double[] { Math.log(2), Math.log(4) }, result, 1e-15);
        assertThrows(IllegalArgumentException.class,
                () -> TailScorer.extremities(new double[] { 1.0 }, new double[] { 1.0, 1.0 }));
    }
}
