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

package com.amazon.ecod.examples;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class MainTest {

    @Test
    public void testRegisteredExamples() {
        Main main = new Main();
        assertEquals(5, main.getExamples().size());
        assertDoesNotThrow(() -> main.run(new String[] { "--help" }));
        assertThrows(IllegalArgumentException.class, () -> main.run(new String[] { "no-such-example" }));
    }

    @Test
    public void testExamplesRun() {
        for (Example example : new Main().getExamples().values()) {
            assertDoesNotThrow(example::run, example.command());
        }
    }
}
