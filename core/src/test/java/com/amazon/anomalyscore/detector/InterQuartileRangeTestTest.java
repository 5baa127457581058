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

package com.amazon.anomalyscore.detector;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.anomalyscore.errors.DetectorRuntimeException;

public class InterQuartileRangeTestTest {

    private static final double[] ORDINATES = { 1, 2, 3, 4, 5 };

    @Test
    public void testQuartileBounds() {
        boolean[] flags = new InterQuartileRangeTest().detect(new double[] { 1, 2, 3, 4, 100 }, ORDINATES);
        assertArrayEquals(new boolean[] { true, false, false, false, true }, flags);
    }

    @Test
    public void testWhiskerFactor() {
        boolean[] flags = new InterQuartileRangeTest(1.5).detect(new double[] { 1, 2, 3, 4, 100 }, ORDINATES);
        assertArrayEquals(new boolean[] { false, false, false, false, true }, flags);
    }

    @Test
    public void testFlagsFollowInputOrder() {
        double[] reversed = { 5, 4, 3, 2, 1 };
        boolean[] flags = new InterQuartileRangeTest(1.5).detect(new double[] { 100, 4, 3, 2, 1 }, reversed);
        assertArrayEquals(new boolean[] { true, false, false, false, false }, flags);
    }

    @Test
    public void testMissingValuesAreNotFlagged() {
        boolean[] flags = new InterQuartileRangeTest().detect(new double[] { Double.NaN, 2, 3, 4, 100 }, ORDINATES);
        assertArrayEquals(new boolean[] { false, true, false, false, true }, flags);
    }

    @Test
    public void testInvalidInput() {
        assertThrows(DetectorRuntimeException.class, () -> new InterQuartileRangeTest()
                .detect(new double[] { 1, 2, Double.POSITIVE_INFINITY, 4, 5 }, ORDINATES));
        assertThrows(IllegalArgumentException.class,
                () -> new InterQuartileRangeTest().detect(new double[] { 1 }, ORDINATES));
        assertThrows(IllegalArgumentException.class, () -> new InterQuartileRangeTest(-1));
    }
}
