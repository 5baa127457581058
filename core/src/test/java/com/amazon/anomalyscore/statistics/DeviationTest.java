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

package com.amazon.anomalyscore.statistics;

import static com.amazon.anomalyscore.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class DeviationTest {

    @Test
    public void testPopulationDeviation() {
        Deviation deviation = new Deviation();
        deviation.update(new double[] { 45, 50, 95, 48 });

        assertEquals(4, deviation.getCount());
        assertEquals(59.5, deviation.getMean(), EPSILON);
        assertEquals(Math.sqrt(423.25), deviation.getDeviation(), EPSILON);
    }

    @Test
    public void testMissingValuesAreSkipped() {
        Deviation deviation = new Deviation();
        deviation.update(new double[] { 1, Double.NaN, 3 });
        assertEquals(2, deviation.getCount());
        assertEquals(2.0, deviation.getMean(), EPSILON);
        assertEquals(1.0, deviation.getDeviation(), EPSILON);
    }

    @Test
    public void testConstantValues() {
        Deviation deviation = new Deviation();
        deviation.update(new double[] { 7, 7, 7 });
        assertEquals(0.0, deviation.getDeviation());
    }

    @Test
    public void testEmpty() {
        Deviation deviation = new Deviation();
        assertTrue(deviation.isEmpty());
        assertThrows(IllegalStateException.class, deviation::getMean);
        assertThrows(IllegalStateException.class, deviation::getDeviation);
    }

    @Test
    public void testMatchesTwoPassComputation() {
        Random random = new Random(17);
        double[] values = new double[1000];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            values[i] = 1e6 + random.nextGaussian();
            sum += values[i];
        }
        double mean = sum / values.length;
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }

        Deviation deviation = new Deviation();
        deviation.update(values);
        assertEquals(mean, deviation.getMean(), 1e-6);
        assertEquals(Math.sqrt(squares / values.length), deviation.getDeviation(), 1e-6);
    }
}
