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

package com.amazon.anomalyscore.copula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class EmpiricalCdfTest {

    @Test
    public void testProbability() {
        EmpiricalCdf cdf = new EmpiricalCdf(new double[] { 3, 1, 2, 2 });
        assertEquals(4, cdf.size());
        assertEquals(0.0, cdf.probability(0.5));
        assertEquals(0.25, cdf.probability(1));
        assertEquals(0.75, cdf.probability(2));
        assertEquals(0.75, cdf.probability(2.5));
        assertEquals(1.0, cdf.probability(3));
        assertEquals(1.0, cdf.probability(10));
    }

    @Test
    public void testEmptySample() {
        assertThrows(IllegalArgumentException.class, () -> new EmpiricalCdf(new double[0]));
    }
}
