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

package com.amazon.anomalyscore.dataset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.format.DateTimeParseException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class TimeOrdinatesTest {

    private static final double JAN_1_2024 = 1704067200000.0;

    @Test
    public void testParse() {
        assertEquals(42.0, TimeOrdinates.parse("42"));
        assertEquals(-1.5, TimeOrdinates.parse(" -1.5 "));
        assertEquals(JAN_1_2024, TimeOrdinates.parse("2024-01-01"));
        assertEquals(JAN_1_2024 + 60_000, TimeOrdinates.parse("2024-01-01T00:01"));
        assertEquals(JAN_1_2024 + 3_600_000, TimeOrdinates.parse("2024-01-01 01:00:00"));
        assertEquals(JAN_1_2024, TimeOrdinates.parse("2024-01-01T02:00:00+02:00"));
        assertEquals(JAN_1_2024, TimeOrdinates.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    public void testParseCompactOffset() {
        assertEquals(JAN_1_2024, TimeOrdinates.parse("2024-01-01T02:00+0200"));
        assertEquals(JAN_1_2024 + 36_000_123, TimeOrdinates.parse("2024-01-01 10:00:00.123456789+0000"));
    }

    @Test
    public void testParseYearFirstSlashes() {
        assertEquals(JAN_1_2024, TimeOrdinates.parse("2024/01/01"));
        assertEquals(JAN_1_2024 + 36_000_000, TimeOrdinates.parse("2024/1/1 10:00"));
        assertEquals(JAN_1_2024 + 36_030_000, TimeOrdinates.parse("2024/01/01 10:00:30"));
    }

    @Test
    public void testParseMonthFirstSlashes() {
        assertEquals(JAN_1_2024 + 86_400_000, TimeOrdinates.parse("01/02/2024"));
        assertEquals(JAN_1_2024 + 86_400_000 + 36_000_000, TimeOrdinates.parse("01/02/2024 10:00"));
        assertEquals(JAN_1_2024 + 36_030_000, TimeOrdinates.parse("1/1/2024 10:00:30"));
    }

    @Test
    public void testParseFailure() {
        assertThrows(DateTimeParseException.class, () -> TimeOrdinates.parse("yesterday"));
        assertThrows(DateTimeParseException.class, () -> TimeOrdinates.parse("2024-13-01"));
        assertThrows(DateTimeParseException.class, () -> TimeOrdinates.parse("13/45/2024"));
        assertThrows(DateTimeParseException.class, () -> TimeOrdinates.parse("0x1p3"));
    }

    @Test
    public void testOf() {
        Dataset dataset = new Dataset(Arrays.asList("timestamp", "cpu"), "timestamp",
                Arrays.asList(new String[] { "3", "1" }, new String[] { "1", "2" }));
        assertArrayEquals(new double[] { 3, 1 }, TimeOrdinates.of(dataset));
    }

    @Test
    public void testOfQuotedTimestamps() {
        Dataset dataset = new Dataset(Arrays.asList("timestamp", "cpu"), "timestamp",
                Arrays.asList(new String[] { "\"2024/01/01\"", "1" }, new String[] { " \"01/02/2024\" ", "2" }));
        assertArrayEquals(new double[] { JAN_1_2024, JAN_1_2024 + 86_400_000 }, TimeOrdinates.of(dataset));
    }
}
