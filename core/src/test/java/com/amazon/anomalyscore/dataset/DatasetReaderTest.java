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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.anomalyscore.errors.SchemaException;
import com.amazon.anomalyscore.testutils.MetricsTableBuilder;

public class DatasetReaderTest {

    private static Dataset read(DatasetReader reader, String text) throws IOException {
        return reader.read(new BufferedReader(new StringReader(text)), "timestamp");
    }

    @Test
    public void testRead() throws IOException {
        Dataset dataset = read(new DatasetReader(), "timestamp, cpu ,memory\n\nt0,1,2\nt1,3,\n");

        assertThat(dataset.getColumnNames(), contains("timestamp", "cpu", "memory"));
        assertEquals(2, dataset.getRowCount());
        assertTrue(Double.isNaN(dataset.getValue(1, 1)));
        assertArrayEquals(new String[] { "t1", "3", "" }, dataset.getRawRow(1));
    }

    @Test
    public void testDelimiter() throws IOException {
        DatasetReader reader = new DatasetReader("|");
        Dataset dataset = read(reader, "timestamp|cpu\nt0|1.5\n");
        assertEquals("|", reader.getDelimiter());
        assertEquals(1.5, dataset.getValue(0, 0));
    }

    @Test
    public void testEmptyInput() {
        assertThrows(SchemaException.class, () -> read(new DatasetReader(), ""));
        assertThrows(SchemaException.class, () -> read(new DatasetReader(), "timestamp,cpu\n"));
        assertThrows(IllegalArgumentException.class, () -> new DatasetReader(""));
    }

    @Test
    public void testReadPath(@TempDir Path dir) throws IOException {
        Path input = new MetricsTableBuilder("cpu_usage").row("45").row("50").write(dir.resolve("in.csv"));
        Dataset dataset = new DatasetReader().read(input, "timestamp");
        assertEquals(2, dataset.getRowCount());
        assertEquals(50.0, dataset.getValue(0, 1));
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> new DatasetReader().read(dir.resolve("missing.csv"), "timestamp"));
    }

    @Test
    public void testByteOrderMark() throws IOException {
        Dataset dataset = read(new DatasetReader(), "\uFEFFtimestamp,cpu\nt0,1\n");
        assertThat(dataset.getColumnNames(), contains("timestamp", "cpu"));
        assertEquals(1.0, dataset.getValue(0, 0));
    }

    @Test
    public void testQuotedHeader() throws IOException {
        Dataset dataset = read(new DatasetReader(), "\"timestamp\",\"cpu, %\",\"say \"\"hi\"\"\"\nt0,1,2\n");
        assertThat(dataset.getColumnNames(), contains("timestamp", "cpu, %", "say \"hi\""));
        assertThat(dataset.getFeatureNames(), contains("cpu, %", "say \"hi\""));
    }

    @Test
    public void testQuotedCellWithDelimiter() throws IOException {
        Dataset dataset = read(new DatasetReader(), "timestamp,cpu\n\"Jan 1, 2024\",\"1.5\"\n,2\n");

        assertEquals(2, dataset.getRowCount());
        assertEquals("Jan 1, 2024", dataset.getTimestamp(0));
        assertEquals(1.5, dataset.getValue(0, 0));
        assertArrayEquals(new String[] { "\"Jan 1, 2024\"", "\"1.5\"" }, dataset.getRawRow(0));
    }

    @Test
    public void testQuotedCellWithMultiCharacterDelimiter() throws IOException {
        Dataset dataset = read(new DatasetReader("::"), "timestamp::cpu\n\"a::b\"::3\n");
        assertEquals("a::b", dataset.getTimestamp(0));
        assertEquals(3.0, dataset.getValue(0, 0));
    }

    @Test
    public void testUnterminatedQuote() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> read(new DatasetReader(), "timestamp,cpu\n\"t0,1\n"));
        assertThat(e.getMessage(), containsString("line 2"));
        assertThrows(IllegalArgumentException.class, () -> new DatasetReader("\""));
    }

    @Test
    public void testSplitKeepsQuotesAndEmptyCells() {
        assertArrayEquals(new String[] { "a", " \"b,c\" ", "", "" }, new DatasetReader().split("a, \"b,c\" ,,", 1));
        assertArrayEquals(new String[] { "5\"", "x" }, new DatasetReader().split("5\",x", 1));
    }
}
