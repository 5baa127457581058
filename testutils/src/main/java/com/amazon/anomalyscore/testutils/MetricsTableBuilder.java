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

package com.amazon.anomalyscore.testutils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Builds delimited metric tables for tests: a header row, a timestamp column and
 * any number of feature columns.
 *
 * <pre>
 * Path input = new MetricsTableBuilder("cpu_usage").row("45").row("50").write(dir.resolve("in.csv"));
 * </pre>
 */
public class MetricsTableBuilder {

    public static final String TIMESTAMP_COLUMN = "timestamp";

    public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private final List<String> header;
    private final List<String[]> rows = new ArrayList<>();
    private String delimiter = ",";
    private boolean automaticTimestamps = true;

    public MetricsTableBuilder(String... featureNames) {
        header = new ArrayList<>();
        header.add(TIMESTAMP_COLUMN);
        header.addAll(Arrays.asList(featureNames));
    }

    /**
     * Creates a builder with an explicit header; rows then have to supply every
     * cell, including the timestamp.
     *
     * @param columnNames the header
     * @return a builder without automatic timestamps
     */
    public static MetricsTableBuilder withHeader(String... columnNames) {
        MetricsTableBuilder builder = new MetricsTableBuilder();
        builder.header.clear();
        builder.header.addAll(Arrays.asList(columnNames));
        builder.automaticTimestamps = false;
        return builder;
    }

    public MetricsTableBuilder delimiter(String delimiter) {
        this.delimiter = delimiter;
        return this;
    }

    /**
     * Adds a row. With automatic timestamps the row is prefixed with one minute
     * past the previous row.
     *
     * @param cells the cells of the row
     * @return this builder
     */
    public MetricsTableBuilder row(String... cells) {
        if (automaticTimestamps) {
            String[] row = new String[cells.length + 1];
            row[0] = START.plusMinutes(rows.size()).toString();
            System.arraycopy(cells, 0, row, 1, cells.length);
            rows.add(row);
        } else {
            rows.add(cells.clone());
        }
        return this;
    }

    public MetricsTableBuilder row(double... values) {
        String[] cells = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            cells[i] = String.format(Locale.ROOT, "%.4f", values[i]);
        }
        return row(cells);
    }

    public MetricsTableBuilder rows(double[][] values) {
        for (double[] row : values) {
            row(row);
        }
        return this;
    }

    public List<String> getLines() {
        List<String> lines = new ArrayList<>();
        lines.add(String.join(delimiter, header));
        for (String[] row : rows) {
            StringJoiner joiner = new StringJoiner(delimiter);
            Arrays.stream(row).forEach(joiner::add);
            lines.add(joiner.toString());
        }
        return lines;
    }

    public String build() {
        return String.join("\n", getLines()) + "\n";
    }

    public Path write(Path path) throws IOException {
        return Files.write(path, getLines(), StandardCharsets.UTF_8);
    }
}
