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

import static com.amazon.anomalyscore.CommonUtils.checkArgument;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscore.errors.SchemaException;

/**
 * Reads a delimited text table with a header row into a {@link Dataset}. Lines
 * are split on the literal delimiter, except inside double-quoted cells, where a
 * doubled quote stands for one quote. A leading byte order mark is dropped and
 * blank lines are skipped.
 */
public class DatasetReader {

    public static final String DEFAULT_DELIMITER = ",";

    static final char BYTE_ORDER_MARK = '\uFEFF';

    @Getter
    private final String delimiter;

    public DatasetReader() {
        this(DEFAULT_DELIMITER);
    }

    public DatasetReader(String delimiter) {
        checkArgument(delimiter != null && !delimiter.isEmpty(), "delimiter should be a non-empty string");
        checkArgument(!delimiter.contains(String.valueOf(Dataset.QUOTE)), "delimiter should not contain a quote");
        this.delimiter = delimiter;
    }

    /**
     * Reads the table stored at the given location.
     *
     * @param path            the input file
     * @param timestampColumn the timestamp column name
     * @return the dataset
     * @throws IOException     if the file cannot be read
     * @throws SchemaException if the table does not have a scorable shape
     */
    public Dataset read(Path path, String timestampColumn) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in, timestampColumn);
        }
    }

    public Dataset read(BufferedReader in, String timestampColumn) throws IOException {
        List<String> header = null;
        List<String[]> rows = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = split(line, lineNumber);
            if (header == null) {
                header = unquoteAll(values);
            } else {
                rows.add(values);
            }
        }

        if (header == null) {
            throw new SchemaException("Input table is empty, a header row is required");
        }
        Dataset dataset = new Dataset(header, timestampColumn, rows);
        if (dataset.getRowCount() == 0) {
            throw new SchemaException("Input table has a header but no data rows");
        }
        return dataset;
    }

    /**
     * Splits a line into its cells. Quoted cells keep their quotes so that they
     * can be written back verbatim; {@link Dataset#unquote} yields their value.
     *
     * @param line       the line
     * @param lineNumber the line number, for error messages
     * @return the cells, including trailing empty ones
     * @throws SchemaException if a quoted cell is not closed on the same line
     */
    String[] split(String line, int lineNumber) {
        List<String> cells = new ArrayList<>();
        int start = 0;
        int i = 0;
        boolean quoted = false;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == Dataset.QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == Dataset.QUOTE) {
                        i++;
                    } else {
                        quoted = false;
                    }
                }
                i++;
            } else if (c == Dataset.QUOTE && line.substring(start, i).trim().isEmpty()) {
                quoted = true;
                i++;
            } else if (line.startsWith(delimiter, i)) {
                cells.add(line.substring(start, i));
                i += delimiter.length();
                start = i;
            } else {
                i++;
            }
        }
        if (quoted) {
            throw new SchemaException(String.format("Unterminated quoted cell on line %d", lineNumber));
        }
        cells.add(line.substring(start));
        return cells.toArray(new String[0]);
    }

    private static List<String> unquoteAll(String[] values) {
        List<String> result = new ArrayList<>(values.length);
        for (String value : values) {
            result.add(Dataset.unquote(value));
        }
        return result;
    }
}
