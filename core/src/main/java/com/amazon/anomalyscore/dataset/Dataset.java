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
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import lombok.Getter;

import com.amazon.anomalyscore.errors.SchemaException;

/**
 * An ordered, already loaded table. Row order is time order. Exactly one column
 * is the timestamp; every other column is a numeric feature. The raw cell text
 * is retained so that the scored output reproduces the input cells verbatim.
 *
 * Feature values are stored column-major; a missing cell is {@code Double.NaN}.
 */
public class Dataset {

    static final char QUOTE = '"';

    // plain decimal or scientific notation, without Java type suffixes or hex
    static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    @Getter
    private final List<String> columnNames;

    @Getter
    private final String timestampColumn;

    private final int timestampIndex;

    private final List<String> featureNames;

    private final int[] featureColumnIndices;

    private final List<String[]> rawRows;

    // values[feature][row]
    private final double[][] values;

    /**
     * Creates a dataset from its header and already split rows.
     *
     * @param columnNames     the header
     * @param timestampColumn the name of the timestamp column
     * @param rawRows         the data rows, each with one cell per header column
     * @throws SchemaException if the timestamp column is missing, no feature
     *                         column exists, a row is ragged, or a feature cell is
     *                         not numeric
     */
    public Dataset(List<String> columnNames, String timestampColumn, List<String[]> rawRows) {
        checkNotNull(columnNames, "column names should not be null");
        checkNotNull(timestampColumn, "timestamp column should not be null");
        checkNotNull(rawRows, "rows should not be null");
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.timestampColumn = timestampColumn;
        this.timestampIndex = columnNames.indexOf(timestampColumn);
        if (timestampIndex < 0) {
            throw new SchemaException(String.format("Column '%s' not found, available columns: %s", timestampColumn,
                    columnNames));
        }

        List<String> features = new ArrayList<>();
        int[] indices = new int[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            if (i != timestampIndex) {
                indices[features.size()] = i;
                features.add(columnNames.get(i));
            }
        }
        if (features.isEmpty()) {
            throw new SchemaException("No feature columns found besides timestamp column '" + timestampColumn + "'");
        }
        this.featureNames = Collections.unmodifiableList(features);
        this.featureColumnIndices = Arrays.copyOf(indices, features.size());

        this.rawRows = new ArrayList<>(rawRows.size());
        this.values = new double[features.size()][rawRows.size()];
        for (int row = 0; row < rawRows.size(); row++) {
            String[] cells = rawRows.get(row);
            if (cells.length != columnNames.size()) {
                throw new SchemaException(String.format("Wrong number of values on data row %d. Expected %d but found %d.",
                        row + 1, columnNames.size(), cells.length));
            }
            this.rawRows.add(Arrays.copyOf(cells, cells.length));
            for (int feature = 0; feature < featureColumnIndices.length; feature++) {
                values[feature][row] = parseCell(cells[featureColumnIndices[feature]], featureNames.get(feature),
                        row + 1);
            }
        }
    }

    static double parseCell(String cell, String feature, int rowNumber) {
        String text = unquote(cell);
        if (isMissing(text)) {
            return Double.NaN;
        }
        if (!DECIMAL.matcher(text).matches()) {
            throw new SchemaException(String.format("Feature column '%s' has non-numeric value '%s' on data row %d",
                    feature, cell, rowNumber));
        }
        return Double.parseDouble(text);
    }

    /**
     * @param cell a raw cell
     * @return the trimmed cell, without its enclosing quotes and with doubled
     *         quotes collapsed when it is quoted
     */
    public static String unquote(String cell) {
        String trimmed = cell.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == QUOTE && trimmed.charAt(trimmed.length() - 1) == QUOTE) {
            return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
        }
        return trimmed;
    }

    static boolean isMissing(String trimmed) {
        return trimmed.isEmpty() || "na".equalsIgnoreCase(trimmed) || "nan".equalsIgnoreCase(trimmed)
                || "null".equalsIgnoreCase(trimmed);
    }

    /**
     * @return the number of data rows
     */
    public int getRowCount() {
        return rawRows.size();
    }

    /**
     * @return the number of feature columns
     */
    public int getFeatureCount() {
        return featureNames.size();
    }

    /**
     * @return the feature names in column order
     */
    public List<String> getFeatureNames() {
        return featureNames;
    }

    public String getFeatureName(int feature) {
        return featureNames.get(feature);
    }

    /**
     * @param feature the feature index, in column order
     * @param row     the row index
     * @return the value, NaN when the cell is missing
     */
    public double getValue(int feature, int row) {
        return values[feature][row];
    }

    /**
     * @param feature the feature index
     * @return a copy of the feature column in row order
     */
    public double[] getFeatureValues(int feature) {
        checkArgument(feature >= 0 && feature < values.length, "incorrect feature index");
        return Arrays.copyOf(values[feature], values[feature].length);
    }

    /**
     * @param row the row index
     * @return the text of the timestamp cell, unquoted
     */
    public String getTimestamp(int row) {
        return unquote(rawRows.get(row)[timestampIndex]);
    }

    /**
     * @param row the row index
     * @return a copy of the raw cells of the row, in header order
     */
    public String[] getRawRow(int row) {
        String[] cells = rawRows.get(row);
        return Arrays.copyOf(cells, cells.length);
    }

    public boolean hasMissingValues() {
        for (double[] column : values) {
            for (double value : column) {
                if (Double.isNaN(value)) {
                    return true;
                }
            }
        }
        return false;
    }
}
