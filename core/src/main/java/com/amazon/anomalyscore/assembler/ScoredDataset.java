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

package com.amazon.anomalyscore.assembler;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.formatScore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.returntypes.AnomalyResult;
import com.amazon.anomalyscore.returntypes.DetectionSummary;

/**
 * The original table with the score and contributor columns appended, in the
 * original row order.
 */
@Getter
public class ScoredDataset {

    public static final String SCORE_COLUMN = "anomaly_score_0_100";

    public static final String CONTRIBUTORS_COLUMN = "top_contributors";

    private final Dataset dataset;

    private final List<AnomalyResult> results;

    private final DetectionSummary summary;

    public ScoredDataset(Dataset dataset, List<AnomalyResult> results, DetectionSummary summary) {
        checkArgument(dataset.getRowCount() == results.size(), "one result per row is required");
        this.dataset = dataset;
        this.results = Collections.unmodifiableList(results);
        this.summary = summary;
    }

    /**
     * @return the original column names followed by the two appended columns
     */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(dataset.getColumnNames());
        names.add(SCORE_COLUMN);
        names.add(CONTRIBUTORS_COLUMN);
        return names;
    }

    /**
     * @param row the row index
     * @return the raw cells of the row followed by the formatted score and
     *         contributors
     */
    public String[] getRow(int row) {
        String[] raw = dataset.getRawRow(row);
        String[] cells = Arrays.copyOf(raw, raw.length + 2);
        AnomalyResult result = results.get(row);
        cells[raw.length] = formatScore(result.getScore());
        cells[raw.length + 1] = result.getContributorString();
        return cells;
    }

    public int getRowCount() {
        return results.size();
    }
}
