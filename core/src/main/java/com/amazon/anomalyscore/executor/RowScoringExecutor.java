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

package com.amazon.anomalyscore.executor;

import java.util.List;
import java.util.function.IntFunction;

import com.amazon.anomalyscore.returntypes.AnomalyResult;

/**
 * Scores the rows of a dataset. Rows are independent of each other once the
 * run-wide statistics (and any fitted model) exist, so implementations are free
 * to score them in any order, but must return the results in row order.
 */
public abstract class RowScoringExecutor {

    /**
     * @param rowCount  the number of rows
     * @param rowScorer computes the result of the row with the given index
     * @return the results, in row order
     */
    public abstract List<AnomalyResult> scoreRows(int rowCount, IntFunction<AnomalyResult> rowScorer);
}
