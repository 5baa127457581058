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

import static com.amazon.anomalyscore.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * Empirical quantiles with linear interpolation between the closest ranks: the
 * q-quantile of n sorted values sits at position (n - 1) * q.
 */
public class Quantiles {

    private Quantiles() {
    }

    /**
     * @param values the values, possibly containing NaN for missing entries
     * @return a sorted copy without missing entries
     */
    public static double[] sortedPresent(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
    }

    /**
     * @param sorted   sorted values without missing entries
     * @param quantile the quantile in [0, 1]
     * @return the interpolated quantile, NaN for an empty input
     */
    public static double quantile(double[] sorted, double quantile) {
        checkArgument(quantile >= 0 && quantile <= 1, "quantile should be in [0, 1]");
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double position = (sorted.length - 1) * quantile;
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        if (fraction == 0) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
