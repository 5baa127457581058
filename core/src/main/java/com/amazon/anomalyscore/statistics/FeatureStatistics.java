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
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.errors.SchemaException;

/**
 * Per-feature mean, population standard deviation and quartiles of a dataset.
 * Computed once at the start of a detection run and read-only afterwards; every
 * run computes its own instance.
 */
public class FeatureStatistics {

    private final List<FeatureSummary> summaries;

    FeatureStatistics(List<FeatureSummary> summaries) {
        this.summaries = Collections.unmodifiableList(summaries);
    }

    /**
     * Computes the statistics of every feature column.
     *
     * @param dataset the dataset
     * @return the statistics, one summary per feature in column order
     * @throws SchemaException if the dataset has no feature column
     */
    public static FeatureStatistics compute(Dataset dataset) {
        checkNotNull(dataset, "dataset should not be null");
        if (dataset.getFeatureCount() == 0) {
            throw new SchemaException("No feature columns found");
        }
        List<FeatureSummary> summaries = new ArrayList<>(dataset.getFeatureCount());
        for (int feature = 0; feature < dataset.getFeatureCount(); feature++) {
            summaries.add(summarize(dataset.getFeatureName(feature), dataset.getFeatureValues(feature)));
        }
        return new FeatureStatistics(summaries);
    }

    /**
     * Summarizes a single column.
     *
     * @param featureName the name of the feature
     * @param values      the values, NaN when missing
     * @return the summary
     */
    public static FeatureSummary summarize(String featureName, double[] values) {
        Deviation deviation = new Deviation();
        deviation.update(values);
        if (deviation.isEmpty()) {
            return new FeatureSummary(featureName, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        double[] sorted = Quantiles.sortedPresent(values);
        return new FeatureSummary(featureName, deviation.getMean(), deviation.getDeviation(),
                Quantiles.quantile(sorted, 0.25), Quantiles.quantile(sorted, 0.75));
    }

    public int getFeatureCount() {
        return summaries.size();
    }

    public FeatureSummary get(int feature) {
        checkArgument(feature >= 0 && feature < summaries.size(), "incorrect feature index");
        return summaries.get(feature);
    }

    public List<FeatureSummary> getSummaries() {
        return summaries;
    }
}
