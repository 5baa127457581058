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

package com.amazon.anomalyscore.detector;

import static com.amazon.anomalyscore.CommonUtils.scaledZScore;

import java.util.List;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.ranker.ContributionRanker;
import com.amazon.anomalyscore.returntypes.AnomalyResult;
import com.amazon.anomalyscore.statistics.FeatureStatistics;
import com.amazon.anomalyscore.statistics.FeatureSummary;

/**
 * Scores each feature of a row by its z-score against the dataset mean and
 * standard deviation; a z-score of 3 saturates the sub-score at 100. The row
 * score is the largest sub-score.
 *
 * This tier is always available and is the end of every fallback chain; it
 * never defers to another tier.
 */
public class PointStatisticDetector implements IDetector {

    /**
     * the z-score that maps to a full score
     */
    public static final double FULL_SCALE_Z_SCORE = 3.0;

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<AnomalyResult> detect(DetectionContext context) {
        Dataset dataset = context.getDataset();
        FeatureStatistics statistics = context.getStatistics();
        return context.getExecutor().scoreRows(dataset.getRowCount(), row -> scoreRow(dataset, statistics, row));
    }

    AnomalyResult scoreRow(Dataset dataset, FeatureStatistics statistics, int row) {
        double[] subScores = new double[dataset.getFeatureCount()];
        for (int feature = 0; feature < subScores.length; feature++) {
            subScores[feature] = subScore(dataset.getValue(feature, row), statistics.get(feature));
        }
        return ContributionRanker.maxOf(dataset.getFeatureNames(), subScores);
    }

    /**
     * The point-statistic sub-score of a single value. Also used by the
     * distribution tier for a feature it could not evaluate.
     *
     * @param value   the value, NaN when missing
     * @param summary the statistics of the value's feature
     * @return the sub-score in [0, 100]; 0 for a constant feature
     */
    public static double subScore(double value, FeatureSummary summary) {
        return scaledZScore(value, summary.getMean(), summary.getDeviation(), FULL_SCALE_Z_SCORE);
    }
}
