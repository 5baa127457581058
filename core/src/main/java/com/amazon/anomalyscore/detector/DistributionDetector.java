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

import static com.amazon.anomalyscore.CommonUtils.checkNotNull;
import static com.amazon.anomalyscore.CommonUtils.clampScore;

import java.time.format.DateTimeParseException;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.dataset.TimeOrdinates;
import com.amazon.anomalyscore.errors.DependencyUnavailableException;
import com.amazon.anomalyscore.errors.DetectorRuntimeException;
import com.amazon.anomalyscore.ranker.ContributionRanker;
import com.amazon.anomalyscore.returntypes.AnomalyResult;
import com.amazon.anomalyscore.statistics.FeatureStatistics;
import com.amazon.anomalyscore.statistics.FeatureSummary;

/**
 * Scores each feature of a row by how far its value lies outside the
 * interquartile box, in units of the interquartile range; two ranges beyond the
 * box saturate the sub-score at 100. Only values flagged by the
 * {@link InterQuartileRangeTest} over the time ordered series are scored.
 *
 * A feature the test cannot evaluate is scored with the point-statistic formula
 * instead, for every row; the other features are unaffected. Timestamps that are
 * not time ordinates fail the whole tier.
 */
public class DistributionDetector implements IDetector {

    /**
     * the sub-score per interquartile range of distance from the box
     */
    public static final double SCORE_PER_RANGE = 50.0;

    @Getter
    private final InterQuartileRangeTest test;

    public DistributionDetector() {
        this(new InterQuartileRangeTest());
    }

    /**
     * @param test the sequential outlier test, null when it is not present
     */
    public DistributionDetector(InterQuartileRangeTest test) {
        this.test = test;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ADTK_STYLE;
    }

    @Override
    public boolean isAvailable() {
        return test != null;
    }

    @Override
    public List<AnomalyResult> detect(DetectionContext context) {
        if (!isAvailable()) {
            throw new DependencyUnavailableException("the interquartile range test is not available");
        }
        Dataset dataset = context.getDataset();
        FeatureStatistics statistics = context.getStatistics();

        double[] ordinates;
        try {
            ordinates = TimeOrdinates.of(dataset);
        } catch (DateTimeParseException e) {
            throw new DetectorRuntimeException(String.format("timestamp column '%s' is not a time ordinate: %s",
                    dataset.getTimestampColumn(), e.getMessage()), e);
        }

        // null marks a feature scored with the point-statistic formula
        boolean[][] flags = new boolean[dataset.getFeatureCount()][];
        for (int feature = 0; feature < flags.length; feature++) {
            try {
                flags[feature] = test.detect(dataset.getFeatureValues(feature), ordinates);
            } catch (RuntimeException e) {
                context.getDegradeLog().recordFeature(getMethod(), DetectionMethod.STATISTICAL,
                        dataset.getFeatureName(feature), e);
                flags[feature] = null;
            }
        }

        return context.getExecutor().scoreRows(dataset.getRowCount(),
                row -> scoreRow(dataset, statistics, flags, row));
    }

    AnomalyResult scoreRow(Dataset dataset, FeatureStatistics statistics, boolean[][] flags, int row) {
        double[] subScores = new double[dataset.getFeatureCount()];
        for (int feature = 0; feature < subScores.length; feature++) {
            double value = dataset.getValue(feature, row);
            FeatureSummary summary = statistics.get(feature);
            if (flags[feature] == null) {
                subScores[feature] = PointStatisticDetector.subScore(value, summary);
            } else if (flags[feature][row]) {
                subScores[feature] = subScore(value, summary);
            }
        }
        return ContributionRanker.maxOf(dataset.getFeatureNames(), subScores);
    }

    /**
     * The distance sub-score of a single value.
     *
     * @param value   the value, NaN when missing
     * @param summary the statistics of the value's feature
     * @return the sub-score in [0, 100]; 0 inside the box and for a zero range
     */
    public static double subScore(double value, FeatureSummary summary) {
        checkNotNull(summary, "summary should not be null");
        double iqr = summary.getInterquartileRange();
        if (!(iqr > 0) || Double.isNaN(value)) {
            return 0;
        }
        double distance;
        if (value < summary.getFirstQuartile()) {
            distance = (summary.getFirstQuartile() - value) / iqr;
        } else if (value > summary.getThirdQuartile()) {
            distance = (value - summary.getThirdQuartile()) / iqr;
        } else {
            distance = 0;
        }
        return clampScore(distance * SCORE_PER_RANGE);
    }
}
