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

import static com.amazon.anomalyscore.CommonUtils.MAX_SCORE;
import static com.amazon.anomalyscore.CommonUtils.clampScore;
import static com.amazon.anomalyscore.CommonUtils.scaledZScore;

import java.util.List;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.copula.CopulaOutlierModel;
import com.amazon.anomalyscore.copula.IOutlierModel;
import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.errors.DependencyUnavailableException;
import com.amazon.anomalyscore.errors.DetectorRuntimeException;
import com.amazon.anomalyscore.ranker.ContributionRanker;
import com.amazon.anomalyscore.returntypes.AnomalyResult;
import com.amazon.anomalyscore.statistics.Deviation;
import com.amazon.anomalyscore.statistics.FeatureStatistics;

/**
 * Scores rows jointly over all features. Missing values are replaced by the
 * feature mean, an outlier model is fit on the complete matrix, and its decision
 * scores are rescaled so that the smallest score of the run maps to 0 and the
 * largest to 100. When all decision scores are equal every row scores 0.
 *
 * The contributors of a row are feature local: each feature's absolute z-score
 * times 25, so a z-score of 4 saturates.
 *
 * Any failure of the model fails the whole tier; there is no per-feature
 * fallback here.
 */
@Slf4j
public class MultivariateOutlierDetector implements IDetector {

    /**
     * the z-score that maps to a full contribution
     */
    public static final double CONTRIBUTION_FULL_SCALE_Z_SCORE = 4.0;

    private final Supplier<? extends IOutlierModel> modelFactory;

    public MultivariateOutlierDetector() {
        this(CopulaOutlierModel::new);
    }

    /**
     * @param modelFactory creates a fresh model for each run, null when no model
     *                     is present
     */
    public MultivariateOutlierDetector(Supplier<? extends IOutlierModel> modelFactory) {
        this.modelFactory = modelFactory;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ML;
    }

    @Override
    public boolean isAvailable() {
        return modelFactory != null;
    }

    @Override
    public List<AnomalyResult> detect(DetectionContext context) {
        if (!isAvailable()) {
            throw new DependencyUnavailableException("no multivariate outlier model is available");
        }
        Dataset dataset = context.getDataset();
        if (dataset.hasMissingValues()) {
            context.getListener().onLine("Handling missing values");
        }
        double[][] points = impute(dataset, context.getStatistics());

        double[] decisionScores;
        try {
            IOutlierModel model = modelFactory.get();
            model.fit(points);
            decisionScores = model.decisionFunction(points);
        } catch (RuntimeException e) {
            throw new DetectorRuntimeException("outlier model failed: " + e.getMessage(), e);
        }
        if (decisionScores == null || decisionScores.length != points.length) {
            throw new DetectorRuntimeException("outlier model returned the wrong number of scores");
        }
        double[] scores = rescale(decisionScores);

        int dimensions = dataset.getFeatureCount();
        double[] means = new double[dimensions];
        double[] deviations = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            Deviation deviation = new Deviation();
            for (double[] point : points) {
                deviation.update(point[j]);
            }
            means[j] = deviation.getMean();
            deviations[j] = deviation.getDeviation();
        }
        log.debug("fitted outlier model on {} points with {} dimensions", points.length, dimensions);

        return context.getExecutor().scoreRows(points.length, row -> {
            double[] subScores = new double[dimensions];
            for (int j = 0; j < dimensions; j++) {
                subScores[j] = scaledZScore(points[row][j], means[j], deviations[j], CONTRIBUTION_FULL_SCALE_Z_SCORE);
            }
            return new AnomalyResult(scores[row], ContributionRanker.rank(dataset.getFeatureNames(), subScores));
        });
    }

    /**
     * Builds the row-major feature matrix, replacing each missing value by the
     * mean of its feature.
     *
     * @param dataset    the dataset
     * @param statistics the statistics of the dataset
     * @return the complete matrix
     * @throws DetectorRuntimeException if a feature has no value at all
     */
    static double[][] impute(Dataset dataset, FeatureStatistics statistics) {
        double[][] points = new double[dataset.getRowCount()][dataset.getFeatureCount()];
        for (int j = 0; j < dataset.getFeatureCount(); j++) {
            double mean = statistics.get(j).getMean();
            for (int i = 0; i < points.length; i++) {
                double value = dataset.getValue(j, i);
                points[i][j] = Double.isNaN(value) ? mean : value;
                if (!Double.isFinite(points[i][j])) {
                    throw new DetectorRuntimeException(String.format(
                            "feature '%s' has no finite value to impute on data row %d", dataset.getFeatureName(j),
                            i + 1));
                }
            }
        }
        return points;
    }

    /**
     * Rescales decision scores linearly onto [0, 100] with the observed minimum
     * and maximum.
     *
     * @param decisionScores the raw scores
     * @return the rescaled scores, all 0 when minimum equals maximum
     */
    static double[] rescale(double[] decisionScores) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double score : decisionScores) {
            if (!Double.isFinite(score)) {
                throw new DetectorRuntimeException("outlier model returned a non-finite decision score");
            }
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        double[] scores = new double[decisionScores.length];
        if (max > min) {
            for (int i = 0; i < scores.length; i++) {
                scores[i] = clampScore((decisionScores[i] - min) / (max - min) * MAX_SCORE);
            }
        }
        return scores;
    }
}
