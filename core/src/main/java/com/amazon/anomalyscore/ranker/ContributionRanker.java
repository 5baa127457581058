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

package com.amazon.anomalyscore.ranker;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import com.amazon.anomalyscore.returntypes.AnomalyResult;
import com.amazon.anomalyscore.returntypes.SubScore;

/**
 * Selects and formats the features that contributed most to the score of a row.
 * Every detection tier explains its rows through this class, so the explanation
 * format does not depend on the tier.
 */
public class ContributionRanker {

    public static final int DEFAULT_NUMBER_OF_CONTRIBUTORS = 3;

    public static final String SEPARATOR = "; ";

    private ContributionRanker() {
    }

    /**
     * Ranks the sub-scores of a row. The sort is stable, so equal sub-scores keep
     * the column order of their features.
     *
     * @param featureNames the feature names in column order
     * @param subScores    one sub-score per feature, aligned with the names
     * @param limit        the maximum number of contributors to keep
     * @return at most {@code limit} sub-scores, in decreasing order
     */
    public static List<SubScore> rank(List<String> featureNames, double[] subScores, int limit) {
        checkNotNull(featureNames, "feature names should not be null");
        checkNotNull(subScores, "sub-scores should not be null");
        checkArgument(featureNames.size() == subScores.length, "incorrect number of sub-scores");
        checkArgument(limit > 0, "limit should be positive");

        List<SubScore> all = new ArrayList<>(subScores.length);
        for (int i = 0; i < subScores.length; i++) {
            all.add(new SubScore(featureNames.get(i), subScores[i]));
        }
        all.sort(Comparator.comparingDouble(SubScore::getScore).reversed());
        return new ArrayList<>(all.subList(0, Math.min(limit, all.size())));
    }

    public static List<SubScore> rank(List<String> featureNames, double[] subScores) {
        return rank(featureNames, subScores, DEFAULT_NUMBER_OF_CONTRIBUTORS);
    }

    /**
     * Builds the result of a row whose headline score is the largest sub-score.
     *
     * @param featureNames the feature names in column order
     * @param subScores    one sub-score per feature
     * @return the result of the row
     */
    public static AnomalyResult maxOf(List<String> featureNames, double[] subScores) {
        double max = 0;
        for (double score : subScores) {
            max = Math.max(max, score);
        }
        return new AnomalyResult(max, rank(featureNames, subScores));
    }

    /**
     * @param contributors ranked contributors
     * @return {@code feature:score} pairs, one decimal each, joined by
     *         {@link #SEPARATOR}
     */
    public static String format(List<SubScore> contributors) {
        return contributors.stream().map(SubScore::toString).collect(Collectors.joining(SEPARATOR));
    }
}
