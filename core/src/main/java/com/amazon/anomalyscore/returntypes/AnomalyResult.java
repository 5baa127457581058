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

package com.amazon.anomalyscore.returntypes;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscore.ranker.ContributionRanker;

/**
 * The outcome for one row: the headline score in [0, 100] and the top
 * contributing features, ordered by decreasing sub-score. Never modified after
 * creation.
 */
@Getter
public class AnomalyResult {

    private final double score;

    private final List<SubScore> contributors;

    public AnomalyResult(double score, List<SubScore> contributors) {
        checkArgument(score >= 0 && score <= 100, "score should be in [0, 100]");
        checkNotNull(contributors, "contributors should not be null");
        this.score = score;
        this.contributors = Collections.unmodifiableList(contributors);
    }

    /**
     * @return the contributors rendered as {@code feature:score} pairs separated
     *         by {@code "; "}
     */
    public String getContributorString() {
        return ContributionRanker.format(contributors);
    }

    @Override
    public String toString() {
        return String.format("AnomalyResult[score=%s, contributors=%s]", score, getContributorString());
    }
}
