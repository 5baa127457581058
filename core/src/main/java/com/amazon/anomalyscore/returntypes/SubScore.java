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

import static com.amazon.anomalyscore.CommonUtils.formatScore;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The contribution of a single feature to the score of a row.
 */
@Getter
@EqualsAndHashCode
public class SubScore {

    private final String featureName;

    private final double score;

    public SubScore(String featureName, double score) {
        this.featureName = featureName;
        this.score = score;
    }

    /**
     * @return the display form {@code feature:score}
     */
    @Override
    public String toString() {
        return featureName + ":" + formatScore(score);
    }
}
