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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The aggregate descriptors of one feature over the whole dataset. All values
 * are NaN for a feature without any present value.
 */
@Getter
@AllArgsConstructor
public class FeatureSummary {

    private final String featureName;

    private final double mean;

    // population standard deviation
    private final double deviation;

    private final double firstQuartile;

    private final double thirdQuartile;

    public double getInterquartileRange() {
        return thirdQuartile - firstQuartile;
    }

    @Override
    public String toString() {
        return String.format("%s[mean=%s, deviation=%s, q1=%s, q3=%s]", featureName, mean, deviation, firstQuartile,
                thirdQuartile);
    }
}
