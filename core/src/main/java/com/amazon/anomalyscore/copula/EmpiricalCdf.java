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

package com.amazon.anomalyscore.copula;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * The empirical cumulative distribution of a sample: F(x) is the fraction of
 * sample values less than or equal to x.
 */
public class EmpiricalCdf {

    private final double[] sorted;

    public EmpiricalCdf(double[] sample) {
        checkArgument(sample.length > 0, "sample should not be empty");
        this.sorted = Arrays.copyOf(sample, sample.length);
        Arrays.sort(this.sorted);
    }

    public double probability(double x) {
        return upperBound(x) / (double) sorted.length;
    }

    // number of sample values <= x
    int upperBound(double x) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] <= x) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    public int size() {
        return sorted.length;
    }
}
