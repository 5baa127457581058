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

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.diagnostics.DegradeEvent;

/**
 * Coarse buckets of the scores of a run: high (above 70), medium (above 30 up
 * to 70) and low (30 or less), with the largest score and the tiers involved.
 */
@Getter
public class DetectionSummary {

    public static final double HIGH_THRESHOLD = 70.0;

    public static final double MEDIUM_THRESHOLD = 30.0;

    private final int rowCount;

    private final int highCount;

    private final int mediumCount;

    private final int lowCount;

    private final double maxScore;

    private final DetectionMethod requestedMethod;

    private final DetectionMethod effectiveMethod;

    private final List<DegradeEvent> degradeEvents;

    public DetectionSummary(List<AnomalyResult> results, DetectionMethod requestedMethod,
            DetectionMethod effectiveMethod, List<DegradeEvent> degradeEvents) {
        int high = 0;
        int medium = 0;
        int low = 0;
        double max = 0;
        for (AnomalyResult result : results) {
            double score = result.getScore();
            if (score > HIGH_THRESHOLD) {
                ++high;
            } else if (score > MEDIUM_THRESHOLD) {
                ++medium;
            } else {
                ++low;
            }
            max = Math.max(max, score);
        }
        this.rowCount = results.size();
        this.highCount = high;
        this.mediumCount = medium;
        this.lowCount = low;
        this.maxScore = max;
        this.requestedMethod = requestedMethod;
        this.effectiveMethod = effectiveMethod;
        this.degradeEvents = Collections.unmodifiableList(degradeEvents);
    }

    public boolean isDegraded() {
        return !degradeEvents.isEmpty();
    }
}
