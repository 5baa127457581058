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

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.diagnostics.DegradeLog;
import com.amazon.anomalyscore.executor.RowScoringExecutor;
import com.amazon.anomalyscore.runner.ProgressListener;
import com.amazon.anomalyscore.statistics.FeatureStatistics;

/**
 * Everything a detector needs for one run. The statistics are computed before
 * the context is created and are shared, read-only, by all tiers of the run.
 */
@Getter
public class DetectionContext {

    private final Dataset dataset;

    private final FeatureStatistics statistics;

    private final RowScoringExecutor executor;

    private final DegradeLog degradeLog;

    private final ProgressListener listener;

    public DetectionContext(Dataset dataset, FeatureStatistics statistics, RowScoringExecutor executor,
            DegradeLog degradeLog, ProgressListener listener) {
        this.dataset = checkNotNull(dataset, "dataset should not be null");
        this.statistics = checkNotNull(statistics, "statistics should not be null");
        this.executor = checkNotNull(executor, "executor should not be null");
        this.degradeLog = checkNotNull(degradeLog, "degrade log should not be null");
        this.listener = checkNotNull(listener, "listener should not be null");
        checkArgument(dataset.getFeatureCount() == statistics.getFeatureCount(),
                "statistics do not match the dataset");
    }
}
