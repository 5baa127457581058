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

import java.util.List;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.errors.DependencyUnavailableException;
import com.amazon.anomalyscore.errors.DetectorRuntimeException;
import com.amazon.anomalyscore.returntypes.AnomalyResult;

/**
 * A detection tier. Every tier scores all rows of a dataset and explains each
 * row through the shared contribution ranking.
 */
public interface IDetector {

    /**
     * @return the method this detector implements
     */
    DetectionMethod getMethod();

    /**
     * @return false when the model or test this detector relies on is not present
     */
    boolean isAvailable();

    /**
     * Scores every row.
     *
     * @param context the dataset, its statistics and the run's collaborators
     * @return one result per row, in row order
     * @throws DependencyUnavailableException if the detector is not available
     * @throws DetectorRuntimeException       if the detector fails as a whole
     */
    List<AnomalyResult> detect(DetectionContext context);
}
