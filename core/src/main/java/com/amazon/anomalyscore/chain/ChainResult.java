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

package com.amazon.anomalyscore.chain;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.returntypes.AnomalyResult;

/**
 * The per-row results of a run together with the tier that produced them.
 */
@Getter
public class ChainResult {

    private final DetectionMethod requestedMethod;

    private final DetectionMethod effectiveMethod;

    private final List<AnomalyResult> results;

    public ChainResult(DetectionMethod requestedMethod, DetectionMethod effectiveMethod, List<AnomalyResult> results) {
        this.requestedMethod = requestedMethod;
        this.effectiveMethod = effectiveMethod;
        this.results = Collections.unmodifiableList(results);
    }

    public boolean isDegraded() {
        return requestedMethod != effectiveMethod;
    }
}
