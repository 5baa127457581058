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

package com.amazon.anomalyscore.diagnostics;

import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyscore.config.DetectionMethod;

/**
 * A non-fatal transition from one tier to a lower one. A feature is named when
 * only that feature was degraded; otherwise the whole tier was replaced.
 */
@Getter
public class DegradeEvent {

    private final DetectionMethod from;

    private final DetectionMethod to;

    private final String featureName;

    private final String causeType;

    private final String message;

    public DegradeEvent(DetectionMethod from, DetectionMethod to, String featureName, Throwable cause) {
        this.from = from;
        this.to = to;
        this.featureName = featureName;
        this.causeType = cause.getClass().getSimpleName();
        this.message = cause.getMessage();
    }

    public Optional<String> getFeature() {
        return Optional.ofNullable(featureName);
    }

    public boolean isPerFeature() {
        return featureName != null;
    }

    /**
     * @return a one line description, used for logs and run output
     */
    public String describe() {
        String scope = isPerFeature() ? "feature '" + featureName + "'" : "all features";
        return String.format("%s detection degraded to %s for %s: %s: %s", from, to, scope, causeType, message);
    }

    @Override
    public String toString() {
        return describe();
    }
}
