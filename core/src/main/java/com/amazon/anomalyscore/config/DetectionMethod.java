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

package com.amazon.anomalyscore.config;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The detection tiers, in decreasing order of sophistication. Each tier names
 * the tier it degrades to; the point-statistic tier is terminal.
 */
public enum DetectionMethod {

    /**
     * per-feature z-scores; always available
     */
    STATISTICAL("statistical", null),
    /**
     * per-feature interquartile distance over the time ordered values
     */
    ADTK_STYLE("adtk-style", STATISTICAL),
    /**
     * joint copula based outlier scoring over all features
     */
    ML("ml", ADTK_STYLE);

    private final String methodName;

    private final DetectionMethod fallback;

    DetectionMethod(String methodName, DetectionMethod fallback) {
        this.methodName = methodName;
        this.fallback = fallback;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * @return the tier to use when this one is unavailable or fails, empty for
     *         the terminal tier
     */
    public Optional<DetectionMethod> getFallback() {
        return Optional.ofNullable(fallback);
    }

    public boolean isTerminal() {
        return fallback == null;
    }

    /**
     * Resolves a method name as accepted on the command line. The bare name
     * {@code adtk} is accepted for the distribution tier.
     *
     * @param name the method name, case insensitive
     * @return the detection method
     */
    public static DetectionMethod fromName(String name) {
        checkArgument(name != null, "method name should not be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("adtk".equals(normalized)) {
            return ADTK_STYLE;
        }
        for (DetectionMethod method : values()) {
            if (method.methodName.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown method '%s', expected one of %s", name,
                Arrays.stream(values()).map(DetectionMethod::getMethodName).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return methodName;
    }
}
