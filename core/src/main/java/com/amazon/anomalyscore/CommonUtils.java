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

package com.amazon.anomalyscore;

import java.util.Locale;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * the upper end of the normalized score range; the lower end is 0
     */
    public static final double MAX_SCORE = 100.0;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Clamps a score into [0, MAX_SCORE]. A NaN score is treated as 0, so that a
     * row always gets a usable score.
     *
     * @param score the raw score
     * @return the clamped score
     */
    public static double clampScore(double score) {
        if (Double.isNaN(score) || score <= 0) {
            return 0;
        }
        return Math.min(MAX_SCORE, score);
    }

    /**
     * The absolute z-score of a value, scaled linearly so that a z-score of
     * {@code fullScaleZScore} maps to MAX_SCORE, and clamped. A degenerate (zero
     * or non-finite) deviation and a missing value both produce 0; a constant
     * feature never flags.
     *
     * @param value           the observed value, NaN when missing
     * @param mean            the mean of the feature
     * @param deviation       the standard deviation of the feature
     * @param fullScaleZScore the z-score that saturates the score
     * @return the scaled z-score in [0, MAX_SCORE]
     */
    public static double scaledZScore(double value, double mean, double deviation, double fullScaleZScore) {
        if (!(deviation > 0) || Double.isInfinite(deviation) || Double.isNaN(value)) {
            return 0;
        }
        double zScore = Math.abs((value - mean) / deviation);
        return clampScore((zScore / fullScaleZScore) * MAX_SCORE);
    }

    /**
     * Renders a score with a single decimal place, independent of the default
     * locale.
     *
     * @param score the score
     * @return the formatted string
     */
    public static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
