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
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;
import static com.amazon.anomalyscore.CommonUtils.checkState;

// the construction follows "COPOD: Copula-Based Outlier Detection", Li, Zhao, Botta,
// Ionescu and Hu, ICDM 2020. Each dimension contributes the negative log of its
// empirical tail probability; the tail is chosen by the skewness of the dimension.

/**
 * Copula based outlier detection. The model keeps the empirical distribution of
 * every dimension and of its negation (for the left and right tails) together
 * with the sign of the dimension's skewness. The model is deterministic: the same
 * training data always yields the same scores.
 */
public class CopulaOutlierModel implements IOutlierModel {

    private EmpiricalCdf[] leftTails;

    private EmpiricalCdf[] rightTails;

    private int[] skewSigns;

    @Override
    public void fit(double[][] points) {
        checkNotNull(points, "points should not be null");
        checkArgument(points.length > 0, "at least one point is required");
        int dimensions = points[0].length;
        checkArgument(dimensions > 0, "points should have at least one dimension");

        leftTails = new EmpiricalCdf[dimensions];
        rightTails = new EmpiricalCdf[dimensions];
        skewSigns = new int[dimensions];
        for (int j = 0; j < dimensions; j++) {
            double[] column = new double[points.length];
            double[] negated = new double[points.length];
            for (int i = 0; i < points.length; i++) {
                checkArgument(points[i].length == dimensions, "points should have the same dimensions");
                checkArgument(Double.isFinite(points[i][j]), "points should be finite");
                column[i] = points[i][j];
                negated[i] = -points[i][j];
            }
            leftTails[j] = new EmpiricalCdf(column);
            rightTails[j] = new EmpiricalCdf(negated);
            skewSigns[j] = (int) Math.signum(skewness(column));
        }
    }

    @Override
    public double[] decisionFunction(double[][] points) {
        checkState(isFitted(), "model should be fitted before scoring");
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            checkArgument(points[i].length == leftTails.length, "incorrect dimensions");
            double sum = 0;
            for (int j = 0; j < leftTails.length; j++) {
                double left = tailScore(leftTails[j].probability(points[i][j]));
                double right = tailScore(rightTails[j].probability(-points[i][j]));
                double skewed;
                if (skewSigns[j] < 0) {
                    skewed = left;
                } else if (skewSigns[j] > 0) {
                    skewed = right;
                } else {
                    skewed = left + right;
                }
                sum += Math.max(skewed, (left + right) / 2);
            }
            scores[i] = sum;
        }
        return scores;
    }

    public boolean isFitted() {
        return leftTails != null;
    }

    // a point below the whole sample has probability 0; use the smallest positive
    // double so the score stays finite
    static double tailScore(double probability) {
        return -Math.log(Math.max(probability, Double.MIN_VALUE));
    }

    /**
     * @param values the sample
     * @return the population skewness, 0 for a constant sample
     */
    static double skewness(double[] values) {
        double mean = 0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;
        double secondMoment = 0;
        double thirdMoment = 0;
        for (double value : values) {
            double difference = value - mean;
            secondMoment += difference * difference;
            thirdMoment += difference * difference * difference;
        }
        secondMoment /= values.length;
        thirdMoment /= values.length;
        if (secondMoment <= 0) {
            return 0;
        }
        return thirdMoment / Math.pow(secondMoment, 1.5);
    }
}
