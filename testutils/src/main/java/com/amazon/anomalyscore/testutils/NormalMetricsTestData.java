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

package com.amazon.anomalyscore.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Samples rows of independent normal metrics around a base level and replaces a
 * fixed set of rows with spikes, so tests know which rows are anomalous. The
 * same seed always produces the same rows.
 */
public class NormalMetricsTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double spikeMu;

    public NormalMetricsTestData(double baseMu, double baseSigma, double spikeMu) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.spikeMu = spikeMu;
    }

    public NormalMetricsTestData() {
        this(50.0, 2.0, 95.0);
    }

    /**
     * @param numberOfRows    number of rows
     * @param numberOfColumns number of metrics per row
     * @param seed            random seed
     * @param spikeRows       rows in which every metric is set to the spike level
     * @return the rows
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed, int... spikeRows) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                result[i][j] = dist.nextDouble(baseMu, baseSigma);
            }
        }
        for (int row : spikeRows) {
            Arrays.fill(result[row], spikeMu);
        }
        return result;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;
            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
