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

/**
 * An unsupervised outlier model over complete (imputed) feature vectors.
 */
public interface IOutlierModel {

    /**
     * Fits the model.
     *
     * @param points the training matrix, one row per point; no missing values
     */
    void fit(double[][] points);

    /**
     * @param points the points to score, with the dimensions of the training data
     * @return one decision score per point, larger means more outlying
     */
    double[] decisionFunction(double[][] points);
}
