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

package com.amazon.anomalyscore.runner;

/**
 * Receives the progress of a detection run. The caller owns the listener; the
 * engine keeps no state between runs. All methods default to doing nothing.
 */
public interface ProgressListener {

    ProgressListener NO_OP = new ProgressListener() {
    };

    /**
     * @param percent the completed fraction of the run, in [0, 100]
     */
    default void onProgress(int percent) {
    }

    /**
     * @param text a line of human readable run output
     */
    default void onLine(String text) {
    }

    /**
     * Invoked exactly once, when the run has succeeded or failed.
     *
     * @param outcome the outcome of the run
     */
    default void onComplete(RunOutcome outcome) {
    }
}
