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

package com.amazon.anomalyscore.errors;

/**
 * Raised when a detection tier fails while fitting or scoring valid data. Not
 * fatal; the caller degrades at the granularity of the failing unit (a single
 * feature of the distribution tier, or the whole multivariate tier).
 */
public class DetectorRuntimeException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DetectorRuntimeException(String message) {
        super(message);
    }

    public DetectorRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
