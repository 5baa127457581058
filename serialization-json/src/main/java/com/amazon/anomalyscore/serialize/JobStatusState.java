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

package com.amazon.anomalyscore.serialize;

import java.io.Serializable;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * A POJO used to report the status of a run. Summary fields are only set once
 * the run has completed; {@code error} only once it has failed.
 */
@Getter
@Setter
public class JobStatusState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String status;
    private int progress;
    private String output;
    private String outputPath;
    private String requestedMethod;
    private String effectiveMethod;
    private Integer rowCount;
    private Integer highCount;
    private Integer mediumCount;
    private Integer lowCount;
    private Double maxScore;
    private String error;
    private List<DegradeEventState> degradeEvents;
}
