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

import lombok.Getter;

import com.amazon.anomalyscore.runner.JobStatus;
import com.google.gson.Gson;

/**
 * JSON rendering of a {@link JobStatus}. The status is converted to a
 * {@link JobStatusState} with a {@link JobStatusMapper} and written with
 * <a href="https://github.com/google/gson">Gson</a>. The Gson instance is
 * exposed so callers can customize the output (e.g., by enabling pretty
 * printing).
 */
@Getter
public class JobStatusSerDe {

    private final JobStatusMapper mapper;
    private final Gson gson;

    public JobStatusSerDe() {
        this(new JobStatusMapper(), new Gson());
    }

    public JobStatusSerDe(JobStatusMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public String toJson(JobStatus jobStatus) {
        return gson.toJson(mapper.toState(jobStatus));
    }

    /**
     * @param json a json string written by {@link #toJson(JobStatus)}
     * @return the status report
     */
    public JobStatusState fromJson(String json) {
        return gson.fromJson(json, JobStatusState.class);
    }
}
