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

import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.util.Locale;
import java.util.stream.Collectors;

import com.amazon.anomalyscore.diagnostics.DegradeEvent;
import com.amazon.anomalyscore.returntypes.DetectionSummary;
import com.amazon.anomalyscore.runner.JobStatus;
import com.amazon.anomalyscore.runner.RunOutcome;

/**
 * Converts a {@link JobStatus} into a {@link JobStatusState} snapshot.
 */
public class JobStatusMapper {

    public JobStatusState toState(JobStatus jobStatus) {
        checkNotNull(jobStatus, "job status should not be null");
        JobStatusState state = new JobStatusState();
        RunOutcome outcome;
        // one consistent snapshot while the run may still be reporting
        synchronized (jobStatus) {
            state.setStatus(jobStatus.getState().name().toLowerCase(Locale.ROOT));
            state.setProgress(jobStatus.getProgress());
            state.setOutput(jobStatus.getOutput());
            outcome = jobStatus.getOutcome();
        }
        if (outcome == null) {
            return state;
        }

        if (outcome.isSuccess()) {
            DetectionSummary summary = outcome.getSummary();
            state.setOutputPath(String.valueOf(outcome.getOutputPath()));
            state.setRequestedMethod(summary.getRequestedMethod().getMethodName());
            state.setEffectiveMethod(summary.getEffectiveMethod().getMethodName());
            state.setRowCount(summary.getRowCount());
            state.setHighCount(summary.getHighCount());
            state.setMediumCount(summary.getMediumCount());
            state.setLowCount(summary.getLowCount());
            state.setMaxScore(summary.getMaxScore());
            state.setDegradeEvents(
                    summary.getDegradeEvents().stream().map(this::toState).collect(Collectors.toList()));
        } else {
            Exception error = outcome.getError();
            state.setError(error.getClass().getSimpleName() + ": " + error.getMessage());
        }
        return state;
    }

    public DegradeEventState toState(DegradeEvent event) {
        DegradeEventState state = new DegradeEventState();
        state.setFrom(event.getFrom().getMethodName());
        state.setTo(event.getTo().getMethodName());
        state.setFeature(event.getFeatureName());
        state.setCauseType(event.getCauseType());
        state.setMessage(event.getMessage());
        return state;
    }
}
