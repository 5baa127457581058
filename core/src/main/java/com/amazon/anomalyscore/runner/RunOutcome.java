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

import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Getter;

import com.amazon.anomalyscore.returntypes.DetectionSummary;

/**
 * The result of a run: either the summary of a written output, or the error that
 * aborted the run before any output was written.
 */
@Getter
public class RunOutcome {

    private final boolean success;

    private final Path outputPath;

    private final DetectionSummary summary;

    private final Exception error;

    private RunOutcome(boolean success, Path outputPath, DetectionSummary summary, Exception error) {
        this.success = success;
        this.outputPath = outputPath;
        this.summary = summary;
        this.error = error;
    }

    public static RunOutcome success(Path outputPath, DetectionSummary summary) {
        return new RunOutcome(true, outputPath, checkNotNull(summary, "summary should not be null"), null);
    }

    public static RunOutcome failure(Exception error) {
        return new RunOutcome(false, null, null, checkNotNull(error, "error should not be null"));
    }

    public Optional<DetectionSummary> getSummaryIfPresent() {
        return Optional.ofNullable(summary);
    }

    public Optional<Exception> getErrorIfPresent() {
        return Optional.ofNullable(error);
    }
}
