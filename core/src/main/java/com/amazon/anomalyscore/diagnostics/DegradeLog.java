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

package com.amazon.anomalyscore.diagnostics;

import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.runner.ProgressListener;

/**
 * The degrade events of a single run. Each event is logged, forwarded to the
 * run's listener and kept for the run summary, so that no fallback is silent.
 * Per-feature events can be recorded from parallel scoring threads.
 */
@Slf4j
public class DegradeLog {

    private final List<DegradeEvent> events = new ArrayList<>();

    private final ProgressListener listener;

    public DegradeLog() {
        this(ProgressListener.NO_OP);
    }

    public DegradeLog(ProgressListener listener) {
        this.listener = checkNotNull(listener, "listener should not be null");
    }

    public void record(DetectionMethod from, DetectionMethod to, Throwable cause) {
        record(new DegradeEvent(from, to, null, cause));
    }

    public void recordFeature(DetectionMethod from, DetectionMethod to, String featureName, Throwable cause) {
        record(new DegradeEvent(from, to, featureName, cause));
    }

    public void record(DegradeEvent event) {
        synchronized (events) {
            events.add(event);
        }
        log.warn("{}", event);
        listener.onLine("Warning: " + event.describe());
    }

    public List<DegradeEvent> getEvents() {
        synchronized (events) {
            return Collections.unmodifiableList(new ArrayList<>(events));
        }
    }

    public boolean isEmpty() {
        synchronized (events) {
            return events.isEmpty();
        }
    }
}
