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
 * A caller-owned handle on a single run, safe to poll from another thread while
 * the run is in progress. It records the status, the progress, the accumulated
 * run output and, once finished, the outcome.
 */
public class JobStatus implements ProgressListener {

    public enum State {
        IDLE, RUNNING, COMPLETED, FAILED
    }

    private State state = State.IDLE;

    private int progress = 0;

    private final StringBuilder output = new StringBuilder();

    private RunOutcome outcome;

    @Override
    public synchronized void onProgress(int percent) {
        if (state == State.IDLE) {
            state = State.RUNNING;
        }
        progress = Math.max(progress, Math.min(100, percent));
    }

    @Override
    public synchronized void onLine(String text) {
        if (state == State.IDLE) {
            state = State.RUNNING;
        }
        output.append(text).append('\n');
    }

    @Override
    public synchronized void onComplete(RunOutcome outcome) {
        this.outcome = outcome;
        this.state = outcome.isSuccess() ? State.COMPLETED : State.FAILED;
        this.progress = 100;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getProgress() {
        return progress;
    }

    public synchronized String getOutput() {
        return output.toString();
    }

    /**
     * @return the outcome, null while the run has not finished
     */
    public synchronized RunOutcome getOutcome() {
        return outcome;
    }

    public synchronized boolean isFinished() {
        return state == State.COMPLETED || state == State.FAILED;
    }
}
