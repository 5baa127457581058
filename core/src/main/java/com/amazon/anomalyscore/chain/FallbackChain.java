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

package com.amazon.anomalyscore.chain;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;
import static com.amazon.anomalyscore.CommonUtils.checkState;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.detector.DetectionContext;
import com.amazon.anomalyscore.detector.IDetector;
import com.amazon.anomalyscore.errors.DependencyUnavailableException;
import com.amazon.anomalyscore.returntypes.AnomalyResult;

/**
 * Runs the requested tier and degrades, one tier at a time, when a tier is
 * unavailable or fails: ml, then adtk-style, then statistical. The chain never
 * moves back up and visits each tier at most once per run. Every transition is
 * recorded in the run's degrade log.
 */
@Slf4j
public class FallbackChain {

    private final Map<DetectionMethod, IDetector> detectors = new EnumMap<>(DetectionMethod.class);

    /**
     * @param detectors the tiers; the terminal statistical tier is required
     */
    public FallbackChain(List<? extends IDetector> detectors) {
        checkNotNull(detectors, "detectors should not be null");
        for (IDetector detector : detectors) {
            checkArgument(!this.detectors.containsKey(detector.getMethod()),
                    "duplicate detector for " + detector.getMethod());
            this.detectors.put(detector.getMethod(), detector);
        }
        IDetector terminal = this.detectors.get(DetectionMethod.STATISTICAL);
        checkArgument(terminal != null, "the statistical detector is required");
        checkArgument(terminal.isAvailable(), "the statistical detector should always be available");
    }

    /**
     * Scores the context's dataset with the requested tier, or the first lower
     * tier that succeeds.
     *
     * @param requested the requested method
     * @param context   the run context
     * @return the results and the tier that produced them
     */
    public ChainResult detect(DetectionMethod requested, DetectionContext context) {
        checkNotNull(requested, "method should not be null");
        DetectionMethod current = requested;
        while (true) {
            IDetector detector = detectors.get(current);
            if (current.isTerminal()) {
                context.getListener().onLine("Using " + current + " detection");
                return new ChainResult(requested, current, detector.detect(context));
            }
            try {
                if (detector == null || !detector.isAvailable()) {
                    throw new DependencyUnavailableException(current + " detection is not available");
                }
                context.getListener().onLine("Using " + current + " detection");
                List<AnomalyResult> results = detector.detect(context);
                checkState(results.size() == context.getDataset().getRowCount(),
                        current + " detection returned the wrong number of results");
                return new ChainResult(requested, current, results);
            } catch (RuntimeException e) {
                DetectionMethod next = current.getFallback().orElseThrow();
                log.debug("tier {} failed", current, e);
                context.getDegradeLog().record(current, next, e);
                current = next;
            }
        }
    }

    public boolean isAvailable(DetectionMethod method) {
        IDetector detector = detectors.get(method);
        return detector != null && detector.isAvailable();
    }
}
