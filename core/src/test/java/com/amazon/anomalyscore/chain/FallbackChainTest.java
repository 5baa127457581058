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

import static com.amazon.anomalyscore.TestUtils.context;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyscore.TestUtils;
import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.detector.DetectionContext;
import com.amazon.anomalyscore.detector.IDetector;
import com.amazon.anomalyscore.diagnostics.DegradeEvent;
import com.amazon.anomalyscore.diagnostics.DegradeLog;
import com.amazon.anomalyscore.errors.DetectorRuntimeException;
import com.amazon.anomalyscore.returntypes.AnomalyResult;
import com.amazon.anomalyscore.runner.ProgressListener;

public class FallbackChainTest {

    private IDetector ml;
    private IDetector adtk;
    private IDetector statistical;
    private FallbackChain chain;

    private DegradeLog degradeLog;
    private ProgressListener listener;
    private DetectionContext context;
    private List<AnomalyResult> results;

    private static IDetector detector(DetectionMethod method) {
        IDetector detector = mock(IDetector.class);
        when(detector.getMethod()).thenReturn(method);
        when(detector.isAvailable()).thenReturn(true);
        return detector;
    }

    @BeforeEach
    public void setUp() {
        ml = detector(DetectionMethod.ML);
        adtk = detector(DetectionMethod.ADTK_STYLE);
        statistical = detector(DetectionMethod.STATISTICAL);
        chain = new FallbackChain(Arrays.asList(ml, adtk, statistical));

        Dataset dataset = TestUtils.singleFeature("cpu", 1, 2);
        degradeLog = new DegradeLog();
        listener = mock(ProgressListener.class);
        context = context(dataset, degradeLog, listener);
        results = Arrays.asList(new AnomalyResult(0, Collections.emptyList()),
                new AnomalyResult(10, Collections.emptyList()));
    }

    @Test
    public void testRequestedTierSucceeds() {
        when(ml.detect(any())).thenReturn(results);
        ChainResult result = chain.detect(DetectionMethod.ML, context);

        assertEquals(DetectionMethod.ML, result.getEffectiveMethod());
        assertFalse(result.isDegraded());
        assertEquals(results, result.getResults());
        assertTrue(degradeLog.isEmpty());
        verify(adtk, never()).detect(any());
        verify(listener).onLine("Using ml detection");
    }

    @Test
    public void testStatisticalNeverConsultsHigherTiers() {
        when(statistical.detect(any())).thenReturn(results);
        ChainResult result = chain.detect(DetectionMethod.STATISTICAL, context);

        assertEquals(DetectionMethod.STATISTICAL, result.getEffectiveMethod());
        verify(ml, never()).detect(any());
        verify(adtk, never()).detect(any());
    }

    @Test
    public void testUnavailableTierDegrades() {
        when(ml.isAvailable()).thenReturn(false);
        when(adtk.detect(any())).thenReturn(results);
        ChainResult result = chain.detect(DetectionMethod.ML, context);

        assertEquals(DetectionMethod.ML, result.getRequestedMethod());
        assertEquals(DetectionMethod.ADTK_STYLE, result.getEffectiveMethod());
        assertTrue(result.isDegraded());
        verify(ml, never()).detect(any());

        DegradeEvent event = degradeLog.getEvents().get(0);
        assertEquals(DetectionMethod.ML, event.getFrom());
        assertEquals(DetectionMethod.ADTK_STYLE, event.getTo());
        assertFalse(event.isPerFeature());
        assertEquals("DependencyUnavailableException", event.getCauseType());
    }

    @Test
    public void testFailuresCascadeToStatistical() {
        when(ml.detect(any())).thenThrow(new DetectorRuntimeException("model failed"));
        when(adtk.detect(any())).thenThrow(new DetectorRuntimeException("bad timestamps"));
        when(statistical.detect(any())).thenReturn(results);
        ChainResult result = chain.detect(DetectionMethod.ML, context);

        assertEquals(DetectionMethod.STATISTICAL, result.getEffectiveMethod());
        List<String> transitions = degradeLog.getEvents().stream().map(e -> e.getFrom() + "->" + e.getTo())
                .collect(Collectors.toList());
        assertThat(transitions, contains("ml->adtk-style", "adtk-style->statistical"));
        assertEquals("model failed", degradeLog.getEvents().get(0).getMessage());
    }

    @Test
    public void testWrongResultCountDegrades() {
        when(adtk.detect(any())).thenReturn(results.subList(0, 1));
        when(statistical.detect(any())).thenReturn(results);
        ChainResult result = chain.detect(DetectionMethod.ADTK_STYLE, context);

        assertEquals(DetectionMethod.STATISTICAL, result.getEffectiveMethod());
        assertEquals("IllegalStateException", degradeLog.getEvents().get(0).getCauseType());
    }

    @Test
    public void testStatisticalFailureIsFatal() {
        IllegalStateException failure = new IllegalStateException("boom");
        when(statistical.detect(any())).thenThrow(failure);
        assertSame(failure, assertThrows(IllegalStateException.class,
                () -> chain.detect(DetectionMethod.STATISTICAL, context)));
    }

    @Test
    public void testMissingTierIsUnavailable() {
        FallbackChain partial = new FallbackChain(Collections.singletonList(statistical));
        when(statistical.detect(any())).thenReturn(results);

        assertFalse(partial.isAvailable(DetectionMethod.ML));
        assertTrue(partial.isAvailable(DetectionMethod.STATISTICAL));
        ChainResult result = partial.detect(DetectionMethod.ML, context);
        assertEquals(DetectionMethod.STATISTICAL, result.getEffectiveMethod());
        assertEquals(2, degradeLog.getEvents().size());
    }

    @Test
    public void testStatisticalIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new FallbackChain(Arrays.asList(ml, adtk)));
        assertThrows(IllegalArgumentException.class, () -> new FallbackChain(Arrays.asList(statistical, statistical)));
    }
}
