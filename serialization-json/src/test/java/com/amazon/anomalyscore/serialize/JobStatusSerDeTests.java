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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.anomalyscore.TieredAnomalyScorer;
import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.runner.JobStatus;
import com.amazon.anomalyscore.testutils.MetricsTableBuilder;
import com.google.gson.GsonBuilder;

public class JobStatusSerDeTests {

    @TempDir
    Path dir;

    private Path input;
    private JobStatusSerDe serializer;

    @BeforeEach
    public void setUp() throws IOException {
        input = new MetricsTableBuilder("cpu_usage").row("45").row("50").row("95").row("48")
                .write(dir.resolve("in.csv"));
        serializer = new JobStatusSerDe();
    }

    @Test
    public void testIdleStatus() {
        JobStatusState state = serializer.fromJson(serializer.toJson(new JobStatus()));

        assertEquals("idle", state.getStatus());
        assertEquals(0, state.getProgress());
        assertNull(state.getEffectiveMethod());
        assertNull(state.getError());
    }

    @Test
    public void testCompletedStatus() {
        JobStatus status = new JobStatus();
        TieredAnomalyScorer.builder().multivariateModelEnabled(false).build().run(input, dir.resolve("out.csv"),
                DetectionMethod.ML, "timestamp", status);

        String json = serializer.toJson(status);
        assertThat(json, containsString("\"status\":\"completed\""));

        JobStatusState state = serializer.fromJson(json);
        assertEquals(100, state.getProgress());
        assertEquals("ml", state.getRequestedMethod());
        assertEquals("adtk-style", state.getEffectiveMethod());
        assertEquals(4, state.getRowCount());
        assertEquals(1, state.getHighCount());
        assertEquals(0, state.getMediumCount());
        assertEquals(3, state.getLowCount());
        assertEquals(100.0, state.getMaxScore());
        assertEquals(1, state.getDegradeEvents().size());
        DegradeEventState event = state.getDegradeEvents().get(0);
        assertEquals("ml", event.getFrom());
        assertEquals("adtk-style", event.getTo());
        assertNull(event.getFeature());
        assertEquals("DependencyUnavailableException", event.getCauseType());
        assertThat(state.getOutput(), containsString("Loaded 4 rows, 2 columns"));
        assertTrue(state.getOutputPath().endsWith("out.csv"));
    }

    @Test
    public void testFailedStatus() {
        JobStatus status = new JobStatus();
        TieredAnomalyScorer.builder().build().run(input, dir.resolve("out.csv"), DetectionMethod.STATISTICAL,
                "time", status);

        JobStatusState state = serializer.fromJson(serializer.toJson(status));
        assertEquals("failed", state.getStatus());
        assertThat(state.getError(), containsString("SchemaException: Column 'time' not found"));
        assertNull(state.getRowCount());
    }

    @Test
    public void testCustomGson() {
        JobStatusSerDe pretty = new JobStatusSerDe(new JobStatusMapper(), new GsonBuilder().setPrettyPrinting()
                .create());
        assertThat(pretty.toJson(new JobStatus()), containsString("\n  \"status\": \"idle\""));
    }
}
