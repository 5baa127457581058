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

package com.amazon.anomalyscore.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.anomalyscore.returntypes.AnomalyResult;

public class RowScoringExecutorTest {

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(new SequentialRowScoringExecutor(), new ParallelRowScoringExecutor(4))
                    .map(Arguments::of);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testRowOrderIsPreserved(RowScoringExecutor executor) {
        List<AnomalyResult> results = executor.scoreRows(1000,
                row -> new AnomalyResult(row % 101, Collections.emptyList()));

        assertEquals(1000, results.size());
        for (int row = 0; row < results.size(); row++) {
            assertEquals(row % 101, results.get(row).getScore());
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testNoRows(RowScoringExecutor executor) {
        assertEquals(0, executor.scoreRows(0, row -> null).size());
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testFailurePropagates(RowScoringExecutor executor) {
        assertThrows(IllegalStateException.class, () -> executor.scoreRows(10, row -> {
            throw new IllegalStateException("row " + row);
        }));
    }

    @Test
    public void testThreadPoolSize() {
        assertEquals(3, new ParallelRowScoringExecutor(3).getThreadPoolSize());
        assertThrows(IllegalArgumentException.class, () -> new ParallelRowScoringExecutor(0));
    }
}
