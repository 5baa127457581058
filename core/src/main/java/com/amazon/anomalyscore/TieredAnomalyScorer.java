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

package com.amazon.anomalyscore;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;
import static com.amazon.anomalyscore.CommonUtils.formatScore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyscore.assembler.ResultAssembler;
import com.amazon.anomalyscore.assembler.ScoredDataset;
import com.amazon.anomalyscore.chain.ChainResult;
import com.amazon.anomalyscore.chain.FallbackChain;
import com.amazon.anomalyscore.config.DetectionMethod;
import com.amazon.anomalyscore.copula.CopulaOutlierModel;
import com.amazon.anomalyscore.copula.IOutlierModel;
import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.dataset.DatasetReader;
import com.amazon.anomalyscore.detector.DetectionContext;
import com.amazon.anomalyscore.detector.DistributionDetector;
import com.amazon.anomalyscore.detector.IDetector;
import com.amazon.anomalyscore.detector.InterQuartileRangeTest;
import com.amazon.anomalyscore.detector.MultivariateOutlierDetector;
import com.amazon.anomalyscore.detector.PointStatisticDetector;
import com.amazon.anomalyscore.diagnostics.DegradeLog;
import com.amazon.anomalyscore.executor.ParallelRowScoringExecutor;
import com.amazon.anomalyscore.executor.RowScoringExecutor;
import com.amazon.anomalyscore.executor.SequentialRowScoringExecutor;
import com.amazon.anomalyscore.returntypes.DetectionSummary;
import com.amazon.anomalyscore.runner.ProgressListener;
import com.amazon.anomalyscore.runner.RunOutcome;
import com.amazon.anomalyscore.statistics.FeatureStatistics;

/**
 * The anomaly scoring engine. A run loads a table, computes the feature
 * statistics, scores every row with the requested tier (degrading to lower tiers
 * as needed), appends the score and contributor columns and writes the result.
 *
 * The engine holds configuration only; every run computes its statistics from
 * scratch and reports through the listener it is given, so concurrent runs with
 * distinct outputs do not interfere.
 *
 * <pre>
 * TieredAnomalyScorer scorer = TieredAnomalyScorer.builder().parallelExecutionEnabled(true).build();
 * RunOutcome outcome = scorer.run(input, output, DetectionMethod.ML, "timestamp", listener);
 * </pre>
 */
@Slf4j
public class TieredAnomalyScorer {

    public static final DetectionMethod DEFAULT_METHOD = DetectionMethod.ADTK_STYLE;

    public static final String DEFAULT_TIMESTAMP_COLUMN = "timestamp";

    public static final String DEFAULT_DELIMITER = DatasetReader.DEFAULT_DELIMITER;

    public static final double DEFAULT_IQR_FACTOR = InterQuartileRangeTest.DEFAULT_FACTOR;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    public static final boolean DEFAULT_MULTIVARIATE_MODEL_ENABLED = true;

    public static final boolean DEFAULT_DISTRIBUTION_TEST_ENABLED = true;

    @Getter
    private final String delimiter;

    @Getter
    private final boolean parallelExecutionEnabled;

    @Getter
    private final int threadPoolSize;

    private final DatasetReader reader;

    private final ResultAssembler assembler;

    private final FallbackChain chain;

    private final RowScoringExecutor executor;

    protected TieredAnomalyScorer(Builder<?> builder) {
        checkArgument(builder.iqrFactor >= 0, "iqr factor should be non-negative");
        this.delimiter = builder.delimiter;
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        this.reader = new DatasetReader(builder.delimiter);
        this.assembler = new ResultAssembler(builder.delimiter);

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
            executor = new ParallelRowScoringExecutor(threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialRowScoringExecutor();
        }

        List<IDetector> detectors = new ArrayList<>();
        detectors.add(new MultivariateOutlierDetector(builder.multivariateModelEnabled ? builder.modelFactory : null));
        detectors.add(new DistributionDetector(
                builder.distributionTestEnabled ? new InterQuartileRangeTest(builder.iqrFactor) : null));
        detectors.add(new PointStatisticDetector());
        this.chain = new FallbackChain(detectors);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Runs the engine with the default method and timestamp column.
     *
     * @param input  the input table
     * @param output the output table
     * @return the outcome
     */
    public RunOutcome run(Path input, Path output) {
        return run(input, output, DEFAULT_METHOD, DEFAULT_TIMESTAMP_COLUMN, ProgressListener.NO_OP);
    }

    /**
     * Scores the table at {@code input} and writes the augmented table to
     * {@code output}. Schema, data and I/O errors do not escape: they produce a
     * failed outcome, and in that case no output is written.
     *
     * @param input           the input table
     * @param output          the output table
     * @param method          the requested method
     * @param timestampColumn the name of the timestamp column
     * @param listener        receives progress, run output and the outcome
     * @return the outcome, also passed to {@link ProgressListener#onComplete}
     */
    public RunOutcome run(Path input, Path output, DetectionMethod method, String timestampColumn,
            ProgressListener listener) {
        checkNotNull(listener, "listener should not be null");
        RunOutcome outcome;
        try {
            checkNotNull(input, "input should not be null");
            checkNotNull(output, "output should not be null");
            checkNotNull(method, "method should not be null");
            checkNotNull(timestampColumn, "timestamp column should not be null");
            listener.onLine("Starting anomaly detection");
            listener.onLine("Input: " + input);
            listener.onLine("Method: " + method);

            Dataset dataset = reader.read(input, timestampColumn);
            listener.onProgress(10);
            listener.onLine(String.format("Loaded %d rows, %d columns", dataset.getRowCount(),
                    dataset.getColumnNames().size()));

            ScoredDataset scored = score(dataset, method, listener);

            assembler.write(scored, output);
            listener.onProgress(90);
            DetectionSummary summary = scored.getSummary();
            report(summary, output, listener);
            outcome = RunOutcome.success(output, summary);
        } catch (IOException | RuntimeException e) {
            log.error("anomaly detection failed", e);
            listener.onLine("Error: " + e.getMessage());
            outcome = RunOutcome.failure(e);
        }
        listener.onProgress(100);
        listener.onComplete(outcome);
        return outcome;
    }

    /**
     * Scores an already loaded dataset.
     *
     * @param dataset  the dataset
     * @param method   the requested method
     * @param listener receives progress and run output
     * @return the dataset with its results and summary
     */
    public ScoredDataset score(Dataset dataset, DetectionMethod method, ProgressListener listener) {
        checkNotNull(dataset, "dataset should not be null");
        checkNotNull(method, "method should not be null");
        listener.onProgress(20);
        listener.onLine("Analyzing features: " + dataset.getFeatureNames());

        FeatureStatistics statistics = FeatureStatistics.compute(dataset);
        listener.onProgress(30);

        DegradeLog degradeLog = new DegradeLog(listener);
        DetectionContext context = new DetectionContext(dataset, statistics, executor, degradeLog, listener);
        ChainResult chainResult = chain.detect(method, context);
        listener.onProgress(80);
        return assembler.assemble(dataset, chainResult, degradeLog.getEvents());
    }

    public boolean isAvailable(DetectionMethod method) {
        return chain.isAvailable(method);
    }

    private static void report(DetectionSummary summary, Path output, ProgressListener listener) {
        listener.onLine("Detection completed using " + summary.getEffectiveMethod() + " detection");
        listener.onLine("Results saved to: " + output);
        listener.onLine("High anomalies (>70): " + summary.getHighCount());
        listener.onLine("Medium anomalies (30-70): " + summary.getMediumCount());
        listener.onLine("Normal (<=30): " + summary.getLowCount());
        listener.onLine("Max anomaly score: " + formatScore(summary.getMaxScore()));
    }

    public static class Builder<T extends Builder<T>> {

        private String delimiter = DEFAULT_DELIMITER;
        private double iqrFactor = DEFAULT_IQR_FACTOR;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private boolean multivariateModelEnabled = DEFAULT_MULTIVARIATE_MODEL_ENABLED;
        private boolean distributionTestEnabled = DEFAULT_DISTRIBUTION_TEST_ENABLED;
        private Supplier<? extends IOutlierModel> modelFactory = CopulaOutlierModel::new;

        public T delimiter(String delimiter) {
            this.delimiter = delimiter;
            return (T) this;
        }

        public T iqrFactor(double iqrFactor) {
            this.iqrFactor = iqrFactor;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T multivariateModelEnabled(boolean multivariateModelEnabled) {
            this.multivariateModelEnabled = multivariateModelEnabled;
            return (T) this;
        }

        public T distributionTestEnabled(boolean distributionTestEnabled) {
            this.distributionTestEnabled = distributionTestEnabled;
            return (T) this;
        }

        public T outlierModel(Supplier<? extends IOutlierModel> modelFactory) {
            this.modelFactory = checkNotNull(modelFactory, "model factory should not be null");
            return (T) this;
        }

        public TieredAnomalyScorer build() {
            return new TieredAnomalyScorer(this);
        }
    }
}
