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

import static com.amazon.anomalyscore.CommonUtils.checkArgument;
import static com.amazon.anomalyscore.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.anomalyscore.TieredAnomalyScorer;
import com.amazon.anomalyscore.config.DetectionMethod;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/anomalyscore-core-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument input;
    private final StringArgument output;
    private final Argument<DetectionMethod> method;
    private final StringArgument timestampColumn;
    private final StringArgument delimiter;
    private final DoubleArgument iqrFactor;
    private final BooleanArgument parallelExecution;
    private final IntegerArgument threadPoolSize;
    private final BooleanArgument disableMultivariate;
    private final BooleanArgument disableDistributionTest;
    private boolean helpRequested;

    /**
     * Create a new ArgumentParser. The runner class and runner description will be
     * used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new LinkedHashMap<>();
        longFlags = new LinkedHashMap<>();

        input = new StringArgument("-i", "--input", "Input table with a header row (required).", null);
        addArgument(input);

        output = new StringArgument("-o", "--output", "Output table (required).", null);
        addArgument(output);

        method = new Argument<>("-m", "--method", "Detection method: statistical, adtk-style or ml.",
                TieredAnomalyScorer.DEFAULT_METHOD, DetectionMethod::fromName);
        addArgument(method);

        timestampColumn = new StringArgument("-t", "--timestamp-column", "Name of the timestamp column.",
                TieredAnomalyScorer.DEFAULT_TIMESTAMP_COLUMN,
                s -> checkArgument(!s.isEmpty(), "timestamp column should not be empty"));
        addArgument(timestampColumn);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                TieredAnomalyScorer.DEFAULT_DELIMITER,
                s -> checkArgument(!s.isEmpty(), "delimiter should not be empty"));
        addArgument(delimiter);

        iqrFactor = new DoubleArgument(null, "--iqr-factor",
                "Interquartile range multiple added to the quartile bounds before a value is flagged.",
                TieredAnomalyScorer.DEFAULT_IQR_FACTOR,
                x -> checkArgument(x >= 0 && Double.isFinite(x), "iqr factor should be a non-negative number"));
        addArgument(iqrFactor);

        parallelExecution = new BooleanArgument(null, "--parallel-execution",
                "Set to 'true' to score rows on a thread pool.", TieredAnomalyScorer.DEFAULT_PARALLEL_EXECUTION_ENABLED);
        addArgument(parallelExecution);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of threads used with parallel execution, or 0 to pick one from the processor count.", 0,
                n -> checkArgument(n >= 0, "thread pool size should be non-negative"));
        addArgument(threadPoolSize);

        disableMultivariate = new BooleanArgument(null, "--disable-multivariate",
                "Set to 'true' to make the ml method unavailable.", false);
        addArgument(disableMultivariate);

        disableDistributionTest = new BooleanArgument(null, "--disable-distribution-test",
                "Set to 'true' to make the adtk-style method unavailable.", false);
        addArgument(disableDistributionTest);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments. A help flag stops parsing
     * and sets {@link #isHelpRequested()}.
     *
     * @param arguments An array of command-line arguments.
     * @throws IllegalArgumentException if a flag is unknown, has no value, has an
     *                                  invalid value, or a required argument is
     *                                  missing
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                helpRequested = true;
                return;
            }

            Argument<?> argument = shortFlags.containsKey(flag) ? shortFlags.get(flag) : longFlags.get(flag);
            checkArgument(argument != null, "Unknown argument: " + flag);
            checkArgument(i + 1 < arguments.length, "Missing value for " + flag);
            argument.parse(arguments[++i]);
            i++;
        }

        checkArgument(input.getValue() != null, "--input is required");
        checkArgument(output.getValue() != null, "--output is required");
    }

    /**
     * Print a usage message.
     *
     * @param out where the message is printed
     */
    public void printUsage(PrintStream out) {
        out.println(String.format("Usage: java -jar %s [options] --input input_file --output output_file",
                ARCHIVE_NAME));
        out.println(String.format("Main class: %s", runnerClass));
        out.println();
        out.println(runnerDescription);
        out.println();
        out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted().forEach(msg -> out.println("\t" + msg));

        out.println();
        out.println("\t--help, -h: Print this help message and exit.");
    }

    public void printUsage() {
        printUsage(System.out);
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage(System.err);
        System.exit(1);
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public Path getInput() {
        return Paths.get(input.getValue());
    }

    public Path getOutput() {
        return Paths.get(output.getValue());
    }

    public DetectionMethod getMethod() {
        return method.getValue();
    }

    public String getTimestampColumn() {
        return timestampColumn.getValue();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public double getIqrFactor() {
        return iqrFactor.getValue();
    }

    public boolean getParallelExecution() {
        return parallelExecution.getValue();
    }

    /**
     * @return the user-specified thread pool size, 0 when it should be derived
     *         from the processor count
     */
    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    public boolean getDisableMultivariate() {
        return disableMultivariate.getValue();
    }

    public boolean getDisableDistributionTest() {
        return disableDistributionTest.getValue();
    }

    /**
     * @return a scorer builder configured from the parsed arguments
     */
    public TieredAnomalyScorer.Builder<?> toBuilder() {
        TieredAnomalyScorer.Builder<?> builder = TieredAnomalyScorer.builder().delimiter(getDelimiter())
                .iqrFactor(getIqrFactor()).parallelExecutionEnabled(getParallelExecution())
                .multivariateModelEnabled(!getDisableMultivariate())
                .distributionTestEnabled(!getDisableDistributionTest());
        if (getThreadPoolSize() > 0) {
            builder.threadPoolSize(getThreadPoolSize());
        }
        return builder;
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            String suffix = defaultValue == null ? "" : String.format(" (default: %s)", defaultValue);
            if (shortFlag != null) {
                return String.format("%s, %s: %s%s", longFlag, shortFlag, description, suffix);
            } else {
                return String.format("%s: %s%s", longFlag, description, suffix);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
