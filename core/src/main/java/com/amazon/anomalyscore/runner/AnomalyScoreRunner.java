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

import java.io.PrintStream;

import com.amazon.anomalyscore.TieredAnomalyScorer;

/**
 * A command-line application that scores every row of a delimited table and
 * writes the table with the score and contributor columns appended.
 */
public class AnomalyScoreRunner {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private final ArgumentParser argumentParser;

    public AnomalyScoreRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) {
        ArgumentParser parser = new ArgumentParser(AnomalyScoreRunner.class.getName(),
                "Compute an anomaly score from 0 to 100 for each row of the input table and list the three "
                        + "features that contributed most to it.");
        try {
            parser.parse(args);
        } catch (IllegalArgumentException e) {
            parser.printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
        }

        if (parser.isHelpRequested()) {
            parser.printUsage();
            return;
        }

        System.exit(new AnomalyScoreRunner(parser).run(System.out));
    }

    /**
     * Run the scorer with the parsed arguments, printing the run output.
     *
     * @param out where the run output is printed
     * @return the process exit status
     */
    public int run(PrintStream out) {
        TieredAnomalyScorer scorer = argumentParser.toBuilder().build();
        RunOutcome outcome = scorer.run(argumentParser.getInput(), argumentParser.getOutput(),
                argumentParser.getMethod(), argumentParser.getTimestampColumn(), new ConsoleListener(out));
        return outcome.isSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    static class ConsoleListener implements ProgressListener {

        private final PrintStream out;

        ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onLine(String text) {
            out.println(text);
        }

        @Override
        public void onComplete(RunOutcome outcome) {
            out.flush();
        }
    }
}
