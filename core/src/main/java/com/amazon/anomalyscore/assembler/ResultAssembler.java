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

package com.amazon.anomalyscore.assembler;

import static com.amazon.anomalyscore.CommonUtils.checkArgument;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.StringJoiner;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyscore.chain.ChainResult;
import com.amazon.anomalyscore.dataset.Dataset;
import com.amazon.anomalyscore.diagnostics.DegradeEvent;
import com.amazon.anomalyscore.returntypes.DetectionSummary;

/**
 * Merges the per-row results back into the original table and writes the
 * augmented table. The output file only appears once it is complete.
 */
@Slf4j
public class ResultAssembler {

    @Getter
    private final String delimiter;

    public ResultAssembler(String delimiter) {
        checkArgument(delimiter != null && !delimiter.isEmpty(), "delimiter should be a non-empty string");
        this.delimiter = delimiter;
    }

    public ScoredDataset assemble(Dataset dataset, ChainResult chainResult, List<DegradeEvent> degradeEvents) {
        DetectionSummary summary = new DetectionSummary(chainResult.getResults(), chainResult.getRequestedMethod(),
                chainResult.getEffectiveMethod(), degradeEvents);
        return new ScoredDataset(dataset, chainResult.getResults(), summary);
    }

    /**
     * Writes the table to a temporary file next to the target and moves it into
     * place, so a failed write never leaves a partial output behind.
     *
     * @param scored the scored table
     * @param output the output location
     * @throws IOException if the table cannot be written
     */
    public void write(ScoredDataset scored, Path output) throws IOException {
        Path absolute = output.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temporary = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8);
                    PrintWriter out = new PrintWriter(writer)) {
                write(scored, out);
                if (out.checkError()) {
                    throw new IOException("failed writing " + temporary);
                }
            }
            move(temporary, absolute);
        } finally {
            Files.deleteIfExists(temporary);
        }
        log.info("wrote {} scored rows to {}", scored.getRowCount(), absolute);
    }

    public void write(ScoredDataset scored, PrintWriter out) {
        int originalColumns = scored.getDataset().getColumnNames().size();
        // header names are read unquoted, so every one of them may need quoting again
        out.println(join(scored.getColumnNames().toArray(new String[0]), 0));
        for (int row = 0; row < scored.getRowCount(); row++) {
            out.println(join(scored.getRow(row), originalColumns));
        }
        out.flush();
    }

    // input data cells are written verbatim; only the appended cells may need quoting
    String join(String[] cells, int originalColumns) {
        StringJoiner joiner = new StringJoiner(delimiter);
        for (int i = 0; i < cells.length; i++) {
            joiner.add(i < originalColumns ? cells[i] : quoteIfNeeded(cells[i]));
        }
        return joiner.toString();
    }

    String quoteIfNeeded(String cell) {
        if (cell.contains(delimiter) || cell.contains("\"")) {
            return "\"" + cell.replace("\"", "\"\"") + "\"";
        }
        return cell;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic move not supported for {}, replacing", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
