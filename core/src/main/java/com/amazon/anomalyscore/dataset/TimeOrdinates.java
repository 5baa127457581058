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

package com.amazon.anomalyscore.dataset;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Converts timestamp cells into orderable time ordinates (milliseconds since
 * the epoch, UTC for zone-less values). Accepted forms:
 * <ul>
 * <li>ISO-8601 dates and date-times, with {@code T} or a space between date and
 * time, and an optional offset such as {@code Z}, {@code +02:00} or
 * {@code +0200};</li>
 * <li>year-first slash dates, {@code yyyy/MM/dd[ HH:mm[:ss]]};</li>
 * <li>month-first slash dates, {@code MM/dd/yyyy[ HH:mm[:ss]]};</li>
 * <li>plain numbers, which are taken as already being ordinates.</li>
 * </ul>
 */
public class TimeOrdinates {

    private static final Pattern ISO_PREFIX = Pattern.compile("\\d{4}-.*");

    private static final Pattern YEAR_FIRST_PREFIX = Pattern.compile("\\d{4}/.*");

    private static final Pattern MONTH_FIRST_PREFIX = Pattern.compile("\\d{1,2}/.*");

    private static final DateTimeFormatter ISO_FORMATTER = new DateTimeFormatterBuilder().parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart().appendPattern("['T'][' ']")
            .append(DateTimeFormatter.ISO_LOCAL_TIME).optionalStart().appendPattern("[XXX][XX][X]").optionalEnd()
            .optionalEnd().toFormatter();

    private static final DateTimeFormatter YEAR_FIRST_FORMATTER = slashFormatter("uuuu/M/d");

    private static final DateTimeFormatter MONTH_FIRST_FORMATTER = slashFormatter("M/d/uuuu");

    private TimeOrdinates() {
    }

    private static DateTimeFormatter slashFormatter(String datePattern) {
        return new DateTimeFormatterBuilder().appendPattern(datePattern).optionalStart().appendLiteral(' ')
                .appendPattern("H:mm").optionalStart().appendPattern(":ss").optionalEnd().optionalEnd()
                .toFormatter();
    }

    /**
     * Parses every timestamp of the dataset.
     *
     * @param dataset the dataset
     * @return one ordinate per row, in row order
     * @throws DateTimeParseException if any timestamp is not a recognized time
     */
    public static double[] of(Dataset dataset) {
        double[] ordinates = new double[dataset.getRowCount()];
        for (int row = 0; row < ordinates.length; row++) {
            ordinates[row] = parse(dataset.getTimestamp(row));
        }
        return ordinates;
    }

    /**
     * @param timestamp the timestamp cell
     * @return the time ordinate
     * @throws DateTimeParseException if the cell is not a recognized time
     */
    public static double parse(String timestamp) {
        String text = timestamp.trim();
        if (Dataset.DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (ISO_PREFIX.matcher(text).matches()) {
            return toOrdinate(ISO_FORMATTER.parseBest(text, OffsetDateTime::from, LocalDateTime::from,
                    LocalDate::from));
        }
        DateTimeFormatter formatter;
        if (YEAR_FIRST_PREFIX.matcher(text).matches()) {
            formatter = YEAR_FIRST_FORMATTER;
        } else if (MONTH_FIRST_PREFIX.matcher(text).matches()) {
            formatter = MONTH_FIRST_FORMATTER;
        } else {
            throw new DateTimeParseException("Text '" + text + "' is not a recognized timestamp", text, 0);
        }
        return toOrdinate(formatter.parseBest(text, LocalDateTime::from, LocalDate::from));
    }

    private static double toOrdinate(TemporalAccessor parsed) {
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant().toEpochMilli();
        } else if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
}
