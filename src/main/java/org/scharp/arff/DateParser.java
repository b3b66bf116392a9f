///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Turns free text into a calendar value so that it can be written with a date attribute's pattern.
 */
@FunctionalInterface
public interface DateParser {

    /**
     * A parser that recognizes ISO-8601 dates and date-times (with or without an offset, with either a {@code T} or a
     * space between date and time), as well as {@code yyyy/MM/dd}, {@code MM/dd/yyyy}, and {@code yyyyMMdd} dates that
     * may be followed by a time.  A date without a time is taken to be at midnight.
     */
    DateParser LENIENT = new DateParser() {
        private final List<DateTimeFormatter> formatters = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm[:ss][.SSS]"),
            DateTimeFormatter.ofPattern("uuuu/MM/dd[ HH:mm[:ss]]"),
            DateTimeFormatter.ofPattern("MM/dd/uuuu[ HH:mm[:ss]]"),
            DateTimeFormatter.ofPattern("uuuuMMdd[ HH:mm[:ss]]"),
            DateTimeFormatter.ISO_LOCAL_DATE);

        @Override
        public LocalDateTime parse(String text) {
            ArgumentUtil.checkNotNull(text, "text");
            String trimmed = text.strip();
            for (DateTimeFormatter formatter : formatters) {
                try {
                    TemporalAccessor parsed = formatter.parseBest(
                        trimmed,
                        OffsetDateTime::from,
                        LocalDateTime::from,
                        LocalDate::from);
                    return toLocalDateTime(parsed);
                } catch (DateTimeParseException e) {
                    // try the next formatter
                }
            }
            throw new IllegalArgumentException("unrecognized date \"" + text + "\"");
        }
    };

    /**
     * Parses text that describes a date or a date and time.
     *
     * @param text
     *     The text to parse.
     *
     * @return The calendar value described by {@code text}.
     *
     * @throws IllegalArgumentException
     *     if {@code text} is not recognized as a date.
     */
    LocalDateTime parse(String text);

    /**
     * Converts a calendar value to a local date-time.  Dates are taken to be at midnight and offset date-times lose
     * their offset.
     *
     * @param temporal
     *     The calendar value.
     *
     * @return A local date-time.
     *
     * @throws IllegalArgumentException
     *     if {@code temporal} doesn't have a date.
     */
    static LocalDateTime toLocalDateTime(TemporalAccessor temporal) {
        if (temporal instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (temporal instanceof LocalDate localDate) {
            return localDate.atStartOfDay();
        }
        if (temporal instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toLocalDateTime();
        }
        try {
            return LocalDateTime.from(temporal);
        } catch (DateTimeException e) {
            try {
                return LocalDate.from(temporal).atStartOfDay();
            } catch (DateTimeException e2) {
                throw new IllegalArgumentException("cannot convert " + temporal + " to a date", e2);
            }
        }
    }
}
