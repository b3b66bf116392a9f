///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Translates the date patterns that are declared on ARFF date attributes into {@link DateTimeFormatter}s.
 * <p>
 * Only the tokens {@code yyyy}, {@code MM}, {@code dd}, {@code HH}, {@code mm}, and {@code ss} are recognized.  Every
 * other character of the pattern is copied to the output literally.
 * </p>
 */
final class DatePattern {

    /**
     * The pattern of a date attribute that is declared without one.
     */
    // Weka documents yyyy-MM-dd'T'HH:mm:ss as its default, but Weka can't read dates written that way.
    static final String DEFAULT = "yyyy-MM-dd HH:mm:ss";

    private DatePattern() {
    }

    /**
     * Creates a formatter that writes dates with a given pattern.
     *
     * @param pattern
     *     A Weka-style date pattern.
     *
     * @return A formatter for {@code LocalDateTime} values.
     */
    static DateTimeFormatter toFormatter(String pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        int i = 0;
        while (i < pattern.length()) {
            if (pattern.startsWith("yyyy", i)) {
                builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD);
                i += 4;
            } else if (pattern.startsWith("MM", i)) {
                builder.appendValue(ChronoField.MONTH_OF_YEAR, 2);
                i += 2;
            } else if (pattern.startsWith("dd", i)) {
                builder.appendValue(ChronoField.DAY_OF_MONTH, 2);
                i += 2;
            } else if (pattern.startsWith("HH", i)) {
                builder.appendValue(ChronoField.HOUR_OF_DAY, 2);
                i += 2;
            } else if (pattern.startsWith("mm", i)) {
                builder.appendValue(ChronoField.MINUTE_OF_HOUR, 2);
                i += 2;
            } else if (pattern.startsWith("ss", i)) {
                builder.appendValue(ChronoField.SECOND_OF_MINUTE, 2);
                i += 2;
            } else {
                builder.appendLiteral(pattern.charAt(i));
                i++;
            }
        }
        return builder.toFormatter(Locale.ROOT);
    }
}
