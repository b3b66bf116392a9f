///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Unit tests for {@link DatePattern} */
public class DatePatternTest {

    private static final LocalDateTime DATE_TIME = LocalDateTime.of(2020, 1, 2, 3, 4, 5);

    private static String format(String pattern) {
        return DatePattern.toFormatter(pattern).format(DATE_TIME);
    }

    @Test
    void defaultPattern() {
        assertEquals("2020-01-02 03:04:05", format(DatePattern.DEFAULT));
    }

    @Test
    void customPatterns() {
        assertEquals("2020-01-02", format("yyyy-MM-dd"));
        assertEquals("01/02/2020", format("MM/dd/yyyy"));
        assertEquals("03:04", format("HH:mm"));
        assertEquals("20200102T030405", format("yyyyMMddTHHmmss"));

        // minutes and months are told apart by case
        assertEquals("04-01", format("mm-MM"));
    }

    @Test
    void unknownCharactersAreLiteral() {
        assertEquals("2020 y 01 'x'", format("yyyy y MM 'x'"));
        assertEquals("", format(""));
    }
}
