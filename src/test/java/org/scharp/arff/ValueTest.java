///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link Value} */
public class ValueTest {

    @Test
    void integerValues() {
        assertEquals(12L, Value.integer(12).value());
        assertEquals(12L, Value.integer(12L).value());
        assertEquals(-3L, Value.integer((short) -3).value());
        assertEquals(7L, Value.integer(" 7 ").value());
        assertEquals(3L, Value.integer(3.0).value());
        assertEquals(2L, Value.integer(new BigDecimal("2.00")).value());
        assertEquals(Long.MAX_VALUE, Value.integer(BigInteger.valueOf(Long.MAX_VALUE)).value());

        Value value = Value.integer("42");
        assertEquals(AttributeType.INTEGER, value.type());
        assertFalse(value.isMissing());
        assertFalse(value.isClass());
        assertEquals("42", value.toString());
    }

    @Test
    void integerRejectsNonIntegers() {
        Exception exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(3.5));
        assertEquals("cannot convert Double \"3.5\" to an integer value", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.integer("1.5"));
        assertEquals("cannot convert String \"1.5\" to an integer value", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(Double.NaN));
        assertEquals("cannot convert Double \"NaN\" to an integer value", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(new BigDecimal("0.5")));
        assertEquals("cannot convert BigDecimal \"0.5\" to an integer value", exception.getMessage());

        BigInteger tooBig = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
        exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(tooBig));
        assertEquals("cannot convert BigInteger \"9223372036854775808\" to an integer value", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> Value.integer(null));
        assertEquals("raw must not be null", exception.getMessage());
    }

    @Test
    void numericValues() {
        assertEquals(1.5, Value.numeric("1.5").value());
        assertEquals(3.0, Value.numeric(3).value());
        assertEquals(0.25, Value.numeric(new BigDecimal("0.25")).value());
        assertEquals(-1.0e-3, Value.numeric("-1e-3").value());
        assertEquals(0.5, Value.numeric(".5").value());
        assertEquals(Double.NaN, Value.numeric("NaN").value());
        assertEquals(Double.POSITIVE_INFINITY, Value.numeric("inf").value());
        assertEquals(Double.NEGATIVE_INFINITY, Value.numeric("-Infinity").value());
        assertEquals(AttributeType.NUMERIC, Value.numeric(1).type());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Value.numeric("abc"));
        assertEquals("cannot convert String \"abc\" to a numeric value", exception.getMessage());

        // Java's own suffixes aren't numbers in ARFF
        exception = assertThrows(IllegalArgumentException.class, () -> Value.numeric("1.5d"));
        assertEquals("cannot convert String \"1.5d\" to a numeric value", exception.getMessage());
    }

    @Test
    void textualValues() {
        Value string = Value.string(5);
        assertEquals(AttributeType.STRING, string.type());
        assertEquals("5", string.value());

        Value nominal = Value.nominal("sunny");
        assertEquals(AttributeType.NOMINAL, nominal.type());
        assertEquals("sunny", nominal.value());
    }

    @Test
    void dateValues() {
        LocalDate date = LocalDate.of(2020, 1, 2);
        assertSame(date, Value.date(date).value());
        assertEquals("2020-01-02 03:04", Value.date("2020-01-02 03:04").value());
        assertEquals(AttributeType.DATE, Value.date(date).type());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Value.date(5));
        assertEquals("cannot convert Integer \"5\" to a date value", exception.getMessage());
    }

    @Test
    void missingValues() {
        for (AttributeType type : AttributeType.values()) {
            Value missing = Value.of(type, Value.MISSING, false);
            assertEquals(type, missing.type(), "wrong type for missing " + type);
            assertTrue(missing.isMissing(), "missing " + type + " not missing");
            assertEquals("?", missing.value());
        }
    }

    @Test
    void testOf() {
        assertEquals(Value.integer(1), Value.of(AttributeType.INTEGER, "1", false));
        assertEquals(Value.numeric(1), Value.of(AttributeType.NUMERIC, "1", false));
        assertEquals(Value.string("1"), Value.of(AttributeType.STRING, 1, false));
        assertEquals(Value.nominal("a", true), Value.of(AttributeType.NOMINAL, "a", true));
        assertEquals(Value.date("2020-01-01"), Value.of(AttributeType.DATE, "2020-01-01", false));

        Exception exception = assertThrows(NullPointerException.class, () -> Value.of(null, "1", false));
        assertEquals("type must not be null", exception.getMessage());
    }

    @Test
    void wrapInfersType() {
        Value value = Value.nominal("x");
        assertSame(value, Value.wrap(value));

        assertEquals(Value.string("text"), Value.wrap("text"));
        assertEquals(Value.string("?"), Value.wrap("?"));

        // text is never inferred as a number
        assertEquals(Value.string("12"), Value.wrap("12"));

        // numbers are numeric, even integers
        assertEquals(Value.numeric(3.0), Value.wrap(3));
        assertEquals(Value.numeric(2.5), Value.wrap(2.5));

        LocalDateTime dateTime = LocalDateTime.of(2020, 1, 2, 3, 4, 5);
        assertEquals(Value.date(dateTime), Value.wrap(dateTime));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Value.wrap(true));
        assertEquals("cannot infer the type of Boolean \"true\"", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.wrap(new Object()));
        assertThat(exception.getMessage(), startsWith("cannot infer the type of Object"));
    }

    @Test
    void classFlag() {
        Value value = Value.nominal("yes");
        assertFalse(value.isClass());

        Value classValue = value.asClass();
        assertTrue(classValue.isClass());
        assertEquals(value.type(), classValue.type());
        assertEquals(value.value(), classValue.value());
        assertSame(classValue, classValue.asClass());

        // the flag is part of equality
        assertNotEquals(value, classValue);
        assertEquals(Value.nominal("yes", true), classValue);
        assertEquals(Value.nominal("yes", true).hashCode(), classValue.hashCode());
    }

    @Test
    void testPlus() {
        assertEquals(Value.integer(5), Value.integer(2).plus(Value.integer(3)));
        assertEquals(Value.integer(5), Value.integer(2).plus(3));
        assertEquals(Value.numeric(3.5), Value.numeric(1.5).plus(Value.numeric(2)));
        assertEquals(Value.numeric(3.5), Value.numeric(1.5).plus(2));

        // the sum keeps the class flag of the left operand
        assertTrue(Value.numeric(1, true).plus(Value.numeric(2)).isClass());
        assertFalse(Value.numeric(1).plus(Value.numeric(2, true)).isClass());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(2).plus(1.5));
        assertEquals("cannot convert Double \"1.5\" to an integer value", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.string("a").plus(Value.string("b")));
        assertEquals("cannot add string values", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(1).plus(Value.numeric(1)));
        assertEquals("cannot add a numeric value and a integer value", exception.getMessage());

        exception = assertThrows(IllegalStateException.class, () -> Value.integer("?").plus(Value.integer(1)));
        assertEquals("cannot add missing values", exception.getMessage());

        exception = assertThrows(IllegalStateException.class, () -> Value.numeric(1).plus(Value.numeric("?")));
        assertEquals("cannot add missing values", exception.getMessage());

        exception = assertThrows(ArithmeticException.class, () -> Value.integer(Long.MAX_VALUE).plus(1));
        assertEquals("long overflow", exception.getMessage());
    }

    @Test
    void testDividedBy() {
        assertEquals(Value.numeric(1.5), Value.numeric(3).dividedBy(Value.numeric(2)));
        assertEquals(Value.numeric(0.25), Value.numeric(1).dividedBy(4));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Value.integer(4).dividedBy(2));
        assertEquals("cannot divide integer values", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Value.numeric(4).dividedBy(Value.integer(2)));
        assertEquals("cannot divide a integer value and a numeric value", exception.getMessage());

        exception = assertThrows(ArithmeticException.class, () -> Value.numeric(1).dividedBy(0));
        assertEquals("division by zero", exception.getMessage());

        exception = assertThrows(IllegalStateException.class, () -> Value.numeric("?").dividedBy(2));
        assertEquals("cannot divide missing values", exception.getMessage());
    }
}
