///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single datum tagged with the type of the attribute it belongs to.
 * <p>
 * A value is created through the factory method for its type, which validates and normalizes the raw input:
 * </p>
 * <ul>
 * <li>{@link AttributeType#INTEGER}: the payload is a {@link Long}. The input must be exactly representable as an
 * integer.</li>
 * <li>{@link AttributeType#NUMERIC}: the payload is a {@link Double}.</li>
 * <li>{@link AttributeType#STRING}: the payload is the input's textual form. This never fails.</li>
 * <li>{@link AttributeType#NOMINAL}: the payload is the input's textual form. Whether it belongs to the attribute's
 * value set is checked by whoever consumes the value.</li>
 * <li>{@link AttributeType#DATE}: the payload is either a {@link TemporalAccessor} or free text that is normalized when
 * it's written.</li>
 * </ul>
 * <p>
 * For every type, the {@link #MISSING} marker is a legal input and is kept as-is.
 * </p>
 * <p>
 * A value may also be flagged as the class label, which designates its attribute as the relation's class attribute
 * when the value is appended to an {@link ArffDataset}.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class Value {

    /**
     * The token that represents a missing value of any type.
     */
    public static final String MISSING = "?";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NOT_A_NUMBER = Pattern.compile("(?i)[+-]?nan");
    private static final Pattern INFINITY = Pattern.compile("(?i)[+-]?inf(inity)?");

    private final AttributeType type;
    private final Object value;
    private final boolean classValue;

    private Value(AttributeType type, Object value, boolean classValue) {
        this.type = type;
        this.value = value;
        this.classValue = classValue;
    }

    /**
     * Creates a value of the given type.
     *
     * @param type
     *     The type of the value.
     * @param raw
     *     The raw datum.
     * @param classValue
     *     Whether this value is the class label.
     *
     * @return A new value.
     *
     * @throws NullPointerException
     *     if {@code type} or {@code raw} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code raw} cannot be converted to {@code type}.
     */
    public static Value of(AttributeType type, Object raw, boolean classValue) {
        ArgumentUtil.checkNotNull(type, "type");
        switch (type) {
        case INTEGER:
            return integer(raw, classValue);
        case NUMERIC:
            return numeric(raw, classValue);
        case STRING:
            return string(raw, classValue);
        case NOMINAL:
            return nominal(raw, classValue);
        case DATE:
            return date(raw, classValue);
        default:
            throw new AssertionError("unhandled type " + type);
        }
    }

    /**
     * Creates an integer value.
     *
     * @param raw
     *     A {@link Number} with no fractional part, text that spells an integer, or {@link #MISSING}.
     *
     * @return A new value.
     *
     * @throws IllegalArgumentException
     *     if {@code raw} is not an integer.
     */
    public static Value integer(Object raw) {
        return integer(raw, false);
    }

    /**
     * Creates an integer value that may be the class label.
     *
     * @param raw
     *     A {@link Number} with no fractional part, text that spells an integer, or {@link #MISSING}.
     * @param classValue
     *     Whether this value is the class label.
     *
     * @return A new value.
     *
     * @throws IllegalArgumentException
     *     if {@code raw} is not an integer.
     */
    public static Value integer(Object raw, boolean classValue) {
        ArgumentUtil.checkNotNull(raw, "raw");
        if (MISSING.equals(raw)) {
            return new Value(AttributeType.INTEGER, MISSING, classValue);
        }
        return new Value(AttributeType.INTEGER, toLong(raw), classValue);
    }

    /**
     * Creates a numeric (floating point) value.
     *
     * @param raw
     *     A {@link Number}, text that spells a number, or {@link #MISSING}.
     *
     * @return A new value.
     *
     * @throws IllegalArgumentException
     *     if {@code raw} is not a number.
     */
    public static Value numeric(Object raw) {
        return numeric(raw, false);
    }

    /**
     * Creates a numeric (floating point) value that may be the class label.
     *
     * @param raw
     *     A {@link Number}, text that spells a number, or {@link #MISSING}.
     * @param classValue
     *     Whether this value is the class label.
     *
     * @return A new value.
     *
     * @throws IllegalArgumentException
     *     if {@code raw} is not a number.
     */
    public static Value numeric(Object raw, boolean classValue) {
        ArgumentUtil.checkNotNull(raw, "raw");
        if (MISSING.equals(raw)) {
            return new Value(AttributeType.NUMERIC, MISSING, classValue);
        }
        return new Value(AttributeType.NUMERIC, toDouble(raw), classValue);
    }

    /**
     * Creates a string value.
     *
     * @param raw
     *     Any object.  Its textual form becomes the payload.
     *
     * @return A new value.
     */
    public static Value string(Object raw) {
        return string(raw, false);
    }

    /**
     * Creates a string value that may be the class label.
     *
     * @param raw
     *     Any object.  Its textual form becomes the payload.
     * @param classValue
     *     Whether this value is the class label.
     *
     * @return A new value.
     */
    public static Value string(Object raw, boolean classValue) {
        ArgumentUtil.checkNotNull(raw, "raw");
        return new Value(AttributeType.STRING, raw.toString(), classValue);
    }

    /**
     * Creates a nominal value.
     *
     * @param raw
     *     Any object.  Its textual form becomes the payload.
     *
     * @return A new value.
     */
    public static Value nominal(Object raw) {
        return nominal(raw, false);
    }

    /**
     * Creates a nominal value that may be the class label.
     *
     * @param raw
     *     Any object.  Its textual form becomes the payload.
     * @param classValue
     *     Whether this value is the class label.
     *
     * @return A new value.
     */
    public static Value nominal(Object raw, boolean classValue) {
        ArgumentUtil.checkNotNull(raw, "raw");
        return new Value(AttributeType.NOMINAL, raw.toString(), classValue);
    }

    /**
     * Creates a date value.
     *
     * @param raw
     *     A {@link TemporalAccessor}, such as a {@code LocalDate} or a {@code LocalDateTime}, free text that describes
     *     a date, or {@link #MISSING}.
     *
     * @return A new value.
     *
     * @throws IllegalArgumentException
     *     if {@code raw} is neither a temporal object nor text.
     */
    public static Value date(Object raw) {
        return date(raw, false);
    }

    /**
     * Creates a date value that may be the class label.
     *
     * @param raw
     *     A {@link TemporalAccessor}, such as a {@code LocalDate} or a {@code LocalDateTime}, free text that describes
     *     a date, or {@link #MISSING}.
     * @param classValue
     *     Whether this value is the class label.
     *
     * @return A new value.
     *
     * @throws IllegalArgumentException
     *     if {@code raw} is neither a temporal object nor text.
     */
    public static Value date(Object raw, boolean classValue) {
        ArgumentUtil.checkNotNull(raw, "raw");
        if (raw instanceof TemporalAccessor) {
            return new Value(AttributeType.DATE, raw, classValue);
        }
        if (raw instanceof CharSequence) {
            return new Value(AttributeType.DATE, raw.toString(), classValue);
        }
        throw new IllegalArgumentException("cannot convert " + describe(raw) + " to a date value");
    }

    /**
     * Wraps a datum whose type is not known.
     * <p>
     * This should only be used when there's no schema to say what the type is.  The type is inferred by trying, in
     * order:
     * </p>
     * <ol>
     * <li>If {@code raw} is already a {@code Value}, it is returned.</li>
     * <li>The missing marker and all other text become {@link AttributeType#STRING} values.</li>
     * <li>{@link AttributeType#NUMERIC}</li>
     * <li>{@link AttributeType#INTEGER}</li>
     * <li>{@link AttributeType#DATE}</li>
     * </ol>
     * <p>
     * Because numeric is tried before integer, a {@code Long} or an {@code Integer} becomes a numeric value.
     * </p>
     *
     * @param raw
     *     The datum to wrap.
     *
     * @return A value.
     *
     * @throws IllegalArgumentException
     *     if no type accepts {@code raw}.
     */
    public static Value wrap(Object raw) {
        ArgumentUtil.checkNotNull(raw, "raw");
        if (raw instanceof Value value) {
            return value;
        }
        if (MISSING.equals(raw) || raw instanceof CharSequence) {
            return string(raw);
        }
        try {
            return numeric(raw);
        } catch (IllegalArgumentException e) {
            // fall through to the next type
        }
        try {
            return integer(raw);
        } catch (IllegalArgumentException e) {
            // fall through to the next type
        }
        try {
            return date(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("cannot infer the type of " + describe(raw), e);
        }
    }

    private static String describe(Object raw) {
        return raw.getClass().getSimpleName() + " \"" + raw + "\"";
    }

    private static long toLong(Object raw) {
        try {
            if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof BigInteger bigInteger) {
                return bigInteger.longValueExact();
            }
            if (raw instanceof BigDecimal bigDecimal) {
                return bigDecimal.longValueExact();
            }
            if (raw instanceof Double || raw instanceof Float) {
                double doubleValue = ((Number) raw).doubleValue();
                if (Double.isFinite(doubleValue) && doubleValue == Math.rint(doubleValue) &&
                    Long.MIN_VALUE <= doubleValue && doubleValue < 0x1p63) {
                    return (long) doubleValue;
                }
            } else if (raw instanceof CharSequence) {
                return Long.parseLong(raw.toString().strip());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("cannot convert " + describe(raw) + " to an integer value", e);
        }
        throw new IllegalArgumentException("cannot convert " + describe(raw) + " to an integer value");
    }

    private static double toDouble(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof CharSequence) {
            String text = raw.toString().strip();
            if (DECIMAL.matcher(text).matches()) {
                return Double.parseDouble(text);
            }
            if (NOT_A_NUMBER.matcher(text).matches()) {
                return Double.NaN;
            }
            if (INFINITY.matcher(text).matches()) {
                return text.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
        }
        throw new IllegalArgumentException("cannot convert " + describe(raw) + " to a numeric value");
    }

    /**
     * Gets the type of the attribute that this value belongs to.
     *
     * @return This value's type. This is never {@code null}.
     */
    public AttributeType type() {
        return type;
    }

    /**
     * Gets the payload.
     *
     * @return The payload, which is {@link #MISSING} for a missing value.  This is never {@code null}.
     */
    public Object value() {
        return value;
    }

    /**
     * Whether this value is the missing marker.
     *
     * @return {@code true}, if this value is missing; {@code false}, otherwise.
     */
    public boolean isMissing() {
        return MISSING.equals(value);
    }

    /**
     * Whether this value is the class label.
     *
     * @return {@code true}, if this value designates its attribute as the class attribute.
     */
    public boolean isClass() {
        return classValue;
    }

    /**
     * Creates a copy of this value that is flagged as the class label.
     *
     * @return A value with the same type and payload.
     */
    public Value asClass() {
        return classValue ? this : new Value(type, value, true);
    }

    /**
     * Adds another value of the same type to this one.
     *
     * @param other
     *     The value to add.
     *
     * @return The sum, with this value's class flag.
     *
     * @throws IllegalArgumentException
     *     if {@code other} doesn't have the same numeric type as this value.
     * @throws IllegalStateException
     *     if either value is missing.
     */
    public Value plus(Value other) {
        ArgumentUtil.checkNotNull(other, "other");
        checkArithmetic("add", other);
        if (type == AttributeType.INTEGER) {
            return new Value(type, Math.addExact((Long) value, (Long) other.value), classValue);
        }
        return new Value(type, (Double) value + (Double) other.value, classValue);
    }

    /**
     * Adds a number to this value.
     *
     * @param number
     *     The number to add.  For integer values, it must not have a fractional part.
     *
     * @return The sum, with this value's class flag.
     *
     * @throws IllegalArgumentException
     *     if this value is not numeric, or if it's an integer and {@code number} is not.
     * @throws IllegalStateException
     *     if this value is missing.
     */
    public Value plus(Number number) {
        ArgumentUtil.checkNotNull(number, "number");
        return plus(of(type == AttributeType.INTEGER ? AttributeType.INTEGER : AttributeType.NUMERIC, number, false));
    }

    /**
     * Divides this numeric value by another.
     *
     * @param divisor
     *     The numeric value by which to divide.
     *
     * @return The quotient, with this value's class flag.
     *
     * @throws IllegalArgumentException
     *     if either value is not {@link AttributeType#NUMERIC}.
     * @throws IllegalStateException
     *     if either value is missing.
     * @throws ArithmeticException
     *     if {@code divisor} is zero.
     */
    public Value dividedBy(Value divisor) {
        ArgumentUtil.checkNotNull(divisor, "divisor");
        if (type != AttributeType.NUMERIC) {
            throw new IllegalArgumentException("cannot divide " + type + " values");
        }
        checkArithmetic("divide", divisor);
        if ((Double) divisor.value == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return new Value(type, (Double) value / (Double) divisor.value, classValue);
    }

    /**
     * Divides this numeric value by a number.
     *
     * @param divisor
     *     The number by which to divide.
     *
     * @return The quotient, with this value's class flag.
     *
     * @throws IllegalArgumentException
     *     if this value is not {@link AttributeType#NUMERIC}.
     * @throws IllegalStateException
     *     if this value is missing.
     * @throws ArithmeticException
     *     if {@code divisor} is zero.
     */
    public Value dividedBy(Number divisor) {
        ArgumentUtil.checkNotNull(divisor, "divisor");
        return dividedBy(numeric(divisor));
    }

    private void checkArithmetic(String operation, Value other) {
        if (!type.isNumeric()) {
            throw new IllegalArgumentException("cannot " + operation + " " + type + " values");
        }
        if (other.type != type) {
            throw new IllegalArgumentException(
                "cannot " + operation + " a " + other.type + " value and a " + type + " value");
        }
        if (isMissing() || other.isMissing()) {
            throw new IllegalStateException("cannot " + operation + " missing values");
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, classValue);
    }

    /**
     * Determines if this value is equal to another object.
     * <p>
     * Two values are equal if and only if their type, payload, and class flag are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this value.
     *
     * @return {@code true}, if this value is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Value otherValue)) {
            return false;
        }
        return type == otherValue.type && value.equals(otherValue.value) && classValue == otherValue.classValue;
    }

    /**
     * Gets the payload's textual form.
     *
     * @return The payload as a string.
     */
    @Override
    public String toString() {
        return value.toString();
    }
}
