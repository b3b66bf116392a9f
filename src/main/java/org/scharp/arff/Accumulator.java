///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

/**
 * A running total of integer or numeric values.
 * <p>
 * Since {@link Value} is immutable, this is how to accumulate in place:
 * </p>
 * <pre>
 * Accumulator total = new Accumulator(Value.numeric(0));
 * for (Value value : values) {
 *     total.add(value);
 * }
 * Value sum = total.total();
 * </pre>
 * <p>
 * The total keeps the class flag of the initial value.  Instances of this class are not thread-safe.
 * </p>
 */
public final class Accumulator {

    private Value total;

    /**
     * Creates an accumulator.
     *
     * @param initial
     *     The starting value. This must be an {@link AttributeType#INTEGER} or {@link AttributeType#NUMERIC} value that
     *     is not missing.
     *
     * @throws NullPointerException
     *     if {@code initial} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code initial} is not numeric.
     * @throws IllegalStateException
     *     if {@code initial} is missing.
     */
    public Accumulator(Value initial) {
        ArgumentUtil.checkNotNull(initial, "initial");
        if (!initial.type().isNumeric()) {
            throw new IllegalArgumentException("cannot accumulate " + initial.type() + " values");
        }
        if (initial.isMissing()) {
            throw new IllegalStateException("cannot accumulate from a missing value");
        }
        total = initial;
    }

    /**
     * Adds a value of the same type to the total.
     *
     * @param value
     *     The value to add.
     *
     * @return This accumulator
     *
     * @throws IllegalArgumentException
     *     if {@code value} has a different type than the total.
     * @throws IllegalStateException
     *     if {@code value} is missing.
     */
    public Accumulator add(Value value) {
        total = total.plus(value);
        return this;
    }

    /**
     * Adds a number to the total.
     *
     * @param number
     *     The number to add.
     *
     * @return This accumulator
     *
     * @throws IllegalArgumentException
     *     if the total is an integer and {@code number} has a fractional part.
     */
    public Accumulator add(Number number) {
        total = total.plus(number);
        return this;
    }

    /**
     * Gets the current total.
     *
     * @return The total.  This is never {@code null}.
     */
    public Value total() {
        return total;
    }
}
