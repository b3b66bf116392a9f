///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An attribute (column) of an ARFF relation.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link Attribute.Builder}:
 * </p>
 *
 * <pre>
 * Attribute outlookAttribute = Attribute.builder().
 *     name("outlook").
 *     type(AttributeType.NOMINAL).
 *     nominalValues(List.of("sunny", "overcast", "rainy")).
 *     build();
 * </pre>
 *
 * <p>
 * Nominal attributes carry the set of values they allow.  Date attributes carry a Weka-style date pattern such as
 * {@code yyyy-MM-dd HH:mm:ss}.  Other attributes carry no extra data.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a
 * {@code HashMap}.
 * </p>
 */
public final class Attribute {

    private final String name;
    private final AttributeType type;
    private final Set<String> nominalValues;
    private final String datePattern;

    /**
     * A builder class for {@link Attribute}.
     */
    public final static class Builder {
        private String name;
        private AttributeType type;
        private Set<String> nominalValues;
        private String datePattern;

        /**
         * Creates an {@code Attribute} builder.
         */
        private Builder() {
            this.name = null; // required parameter
            this.type = null; // required parameter

            this.nominalValues = Set.of(); // only meaningful for NOMINAL
            this.datePattern = DatePattern.DEFAULT; // only meaningful for DATE
        }

        /**
         * Sets the attribute's name.
         *
         * @param name
         *     The attribute's new name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code name} is blank.
         */
        public Builder name(String name) {
            ArgumentUtil.checkNotBlank(name, "name");
            this.name = name;
            return this;
        }

        /**
         * Sets the attribute's type.
         *
         * @param type
         *     The attribute's new type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code type} is {@code null}.
         */
        public Builder type(AttributeType type) {
            ArgumentUtil.checkNotNull(type, "type");
            this.type = type;
            return this;
        }

        /**
         * Sets the values that a nominal attribute allows.  The values are copied in iteration order.
         *
         * @param nominalValues
         *     The allowed values.  This may be empty, in which case values can be added later.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code nominalValues} is {@code null} or contains a {@code null} entry.
         */
        public Builder nominalValues(Collection<String> nominalValues) {
            ArgumentUtil.checkNoNullElements(nominalValues, "nominalValues");
            this.nominalValues = new LinkedHashSet<>(nominalValues);
            return this;
        }

        /**
         * Sets the pattern with which a date attribute's values are written.
         *
         * @param datePattern
         *     A Weka-style date pattern, such as {@code yyyy-MM-dd}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code datePattern} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code datePattern} is blank.
         */
        public Builder datePattern(String datePattern) {
            ArgumentUtil.checkNotBlank(datePattern, "datePattern");
            this.datePattern = datePattern;
            return this;
        }

        /**
         * Builds an immutable {@code Attribute} with the configured options.
         *
         * @return an {@code Attribute}
         *
         * @throws IllegalStateException
         *     if the name or type haven't been set, or if nominal values were given to an attribute whose type is not
         *     {@link AttributeType#NOMINAL}.
         */
        public Attribute build() {
            if (name == null) {
                throw new IllegalStateException("name must be set");
            }
            if (type == null) {
                throw new IllegalStateException("type must be set");
            }
            if (type != AttributeType.NOMINAL && !nominalValues.isEmpty()) {
                throw new IllegalStateException("only nominal attributes can have nominal values");
            }

            return new Attribute(
                name,
                type,
                type == AttributeType.NOMINAL ? nominalValues : Set.of(),
                type == AttributeType.DATE ? datePattern : null);
        }
    }

    /**
     * Creates a new Attribute builder with no nominal values and the default date pattern.
     * <p>
     * You must set the name and type before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Attribute(String name, AttributeType type, Set<String> nominalValues, String datePattern) {
        this.name = name;
        this.type = type;
        this.nominalValues = Collections.unmodifiableSet(nominalValues);
        this.datePattern = datePattern;
    }

    /**
     * Gets this attribute's name.
     *
     * @return This attribute's name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this attribute's declared type.
     *
     * @return This attribute's type. This is never {@code null}.
     */
    public AttributeType type() {
        return type;
    }

    /**
     * Gets the values that this attribute allows, in the order in which they were declared.
     *
     * @return An unmodifiable set.  This is empty for attributes that are not nominal.
     */
    public Set<String> nominalValues() {
        return nominalValues;
    }

    /**
     * Gets the pattern with which this attribute's values are formatted.
     *
     * @return A Weka-style date pattern for date attributes; {@code null} for all other attributes.
     */
    public String datePattern() {
        return datePattern;
    }

    /**
     * Determines if this nominal attribute allows a given value.  The comparison is made on the value's textual form.
     *
     * @param value
     *     The value to check.
     *
     * @return {@code true} if {@code value} is one of this attribute's nominal values; {@code false}, otherwise.
     */
    public boolean allows(Object value) {
        return nominalValues.contains(String.valueOf(value));
    }

    /**
     * Creates a copy of this nominal attribute which additionally allows {@code value}.
     *
     * @param value
     *     The value to allow.
     *
     * @return An attribute.  This is {@code this} if the value is already allowed.
     */
    Attribute withNominalValue(String value) {
        assert type == AttributeType.NOMINAL : "only nominal attributes have values";
        if (nominalValues.contains(value)) {
            return this;
        }
        Set<String> newValues = new LinkedHashSet<>(nominalValues);
        newValues.add(value);
        return new Attribute(name, type, newValues, datePattern);
    }

    /**
     * Gets a hash code for this attribute.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This attribute's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(name, type, nominalValues, datePattern);
    }

    /**
     * Determines if this attribute is equal to another object.
     * <p>
     * Two attributes are equal if and only if their name, type, nominal values (in any order), and date pattern are
     * all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this attribute.
     *
     * @return {@code true}, if this attribute is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Attribute otherAttribute)) {
            return false;
        }

        return name.equals(otherAttribute.name) &&
            type == otherAttribute.type &&
            nominalValues.equals(otherAttribute.nominalValues) &&
            Objects.equals(datePattern, otherAttribute.datePattern);
    }

    @Override
    public String toString() {
        return name + " (" + type + ")";
    }
}
