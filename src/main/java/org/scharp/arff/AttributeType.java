///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.util.Locale;

/**
 * The declared type of an ARFF attribute.
 */
public enum AttributeType {
    /** A whole number, declared as {@code integer} */
    INTEGER("integer"),

    /** A floating point number, declared as {@code numeric} or {@code real} */
    NUMERIC("numeric"),

    /** Free text, declared as {@code string} */
    STRING("string"),

    /** One of a finite set of values, declared as a brace-delimited list such as <code>{yes,no}</code> */
    NOMINAL("nominal"),

    /** A calendar value, declared as {@code date} with an optional pattern */
    DATE("date");

    private final String keyword;

    AttributeType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Gets the keyword with which this type is declared in an {@code @attribute} directive.
     * <p>
     * Nominal attributes are declared with their value set instead of a keyword, so the keyword for
     * {@link #NOMINAL} is only used in diagnostics.
     * </p>
     *
     * @return This type's keyword. This is never {@code null}.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Whether values of this type are numbers.
     *
     * @return {@code true} for {@link #INTEGER} and {@link #NUMERIC}; {@code false}, otherwise.
     */
    public boolean isNumeric() {
        return this == INTEGER || this == NUMERIC;
    }

    /**
     * Looks up the type that is declared with a given keyword.  The lookup is case-insensitive and
     * {@code real} is a synonym for {@code numeric}.
     *
     * @param keyword
     *     The keyword from an {@code @attribute} directive.
     *
     * @return The matching type, or {@code null} if {@code keyword} doesn't name a type that is declared by keyword.
     */
    static AttributeType forKeyword(String keyword) {
        switch (keyword.toLowerCase(Locale.ROOT)) {
        case "integer":
            return INTEGER;
        case "numeric":
        case "real":
            return NUMERIC;
        case "string":
            return STRING;
        case "date":
            return DATE;
        default:
            return null;
        }
    }

    @Override
    public String toString() {
        return keyword;
    }
}
