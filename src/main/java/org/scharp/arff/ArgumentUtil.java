///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.util.Collection;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {
    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null} or consists only of whitespace.
     *
     * @param argument
     *     The string to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is empty or blank.
     */
    static void checkNotBlank(String argument, String argumentName) {
        checkNotNull(argument, argumentName);
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " must not be blank");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null} or contains a {@code null} element.
     *
     * @param argument
     *     The collection to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null} or has a {@code null} element.
     */
    static void checkNoNullElements(Collection<?> argument, String argumentName) {
        checkNotNull(argument, argumentName);
        for (Object element : argument) {
            if (element == null) {
                throw new NullPointerException(argumentName + " must not contain a null entry");
            }
        }
    }
}
