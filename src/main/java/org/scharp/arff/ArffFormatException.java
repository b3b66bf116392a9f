///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

/**
 * Thrown when ARFF text is malformed or holds a value that its header doesn't allow.
 */
public class ArffFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    /**
     * Creates an exception for a problem on a given line.
     *
     * @param lineNumber
     *     The 1-based number of the offending line.
     * @param message
     *     A description of the problem.
     */
    public ArffFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * Creates an exception for a problem on a given line that was detected by another exception.
     *
     * @param lineNumber
     *     The 1-based number of the offending line.
     * @param message
     *     A description of the problem.
     * @param cause
     *     The exception that detected the problem.
     */
    public ArffFormatException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Gets the number of the line on which the problem was found.
     *
     * @return A 1-based line number.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
