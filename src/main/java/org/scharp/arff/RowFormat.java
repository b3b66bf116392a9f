///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

/**
 * How rows are encoded in the data section of an ARFF.
 */
public enum RowFormat {
    /** One comma-separated value per attribute, in schema order */
    DENSE,

    /** A brace-delimited list of {@code index value} pairs that omits absent attributes */
    SPARSE,
}
