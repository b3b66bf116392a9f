///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library reads and writes ARFF files, the plain-text dataset format of the Weka machine learning workbench.
 * </p>
 *
 * <p>
 * Most programs only need {@link org.scharp.arff.ArffDataset}.  Rows can be collected in memory and written at the
 * end, or streamed to a file one at a time once the schema is known:
 * </p>
 * <pre>
 * ArffDataset dataset = new ArffDataset("weather");
 * dataset.append(Map.of("outlook", Value.nominal("sunny"), "temperature", Value.numeric(85)));
 * dataset.append(Map.of("outlook", Value.nominal("rainy"), "temperature", Value.numeric(70)));
 * dataset.save(targetLocation);
 * </pre>
 *
 * <h2>An ARFF Primer for Java Programmers</h2>
 *
 * <p>
 * An ARFF file describes a single table, which is called a "relation".  Each column is called an "attribute" and each
 * row is called an "instance".  The file has a header followed by the data:
 * </p>
 * <pre>
 * % Daily weather and whether tennis was played
 * &#64;relation weather
 * &#64;attribute outlook {overcast,rainy,sunny}
 * &#64;attribute temperature numeric
 * &#64;attribute play {no,yes}
 * &#64;data
 * sunny,85,no
 * {0 rainy, 1 70, 2 yes}
 * </pre>
 *
 * <p>
 * Lines that start with {@code %} are comments.  The comment lines at the very top of the file are kept as the
 * relation's comment; the rest are ignored.
 * </p>
 *
 * <p>
 * An attribute is one of five types.  {@code integer} and {@code numeric} (or {@code real}) hold numbers.
 * {@code string} holds free text.  A nominal attribute is declared with the finite set of values it allows, such as
 * <code>{yes,no}</code>.  {@code date} holds calendar values that are written with a pattern such as
 * {@code "yyyy-MM-dd HH:mm:ss"}.  In every type, a {@code ?} means the value is missing.
 * </p>
 *
 * <p>
 * Each data line is either "dense", which lists a value for every attribute in order, or "sparse", which lists
 * {@code index value} pairs within braces.  An attribute that is left out of a sparse line is absent, which Weka
 * treats as zero for numbers and as the first nominal value.  That's not the same as missing.
 * </p>
 *
 * <p>
 * Weka's classifiers predict one attribute, the "class" attribute, from the others.  By convention it's the last
 * attribute.  This library keeps it last.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * This library checks its input strictly and throws clear exceptions as soon as possible (fail-fast).  Invalid
 * arguments throw {@link java.lang.NullPointerException} or {@link java.lang.IllegalArgumentException}.  Operations
 * that conflict with a dataset's current state, such as changing the class attribute or growing the schema while
 * streaming, throw {@link java.lang.IllegalStateException}.  Malformed ARFF text throws an
 * {@link org.scharp.arff.ArffFormatException} that names the offending line.
 * </p>
 * <p>
 * The one exception is a dense data line with the wrong number of values.  Such a line can't be matched to the
 * attributes, so this library logs a warning through SLF4J and skips the line instead of rejecting the whole file.
 * </p>
 */
package org.scharp.arff;
