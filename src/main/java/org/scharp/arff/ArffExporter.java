///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Streams an ARFF to a file, one row at a time.
 * <p>
 * The header is written and flushed when the exporter is created.  Each row is flushed as soon as it's written, so a
 * reader that tails the file sees rows promptly.  After the final row, you must invoke {@link #close()}.
 * </p>
 * <pre>
 * try (ArffExporter exporter = new ArffExporter(targetLocation, schema)) {
 *     for (Row row : rows) {
 *         exporter.writeRow(row);
 *     }
 * }
 * </pre>
 * <p>
 * The schema must not change while the exporter is open, since the header has already been written.
 * </p>
 */
public final class ArffExporter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArffExporter.class);

    private final Path targetLocation;
    private final ArffWriter arffWriter;
    private final RowFormat rowFormat;
    private Writer writer;

    private int totalRowsWritten;

    /**
     * Creates an {@code ArffExporter} that writes sparse rows.
     *
     * @param targetLocation
     *     The path to the file to which the ARFF should be written. If the file doesn't exist, then it will be created.
     *     If the file does exist, then its contents will be replaced.
     * @param schema
     *     The schema of the ARFF.
     *
     * @throws IOException
     *     If an I/O problem prevented the header from being written.
     */
    public ArffExporter(Path targetLocation, ArffSchema schema) throws IOException {
        this(targetLocation, schema, RowFormat.SPARSE, DateParser.LENIENT);
    }

    /**
     * Creates an {@code ArffExporter}.
     *
     * @param targetLocation
     *     The path to the file to which the ARFF should be written. If the file doesn't exist, then it will be created.
     *     If the file does exist, then its contents will be replaced.
     * @param schema
     *     The schema of the ARFF.
     * @param rowFormat
     *     How to encode rows.
     * @param dateParser
     *     The parser for date values that are given as free text.
     *
     * @throws IOException
     *     If an I/O problem prevented the header from being written.
     */
    public ArffExporter(Path targetLocation, ArffSchema schema, RowFormat rowFormat, DateParser dateParser)
        throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(schema, "schema");
        ArgumentUtil.checkNotNull(rowFormat, "rowFormat");

        this.targetLocation = targetLocation;
        this.arffWriter = new ArffWriter(schema, dateParser);
        this.rowFormat = rowFormat;
        this.totalRowsWritten = 0;

        writer = Files.newBufferedWriter(targetLocation, StandardCharsets.UTF_8);
        try {
            arffWriter.writeHeader(writer);
            writer.write("@data");
            writer.write(ArffWriter.LINE_SEPARATOR);
            writer.flush();
        } catch (IOException e) {
            writer.close();
            throw e;
        }
        LOGGER.debug("opened ARFF stream to {}", targetLocation);
    }

    /**
     * Appends a row to the ARFF and flushes it.
     *
     * @param row
     *     The row to write.
     *
     * @return {@code true} if a line was written; {@code false} if the row had nothing worth writing.
     *
     * @throws IllegalStateException
     *     if this exporter has been closed.
     * @throws IOException
     *     If an I/O error prevented the row from being written.
     */
    public boolean writeRow(Row row) throws IOException {
        ArgumentUtil.checkNotNull(row, "row");
        if (isClosed()) {
            throw new IllegalStateException("Cannot invoke writeRow on closed exporter");
        }

        boolean written = arffWriter.writeRow(writer, row, rowFormat);
        writer.flush();
        if (written) {
            totalRowsWritten++;
        }
        return written;
    }

    /**
     * Flushes any buffered data to the file.
     *
     * @throws IOException
     *     if there was a problem flushing the data.
     */
    public void flush() throws IOException {
        if (!isClosed()) {
            writer.flush();
        }
    }

    /**
     * Gets the location to which this exporter writes.
     *
     * @return The target file.
     */
    public Path location() {
        return targetLocation;
    }

    /**
     * Gets the number of rows that have been written.  Rows that had nothing worth writing are not counted.
     *
     * @return The number of data lines in the file.
     */
    public int totalRowsWritten() {
        return totalRowsWritten;
    }

    /**
     * Gets whether {@link #close()} has been invoked on this exporter.
     *
     * @return {@code true}, if this exporter is closed; {@code false}, otherwise.
     */
    public boolean isClosed() {
        return writer == null;
    }

    /**
     * Flushes any buffered data to the file and closes it.
     * <p>
     * This is safe to invoke multiple times.
     * </p>
     *
     * @throws IOException
     *     if there was a problem flushing any buffered data.
     */
    @Override
    public void close() throws IOException {
        if (!isClosed()) {
            Writer closing = writer;
            writer = null;
            closing.close();
            LOGGER.debug("closed ARFF stream to {} after {} row(s)", targetLocation, totalRowsWritten);
        }
    }

    /**
     * Writes an ARFF file with the given schema and rows to the file system.
     * <p>
     * If your data set is too large to hold in memory, then you should use the {@link ArffExporter} constructor and
     * stream the rows using {@link ArffExporter#writeRow writeRow}.
     * </p>
     *
     * @param targetLocation
     *     The path to the file to which the ARFF should be written. If the file doesn't exist, then it will be created.
     *     If the file does exist, then its contents will be replaced.
     * @param schema
     *     The data set's schema.
     * @param rows
     *     The rows to write.
     * @param rowFormat
     *     How to encode the rows.
     *
     * @throws IOException
     *     If a file I/O error prevents the dataset from being written.
     * @throws NullPointerException
     *     If any argument is {@code null}, or if {@code rows} contains a {@code null} row.
     */
    public static void exportDataset(Path targetLocation, ArffSchema schema, Iterable<Row> rows, RowFormat rowFormat)
        throws IOException {
        ArgumentUtil.checkNotNull(rows, "rows");

        try (ArffExporter exporter = new ArffExporter(targetLocation, schema, rowFormat, DateParser.LENIENT)) {
            for (Row row : rows) {
                if (row == null) {
                    throw new NullPointerException("rows must not contain a null row");
                }
                exporter.writeRow(row);
            }
        }
    }
}
