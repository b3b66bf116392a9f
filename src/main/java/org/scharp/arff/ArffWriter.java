///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a schema and its rows as ARFF text.
 * <p>
 * The writer reads the schema each time it formats something, so it always reflects the schema's current state.
 * </p>
 */
public final class ArffWriter {

    static final String LINE_SEPARATOR = "\n";

    private final ArffSchema schema;
    private final DateParser dateParser;
    private final Map<String, DateTimeFormatter> dateFormatters;

    /**
     * Creates a writer that parses free-text dates with {@link DateParser#LENIENT}.
     *
     * @param schema
     *     The schema of the rows to write.
     *
     * @throws NullPointerException
     *     if {@code schema} is {@code null}.
     */
    public ArffWriter(ArffSchema schema) {
        this(schema, DateParser.LENIENT);
    }

    /**
     * Creates a writer.
     *
     * @param schema
     *     The schema of the rows to write.
     * @param dateParser
     *     The parser for date values that are given as free text.
     *
     * @throws NullPointerException
     *     if {@code schema} or {@code dateParser} is {@code null}.
     */
    public ArffWriter(ArffSchema schema, DateParser dateParser) {
        ArgumentUtil.checkNotNull(schema, "schema");
        ArgumentUtil.checkNotNull(dateParser, "dateParser");
        this.schema = schema;
        this.dateParser = dateParser;
        this.dateFormatters = new HashMap<>();
    }

    /**
     * Wraps text in single quotes.  Text that is already quoted is not quoted again.
     */
    static String quote(String text) {
        return ("'" + text + "'").replace("''", "'");
    }

    /**
     * Writes the comment, relation, and attribute directives.
     *
     * @param out
     *     Where to write the header.
     *
     * @throws IOException
     *     if {@code out} couldn't be written to.
     */
    public void writeHeader(Appendable out) throws IOException {
        if (!schema.comment().isEmpty()) {
            out.append("% ").append(schema.comment().replace("\n", "\n% ")).append(LINE_SEPARATOR);
        }
        out.append("@relation ").append(schema.relation()).append(LINE_SEPARATOR);
        for (Attribute attribute : schema.attributes()) {
            out.append(formatAttribute(attribute)).append(LINE_SEPARATOR);
        }
    }

    /**
     * Formats the header as a string.
     *
     * @return The header text.
     */
    public String formatHeader() {
        StringBuilder builder = new StringBuilder();
        try {
            writeHeader(builder);
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringBuilder doesn't throw IOException
        }
        return builder.toString();
    }

    /**
     * Formats an {@code @attribute} directive.  Nominal values are sorted and the missing marker is left out.
     */
    static String formatAttribute(Attribute attribute) {
        String prefix = "@attribute " + quote(attribute.name()) + " ";
        switch (attribute.type()) {
        case INTEGER:
        case NUMERIC:
        case STRING:
            return prefix + attribute.type().keyword();
        case NOMINAL:
            return prefix + attribute.nominalValues().stream().
                filter(value -> !Value.MISSING.equals(value)).
                sorted().
                collect(Collectors.joining(",", "{", "}"));
        case DATE:
            return prefix + "date \"" + attribute.datePattern() + "\"";
        default:
            throw new AssertionError("unhandled type " + attribute.type());
        }
    }

    /**
     * Writes the {@code @data} directive followed by one line per row.  Rows that format to nothing are skipped.
     *
     * @param out
     *     Where to write the rows.
     * @param rows
     *     The rows to write.
     * @param format
     *     How to encode the rows.
     *
     * @throws IOException
     *     if {@code out} couldn't be written to.
     */
    public void writeData(Appendable out, Iterable<Row> rows, RowFormat format) throws IOException {
        out.append("@data").append(LINE_SEPARATOR);
        for (Row row : rows) {
            writeRow(out, row, format);
        }
    }

    /**
     * Writes a single row.
     *
     * @param out
     *     Where to write the row.
     * @param row
     *     The row to write.
     * @param format
     *     How to encode the row.
     *
     * @return {@code true} if a line was written; {@code false} if the row formatted to nothing.
     *
     * @throws IOException
     *     if {@code out} couldn't be written to.
     */
    public boolean writeRow(Appendable out, Row row, RowFormat format) throws IOException {
        String line = formatRow(row, format);
        if (line == null) {
            return false;
        }
        out.append(line).append(LINE_SEPARATOR);
        return true;
    }

    /**
     * Formats a row.
     *
     * @param row
     *     The row to format.
     * @param format
     *     How to encode the row.
     *
     * @return The row's text, or {@code null} if a sparse row has nothing worth writing.
     */
    public String formatRow(Row row, RowFormat format) {
        ArgumentUtil.checkNotNull(row, "row");
        ArgumentUtil.checkNotNull(format, "format");
        return format == RowFormat.DENSE ? formatDenseRow(row) : formatSparseRow(row);
    }

    /**
     * Formats a dense row as comma-separated values in schema order.
     *
     * @param row
     *     A dense row.
     *
     * @return The row's text.  This is never {@code null}.
     *
     * @throws IllegalArgumentException
     *     if {@code row} is sparse.
     * @throws UnsupportedOperationException
     *     if the schema has a date attribute.
     */
    public String formatDenseRow(Row row) {
        if (row.isSparse()) {
            throw new IllegalArgumentException("only dense rows can be written in the dense format");
        }
        List<Attribute> attributes = schema.attributes();
        List<Object> cells = row.cells();
        int width = Math.min(attributes.size(), cells.size());

        List<String> line = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            Attribute attribute = attributes.get(i);
            Object cell = cells.get(i);
            if (cell instanceof Value value) {
                cell = value.value();
            }
            switch (attribute.type()) {
            case INTEGER:
            case NUMERIC:
            case NOMINAL:
                line.add(cell.toString());
                break;
            case STRING:
                line.add(quote(cell.toString()));
                break;
            default:
                throw new UnsupportedOperationException("Type " + attribute.type() + " not supported for writing!");
            }
        }
        return String.join(",", line);
    }

    /**
     * Formats a row in the sparse encoding.
     * <p>
     * A dense row is first keyed by attribute name, with each cell wrapped in a value of its attribute's type.  Then,
     * in schema order, every value that is present becomes an {@code index value} token.  A nominal value that isn't
     * in its attribute's value set is left out.  A row that ends up with no tokens, or only a missing value, formats
     * to nothing.
     * </p>
     * <p>
     * String values are written within double quotes and aren't escaped, so a string that contains a double quote
     * can't be read back.
     * </p>
     *
     * @param row
     *     A dense or sparse row.
     *
     * @return The row's text, or {@code null} if the row has nothing worth writing.
     */
    public String formatSparseRow(Row row) {
        Map<String, Value> fields = row.isSparse() ? row.fields() : toFields(row.cells());

        List<String> tokens = new ArrayList<>();
        boolean onlyMissing = true;
        List<Attribute> attributes = schema.attributes();
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = attributes.get(i);
            Value value = fields.get(attribute.name());
            if (value == null) {
                continue; // absent
            }

            final String text;
            if (value.isMissing()) {
                text = Value.MISSING;
            } else {
                if (attribute.type() == AttributeType.NOMINAL && !attribute.allows(value.value())) {
                    continue;
                }
                onlyMissing = false;
                switch (value.type()) {
                case STRING:
                    text = '"' + value.value().toString() + '"';
                    break;
                case DATE:
                    text = formatDate(attribute, value);
                    break;
                default:
                    text = value.value().toString();
                    break;
                }
            }
            tokens.add(i + " " + smartQuote(text));
        }

        if (tokens.isEmpty() || (tokens.size() == 1 && onlyMissing)) {
            return null;
        }
        return "{" + String.join(", ", tokens) + "}";
    }

    private Map<String, Value> toFields(List<Object> cells) {
        Map<String, Value> fields = new HashMap<>();
        List<Attribute> attributes = schema.attributes();
        int width = Math.min(attributes.size(), cells.size());
        for (int i = 0; i < width; i++) {
            Attribute attribute = attributes.get(i);
            Object cell = cells.get(i);
            final Value value;
            if (cell instanceof Value cellValue) {
                value = cellValue;
            } else if (Value.MISSING.equals(cell)) {
                value = Value.string(cell);
            } else {
                value = Value.of(attribute.type(), cell, false);
            }
            fields.put(attribute.name(), value);
        }
        return fields;
    }

    private String formatDate(Attribute attribute, Value value) {
        final LocalDateTime dateTime;
        if (value.value() instanceof TemporalAccessor temporal) {
            dateTime = DateParser.toLocalDateTime(temporal);
        } else {
            dateTime = dateParser.parse(value.value().toString());
        }
        String pattern = attribute.type() == AttributeType.DATE ? attribute.datePattern() : DatePattern.DEFAULT;
        return dateFormatters.computeIfAbsent(pattern, DatePattern::toFormatter).format(dateTime);
    }

    private static String smartQuote(String text) {
        if (!text.startsWith("\"") && text.chars().anyMatch(Character::isWhitespace)) {
            return '"' + text + '"';
        }
        return text;
    }
}
