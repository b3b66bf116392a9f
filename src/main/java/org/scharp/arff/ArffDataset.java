///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * An ARFF relation: a schema together with its rows.
 * <p>
 * A dataset keeps its rows in one of two mutually exclusive ways:
 * </p>
 * <ul>
 * <li><b>In memory</b> (the default): rows are kept in a list.  Appending a row may grow the schema; an unknown
 * attribute is added at the end and an unknown nominal value is added to its attribute's value set.</li>
 * <li><b>Streaming</b>: after {@link #openStream(Path)}, the header has been written to a file and the schema is
 * frozen. Each appended row is written to the file immediately and not kept.  Values for unknown attributes and unknown
 * nominal values are silently dropped from the row.  {@link #closeStream()} must be invoked to release the file.</li>
 * </ul>
 * <p>
 * A value that is flagged as the class label designates its attribute as the class attribute.  Only one attribute can
 * ever be the class attribute, and it's always kept last.
 * </p>
 * <p>
 * Instances of this class are not thread-safe.
 * </p>
 */
public final class ArffDataset {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArffDataset.class);

    private final ArffSchema schema;
    private final List<Row> rows;
    private ArffExporter stream;
    private boolean streamClosed;

    /**
     * Creates an empty dataset with a blank relation name.
     */
    public ArffDataset() {
        this("");
    }

    /**
     * Creates an empty dataset.
     *
     * @param relation
     *     The relation's name.
     *
     * @throws NullPointerException
     *     if {@code relation} is {@code null}.
     */
    public ArffDataset(String relation) {
        this(ArffSchema.builder().relation(relation).build());
    }

    /**
     * Creates an empty dataset with a copy of a schema.
     *
     * @param schema
     *     The schema to copy.
     *
     * @throws NullPointerException
     *     if {@code schema} is {@code null}.
     */
    public ArffDataset(ArffSchema schema) {
        ArgumentUtil.checkNotNull(schema, "schema");
        this.schema = schema.copy();
        this.rows = new ArrayList<>();
        this.stream = null;
        this.streamClosed = false;
    }

    /**
     * Parses ARFF text.
     *
     * @param text
     *     The ARFF text.
     *
     * @return A new dataset.
     *
     * @throws ArffFormatException
     *     if the text is malformed.
     */
    public static ArffDataset parse(String text) {
        return parse(text, false);
    }

    /**
     * Parses ARFF text, optionally skipping the rows.
     *
     * @param text
     *     The ARFF text.
     * @param schemaOnly
     *     {@code true} to stop at the {@code @data} directive.
     *
     * @return A new dataset.
     *
     * @throws ArffFormatException
     *     if the text is malformed.
     */
    public static ArffDataset parse(String text, boolean schemaOnly) {
        return ArffParser.builder().schemaOnly(schemaOnly).build().parse(text);
    }

    /**
     * Reads an ARFF file.
     *
     * @param sourceLocation
     *     The file to read.
     *
     * @return A new dataset.
     *
     * @throws IOException
     *     if the file couldn't be read.
     * @throws ArffFormatException
     *     if the file is malformed.
     */
    public static ArffDataset load(Path sourceLocation) throws IOException {
        return load(sourceLocation, false);
    }

    /**
     * Reads an ARFF file, optionally skipping the rows.
     *
     * @param sourceLocation
     *     The file to read.
     * @param schemaOnly
     *     {@code true} to stop at the {@code @data} directive.
     *
     * @return A new dataset.
     *
     * @throws IOException
     *     if the file couldn't be read.
     * @throws ArffFormatException
     *     if the file is malformed.
     */
    public static ArffDataset load(Path sourceLocation, boolean schemaOnly) throws IOException {
        return ArffParser.builder().schemaOnly(schemaOnly).build().load(sourceLocation);
    }

    /**
     * Creates an in-memory copy of this dataset.
     *
     * @param schemaOnly
     *     {@code true} to copy only the relation name, attributes, and class attribute; {@code false} to also copy the
     *     comment and the rows.
     *
     * @return A new dataset.
     */
    public ArffDataset copy(boolean schemaOnly) {
        ArffDataset copy = new ArffDataset(schema);
        if (schemaOnly) {
            copy.schema.setComment("");
        } else {
            copy.rows.addAll(rows); // rows are immutable
        }
        return copy;
    }

    /**
     * Gets this dataset's schema.  The schema reflects all later changes made through this dataset.
     *
     * @return The schema.  This is never {@code null}.
     */
    public ArffSchema schema() {
        return schema;
    }

    /**
     * Gets the rows held in memory.  A streaming dataset holds no rows.
     *
     * @return An unmodifiable view of the rows.
     */
    public List<Row> rows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Gets the number of rows held in memory.
     *
     * @return The number of rows.
     */
    public int size() {
        return rows.size();
    }

    /**
     * Sets the relation's name.
     *
     * @param relation
     *     The new name.
     *
     * @throws IllegalStateException
     *     if this dataset is streaming.
     */
    public void setRelation(String relation) {
        ArgumentUtil.checkNotNull(relation, "relation");
        checkSchemaIsMutable();
        schema.setRelation(relation);
    }

    /**
     * Sets the comment that is written before the relation.
     *
     * @param comment
     *     The new comment, with lines separated by {@code \n}.
     *
     * @throws IllegalStateException
     *     if this dataset is streaming.
     */
    public void setComment(String comment) {
        ArgumentUtil.checkNotNull(comment, "comment");
        checkSchemaIsMutable();
        schema.setComment(comment);
    }

    /**
     * Adds an attribute that carries no extra data.
     *
     * @param name
     *     The attribute's name.
     * @param type
     *     The attribute's type.  Nominal attributes start with no values and date attributes use the default pattern.
     *
     * @throws IllegalArgumentException
     *     if an attribute named {@code name} already exists.
     * @throws IllegalStateException
     *     if this dataset is streaming.
     */
    public void defineAttribute(String name, AttributeType type) {
        defineAttribute(Attribute.builder().name(name).type(type).build());
    }

    /**
     * Adds an attribute.  The class attribute is kept last.
     *
     * @param attribute
     *     The new attribute.
     *
     * @throws IllegalArgumentException
     *     if an attribute with the same name already exists.
     * @throws IllegalStateException
     *     if this dataset is streaming.
     */
    public void defineAttribute(Attribute attribute) {
        ArgumentUtil.checkNotNull(attribute, "attribute");
        checkSchemaIsMutable();
        List<String> previousOrder = schema.attributeNames();
        schema.addAttribute(attribute);
        schema.moveClassToEnd();
        realignDenseRows(previousOrder);
    }

    /**
     * Designates the class attribute and moves it to the end.
     *
     * @param name
     *     The name of an existing attribute.
     *
     * @throws IllegalArgumentException
     *     if there's no attribute named {@code name}.
     * @throws IllegalStateException
     *     if a different class attribute has already been designated or if this dataset is streaming.
     */
    public void setClassAttribute(String name) {
        ArgumentUtil.checkNotNull(name, "name");
        checkSchemaIsMutable();
        if (schema.indexOf(name) < 0) {
            throw new IllegalArgumentException("there is no attribute named \"" + name + "\"");
        }
        List<String> previousOrder = schema.attributeNames();
        schema.designateClass(name);
        schema.moveClassToEnd();
        realignDenseRows(previousOrder);
    }

    /**
     * Adds values to a nominal attribute's value set.
     *
     * @param name
     *     The name of a nominal attribute.
     * @param values
     *     The values to add.
     *
     * @throws IllegalArgumentException
     *     if there's no nominal attribute named {@code name}.
     * @throws IllegalStateException
     *     if this dataset is streaming.
     */
    public void addNominalValues(String name, Collection<String> values) {
        ArgumentUtil.checkNoNullElements(values, "values");
        checkSchemaIsMutable();
        Attribute attribute = schema.attribute(name);
        if (attribute == null || attribute.type() != AttributeType.NOMINAL) {
            throw new IllegalArgumentException("there is no nominal attribute named \"" + name + "\"");
        }
        for (String value : values) {
            attribute = attribute.withNominalValue(value);
        }
        schema.replaceAttribute(attribute);
    }

    /**
     * Sorts the attributes by name, except for the class attribute, which is kept last.
     *
     * @throws IllegalStateException
     *     if this dataset is streaming.
     */
    public void alphabetizeAttributes() {
        checkSchemaIsMutable();
        List<String> previousOrder = schema.attributeNames();
        schema.alphabetize();
        realignDenseRows(previousOrder);
    }

    private void checkSchemaIsMutable() {
        if (isStreaming()) {
            throw new IllegalStateException("the schema cannot change after it has been written to a stream");
        }
    }

    /**
     * Rearranges the cells of the dense rows held in memory to follow the current attribute order.  A row gets a
     * missing cell for each attribute that isn't in {@code previousOrder}.
     */
    private void realignDenseRows(List<String> previousOrder) {
        List<String> currentOrder = schema.attributeNames();
        if (currentOrder.equals(previousOrder)) {
            return;
        }
        for (ListIterator<Row> iterator = rows.listIterator(); iterator.hasNext(); ) {
            Row row = iterator.next();
            if (!row.isSparse()) {
                List<Object> cells = new ArrayList<>(currentOrder.size());
                for (String name : currentOrder) {
                    int index = previousOrder.indexOf(name);
                    cells.add(index < 0 || row.size() <= index ? Value.MISSING : row.cells().get(index));
                }
                iterator.set(Row.dense(cells));
            }
        }
    }

    /**
     * Appends a row given as values keyed by attribute name.
     * <p>
     * Each entry may be a {@link Value} or a raw datum, which is wrapped in a value of its attribute's declared type
     * (or, for an unknown attribute, the type inferred by {@link Value#wrap}).  In memory, unknown attributes and
     * nominal values grow the schema.  While streaming, they are dropped from the row.
     * </p>
     *
     * @param fields
     *     The row's values.
     *
     * @throws IllegalArgumentException
     *     if a raw datum cannot be converted to its attribute's type.
     * @throws IllegalStateException
     *     if a value's type doesn't match its attribute's type, if a value designates a different class attribute than
     *     the one already designated, if the row would change a schema that was already streamed, or if the stream has
     *     been closed.
     * @throws UncheckedIOException
     *     if the row couldn't be written to the stream.
     */
    public void append(Map<String, ?> fields) {
        addRow(applySchemaRules(fields));
    }

    /**
     * Applies the same schema rules as {@link #append(Map)}, but doesn't keep or write the row.
     * <p>
     * This is useful for collecting the schema of a large dataset in a first pass before streaming it in a second.
     * </p>
     *
     * @param fields
     *     The row's values.
     *
     * @throws IllegalArgumentException
     *     if a raw datum cannot be converted to its attribute's type.
     * @throws IllegalStateException
     *     if a value's type doesn't match its attribute's type, if a value designates a different class attribute than
     *     the one already designated, or if the row would change a schema that was already streamed.
     */
    public void updateSchema(Map<String, ?> fields) {
        applySchemaRules(fields);
    }

    private Row applySchemaRules(Map<String, ?> fields) {
        ArgumentUtil.checkNotNull(fields, "fields");
        final boolean streaming = isStreaming();

        // The whole row is checked before the schema changes, so a rejected row leaves the schema as it was.
        Map<String, Value> row = new LinkedHashMap<>();
        List<Attribute> newAttributes = new ArrayList<>();
        Map<String, String> newNominalValues = new LinkedHashMap<>();
        String classAttribute = schema.classAttribute();
        boolean classWouldMove = false;
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String name = entry.getKey();
            Object raw = entry.getValue();
            ArgumentUtil.checkNotNull(name, "field name");
            ArgumentUtil.checkNotNull(raw, "value of " + name);

            Attribute attribute = schema.attribute(name);
            final Value value;
            if (raw instanceof Value rawValue) {
                value = rawValue;
            } else if (Value.MISSING.equals(raw)) {
                value = Value.string(raw);
            } else if (attribute != null) {
                value = Value.of(attribute.type(), raw, false);
            } else {
                value = Value.wrap(raw);
            }

            if (attribute != null && !value.isMissing() && attribute.type() != value.type()) {
                throw new IllegalStateException(
                    "Attempting to set attribute " + name + " to type " + value.type() +
                        " but it is already defined as type " + attribute.type() + ".");
            }

            boolean keep = true;
            if (attribute == null) {
                if (streaming) {
                    keep = false; // the header has already been written without it
                } else {
                    Attribute.Builder builder = Attribute.builder().name(name).type(value.type());
                    if (value.type() == AttributeType.NOMINAL && !value.isMissing()) {
                        builder.nominalValues(List.of(value.value().toString()));
                    }
                    newAttributes.add(builder.build());
                }
            } else if (value.type() == AttributeType.NOMINAL && !value.isMissing() && !attribute.allows(value.value())) {
                if (streaming) {
                    keep = false; // the header has already been written without it
                } else {
                    newNominalValues.put(name, value.value().toString());
                }
            }

            if (value.isClass()) {
                ArffSchema.checkClassChange(classAttribute, name);
                if (classAttribute == null && keep) {
                    if (streaming && schema.indexOf(name) != schema.size() - 1) {
                        classWouldMove = true;
                    } else {
                        classAttribute = name;
                    }
                }
            }

            if (keep) {
                row.put(name, value);
            }
        }

        if (classWouldMove) {
            throw new IllegalStateException("Attempting to add data that doesn't match the schema while streaming.");
        }

        List<String> previousOrder = schema.attributeNames();
        for (Attribute attribute : newAttributes) {
            schema.addAttribute(attribute);
            LOGGER.debug(
                "added {} attribute \"{}\" to relation {}", attribute.type(), attribute.name(), schema.relation());
        }
        for (Map.Entry<String, String> entry : newNominalValues.entrySet()) {
            schema.replaceAttribute(schema.attribute(entry.getKey()).withNominalValue(entry.getValue()));
            LOGGER.debug("added value \"{}\" to nominal attribute \"{}\"", entry.getValue(), entry.getKey());
        }
        if (classAttribute != null) {
            schema.designateClass(classAttribute);
        }
        if (!streaming) {
            schema.moveClassToEnd();
            realignDenseRows(previousOrder);
        }
        return Row.sparse(row);
    }

    /**
     * Appends a row given as one datum per attribute, in schema order.
     * <p>
     * The cells are converted the same way as a dense line of ARFF text: integers become {@code Long}, numbers become
     * {@code BigDecimal}, nominal values must already be in their attribute's value set, and the missing marker is kept
     * as-is.
     * </p>
     *
     * @param cells
     *     The row's data.
     *
     * @throws IllegalArgumentException
     *     if the number of cells doesn't match the number of attributes, or if a cell can't be converted.
     * @throws IllegalStateException
     *     if the stream has been closed.
     * @throws UncheckedIOException
     *     if the row couldn't be written to the stream.
     */
    public void appendDense(List<?> cells) {
        ArgumentUtil.checkNoNullElements(cells, "cells");
        if (cells.size() != schema.size()) {
            throw new IllegalArgumentException(
                "row has " + cells.size() + " value(s) but there are " + schema.size() + " attribute(s)");
        }
        addRow(toDenseRow(cells));
    }

    /**
     * Parses rows of ARFF text into this dataset.
     *
     * @param lines
     *     Dense or sparse data lines.  Dense lines with the wrong number of values are skipped with a warning.
     *
     * @throws ArffFormatException
     *     if a line is malformed.
     * @throws IllegalStateException
     *     if a sparse line is given while streaming, or if the stream has been closed.
     */
    public void parseData(String lines) {
        ArgumentUtil.checkNotNull(lines, "lines");
        ArffParser.builder().build().parseData(this, lines);
    }

    /**
     * Converts one datum per attribute into a dense row.
     *
     * @throws IllegalArgumentException
     *     if a cell can't be converted.
     */
    Row toDenseRow(List<?> cells) {
        List<Attribute> attributes = schema.attributes();
        List<Object> converted = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            Attribute attribute = attributes.get(i);
            Object cell = cells.get(i);
            if (cell instanceof Value value) {
                cell = value.value();
            }

            if (Value.MISSING.equals(cell)) {
                converted.add(Value.MISSING);
                continue;
            }
            switch (attribute.type()) {
            case INTEGER:
                converted.add(Value.integer(cell).value());
                break;
            case NUMERIC:
                converted.add(toDecimal(cell));
                break;
            case STRING:
                converted.add(cell.toString());
                break;
            case NOMINAL:
                if (!attribute.allows(cell)) {
                    throw new IllegalArgumentException(
                        "Incorrect value " + cell + " for nominal attribute " + attribute.name() +
                            "; allowed values are " + attribute.nominalValues());
                }
                converted.add(cell.toString());
                break;
            case DATE:
                converted.add(cell); // dates are decoded when they're written
                break;
            default:
                throw new AssertionError("unhandled type " + attribute.type());
            }
        }
        return Row.dense(converted);
    }

    private static BigDecimal toDecimal(Object cell) {
        if (cell instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(cell.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("cannot convert \"" + cell + "\" to a numeric value", e);
        }
    }

    /**
     * Keeps a row in memory or, while streaming, writes it.
     */
    void addRow(Row row) {
        if (isStreaming()) {
            try {
                stream.writeRow(row);
            } catch (IOException e) {
                throw new UncheckedIOException("could not write row to " + stream.location(), e);
            }
        } else if (streamClosed) {
            throw new IllegalStateException("cannot add rows to a dataset whose stream has been closed");
        } else {
            rows.add(row);
        }
    }

    /**
     * Starts streaming to a new temporary file.
     *
     * @throws IOException
     *     if the file couldn't be created or the header couldn't be written.
     * @see #openStream(Path, String)
     */
    public void openStream() throws IOException {
        openStream(Files.createTempFile("arff", ".arff"), null);
    }

    /**
     * Starts streaming to a file.
     *
     * @param targetLocation
     *     The file to write.  If it exists, its contents are replaced.
     *
     * @throws IOException
     *     if the header couldn't be written.
     * @see #openStream(Path, String)
     */
    public void openStream(Path targetLocation) throws IOException {
        openStream(targetLocation, null);
    }

    /**
     * Starts streaming to a file.
     * <p>
     * The header is written and flushed, followed by any rows that are held in memory, which are then released. From
     * then on, appended rows are written immediately and the schema can't change.
     * </p>
     *
     * @param targetLocation
     *     The file to write.  If it exists, its contents are replaced.
     * @param classAttribute
     *     The name of the class attribute to designate before the header is written, or {@code null}.
     *
     * @throws IOException
     *     if the header couldn't be written.
     * @throws IllegalStateException
     *     if this dataset is already streaming or has already streamed.
     */
    public void openStream(Path targetLocation, String classAttribute) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        if (isStreaming() || streamClosed) {
            throw new IllegalStateException("a dataset can only be streamed once");
        }
        if (classAttribute != null) {
            setClassAttribute(classAttribute);
        }

        stream = new ArffExporter(targetLocation, schema);
        for (Row row : rows) {
            stream.writeRow(row);
        }
        rows.clear();
    }

    /**
     * Whether rows are being streamed to a file.
     *
     * @return {@code true} between {@link #openStream(Path)} and {@link #closeStream()}.
     */
    public boolean isStreaming() {
        return stream != null;
    }

    /**
     * Flushes the stream, if there is one.
     *
     * @throws IOException
     *     if the stream couldn't be flushed.
     */
    public void flush() throws IOException {
        if (isStreaming()) {
            stream.flush();
        }
    }

    /**
     * Stops streaming and closes the file.
     *
     * @return The file to which the rows were streamed, or {@code null} if this dataset wasn't streaming.
     *
     * @throws IOException
     *     if the file couldn't be flushed and closed.
     */
    public Path closeStream() throws IOException {
        if (!isStreaming()) {
            return null;
        }
        ArffExporter closing = stream;
        stream = null;
        streamClosed = true;
        closing.close();
        return closing.location();
    }

    /**
     * Writes the header and rows in the sparse encoding.
     *
     * @return The ARFF text.
     */
    public String write() {
        return write(RowFormat.SPARSE);
    }

    /**
     * Writes the header and rows.
     *
     * @param format
     *     How to encode the rows.
     *
     * @return The ARFF text.
     *
     * @throws UnsupportedOperationException
     *     if {@code format} is {@link RowFormat#DENSE} and the schema has a date attribute.
     */
    public String write(RowFormat format) {
        StringBuilder builder = new StringBuilder();
        try {
            write(builder, format);
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringBuilder doesn't throw IOException
        }
        return builder.toString();
    }

    /**
     * Writes the header and rows.
     *
     * @param out
     *     Where to write the ARFF text.
     * @param format
     *     How to encode the rows.
     *
     * @throws IOException
     *     if {@code out} couldn't be written to.
     */
    public void write(Appendable out, RowFormat format) throws IOException {
        ArgumentUtil.checkNotNull(out, "out");
        ArgumentUtil.checkNotNull(format, "format");
        ArffWriter writer = new ArffWriter(schema);
        writer.writeHeader(out);
        writer.writeData(out, rows, format);
    }

    /**
     * Writes only the header: comment, relation, and attributes.
     *
     * @return The header text.
     */
    public String writeSchema() {
        return new ArffWriter(schema).formatHeader();
    }

    /**
     * Saves this dataset to a file in the sparse encoding.
     *
     * @param targetLocation
     *     The file to write.  If it exists, its contents are replaced.
     *
     * @throws IOException
     *     if the file couldn't be written.
     */
    public void save(Path targetLocation) throws IOException {
        save(targetLocation, RowFormat.SPARSE);
    }

    /**
     * Saves this dataset to a file.
     *
     * @param targetLocation
     *     The file to write.  If it exists, its contents are replaced.
     * @param format
     *     How to encode the rows.
     *
     * @throws IOException
     *     if the file couldn't be written.
     */
    public void save(Path targetLocation, RowFormat format) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(format, "format");
        ArffExporter.exportDataset(targetLocation, schema, rows, format);
    }

    /**
     * Decodes a single token that was reported for an attribute, such as a classifier's prediction.
     * <ul>
     * <li>The missing marker decodes to {@code null}.</li>
     * <li>Integer attributes decode to a {@code Long}.</li>
     * <li>Numeric attributes decode to a {@code BigDecimal}.</li>
     * <li>Nominal attributes decode to the text after the {@code :} in tokens like {@code 2:yes}, which must be one of
     * the attribute's values.</li>
     * </ul>
     *
     * @param name
     *     The attribute's name.
     * @param token
     *     The token to decode.
     *
     * @return The decoded value, or {@code null} for a missing value.
     *
     * @throws IllegalArgumentException
     *     if there's no attribute named {@code name}, if it's a string or date attribute, or if {@code token} isn't
     *     valid for the attribute.
     */
    public Object decodeAttributeValue(String name, String token) {
        ArgumentUtil.checkNotNull(token, "token");
        Attribute attribute = schema.attribute(name);
        if (attribute == null) {
            throw new IllegalArgumentException("there is no attribute named \"" + name + "\"");
        }
        if (Value.MISSING.equals(token)) {
            return null;
        }

        switch (attribute.type()) {
        case INTEGER:
            return Value.integer(token).value();
        case NUMERIC:
            return toDecimal(token);
        case NOMINAL:
            String nominalValue = token.substring(token.indexOf(':') + 1);
            if (Value.MISSING.equals(nominalValue)) {
                return null;
            }
            if (!attribute.allows(nominalValue)) {
                throw new IllegalArgumentException(
                    "Predicted value \"" + nominalValue + "\" but only values " +
                        String.join(", ", attribute.nominalValues()) + " are allowed.");
            }
            return nominalValue;
        default:
            throw new IllegalArgumentException("cannot decode values of " + attribute.type() + " attributes");
        }
    }
}
