///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ArffWriter} */
public class ArffWriterTest {

    private static final Attribute OUTLOOK = Attribute.builder().
        name("outlook").
        type(AttributeType.NOMINAL).
        nominalValues(List.of("sunny", "overcast", "rainy", "partly cloudy")).
        build();

    private static final Attribute TEMPERATURE = Attribute.builder().name("temperature").type(AttributeType.NUMERIC).build();

    private static final Attribute HUMIDITY = Attribute.builder().name("humidity").type(AttributeType.INTEGER).build();

    private static final Attribute NOTE = Attribute.builder().name("note").type(AttributeType.STRING).build();

    private static final Attribute WHEN = Attribute.builder().
        name("when").
        type(AttributeType.DATE).
        datePattern("yyyy-MM-dd").
        build();

    private static ArffSchema schema(Attribute... attributes) {
        return ArffSchema.builder().relation("weather").attributes(List.of(attributes)).build();
    }

    private static Map<String, Value> fields(Object... namesAndValues) {
        Map<String, Value> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put((String) namesAndValues[i], (Value) namesAndValues[i + 1]);
        }
        return fields;
    }

    @Test
    void testQuote() {
        assertEquals("'name'", ArffWriter.quote("name"));
        assertEquals("'two words'", ArffWriter.quote("two words"));

        // already quoted
        assertEquals("'name'", ArffWriter.quote("'name'"));
    }

    @Test
    void testFormatAttribute() {
        assertEquals("@attribute 'temperature' numeric", ArffWriter.formatAttribute(TEMPERATURE));
        assertEquals("@attribute 'humidity' integer", ArffWriter.formatAttribute(HUMIDITY));
        assertEquals("@attribute 'note' string", ArffWriter.formatAttribute(NOTE));
        assertEquals("@attribute 'when' date \"yyyy-MM-dd\"", ArffWriter.formatAttribute(WHEN));

        // nominal values are sorted
        assertEquals(
            "@attribute 'outlook' {overcast,partly cloudy,rainy,sunny}",
            ArffWriter.formatAttribute(OUTLOOK));

        // the missing marker is never declared
        Attribute withMissing = Attribute.builder().
            name("play").
            type(AttributeType.NOMINAL).
            nominalValues(List.of("yes", "?", "no")).
            build();
        assertEquals("@attribute 'play' {no,yes}", ArffWriter.formatAttribute(withMissing));

        Attribute defaultDate = Attribute.builder().name("d").type(AttributeType.DATE).build();
        assertEquals("@attribute 'd' date \"yyyy-MM-dd HH:mm:ss\"", ArffWriter.formatAttribute(defaultDate));
    }

    @Test
    void testFormatHeader() {
        ArffWriter writer = new ArffWriter(schema(OUTLOOK, TEMPERATURE, HUMIDITY, NOTE, WHEN));
        assertEquals(
            "@relation weather\n" +
                "@attribute 'outlook' {overcast,partly cloudy,rainy,sunny}\n" +
                "@attribute 'temperature' numeric\n" +
                "@attribute 'humidity' integer\n" +
                "@attribute 'note' string\n" +
                "@attribute 'when' date \"yyyy-MM-dd\"\n",
            writer.formatHeader());
    }

    @Test
    void headerWithComment() {
        ArffSchema schema = ArffSchema.builder().
            relation("r").
            comment("first line\nsecond line").
            attributes(List.of(NOTE)).
            build();

        assertEquals(
            "% first line\n% second line\n@relation r\n@attribute 'note' string\n",
            new ArffWriter(schema).formatHeader());
    }

    @Test
    void headerReflectsSchemaChanges() {
        ArffSchema schema = schema(NOTE);
        ArffWriter writer = new ArffWriter(schema);

        schema.addAttribute(HUMIDITY);
        schema.setRelation("changed");
        assertEquals("@relation changed\n@attribute 'note' string\n@attribute 'humidity' integer\n", writer.formatHeader());
    }

    @Test
    void sparseRow() {
        ArffWriter writer = new ArffWriter(schema(OUTLOOK, TEMPERATURE, HUMIDITY, NOTE, WHEN));

        Row row = Row.sparse(
            fields(
                "note", Value.string("hi there"),
                "outlook", Value.nominal("sunny"),
                "temperature", Value.numeric(72.5),
                "when", Value.date("2020-01-02 03:04:05")));

        // tokens are written in schema order, not row order
        assertEquals("{0 sunny, 1 72.5, 3 \"hi there\", 4 2020-01-02}", writer.formatSparseRow(row));
        assertEquals("{0 sunny, 1 72.5, 3 \"hi there\", 4 2020-01-02}", writer.formatRow(row, RowFormat.SPARSE));
    }

    @Test
    void sparseRowQuoting() {
        ArffWriter writer = new ArffWriter(schema(OUTLOOK, NOTE));

        // nominal values with whitespace are quoted
        assertEquals("{0 \"partly cloudy\"}", writer.formatSparseRow(Row.sparse(fields("outlook", Value.nominal("partly cloudy")))));

        // strings are always quoted
        assertEquals("{1 \"x\"}", writer.formatSparseRow(Row.sparse(fields("note", Value.string("x")))));
        assertEquals("{1 \"\"}", writer.formatSparseRow(Row.sparse(fields("note", Value.string("")))));
    }

    @Test
    void sparseRowDropsUnknownNominalValues() {
        ArffWriter writer = new ArffWriter(schema(OUTLOOK, HUMIDITY));

        Row row = Row.sparse(fields("outlook", Value.nominal("snowy"), "humidity", Value.integer(80)));
        assertEquals("{1 80}", writer.formatSparseRow(row));

        // Nothing is left to write
        assertNull(writer.formatSparseRow(Row.sparse(fields("outlook", Value.nominal("snowy")))));
    }

    @Test
    void sparseRowWithNothingWorthWriting() {
        ArffWriter writer = new ArffWriter(schema(TEMPERATURE, HUMIDITY));

        assertNull(writer.formatSparseRow(Row.sparse(Map.of())));
        assertNull(writer.formatSparseRow(Row.sparse(fields("temperature", Value.numeric("?")))));

        // attributes that aren't in the schema are ignored
        assertNull(writer.formatSparseRow(Row.sparse(fields("wind", Value.numeric(5)))));

        // a missing value is written when there's something else
        assertEquals(
            "{0 ?, 1 5}",
            writer.formatSparseRow(Row.sparse(fields("temperature", Value.numeric("?"), "humidity", Value.integer(5)))));
    }

    @Test
    void denseRowInSparseFormat() {
        ArffWriter writer = new ArffWriter(schema(OUTLOOK, TEMPERATURE, HUMIDITY, NOTE, WHEN));

        Row row = Row.dense(List.of("rainy", new BigDecimal("72.5"), 80L, "note", "?"));
        assertEquals("{0 rainy, 1 72.5, 2 80, 3 \"note\", 4 ?}", writer.formatSparseRow(row));
    }

    @Test
    void dates() {
        ArffSchema schema = schema(Attribute.builder().name("when").type(AttributeType.DATE).build());
        ArffWriter writer = new ArffWriter(schema);

        // The default pattern has a space, so it's quoted.
        Row row = Row.sparse(fields("when", Value.date(LocalDateTime.of(2020, 1, 2, 3, 4, 5))));
        assertEquals("{0 \"2020-01-02 03:04:05\"}", writer.formatSparseRow(row));

        row = Row.sparse(fields("when", Value.date(LocalDate.of(2020, 1, 2))));
        assertEquals("{0 \"2020-01-02 00:00:00\"}", writer.formatSparseRow(row));

        Row badDate = Row.sparse(fields("when", Value.date("someday")));
        Exception exception = assertThrows(IllegalArgumentException.class, () -> writer.formatSparseRow(badDate));
        assertEquals("unrecognized date \"someday\"", exception.getMessage());
    }

    @Test
    void customDateParser() {
        DateParser fixedParser = text -> LocalDateTime.of(2000, 12, 31, 0, 0);
        ArffWriter writer = new ArffWriter(schema(WHEN), fixedParser);

        Row row = Row.sparse(fields("when", Value.date("New Year's Eve")));
        assertEquals("{0 2000-12-31}", writer.formatSparseRow(row));
    }

    @Test
    void denseRow() {
        ArffWriter writer = new ArffWriter(schema(OUTLOOK, TEMPERATURE, HUMIDITY, NOTE));

        Row row = Row.dense(List.of("sunny", new BigDecimal("72.50"), 80L, "it is hot"));
        assertEquals("sunny,72.50,80,'it is hot'", writer.formatDenseRow(row));
        assertEquals("sunny,72.50,80,'it is hot'", writer.formatRow(row, RowFormat.DENSE));

        row = Row.dense(List.of(Value.nominal("rainy"), "?", "?", Value.string("x")));
        assertEquals("rainy,?,?,'x'", writer.formatDenseRow(row));
    }

    @Test
    void denseRowErrors() {
        ArffWriter writer = new ArffWriter(schema(NOTE, WHEN));

        Exception exception = assertThrows(
            UnsupportedOperationException.class,
            () -> writer.formatDenseRow(Row.dense(List.of("x", "2020-01-01"))));
        assertEquals("Type date not supported for writing!", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> writer.formatDenseRow(Row.sparse(fields("note", Value.string("x")))));
        assertEquals("only dense rows can be written in the dense format", exception.getMessage());
    }

    @Test
    void testWriteData() throws IOException {
        ArffWriter writer = new ArffWriter(schema(TEMPERATURE, HUMIDITY));

        List<Row> rows = List.of(
            Row.sparse(fields("temperature", Value.numeric(1.5))),
            Row.sparse(Map.of()), // skipped
            Row.sparse(fields("humidity", Value.integer(3))));

        StringBuilder out = new StringBuilder();
        writer.writeData(out, rows, RowFormat.SPARSE);
        assertEquals("@data\n{0 1.5}\n{1 3}\n", out.toString());

        out = new StringBuilder();
        assertFalse(writer.writeRow(out, Row.sparse(Map.of()), RowFormat.SPARSE));
        assertEquals("", out.toString());
        assertTrue(writer.writeRow(out, Row.dense(List.of(new BigDecimal("2.5"), 4L)), RowFormat.DENSE));
        assertEquals("2.5,4\n", out.toString());
    }

    @Test
    void constructorRejectsNulls() {
        Exception exception = assertThrows(NullPointerException.class, () -> new ArffWriter(null));
        assertEquals("schema must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> new ArffWriter(schema(NOTE), null));
        assertEquals("dateParser must not be null", exception.getMessage());
    }
}
