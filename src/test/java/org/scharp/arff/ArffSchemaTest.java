///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ArffSchema} */
public class ArffSchemaTest {

    private static Attribute attribute(String name, AttributeType type) {
        return Attribute.builder().name(name).type(type).build();
    }

    @Test
    void defaults() {
        ArffSchema schema = ArffSchema.builder().build();
        assertEquals("", schema.relation());
        assertEquals("", schema.comment());
        assertEquals(List.of(), schema.attributes());
        assertEquals(0, schema.size());
        assertNull(schema.classAttribute());
    }

    @Test
    void basicUsage() {
        ArffSchema schema = ArffSchema.builder().
            relation("weather").
            comment("line 1\nline 2").
            attributes(
                List.of(
                    attribute("outlook", AttributeType.STRING),
                    attribute("temperature", AttributeType.NUMERIC),
                    attribute("humidity", AttributeType.INTEGER))).
            build();

        assertEquals("weather", schema.relation());
        assertEquals("line 1\nline 2", schema.comment());
        assertEquals(List.of("outlook", "temperature", "humidity"), schema.attributeNames());
        assertEquals(3, schema.size());

        assertEquals(1, schema.indexOf("temperature"));
        assertEquals(-1, schema.indexOf("wind"));
        assertEquals(attribute("humidity", AttributeType.INTEGER), schema.attribute("humidity"));
        assertNull(schema.attribute("wind"));

        assertThrows(UnsupportedOperationException.class, () -> schema.attributes().clear());
    }

    @Test
    void classAttributeIsMovedToEnd() {
        ArffSchema schema = ArffSchema.builder().
            attributes(
                List.of(
                    attribute("play", AttributeType.NOMINAL),
                    attribute("temperature", AttributeType.NUMERIC),
                    attribute("humidity", AttributeType.INTEGER))).
            classAttribute("play").
            build();

        assertEquals("play", schema.classAttribute());
        assertEquals(List.of("temperature", "humidity", "play"), schema.attributeNames());
        assertFalse(schema.isClassOutOfPlace());
    }

    @Test
    void classAttributeMustExist() {
        ArffSchema.Builder builder = ArffSchema.builder().
            attributes(List.of(attribute("a", AttributeType.STRING))).
            classAttribute("b");

        Exception exception = assertThrows(IllegalStateException.class, builder::build);
        assertEquals("class attribute \"b\" is not an attribute", exception.getMessage());
    }

    @Test
    void duplicateAttributeNames() {
        List<Attribute> attributes = List.of(
            attribute("a", AttributeType.STRING),
            attribute("b", AttributeType.STRING),
            attribute("a", AttributeType.NUMERIC));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArffSchema.builder().attributes(attributes));
        assertEquals("attributes contains two attributes named \"a\"", exception.getMessage());
    }

    @Test
    void builderRejectsNulls() {
        ArffSchema.Builder builder = ArffSchema.builder();

        Exception exception = assertThrows(NullPointerException.class, () -> builder.relation(null));
        assertEquals("relation must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.comment(null));
        assertEquals("comment must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.attributes(null));
        assertEquals("attributes must not be null", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> builder.attributes(Arrays.asList(attribute("a", AttributeType.STRING), null)));
        assertEquals("attributes must not contain a null entry", exception.getMessage());
    }

    @Test
    void designateClass() {
        ArffSchema schema = ArffSchema.builder().
            attributes(List.of(attribute("a", AttributeType.STRING), attribute("b", AttributeType.STRING))).
            build();

        schema.designateClass("a");
        assertEquals("a", schema.classAttribute());
        assertTrue(schema.isClassOutOfPlace());

        // designating the same attribute again is fine
        schema.designateClass("a");

        Exception exception = assertThrows(IllegalStateException.class, () -> schema.designateClass("b"));
        assertEquals(
            "Attempting to set class to \"b\" when it has already been set to \"a\"",
            exception.getMessage());

        schema.moveClassToEnd();
        assertEquals(List.of("b", "a"), schema.attributeNames());
        assertFalse(schema.isClassOutOfPlace());
    }

    @Test
    void addAndReplaceAttributes() {
        ArffSchema schema = ArffSchema.builder().build();
        schema.addAttribute(attribute("a", AttributeType.NOMINAL));
        schema.addAttribute(attribute("b", AttributeType.STRING));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> schema.addAttribute(attribute("a", AttributeType.NUMERIC)));
        assertEquals("attribute \"a\" is already defined", exception.getMessage());

        Attribute widened = schema.attribute("a").withNominalValue("x");
        schema.replaceAttribute(widened);
        assertEquals(widened, schema.attribute("a"));
        assertEquals(List.of("a", "b"), schema.attributeNames());
    }

    @Test
    void alphabetize() {
        ArffSchema schema = ArffSchema.builder().
            attributes(
                List.of(
                    attribute("delta", AttributeType.STRING),
                    attribute("alpha", AttributeType.STRING),
                    attribute("class", AttributeType.NOMINAL),
                    attribute("charlie", AttributeType.STRING),
                    attribute("bravo", AttributeType.STRING))).
            classAttribute("alpha").
            build();

        schema.alphabetize();
        assertEquals(List.of("bravo", "charlie", "class", "delta", "alpha"), schema.attributeNames());
    }

    @Test
    void copyIsIndependent() {
        ArffSchema schema = ArffSchema.builder().
            relation("r").
            comment("c").
            attributes(List.of(attribute("a", AttributeType.STRING), attribute("b", AttributeType.NOMINAL))).
            classAttribute("b").
            build();

        ArffSchema copy = schema.copy();
        assertEquals("r", copy.relation());
        assertEquals("c", copy.comment());
        assertEquals(schema.attributes(), copy.attributes());
        assertEquals("b", copy.classAttribute());

        copy.addAttribute(attribute("z", AttributeType.STRING));
        copy.setRelation("other");
        assertEquals(2, schema.size());
        assertEquals("r", schema.relation());
    }
}
