///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The header of an ARFF: a relation name, an initial comment, an ordered list of attributes, and optionally the name
 * of the class attribute.
 * <p>
 * The order of the attributes is significant: it fixes the column order of dense rows and the column indices of sparse
 * rows.  If a class attribute is designated, it is always the last attribute.
 * </p>
 * <p>
 * A schema is owned by an {@link ArffDataset}, which is the only thing that changes it.  A standalone schema can be
 * created with a {@link ArffSchema.Builder}:
 * </p>
 * <pre>
 * ArffSchema schema = ArffSchema.builder().
 *     relation("weather").
 *     attributes(
 *         List.of(
 *             Attribute.builder().name("temperature").type(AttributeType.NUMERIC).build(),
 *             Attribute.builder().name("play").type(AttributeType.NOMINAL).nominalValues(List.of("yes", "no")).build()
 *     )).
 *     classAttribute("play").
 *     build();
 * </pre>
 */
public final class ArffSchema {

    private String relation;
    private String comment;
    private final List<Attribute> attributes;
    private String classAttribute;

    /**
     * A builder class for {@link ArffSchema}.
     */
    public final static class Builder {
        private String relation;
        private String comment;
        private List<Attribute> attributes;
        private String classAttribute;

        private Builder() {
            this.relation = "";
            this.comment = "";
            this.attributes = List.of();
            this.classAttribute = null;
        }

        /**
         * Sets the relation's name.
         *
         * @param relation
         *     The relation's name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code relation} is {@code null}.
         */
        public Builder relation(String relation) {
            ArgumentUtil.checkNotNull(relation, "relation");
            this.relation = relation;
            return this;
        }

        /**
         * Sets the comment that is written before the relation.
         *
         * @param comment
         *     The comment.  Lines are separated by {@code \n}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code comment} is {@code null}.
         */
        public Builder comment(String comment) {
            ArgumentUtil.checkNotNull(comment, "comment");
            this.comment = comment;
            return this;
        }

        /**
         * Sets the relation's attributes.
         *
         * @param attributes
         *     The attributes in schema order.  This list is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code attributes} is {@code null} or contains a {@code null} entry.
         * @throws IllegalArgumentException
         *     if two attributes have the same name.
         */
        public Builder attributes(List<Attribute> attributes) {
            ArgumentUtil.checkNoNullElements(attributes, "attributes");
            checkUniqueNames(attributes);
            this.attributes = new ArrayList<>(attributes);
            return this;
        }

        /**
         * Sets the name of the class attribute.
         *
         * @param classAttribute
         *     The name of an attribute, or {@code null} for no class attribute.
         *
         * @return This builder
         */
        public Builder classAttribute(String classAttribute) {
            this.classAttribute = classAttribute;
            return this;
        }

        /**
         * Builds the schema.  If a class attribute is set, it is moved to the end.
         *
         * @return A new {@code ArffSchema}
         *
         * @throws IllegalStateException
         *     if the class attribute is not one of the attributes.
         */
        public ArffSchema build() {
            ArffSchema schema = new ArffSchema(relation, comment, attributes);
            if (classAttribute != null) {
                if (schema.indexOf(classAttribute) < 0) {
                    throw new IllegalStateException("class attribute \"" + classAttribute + "\" is not an attribute");
                }
                schema.designateClass(classAttribute);
                schema.moveClassToEnd();
            }
            return schema;
        }
    }

    /**
     * Creates a new ArffSchema builder with a blank relation name, no comment, and no attributes.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static void checkUniqueNames(List<Attribute> attributes) {
        List<String> seen = new ArrayList<>(attributes.size());
        for (Attribute attribute : attributes) {
            if (seen.contains(attribute.name())) {
                throw new IllegalArgumentException("attributes contains two attributes named \"" + attribute.name() + "\"");
            }
            seen.add(attribute.name());
        }
    }

    private ArffSchema(String relation, String comment, List<Attribute> attributes) {
        this.relation = relation;
        this.comment = comment;
        this.attributes = new ArrayList<>(attributes);
        this.classAttribute = null;
    }

    /**
     * Gets the relation's name.
     *
     * @return The relation name.  This may be blank but never {@code null}.
     */
    public String relation() {
        return relation;
    }

    /**
     * Gets the comment that precedes the relation.
     *
     * @return The comment, with lines separated by {@code \n}.  This may be empty but never {@code null}.
     */
    public String comment() {
        return comment;
    }

    /**
     * Gets the attributes in schema order.
     *
     * @return An unmodifiable view of the attributes.  This is never {@code null}.
     */
    public List<Attribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    /**
     * Gets the names of the attributes in schema order.
     *
     * @return A list of names.
     */
    public List<String> attributeNames() {
        return attributes.stream().map(Attribute::name).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Gets the number of attributes.
     *
     * @return The number of attributes.
     */
    public int size() {
        return attributes.size();
    }

    /**
     * Gets the attribute with a given name.
     *
     * @param name
     *     The attribute's name.
     *
     * @return The attribute, or {@code null} if there's no attribute named {@code name}.
     */
    public Attribute attribute(String name) {
        int index = indexOf(name);
        return index < 0 ? null : attributes.get(index);
    }

    /**
     * Gets the position of the attribute with a given name.
     *
     * @param name
     *     The attribute's name.
     *
     * @return The zero-based index of the attribute, or -1 if there's no attribute named {@code name}.
     */
    public int indexOf(String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Gets the name of the class attribute.
     *
     * @return The class attribute's name, or {@code null} if no class attribute has been designated.
     */
    public String classAttribute() {
        return classAttribute;
    }

    void setRelation(String relation) {
        this.relation = relation;
    }

    void setComment(String comment) {
        this.comment = comment;
    }

    void addAttribute(Attribute attribute) {
        if (indexOf(attribute.name()) >= 0) {
            throw new IllegalArgumentException("attribute \"" + attribute.name() + "\" is already defined");
        }
        attributes.add(attribute);
    }

    void replaceAttribute(Attribute attribute) {
        int index = indexOf(attribute.name());
        assert index >= 0 : attribute.name() + " is not defined";
        attributes.set(index, attribute);
    }

    /**
     * Designates the class attribute.  Once designated, it can't be changed.
     *
     * @throws IllegalStateException
     *     if a different class attribute has already been designated.
     */
    void designateClass(String name) {
        checkClassChange(classAttribute, name);
        classAttribute = name;
    }

    /**
     * @throws IllegalStateException
     *     if {@code classAttribute} is already designated and isn't {@code name}.
     */
    static void checkClassChange(String classAttribute, String name) {
        if (classAttribute != null && !classAttribute.equals(name)) {
            throw new IllegalStateException(
                "Attempting to set class to \"" + name + "\" when it has already been set to \"" + classAttribute + "\"");
        }
    }

    /**
     * Whether the class attribute would move if {@link #moveClassToEnd()} were invoked.
     */
    boolean isClassOutOfPlace() {
        int index = classAttribute == null ? -1 : indexOf(classAttribute);
        return 0 <= index && index != attributes.size() - 1;
    }

    void moveClassToEnd() {
        if (isClassOutOfPlace()) {
            Attribute classAttr = attributes.remove(indexOf(classAttribute));
            attributes.add(classAttr);
        }
    }

    void alphabetize() {
        attributes.sort(
            Comparator.comparing((Attribute attribute) -> attribute.name().equals(classAttribute)).
                thenComparing(Attribute::name));
    }

    ArffSchema copy() {
        ArffSchema copy = new ArffSchema(relation, comment, attributes);
        copy.classAttribute = classAttribute;
        return copy;
    }
}
