///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.arff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A row (instance) of an ARFF relation.
 * <p>
 * A row has one of two shapes:
 * </p>
 * <ul>
 * <li>A <i>dense</i> row is a list of cells aligned with the schema's attributes.  A cell is a {@code Long} for
 * integer attributes, a {@code BigDecimal} or other {@code Number} for numeric attributes, a {@code String} for
 * string, nominal, and date attributes, a {@link Value}, or the {@link Value#MISSING} marker.</li>
 * <li>A <i>sparse</i> row maps attribute names to {@link Value}s.  An attribute without an entry is absent, which
 * is not the same as missing.</li>
 * </ul>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class Row {

    private final List<Object> cells;
    private final Map<String, Value> fields;

    private Row(List<Object> cells, Map<String, Value> fields) {
        this.cells = cells;
        this.fields = fields;
    }

    /**
     * Creates a dense row.
     *
     * @param cells
     *     The row's cells, in schema order.  This list is copied.
     *
     * @return A new row.
     *
     * @throws NullPointerException
     *     if {@code cells} is {@code null} or has a {@code null} entry.
     */
    public static Row dense(List<?> cells) {
        ArgumentUtil.checkNoNullElements(cells, "cells");
        return new Row(Collections.unmodifiableList(new ArrayList<>(cells)), null);
    }

    /**
     * Creates a sparse row.
     *
     * @param fields
     *     The row's values, keyed by attribute name.  This map is copied, keeping its iteration order.
     *
     * @return A new row.
     *
     * @throws NullPointerException
     *     if {@code fields} is {@code null} or has a {@code null} key or value.
     */
    public static Row sparse(Map<String, Value> fields) {
        ArgumentUtil.checkNotNull(fields, "fields");
        ArgumentUtil.checkNoNullElements(fields.keySet(), "field names");
        ArgumentUtil.checkNoNullElements(fields.values(), "field values");
        return new Row(null, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    /**
     * Whether this is a sparse row.
     *
     * @return {@code true} if this row is keyed by attribute name; {@code false} if it's positional.
     */
    public boolean isSparse() {
        return fields != null;
    }

    /**
     * Gets the cells of a dense row.
     *
     * @return An unmodifiable list.
     *
     * @throws IllegalStateException
     *     if this row is sparse.
     */
    public List<Object> cells() {
        if (cells == null) {
            throw new IllegalStateException("sparse rows have no cells");
        }
        return cells;
    }

    /**
     * Gets the values of a sparse row.
     *
     * @return An unmodifiable map from attribute name to value.
     *
     * @throws IllegalStateException
     *     if this row is dense.
     */
    public Map<String, Value> fields() {
        if (fields == null) {
            throw new IllegalStateException("dense rows have no fields");
        }
        return fields;
    }

    /**
     * Gets the number of cells (dense) or present values (sparse).
     *
     * @return The size of this row.
     */
    public int size() {
        return cells != null ? cells.size() : fields.size();
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells, fields);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Row otherRow)) {
            return false;
        }
        return Objects.equals(cells, otherRow.cells) && Objects.equals(fields, otherRow.fields);
    }

    @Override
    public String toString() {
        return cells != null ? cells.toString() : fields.toString();
    }
}
