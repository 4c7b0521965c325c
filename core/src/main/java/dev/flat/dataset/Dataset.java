/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, ordered collection of observations sharing one {@link Schema}.
 *
 * <p>The same dataset may be observed through any number of {@link View}s:</p>
 * <pre>{@code
 * Dataset dataset = Dataset.builder(Schema.of("Animal", "Length"))
 *         .add("whale", 4)
 *         .add("shark", 1)
 *         .build();
 *
 * dataset.countingView();        // every column displayed, each row counts 1
 * dataset.measureView(1);        // "Animal" displayed, bars sum "Length"
 * dataset.countBreakdownView(1); // "Animal" displayed, one bar column per length
 * }</pre>
 */
public final class Dataset {

    private final Schema schema;
    private final List<Dimensions> rows;

    private Dataset(Schema schema, List<Dimensions> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public static Builder builder(Schema schema) {
        return new Builder(schema);
    }

    public Schema schema() {
        return schema;
    }

    public List<Dimensions> rows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Displays every column, measured by the last column.
     */
    public View reflectiveView() {
        return view(RoleMap.displaying(allColumns()), Measure.column(schema.size() - 1));
    }

    /**
     * Displays every column, each observation counting 1.
     */
    public View countingView() {
        return view(RoleMap.displaying(allColumns()), Measure.count());
    }

    /**
     * Displays every column except {@code column}, measured by {@code column}.
     */
    public View measureView(int column) {
        return view(RoleMap.displaying(allColumnsExcept(column)), Measure.column(column));
    }

    /**
     * Displays every column except {@code column}, breaking the bars down by the values of
     * {@code column} and measuring them by {@code column}.
     */
    public View breakdownView(int column) {
        return view(RoleMap.displaying(allColumnsExcept(column)).withBreakdown(column), Measure.column(column));
    }

    /**
     * Displays every column except {@code column}, breaking the bars down by the values of
     * {@code column} and counting the observations behind each.
     */
    public View countBreakdownView(int column) {
        return view(RoleMap.displaying(allColumnsExcept(column)).withBreakdown(column), Measure.count());
    }

    /**
     * Creates a view with explicit roles.
     *
     * @throws IllegalArgumentException if a role refers to a column outside the schema, or the
     *         measure column is not numeric
     */
    public View view(RoleMap roles, Measure measure) {
        return new RoleView(this, roles, measure);
    }

    private int[] allColumns() {
        int[] columns = new int[schema.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = i;
        }
        return columns;
    }

    private int[] allColumnsExcept(int column) {
        schema.checkColumn(column);
        if (schema.size() < 2) {
            throw new IllegalArgumentException("At least two columns are required to display all columns except " + column);
        }
        return Arrays.stream(allColumns()).filter(c -> c != column).toArray();
    }

    /**
     * Collects observations for a {@link Dataset}. Each column accepts values of a single
     * {@link Comparable} class, fixed by the first observation.
     */
    public static final class Builder {

        private final Schema schema;
        private final List<Dimensions> rows = new ArrayList<>();
        private final Class<?>[] columnTypes;

        private Builder(Schema schema) {
            if (schema == null) {
                throw new IllegalArgumentException("Schema cannot be null");
            }
            this.schema = schema;
            this.columnTypes = new Class<?>[schema.size()];
        }

        /**
         * Adds one observation.
         *
         * @throws IllegalArgumentException if the number of values differs from the schema, a value
         *         is null or not {@link Comparable}, or its class differs from earlier values of its column
         */
        public Builder add(Object... values) {
            update(values);
            return this;
        }

        /**
         * Adds one observation, for use in loops.
         *
         * @see #add(Object...)
         */
        public void update(Object... values) {
            if (values == null || values.length != schema.size()) {
                throw new IllegalArgumentException("Expected " + schema.size() + " values for " + schema
                        + " but got " + (values == null ? 0 : values.length));
            }
            for (int column = 0; column < values.length; column++) {
                Object value = values[column];
                if (value == null) {
                    throw new IllegalArgumentException("Value of column '" + schema.header(column) + "' cannot be null");
                }
                if (!(value instanceof Comparable)) {
                    throw new IllegalArgumentException("Value of column '" + schema.header(column)
                            + "' must be Comparable but was " + value.getClass().getName());
                }
                if (columnTypes[column] == null) {
                    columnTypes[column] = value.getClass();
                }
                else if (columnTypes[column] != value.getClass()) {
                    throw new IllegalArgumentException("Column '" + schema.header(column) + "' holds "
                            + columnTypes[column].getName() + " values, cannot add " + value.getClass().getName());
                }
            }
            rows.add(new Dimensions(Arrays.asList(values)));
        }

        public Dataset build() {
            return new Dataset(schema, Collections.unmodifiableList(new ArrayList<>(rows)));
        }
    }
}
