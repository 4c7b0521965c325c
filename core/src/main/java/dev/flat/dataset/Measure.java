/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

/**
 * Where the numeric measurement of an observation comes from.
 */
public final class Measure {

    static final String COUNT_HEADER = "Count";

    private static final Measure COUNT = new Measure(-1);

    private final int column;

    private Measure(int column) {
        this.column = column;
    }

    /**
     * Every observation measures {@code 1}.
     */
    public static Measure count() {
        return COUNT;
    }

    /**
     * Observations measure the numeric value of the given column.
     */
    public static Measure column(int column) {
        if (column < 0) {
            throw new IllegalArgumentException("Invalid measure column: " + column);
        }
        return new Measure(column);
    }

    public boolean isCount() {
        return column < 0;
    }

    public int column() {
        return column;
    }

    String header(Schema schema) {
        return isCount() ? COUNT_HEADER : schema.header(column);
    }

    double measure(Dimensions dims) {
        return isCount() ? 1.0 : ((Number) dims.get(column)).doubleValue();
    }

    @Override
    public String toString() {
        return isCount() ? "Measure[count]" : "Measure[column=" + column + "]";
    }
}
