/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * An ordered sequence of rows over a fixed set of columns. Adding a row widens the text columns
 * to fit it; a {@link Flat} turns the finished grid into text and freezes it.
 */
public final class Grid {

    /**
     * An overflow label and the columns it spans, starting with its own.
     */
    record Overflow(int width, List<Integer> columns) {
    }

    private final List<Column> columns;
    private final List<List<Cell>> rows = new ArrayList<>();
    private final List<Overflow> overflows = new ArrayList<>();
    private final Set<String> breakdownValues = new LinkedHashSet<>();
    private int minimumBreakdownWidth = Integer.MAX_VALUE;
    private int maximumBreakdownWidth;
    private boolean frozen;

    public Grid(List<Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("A grid needs at least one column");
        }
        this.columns = List.copyOf(columns);
    }

    /**
     * Appends a row.
     *
     * @throws IllegalArgumentException if the row is empty or has more cells than the grid has columns
     * @throws IllegalStateException if the grid has already been handed to a {@link Flat}
     */
    public void add(Row row) {
        if (frozen) {
            throw new IllegalStateException("Cannot add a row to a grid that has already been rendered");
        }
        if (row.isEmpty()) {
            throw new IllegalArgumentException("Cannot add an empty row");
        }
        List<Cell> cells = row.cells();
        if (cells.size() > columns.size()) {
            throw new IllegalArgumentException("All columns must be accounted for, missing: " + columns.size()
                    + " (row has " + cells.size() + " cells)");
        }

        Integer overflowWidth = null;
        List<Integer> overflowColumns = new ArrayList<>();

        for (int j = 0; j < cells.size(); j++) {
            Cell cell = cells.get(j);
            if (overflowWidth != null) {
                if (cell.kind() == Cell.Kind.SKIP) {
                    overflowColumns.add(j);
                }
                else {
                    overflows.add(new Overflow(overflowWidth, List.copyOf(overflowColumns)));
                    overflowWidth = null;
                }
            }

            Column column = columns.get(j);
            OptionalInt width = cell.naturalWidth();
            switch (column.type()) {
                case TEXT -> {
                    if (width.isPresent()) {
                        if (cell.kind() == Cell.Kind.OVERFLOW) {
                            overflowWidth = width.getAsInt();
                            overflowColumns = new ArrayList<>();
                            overflowColumns.add(j);
                        }
                        else {
                            column.widen(width.getAsInt());
                        }
                    }
                }
                case BREAKDOWN -> {
                    if (cell.kind() == Cell.Kind.TEXT) {
                        breakdownValues.add(cell.text());
                    }
                    if (width.isPresent()) {
                        minimumBreakdownWidth = Math.min(minimumBreakdownWidth, width.getAsInt());
                        maximumBreakdownWidth = Math.max(maximumBreakdownWidth, width.getAsInt());
                    }
                }
                case COUNT -> {
                    // sized at render time
                }
            }
        }

        if (overflowWidth != null) {
            overflows.add(new Overflow(overflowWidth, List.copyOf(overflowColumns)));
        }
        rows.add(List.copyOf(cells));
    }

    void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<Column> columns() {
        return columns;
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public List<List<Cell>> rows() {
        return Collections.unmodifiableList(rows);
    }

    List<Overflow> overflows() {
        return overflows;
    }

    /**
     * Returns the distinct headings written into breakdown columns.
     */
    public Set<String> breakdownValues() {
        return Collections.unmodifiableSet(breakdownValues);
    }

    int minimumBreakdownWidth() {
        return minimumBreakdownWidth == Integer.MAX_VALUE ? 0 : minimumBreakdownWidth;
    }

    int maximumBreakdownWidth() {
        return maximumBreakdownWidth;
    }
}
