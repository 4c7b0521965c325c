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
import java.util.List;

/**
 * A logical line of a {@link Grid}. The n-th cell belongs to the n-th column.
 */
public final class Row {

    private final List<Cell> cells = new ArrayList<>();

    public Row add(Cell cell) {
        cells.add(cell);
        return this;
    }

    public Row text(String text) {
        return add(Cell.text(text));
    }

    public Row empty() {
        return add(Cell.empty());
    }

    /**
     * Appends all cells of {@code other}.
     */
    public Row addAll(List<Cell> other) {
        cells.addAll(other);
        return this;
    }

    public List<Cell> cells() {
        return Collections.unmodifiableList(cells);
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    @Override
    public String toString() {
        return "Row" + cells;
    }
}
