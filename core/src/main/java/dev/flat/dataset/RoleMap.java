/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assigns roles to the columns of a dimension vector: which columns are displayed (the first
 * of them being the primary dimension) and which column, if any, is broken down into
 * parallel bar columns.
 *
 * @param display the displayed column indices, primary first
 * @param breakdown the breakdown column index, or -1 for none
 */
public record RoleMap(List<Integer> display, int breakdown) {

    public static final int NO_BREAKDOWN = -1;

    public RoleMap {
        if (display == null || display.isEmpty()) {
            throw new IllegalArgumentException("At least one display column must be specified");
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer column : display) {
            if (column == null || column < 0) {
                throw new IllegalArgumentException("Invalid display column: " + column);
            }
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Display column " + column + " is listed twice");
            }
        }
        if (breakdown < NO_BREAKDOWN) {
            throw new IllegalArgumentException("Invalid breakdown column: " + breakdown);
        }
        if (seen.contains(breakdown)) {
            throw new IllegalArgumentException("Column " + breakdown + " cannot be both displayed and broken down");
        }
        display = Collections.unmodifiableList(new ArrayList<>(display));
    }

    /**
     * Displays the given columns, the first one being the primary dimension.
     */
    public static RoleMap displaying(int... columns) {
        List<Integer> display = new ArrayList<>(columns.length);
        for (int column : columns) {
            display.add(column);
        }
        return new RoleMap(display, NO_BREAKDOWN);
    }

    public RoleMap withBreakdown(int column) {
        return new RoleMap(display, column);
    }

    public int primary() {
        return display.get(0);
    }

    public boolean hasBreakdown() {
        return breakdown != NO_BREAKDOWN;
    }
}
