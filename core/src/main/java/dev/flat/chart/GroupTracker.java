/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

/**
 * Tracks which branch currently occupies one column of a collapsed chart, and how many rows
 * have been emitted for it so far.
 */
final class GroupTracker {

    private String locus;
    private int index;

    /**
     * Advances to the next row for {@code partialPath}: continues the current branch when it
     * matches, otherwise starts a new branch at index 0.
     *
     * @return the row index within the branch
     */
    int advance(String partialPath) {
        if (partialPath.equals(locus)) {
            index++;
        }
        else {
            locus = partialPath;
            index = 0;
        }
        return index;
    }

    String locus() {
        return locus;
    }

    int index() {
        return index;
    }
}
