/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

/**
 * Where a row lies relative to the midpoint of the branch it belongs to.
 */
enum Position {
    ABOVE,
    AT,
    BELOW;

    /**
     * Locates the {@code index}-th row of a branch spanning {@code occurrences} rows. The branch
     * label sits on row {@code ceil(occurrences / 2) - 1}.
     */
    static Position of(int index, int occurrences) {
        int midpoint = (occurrences + 1) / 2 - 1;
        if (midpoint > index) {
            return ABOVE;
        }
        return midpoint == index ? AT : BELOW;
    }

    /**
     * Returns the glyph joining a branch label to a descendant in this position.
     */
    String connector() {
        return switch (this) {
            case ABOVE -> "┐";
            case AT -> "-";
            case BELOW -> "┘";
        };
    }
}
