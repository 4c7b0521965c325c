/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

import java.util.List;

/**
 * One observation of a {@link Dataset}: a value per column, in schema order.
 *
 * @param values the column values; never null, each one {@link Comparable}
 */
public record Dimensions(List<Object> values) {

    public Dimensions {
        values = List.copyOf(values);
    }

    public Object get(int column) {
        return values.get(column);
    }

    public int size() {
        return values.size();
    }
}
