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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered column headers of a {@link Dataset}.
 *
 * <p>Headers are non-blank and unique; their position is the column index used by
 * {@link RoleMap} and {@link Measure}.</p>
 */
public final class Schema {

    private final List<String> headers;
    private final Map<String, Integer> indexByHeader;

    private Schema(List<String> headers, Map<String, Integer> indexByHeader) {
        this.headers = headers;
        this.indexByHeader = indexByHeader;
    }

    /**
     * Creates a schema with the given column headers.
     *
     * @throws IllegalArgumentException if no header is given, or a header is blank or repeated
     */
    public static Schema of(String... headers) {
        if (headers == null || headers.length == 0) {
            throw new IllegalArgumentException("At least one column header must be specified");
        }
        List<String> list = new ArrayList<>(headers.length);
        Map<String, Integer> index = new HashMap<>();
        for (String header : headers) {
            if (header == null || header.isBlank()) {
                throw new IllegalArgumentException("Column header cannot be null or blank");
            }
            if (index.putIfAbsent(header, list.size()) != null) {
                throw new IllegalArgumentException("Duplicate column header: " + header);
            }
            list.add(header);
        }
        return new Schema(Collections.unmodifiableList(list), Collections.unmodifiableMap(index));
    }

    public int size() {
        return headers.size();
    }

    public String header(int column) {
        checkColumn(column);
        return headers.get(column);
    }

    public List<String> headers() {
        return headers;
    }

    /**
     * Returns the index of the column with the given header.
     *
     * @throws IllegalArgumentException if there is no such column
     */
    public int indexOf(String header) {
        Integer index = indexByHeader.get(header);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column: " + header);
        }
        return index;
    }

    void checkColumn(int column) {
        if (column < 0 || column >= headers.size()) {
            throw new IllegalArgumentException("Column index " + column + " out of range for schema " + headers);
        }
    }

    @Override
    public String toString() {
        return "Schema" + headers;
    }
}
