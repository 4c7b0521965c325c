/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.abbreviate;

import java.util.Map;

/**
 * The outcome of an abbreviation search: the chosen width and, per original string,
 * the form to display at that width.
 *
 * @param width the width (in code points) at which every string is represented uniquely
 * @param mapping original string to its display form
 */
public record Abbreviations(int width, Map<String, String> mapping) {

    public Abbreviations {
        mapping = Map.copyOf(mapping);
    }

    /**
     * Returns the display form of the given value, or the value itself when it was not part of the search.
     */
    public String abbreviate(String value) {
        return mapping.getOrDefault(value, value);
    }
}
