/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.abbreviate;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds the narrowest width at which a set of labels can be shortened without two of them
 * becoming indistinguishable.
 *
 * <p>Labels longer than the candidate width are cut down and marked with {@value #MONIKER}.
 * The search first keeps the head of each label ({@code "hippopot.."}) and, if that collides,
 * the tail ({@code "..potamus"}). Lengths are measured in code points, so wide glyphs count
 * as a single character.</p>
 */
public final class StringAbbreviator {

    public static final String MONIKER = "..";

    private static final int MONIKER_LENGTH = MONIKER.length();

    private StringAbbreviator() {
    }

    /**
     * Searches the widths {@code minimum..maximum} (inclusive) for the first one at which every value
     * can be displayed uniquely.
     *
     * @param minimum the narrowest width to try
     * @param maximum the widest width to try
     * @param values the distinct labels
     * @return the chosen width with its abbreviations, or the longest label length with an identity
     *         mapping when no width in range works
     * @throws IllegalArgumentException if {@code minimum > maximum} or either bound is negative
     */
    public static Abbreviations find(int minimum, int maximum, Collection<String> values) {
        if (minimum < 0 || minimum > maximum) {
            throw new IllegalArgumentException("Invalid abbreviation range [" + minimum + ", " + maximum + "]");
        }
        Set<String> distinct = new LinkedHashSet<>(values);
        if (distinct.isEmpty()) {
            return new Abbreviations(0, Map.of());
        }

        int shortest = Integer.MAX_VALUE;
        int longest = 0;
        for (String value : distinct) {
            int length = length(value);
            shortest = Math.min(shortest, length);
            longest = Math.max(longest, length);
        }

        // Never cut the shortest label when a wider width would leave it whole.
        int start = minimum;
        if (shortest <= minimum && longest > minimum) {
            start = Math.max(minimum, shortest + MONIKER_LENGTH);
        }

        for (int width = start; width <= maximum; width++) {
            Map<String, String> abbreviations = generate(width, distinct);
            if (abbreviations != null) {
                return new Abbreviations(width, abbreviations);
            }
        }

        Map<String, String> identity = new HashMap<>();
        for (String value : distinct) {
            identity.put(value, value);
        }
        return new Abbreviations(longest, identity);
    }

    /**
     * Abbreviates every value to at most {@code width} code points, or returns null if neither
     * the head nor the tail variant keeps them unique.
     */
    static Map<String, String> generate(int width, Set<String> values) {
        Map<String, String> headStems = new HashMap<>();
        Map<String, String> tailStems = new HashMap<>();
        int keep = Math.max(0, width - MONIKER_LENGTH);

        for (String value : values) {
            if (length(value) <= width) {
                headStems.put(value, value);
                tailStems.put(value, value);
            }
            else {
                headStems.put(value, value.substring(0, value.offsetByCodePoints(0, keep)));
                tailStems.put(value, value.substring(value.offsetByCodePoints(value.length(), -keep)));
            }
        }

        // A stem equal to a label kept whole would read as that label, so stems must be unique too.
        if (unique(headStems)) {
            Map<String, String> head = decorate(headStems, width, false);
            if (unique(head)) {
                return head;
            }
        }
        if (unique(tailStems)) {
            Map<String, String> tail = decorate(tailStems, width, true);
            if (unique(tail)) {
                return tail;
            }
        }
        return null;
    }

    private static Map<String, String> decorate(Map<String, String> stems, int width, boolean leading) {
        Map<String, String> decorated = new HashMap<>();
        for (Map.Entry<String, String> entry : stems.entrySet()) {
            String value = entry.getKey();
            if (length(value) <= width) {
                decorated.put(value, value);
            }
            else if (leading) {
                decorated.put(value, MONIKER + entry.getValue());
            }
            else {
                decorated.put(value, entry.getValue() + MONIKER);
            }
        }
        return decorated;
    }

    /**
     * Returns the length of the given string in code points.
     */
    public static int length(String value) {
        return value.codePointCount(0, value.length());
    }

    private static boolean unique(Map<String, String> abbreviations) {
        return new HashSet<>(abbreviations.values()).size() == abbreviations.size();
    }
}
