/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.flat.dataset.DimensionFormat;
import dev.flat.dataset.Dimensions;
import dev.flat.dataset.View;

/**
 * Everything a path-based chart needs to know about the observations of a view, gathered in a
 * single pass.
 *
 * <p>Paths are grouped by the string projection of their display dimensions: two values that
 * print the same are the same node, even when they are not equal.</p>
 */
final class PathIndex {

    static final char SEPARATOR = ';';

    private final List<List<Object>> displayPaths;
    private final Map<List<Object>, AggregateKey> lookup;
    private final Map<String, Integer> pathOccurrences;
    private final Map<AggregateKey, List<Double>> aggregateValues;
    private final Map<String, List<Double>> partialAggregateValues;
    private final List<Object> breakdowns;
    private final List<Set<String>> dimensionValues;

    private PathIndex(List<List<Object>> displayPaths, Map<List<Object>, AggregateKey> lookup,
                      Map<String, Integer> pathOccurrences, Map<AggregateKey, List<Double>> aggregateValues,
                      Map<String, List<Double>> partialAggregateValues, List<Object> breakdowns,
                      List<Set<String>> dimensionValues) {
        this.displayPaths = displayPaths;
        this.lookup = lookup;
        this.pathOccurrences = pathOccurrences;
        this.aggregateValues = aggregateValues;
        this.partialAggregateValues = partialAggregateValues;
        this.breakdowns = breakdowns;
        this.dimensionValues = dimensionValues;
    }

    static PathIndex build(View view) {
        int depth = view.displayHeaders().size();
        Set<String> fullPaths = new HashSet<>();
        Map<String, Integer> pathOccurrences = new HashMap<>();
        Map<AggregateKey, List<Double>> aggregateValues = new HashMap<>();
        Map<String, List<Double>> partialAggregateValues = new HashMap<>();
        Map<List<Object>, AggregateKey> lookup = new LinkedHashMap<>();
        List<Object> breakdowns = new ArrayList<>();
        Set<Object> seenBreakdowns = new HashSet<>();
        List<Set<String>> dimensionValues = new ArrayList<>(depth);
        for (int j = 0; j < depth; j++) {
            dimensionValues.add(new LinkedHashSet<>());
        }

        for (Dimensions dims : view.data()) {
            double value = view.value(dims);
            AggregateKey key = new AggregateKey(view.primaryDim(dims), view.breakdownDim(dims));
            List<Object> displayDims = view.displayDims(dims);
            if (displayDims.size() != depth) {
                throw new IllegalArgumentException("View returned " + displayDims.size()
                        + " display dimensions for " + depth + " display headers");
            }
            List<String> parts = strings(displayDims);

            for (int j = 0; j < depth; j++) {
                dimensionValues.get(j).add(parts.get(j));
            }

            // Prefixes count distinct full paths, not observations.
            if (fullPaths.add(key(parts, depth))) {
                for (int length = 1; length <= depth; length++) {
                    pathOccurrences.merge(key(parts, length), 1, Integer::sum);
                }
            }

            for (int length = 2; length <= depth; length++) {
                partialAggregateValues.computeIfAbsent(key(parts, length), k -> new ArrayList<>()).add(value);
            }
            aggregateValues.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            lookup.putIfAbsent(displayDims, key);

            if (view.isBreakdown() && seenBreakdowns.add(key.breakdown())) {
                breakdowns.add(key.breakdown());
            }
        }

        List<List<Object>> displayPaths = new ArrayList<>(lookup.keySet());
        displayPaths.sort(DimensionFormat.TUPLE_ORDER);
        breakdowns.sort(DimensionFormat.NATURAL_ORDER);

        return new PathIndex(Collections.unmodifiableList(displayPaths), lookup, pathOccurrences, aggregateValues,
                partialAggregateValues, Collections.unmodifiableList(breakdowns), dimensionValues);
    }

    /**
     * Returns the key of the first {@code length} parts of a path, e.g. {@code "a;b;"}.
     */
    static String key(List<String> parts, int length) {
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < length; i++) {
            key.append(parts.get(i)).append(SEPARATOR);
        }
        return key.toString();
    }

    static List<String> strings(List<Object> values) {
        List<String> strings = new ArrayList<>(values.size());
        for (Object value : values) {
            strings.add(DimensionFormat.format(value));
        }
        return strings;
    }

    /**
     * Returns the distinct display paths in their natural order.
     */
    List<List<Object>> displayPaths() {
        return displayPaths;
    }

    /**
     * Returns the aggregate key of the first observation seen with the given display path.
     *
     * @throws IllegalStateException if the path was not indexed
     */
    AggregateKey keyOf(List<Object> displayPath) {
        AggregateKey key = lookup.get(displayPath);
        if (key == null) {
            throw new IllegalStateException("Display path " + displayPath + " is not mapped to dimensions");
        }
        return key;
    }

    int occurrences(String partialPath) {
        Integer occurrences = pathOccurrences.get(partialPath);
        if (occurrences == null) {
            throw new IllegalStateException("Partial path '" + partialPath + "' was never indexed");
        }
        return occurrences;
    }

    Map<AggregateKey, List<Double>> aggregateValues() {
        return aggregateValues;
    }

    /**
     * Returns the measurements beneath a partial path of at least two parts.
     */
    List<Double> partialValues(String partialPath) {
        return partialAggregateValues.getOrDefault(partialPath, List.of());
    }

    List<Object> breakdowns() {
        return breakdowns;
    }

    /**
     * Returns the distinct display strings of each display column.
     */
    Set<String> dimensionValues(int column) {
        return dimensionValues.get(column);
    }
}
