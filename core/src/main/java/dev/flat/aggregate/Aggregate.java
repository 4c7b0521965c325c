/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.aggregate;

import java.util.List;
import java.util.Map;

/**
 * The functions that summarize the measurements of a group.
 *
 * <p>Every variant maps an empty group to {@code 0}.</p>
 */
public enum Aggregate {

    /** Arithmetic mean, e.g. {@code [1, 2, 3] -> 2}. */
    AVERAGE("Average"),
    /** Greatest value, e.g. {@code [1, 2, 3] -> 3}. */
    MAX("Max"),
    /** Smallest value, e.g. {@code [1, 2, 3] -> 1}. */
    MIN("Min"),
    /** Total, e.g. {@code [1, 2, 3] -> 6}. */
    SUM("Sum");

    private final String displayName;

    Aggregate(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Applies this aggregate to the given measurements.
     */
    public double apply(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return switch (this) {
            case AVERAGE -> sum(values) / values.size();
            case MAX -> {
                double max = Double.NEGATIVE_INFINITY;
                for (double value : values) {
                    max = Math.max(max, value);
                }
                yield max;
            }
            case MIN -> {
                double min = Double.POSITIVE_INFINITY;
                for (double value : values) {
                    min = Math.min(min, value);
                }
                yield min;
            }
            case SUM -> sum(values);
        };
    }

    /**
     * Looks up the measurements of {@code key}, applies this aggregate and widens {@code range}
     * by the result. A key with no measurements aggregates an empty group.
     *
     * @param buckets measurements per key
     * @param key the group to aggregate
     * @param range the running range of all applied aggregates
     * @return the aggregate of the group
     */
    public <K> double applyTo(Map<K, List<Double>> buckets, K key, ValueRange range) {
        double value = apply(buckets.getOrDefault(key, List.of()));
        range.include(value);
        return value;
    }

    /**
     * Parses an aggregate from its display name, ignoring case.
     *
     * @throws IllegalArgumentException if the name matches no aggregate
     */
    public static Aggregate fromName(String name) {
        for (Aggregate aggregate : values()) {
            if (aggregate.displayName.equalsIgnoreCase(name)) {
                return aggregate;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate: " + name);
    }

    private static double sum(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
