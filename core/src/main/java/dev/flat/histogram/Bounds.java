/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.histogram;

import java.util.function.Function;

/**
 * A contiguous bin. The lower bound is always inclusive; the upper bound is exclusive except
 * for the last bin of a range.
 *
 * @param lower the inclusive lower bound
 * @param upper the upper bound
 * @param upperInclusive whether {@code upper} itself belongs to the bin
 * @param <T> the key type
 */
public record Bounds<T extends Comparable<? super T>>(T lower, T upper, boolean upperInclusive) {

    public boolean contains(T key) {
        if (key.compareTo(lower) < 0) {
            return false;
        }
        int upperComparison = key.compareTo(upper);
        return upperInclusive ? upperComparison <= 0 : upperComparison < 0;
    }

    /**
     * Formats the bin as an interval, e.g. {@code [0, 1.8)} or {@code [7.2, 9]}.
     */
    public String format(Function<T, String> formatter) {
        return "[" + formatter.apply(lower) + ", " + formatter.apply(upper) + (upperInclusive ? "]" : ")");
    }
}
