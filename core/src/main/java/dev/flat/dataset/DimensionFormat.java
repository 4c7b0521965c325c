/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * String projection and ordering of dimension values.
 */
public final class DimensionFormat {

    /**
     * Orders dimension tuples element by element using each value's natural order, shorter
     * tuples first on a shared prefix.
     */
    public static final Comparator<List<Object>> TUPLE_ORDER = DimensionFormat::compareTuples;

    /**
     * Orders single dimension values by their natural order.
     */
    public static final Comparator<Object> NATURAL_ORDER = DimensionFormat::compareValues;

    private DimensionFormat() {
    }

    /**
     * Returns the display form of a dimension value. Floating point values print in their
     * shortest plain decimal form without a trailing {@code .0}.
     */
    public static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "inf" : "-inf";
            }
            String plain = new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
            return "-0".equals(plain) ? "0" : plain;
        }
        return String.valueOf(value);
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    static int compareValues(Object left, Object right) {
        return ((Comparable) left).compareTo(right);
    }

    private static int compareTuples(List<Object> left, List<Object> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int result = compareValues(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
