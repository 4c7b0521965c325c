/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.aggregate;

/**
 * Running minimum and maximum over the aggregates rendered in one chart. Bars are scaled
 * against this range.
 */
public final class ValueRange {

    private double minimum = Double.POSITIVE_INFINITY;
    private double maximum = Double.NEGATIVE_INFINITY;

    public void include(double value) {
        if (value < minimum) {
            minimum = value;
        }
        if (value > maximum) {
            maximum = value;
        }
    }

    /**
     * Returns true until the first value has been included.
     */
    public boolean isEmpty() {
        return minimum > maximum;
    }

    public double minimum() {
        return isEmpty() ? 0.0 : minimum;
    }

    public double maximum() {
        return isEmpty() ? 0.0 : maximum;
    }

    /**
     * Returns the largest magnitude in the range, which bounds the longest bar.
     */
    public double magnitude() {
        return Math.max(Math.abs(minimum()), Math.abs(maximum()));
    }

    @Override
    public String toString() {
        return isEmpty() ? "ValueRange[]" : "ValueRange[" + minimum + ", " + maximum + "]";
    }
}
