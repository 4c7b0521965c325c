/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.histogram;

/**
 * How a bin domain rounds the result of dividing or multiplying by a count.
 */
public enum RoundingPolicy {

    /** Continuous domains keep the exact result. */
    EXACT,
    /** Integral domains round up, so that the bins always cover the full range. */
    CEILING;

    public double apply(double value) {
        return switch (this) {
            case EXACT -> value;
            case CEILING -> Math.ceil(value);
        };
    }
}
