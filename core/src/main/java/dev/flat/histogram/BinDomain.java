/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.histogram;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import dev.flat.dataset.DimensionFormat;

/**
 * The arithmetic a {@link Binner} needs over the keys it bins.
 *
 * <p>Implement this to bin key types other than the built-in {@link #doubles()},
 * {@link #longs()} and {@link #integers()} domains.</p>
 *
 * @param <T> the key type
 */
public interface BinDomain<T extends Comparable<? super T>> {

    T add(T left, T right);

    T subtract(T left, T right);

    /**
     * Converts a key to a double, for scaling.
     */
    double toDouble(T value);

    /**
     * Converts a scaled (and already rounded) double back to a key.
     */
    T fromDouble(double value);

    RoundingPolicy rounding();

    /**
     * Returns the display form of a bin bound.
     */
    default String format(T value) {
        return DimensionFormat.format(value);
    }

    /**
     * Divides a key by a count, rounded according to {@link #rounding()}.
     */
    default T divide(T value, int count) {
        return fromDouble(rounding().apply(toDouble(value) / count));
    }

    /**
     * Multiplies a key by a count, rounded according to {@link #rounding()}.
     */
    default T multiply(T value, int count) {
        return fromDouble(rounding().apply(toDouble(value) * count));
    }

    /**
     * Returns the {@code bins + 1} edges of {@code bins} equally wide bins, starting at {@code min}
     * and reaching at least {@code max}. The width is {@code (max - min) / bins}, rounded according to
     * {@link #rounding()}.
     *
     * @param min the smallest key, strictly below {@code max}
     * @param max the largest key
     * @throws IllegalArgumentException if the edges cannot be represented as keys
     */
    default List<T> edges(T min, T max, int bins) {
        T width = divide(subtract(max, min), bins);
        List<T> edges = new ArrayList<>(bins + 1);
        for (int i = 0; i <= bins; i++) {
            edges.add(add(min, multiply(width, i)));
        }
        return edges;
    }

    static BinDomain<Double> doubles() {
        return Domains.DOUBLES;
    }

    static BinDomain<Long> longs() {
        return Domains.LONGS;
    }

    static BinDomain<Integer> integers() {
        return Domains.INTEGERS;
    }

    /**
     * Returns the built-in domain for keys of the given class.
     *
     * @throws IllegalArgumentException if the class has no built-in domain
     */
    @SuppressWarnings("unchecked")
    static <T extends Comparable<? super T>> BinDomain<T> forType(Class<?> type) {
        if (type == Double.class) {
            return (BinDomain<T>) Domains.DOUBLES;
        }
        if (type == Float.class) {
            return (BinDomain<T>) Domains.FLOATS;
        }
        if (type == Long.class) {
            return (BinDomain<T>) Domains.LONGS;
        }
        if (type == Integer.class) {
            return (BinDomain<T>) Domains.INTEGERS;
        }
        if (type == Short.class) {
            return (BinDomain<T>) Domains.SHORTS;
        }
        if (type == Byte.class) {
            return (BinDomain<T>) Domains.BYTES;
        }
        if (type == BigDecimal.class) {
            return (BinDomain<T>) Domains.DECIMALS;
        }
        throw new IllegalArgumentException("No bin domain for keys of type " + type.getName());
    }
}
