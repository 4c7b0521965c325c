/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.histogram;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Partitions an ordered key domain into equally wide, contiguous bins.
 *
 * <p>Given the smallest and largest key, the bin width is {@code (max - min) / bins}, rounded by
 * the domain's {@link RoundingPolicy}. Each bin is {@code [lower, upper)}, except the last which
 * is {@code [lower, upper]}; when all keys are equal there is a single bin {@code [min, min]}.
 * The edges come from {@link BinDomain#edges}.</p>
 *
 * <p>Keys are placed by a linear scan over the bounds, which is O(keys × bins).</p>
 *
 * @param <T> the key type
 */
public final class Binner<T extends Comparable<? super T>> {

    private static final System.Logger LOG = System.getLogger(Binner.class.getName());

    private final BinDomain<T> domain;
    private final int bins;

    /**
     * @param domain the arithmetic over the keys
     * @param bins the number of bins; values below 1 are raised to 1
     */
    public Binner(BinDomain<T> domain, int bins) {
        if (domain == null) {
            throw new IllegalArgumentException("Bin domain cannot be null");
        }
        this.domain = domain;
        this.bins = Math.max(bins, 1);
    }

    public BinDomain<T> domain() {
        return domain;
    }

    public int bins() {
        return bins;
    }

    /**
     * Computes the bin bounds covering the given keys.
     *
     * @throws NoDataException if there are no keys
     * @throws IllegalArgumentException if the domain cannot represent the bounds of the keys' range
     */
    public List<Bounds<T>> bounds(Collection<? extends T> keys) {
        if (keys.isEmpty()) {
            throw new NoDataException("Cannot bin an empty domain");
        }

        T min = null;
        T max = null;
        for (T key : keys) {
            if (min == null || key.compareTo(min) < 0) {
                min = key;
            }
            if (max == null || key.compareTo(max) > 0) {
                max = key;
            }
        }

        if (min.compareTo(max) == 0) {
            return List.of(new Bounds<>(min, min, true));
        }

        List<T> edges = domain.edges(min, max, bins);
        List<Bounds<T>> bounds = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            bounds.add(new Bounds<>(edges.get(i), edges.get(i + 1), i + 1 == bins));
        }

        LOG.log(System.Logger.Level.DEBUG, "Binned [{0}, {1}] into {2} bins up to {3}",
                domain.format(min), domain.format(max), bins, domain.format(edges.get(bins)));
        return Collections.unmodifiableList(bounds);
    }

    /**
     * Returns the index of the bin containing {@code key}.
     *
     * <p>A key outside every bin (floating point drift at a boundary) is placed in the nearest
     * bin and reported as a warning.</p>
     */
    public int indexOf(List<Bounds<T>> bounds, T key) {
        for (int i = 0; i < bounds.size(); i++) {
            if (bounds.get(i).contains(key)) {
                return i;
            }
        }
        if (bounds.isEmpty()) {
            throw new NoDataException("No bins to place key " + domain.format(key) + " in");
        }
        int nearest = key.compareTo(bounds.get(0).lower()) < 0 ? 0 : bounds.size() - 1;
        LOG.log(System.Logger.Level.WARNING, "Key {0} matches no bin, clamping to {1}",
                domain.format(key), bounds.get(nearest).format(domain::format));
        return nearest;
    }

    /**
     * Splits {@code entries} by the bin of their key, preserving their order within each bin.
     *
     * @return one list per bin, in bin order
     */
    public <E> List<List<E>> partition(List<Bounds<T>> bounds, Collection<E> entries, Function<? super E, ? extends T> key) {
        List<List<E>> partitions = new ArrayList<>(bounds.size());
        for (int i = 0; i < bounds.size(); i++) {
            partitions.add(new ArrayList<>());
        }
        for (E entry : entries) {
            partitions.get(indexOf(bounds, key.apply(entry))).add(entry);
        }
        return partitions;
    }

    /**
     * Counts the keys falling into each bin.
     *
     * @throws NoDataException if there are no keys
     */
    public int[] count(Collection<? extends T> keys) {
        List<Bounds<T>> bounds = bounds(keys);
        int[] counts = new int[bounds.size()];
        for (T key : keys) {
            counts[indexOf(bounds, key)]++;
        }
        return counts;
    }

    /**
     * Exception thrown when binning is asked for without any keys.
     */
    public static class NoDataException extends RuntimeException {
        public NoDataException(String message) {
            super(message);
        }
    }
}
