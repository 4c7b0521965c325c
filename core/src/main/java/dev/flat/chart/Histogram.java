/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.flat.aggregate.ValueRange;
import dev.flat.dataset.DimensionFormat;
import dev.flat.dataset.Dimensions;
import dev.flat.dataset.View;
import dev.flat.histogram.BinDomain;
import dev.flat.histogram.Binner;
import dev.flat.histogram.Bounds;
import dev.flat.render.Alignment;
import dev.flat.render.Column;
import dev.flat.render.Flat;
import dev.flat.render.Grid;
import dev.flat.render.RenderConfig;
import dev.flat.render.Row;

/**
 * Renders the primary dimension of a view as a histogram: the range of primary values is split
 * into equal bins and each bin shows the aggregate of the observations falling into it.
 *
 * <pre>
 * abc         |Sum(Count)
 * [0, 1.8)    |**
 * [1.8, 3.6)  |**
 * [7.2, 9]    |**
 * </pre>
 *
 * @param <T> the type of the primary dimension
 */
public final class Histogram<T extends Comparable<? super T>> {

    private static final System.Logger LOG = System.getLogger(Histogram.class.getName());

    private final View view;
    private final Binner<T> binner;

    private Histogram(View view, Binner<T> binner) {
        this.view = view;
        this.binner = binner;
    }

    /**
     * Creates a histogram over the built-in domain matching the primary values of the view.
     *
     * @param bins the number of bins; values below 1 are raised to 1
     * @throws IllegalArgumentException if there is no built-in domain for the primary values
     */
    public static Histogram<?> of(View view, int bins) {
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        if (view.data().isEmpty()) {
            return of(view, bins, BinDomain.doubles());
        }
        Object sample = view.primaryDim(view.data().get(0));
        BinDomain<?> domain = BinDomain.forType(sample.getClass());
        return of(view, bins, domain);
    }

    /**
     * Creates a histogram over an explicit domain. The primary values of the view must be of the
     * domain's key type.
     *
     * @param bins the number of bins; values below 1 are raised to 1
     */
    public static <T extends Comparable<? super T>> Histogram<T> of(View view, int bins, BinDomain<T> domain) {
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        return new Histogram<>(view, new Binner<>(domain, bins));
    }

    public Flat render(RenderConfig config) {
        List<Dimensions> data = view.data();

        Set<Object> distinct = new LinkedHashSet<>();
        if (view.isBreakdown()) {
            for (Dimensions dims : data) {
                distinct.add(view.breakdownDim(dims));
            }
        }
        List<Object> breakdowns = new ArrayList<>(distinct);
        breakdowns.sort(DimensionFormat.NATURAL_ORDER);
        BarSection bars = new BarSection(view, config, breakdowns);

        List<Column> columns = new ArrayList<>();
        columns.add(Column.text(Alignment.LEFT));
        bars.appendColumns(columns);
        Grid grid = new Grid(columns);
        bars.preHeaders(1).forEach(grid::add);

        Row header = new Row().text(view.displayHeaders().get(0));
        bars.appendHeader(header);
        grid.add(header);

        ValueRange range = new ValueRange();
        if (data.isEmpty()) {
            LOG.log(System.Logger.Level.DEBUG, "No observations, rendering header only");
            return new Flat(grid, range, config);
        }

        List<T> keys = new ArrayList<>(data.size());
        for (Dimensions dims : data) {
            keys.add(primary(dims));
        }
        List<Bounds<T>> bounds = binner.bounds(keys);
        List<List<Dimensions>> partitions = binner.partition(bounds, data, this::primary);

        for (int i = 0; i < bounds.size(); i++) {
            Map<Object, List<Double>> buckets = new HashMap<>();
            for (Dimensions dims : partitions.get(i)) {
                buckets.computeIfAbsent(view.breakdownDim(dims), k -> new ArrayList<>()).add(view.value(dims));
            }

            Row row = new Row().text(bounds.get(i).format(binner.domain()::format));
            bars.appendValues(row, buckets, breakdown -> breakdown, range);
            grid.add(row);
        }

        return new Flat(grid, range, config);
    }

    @SuppressWarnings("unchecked")
    private T primary(Dimensions dims) {
        return (T) view.primaryDim(dims);
    }
}
