/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import dev.flat.aggregate.Aggregate;
import dev.flat.aggregate.MinimalPrecision;
import dev.flat.aggregate.ValueRange;
import dev.flat.dataset.DimensionFormat;
import dev.flat.dataset.View;
import dev.flat.render.Alignment;
import dev.flat.render.Cell;
import dev.flat.render.Column;
import dev.flat.render.RenderConfig;
import dev.flat.render.Row;

/**
 * The right-hand part shared by every chart: the optional {@code [n]} annotation, the {@code |}
 * delimiter and the bars, either a single bar or one per breakdown value.
 *
 * <pre>
 * ...  Sum  |Sum(Count)        ...  | 1   4   5 |
 * ...  [4]  |****              ...  |***  *     |
 * </pre>
 */
final class BarSection {

    private final View view;
    private final Aggregate aggregate;
    private final boolean showAggregate;
    private final List<Object> breakdowns;

    BarSection(View view, RenderConfig config, List<Object> breakdowns) {
        this.view = view;
        this.aggregate = config.aggregate();
        this.showAggregate = config.showAggregate();
        this.breakdowns = breakdowns;
    }

    void appendColumns(List<Column> columns) {
        if (showAggregate) {
            columns.add(Column.text(Alignment.CENTER));
            columns.add(Column.text(Alignment.LEFT));
            columns.add(Column.text(Alignment.RIGHT));
            columns.add(Column.text(Alignment.LEFT));
        }
        columns.add(Column.text(Alignment.CENTER));
        columns.add(Column.text(Alignment.CENTER));

        if (view.isBreakdown()) {
            for (int k = 0; k < breakdowns.size(); k++) {
                columns.add(Column.breakdown(Alignment.CENTER));
                if (k + 1 < breakdowns.size()) {
                    columns.add(Column.text(Alignment.LEFT));
                }
            }
            columns.add(Column.text(Alignment.CENTER));
        }
        else {
            columns.add(Column.count(Alignment.LEFT));
        }
    }

    /**
     * Returns the label rows placed above the header of a breakdown chart, aligned with the first bar
     * column. A breakdown measured by itself gets a single {@code Sum(label)} row, any other gets the
     * breakdown label followed by {@code Sum(measure)}.
     *
     * @param leadingColumns the number of columns before this section
     */
    List<Row> preHeaders(int leadingColumns) {
        Optional<String> breakdownHeader = view.breakdownHeader();
        if (breakdownHeader.isEmpty()) {
            return List.of();
        }
        String label = breakdownHeader.get();
        List<Row> rows = new ArrayList<>(2);
        if (!label.equals(view.valueHeader())) {
            rows.add(preHeader(leadingColumns, label));
        }
        rows.add(preHeader(leadingColumns, aggregateLabel()));
        return rows;
    }

    private Row preHeader(int leadingColumns, String label) {
        Row row = new Row();
        int blanks = leadingColumns + (showAggregate ? 4 : 0) + 2;
        for (int i = 0; i < blanks; i++) {
            row.empty();
        }
        return row.add(Cell.plain(label));
    }

    void appendHeader(Row header) {
        if (showAggregate) {
            header.empty()
                    .add(Cell.overflow(aggregate.toString()))
                    .add(Cell.skip())
                    .add(Cell.skip());
        }
        header.text("  ").text("|");

        if (view.isBreakdown()) {
            for (int k = 0; k < breakdowns.size(); k++) {
                header.text(DimensionFormat.format(breakdowns.get(k)));
                if (k + 1 < breakdowns.size()) {
                    header.text(" ");
                }
            }
            header.text("|");
        }
        else {
            header.add(Cell.plain(aggregateLabel()));
        }
    }

    /**
     * Appends the annotation and bars of one group.
     *
     * @param row the row to extend
     * @param buckets the measurements per aggregate key
     * @param keyFor maps a breakdown value (null without breakdown) to its bucket key
     * @param range the running range, widened by every aggregate drawn
     */
    <K> void appendValues(Row row, Map<K, List<Double>> buckets, Function<Object, K> keyFor, ValueRange range) {
        if (view.isBreakdown()) {
            List<Double> values = new ArrayList<>(breakdowns.size());
            for (Object breakdown : breakdowns) {
                values.add(aggregate.applyTo(buckets, keyFor.apply(breakdown), range));
            }
            appendAnnotation(row, aggregate.apply(values));
            row.text("  ").text("|");
            for (int k = 0; k < values.size(); k++) {
                row.add(Cell.value(values.get(k)));
                if (k + 1 < values.size()) {
                    row.text(" ");
                }
            }
            row.text("|");
        }
        else {
            double value = aggregate.applyTo(buckets, keyFor.apply(null), range);
            appendAnnotation(row, value);
            row.text("  ").text("|").add(Cell.value(value));
        }
    }

    private void appendAnnotation(Row row, double value) {
        if (showAggregate) {
            row.text(" ").text("[").text(MinimalPrecision.format(value)).text("]");
        }
    }

    String aggregateLabel() {
        return aggregate + "(" + view.valueHeader() + ")";
    }
}
