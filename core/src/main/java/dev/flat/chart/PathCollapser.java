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
import java.util.List;

import dev.flat.abbreviate.Abbreviations;
import dev.flat.abbreviate.StringAbbreviator;
import dev.flat.aggregate.Aggregate;
import dev.flat.aggregate.MinimalPrecision;
import dev.flat.aggregate.ValueRange;
import dev.flat.dataset.View;
import dev.flat.render.Alignment;
import dev.flat.render.Cell;
import dev.flat.render.Column;
import dev.flat.render.Grid;
import dev.flat.render.RenderConfig;
import dev.flat.render.Row;

/**
 * Lays out one row per distinct display path, merging rows that share an ancestor into a single
 * branch that is labelled once, at its midpoint.
 *
 * <p>The primary dimension sits next to the bars and the outermost ancestor on the far left:</p>
 * <pre>
 * C  B    A   |Sum(Count)
 * c1 ┐
 * c2 - b1 ┐
 * c3 ┘    - a1  |*****
 * c1 - b2 ┘
 * c1 - b3 ┘
 * </pre>
 *
 * <p>Paths are walked in their natural order. For every column a {@link GroupTracker} follows
 * the branch occupying it, so each row knows whether it lies above, at, or below the
 * branch's midpoint. Only the row at the midpoint prints the label; ancestors are joined to the
 * label of their descendant with {@code ┐}, {@code -} or {@code ┘}.</p>
 */
public final class PathCollapser {

    private static final System.Logger LOG = System.getLogger(PathCollapser.class.getName());

    private final View view;
    private final RenderConfig config;

    public PathCollapser(View view, RenderConfig config) {
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Render config cannot be null");
        }
        this.view = view;
        this.config = config;
    }

    /**
     * The collapsed layout and the range of the aggregates it draws.
     *
     * @param grid the rows of the chart, headers included
     * @param range the smallest and largest aggregate drawn as a bar
     */
    public record Layout(Grid grid, ValueRange range) {
    }

    public Layout collapse() {
        PathIndex index = PathIndex.build(view);
        List<String> headers = view.displayHeaders();
        int depth = headers.size();
        boolean intermediate = config.showIntermediateAggregates();
        Aggregate aggregate = config.aggregate();
        BarSection bars = new BarSection(view, config, index.breakdowns());

        List<Abbreviations> abbreviations = abbreviations(index, headers);

        List<Column> columns = new ArrayList<>();
        for (int j = 0; j < depth; j++) {
            columns.add(Column.text(Alignment.LEFT));
            if (j + 1 < depth) {
                columns.add(Column.text(Alignment.CENTER));
                if (intermediate) {
                    columns.add(Column.text(Alignment.LEFT));
                    columns.add(Column.text(Alignment.RIGHT));
                    columns.add(Column.text(Alignment.LEFT));
                }
                columns.add(Column.text(Alignment.CENTER));
            }
        }
        int labelColumns = columns.size();
        bars.appendColumns(columns);

        Grid grid = new Grid(columns);
        bars.preHeaders(labelColumns).forEach(grid::add);

        Row header = new Row();
        List<String> reversedHeaders = new ArrayList<>(headers);
        Collections.reverse(reversedHeaders);
        for (int j = 0; j < depth; j++) {
            header.text(reversedHeaders.get(j));
            if (j + 1 < depth) {
                header.text(" ");
                if (intermediate) {
                    header.add(Cell.overflow(aggregate.toString())).add(Cell.skip()).add(Cell.skip());
                }
                header.text("   ");
            }
        }
        bars.appendHeader(header);
        grid.add(header);

        GroupTracker[] trackers = new GroupTracker[depth];
        for (int j = 0; j < depth; j++) {
            trackers[j] = new GroupTracker();
        }
        ValueRange range = new ValueRange();

        for (List<Object> displayPath : index.displayPaths()) {
            List<String> parts = PathIndex.strings(displayPath);
            // Chunks are collected primary first and emitted in reverse, outermost ancestor on the left.
            List<List<Cell>> chunks = new ArrayList<>(depth);
            Position descendant = null;

            for (int dagIndex = 0; dagIndex < depth; dagIndex++) {
                int j = depth - dagIndex - 1;
                String partialPath = PathIndex.key(parts, dagIndex + 1);
                int rowIndex = trackers[j].advance(partialPath);
                Position position = Position.of(rowIndex, index.occurrences(partialPath));
                List<Cell> chunk = new ArrayList<>();

                if (position == Position.AT) {
                    String part = parts.get(dagIndex);
                    chunk.add(Cell.text(abbreviations.isEmpty() ? part : abbreviations.get(dagIndex).abbreviate(part)));

                    if (dagIndex == 0) {
                        AggregateKey key = index.keyOf(displayPath);
                        Row values = new Row();
                        bars.appendValues(values, index.aggregateValues(),
                                breakdown -> view.isBreakdown() ? new AggregateKey(key.primary(), breakdown) : key, range);
                        chunk.addAll(values.cells());
                    }
                    else {
                        chunk.add(Cell.text(" "));
                        if (intermediate) {
                            chunk.add(Cell.text("["));
                            chunk.add(Cell.text(MinimalPrecision.format(aggregate.apply(index.partialValues(partialPath)))));
                            chunk.add(Cell.text("]"));
                        }
                        chunk.add(Cell.text(requireDescendant(descendant, displayPath).connector()));
                    }
                }
                else if (dagIndex != 0) {
                    boolean joinsDescendant = requireDescendant(descendant, displayPath) == Position.AT;
                    chunk.add(Cell.empty());
                    chunk.add(joinsDescendant ? Cell.text(" ") : Cell.empty());
                    if (intermediate) {
                        chunk.add(Cell.empty());
                        chunk.add(Cell.empty());
                        chunk.add(Cell.empty());
                    }
                    chunk.add(joinsDescendant ? Cell.text(Position.AT.connector()) : Cell.empty());
                }

                descendant = position;
                chunks.add(chunk);
            }

            Row row = new Row();
            for (int c = chunks.size() - 1; c >= 0; c--) {
                row.addAll(chunks.get(c));
            }
            if (!row.isEmpty()) {
                grid.add(row);
            }
        }

        LOG.log(System.Logger.Level.DEBUG, "Collapsed {0} observations into {1} paths over {2} columns",
                view.data().size(), index.displayPaths().size(), depth);
        return new Layout(grid, range);
    }

    private List<Abbreviations> abbreviations(PathIndex index, List<String> headers) {
        if (!config.abbreviateValues()) {
            return List.of();
        }
        int longestHeader = 0;
        for (String header : headers) {
            longestHeader = Math.max(longestHeader, StringAbbreviator.length(header));
        }
        List<Abbreviations> abbreviations = new ArrayList<>(headers.size());
        for (int j = 0; j < headers.size(); j++) {
            abbreviations.add(StringAbbreviator.find(StringAbbreviator.length(headers.get(j)), longestHeader,
                    index.dimensionValues(j)));
        }
        return abbreviations;
    }

    private static Position requireDescendant(Position descendant, List<Object> displayPath) {
        if (descendant == null) {
            throw new IllegalStateException("Ancestor of " + displayPath + " rendered before its descendant");
        }
        return descendant;
    }
}
