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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import dev.flat.aggregate.Aggregate;
import dev.flat.aggregate.MinimalPrecision;
import dev.flat.aggregate.ValueRange;
import dev.flat.dataset.View;
import dev.flat.render.Alignment;
import dev.flat.render.Column;
import dev.flat.render.Flat;
import dev.flat.render.Grid;
import dev.flat.render.RenderConfig;
import dev.flat.render.Row;

/**
 * Renders the display dimensions of a view as an indented tree, one row per node. Only the
 * top-level nodes carry bars.
 *
 * <pre>
 * /Animal /Size  |Sum(Count)
 * /shark         |**
 *   /medium
 *   /small
 * /whale         |*
 *   /large
 * </pre>
 */
public final class PathChart {

    private static final System.Logger LOG = System.getLogger(PathChart.class.getName());

    private final View view;

    public PathChart(View view) {
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        this.view = view;
    }

    public Flat render(RenderConfig config) {
        PathIndex index = PathIndex.build(view);
        BarSection bars = new BarSection(view, config, index.breakdowns());

        Node root = new Node();
        Map<String, AggregateKey> keys = new HashMap<>();
        for (List<Object> displayPath : index.displayPaths()) {
            List<String> parts = PathIndex.strings(displayPath);
            Node node = root;
            for (String part : parts) {
                node = node.children.computeIfAbsent(part, p -> new Node());
            }
            keys.putIfAbsent(parts.get(0), index.keyOf(displayPath));
        }

        List<Column> columns = new ArrayList<>();
        columns.add(Column.text(Alignment.LEFT));
        bars.appendColumns(columns);
        Grid grid = new Grid(columns);
        bars.preHeaders(1).forEach(grid::add);

        StringBuilder combined = new StringBuilder();
        for (String header : view.displayHeaders()) {
            if (combined.length() > 0) {
                combined.append(' ');
            }
            combined.append('/').append(header);
        }
        Row header = new Row().text(combined.toString());
        bars.appendHeader(header);
        grid.add(header);

        ValueRange range = new ValueRange();
        List<String> path = new ArrayList<>();
        for (Map.Entry<String, Node> top : root.children.entrySet()) {
            String part = top.getKey();
            AggregateKey key = keys.get(part);
            Row row = new Row().text("/" + part);
            bars.appendValues(row, index.aggregateValues(),
                    breakdown -> view.isBreakdown() ? new AggregateKey(key.primary(), breakdown) : key, range);
            grid.add(row);

            path.add(part);
            appendDescendants(grid, top.getValue(), path, index, config);
            path.remove(path.size() - 1);
        }

        LOG.log(System.Logger.Level.DEBUG, "Rendered {0} top-level paths", root.children.size());
        return new Flat(grid, range, config);
    }

    private void appendDescendants(Grid grid, Node node, List<String> path, PathIndex index, RenderConfig config) {
        Aggregate aggregate = config.aggregate();
        String indent = " ".repeat(path.size() * 2);
        for (Map.Entry<String, Node> child : node.children.entrySet()) {
            path.add(child.getKey());
            Row row = new Row().text(indent + "/" + child.getKey());
            if (config.showAggregate()) {
                double value = aggregate.apply(index.partialValues(PathIndex.key(path, path.size())));
                row.text(" ").text("[").text(MinimalPrecision.format(value)).text("]");
            }
            grid.add(row);
            appendDescendants(grid, child.getValue(), path, index, config);
            path.remove(path.size() - 1);
        }
    }

    /**
     * A node of the path tree, with its children in string order.
     */
    private static final class Node {
        private final Map<String, Node> children = new TreeMap<>();
    }
}
