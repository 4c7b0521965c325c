/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.render;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.flat.abbreviate.Abbreviations;
import dev.flat.abbreviate.StringAbbreviator;
import dev.flat.aggregate.ValueRange;

/**
 * The textual rendering of a chart. Use {@link #toString()} to materialize it.
 *
 * <p>Bars are drawn relative to each other. The width left over by the text columns is shared
 * by the bar columns; when the largest magnitude fits, every glyph stands for one unit,
 * otherwise all bars are scaled down linearly until it fits. Bars are never scaled up.
 * Negative values are drawn with {@value #NEGATIVE_GLYPH}.</p>
 *
 * <p>Building a {@code Flat} freezes its grid: the column widths and the value range are fixed
 * at that point, and no further rows can be added.</p>
 */
public final class Flat {

    private static final System.Logger LOG = System.getLogger(Flat.class.getName());

    public static final char POSITIVE_GLYPH = '*';
    public static final char NEGATIVE_GLYPH = '⊖';

    static final int MINIMUM_VIEW_WIDTH = 2;

    private final Grid grid;
    private final double magnitude;
    private final int widthHint;
    private final boolean abbreviateBreakdown;
    private final int[] widths;
    private final Map<Integer, Integer> overflowOverrides = new HashMap<>();
    private String rendered;

    public Flat(Grid grid, ValueRange range, RenderConfig config) {
        grid.freeze();
        this.grid = grid;
        this.magnitude = range.magnitude();
        this.widthHint = config.widthHint();
        this.abbreviateBreakdown = config.abbreviateBreakdown();
        this.widths = resolveWidths();
    }

    /**
     * Reconciles every overflow label with the columns it spans: a label wider than its columns
     * widens the last of them, a narrower one is padded to their combined width.
     */
    private int[] resolveWidths() {
        int[] resolved = new int[grid.columns().size()];
        for (int j = 0; j < resolved.length; j++) {
            resolved[j] = grid.column(j).width();
        }

        for (Grid.Overflow overflow : grid.overflows()) {
            int remainder = overflow.width();
            int excess = 0;

            for (int index : overflow.columns()) {
                if (grid.column(index).type() != Column.Type.TEXT) {
                    continue;
                }
                int width = resolved[index];
                if (remainder >= width) {
                    remainder -= width;
                }
                else {
                    excess += width - remainder;
                    remainder = 0;
                }
            }

            List<Integer> spanned = overflow.columns();
            if (remainder > 0) {
                resolved[spanned.get(spanned.size() - 1)] += remainder;
            }
            else if (excess > 0) {
                overflowOverrides.put(spanned.get(0), overflow.width() + excess);
            }
        }
        return resolved;
    }

    public Grid grid() {
        return grid;
    }

    @Override
    public String toString() {
        if (rendered == null) {
            rendered = render();
        }
        return rendered;
    }

    private String render() {
        int textWidth = 0;
        int barColumns = 0;
        for (int j = 0; j < widths.length; j++) {
            if (grid.column(j).type() == Column.Type.TEXT) {
                textWidth += widths[j];
            }
            else {
                barColumns++;
            }
        }

        int viewWidth = Math.max(0, widthHint - textWidth);
        if (barColumns > 0) {
            viewWidth /= barColumns;
        }
        viewWidth = Math.max(viewWidth, MINIMUM_VIEW_WIDTH);

        double valueWidth = magnitude == 0.0 ? 1.0 : magnitude;

        Scale scale;
        int barWidth;
        if (viewWidth >= valueWidth) {
            scale = Scale.FULL;
            barWidth = (int) valueWidth;
        }
        else {
            scale = new Scale(viewWidth, valueWidth);
            barWidth = viewWidth;
        }

        Abbreviations abbreviations = breakdownAbbreviations(viewWidth);
        Layout layout = new Layout(Math.max(barWidth, abbreviations.width()), scale, abbreviations);

        LOG.log(System.Logger.Level.DEBUG, "Rendering {0} rows: view width {1}, bar width {2}, {3}",
                grid.rows().size(), viewWidth, layout.barWidth(), scale);

        StringBuilder out = new StringBuilder();
        List<List<Cell>> rows = grid.rows();
        for (int i = 0; i < rows.size(); i++) {
            writeRow(out, rows.get(i), layout);
            if (i + 1 < rows.size()) {
                out.append('\n');
            }
        }
        return out.toString();
    }

    private Abbreviations breakdownAbbreviations(int viewWidth) {
        int minimum = grid.minimumBreakdownWidth();
        int maximum = grid.maximumBreakdownWidth();
        if (!abbreviateBreakdown || grid.breakdownValues().isEmpty()) {
            return new Abbreviations(maximum, Map.of());
        }
        if (viewWidth > maximum) {
            return StringAbbreviator.find(minimum, maximum, grid.breakdownValues());
        }
        return StringAbbreviator.find(viewWidth, maximum, grid.breakdownValues());
    }

    private void writeRow(StringBuilder out, List<Cell> cells, Layout layout) {
        // Trailing blanks are not written.
        int last = cells.size() - 1;
        while (last >= 0 && (cells.get(last).kind() == Cell.Kind.EMPTY || cells.get(last).kind() == Cell.Kind.SKIP)) {
            last--;
        }

        for (int j = 0; j <= last; j++) {
            Cell cell = cells.get(j);
            if (cell.kind() == Cell.Kind.SKIP) {
                continue;
            }
            Column column = grid.column(j);
            String content = content(cell, column, layout);

            if (cell.kind() == Cell.Kind.PLAIN) {
                out.append(content);
                continue;
            }

            int width = column.type() == Column.Type.TEXT ? widths[j] : layout.barWidth();
            if (cell.kind() == Cell.Kind.OVERFLOW && overflowOverrides.containsKey(j)) {
                width = overflowOverrides.get(j);
            }

            if (j == last) {
                out.append(column.alignment().padLeading(content, width));
            }
            else {
                out.append(column.alignment().pad(content, width));
            }
        }
    }

    private static String content(Cell cell, Column column, Layout layout) {
        return switch (cell.kind()) {
            case EMPTY, SKIP -> "";
            case TEXT -> column.type() == Column.Type.BREAKDOWN ? layout.abbreviations().abbreviate(cell.text()) : cell.text();
            case PLAIN, OVERFLOW -> cell.text();
            case VALUE -> bar(cell.value(), layout.scale());
        };
    }

    static String bar(double value, Scale scale) {
        if (Double.isNaN(value)) {
            return "";
        }
        return String.valueOf(value < 0 ? NEGATIVE_GLYPH : POSITIVE_GLYPH).repeat(scale.length(value));
    }

    /**
     * The number of glyphs drawn for {@code units} units of value. At full scale a bar is rounded
     * to the nearest glyph; once bars are scaled down, a partially filled glyph is dropped.
     */
    record Scale(double glyphs, double units) {

        static final Scale FULL = new Scale(1, 1);

        int length(double value) {
            double magnitude = Math.abs(value);
            if (glyphs >= units) {
                return (int) Math.round(magnitude);
            }
            return (int) (magnitude * glyphs / units);
        }
    }

    private record Layout(int barWidth, Scale scale, Abbreviations abbreviations) {
    }
}
