/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.render;

import java.util.OptionalInt;

/**
 * A typed cell of a {@link Row}.
 */
public final class Cell {

    /**
     * The kinds of cell.
     */
    public enum Kind {
        /** Blank placeholder, padded to its column. Trailing blanks are dropped. */
        EMPTY,
        /** Aligned text. */
        TEXT,
        /** Unaligned text, written verbatim; only used as the last cell of a row. */
        PLAIN,
        /** Text allowed to spread over the {@link #SKIP} cells that follow it. */
        OVERFLOW,
        /** A measurement, drawn as a bar of glyphs. */
        VALUE,
        /** A cell absorbed by a preceding {@link #OVERFLOW}. */
        SKIP
    }

    private static final Cell EMPTY = new Cell(Kind.EMPTY, "", 0.0);
    private static final Cell SKIP = new Cell(Kind.SKIP, "", 0.0);

    private final Kind kind;
    private final String text;
    private final double value;

    private Cell(Kind kind, String text, double value) {
        this.kind = kind;
        this.text = text;
        this.value = value;
    }

    public static Cell empty() {
        return EMPTY;
    }

    public static Cell skip() {
        return SKIP;
    }

    public static Cell text(String text) {
        return new Cell(Kind.TEXT, text, 0.0);
    }

    public static Cell plain(String text) {
        return new Cell(Kind.PLAIN, text, 0.0);
    }

    public static Cell overflow(String text) {
        return new Cell(Kind.OVERFLOW, text, 0.0);
    }

    public static Cell value(double value) {
        return new Cell(Kind.VALUE, "", value);
    }

    public Kind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    public double value() {
        return value;
    }

    /**
     * Returns the width this cell contributes to its column, if it contributes at all.
     */
    OptionalInt naturalWidth() {
        return switch (kind) {
            case EMPTY -> OptionalInt.of(0);
            case TEXT, OVERFLOW -> OptionalInt.of(text.codePointCount(0, text.length()));
            case PLAIN, VALUE, SKIP -> OptionalInt.empty();
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EMPTY, SKIP -> kind.name();
            case VALUE -> "VALUE(" + value + ")";
            default -> kind + "(" + text + ")";
        };
    }
}
