/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.render;

/**
 * A column of a {@link Grid}.
 *
 * <p>Text columns grow to their widest cell. Count and breakdown columns hold the bars; their
 * width is decided when the grid is rendered, from the width left over by the text columns.</p>
 */
public final class Column {

    /**
     * The kinds of column.
     */
    public enum Type {
        TEXT,
        COUNT,
        BREAKDOWN
    }

    private final Type type;
    private final Alignment alignment;
    private int width;

    private Column(Type type, Alignment alignment) {
        this.type = type;
        this.alignment = alignment;
    }

    public static Column text(Alignment alignment) {
        return new Column(Type.TEXT, alignment);
    }

    public static Column count(Alignment alignment) {
        return new Column(Type.COUNT, alignment);
    }

    public static Column breakdown(Alignment alignment) {
        return new Column(Type.BREAKDOWN, alignment);
    }

    public Type type() {
        return type;
    }

    public Alignment alignment() {
        return alignment;
    }

    /**
     * Returns the width of a text column; 0 for bar columns.
     */
    public int width() {
        return width;
    }

    void widen(int candidate) {
        if (candidate > width) {
            width = candidate;
        }
    }

    @Override
    public String toString() {
        return "Column[" + type + ", " + alignment + (type == Type.TEXT ? ", width=" + width : "") + "]";
    }
}
