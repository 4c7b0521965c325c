/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.render;

/**
 * Horizontal placement of a cell within its column.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT;

    /**
     * Pads {@code text} to {@code width} code points. Centering puts the odd space on the right.
     */
    String pad(String text, int width) {
        int padding = width - text.codePointCount(0, text.length());
        if (padding <= 0) {
            return text;
        }
        return switch (this) {
            case LEFT -> text + " ".repeat(padding);
            case RIGHT -> " ".repeat(padding) + text;
            case CENTER -> " ".repeat(padding / 2) + text + " ".repeat(padding - padding / 2);
        };
    }

    /**
     * Pads {@code text} like {@link #pad(String, int)}, but without trailing spaces. Used for the
     * last cell of a line.
     */
    String padLeading(String text, int width) {
        int padding = width - text.codePointCount(0, text.length());
        if (padding <= 0) {
            return text;
        }
        return switch (this) {
            case LEFT -> text;
            case RIGHT -> " ".repeat(padding) + text;
            case CENTER -> " ".repeat(padding / 2) + text;
        };
    }
}
