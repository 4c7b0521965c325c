/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.render;

import dev.flat.aggregate.Aggregate;

/**
 * Per-render configuration shared by all charts.
 *
 * <p>Usage examples:</p>
 * <pre>{@code
 * // Sum, 120 characters wide, no annotations
 * RenderConfig.defaults()
 *
 * // Averages with their value printed next to each bar
 * RenderConfig.builder()
 *         .aggregate(Aggregate.AVERAGE)
 *         .showAggregate(true)
 *         .widthHint(80)
 *         .build()
 * }</pre>
 *
 * <p>The default width hint may be overridden with the system property
 * {@value #WIDTH_HINT_PROPERTY}.</p>
 */
public final class RenderConfig {

    private static final System.Logger LOG = System.getLogger(RenderConfig.class.getName());

    /**
     * System property overriding {@link #DEFAULT_WIDTH_HINT}.
     */
    public static final String WIDTH_HINT_PROPERTY = "flat.width.hint";

    public static final int DEFAULT_WIDTH_HINT = 120;

    private final Aggregate aggregate;
    private final int widthHint;
    private final boolean showAggregate;
    private final boolean showIntermediateAggregates;
    private final boolean abbreviateValues;
    private final boolean abbreviateBreakdown;

    private RenderConfig(Builder builder) {
        this.aggregate = builder.aggregate;
        this.widthHint = builder.widthHint;
        this.showAggregate = builder.showAggregate;
        this.showIntermediateAggregates = builder.showIntermediateAggregates;
        this.abbreviateValues = builder.abbreviateValues;
        this.abbreviateBreakdown = builder.abbreviateBreakdown;
    }

    /**
     * Returns the default configuration.
     */
    public static RenderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .aggregate(aggregate)
                .widthHint(widthHint)
                .showAggregate(showAggregate)
                .showIntermediateAggregates(showIntermediateAggregates)
                .abbreviateValues(abbreviateValues)
                .abbreviateBreakdown(abbreviateBreakdown);
    }

    /**
     * The function applied to the measurements of each group.
     */
    public Aggregate aggregate() {
        return aggregate;
    }

    /**
     * The width the rendering tries to stay within. It is ignored when the rendering fits in less, and
     * minimally exceeded when the text columns alone are wider.
     */
    public int widthHint() {
        return widthHint;
    }

    /**
     * Whether the aggregate of the primary dimension is printed next to its bar.
     */
    public boolean showAggregate() {
        return showAggregate;
    }

    /**
     * Whether the aggregate of every collapsed ancestor is printed next to it. The aggregates cascade:
     * each level shows the aggregate over everything beneath it.
     */
    public boolean showIntermediateAggregates() {
        return showIntermediateAggregates;
    }

    /**
     * Whether dimension values are abbreviated down to their column header width.
     */
    public boolean abbreviateValues() {
        return abbreviateValues;
    }

    /**
     * Whether breakdown column headings are abbreviated to fit the bar width.
     */
    public boolean abbreviateBreakdown() {
        return abbreviateBreakdown;
    }

    static int defaultWidthHint() {
        String property = System.getProperty(WIDTH_HINT_PROPERTY);
        if (property == null || property.isBlank()) {
            return DEFAULT_WIDTH_HINT;
        }
        try {
            int widthHint = Integer.parseInt(property.trim());
            if (widthHint < 0) {
                LOG.log(System.Logger.Level.WARNING, "Ignoring negative {0}={1}", WIDTH_HINT_PROPERTY, property);
                return DEFAULT_WIDTH_HINT;
            }
            LOG.log(System.Logger.Level.DEBUG, "Width hint {0} set via system property", widthHint);
            return widthHint;
        }
        catch (NumberFormatException e) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring non-numeric {0}={1}", WIDTH_HINT_PROPERTY, property);
            return DEFAULT_WIDTH_HINT;
        }
    }

    @Override
    public String toString() {
        return "RenderConfig[aggregate=" + aggregate + ", widthHint=" + widthHint + ", showAggregate=" + showAggregate
                + ", showIntermediateAggregates=" + showIntermediateAggregates + ", abbreviateValues=" + abbreviateValues
                + ", abbreviateBreakdown=" + abbreviateBreakdown + "]";
    }

    /**
     * Builder for {@link RenderConfig}.
     */
    public static final class Builder {

        private Aggregate aggregate = Aggregate.SUM;
        private int widthHint = defaultWidthHint();
        private boolean showAggregate;
        private boolean showIntermediateAggregates;
        private boolean abbreviateValues;
        private boolean abbreviateBreakdown;

        private Builder() {
        }

        public Builder aggregate(Aggregate aggregate) {
            if (aggregate == null) {
                throw new IllegalArgumentException("Aggregate cannot be null");
            }
            this.aggregate = aggregate;
            return this;
        }

        public Builder widthHint(int widthHint) {
            if (widthHint < 0) {
                throw new IllegalArgumentException("Width hint cannot be negative: " + widthHint);
            }
            this.widthHint = widthHint;
            return this;
        }

        public Builder showAggregate(boolean showAggregate) {
            this.showAggregate = showAggregate;
            return this;
        }

        public Builder showIntermediateAggregates(boolean showIntermediateAggregates) {
            this.showIntermediateAggregates = showIntermediateAggregates;
            return this;
        }

        public Builder abbreviateValues(boolean abbreviateValues) {
            this.abbreviateValues = abbreviateValues;
            return this;
        }

        public Builder abbreviateBreakdown(boolean abbreviateBreakdown) {
            this.abbreviateBreakdown = abbreviateBreakdown;
            return this;
        }

        public RenderConfig build() {
            return new RenderConfig(this);
        }
    }
}
