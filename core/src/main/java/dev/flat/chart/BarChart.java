/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import java.util.List;
import java.util.Optional;

import dev.flat.dataset.Dimensions;
import dev.flat.dataset.View;
import dev.flat.render.Flat;
import dev.flat.render.RenderConfig;

/**
 * Renders one bar per distinct primary value, ignoring any other display dimension.
 *
 * <pre>
 * animal  |Sum(Count)
 * shark   |**
 * tiger   |***
 * </pre>
 */
public final class BarChart {

    private final View view;

    public BarChart(View view) {
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        this.view = view;
    }

    public Flat render(RenderConfig config) {
        PathCollapser.Layout layout = new PathCollapser(new PrimaryView(view), config).collapse();
        return new Flat(layout.grid(), layout.range(), config);
    }

    /**
     * Narrows the displayed dimensions of a view to its primary.
     */
    private static final class PrimaryView implements View {

        private final View delegate;
        private final List<String> headers;

        PrimaryView(View delegate) {
            List<String> displayHeaders = delegate.displayHeaders();
            if (displayHeaders.isEmpty()) {
                throw new IllegalArgumentException("View has no display dimensions");
            }
            this.delegate = delegate;
            this.headers = List.of(displayHeaders.get(0));
        }

        @Override
        public List<Dimensions> data() {
            return delegate.data();
        }

        @Override
        public double value(Dimensions dims) {
            return delegate.value(dims);
        }

        @Override
        public String valueHeader() {
            return delegate.valueHeader();
        }

        @Override
        public Object primaryDim(Dimensions dims) {
            return delegate.primaryDim(dims);
        }

        @Override
        public Object breakdownDim(Dimensions dims) {
            return delegate.breakdownDim(dims);
        }

        @Override
        public Optional<String> breakdownHeader() {
            return delegate.breakdownHeader();
        }

        @Override
        public List<Object> displayDims(Dimensions dims) {
            return List.of(delegate.primaryDim(dims));
        }

        @Override
        public List<String> displayHeaders() {
            return headers;
        }
    }
}
