/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import dev.flat.dataset.View;
import dev.flat.render.Flat;
import dev.flat.render.RenderConfig;

/**
 * Renders every display dimension of a view as a tree collapsed towards the primary dimension.
 *
 * <pre>{@code
 * Flat flat = new DagChart(dataset.countingView()).render(RenderConfig.defaults());
 * System.out.println(flat);
 * }</pre>
 */
public final class DagChart {

    private final View view;

    public DagChart(View view) {
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        this.view = view;
    }

    public Flat render(RenderConfig config) {
        PathCollapser.Layout layout = new PathCollapser(view, config).collapse();
        return new Flat(layout.grid(), layout.range(), config);
    }
}
