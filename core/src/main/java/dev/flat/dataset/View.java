/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

import java.util.List;
import java.util.Optional;

/**
 * What a chart looks at in a dataset: which dimensions frame the chart, which one is broken
 * down into parallel bar columns, and what each observation measures.
 *
 * <p>A view does not own the observations it exposes; it must not outlive its dataset.</p>
 */
public interface View {

    /**
     * Returns the observations of the underlying dataset.
     */
    List<Dimensions> data();

    /**
     * Returns the measurement of the observation.
     */
    double value(Dimensions dims);

    /**
     * Returns the name of the measurement, such as {@code Count} or a column header.
     */
    String valueHeader();

    /**
     * Returns the primary dimension of the observation: the innermost grouping key, which is
     * always displayed first.
     */
    Object primaryDim(Dimensions dims);

    /**
     * Returns the breakdown dimension of the observation, or null for views without a breakdown.
     */
    Object breakdownDim(Dimensions dims);

    /**
     * Returns the header of the breakdown dimension, if this view has one.
     */
    Optional<String> breakdownHeader();

    default boolean isBreakdown() {
        return breakdownHeader().isPresent();
    }

    /**
     * Returns the displayed dimensions of the observation, primary first. The length always matches
     * {@link #displayHeaders()}.
     */
    List<Object> displayDims(Dimensions dims);

    List<String> displayHeaders();
}
