/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A {@link View} whose dimensions are picked from the dimension vector by a {@link RoleMap}.
 */
final class RoleView implements View {

    private final Dataset dataset;
    private final RoleMap roles;
    private final Measure measure;
    private final List<String> displayHeaders;
    private final String valueHeader;

    RoleView(Dataset dataset, RoleMap roles, Measure measure) {
        Schema schema = dataset.schema();
        for (int column : roles.display()) {
            schema.checkColumn(column);
        }
        if (roles.hasBreakdown()) {
            schema.checkColumn(roles.breakdown());
        }
        if (!measure.isCount()) {
            schema.checkColumn(measure.column());
            if (!dataset.isEmpty() && !(dataset.rows().get(0).get(measure.column()) instanceof Number)) {
                throw new IllegalArgumentException("Column '" + schema.header(measure.column()) + "' is not numeric");
            }
        }

        List<String> headers = new ArrayList<>(roles.display().size());
        for (int column : roles.display()) {
            headers.add(schema.header(column));
        }

        this.dataset = dataset;
        this.roles = roles;
        this.measure = measure;
        this.displayHeaders = Collections.unmodifiableList(headers);
        this.valueHeader = measure.header(schema);
    }

    @Override
    public List<Dimensions> data() {
        return dataset.rows();
    }

    @Override
    public double value(Dimensions dims) {
        return measure.measure(dims);
    }

    @Override
    public String valueHeader() {
        return valueHeader;
    }

    @Override
    public Object primaryDim(Dimensions dims) {
        return dims.get(roles.primary());
    }

    @Override
    public Object breakdownDim(Dimensions dims) {
        return roles.hasBreakdown() ? dims.get(roles.breakdown()) : null;
    }

    @Override
    public Optional<String> breakdownHeader() {
        return roles.hasBreakdown() ? Optional.of(dataset.schema().header(roles.breakdown())) : Optional.empty();
    }

    @Override
    public List<Object> displayDims(Dimensions dims) {
        List<Object> display = new ArrayList<>(roles.display().size());
        for (int column : roles.display()) {
            display.add(dims.get(column));
        }
        return display;
    }

    @Override
    public List<String> displayHeaders() {
        return displayHeaders;
    }

    @Override
    public String toString() {
        return "RoleView[roles=" + roles + ", measure=" + measure + "]";
    }
}
