/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import org.junit.jupiter.api.Test;

import dev.flat.aggregate.Aggregate;
import dev.flat.dataset.Dataset;
import dev.flat.dataset.Schema;
import dev.flat.dataset.View;
import dev.flat.render.RenderConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BarChartTest {

    private static final RenderConfig DEFAULTS = RenderConfig.builder().widthHint(120).build();

    private static String render(View view, RenderConfig config) {
        return new BarChart(view).render(config).toString();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static Dataset animals() {
        return Dataset.builder(Schema.of("animal", "length", "stable"))
                .add("whale", 4, true)
                .add("shark", 4, false)
                .add("shark", 1, true)
                .add("shark", 1, true)
                .add("shark", 1, true)
                .add("tiger", 4, false)
                .add("tiger", 5, true)
                .add("tiger", 5, true)
                .add("tiger", 5, true)
                .add("tiger", 1, false)
                .add("tiger", 1, false)
                .add("tiger", 1, false)
                .build();
    }

    @Test
    void testOneBarPerPrimaryValue() {
        assertThat(render(animals().countingView(), DEFAULTS)).isEqualTo(lines(
                "animal  |Sum(Count)",
                "shark   |****",
                "tiger   |*******",
                "whale   |*"));
    }

    @Test
    void testMeasuredBars() {
        assertThat(render(animals().measureView(1), DEFAULTS)).isEqualTo(lines(
                "animal  |Sum(length)",
                "shark   |*******",
                "tiger   |**********************",
                "whale   |****"));
    }

    @Test
    void testShowAverage() {
        RenderConfig config = DEFAULTS.toBuilder().aggregate(Aggregate.AVERAGE).showAggregate(true).build();

        assertThat(render(animals().measureView(1), config)).isEqualTo(lines(
                "animal Average  |Average(length)",
                "shark  [1.8]    |**",
                "tiger  [3.1]    |***",
                "whale  [  4]    |****"));
    }

    @Test
    void testIntermediateAggregatesHaveNothingToAnnotate() {
        RenderConfig config = DEFAULTS.toBuilder().showAggregate(true).showIntermediateAggregates(true).build();

        assertThat(render(animals().countingView(), config)).isEqualTo(lines(
                "animal Sum  |Sum(Count)",
                "shark  [4]  |****",
                "tiger  [7]  |*******",
                "whale  [1]  |*"));
    }

    @Test
    void testCountBreakdown() {
        assertThat(render(animals().countBreakdownView(1), DEFAULTS)).isEqualTo(lines(
                "         length",
                "         Sum(Count)",
                "animal  | 1   4   5 |",
                "shark   |***  *     |",
                "tiger   |***  *  ***|",
                "whale   |     *     |"));
    }

    @Test
    void testRejectsNullView() {
        assertThatThrownBy(() -> new BarChart(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("View cannot be null");
    }
}
