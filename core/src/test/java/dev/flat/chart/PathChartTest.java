/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import org.junit.jupiter.api.Test;

import dev.flat.dataset.Dataset;
import dev.flat.dataset.Schema;
import dev.flat.dataset.View;
import dev.flat.render.RenderConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the indented path chart.
 */
public class PathChartTest {

    private static final RenderConfig DEFAULTS = RenderConfig.builder().widthHint(120).build();
    private static final RenderConfig SHOW_SUM = DEFAULTS.toBuilder().showAggregate(true).build();

    private static String render(View view, RenderConfig config) {
        return new PathChart(view).render(config).toString();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static Dataset abc(String... rows) {
        Dataset.Builder builder = Dataset.builder(Schema.of("A", "B", "C"));
        for (String row : rows) {
            builder.add((Object[]) row.split(","));
        }
        return builder.build();
    }

    // ==================== Single dimension ====================

    @Test
    void testEmpty() {
        Dataset dataset = Dataset.builder(Schema.of("abc")).build();

        assertThat(render(dataset.reflectiveView(), DEFAULTS)).isEqualTo("/abc  |Sum(abc)");
    }

    @Test
    void testZero() {
        Dataset dataset = Dataset.builder(Schema.of("abc")).add(0L).build();

        assertThat(render(dataset.reflectiveView(), DEFAULTS)).isEqualTo(lines(
                "/abc  |Sum(abc)",
                "/0    |"));
    }

    @Test
    void testNegativesAndPositives() {
        Dataset dataset = Dataset.builder(Schema.of("abc")).add(-1L).add(0L).add(1L).build();

        assertThat(render(dataset.reflectiveView(), DEFAULTS)).isEqualTo(lines(
                "/abc  |Sum(abc)",
                "/-1   |⊖",
                "/0    |",
                "/1    |*"));
    }

    @Test
    void testOneThousandFillsWidthHint() {
        Dataset.Builder builder = Dataset.builder(Schema.of("abc"));
        for (int i = 0; i < 1_000; i++) {
            builder.update(1L);
        }
        RenderConfig config = RenderConfig.builder().widthHint(160).build();

        assertThat(render(builder.build().reflectiveView(), config)).isEqualTo(lines(
                "/abc  |Sum(abc)",
                "/1    |" + "*".repeat(153)));
    }

    @Test
    void testNegativeOneThousandFillsWidthHint() {
        Dataset.Builder builder = Dataset.builder(Schema.of("abc"));
        for (int i = 0; i < 1_000; i++) {
            builder.update(-1L);
        }
        RenderConfig config = RenderConfig.builder().widthHint(160).build();

        assertThat(render(builder.build().reflectiveView(), config)).isEqualTo(lines(
                "/abc  |Sum(abc)",
                "/-1   |" + "⊖".repeat(153)));
    }

    // ==================== Nesting ====================

    @Test
    void testDescendantsIndentedUnderTopLevelBars() {
        Dataset dataset = Dataset.builder(Schema.of("Animal", "Size"))
                .add("whale", "large")
                .add("shark", "medium")
                .add("shark", "small")
                .add("tiger", "medium")
                .add("tiger", "medium")
                .add("tiger", "small")
                .build();

        assertThat(render(dataset.countingView(), DEFAULTS)).isEqualTo(lines(
                "/Animal /Size  |Sum(Count)",
                "/shark         |**",
                "  /medium",
                "  /small",
                "/tiger         |***",
                "  /medium",
                "  /small",
                "/whale         |*",
                "  /large"));
    }

    @Test
    void testSingleBranch() {
        assertThat(render(abc("a1,b1,c1").countingView(), SHOW_SUM)).isEqualTo(lines(
                "/A /B /C Sum  |Sum(Count)",
                "/a1      [1]  |*",
                "  /b1    [1]",
                "    /c1  [1]"));
    }

    @Test
    void testSiblingLeaves() {
        assertThat(render(abc("a1,b1,c1", "a1,b1,c2").countingView(), SHOW_SUM)).isEqualTo(lines(
                "/A /B /C Sum  |Sum(Count)",
                "/a1      [2]  |**",
                "  /b1    [2]",
                "    /c1  [1]",
                "    /c2  [1]"));
    }

    @Test
    void testRepeatedLeafUnderDifferentBranches() {
        assertThat(render(abc("a1,b1,c1", "a1,b1,c2", "a1,b2,c1").countingView(), SHOW_SUM)).isEqualTo(lines(
                "/A /B /C Sum  |Sum(Count)",
                "/a1      [3]  |***",
                "  /b1    [2]",
                "    /c1  [1]",
                "    /c2  [1]",
                "  /b2    [1]",
                "    /c1  [1]"));
    }

    @Test
    void testUnevenBranches() {
        assertThat(render(abc("a1,b1,c1", "a1,b1,c2", "a1,b1,c3", "a1,b2,c3").countingView(), SHOW_SUM))
                .isEqualTo(lines(
                        "/A /B /C Sum  |Sum(Count)",
                        "/a1      [4]  |****",
                        "  /b1    [3]",
                        "    /c1  [1]",
                        "    /c2  [1]",
                        "    /c3  [1]",
                        "  /b2    [1]",
                        "    /c3  [1]"));
    }

    @Test
    void testChildrenSortedRegardlessOfInsertionOrder() {
        String expected = lines(
                "/A /B /C Sum  |Sum(Count)",
                "/a1      [5]  |*****",
                "  /b1    [3]",
                "    /c1  [1]",
                "    /c2  [1]",
                "    /c3  [1]",
                "  /b2    [1]",
                "    /c1  [1]",
                "  /b3    [1]",
                "    /c1  [1]");

        assertThat(render(abc("a1,b1,c1", "a1,b1,c2", "a1,b1,c3", "a1,b2,c1", "a1,b3,c1").countingView(), SHOW_SUM))
                .isEqualTo(expected);
        assertThat(render(abc("a1,b3,c1", "a1,b1,c3", "a1,b2,c1", "a1,b1,c1", "a1,b1,c2").countingView(), SHOW_SUM))
                .isEqualTo(expected);
    }

    @Test
    void testSeveralTopLevelPaths() {
        assertThat(render(abc("a2,b1,c1", "a1,b1,c1", "a2,b1,c1").countingView(), DEFAULTS)).isEqualTo(lines(
                "/A /B /C  |Sum(Count)",
                "/a1       |*",
                "  /b1",
                "    /c1",
                "/a2       |**",
                "  /b1",
                "    /c1"));
    }

    // ==================== Measures and breakdowns ====================

    @Test
    void testFractionalMeasures() {
        Dataset dataset = Dataset.builder(Schema.of("abc", "def"))
                .add(1L, 0.1).add(2L, 0.4).add(3L, 0.5).add(4L, 0.9)
                .build();

        assertThat(render(dataset.measureView(1), DEFAULTS)).isEqualTo(lines(
                "/abc  |Sum(def)",
                "/1    |",
                "/2    |",
                "/3    |*",
                "/4    |*"));
        assertThat(render(dataset.countingView(), DEFAULTS)).isEqualTo(lines(
                "/abc /def  |Sum(Count)",
                "/1         |*",
                "  /0.1",
                "/2         |*",
                "  /0.4",
                "/3         |*",
                "  /0.5",
                "/4         |*",
                "  /0.9"));
    }

    @Test
    void testBreakdownMeasuredByItself() {
        Dataset dataset = Dataset.builder(Schema.of("abc", "something long"))
                .add(1, 2).add(2, 3).add(3, 4)
                .build();

        assertThat(render(dataset.breakdownView(1), DEFAULTS)).isEqualTo(lines(
                "       Sum(something long)",
                "/abc  | 2    3    4  |",
                "/1    | **           |",
                "/2    |     ***      |",
                "/3    |          ****|"));
    }

    @Test
    void testCountBreakdownWithAbbreviatedHeadings() {
        Dataset dataset = Dataset.builder(Schema.of("pterodactyl", "dinosaur"))
                .add("triceratops", "tyrannosaurs")
                .add("shark", "triceratops")
                .add("shark", "triceratops")
                .add("tiger", "pterodactyl")
                .add("tiger", "pterodactyl")
                .add("tiger", "pterodactyl")
                .build();
        RenderConfig config = RenderConfig.builder().widthHint(1).abbreviateBreakdown(true).build();

        assertThat(render(dataset.countBreakdownView(1), config)).isEqualTo(lines(
                "               dinosaur",
                "               Sum(Count)",
                "/pterodactyl  |pt.. tr.. ty..|",
                "/shark        |      *       |",
                "/tiger        | **           |",
                "/triceratops  |              |"));
    }

    @Test
    void testRejectsNullView() {
        assertThatThrownBy(() -> new PathChart(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("View cannot be null");
    }
}
