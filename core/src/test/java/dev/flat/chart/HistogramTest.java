/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.chart;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.flat.aggregate.Aggregate;
import dev.flat.dataset.Dataset;
import dev.flat.dataset.Schema;
import dev.flat.dataset.View;
import dev.flat.histogram.BinDomain;
import dev.flat.render.RenderConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for histograms over the built-in bin domains.
 */
public class HistogramTest {

    private static final RenderConfig DEFAULTS = RenderConfig.builder().widthHint(120).build();

    private static String render(View view, int bins, RenderConfig config) {
        return Histogram.of(view, bins).render(config).toString();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static Dataset longs(long... values) {
        Dataset.Builder builder = Dataset.builder(Schema.of("abc"));
        for (long value : values) {
            builder.update(value);
        }
        return builder.build();
    }

    private static Dataset lengths() {
        Dataset.Builder builder = Dataset.builder(Schema.of("length"));
        for (int i = 0; i < 10; i++) {
            builder.update((double) i);
        }
        return builder.build();
    }

    // ==================== Bins ====================

    @Test
    void testEmpty() {
        assertThat(render(longs().reflectiveView(), 0, DEFAULTS)).isEqualTo("abc  |Sum(abc)");
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1 })
    void testSingleBinCoversEverything(int bins) {
        assertThat(render(longs(1, 2, 3).reflectiveView(), bins, DEFAULTS)).isEqualTo(lines(
                "abc     |Sum(abc)",
                "[1, 3]  |******"));
    }

    @Test
    void testSingleValueNeedsOneBin() {
        assertThat(render(longs(1).reflectiveView(), 2, DEFAULTS)).isEqualTo(lines(
                "abc     |Sum(abc)",
                "[1, 1]  |*"));
    }

    @Test
    void testZero() {
        assertThat(render(longs(0).reflectiveView(), 1, DEFAULTS)).isEqualTo(lines(
                "abc     |Sum(abc)",
                "[0, 0]  |"));
    }

    @Test
    void testNegativesAndPositives() {
        assertThat(render(longs(-1, 0, 1).reflectiveView(), 3, DEFAULTS)).isEqualTo(lines(
                "abc      |Sum(abc)",
                "[-1, 0)  |⊖",
                "[0, 1)   |",
                "[1, 2]   |*"));
    }

    @Test
    void testOneThousandFillsWidthHint() {
        long[] ones = new long[1_000];
        Arrays.fill(ones, 1L);
        RenderConfig config = RenderConfig.builder().widthHint(160).build();

        assertThat(render(longs(ones).reflectiveView(), 1, config)).isEqualTo(lines(
                "abc     |Sum(abc)",
                "[1, 1]  |" + "*".repeat(151)));
    }

    @Test
    void testNegativeOneThousandFillsWidthHint() {
        long[] ones = new long[1_000];
        Arrays.fill(ones, -1L);
        RenderConfig config = RenderConfig.builder().widthHint(160).build();

        assertThat(render(longs(ones).reflectiveView(), 1, config)).isEqualTo(lines(
                "abc       |Sum(abc)",
                "[-1, -1]  |" + "⊖".repeat(149)));
    }

    @Test
    void testCountingDoubles() {
        Dataset.Builder builder = Dataset.builder(Schema.of("abc"));
        for (int i = 0; i < 10; i++) {
            builder.update((double) i);
        }

        assertThat(render(builder.build().countingView(), 5, DEFAULTS)).isEqualTo(lines(
                "abc         |Sum(Count)",
                "[0, 1.8)    |**",
                "[1.8, 3.6)  |**",
                "[3.6, 5.4)  |**",
                "[5.4, 7.2)  |**",
                "[7.2, 9]    |**"));
    }

    @Test
    void testIntegralBinsRoundUp() {
        Dataset.Builder builder = Dataset.builder(Schema.of("length"));
        for (int i = 0; i < 10; i++) {
            builder.update(i);
        }

        assertThat(render(builder.build().reflectiveView(), 5, DEFAULTS)).isEqualTo(lines(
                "length   |Sum(length)",
                "[0, 2)   |*",
                "[2, 4)   |*****",
                "[4, 6)   |*********",
                "[6, 8)   |*************",
                "[8, 10]  |*****************"));
    }

    // ==================== Annotations ====================

    @Test
    void testShowSum() {
        RenderConfig config = DEFAULTS.toBuilder().showAggregate(true).build();

        assertThat(render(lengths().reflectiveView(), 5, config)).isEqualTo(lines(
                "length     Sum   |Sum(length)",
                "[0, 1.8)   [ 1]  |*",
                "[1.8, 3.6) [ 5]  |*****",
                "[3.6, 5.4) [ 9]  |*********",
                "[5.4, 7.2) [13]  |*************",
                "[7.2, 9]   [17]  |*****************"));
    }

    @Test
    void testShowAverage() {
        RenderConfig config = DEFAULTS.toBuilder().aggregate(Aggregate.AVERAGE).showAggregate(true).build();

        assertThat(render(lengths().reflectiveView(), 5, config)).isEqualTo(lines(
                "length     Average  |Average(length)",
                "[0, 1.8)   [0.5]    |*",
                "[1.8, 3.6) [2.5]    |***",
                "[3.6, 5.4) [4.5]    |*****",
                "[5.4, 7.2) [6.5]    |*******",
                "[7.2, 9]   [8.5]    |*********"));
    }

    @ParameterizedTest
    @ValueSource(ints = { 17, 18, 19, 20 })
    void testShowSumSquished(int widthHint) {
        Dataset.Builder builder = Dataset.builder(Schema.of("length", "weight"));
        for (int i = 0; i < 10; i++) {
            builder.update((double) (i % 8), (long) i);
        }
        builder.update(9.0, 0L);
        RenderConfig config = RenderConfig.builder().widthHint(widthHint).showAggregate(true).build();

        assertThat(render(builder.build().measureView(1), 5, config)).isEqualTo(lines(
                "length     Sum   |Sum(weight)",
                "[0, 1.8)   [18]  |**",
                "[1.8, 3.6) [ 5]  |",
                "[3.6, 5.4) [ 9]  |*",
                "[5.4, 7.2) [13]  |*",
                "[7.2, 9]   [ 0]  |"));
    }

    // ==================== Breakdowns ====================

    @Test
    void testCountBreakdown() {
        Dataset dataset = Dataset.builder(Schema.of("length", "pet"))
                .add(0.0, "kipp")
                .add(1.0, "ralf")
                .add(2.0, "kipp")
                .build();

        assertThat(render(dataset.countBreakdownView(1), 2, DEFAULTS)).isEqualTo(lines(
                "         pet",
                "         Sum(Count)",
                "length  |kipp ralf|",
                "[0, 1)  | *       |",
                "[1, 2]  | *    *  |"));
    }

    @Test
    void testBreakdownMeasuredByItself() {
        Dataset dataset = Dataset.builder(Schema.of("abc", "something long"))
                .add(1, 2).add(2, 3).add(3, 4)
                .build();

        assertThat(render(dataset.breakdownView(1), 3, DEFAULTS)).isEqualTo(lines(
                "         Sum(something long)",
                "abc     | 2    3    4  |",
                "[1, 2)  | **           |",
                "[2, 3)  |     ***      |",
                "[3, 4]  |          ****|"));
    }

    @Test
    void testFractionalMeasures() {
        Dataset dataset = Dataset.builder(Schema.of("abc", "def"))
                .add(1L, 0.1).add(2L, 0.2).add(3L, 0.3)
                .build();

        assertThat(render(dataset.measureView(1), 1, DEFAULTS)).isEqualTo(lines(
                "abc     |Sum(def)",
                "[1, 3]  |*"));
        assertThat(render(dataset.countingView(), 1, DEFAULTS)).isEqualTo(lines(
                "abc     |Sum(Count)",
                "[1, 3]  |***"));
        assertThat(render(dataset.countBreakdownView(1), 1, DEFAULTS)).isEqualTo(lines(
                "         def",
                "         Sum(Count)",
                "abc     |0.1 0.2 0.3|",
                "[1, 3]  | *   *   * |"));
    }

    // ==================== Domains ====================

    @Test
    void testExplicitDomain() {
        Histogram<Long> histogram = Histogram.of(longs(1, 2, 3).reflectiveView(), 1, BinDomain.longs());

        assertThat(histogram.render(DEFAULTS).toString()).isEqualTo(lines(
                "abc     |Sum(abc)",
                "[1, 3]  |******"));
    }

    @Test
    void testShortKeysSpanningMostOfTheirRange() {
        Dataset dataset = Dataset.builder(Schema.of("abc"))
                .add((short) -20_000).add((short) 0).add((short) 20_000)
                .build();

        assertThat(render(dataset.countingView(), 2, DEFAULTS)).isEqualTo(lines(
                "abc          |Sum(Count)",
                "[-20000, 0)  |*",
                "[0, 20000]   |**"));
    }

    @Test
    void testFullByteRange() {
        Dataset.Builder builder = Dataset.builder(Schema.of("abc"));
        for (int i = Byte.MIN_VALUE; i <= Byte.MAX_VALUE; i++) {
            builder.update((byte) i);
        }

        String[] rendered = render(builder.build().countingView(), 2, DEFAULTS).split("\n");

        assertThat(rendered).hasSize(3);
        assertThat(rendered[1]).startsWith("[-128, 0)  |");
        assertThat(rendered[2]).startsWith("[0, 127]   |");
        assertThat(rendered[1].length()).isEqualTo(rendered[2].length());
    }

    @Test
    void testUnsupportedPrimaryType() {
        Dataset dataset = Dataset.builder(Schema.of("animal")).add("whale").build();

        assertThatThrownBy(() -> Histogram.of(dataset.countingView(), 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No bin domain")
                .hasMessageContaining("java.lang.String");
    }

    @Test
    void testRejectsNullView() {
        assertThatThrownBy(() -> Histogram.of(null, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("View cannot be null");
    }
}
