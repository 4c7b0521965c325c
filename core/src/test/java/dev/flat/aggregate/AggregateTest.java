/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.aggregate;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AggregateTest {

    private static final List<Double> VALUES = List.of(1.0, 2.0, 3.0);

    // ==================== apply ====================

    @ParameterizedTest
    @CsvSource({
            "AVERAGE, 2.0",
            "MAX, 3.0",
            "MIN, 1.0",
            "SUM, 6.0"
    })
    void testApply(Aggregate aggregate, double expected) {
        assertThat(aggregate.apply(VALUES)).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(Aggregate.class)
    void testEmptyGroupIsZero(Aggregate aggregate) {
        assertThat(aggregate.apply(List.of())).isZero();
    }

    @Test
    void testNegativeValues() {
        List<Double> values = List.of(-4.0, -1.0);

        assertThat(Aggregate.MAX.apply(values)).isEqualTo(-1.0);
        assertThat(Aggregate.MIN.apply(values)).isEqualTo(-4.0);
        assertThat(Aggregate.AVERAGE.apply(values)).isEqualTo(-2.5);
    }

    @Test
    void testApplyToWidensRange() {
        Map<String, List<Double>> buckets = Map.of("a", List.of(1.0, 2.0), "b", List.of(-3.0));
        ValueRange range = new ValueRange();

        assertThat(Aggregate.SUM.applyTo(buckets, "a", range)).isEqualTo(3.0);
        assertThat(Aggregate.SUM.applyTo(buckets, "b", range)).isEqualTo(-3.0);

        assertThat(range.minimum()).isEqualTo(-3.0);
        assertThat(range.maximum()).isEqualTo(3.0);
    }

    @Test
    void testApplyToMissingKeyAggregatesNothing() {
        ValueRange range = new ValueRange();

        assertThat(Aggregate.MAX.applyTo(Map.of(), "missing", range)).isZero();
        assertThat(range.isEmpty()).isFalse();
        assertThat(range.maximum()).isZero();
    }

    // ==================== names ====================

    @Test
    void testDisplayNames() {
        assertThat(Aggregate.AVERAGE).hasToString("Average");
        assertThat(Aggregate.SUM).hasToString("Sum");
    }

    @Test
    void testFromName() {
        assertThat(Aggregate.fromName("Max")).isEqualTo(Aggregate.MAX);
        assertThat(Aggregate.fromName("average")).isEqualTo(Aggregate.AVERAGE);
    }

    @Test
    void testFromNameRejectsUnknown() {
        assertThatThrownBy(() -> Aggregate.fromName("Median"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Median");
    }

    // ==================== ValueRange ====================

    @Test
    void testEmptyRange() {
        ValueRange range = new ValueRange();

        assertThat(range.isEmpty()).isTrue();
        assertThat(range.minimum()).isZero();
        assertThat(range.maximum()).isZero();
        assertThat(range.magnitude()).isZero();
    }

    @Test
    void testMagnitudeUsesLargestAbsoluteValue() {
        ValueRange range = new ValueRange();
        range.include(-7.0);
        range.include(5.0);

        assertThat(range.magnitude()).isEqualTo(7.0);
    }
}
