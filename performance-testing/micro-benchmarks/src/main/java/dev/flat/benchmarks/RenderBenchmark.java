/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.benchmarks;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import dev.flat.chart.BarChart;
import dev.flat.chart.DagChart;
import dev.flat.chart.Histogram;
import dev.flat.chart.PathChart;
import dev.flat.dataset.Dataset;
import dev.flat.dataset.Schema;
import dev.flat.dataset.View;
import dev.flat.render.RenderConfig;

/**
 * Benchmark for rendering the charts over a synthetic three level hierarchy of sales.
 *
 * <p>Run with:</p>
 * <pre>
 * java -jar benchmarks.jar RenderBenchmark
 * </pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class RenderBenchmark {

    @Param({"1000", "100000"})
    private int rows;

    @Param({"count", "breakdown"})
    private String shape;

    private View view;
    private View histogramView;
    private RenderConfig config;

    @Setup
    public void setup() {
        Random random = new Random(42);
        Dataset.Builder builder = Dataset.builder(Schema.of("region", "store", "product", "units"));
        Dataset.Builder unitsBuilder = Dataset.builder(Schema.of("units", "region"));
        for (int i = 0; i < rows; i++) {
            String region = "region-" + random.nextInt(4);
            long units = random.nextInt(50);
            builder.update(region, "store-" + random.nextInt(12), "product-" + random.nextInt(8), units);
            unitsBuilder.update(units, region);
        }
        Dataset dataset = builder.build();
        Dataset unitsDataset = unitsBuilder.build();

        boolean breakdown = "breakdown".equals(shape);
        view = breakdown ? dataset.countBreakdownView(2) : dataset.measureView(3);
        histogramView = breakdown ? unitsDataset.countBreakdownView(1) : unitsDataset.countingView();
        config = RenderConfig.builder()
                .showAggregate(true)
                .showIntermediateAggregates(true)
                .build();
    }

    @Benchmark
    public String dagChart() {
        return new DagChart(view).render(config).toString();
    }

    @Benchmark
    public String pathChart() {
        return new PathChart(view).render(config).toString();
    }

    @Benchmark
    public String barChart() {
        return new BarChart(view).render(config).toString();
    }

    @Benchmark
    public String histogram() {
        return Histogram.of(histogramView, 10).render(config).toString();
    }
}
