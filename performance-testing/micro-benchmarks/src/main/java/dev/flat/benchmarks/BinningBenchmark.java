/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.benchmarks;

import java.util.ArrayList;
import java.util.List;
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
import org.openjdk.jmh.infra.Blackhole;

import dev.flat.histogram.BinDomain;
import dev.flat.histogram.Binner;
import dev.flat.histogram.Bounds;

/**
 * Benchmark for computing bin bounds and assigning keys to them.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class BinningBenchmark {

    @Param({"1024", "65536"})
    private int size;

    @Param({"10", "100"})
    private int bins;

    private List<Double> doubles;
    private List<Long> longs;
    private Binner<Double> doubleBinner;
    private Binner<Long> longBinner;

    @Setup
    public void setup() {
        Random random = new Random(42);
        doubles = new ArrayList<>(size);
        longs = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            doubles.add(random.nextGaussian() * 100);
            longs.add((long) random.nextInt(1_000_000));
        }
        doubleBinner = new Binner<>(BinDomain.doubles(), bins);
        longBinner = new Binner<>(BinDomain.longs(), bins);
    }

    @Benchmark
    public void countDoubles(Blackhole bh) {
        bh.consume(doubleBinner.count(doubles));
    }

    @Benchmark
    public void countLongs(Blackhole bh) {
        bh.consume(longBinner.count(longs));
    }

    @Benchmark
    public void partitionDoubles(Blackhole bh) {
        List<Bounds<Double>> bounds = doubleBinner.bounds(doubles);
        bh.consume(doubleBinner.partition(bounds, doubles, key -> key));
    }
}
