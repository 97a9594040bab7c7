/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.benchmarks;

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

import dev.framewood.frame.Series;
import dev.framewood.index.IndexLabel;
import dev.framewood.join.JoinOptions;
import dev.framewood.join.JoinType;
import dev.framewood.join.JoinedSeries;
import dev.framewood.join.Joins;
import dev.framewood.types.Scalar;

/**
 * Benchmark for label joins comparing arena and heap position buffers.
 *
 * <p>Run with:</p>
 * <pre>
 * java -jar benchmarks.jar JoinBenchmark
 * </pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class JoinBenchmark {

    @Param({"1024", "65536"})
    private int size;

    // Distinct labels per side; fewer labels means more duplicate matches
    @Param({"64", "4096"})
    private int cardinality;

    @Param({"arena", "heap"})
    private String strategy;

    @Param({"INNER", "OUTER"})
    private JoinType joinType;

    private Series left;
    private Series right;
    private JoinOptions options;

    @Setup
    public void setup() {
        Random random = new Random(42);
        left = randomSeries("left", random);
        right = randomSeries("right", random);
        options = JoinOptions.defaults().withArena("arena".equals(strategy));
    }

    @Benchmark
    public JoinedSeries joinSeries() {
        return Joins.joinSeries(left, right, joinType, options);
    }

    @Benchmark
    public long estimateOutputRows() {
        return Joins.estimateOutputRows(left.index(), right.index(), joinType);
    }

    private Series randomSeries(String name, Random random) {
        List<IndexLabel> labels = new ArrayList<>(size);
        List<Scalar> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            labels.add(IndexLabel.of(random.nextInt(cardinality)));
            values.add(Scalar.of(random.nextDouble()));
        }
        return Series.fromValues(name, labels, values);
    }
}
