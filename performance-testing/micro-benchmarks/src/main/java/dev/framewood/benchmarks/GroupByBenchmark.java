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
import dev.framewood.groupby.Aggregation;
import dev.framewood.groupby.GroupBy;
import dev.framewood.groupby.GroupByOptions;
import dev.framewood.index.Index;
import dev.framewood.types.Scalar;

/**
 * Benchmark for group-by sums comparing the dense array path against hashing.
 *
 * <p>Run with:</p>
 * <pre>
 * java -jar benchmarks.jar GroupByBenchmark
 * </pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class GroupByBenchmark {

    @Param({"8192", "262144"})
    private int size;

    @Param({"16", "1024", "65536"})
    private int keySpan;

    @Param({"dense", "hash"})
    private String path;

    private Series keys;
    private Series values;
    private GroupByOptions options;

    @Setup
    public void setup() {
        Random random = new Random(42);
        List<Scalar> keyValues = new ArrayList<>(size);
        List<Scalar> valueValues = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            keyValues.add(Scalar.of((long) random.nextInt(keySpan)));
            // ~5% missing values
            valueValues.add(random.nextInt(20) == 0 ? Scalar.nan() : Scalar.of(random.nextDouble()));
        }

        Index index = Index.range(size);
        keys = Series.fromValues("key", index.labels(), keyValues);
        values = Series.fromValues("value", index.labels(), valueValues);
        options = GroupByOptions.defaults().withDense("dense".equals(path));
    }

    @Benchmark
    public Series sum() {
        return GroupBy.sum(keys, values, options);
    }

    @Benchmark
    public Series mean() {
        return GroupBy.aggregate(keys, values, Aggregation.MEAN, options);
    }
}
