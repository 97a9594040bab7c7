/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.join;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import dev.framewood.frame.Series;
import dev.framewood.index.Index;
import dev.framewood.index.IndexLabel;
import dev.framewood.types.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for label joins of series, covering every join type and both buffer strategies.
 */
class JoinsTest {

    private static final Random RANDOM = new Random(42);

    private static final JoinOptions ARENA = new JoinOptions(true, JoinOptions.DEFAULT_ARENA_BUDGET_BYTES);
    private static final JoinOptions HEAP = ARENA.withArena(false);

    @Test
    void testInnerJoinMultipliesDuplicates() {
        Series left = series("l", new String[]{ "k", "k", "x" }, 1, 2, 3);
        Series right = series("r", new String[]{ "k", "k" }, 10, 20);

        JoinedSeries joined = Joins.joinSeries(left, right, JoinType.INNER);

        assertThat(joined.length()).isEqualTo(4);
        assertThat(joined.index()).isEqualTo(Index.ofStrings("k", "k", "k", "k"));
        assertThat(joined.leftValues().values()).containsExactly(
                Scalar.of(1L), Scalar.of(1L), Scalar.of(2L), Scalar.of(2L));
        assertThat(joined.rightValues().values()).containsExactly(
                Scalar.of(10L), Scalar.of(20L), Scalar.of(10L), Scalar.of(20L));
    }

    @Test
    void testOuterJoin() {
        Series left = series("l", new String[]{ "a", "b" }, 1, 2);
        Series right = series("r", new String[]{ "b", "c" }, 20, 30);

        JoinedSeries joined = Joins.joinSeries(left, right, JoinType.OUTER);

        assertThat(joined.index()).isEqualTo(Index.ofStrings("a", "b", "c"));
        assertThat(joined.leftValues().values()).containsExactly(Scalar.of(1L), Scalar.of(2L), Scalar.nullValue());
        assertThat(joined.rightValues().values()).containsExactly(Scalar.nullValue(), Scalar.of(20L), Scalar.of(30L));
    }

    @Test
    void testLeftJoin() {
        Series left = series("l", new String[]{ "a", "b" }, 1, 2);
        Series right = series("r", new String[]{ "b", "b" }, 20, 21);

        JoinedSeries joined = Joins.joinSeries(left, right, JoinType.LEFT);

        assertThat(joined.index()).isEqualTo(Index.ofStrings("a", "b", "b"));
        assertThat(joined.leftValues().values()).containsExactly(Scalar.of(1L), Scalar.of(2L), Scalar.of(2L));
        assertThat(joined.rightValues().values()).containsExactly(Scalar.nullValue(), Scalar.of(20L), Scalar.of(21L));
    }

    @Test
    void testRightJoinIsDrivenByRightRows() {
        Series left = series("l", new String[]{ "a", "b", "a" }, 1, 2, 3);
        Series right = series("r", new String[]{ "a", "c" }, 10, 30);

        JoinedSeries joined = Joins.joinSeries(left, right, JoinType.RIGHT);

        assertThat(joined.index()).isEqualTo(Index.ofStrings("a", "a", "c"));
        assertThat(joined.leftValues().values()).containsExactly(Scalar.of(1L), Scalar.of(3L), Scalar.nullValue());
        assertThat(joined.rightValues().values()).containsExactly(Scalar.of(10L), Scalar.of(10L), Scalar.of(30L));
    }

    @Test
    void testCrossJoin() {
        Series left = series("l", new String[]{ "a", "b" }, 1, 2);
        Series right = series("r", new String[]{ "x", "y", "z" }, 10, 20, 30);

        JoinedSeries joined = Joins.joinSeries(left, right, JoinType.CROSS);

        assertThat(joined.index()).isEqualTo(Index.ofStrings("a", "a", "a", "b", "b", "b"));
        assertThat(joined.leftValues().values()).containsExactly(
                Scalar.of(1L), Scalar.of(1L), Scalar.of(1L), Scalar.of(2L), Scalar.of(2L), Scalar.of(2L));
        assertThat(joined.rightValues().values()).containsExactly(
                Scalar.of(10L), Scalar.of(20L), Scalar.of(30L), Scalar.of(10L), Scalar.of(20L), Scalar.of(30L));
    }

    @Test
    void testJoinWithEmptySide() {
        Series left = series("l", new String[]{ "a" }, 1);
        Series empty = series("r", new String[0]);

        assertThat(Joins.joinSeries(left, empty, JoinType.INNER).length()).isZero();
        assertThat(Joins.joinSeries(left, empty, JoinType.LEFT).length()).isEqualTo(1);
        assertThat(Joins.joinSeries(left, empty, JoinType.CROSS).length()).isZero();
        assertThat(Joins.joinSeries(empty, left, JoinType.OUTER).index()).isEqualTo(Index.ofStrings("a"));
    }

    @ParameterizedTest
    @CsvSource({
            "INNER, 4",
            "LEFT, 5",
            "RIGHT, 5",
            "OUTER, 6",
            "CROSS, 9"
    })
    void testEstimateOutputRows(JoinType type, long expected) {
        Index left = Index.ofStrings("k", "k", "x");
        Index right = Index.ofStrings("k", "k", "y");

        assertThat(Joins.estimateOutputRows(left, right, type)).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(JoinType.class)
    void testEstimateMatchesOutput(JoinType type) {
        for (int round = 0; round < 20; round++) {
            Series left = randomSeries("l", RANDOM.nextInt(30));
            Series right = randomSeries("r", RANDOM.nextInt(30));

            long estimate = Joins.estimateOutputRows(left.index(), right.index(), type);

            assertThat(Joins.joinSeries(left, right, type, HEAP).length()).isEqualTo(estimate);
        }
    }

    @Test
    void testEstimateBytes() {
        assertThat(Joins.estimateBytes(10)).isEqualTo(320);
        assertThat(Joins.estimateBytes(0)).isZero();
        assertThat(Joins.estimateBytes(Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
    }

    @ParameterizedTest
    @EnumSource(JoinType.class)
    void testArenaAndHeapProduceIdenticalResults(JoinType type) {
        for (int round = 0; round < 50; round++) {
            Series left = randomSeries("l", RANDOM.nextInt(40));
            Series right = randomSeries("r", RANDOM.nextInt(40));

            JoinedSeries viaArena = Joins.joinSeries(left, right, type, ARENA);
            JoinedSeries viaHeap = Joins.joinSeries(left, right, type, HEAP);
            JoinedSeries overBudget = Joins.joinSeries(left, right, type, ARENA.withArenaBudgetBytes(0));

            assertThat(viaArena).isEqualTo(viaHeap);
            assertThat(overBudget).isEqualTo(viaHeap);
        }
    }

    @Test
    void testSeriesJoinDelegates() {
        Series left = series("l", new String[]{ "a", "b" }, 1, 2);
        Series right = series("r", new String[]{ "b" }, 20);

        assertThat(left.join(right, JoinType.INNER)).isEqualTo(Joins.joinSeries(left, right, JoinType.INNER));
    }

    @Test
    void testJoinOptions() {
        JoinOptions options = new JoinOptions(true, 1024);

        assertThat(options.withArena(false)).isEqualTo(new JoinOptions(false, 1024));
        assertThat(options.withArenaBudgetBytes(0).arenaBudgetBytes()).isZero();
        assertThatThrownBy(() -> new JoinOptions(true, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void testJoinOptionsFromSystemProperties() {
        try {
            System.setProperty(JoinOptions.ARENA_ENABLED_PROPERTY, "false");
            System.setProperty(JoinOptions.ARENA_BUDGET_PROPERTY, "4096");

            assertThat(JoinOptions.defaults()).isEqualTo(new JoinOptions(false, 4096));

            System.setProperty(JoinOptions.ARENA_BUDGET_PROPERTY, "lots");
            assertThatThrownBy(JoinOptions::defaults)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(JoinOptions.ARENA_BUDGET_PROPERTY)
                    .hasCauseInstanceOf(NumberFormatException.class);
        }
        finally {
            System.clearProperty(JoinOptions.ARENA_ENABLED_PROPERTY);
            System.clearProperty(JoinOptions.ARENA_BUDGET_PROPERTY);
        }

        assertThat(JoinOptions.defaults()).isEqualTo(new JoinOptions(true, JoinOptions.DEFAULT_ARENA_BUDGET_BYTES));
    }

    private static Series series(String name, String[] labels, long... values) {
        List<IndexLabel> indexLabels = new ArrayList<>();
        for (String label : labels) {
            indexLabels.add(IndexLabel.of(label));
        }
        List<Scalar> scalars = new ArrayList<>();
        for (long value : values) {
            scalars.add(Scalar.of(value));
        }
        return Series.fromValues(name, indexLabels, scalars);
    }

    private static Series randomSeries(String name, int size) {
        List<IndexLabel> labels = new ArrayList<>(size);
        List<Scalar> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            labels.add(RANDOM.nextBoolean() ? IndexLabel.of(RANDOM.nextInt(6)) : IndexLabel.of("k" + RANDOM.nextInt(6)));
            values.add(RANDOM.nextInt(10) == 0 ? Scalar.nullValue() : Scalar.of((long) RANDOM.nextInt(100)));
        }
        return Series.fromValues(name, labels, values);
    }
}
