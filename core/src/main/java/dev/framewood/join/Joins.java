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
import java.util.Map;
import java.util.TreeMap;
import java.util.function.LongConsumer;

import dev.framewood.column.Column;
import dev.framewood.frame.DataFrame;
import dev.framewood.frame.Series;
import dev.framewood.index.AlignmentPlan;
import dev.framewood.index.Index;
import dev.framewood.index.IndexLabel;
import dev.framewood.internal.join.HeapPositionSink;
import dev.framewood.internal.join.JoinExecutionEvent;
import dev.framewood.internal.join.LabelMultimap;
import dev.framewood.internal.join.PositionArena;
import dev.framewood.internal.join.PositionSink;
import dev.framewood.types.DType;
import dev.framewood.types.Scalar;

/**
 * Relational joins over row labels and key columns.
 * <p>
 * Unlike {@link dev.framewood.index.Alignment}, joins match every occurrence of a
 * label: a key appearing {@code m} times on one side and {@code n} times on the
 * other yields {@code m * n} output rows.
 * </p>
 * <p>
 * Each call first computes its exact output size from per-label multiplicities.
 * If the estimated footprint of the position buffers fits the configured budget,
 * positions are written into a {@link PositionArena} released when the call
 * returns; otherwise growable heap buffers are used. The strategy never changes
 * the result.
 * </p>
 */
public final class Joins {

    private static final System.Logger LOG = System.getLogger(Joins.class.getName());

    /** Estimated bytes per output row: two positions plus one label reference. */
    static final long BYTES_PER_OUTPUT_ROW = 2 * 8 + 16;

    /** Largest output a join can materialize, bounded by the maximum array length. */
    public static final long MAX_OUTPUT_ROWS = Integer.MAX_VALUE - 8;

    private static final LongConsumer NO_ADMISSION = rows -> {
    };

    private Joins() {
    }

    public static JoinedSeries joinSeries(Series left, Series right, JoinType type) {
        return joinSeries(left, right, type, JoinOptions.defaults());
    }

    /**
     * Joins two series on their index labels.
     * <p>
     * Each output row is labelled with the label of the row driving it: the left row
     * for inner, left, cross and the matched part of outer joins, the right row for
     * right joins and for the right-only tail of outer joins.
     * </p>
     *
     * @throws IllegalStateException if the output would exceed {@link #MAX_OUTPUT_ROWS}
     */
    public static JoinedSeries joinSeries(Series left, Series right, JoinType type, JoinOptions options) {
        return joinSeries(left, right, type, options, NO_ADMISSION);
    }

    /**
     * Joins two series on their index labels, passing the exact output size to
     * {@code admission} before any position buffer is allocated. An exception thrown
     * by {@code admission} aborts the join.
     */
    public static JoinedSeries joinSeries(Series left, Series right, JoinType type, JoinOptions options,
                                          LongConsumer admission) {
        List<IndexLabel> leftLabels = left.index().labels();
        List<IndexLabel> rightLabels = right.index().labels();
        JoinPositions positions = computePositions(leftLabels, rightLabels, type, options, admission);

        int[] leftPositions = positions.left();
        int[] rightPositions = positions.right();
        List<IndexLabel> labels = new ArrayList<>(leftPositions.length);
        for (int i = 0; i < leftPositions.length; i++) {
            labels.add(leftPositions[i] != AlignmentPlan.NO_ROW
                    ? leftLabels.get(leftPositions[i])
                    : rightLabels.get(rightPositions[i]));
        }

        return new JoinedSeries(
                Index.of(labels),
                left.column().reindexByPositions(leftPositions),
                right.column().reindexByPositions(rightPositions));
    }

    public static MergedDataFrame merge(DataFrame left, DataFrame right, String on, JoinType how) {
        return merge(left, right, on, how, JoinOptions.defaults());
    }

    /**
     * Merges two frames on a key column.
     * <p>
     * Key values must be {@code INT64} or {@code UTF8}; missing keys match each other
     * and nothing else. The key column of the result has the common dtype of both key
     * columns and takes the left key where the left side contributes and the right key
     * otherwise. Other columns
     * present on both sides are suffixed {@code _left} and {@code _right}. A cross
     * merge ignores {@code on} and keeps every column of both sides.
     * </p>
     *
     * @throws IllegalArgumentException if the key column is missing or has an unsupported
     * dtype, or the merged column names collide
     */
    public static MergedDataFrame merge(DataFrame left, DataFrame right, String on, JoinType how,
                                        JoinOptions options) {
        return merge(left, right, on, how, options, NO_ADMISSION);
    }

    /**
     * Merges two frames on a key column, passing the exact output size to
     * {@code admission} before any position buffer is allocated.
     *
     * @see #merge(DataFrame, DataFrame, String, JoinType, JoinOptions)
     */
    public static MergedDataFrame merge(DataFrame left, DataFrame right, String on, JoinType how,
                                        JoinOptions options, LongConsumer admission) {
        if (how == JoinType.CROSS) {
            return crossMerge(left, right, options, admission);
        }

        Column leftKey = left.column(on);
        Column rightKey = right.column(on);
        JoinPositions positions = computePositions(keyLabels(on, leftKey), keyLabels(on, rightKey), how, options,
                admission);
        int[] leftPositions = positions.left();
        int[] rightPositions = positions.right();

        List<Scalar> keys = new ArrayList<>(leftPositions.length);
        for (int i = 0; i < leftPositions.length; i++) {
            keys.add(leftPositions[i] != AlignmentPlan.NO_ROW
                    ? leftKey.value(leftPositions[i])
                    : rightKey.value(rightPositions[i]));
        }

        TreeMap<String, Column> columns = new TreeMap<>();
        columns.put(on, Column.create(DType.common(leftKey.dtype(), rightKey.dtype()), keys));
        for (Map.Entry<String, Column> entry : left.columns().entrySet()) {
            String name = entry.getKey();
            if (!name.equals(on)) {
                String outName = right.hasColumn(name) ? name + "_left" : name;
                putUnique(columns, outName, entry.getValue().reindexByPositions(leftPositions));
            }
        }
        for (Map.Entry<String, Column> entry : right.columns().entrySet()) {
            String name = entry.getKey();
            if (!name.equals(on)) {
                String outName = left.hasColumn(name) ? name + "_right" : name;
                putUnique(columns, outName, entry.getValue().reindexByPositions(rightPositions));
            }
        }
        return new MergedDataFrame(Index.range(leftPositions.length), columns);
    }

    private static MergedDataFrame crossMerge(DataFrame left, DataFrame right, JoinOptions options,
                                              LongConsumer admission) {
        JoinPositions positions = computePositions(left.index().labels(), right.index().labels(),
                JoinType.CROSS, options, admission);

        TreeMap<String, Column> columns = new TreeMap<>();
        for (Map.Entry<String, Column> entry : left.columns().entrySet()) {
            String name = entry.getKey();
            String outName = right.hasColumn(name) ? name + "_left" : name;
            putUnique(columns, outName, entry.getValue().reindexByPositions(positions.left()));
        }
        for (Map.Entry<String, Column> entry : right.columns().entrySet()) {
            String name = entry.getKey();
            String outName = left.hasColumn(name) ? name + "_right" : name;
            putUnique(columns, outName, entry.getValue().reindexByPositions(positions.right()));
        }
        return new MergedDataFrame(Index.range(positions.left().length), columns);
    }

    private static void putUnique(Map<String, Column> columns, String name, Column column) {
        if (columns.putIfAbsent(name, column) != null) {
            throw new IllegalArgumentException("Merge would produce duplicate column '" + name + "'");
        }
    }

    /**
     * Returns the exact number of rows a join of the two indexes produces, saturating at
     * {@link Long#MAX_VALUE}. Intended as the size signal for admission policies.
     */
    public static long estimateOutputRows(Index left, Index right, JoinType type) {
        return estimateOutputRows(left.labels(), right.labels(), type);
    }

    private static long estimateOutputRows(List<IndexLabel> leftLabels, List<IndexLabel> rightLabels,
                                           JoinType type) {
        return switch (type) {
            case CROSS -> estimateRows(leftLabels, rightLabels, type, null, null);
            case INNER, LEFT -> estimateRows(leftLabels, rightLabels, type, null, LabelMultimap.build(rightLabels));
            case RIGHT -> estimateRows(leftLabels, rightLabels, type, LabelMultimap.build(leftLabels), null);
            case OUTER -> estimateRows(leftLabels, rightLabels, type,
                    LabelMultimap.build(leftLabels), LabelMultimap.build(rightLabels));
        };
    }

    /**
     * Returns the number of rows {@link #merge} would produce.
     */
    public static long estimateMergeRows(DataFrame left, DataFrame right, String on, JoinType how) {
        if (how == JoinType.CROSS) {
            return estimateOutputRows(left.index(), right.index(), how);
        }
        return estimateOutputRows(keyLabels(on, left.column(on)), keyLabels(on, right.column(on)), how);
    }

    /**
     * Converts an estimated row count into the estimated position-buffer footprint.
     */
    public static long estimateBytes(long rows) {
        if (rows > Long.MAX_VALUE / BYTES_PER_OUTPUT_ROW) {
            return Long.MAX_VALUE;
        }
        return rows * BYTES_PER_OUTPUT_ROW;
    }

    private static JoinPositions computePositions(List<IndexLabel> leftLabels, List<IndexLabel> rightLabels,
                                                  JoinType type, JoinOptions options,
                                                  LongConsumer admission) {
        LabelMultimap leftMap = type == JoinType.RIGHT || type == JoinType.OUTER
                ? LabelMultimap.build(leftLabels)
                : null;
        LabelMultimap rightMap = type == JoinType.INNER || type == JoinType.LEFT || type == JoinType.OUTER
                ? LabelMultimap.build(rightLabels)
                : null;

        long estimatedRows = estimateRows(leftLabels, rightLabels, type, leftMap, rightMap);
        admission.accept(estimatedRows);
        long estimatedBytes = estimateBytes(estimatedRows);
        if (estimatedRows > MAX_OUTPUT_ROWS) {
            throw new IllegalStateException("Join output of " + estimatedRows
                    + " rows exceeds the maximum of " + MAX_OUTPUT_ROWS + " rows");
        }

        boolean useArena = options.useArena()
                && estimatedBytes <= options.arenaBudgetBytes()
                && PositionArena.fits(estimatedRows);
        LOG.log(System.Logger.Level.DEBUG, "{0} join: estimated {1} rows ({2} bytes), using {3} buffers",
                type, estimatedRows, estimatedBytes, useArena ? "arena" : "heap");

        JoinExecutionEvent event = new JoinExecutionEvent();
        event.begin();

        JoinPositions positions = useArena
                ? emitIntoArena(leftLabels, rightLabels, type, leftMap, rightMap, (int) estimatedRows)
                : emitIntoHeap(leftLabels, rightLabels, type, leftMap, rightMap);

        event.joinType = type.name();
        event.estimatedRows = estimatedRows;
        event.estimatedBytes = estimatedBytes;
        event.outputRows = positions.left().length;
        event.arena = useArena;
        event.commit();
        return positions;
    }

    private static JoinPositions emitIntoArena(List<IndexLabel> leftLabels, List<IndexLabel> rightLabels,
                                               JoinType type, LabelMultimap leftMap, LabelMultimap rightMap,
                                               int rows) {
        try (PositionArena arena = PositionArena.open(2L * rows)) {
            PositionSink sink = arena.allocateSink(rows);
            emit(leftLabels, rightLabels, type, leftMap, rightMap, sink);
            // Copy out before the arena releases its slab
            return new JoinPositions(sink.leftPositions(), sink.rightPositions());
        }
    }

    private static JoinPositions emitIntoHeap(List<IndexLabel> leftLabels, List<IndexLabel> rightLabels,
                                              JoinType type, LabelMultimap leftMap, LabelMultimap rightMap) {
        PositionSink sink = new HeapPositionSink();
        emit(leftLabels, rightLabels, type, leftMap, rightMap, sink);
        return new JoinPositions(sink.leftPositions(), sink.rightPositions());
    }

    private static long estimateRows(List<IndexLabel> leftLabels, List<IndexLabel> rightLabels, JoinType type,
                                     LabelMultimap leftMap, LabelMultimap rightMap) {
        switch (type) {
            case CROSS: {
                long leftSize = leftLabels.size();
                long rightSize = rightLabels.size();
                if (leftSize != 0 && rightSize > Long.MAX_VALUE / leftSize) {
                    return Long.MAX_VALUE;
                }
                return leftSize * rightSize;
            }
            case INNER: {
                long rows = 0;
                for (IndexLabel label : leftLabels) {
                    rows += rightMap.matchCount(label);
                }
                return rows;
            }
            case LEFT:
                return drivenRows(leftLabels, rightMap);
            case RIGHT:
                return drivenRows(rightLabels, leftMap);
            case OUTER: {
                long rows = drivenRows(leftLabels, rightMap);
                for (IndexLabel label : rightLabels) {
                    if (!leftMap.contains(label)) {
                        rows++;
                    }
                }
                return rows;
            }
            default:
                throw new IllegalArgumentException("Unknown join type: " + type);
        }
    }

    /** Rows of a join that keeps every driving row, matched or not. */
    private static long drivenRows(List<IndexLabel> driving, LabelMultimap probe) {
        long rows = 0;
        for (IndexLabel label : driving) {
            rows += Math.max(1, probe.matchCount(label));
        }
        return rows;
    }

    private static void emit(List<IndexLabel> leftLabels, List<IndexLabel> rightLabels, JoinType type,
                             LabelMultimap leftMap, LabelMultimap rightMap, PositionSink sink) {
        switch (type) {
            case INNER -> emitLeftDriven(leftLabels, rightMap, false, sink);
            case LEFT -> emitLeftDriven(leftLabels, rightMap, true, sink);
            case RIGHT -> {
                for (int rightRow = 0; rightRow < rightLabels.size(); rightRow++) {
                    int slot = leftMap.slot(rightLabels.get(rightRow));
                    if (slot == LabelMultimap.ABSENT) {
                        sink.append(AlignmentPlan.NO_ROW, rightRow);
                        continue;
                    }
                    for (int offset = leftMap.start(slot); offset < leftMap.end(slot); offset++) {
                        sink.append(leftMap.row(offset), rightRow);
                    }
                }
            }
            case OUTER -> {
                emitLeftDriven(leftLabels, rightMap, true, sink);
                for (int rightRow = 0; rightRow < rightLabels.size(); rightRow++) {
                    if (!leftMap.contains(rightLabels.get(rightRow))) {
                        sink.append(AlignmentPlan.NO_ROW, rightRow);
                    }
                }
            }
            case CROSS -> {
                int rightSize = rightLabels.size();
                for (int leftRow = 0; leftRow < leftLabels.size(); leftRow++) {
                    for (int rightRow = 0; rightRow < rightSize; rightRow++) {
                        sink.append(leftRow, rightRow);
                    }
                }
            }
        }
    }

    private static void emitLeftDriven(List<IndexLabel> leftLabels, LabelMultimap rightMap,
                                       boolean keepUnmatched, PositionSink sink) {
        for (int leftRow = 0; leftRow < leftLabels.size(); leftRow++) {
            int slot = rightMap.slot(leftLabels.get(leftRow));
            if (slot == LabelMultimap.ABSENT) {
                if (keepUnmatched) {
                    sink.append(leftRow, AlignmentPlan.NO_ROW);
                }
                continue;
            }
            for (int offset = rightMap.start(slot); offset < rightMap.end(slot); offset++) {
                sink.append(leftRow, rightMap.row(offset));
            }
        }
    }

    /** Missing keys become {@code null} labels, which only match each other. */
    private static List<IndexLabel> keyLabels(String on, Column keyColumn) {
        List<IndexLabel> labels = new ArrayList<>(keyColumn.length());
        for (Scalar value : keyColumn.values()) {
            if (value.isMissing()) {
                labels.add(null);
            }
            else if (value instanceof Scalar.Int64 intValue) {
                labels.add(new IndexLabel.Int64(intValue.value()));
            }
            else if (value instanceof Scalar.Utf8 stringValue) {
                labels.add(new IndexLabel.Utf8(stringValue.value()));
            }
            else {
                throw new IllegalArgumentException("Merge key column '" + on + "' has unsupported dtype "
                        + keyColumn.dtype() + "; expected INT64 or UTF8");
            }
        }
        return labels;
    }

    private record JoinPositions(int[] left, int[] right) {
    }
}
