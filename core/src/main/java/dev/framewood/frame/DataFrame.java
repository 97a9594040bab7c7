/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import dev.framewood.column.Column;
import dev.framewood.column.LengthMismatchException;
import dev.framewood.index.Alignment;
import dev.framewood.index.AlignmentPlan;
import dev.framewood.index.Index;
import dev.framewood.join.JoinOptions;
import dev.framewood.join.JoinType;
import dev.framewood.join.Joins;

/**
 * Named columns sharing one row index. Columns are kept in name order.
 */
public final class DataFrame {

    private final Index index;
    private final SortedMap<String, Column> columns;

    private DataFrame(Index index, SortedMap<String, Column> columns) {
        this.index = index;
        this.columns = columns;
    }

    /**
     * @throws LengthMismatchException if a column's length differs from the index length
     */
    public static DataFrame of(Index index, Map<String, Column> columns) {
        Objects.requireNonNull(index, "index");
        SortedMap<String, Column> copy = new TreeMap<>();
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            Column column = entry.getValue();
            if (column.length() != index.length()) {
                throw LengthMismatchException.indexAndColumn(index.length(), column.length());
            }
            copy.put(entry.getKey(), column);
        }
        return new DataFrame(index, Collections.unmodifiableSortedMap(copy));
    }

    /**
     * Combines series into a frame on the union of their indexes. Every series added
     * re-aligns the columns collected so far; a later series with the same name
     * replaces an earlier one.
     */
    public static DataFrame fromSeries(List<Series> seriesList) {
        if (seriesList.isEmpty()) {
            return of(Index.of(List.of()), Map.of());
        }

        Series first = seriesList.get(0);
        Index unionIndex = first.index();
        SortedMap<String, Column> columns = new TreeMap<>();
        columns.put(first.name(), first.column());

        for (Series series : seriesList.subList(1, seriesList.size())) {
            AlignmentPlan plan = Alignment.alignUnion(unionIndex, series.index());
            Alignment.validate(plan);

            for (Map.Entry<String, Column> entry : columns.entrySet()) {
                entry.setValue(entry.getValue().reindexByPositions(plan.leftPositions()));
            }
            columns.put(series.name(), series.column().reindexByPositions(plan.rightPositions()));
            unionIndex = plan.unionIndex();
        }
        return of(unionIndex, columns);
    }

    public Index index() {
        return index;
    }

    public SortedMap<String, Column> columns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if there is no column with that name
     */
    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found, available: " + columns.keySet());
        }
        return column;
    }

    public Series series(String name) {
        return Series.of(name, index, column(name));
    }

    public int rowCount() {
        return index.length();
    }

    public DataFrame merge(DataFrame right, String on, JoinType how) {
        return Joins.merge(this, right, on, how, JoinOptions.defaults()).toDataFrame();
    }

    /**
     * Merges on a key column after consulting the guard about the estimated output size.
     *
     * @throws OperationRejectedException if the guard rejects the merge
     */
    public DataFrame merge(DataFrame right, String on, JoinType how, ExecutionGuard guard) {
        return merge(right, on, how, guard, JoinOptions.defaults());
    }

    /**
     * Merges with explicit buffer options. The guard sees the exact output size
     * before any position buffer is allocated.
     *
     * @throws OperationRejectedException if the guard rejects the merge
     */
    public DataFrame merge(DataFrame right, String on, JoinType how, ExecutionGuard guard, JoinOptions options) {
        String operation = "dataframe_merge_" + how.name().toLowerCase(Locale.ROOT);
        return Joins.merge(this, right, on, how, options, rows -> Guards.admitRows(guard, operation, rows))
                .toDataFrame();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataFrame other)) {
            return false;
        }
        return index.equals(other.index) && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return 31 * index.hashCode() + columns.hashCode();
    }

    @Override
    public String toString() {
        return "DataFrame[index=" + index + ", columns=" + columns + "]";
    }
}
