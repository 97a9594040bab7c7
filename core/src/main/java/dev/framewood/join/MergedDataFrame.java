/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.join;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import dev.framewood.column.Column;
import dev.framewood.frame.DataFrame;
import dev.framewood.index.Index;

/**
 * Result of {@link Joins#merge}: a fresh {@code 0..n-1} index and the merged
 * columns, with colliding non-key names suffixed {@code _left} / {@code _right}.
 */
public record MergedDataFrame(Index index, SortedMap<String, Column> columns) {

    public MergedDataFrame {
        columns = Collections.unmodifiableSortedMap(new TreeMap<>(columns));
    }

    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found, available: " + columns.keySet());
        }
        return column;
    }

    public int rowCount() {
        return index.length();
    }

    public DataFrame toDataFrame() {
        return DataFrame.of(index, columns);
    }
}
