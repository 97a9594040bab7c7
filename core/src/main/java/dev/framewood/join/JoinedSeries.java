/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.join;

import java.util.Objects;

import dev.framewood.column.Column;
import dev.framewood.index.Index;

/**
 * Result of {@link Joins#joinSeries}: the output labels and both sides' values
 * materialized onto them. Rows without a partner hold the missing marker.
 */
public record JoinedSeries(Index index, Column leftValues, Column rightValues) {

    public JoinedSeries {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(leftValues, "leftValues");
        Objects.requireNonNull(rightValues, "rightValues");
    }

    public int length() {
        return index.length();
    }
}
