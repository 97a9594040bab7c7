/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.groupby;

/**
 * Settings for a group-by.
 * <p>
 * Use {@code -Dframewood.groupby.dense.disabled=true} to force the generic hash
 * path even for small-range integer keys, for debugging or comparison.
 * </p>
 *
 * @param dropna drop rows with a missing key instead of grouping them under {@code <null>}
 * @param denseEnabled allow the array-indexed path for small-range {@code INT64} keys
 */
public record GroupByOptions(boolean dropna, boolean denseEnabled) {

    public static final String DENSE_DISABLED_PROPERTY = "framewood.groupby.dense.disabled";

    public static GroupByOptions defaults() {
        return new GroupByOptions(true, !Boolean.getBoolean(DENSE_DISABLED_PROPERTY));
    }

    public GroupByOptions withDropna(boolean dropna) {
        return new GroupByOptions(dropna, denseEnabled);
    }

    public GroupByOptions withDense(boolean enabled) {
        return new GroupByOptions(dropna, enabled);
    }
}
