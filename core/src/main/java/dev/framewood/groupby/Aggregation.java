/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.groupby;

/**
 * Per-group reductions supported by {@link GroupBy}.
 */
public enum Aggregation {
    /** Sum of the present values, {@code 0.0} for a group without any. */
    SUM,
    /** Number of present values. */
    COUNT,
    /** Sum divided by count, missing for a group without present values. */
    MEAN
}
