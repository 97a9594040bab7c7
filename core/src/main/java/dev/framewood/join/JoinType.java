/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.join;

/**
 * Join semantics supported by {@link Joins}.
 */
public enum JoinType {
    /** Pairs of rows with equal labels. */
    INNER,
    /** Inner pairs plus unmatched left rows. */
    LEFT,
    /** Inner pairs plus unmatched right rows, driven by right row order. */
    RIGHT,
    /** Left join followed by the right rows whose label never occurs on the left. */
    OUTER,
    /** Every left row paired with every right row, labels ignored. */
    CROSS
}
