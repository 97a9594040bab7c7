/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

/**
 * How two indexes are combined by {@link Alignment#align(Index, Index, AlignMode)}.
 */
public enum AlignMode {
    /** Left rows whose label also occurs on the right, in left order. */
    INNER,
    /** Every left row, in left order. */
    LEFT,
    /** Every right row, in right order. */
    RIGHT,
    /** Every left row, then the right rows whose label does not occur on the left. */
    OUTER
}
