/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.join;

/**
 * Append-only buffer of output row pairs produced by a join.
 * <p>
 * Implemented by {@link HeapPositionSink} and by the sinks handed out by a
 * {@link PositionArena}. Both must yield identical position vectors for the
 * same sequence of appends.
 * </p>
 */
public sealed interface PositionSink permits HeapPositionSink, PositionArena.ArenaSink {

    void append(int leftRow, int rightRow);

    int size();

    /** Returns an exact-length copy of the left positions appended so far. */
    int[] leftPositions();

    /** Returns an exact-length copy of the right positions appended so far. */
    int[] rightPositions();
}
