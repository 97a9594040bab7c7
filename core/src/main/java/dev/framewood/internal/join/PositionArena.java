/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.join;

import java.util.Arrays;

/**
 * Bump allocator for join position buffers, scoped to a single join call.
 * <p>
 * The arena reserves one slab up front, sized from the join's output estimate, and
 * hands out fixed-capacity {@link ArenaSink}s carved from it. Closing the arena
 * releases the slab; sinks must be drained before that.
 * </p>
 * <pre>{@code
 * try (PositionArena arena = PositionArena.open(2L * rows)) {
 *     PositionSink sink = arena.allocateSink(rows);
 *     // append, then copy positions out
 * }
 * }</pre>
 */
public final class PositionArena implements AutoCloseable {

    /** Largest slab the arena will reserve, in ints. */
    public static final int MAX_SLAB_INTS = Integer.MAX_VALUE - 8;

    private int[] slab;
    private int top;

    private PositionArena(int[] slab) {
        this.slab = slab;
    }

    /**
     * Opens an arena able to hold {@code capacityInts} positions.
     *
     * @throws IllegalArgumentException if the capacity is negative or above {@link #MAX_SLAB_INTS}
     */
    public static PositionArena open(long capacityInts) {
        if (capacityInts < 0 || capacityInts > MAX_SLAB_INTS) {
            throw new IllegalArgumentException("Arena capacity out of range: " + capacityInts);
        }
        return new PositionArena(new int[(int) capacityInts]);
    }

    /**
     * Returns true if a sink of {@code rows} row pairs fits into a single arena.
     */
    public static boolean fits(long rows) {
        return rows >= 0 && rows <= MAX_SLAB_INTS / 2;
    }

    /**
     * Carves a sink for {@code rows} row pairs out of the slab.
     *
     * @throws IllegalStateException if the arena is closed or has no room left
     */
    public ArenaSink allocateSink(int rows) {
        ensureOpen();
        long needed = 2L * rows;
        if (rows < 0 || top + needed > slab.length) {
            throw new IllegalStateException("Arena exhausted: requested " + needed + " ints, "
                    + (slab.length - top) + " available");
        }
        ArenaSink sink = new ArenaSink(this, top, top + rows, rows);
        top += (int) needed;
        return sink;
    }

    public int capacity() {
        return slab != null ? slab.length : 0;
    }

    public int used() {
        return top;
    }

    public boolean isClosed() {
        return slab == null;
    }

    private int[] ensureOpen() {
        int[] current = slab;
        if (current == null) {
            throw new IllegalStateException("Arena is closed");
        }
        return current;
    }

    @Override
    public void close() {
        slab = null;
        top = 0;
    }

    /**
     * Fixed-capacity sink backed by a region of the arena slab.
     */
    public static final class ArenaSink implements PositionSink {

        private final PositionArena arena;
        private final int leftBase;
        private final int rightBase;
        private final int capacity;
        private int size;

        private ArenaSink(PositionArena arena, int leftBase, int rightBase, int capacity) {
            this.arena = arena;
            this.leftBase = leftBase;
            this.rightBase = rightBase;
            this.capacity = capacity;
        }

        @Override
        public void append(int leftRow, int rightRow) {
            int[] slab = arena.ensureOpen();
            if (size == capacity) {
                throw new IllegalStateException("Arena sink full at " + capacity + " rows");
            }
            slab[leftBase + size] = leftRow;
            slab[rightBase + size] = rightRow;
            size++;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public int[] leftPositions() {
            return Arrays.copyOfRange(arena.ensureOpen(), leftBase, leftBase + size);
        }

        @Override
        public int[] rightPositions() {
            return Arrays.copyOfRange(arena.ensureOpen(), rightBase, rightBase + size);
        }
    }
}
