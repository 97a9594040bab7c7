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
 * Position buffers on the regular heap, grown by doubling as rows are appended.
 */
public final class HeapPositionSink implements PositionSink {

    private static final int INITIAL_CAPACITY = 16;

    private int[] left;
    private int[] right;
    private int size;

    public HeapPositionSink() {
        this.left = new int[INITIAL_CAPACITY];
        this.right = new int[INITIAL_CAPACITY];
    }

    @Override
    public void append(int leftRow, int rightRow) {
        if (size == left.length) {
            int newCapacity = (int) Math.min((long) left.length << 1, Integer.MAX_VALUE - 8);
            if (newCapacity <= size) {
                throw new IllegalStateException("Join output exceeds the maximum of " + size + " rows");
            }
            left = Arrays.copyOf(left, newCapacity);
            right = Arrays.copyOf(right, newCapacity);
        }
        left[size] = leftRow;
        right[size] = rightRow;
        size++;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int[] leftPositions() {
        return Arrays.copyOf(left, size);
    }

    @Override
    public int[] rightPositions() {
        return Arrays.copyOf(right, size);
    }
}
