/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.join;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.framewood.index.IndexLabel;

/**
 * Label to row-positions multimap used as the probe side of a join.
 * <p>
 * Rows are stored in compressed sparse row layout: all rows of a label sit
 * contiguously in {@link #rows} in ascending order, addressed by a per-label slot.
 * The map holds the caller's label instances as keys, nothing is copied. A
 * {@code null} label stands for a missing key: it gets a slot of its own and
 * matches only other {@code null} labels.
 * </p>
 */
public final class LabelMultimap {

    public static final int ABSENT = -1;

    private final Map<IndexLabel, Integer> slots;
    private final int[] offsets;
    private final int[] rows;

    private LabelMultimap(Map<IndexLabel, Integer> slots, int[] offsets, int[] rows) {
        this.slots = slots;
        this.offsets = offsets;
        this.rows = rows;
    }

    public static LabelMultimap build(List<IndexLabel> labels) {
        int size = labels.size();
        Map<IndexLabel, Integer> slots = new HashMap<>(Math.max(16, size * 4 / 3 + 1));
        int[] slotOfRow = new int[size];
        int[] counts = new int[Math.max(1, size)];

        for (int row = 0; row < size; row++) {
            IndexLabel label = labels.get(row);
            Integer slot = slots.get(label);
            if (slot == null) {
                slot = slots.size();
                slots.put(label, slot);
            }
            slotOfRow[row] = slot;
            counts[slot]++;
        }

        int slotCount = slots.size();
        int[] offsets = new int[slotCount + 1];
        for (int slot = 0; slot < slotCount; slot++) {
            offsets[slot + 1] = offsets[slot] + counts[slot];
        }

        int[] cursor = new int[slotCount];
        System.arraycopy(offsets, 0, cursor, 0, slotCount);
        int[] rows = new int[size];
        for (int row = 0; row < size; row++) {
            rows[cursor[slotOfRow[row]]++] = row;
        }
        return new LabelMultimap(slots, offsets, rows);
    }

    /**
     * Returns the slot of a label, or {@link #ABSENT}.
     */
    public int slot(IndexLabel label) {
        Integer slot = slots.get(label);
        return slot != null ? slot : ABSENT;
    }

    public int count(int slot) {
        return offsets[slot + 1] - offsets[slot];
    }

    /** First offset into {@link #row(int)} of the given slot. */
    public int start(int slot) {
        return offsets[slot];
    }

    /** Exclusive end offset of the given slot. */
    public int end(int slot) {
        return offsets[slot + 1];
    }

    public int row(int offset) {
        return rows[offset];
    }

    public int matchCount(IndexLabel label) {
        int slot = slot(label);
        return slot == ABSENT ? 0 : count(slot);
    }

    public boolean contains(IndexLabel label) {
        return slots.containsKey(label);
    }
}
