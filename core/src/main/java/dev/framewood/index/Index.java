/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * An ordered, immutable sequence of row labels. Labels may repeat.
 * <p>
 * Whether the index has duplicates and how it is sorted are derived from the
 * labels on first request and cached. The caches use the single-check idiom:
 * concurrent first readers may each compute the value, but they all compute
 * the same one. Equality and hashing only look at the labels.
 * </p>
 */
public final class Index {

    private static final Index EMPTY = new Index(List.of());

    private final List<IndexLabel> labels;

    private volatile Boolean duplicates;
    private volatile SortOrder sortOrder;

    private Index(List<IndexLabel> labels) {
        this.labels = labels;
    }

    public static Index of(List<IndexLabel> labels) {
        if (labels.isEmpty()) {
            return EMPTY;
        }
        for (IndexLabel label : labels) {
            if (label == null) {
                throw new NullPointerException("Index labels must not be null");
            }
        }
        return new Index(Collections.unmodifiableList(new ArrayList<>(labels)));
    }

    public static Index of(IndexLabel... labels) {
        return of(Arrays.asList(labels));
    }

    public static Index ofLongs(long... values) {
        List<IndexLabel> labels = new ArrayList<>(values.length);
        for (long value : values) {
            labels.add(new IndexLabel.Int64(value));
        }
        return wrap(labels);
    }

    public static Index ofStrings(String... values) {
        List<IndexLabel> labels = new ArrayList<>(values.length);
        for (String value : values) {
            labels.add(new IndexLabel.Utf8(value));
        }
        return wrap(labels);
    }

    /**
     * Returns an index with the labels {@code 0..length-1}.
     */
    public static Index range(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Index length must not be negative: " + length);
        }
        List<IndexLabel> labels = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            labels.add(new IndexLabel.Int64(i));
        }
        Index index = wrap(labels);
        index.duplicates = Boolean.FALSE;
        index.sortOrder = length == 0 ? SortOrder.UNSORTED : SortOrder.ASCENDING_INT64;
        return index;
    }

    /**
     * Wraps a freshly built list the caller no longer touches, without copying it.
     */
    static Index wrap(List<IndexLabel> labels) {
        return new Index(Collections.unmodifiableList(labels));
    }

    public int length() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public List<IndexLabel> labels() {
        return labels;
    }

    public IndexLabel label(int position) {
        return labels.get(position);
    }

    public boolean hasDuplicates() {
        Boolean result = duplicates;
        if (result == null) {
            result = detectDuplicates(labels);
            duplicates = result;
        }
        return result;
    }

    public SortOrder sortOrder() {
        SortOrder result = sortOrder;
        if (result == null) {
            result = detectSortOrder(labels);
            sortOrder = result;
        }
        return result;
    }

    /**
     * Returns the position of the first occurrence of a label.
     * <p>
     * Uses binary search when the index is ascending over the needle's label kind;
     * otherwise scans linearly. A needle of a different kind than a uniformly
     * typed, sorted index never matches.
     * </p>
     */
    public OptionalInt position(IndexLabel needle) {
        SortOrder order = sortOrder();
        if (order == SortOrder.ASCENDING_INT64 || order == SortOrder.ASCENDING_UTF8) {
            boolean sameKind = order == SortOrder.ASCENDING_INT64
                    ? needle instanceof IndexLabel.Int64
                    : needle instanceof IndexLabel.Utf8;
            if (!sameKind) {
                return OptionalInt.empty();
            }
            int found = Collections.binarySearch(labels, needle);
            return found >= 0 ? OptionalInt.of(found) : OptionalInt.empty();
        }
        int found = labels.indexOf(needle);
        return found >= 0 ? OptionalInt.of(found) : OptionalInt.empty();
    }

    /**
     * Maps every distinct label to the position of its first occurrence.
     * Later occurrences of a duplicated label are not addressable through this map.
     */
    public Map<IndexLabel, Integer> positionMapFirst() {
        Map<IndexLabel, Integer> positions = new HashMap<>(Math.max(16, labels.size() * 4 / 3 + 1));
        for (int i = 0; i < labels.size(); i++) {
            positions.putIfAbsent(labels.get(i), i);
        }
        return positions;
    }

    private static boolean detectDuplicates(List<IndexLabel> labels) {
        Set<IndexLabel> seen = new HashSet<>(Math.max(16, labels.size() * 4 / 3 + 1));
        for (IndexLabel label : labels) {
            if (!seen.add(label)) {
                return true;
            }
        }
        return false;
    }

    private static SortOrder detectSortOrder(List<IndexLabel> labels) {
        if (labels.isEmpty()) {
            return SortOrder.UNSORTED;
        }
        IndexLabel first = labels.get(0);
        Class<?> kind = first.getClass();
        for (int i = 1; i < labels.size(); i++) {
            IndexLabel current = labels.get(i);
            if (current.getClass() != kind || labels.get(i - 1).compareTo(current) >= 0) {
                return SortOrder.UNSORTED;
            }
        }
        return first instanceof IndexLabel.Int64 ? SortOrder.ASCENDING_INT64 : SortOrder.ASCENDING_UTF8;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Index other)) {
            return false;
        }
        return labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return "Index" + labels;
    }
}
