/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.groupby;

import java.util.ArrayList;
import java.util.List;

import dev.framewood.index.IndexLabel;
import dev.framewood.types.Scalar;

/**
 * Array-indexed grouping for {@code Int64} keys spanning a small range.
 * <p>
 * Keys index directly into bucket arrays offset by the minimum key, so no hashing
 * is involved. The span is capped at {@link #MAX_KEY_SPAN} buckets so that a few
 * far-apart keys cannot force a huge allocation.
 * </p>
 */
public final class DenseInt64Grouper {

    public static final int MAX_KEY_SPAN = 65_536;

    private DenseInt64Grouper() {
    }

    /**
     * Groups the rows if every kept key is an {@code Int64} and the key span fits
     * {@link #MAX_KEY_SPAN}.
     *
     * @return the groups, or {@code null} if the keys are not eligible
     */
    public static GroupedValues tryGroup(List<Scalar> keys, List<Scalar> values, boolean dropna) {
        long minKey = Long.MAX_VALUE;
        long maxKey = Long.MIN_VALUE;
        boolean sawKey = false;

        for (Scalar key : keys) {
            if (key instanceof Scalar.Int64 intKey) {
                sawKey = true;
                minKey = Math.min(minKey, intKey.value());
                maxKey = Math.max(maxKey, intKey.value());
            }
            else if (!(dropna && key.isMissing())) {
                return null;
            }
        }

        if (!sawKey) {
            return new GroupedValues(List.of(), new double[0], new long[0]);
        }

        // Overflows to negative for spans beyond the long range
        long span = maxKey - minKey + 1;
        if (span <= 0 || span > MAX_KEY_SPAN) {
            return null;
        }

        int bucketCount = (int) span;
        double[] sums = new double[bucketCount];
        long[] counts = new long[bucketCount];
        boolean[] seen = new boolean[bucketCount];
        int[] ordering = new int[bucketCount];
        int groupCount = 0;

        for (int row = 0; row < keys.size(); row++) {
            Scalar key = keys.get(row);
            if (!(key instanceof Scalar.Int64 intKey)) {
                continue;
            }
            int bucket = (int) (intKey.value() - minKey);
            if (!seen[bucket]) {
                seen[bucket] = true;
                ordering[groupCount++] = bucket;
            }

            Scalar value = values.get(row);
            if (!GroupedValues.contributes(value)) {
                continue;
            }
            sums[bucket] += value.toDouble();
            counts[bucket]++;
        }

        List<IndexLabel> labels = new ArrayList<>(groupCount);
        double[] orderedSums = new double[groupCount];
        long[] orderedCounts = new long[groupCount];
        for (int group = 0; group < groupCount; group++) {
            int bucket = ordering[group];
            labels.add(new IndexLabel.Int64(minKey + bucket));
            orderedSums[group] = sums[bucket];
            orderedCounts[group] = counts[bucket];
        }
        return new GroupedValues(labels, orderedSums, orderedCounts);
    }
}
