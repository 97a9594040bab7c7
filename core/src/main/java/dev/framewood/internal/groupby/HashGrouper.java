/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.groupby;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.framewood.index.IndexLabel;
import dev.framewood.types.Scalar;

/**
 * Hash-based grouping for keys of any dtype.
 * <p>
 * The key scalars themselves are the map keys, so no key objects are built per row.
 * All missing keys, NaN included, share one bucket labelled {@value #NULL_LABEL}.
 * </p>
 */
public final class HashGrouper {

    public static final String NULL_LABEL = "<null>";

    private static final Scalar MISSING_KEY = Scalar.nullValue();

    private HashGrouper() {
    }

    public static GroupedValues group(List<Scalar> keys, List<Scalar> values, boolean dropna) {
        Map<Scalar, Integer> slots = new HashMap<>();
        List<Scalar> ordering = new ArrayList<>();
        double[] sums = new double[16];
        long[] counts = new long[16];

        for (int row = 0; row < keys.size(); row++) {
            Scalar key = keys.get(row);
            if (key.isMissing()) {
                if (dropna) {
                    continue;
                }
                key = MISSING_KEY;
            }

            Integer slot = slots.get(key);
            if (slot == null) {
                slot = ordering.size();
                slots.put(key, slot);
                ordering.add(key);
                if (slot == sums.length) {
                    sums = Arrays.copyOf(sums, slot * 2);
                    counts = Arrays.copyOf(counts, slot * 2);
                }
            }

            Scalar value = values.get(row);
            if (!GroupedValues.contributes(value)) {
                continue;
            }
            sums[slot] += value.toDouble();
            counts[slot]++;
        }

        List<IndexLabel> labels = new ArrayList<>(ordering.size());
        for (Scalar key : ordering) {
            labels.add(toLabel(key));
        }
        return new GroupedValues(labels,
                Arrays.copyOf(sums, ordering.size()),
                Arrays.copyOf(counts, ordering.size()));
    }

    static IndexLabel toLabel(Scalar key) {
        if (key.isMissing()) {
            return new IndexLabel.Utf8(NULL_LABEL);
        }
        if (key instanceof Scalar.Int64 intKey) {
            return new IndexLabel.Int64(intKey.value());
        }
        if (key instanceof Scalar.Utf8 stringKey) {
            return new IndexLabel.Utf8(stringKey.value());
        }
        if (key instanceof Scalar.Bool boolKey) {
            return new IndexLabel.Utf8(Boolean.toString(boolKey.value()));
        }
        return new IndexLabel.Utf8(Double.toString(((Scalar.Float64) key).value()));
    }
}
