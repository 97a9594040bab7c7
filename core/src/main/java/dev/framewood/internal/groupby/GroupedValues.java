/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.groupby;

import java.util.List;

import dev.framewood.index.IndexLabel;
import dev.framewood.types.Scalar;

/**
 * Groups in first-seen order with the running sum and count of contributing
 * values for each.
 */
public record GroupedValues(List<IndexLabel> labels, double[] sums, long[] counts) {

    public int groupCount() {
        return labels.size();
    }

    /** Missing and non-numeric values add nothing to a group. */
    static boolean contributes(Scalar value) {
        return !value.isMissing() && !(value instanceof Scalar.Utf8);
    }
}
