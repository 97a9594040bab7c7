/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maps every output row of a two-sided combination to its source row on each side.
 * <p>
 * {@code leftPositions[i]} and {@code rightPositions[i]} hold the source row for
 * output row {@code i}, or {@link #NO_ROW} when that side contributes nothing and
 * the output must be filled with the missing marker. The arrays are owned by the
 * plan and must not be modified.
 * </p>
 */
public record AlignmentPlan(Index unionIndex, int[] leftPositions, int[] rightPositions) {

    /** Position marking an output row with no source row. */
    public static final int NO_ROW = -1;

    public AlignmentPlan {
        Objects.requireNonNull(unionIndex, "unionIndex");
        Objects.requireNonNull(leftPositions, "leftPositions");
        Objects.requireNonNull(rightPositions, "rightPositions");
    }

    public int length() {
        return unionIndex.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlignmentPlan other)) {
            return false;
        }
        return unionIndex.equals(other.unionIndex)
                && Arrays.equals(leftPositions, other.leftPositions)
                && Arrays.equals(rightPositions, other.rightPositions);
    }

    @Override
    public int hashCode() {
        int result = unionIndex.hashCode();
        result = 31 * result + Arrays.hashCode(leftPositions);
        result = 31 * result + Arrays.hashCode(rightPositions);
        return result;
    }

    @Override
    public String toString() {
        return "AlignmentPlan[unionIndex=" + unionIndex
                + ", leftPositions=" + Arrays.toString(leftPositions)
                + ", rightPositions=" + Arrays.toString(rightPositions) + "]";
    }
}
