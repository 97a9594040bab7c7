/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.column;

import java.util.BitSet;
import java.util.List;

import dev.framewood.types.Scalar;

/**
 * Per-row presence flags of a {@link Column}. Bit {@code i} is set iff value {@code i}
 * is not missing.
 */
public final class ValidityMask {

    private final BitSet bits;
    private final int length;

    private ValidityMask(BitSet bits, int length) {
        this.bits = bits;
        this.length = length;
    }

    static ValidityMask fromValues(List<Scalar> values) {
        BitSet bits = new BitSet(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (!values.get(i).isMissing()) {
                bits.set(i);
            }
        }
        return new ValidityMask(bits, values.size());
    }

    public boolean isValid(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
        }
        return bits.get(index);
    }

    public int countValid() {
        return bits.cardinality();
    }

    public int length() {
        return length;
    }

    /** Returns a copy of the underlying bits. */
    public BitSet toBitSet() {
        return (BitSet) bits.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidityMask other)) {
            return false;
        }
        return length == other.length && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * bits.hashCode() + length;
    }
}
