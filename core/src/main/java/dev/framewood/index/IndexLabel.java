/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

import java.util.Objects;

/**
 * A row label, either an integer or a string.
 * <p>
 * Labels are totally ordered: every {@link Int64} sorts before every {@link Utf8},
 * labels of the same kind compare by value.
 * </p>
 */
public sealed interface IndexLabel extends Comparable<IndexLabel> permits IndexLabel.Int64, IndexLabel.Utf8 {

    static IndexLabel of(long value) {
        return new Int64(value);
    }

    static IndexLabel of(String value) {
        return new Utf8(value);
    }

    record Int64(long value) implements IndexLabel {

        @Override
        public int compareTo(IndexLabel other) {
            if (other instanceof Int64 otherInt) {
                return Long.compare(value, otherInt.value);
            }
            return -1;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Utf8(String value) implements IndexLabel {

        public Utf8 {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public int compareTo(IndexLabel other) {
            if (other instanceof Utf8 otherString) {
                return value.compareTo(otherString.value);
            }
            return 1;
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
