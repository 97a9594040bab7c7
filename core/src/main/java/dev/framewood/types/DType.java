/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.types;

import java.util.List;

/**
 * Logical value types of a column.
 * <p>
 * The types form a small promotion lattice: {@code NULL} absorbs into any other
 * type, {@code BOOL} widens to {@code INT64}, which widens to {@code FLOAT64}.
 * {@code UTF8} only unifies with itself.
 * </p>
 */
public enum DType {
    NULL,
    BOOL,
    INT64,
    FLOAT64,
    UTF8;

    /**
     * Returns the narrowest type both operands can be represented in.
     *
     * @throws TypeException if the two types have no common type
     */
    public static DType common(DType left, DType right) {
        if (left == right) {
            return left;
        }
        if (left == NULL) {
            return right;
        }
        if (right == NULL) {
            return left;
        }
        if (left.isNumeric() && right.isNumeric()) {
            return left.ordinal() > right.ordinal() ? left : right;
        }
        throw TypeException.incompatibleDtypes(left, right);
    }

    /**
     * Infers the type of a value sequence by folding {@link #common(DType, DType)}
     * over it, starting from {@code NULL}.
     */
    public static DType infer(List<? extends Scalar> values) {
        DType current = NULL;
        for (Scalar value : values) {
            current = common(current, value.dtype());
        }
        return current;
    }

    /**
     * Returns true for {@code BOOL}, {@code INT64} and {@code FLOAT64}.
     */
    public boolean isNumeric() {
        return this == BOOL || this == INT64 || this == FLOAT64;
    }
}
