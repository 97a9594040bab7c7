/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.column;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import dev.framewood.index.AlignmentPlan;
import dev.framewood.types.DType;
import dev.framewood.types.NullKind;
import dev.framewood.types.Scalar;

/**
 * An immutable, typed vector of values with a derived validity mask.
 * <p>
 * Every value either has the column's dtype or is that dtype's missing marker
 * ({@link Scalar#missingFor(DType)}); a {@code FLOAT64} column may also hold raw NaN
 * values, which count as missing. Transformations always return a new column.
 * </p>
 *
 * <pre>{@code
 * Column left = Column.fromValues(List.of(Scalar.of(1L), Scalar.nullValue()));
 * Column right = Column.fromValues(List.of(Scalar.of(2L), Scalar.of(5L)));
 * Column sum = left.binaryNumeric(right, ArithmeticOp.ADD); // [Int64(3), Null(NULL)]
 * }</pre>
 */
public final class Column {

    private final DType dtype;
    private final List<Scalar> values;
    private final ValidityMask validity;

    private Column(DType dtype, Scalar[] values) {
        this.dtype = dtype;
        this.values = Collections.unmodifiableList(Arrays.asList(values));
        this.validity = ValidityMask.fromValues(this.values);
    }

    /**
     * Creates a column of the given dtype, casting every value to it.
     *
     * @throws dev.framewood.types.TypeException if a value cannot be cast without loss
     */
    public static Column create(DType dtype, List<? extends Scalar> values) {
        Objects.requireNonNull(dtype, "dtype");
        boolean needsCast = false;
        for (Scalar value : values) {
            DType valueType = value.dtype();
            if (valueType != dtype && valueType != DType.NULL) {
                needsCast = true;
                break;
            }
        }

        Scalar[] coerced = new Scalar[values.size()];
        if (needsCast) {
            for (int i = 0; i < coerced.length; i++) {
                coerced[i] = values.get(i).castTo(dtype);
            }
        }
        else {
            // Only the missing markers need remapping
            for (int i = 0; i < coerced.length; i++) {
                Scalar value = values.get(i);
                coerced[i] = value instanceof Scalar.Null ? Scalar.missingFor(dtype) : value;
            }
        }
        return new Column(dtype, coerced);
    }

    /**
     * Creates a column whose dtype is inferred from the values.
     *
     * @throws dev.framewood.types.TypeException if the values have no common dtype
     */
    public static Column fromValues(List<? extends Scalar> values) {
        return create(DType.infer(values), values);
    }

    public DType dtype() {
        return dtype;
    }

    public int length() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public List<Scalar> values() {
        return values;
    }

    public Scalar value(int index) {
        return values.get(index);
    }

    public ValidityMask validity() {
        return validity;
    }

    /**
     * Materializes one side of an alignment: position {@code i} of the result holds the
     * value at {@code positions[i]}, or the missing marker when the position is
     * {@link AlignmentPlan#NO_ROW} or outside this column.
     */
    public Column reindexByPositions(int[] positions) {
        Scalar missing = Scalar.missingFor(dtype);
        Scalar[] reindexed = new Scalar[positions.length];
        int size = values.size();
        for (int i = 0; i < positions.length; i++) {
            int position = positions[i];
            reindexed[i] = position >= 0 && position < size ? values.get(position) : missing;
        }
        return new Column(dtype, reindexed);
    }

    /**
     * Applies an arithmetic operation row by row.
     * <p>
     * The result dtype is the common dtype of both columns, with {@code BOOL} promoted
     * to {@code INT64}; division always yields {@code FLOAT64}. A row with a missing
     * operand yields {@code Null(NAN)} if either operand is NaN, otherwise the result
     * dtype's missing marker. Present operands are computed in double precision and
     * narrowed back to {@code Int64} only for an {@code INT64} result that is finite,
     * integral and in range.
     * </p>
     *
     * @throws LengthMismatchException if the columns differ in length
     * @throws dev.framewood.types.TypeException if the dtypes have no common type or a
     * value is not numeric
     */
    public Column binaryNumeric(Column right, ArithmeticOp op) {
        if (length() != right.length()) {
            throw LengthMismatchException.columns(length(), right.length());
        }

        DType outType = DType.common(dtype, right.dtype);
        if (outType == DType.BOOL) {
            outType = DType.INT64;
        }
        if (op == ArithmeticOp.DIV) {
            outType = DType.FLOAT64;
        }

        Scalar outMissing = Scalar.missingFor(outType);
        Scalar[] result = new Scalar[length()];
        for (int i = 0; i < result.length; i++) {
            Scalar lhs = values.get(i);
            Scalar rhs = right.values.get(i);
            if (lhs.isMissing() || rhs.isMissing()) {
                result[i] = lhs.isNaN() || rhs.isNaN() ? new Scalar.Null(NullKind.NAN) : outMissing;
                continue;
            }
            result[i] = narrow(op.apply(lhs.toDouble(), rhs.toDouble()), outType);
        }
        return create(outType, Arrays.asList(result));
    }

    private static Scalar narrow(double value, DType outType) {
        if (outType == DType.INT64 && Double.isFinite(value) && value == Math.rint(value)
                && value >= -0x1p63 && value <= 0x1p63) {
            return Scalar.of((long) value);
        }
        return Scalar.of(value);
    }

    /**
     * Compares dtype and values, treating every NaN representation as equal.
     */
    public boolean semanticEquals(Column other) {
        if (dtype != other.dtype || values.size() != other.values.size()) {
            return false;
        }
        for (int i = 0; i < values.size(); i++) {
            if (!values.get(i).semanticEquals(other.values.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Column other)) {
            return false;
        }
        return dtype == other.dtype && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * dtype.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return "Column[" + dtype + "]" + values;
    }
}
