/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.types;

import java.util.Objects;

/**
 * A single typed value, possibly missing.
 * <p>
 * {@code equals} is structural: {@code Float64(NaN)} equals itself but not
 * {@code Null(NAN)}. Use {@link #semanticEquals(Scalar)} to compare values the
 * way the engine does, where every NaN representation is the same value.
 * </p>
 */
public sealed interface Scalar permits Scalar.Null, Scalar.Bool, Scalar.Int64, Scalar.Float64, Scalar.Utf8 {

    DType dtype();

    /** True for any {@link Null} and for a NaN {@link Float64}. */
    boolean isMissing();

    /** True for {@code Null(NAN)} and for a NaN {@link Float64}. */
    default boolean isNaN() {
        return false;
    }

    /**
     * Widens this value to a double.
     *
     * @throws TypeException if the value is missing or not numeric
     */
    double toDouble();

    /**
     * Casts this value to the given type.
     *
     * @throws TypeException if the cast is not possible or would lose information
     */
    Scalar castTo(DType target);

    default boolean semanticEquals(Scalar other) {
        if (isNaN() && other.isNaN()) {
            return true;
        }
        return equals(other);
    }

    /**
     * Returns the missing marker for a type: {@code Null(NAN)} for {@code FLOAT64},
     * {@code Null(NULL)} otherwise.
     */
    static Scalar missingFor(DType dtype) {
        return dtype == DType.FLOAT64 ? Null.NAN_VALUE : Null.NULL_VALUE;
    }

    static Scalar of(long value) {
        return new Int64(value);
    }

    static Scalar of(double value) {
        return new Float64(value);
    }

    static Scalar of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Scalar of(String value) {
        return new Utf8(value);
    }

    static Scalar nullValue() {
        return Null.NULL_VALUE;
    }

    static Scalar nan() {
        return Null.NAN_VALUE;
    }

    record Null(NullKind kind) implements Scalar {

        static final Null NULL_VALUE = new Null(NullKind.NULL);
        static final Null NAN_VALUE = new Null(NullKind.NAN);

        public Null {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public DType dtype() {
            return DType.NULL;
        }

        @Override
        public boolean isMissing() {
            return true;
        }

        @Override
        public boolean isNaN() {
            return kind == NullKind.NAN;
        }

        @Override
        public double toDouble() {
            throw TypeException.valueIsMissing(kind);
        }

        @Override
        public Scalar castTo(DType target) {
            return missingFor(target);
        }

        @Override
        public String toString() {
            return "Null(" + kind + ")";
        }
    }

    record Bool(boolean value) implements Scalar {

        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public DType dtype() {
            return DType.BOOL;
        }

        @Override
        public boolean isMissing() {
            return false;
        }

        @Override
        public double toDouble() {
            return value ? 1.0 : 0.0;
        }

        @Override
        public Scalar castTo(DType target) {
            return switch (target) {
                case NULL -> Null.NULL_VALUE;
                case BOOL -> this;
                case INT64 -> new Int64(value ? 1L : 0L);
                case FLOAT64 -> new Float64(value ? 1.0 : 0.0);
                case UTF8 -> throw TypeException.invalidCast(DType.BOOL, target);
            };
        }

        @Override
        public String toString() {
            return "Bool(" + value + ")";
        }
    }

    record Int64(long value) implements Scalar {

        @Override
        public DType dtype() {
            return DType.INT64;
        }

        @Override
        public boolean isMissing() {
            return false;
        }

        @Override
        public double toDouble() {
            return value;
        }

        @Override
        public Scalar castTo(DType target) {
            return switch (target) {
                case NULL -> Null.NULL_VALUE;
                case BOOL -> {
                    if (value == 0L) {
                        yield Bool.FALSE;
                    }
                    if (value == 1L) {
                        yield Bool.TRUE;
                    }
                    throw TypeException.invalidBoolInt(value);
                }
                case INT64 -> this;
                case FLOAT64 -> new Float64(value);
                case UTF8 -> throw TypeException.invalidCast(DType.INT64, target);
            };
        }

        @Override
        public String toString() {
            return "Int64(" + value + ")";
        }
    }

    record Float64(double value) implements Scalar {

        @Override
        public DType dtype() {
            return DType.FLOAT64;
        }

        @Override
        public boolean isMissing() {
            return Double.isNaN(value);
        }

        @Override
        public boolean isNaN() {
            return Double.isNaN(value);
        }

        @Override
        public double toDouble() {
            return value;
        }

        @Override
        public Scalar castTo(DType target) {
            return switch (target) {
                case NULL -> Null.NULL_VALUE;
                case BOOL -> {
                    if (value == 0.0) {
                        yield Bool.FALSE;
                    }
                    if (value == 1.0) {
                        yield Bool.TRUE;
                    }
                    throw TypeException.invalidBoolFloat(value);
                }
                case INT64 -> {
                    // 2^63 is exactly representable and already out of range
                    if (!Double.isFinite(value) || value != Math.rint(value)
                            || value < -0x1p63 || value >= 0x1p63) {
                        throw TypeException.lossyFloatToInt(value);
                    }
                    yield new Int64((long) value);
                }
                case FLOAT64 -> this;
                case UTF8 -> throw TypeException.invalidCast(DType.FLOAT64, target);
            };
        }

        @Override
        public String toString() {
            return "Float64(" + value + ")";
        }
    }

    record Utf8(String value) implements Scalar {

        public Utf8 {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public DType dtype() {
            return DType.UTF8;
        }

        @Override
        public boolean isMissing() {
            return false;
        }

        @Override
        public double toDouble() {
            throw TypeException.nonNumericValue(value, DType.UTF8);
        }

        @Override
        public Scalar castTo(DType target) {
            return switch (target) {
                case NULL -> Null.NULL_VALUE;
                case UTF8 -> this;
                case BOOL, INT64, FLOAT64 -> throw TypeException.invalidCast(DType.UTF8, target);
            };
        }

        @Override
        public String toString() {
            return "Utf8(" + value + ")";
        }
    }
}
