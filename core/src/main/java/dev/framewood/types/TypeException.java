/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.types;

/**
 * Thrown when values cannot be unified, cast or converted without losing information.
 */
public class TypeException extends IllegalArgumentException {

    /**
     * The specific type failure.
     */
    public enum Kind {
        INCOMPATIBLE_DTYPES,
        INVALID_CAST,
        LOSSY_FLOAT_TO_INT,
        INVALID_BOOL_INT,
        INVALID_BOOL_FLOAT,
        NON_NUMERIC_VALUE,
        VALUE_IS_MISSING
    }

    private final Kind kind;

    public TypeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static TypeException incompatibleDtypes(DType left, DType right) {
        return new TypeException(Kind.INCOMPATIBLE_DTYPES,
                "dtype coercion from " + left + " to " + right + " has no compatible common type");
    }

    static TypeException invalidCast(DType from, DType to) {
        return new TypeException(Kind.INVALID_CAST, "cannot cast scalar of dtype " + from + " to " + to);
    }

    static TypeException lossyFloatToInt(double value) {
        return new TypeException(Kind.LOSSY_FLOAT_TO_INT, "cannot cast float " + value + " to INT64 without loss");
    }

    static TypeException invalidBoolInt(long value) {
        return new TypeException(Kind.INVALID_BOOL_INT, "expected 0/1 for bool cast from INT64 but found " + value);
    }

    static TypeException invalidBoolFloat(double value) {
        return new TypeException(Kind.INVALID_BOOL_FLOAT,
                "expected 0.0/1.0 for bool cast from FLOAT64 but found " + value);
    }

    static TypeException nonNumericValue(String value, DType dtype) {
        return new TypeException(Kind.NON_NUMERIC_VALUE, "value '" + value + "' has non-numeric dtype " + dtype);
    }

    static TypeException valueIsMissing(NullKind kind) {
        return new TypeException(Kind.VALUE_IS_MISSING, "value is missing (" + kind + ")");
    }
}
