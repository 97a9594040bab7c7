/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for scalar missingness, numeric conversion and casts.
 */
class ScalarTest {

    @Test
    void testMissingness() {
        assertThat(Scalar.nullValue().isMissing()).isTrue();
        assertThat(Scalar.nan().isMissing()).isTrue();
        assertThat(Scalar.of(Double.NaN).isMissing()).isTrue();
        assertThat(Scalar.of(0L).isMissing()).isFalse();
        assertThat(Scalar.of("").isMissing()).isFalse();

        assertThat(Scalar.nan().isNaN()).isTrue();
        assertThat(Scalar.of(Double.NaN).isNaN()).isTrue();
        assertThat(Scalar.nullValue().isNaN()).isFalse();
        assertThat(new Scalar.Null(NullKind.NAT).isNaN()).isFalse();
    }

    @Test
    void testNaNEquality() {
        Scalar floatNaN = Scalar.of(Double.NaN);

        assertThat(floatNaN).isEqualTo(Scalar.of(Double.NaN));
        assertThat(floatNaN).isNotEqualTo(Scalar.nan());
        assertThat(floatNaN.semanticEquals(Scalar.nan())).isTrue();
        assertThat(Scalar.nan().semanticEquals(floatNaN)).isTrue();
        assertThat(Scalar.nullValue().semanticEquals(Scalar.nan())).isFalse();
    }

    @Test
    void testToDouble() {
        assertThat(Scalar.of(true).toDouble()).isEqualTo(1.0);
        assertThat(Scalar.of(false).toDouble()).isEqualTo(0.0);
        assertThat(Scalar.of(-7L).toDouble()).isEqualTo(-7.0);
        assertThat(Scalar.of(2.5).toDouble()).isEqualTo(2.5);
    }

    @Test
    void testToDoubleOfMissingFails() {
        assertThatThrownBy(() -> Scalar.nullValue().toDouble())
                .isInstanceOf(TypeException.class)
                .satisfies(e -> assertThat(((TypeException) e).kind()).isEqualTo(TypeException.Kind.VALUE_IS_MISSING));
    }

    @Test
    void testToDoubleOfStringFails() {
        assertThatThrownBy(() -> Scalar.of("x").toDouble())
                .isInstanceOf(TypeException.class)
                .hasMessageContaining("non-numeric")
                .satisfies(e -> assertThat(((TypeException) e).kind()).isEqualTo(TypeException.Kind.NON_NUMERIC_VALUE));
    }

    @Test
    void testMissingFor() {
        assertThat(Scalar.missingFor(DType.FLOAT64)).isEqualTo(Scalar.nan());
        assertThat(Scalar.missingFor(DType.INT64)).isEqualTo(Scalar.nullValue());
        assertThat(Scalar.missingFor(DType.UTF8)).isEqualTo(Scalar.nullValue());
    }

    @Test
    void testCastNullFollowsTarget() {
        assertThat(Scalar.nullValue().castTo(DType.FLOAT64)).isEqualTo(Scalar.nan());
        assertThat(Scalar.nan().castTo(DType.INT64)).isEqualTo(Scalar.nullValue());
    }

    @Test
    void testWideningCasts() {
        assertThat(Scalar.of(true).castTo(DType.INT64)).isEqualTo(Scalar.of(1L));
        assertThat(Scalar.of(3L).castTo(DType.FLOAT64)).isEqualTo(Scalar.of(3.0));
        assertThat(Scalar.of(4.0).castTo(DType.INT64)).isEqualTo(Scalar.of(4L));
        assertThat(Scalar.of(1L).castTo(DType.BOOL)).isEqualTo(Scalar.of(true));
        assertThat(Scalar.of(0.0).castTo(DType.BOOL)).isEqualTo(Scalar.of(false));
        assertThat(Scalar.of("s").castTo(DType.UTF8)).isEqualTo(Scalar.of("s"));
        assertThat(Scalar.of(1L).castTo(DType.NULL)).isEqualTo(Scalar.nullValue());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 1.5, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 0x1p63, 1e300 })
    void testLossyFloatToIntFails(double value) {
        assertThatThrownBy(() -> Scalar.of(value).castTo(DType.INT64))
                .isInstanceOf(TypeException.class)
                .satisfies(e -> assertThat(((TypeException) e).kind()).isEqualTo(TypeException.Kind.LOSSY_FLOAT_TO_INT));
    }

    @Test
    void testFloatToIntAtLowerBound() {
        assertThat(Scalar.of(-0x1p63).castTo(DType.INT64)).isEqualTo(Scalar.of(Long.MIN_VALUE));
    }

    @Test
    void testInvalidBoolCasts() {
        assertThatThrownBy(() -> Scalar.of(2L).castTo(DType.BOOL))
                .isInstanceOf(TypeException.class)
                .satisfies(e -> assertThat(((TypeException) e).kind()).isEqualTo(TypeException.Kind.INVALID_BOOL_INT));
        assertThatThrownBy(() -> Scalar.of(0.5).castTo(DType.BOOL))
                .isInstanceOf(TypeException.class)
                .satisfies(e -> assertThat(((TypeException) e).kind()).isEqualTo(TypeException.Kind.INVALID_BOOL_FLOAT));
    }

    @Test
    void testInvalidCasts() {
        assertThatThrownBy(() -> Scalar.of("1").castTo(DType.INT64))
                .isInstanceOf(TypeException.class)
                .hasMessage("cannot cast scalar of dtype UTF8 to INT64");
        assertThatThrownBy(() -> Scalar.of(1L).castTo(DType.UTF8))
                .isInstanceOf(TypeException.class)
                .satisfies(e -> assertThat(((TypeException) e).kind()).isEqualTo(TypeException.Kind.INVALID_CAST));
    }

    @Test
    void testToString() {
        assertThat(Scalar.of(5L)).hasToString("Int64(5)");
        assertThat(Scalar.nan()).hasToString("Null(NAN)");
        assertThat(Scalar.of("a")).hasToString("Utf8(a)");
    }
}
