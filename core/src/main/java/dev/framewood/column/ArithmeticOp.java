/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.column;

/**
 * Element-wise arithmetic supported by {@link Column#binaryNumeric(Column, ArithmeticOp)}.
 */
public enum ArithmeticOp {
    ADD,
    SUB,
    MUL,
    DIV;

    double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> left / right;
        };
    }
}
