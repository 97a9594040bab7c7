/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.column;

/**
 * Thrown when two sequences that must line up row by row have different lengths.
 */
public class LengthMismatchException extends IllegalArgumentException {

    private final int left;
    private final int right;

    public LengthMismatchException(String message, int left, int right) {
        super(message);
        this.left = left;
        this.right = right;
    }

    public static LengthMismatchException columns(int left, int right) {
        return new LengthMismatchException("column length mismatch: left=" + left + ", right=" + right, left, right);
    }

    public static LengthMismatchException indexAndColumn(int indexLength, int columnLength) {
        return new LengthMismatchException("index length (" + indexLength
                + ") does not match column length (" + columnLength + ")", indexLength, columnLength);
    }

    public int left() {
        return left;
    }

    public int right() {
        return right;
    }
}
