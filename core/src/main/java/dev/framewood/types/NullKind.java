/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.types;

/**
 * Flavours of a missing value.
 */
public enum NullKind {
    /** Generic absence. */
    NULL,
    /** Floating point not-a-number. */
    NAN,
    /** Missing timestamp, reserved for temporal types. */
    NAT
}
