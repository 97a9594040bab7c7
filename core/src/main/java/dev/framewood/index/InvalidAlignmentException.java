/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.index;

/**
 * Thrown when the vectors of an {@link AlignmentPlan} do not have the same length.
 */
public class InvalidAlignmentException extends IllegalStateException {

    public InvalidAlignmentException(String message) {
        super(message);
    }
}
