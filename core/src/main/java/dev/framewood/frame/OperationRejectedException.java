/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

/**
 * Thrown when an {@link ExecutionGuard} rejects an operation.
 */
public class OperationRejectedException extends RuntimeException {

    public OperationRejectedException(String message) {
        super(message);
    }
}
