/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

/**
 * Hooks through which a caller-supplied policy decides whether an operation may run.
 * <p>
 * The engine only reports facts (duplicate labels present, estimated result rows);
 * what to do about them is up to the implementation. Both hooks allow by default.
 * </p>
 */
public interface ExecutionGuard {

    /** Allows every operation. */
    ExecutionGuard PERMISSIVE = new ExecutionGuard() {
    };

    /**
     * Called when an input index of {@code operation} contains duplicate labels.
     */
    default GuardDecision onDuplicateLabels(String operation) {
        return GuardDecision.ALLOW;
    }

    /**
     * Called with the estimated number of output rows before {@code operation}
     * materializes its result.
     */
    default GuardDecision onEstimatedRows(String operation, long estimatedRows) {
        return GuardDecision.ALLOW;
    }

    /**
     * Returns a guard that rejects duplicate labels and results above {@code maxRows}.
     */
    static ExecutionGuard strict(long maxRows) {
        return new ExecutionGuard() {

            @Override
            public GuardDecision onDuplicateLabels(String operation) {
                return GuardDecision.REJECT;
            }

            @Override
            public GuardDecision onEstimatedRows(String operation, long estimatedRows) {
                return estimatedRows > maxRows ? GuardDecision.REJECT : GuardDecision.ALLOW;
            }
        };
    }
}
