/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

final class Guards {

    private Guards() {
    }

    /**
     * @throws OperationRejectedException if the guard rejects {@code estimatedRows}
     */
    static void admitRows(ExecutionGuard guard, String operation, long estimatedRows) {
        if (guard.onEstimatedRows(operation, estimatedRows) == GuardDecision.REJECT) {
            throw new OperationRejectedException(operation + ": estimated " + estimatedRows + " rows rejected");
        }
    }
}
