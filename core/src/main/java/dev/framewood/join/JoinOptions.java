/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.join;

/**
 * Execution settings for a join.
 *
 * <p>Defaults come from system properties:</p>
 * <ul>
 *   <li>{@code framewood.join.arena.enabled} - use the scoped arena when the
 *   estimate fits the budget (default {@code true})</li>
 *   <li>{@code framewood.join.arena.budget.bytes} - largest estimated footprint
 *   served by the arena (default 256 MiB)</li>
 * </ul>
 *
 * @param useArena whether the arena may be used at all
 * @param arenaBudgetBytes largest estimated position-buffer footprint for the arena
 */
public record JoinOptions(boolean useArena, long arenaBudgetBytes) {

    public static final String ARENA_ENABLED_PROPERTY = "framewood.join.arena.enabled";
    public static final String ARENA_BUDGET_PROPERTY = "framewood.join.arena.budget.bytes";

    public static final long DEFAULT_ARENA_BUDGET_BYTES = 256L * 1024 * 1024;

    public JoinOptions {
        if (arenaBudgetBytes < 0) {
            throw new IllegalArgumentException("Arena budget must not be negative: " + arenaBudgetBytes);
        }
    }

    /**
     * Returns options initialized from the system properties.
     *
     * @throws IllegalArgumentException if the budget property is not a valid number
     */
    public static JoinOptions defaults() {
        boolean useArena = !"false".equalsIgnoreCase(System.getProperty(ARENA_ENABLED_PROPERTY));
        String budget = System.getProperty(ARENA_BUDGET_PROPERTY);
        long budgetBytes = DEFAULT_ARENA_BUDGET_BYTES;
        if (budget != null && !budget.isBlank()) {
            try {
                budgetBytes = Long.parseLong(budget.trim());
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + ARENA_BUDGET_PROPERTY + ": " + budget, e);
            }
        }
        return new JoinOptions(useArena, budgetBytes);
    }

    public JoinOptions withArena(boolean enabled) {
        return new JoinOptions(enabled, arenaBudgetBytes);
    }

    public JoinOptions withArenaBudgetBytes(long budgetBytes) {
        return new JoinOptions(useArena, budgetBytes);
    }
}
