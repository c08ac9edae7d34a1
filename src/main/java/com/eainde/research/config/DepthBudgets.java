package com.eainde.research.config;

import com.eainde.research.model.Depth;

import java.time.Duration;

/**
 * Default per-worker time budget for each depth. A caller-supplied budget on the query
 * takes precedence.
 */
public record DepthBudgets(Duration quick, Duration medium, Duration deep) {

    public static final DepthBudgets DEFAULTS =
            new DepthBudgets(Duration.ofMinutes(3), Duration.ofMinutes(5), Duration.ofMinutes(10));

    public DepthBudgets {
        requirePositive("quick", quick);
        requirePositive("medium", medium);
        requirePositive("deep", deep);
    }

    public Duration budgetFor(Depth depth) {
        return switch (depth) {
            case QUICK -> quick;
            case MEDIUM -> medium;
            case DEEP -> deep;
        };
    }

    private static void requirePositive(String name, Duration budget) {
        if (budget == null || budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("worker budget for depth '" + name + "' must be positive");
        }
    }
}
