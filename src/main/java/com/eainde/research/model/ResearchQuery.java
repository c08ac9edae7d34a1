package com.eainde.research.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Optional;

/**
 * One research request.
 *
 * @param text           free-text query
 * @param depth          requested depth
 * @param workerBudget   per-worker time budget override, or {@code null} to use the configured default
 */
public record ResearchQuery(String text, Depth depth, Duration workerBudget) implements Serializable {

    public ResearchQuery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("query text must not be blank");
        }
        text = text.trim();
        depth = depth != null ? depth : Depth.MEDIUM;
        if (workerBudget != null && (workerBudget.isNegative() || workerBudget.isZero())) {
            throw new IllegalArgumentException("worker budget must be positive");
        }
    }

    public ResearchQuery(String text, Depth depth) {
        this(text, depth, null);
    }

    public Optional<Duration> budgetOverride() {
        return Optional.ofNullable(workerBudget);
    }
}
