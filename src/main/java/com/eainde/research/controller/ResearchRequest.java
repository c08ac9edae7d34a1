package com.eainde.research.controller;

import com.eainde.research.model.Depth;
import com.eainde.research.model.ResearchQuery;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Request body for {@code POST /research}.
 *
 * @param query               free-text research question
 * @param depth               quick, medium or deep (medium when omitted)
 * @param workerBudgetSeconds optional per-worker budget overriding the configured default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchRequest(
        @JsonProperty("query")                 String query,
        @JsonProperty("depth")                 String depth,
        @JsonProperty("worker_budget_seconds") Long workerBudgetSeconds
) {

    /**
     * @throws IllegalArgumentException on a blank query, unknown depth or non-positive budget
     */
    public ResearchQuery toQuery() {
        Duration budget = workerBudgetSeconds != null ? Duration.ofSeconds(workerBudgetSeconds) : null;
        return new ResearchQuery(query, Depth.fromLabel(depth), budget);
    }
}
