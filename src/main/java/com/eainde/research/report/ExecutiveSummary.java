package com.eainde.research.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;

@JsonPropertyOrder({"summary", "total_sources", "total_claims", "theme_count", "high_confidence_claims"})
public record ExecutiveSummary(
        @JsonProperty("summary")                String summary,
        @JsonProperty("total_sources")          int totalSources,
        @JsonProperty("total_claims")           int totalClaims,
        @JsonProperty("theme_count")            int themeCount,
        @JsonProperty("high_confidence_claims") int highConfidenceClaims
) implements Serializable {
}
