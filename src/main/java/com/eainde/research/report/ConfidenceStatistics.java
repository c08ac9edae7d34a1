package com.eainde.research.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;

@JsonPropertyOrder({"total_claims", "high", "medium", "low", "average_source_credibility", "total_unique_sources"})
public record ConfidenceStatistics(
        @JsonProperty("total_claims")               int totalClaims,
        @JsonProperty("high")                       LevelStatistic high,
        @JsonProperty("medium")                     LevelStatistic medium,
        @JsonProperty("low")                        LevelStatistic low,
        @JsonProperty("average_source_credibility") double averageSourceCredibility,
        @JsonProperty("total_unique_sources")       int totalUniqueSources
) implements Serializable {
}
