package com.eainde.research.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param percentage share of all claims, rounded to one decimal
 */
public record LevelStatistic(
        @JsonProperty("count")      int count,
        @JsonProperty("percentage") double percentage
) implements Serializable {
}
