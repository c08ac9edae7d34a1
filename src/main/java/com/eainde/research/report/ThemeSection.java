package com.eainde.research.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

@JsonPropertyOrder({"theme", "high_count", "medium_count", "low_count", "distinct_sources", "findings"})
public record ThemeSection(
        @JsonProperty("theme")            String theme,
        @JsonProperty("high_count")       int highCount,
        @JsonProperty("medium_count")     int mediumCount,
        @JsonProperty("low_count")        int lowCount,
        @JsonProperty("distinct_sources") int distinctSources,
        @JsonProperty("findings")         List<ThemedFinding> findings
) implements Serializable {

    public ThemeSection {
        findings = List.copyOf(findings);
    }
}
