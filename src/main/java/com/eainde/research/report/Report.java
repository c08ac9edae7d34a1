package com.eainde.research.report;

import com.eainde.research.model.Gap;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * The terminal artifact of a research run. Immutable; citation numbers are fixed when the
 * report is composed and every rendering reads them from here.
 */
@JsonPropertyOrder({"metadata", "executive_summary", "key_findings", "detailed_analysis",
        "sources", "confidence_statistics", "research_gaps"})
public record Report(
        @JsonProperty("metadata")              ReportMetadata metadata,
        @JsonProperty("executive_summary")     ExecutiveSummary executiveSummary,
        @JsonProperty("key_findings")          List<KeyFinding> keyFindings,
        @JsonProperty("detailed_analysis")     List<ThemeSection> detailedAnalysis,
        @JsonProperty("sources")               List<SourceTier> sources,
        @JsonProperty("confidence_statistics") ConfidenceStatistics confidenceStatistics,
        @JsonProperty("research_gaps")         List<Gap> researchGaps
) implements Serializable {

    public Report {
        keyFindings = List.copyOf(keyFindings);
        detailedAnalysis = List.copyOf(detailedAnalysis);
        sources = List.copyOf(sources);
        researchGaps = List.copyOf(researchGaps);
    }
}
