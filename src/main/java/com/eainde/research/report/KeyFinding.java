package com.eainde.research.report;

import com.eainde.research.model.ConfidenceLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * A ranked finding.
 *
 * @param citations citation numbers into the tiered source list, ascending
 */
@JsonPropertyOrder({"rank", "claim", "confidence", "marker", "citations"})
public record KeyFinding(
        @JsonProperty("rank")       int rank,
        @JsonProperty("claim")      String claim,
        @JsonProperty("confidence") ConfidenceLevel confidence,
        @JsonProperty("marker")     String marker,
        @JsonProperty("citations")  List<Integer> citations
) implements Serializable {

    public KeyFinding {
        citations = List.copyOf(citations);
    }
}
