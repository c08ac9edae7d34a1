package com.eainde.research.report;

import com.eainde.research.model.ConfidenceLevel;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

@JsonPropertyOrder({"claim", "evidence", "confidence", "citations", "subtopic_ids"})
public record ThemedFinding(
        @JsonProperty("claim")        String claim,
        @JsonProperty("evidence")     String evidence,
        @JsonProperty("confidence")   ConfidenceLevel confidence,
        @JsonProperty("citations")    List<Integer> citations,
        @JsonProperty("subtopic_ids") List<Integer> subtopicIds
) implements Serializable {

    public ThemedFinding {
        citations = List.copyOf(citations);
        subtopicIds = List.copyOf(subtopicIds);
    }
}
