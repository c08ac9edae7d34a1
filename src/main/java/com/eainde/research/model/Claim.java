package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A deduplicated claim. The confidence level is derived from {@code citationUrls} when the
 * claim is published and travels with that citation set.
 *
 * @param index               0-based aggregation order
 * @param text                canonical wording
 * @param evidence            evidence accompanying the canonical wording
 * @param citationUrls        cited source URLs, first-cited order
 * @param confidence          level derived from the citations
 * @param subtopicIds         subtopics that reported this claim
 * @param mergedCount         number of worker claims folded into this one
 * @param relatedClaimIndexes related claims that were cross-referenced instead of merged
 */
public record Claim(
        @JsonProperty("index")                 int index,
        @JsonProperty("text")                  String text,
        @JsonProperty("evidence")              String evidence,
        @JsonProperty("citation_urls")         List<String> citationUrls,
        @JsonProperty("confidence")            ConfidenceLevel confidence,
        @JsonProperty("subtopic_ids")          List<Integer> subtopicIds,
        @JsonProperty("merged_count")          int mergedCount,
        @JsonProperty("related_claim_indexes") List<Integer> relatedClaimIndexes
) implements Serializable {

    public Claim {
        citationUrls = citationUrls != null ? List.copyOf(citationUrls) : List.of();
        subtopicIds = subtopicIds != null ? List.copyOf(subtopicIds) : List.of();
        relatedClaimIndexes = relatedClaimIndexes != null ? List.copyOf(relatedClaimIndexes) : List.of();
    }
}
