package com.eainde.research.aggregate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Counters from one aggregation pass.
 *
 * @param documentsReceived  findings documents handed to the aggregator (one per subtopic)
 * @param documentsFailed    documents the dispatcher already marked as failed
 * @param documentsMalformed documents rejected for missing {@code subtopic}/{@code claims}
 * @param claimsBeforeMerge  worker claims ingested
 * @param claimsAfterMerge   claims surviving dedup
 * @param claimsSkipped      worker claims without text
 * @param sourcesBeforeMerge source citations ingested (with duplicates)
 * @param sourcesAfterMerge  unique sources by URL
 * @param sourcesSkipped     source citations without a URL
 * @param relatedSourcePairs same-domain, similar-title pairs cross-referenced
 */
public record AggregationStats(
        @JsonProperty("documents_received")   int documentsReceived,
        @JsonProperty("documents_failed")     int documentsFailed,
        @JsonProperty("documents_malformed")  int documentsMalformed,
        @JsonProperty("claims_before_merge")  int claimsBeforeMerge,
        @JsonProperty("claims_after_merge")   int claimsAfterMerge,
        @JsonProperty("claims_skipped")       int claimsSkipped,
        @JsonProperty("sources_before_merge") int sourcesBeforeMerge,
        @JsonProperty("sources_after_merge")  int sourcesAfterMerge,
        @JsonProperty("sources_skipped")      int sourcesSkipped,
        @JsonProperty("related_source_pairs") int relatedSourcePairs
) implements Serializable {

    public int duplicatesMerged() {
        return claimsBeforeMerge - claimsAfterMerge;
    }
}
