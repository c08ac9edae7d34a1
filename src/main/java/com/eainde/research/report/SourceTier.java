package com.eainde.research.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * One credibility band of the source list. All three bands are always present, possibly empty.
 */
@JsonPropertyOrder({"tier", "min_credibility", "max_credibility", "sources"})
public record SourceTier(
        @JsonProperty("tier")            String tier,
        @JsonProperty("min_credibility") int minCredibility,
        @JsonProperty("max_credibility") int maxCredibility,
        @JsonProperty("sources")         List<CitedSource> sources
) implements Serializable {

    public SourceTier {
        sources = List.copyOf(sources);
    }

    public boolean covers(int credibility) {
        return credibility >= minCredibility && credibility <= maxCredibility;
    }
}
