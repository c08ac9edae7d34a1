package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A claim as reported by one worker, before deduplication. Null source entries are kept
 * and skipped during aggregation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportedClaim(
        @JsonProperty("claim")    String claim,
        @JsonProperty("evidence") String evidence,
        @JsonProperty("sources")  List<ReportedSource> sources
) implements Serializable {

    public ReportedClaim {
        sources = sources != null ? Collections.unmodifiableList(new ArrayList<>(sources)) : List.of();
    }
}
