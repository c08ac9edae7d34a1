package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A deduplicated source. Identity is the URL.
 *
 * @param url             unique key
 * @param title           title
 * @param domain          normalized host used for independence checks
 * @param credibility     1–5, maximum seen across duplicates
 * @param relevanceNotes  union of relevance notes, first-seen order
 * @param author          author if any worker reported one
 * @param organization    publishing organization if any worker reported one
 * @param republishedFrom URL of the original reporting, if this is a republication
 * @param relatedUrls     same-domain sources with similar titles (cross-referenced, not merged)
 * @param registryIndex   0-based first-seen position in the registry
 */
public record Source(
        @JsonProperty("url")              String url,
        @JsonProperty("title")            String title,
        @JsonProperty("domain")           String domain,
        @JsonProperty("credibility")      int credibility,
        @JsonProperty("relevance_notes")  List<String> relevanceNotes,
        @JsonProperty("author")           String author,
        @JsonProperty("organization")     String organization,
        @JsonProperty("republished_from") String republishedFrom,
        @JsonProperty("related_urls")     List<String> relatedUrls,
        @JsonProperty("registry_index")   int registryIndex
) implements Serializable {

    public Source {
        relevanceNotes = relevanceNotes != null ? List.copyOf(relevanceNotes) : List.of();
        relatedUrls = relatedUrls != null ? List.copyOf(relatedUrls) : List.of();
    }
}
