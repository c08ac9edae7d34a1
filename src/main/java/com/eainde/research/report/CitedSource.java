package com.eainde.research.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

@JsonPropertyOrder({"number", "url", "title", "domain", "credibility", "relevance_notes", "related_urls"})
public record CitedSource(
        @JsonProperty("number")          int number,
        @JsonProperty("url")             String url,
        @JsonProperty("title")           String title,
        @JsonProperty("domain")          String domain,
        @JsonProperty("credibility")     int credibility,
        @JsonProperty("relevance_notes") List<String> relevanceNotes,
        @JsonProperty("related_urls")    List<String> relatedUrls
) implements Serializable {

    public CitedSource {
        relevanceNotes = List.copyOf(relevanceNotes);
        relatedUrls = List.copyOf(relatedUrls);
    }
}
