package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A source as reported by one worker, before deduplication.
 *
 * @param url             unique key of the source
 * @param title           page or document title
 * @param credibility     1–5 rating assigned by the worker (may be missing or out of range)
 * @param relevance       why the source supports the claim
 * @param author          author name if known
 * @param organization    publishing organization if known
 * @param republishedFrom URL of the original reporting when this source is a republication
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportedSource(
        @JsonProperty("url")              String url,
        @JsonProperty("title")            String title,
        @JsonProperty("credibility")      Integer credibility,
        @JsonProperty("relevance")        String relevance,
        @JsonProperty("author")           String author,
        @JsonProperty("organization")     String organization,
        @JsonProperty("republished_from") String republishedFrom
) implements Serializable {

    public ReportedSource(String url, String title, Integer credibility, String relevance) {
        this(url, title, credibility, relevance, null, null, null);
    }
}
