package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * One non-overlapping facet of a query, assigned to exactly one worker.
 *
 * @param id        1-based position within the decomposition
 * @param title     human-readable subtopic title
 * @param keywords  3–5 search keywords, query focus phrase first
 * @param angle     research angle this subtopic covers (e.g. "limitations")
 * @param rationale why this facet is part of the decomposition
 */
public record Subtopic(
        @JsonProperty("id")        int id,
        @JsonProperty("title")     String title,
        @JsonProperty("keywords")  List<String> keywords,
        @JsonProperty("angle")     String angle,
        @JsonProperty("rationale") String rationale
) implements Serializable {

    public Subtopic {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }
}
