package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The structured document one research worker returns for its subtopic.
 *
 * <pre>
 * {
 *   "subtopic": "...",
 *   "claims": [ { "claim": "...", "evidence": "...",
 *                 "sources": [ {"url": "...", "title": "...", "credibility": 4, "relevance": "..."} ] } ],
 *   "gaps": [ "..." ],
 *   "search_queries_used": [ "..." ]
 * }
 * </pre>
 *
 * <p>{@code subtopic} and {@code claims} are required. They are kept nullable here so that
 * a document missing them can still be read and then rejected with a gap. Null array entries
 * are kept so that aggregation can skip and count them without losing the rest.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FindingsDocument(
        @JsonProperty("subtopic")            String subtopic,
        @JsonProperty("claims")              List<ReportedClaim> claims,
        @JsonProperty("gaps")                List<String> gaps,
        @JsonProperty("search_queries_used") List<String> searchQueriesUsed
) implements Serializable {

    public FindingsDocument {
        claims = claims != null ? Collections.unmodifiableList(new ArrayList<>(claims)) : null;
        gaps = gaps != null ? Collections.unmodifiableList(new ArrayList<>(gaps)) : List.of();
        searchQueriesUsed = searchQueriesUsed != null
                ? searchQueriesUsed.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    public static FindingsDocument empty(String subtopic) {
        return new FindingsDocument(subtopic, List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isStructurallyValid() {
        return subtopic != null && !subtopic.isBlank() && claims != null;
    }
}
