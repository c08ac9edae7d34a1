package com.eainde.research.report;

import com.eainde.research.aggregate.AggregationStats;
import com.eainde.research.model.Depth;
import com.eainde.research.model.Subtopic;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * @param generatedAt ISO-8601 instant the report was composed
 * @param degraded    {@code true} when no findings could be aggregated
 */
@JsonPropertyOrder({"query", "depth", "run_id", "generated_at", "degraded", "subtopics", "aggregation"})
public record ReportMetadata(
        @JsonProperty("query")        String query,
        @JsonProperty("depth")        Depth depth,
        @JsonProperty("run_id")       String runId,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("degraded")     boolean degraded,
        @JsonProperty("subtopics")    List<Subtopic> subtopics,
        @JsonProperty("aggregation")  AggregationStats aggregation
) implements Serializable {

    public ReportMetadata {
        subtopics = subtopics != null ? List.copyOf(subtopics) : List.of();
    }
}
