package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Duration;

/**
 * A recorded shortfall in coverage or a worker failure. Gaps are surfaced in the
 * report, never hidden.
 */
@JsonPropertyOrder({"kind", "subtopic_id", "subtopic_title", "description"})
public record Gap(
        @JsonProperty("kind")           GapKind kind,
        @JsonProperty("subtopic_id")    int subtopicId,
        @JsonProperty("subtopic_title") String subtopicTitle,
        @JsonProperty("description")    String description
) implements Serializable {

    public static Gap timeout(Subtopic subtopic, Duration budget) {
        return new Gap(GapKind.WORKER_TIMEOUT, subtopic.id(), subtopic.title(),
                "subtopic " + subtopic.id() + " (" + subtopic.title() + ") timed out after "
                        + budget.toSeconds() + "s");
    }

    public static Gap fetchFailure(Subtopic subtopic, String reason) {
        return new Gap(GapKind.WORKER_FETCH_FAILURE, subtopic.id(), subtopic.title(),
                "subtopic " + subtopic.id() + " (" + subtopic.title() + ") could not fetch sources: " + reason);
    }

    public static Gap malformedOutput(Subtopic subtopic, String reason) {
        return new Gap(GapKind.WORKER_MALFORMED_OUTPUT, subtopic.id(), subtopic.title(),
                "subtopic " + subtopic.id() + " (" + subtopic.title() + ") returned unusable output: " + reason);
    }

    public static Gap malformedDocument(Subtopic subtopic) {
        return new Gap(GapKind.MALFORMED_DOCUMENT, subtopic.id(), subtopic.title(),
                "subtopic " + subtopic.id() + " (" + subtopic.title() + ") returned malformed data");
    }

    public static Gap noClaims(Subtopic subtopic) {
        return new Gap(GapKind.NO_CLAIMS, subtopic.id(), subtopic.title(),
                "subtopic " + subtopic.id() + " (" + subtopic.title() + ") returned no claims");
    }

    public static Gap reported(Subtopic subtopic, String text) {
        return new Gap(GapKind.WORKER_REPORTED, subtopic.id(), subtopic.title(), text);
    }
}
