package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * What a single worker is asked to research, plus the sibling subtopics it must stay out of.
 *
 * @param subtopic      the subtopic to research
 * @param coveredTopics titles of every other subtopic in the same run, in subtopic order
 */
public record ResearchAssignment(
        @JsonProperty("subtopic")       Subtopic subtopic,
        @JsonProperty("covered_topics") List<String> coveredTopics
) implements Serializable {

    public ResearchAssignment {
        coveredTopics = coveredTopics != null ? List.copyOf(coveredTopics) : List.of();
    }

    public static ResearchAssignment forSubtopic(Subtopic subtopic, List<Subtopic> all) {
        List<String> others = all.stream()
                .filter(s -> s.id() != subtopic.id())
                .map(Subtopic::title)
                .distinct()
                .toList();
        return new ResearchAssignment(subtopic, others);
    }

    @JsonIgnore
    public List<String> keywords() {
        return subtopic.keywords();
    }

    @JsonIgnore
    public String angle() {
        return subtopic.angle();
    }
}
