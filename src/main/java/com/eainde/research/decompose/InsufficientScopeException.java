package com.eainde.research.decompose;

import com.eainde.research.model.Depth;

/**
 * The query is too narrow to split into the requested number of subtopics without overlap.
 * Fatal to the run.
 */
public class InsufficientScopeException extends RuntimeException {

    private final Depth requestedDepth;
    private final Depth suggestedDepth;

    public InsufficientScopeException(String message, Depth requestedDepth, Depth suggestedDepth) {
        super(message);
        this.requestedDepth = requestedDepth;
        this.suggestedDepth = suggestedDepth;
    }

    public Depth getRequestedDepth() {
        return requestedDepth;
    }

    /**
     * @return a shallower depth that decomposes cleanly, or {@code null} if none does
     */
    public Depth getSuggestedDepth() {
        return suggestedDepth;
    }

    public String getSuggestion() {
        if (suggestedDepth != null) {
            return "Reduce depth to '" + suggestedDepth.label() + "' ("
                    + suggestedDepth.subtopicCount() + " subtopics).";
        }
        return "Broaden or rephrase the query; no depth yields non-overlapping subtopics.";
    }
}
