package com.eainde.research.model;

import java.io.Serializable;

/**
 * Dispatcher output for one subtopic: the worker's document, or an empty document
 * tagged with the gap that explains why the worker failed.
 */
public record SubtopicFindings(Subtopic subtopic, FindingsDocument document, Gap failure) implements Serializable {

    public static SubtopicFindings completed(Subtopic subtopic, FindingsDocument document) {
        return new SubtopicFindings(subtopic, document, null);
    }

    public static SubtopicFindings failed(Subtopic subtopic, Gap failure) {
        return new SubtopicFindings(subtopic, FindingsDocument.empty(subtopic.title()), failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
