package com.eainde.research.workflow;

/**
 * Unexpected failure of a research run that is neither a scope problem nor a recoverable
 * worker failure.
 */
public class ResearchPipelineException extends RuntimeException {

    public ResearchPipelineException(String message) {
        super(message);
    }

    public ResearchPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
