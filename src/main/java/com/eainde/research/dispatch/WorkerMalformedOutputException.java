package com.eainde.research.dispatch;

/**
 * The worker answered, but its answer is not a findings document.
 */
public class WorkerMalformedOutputException extends ResearchWorkerException {

    public WorkerMalformedOutputException(String message) {
        super(message);
    }

    public WorkerMalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
