package com.eainde.research.dispatch;

/**
 * The worker's fetch layer (search, page fetch, model call) failed.
 */
public class WorkerFetchException extends ResearchWorkerException {

    public WorkerFetchException(String message) {
        super(message);
    }

    public WorkerFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
