package com.eainde.research.dispatch;

/**
 * A worker could not produce a findings document. Always recovered by the dispatcher.
 */
public abstract class ResearchWorkerException extends Exception {

    protected ResearchWorkerException(String message) {
        super(message);
    }

    protected ResearchWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
