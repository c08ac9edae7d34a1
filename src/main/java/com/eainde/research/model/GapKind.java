package com.eainde.research.model;

/**
 * Why a gap was recorded.
 */
public enum GapKind {
    WORKER_TIMEOUT,
    WORKER_MALFORMED_OUTPUT,
    WORKER_FETCH_FAILURE,
    MALFORMED_DOCUMENT,
    WORKER_REPORTED,
    NO_CLAIMS
}
