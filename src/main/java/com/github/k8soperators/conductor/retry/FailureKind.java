package com.github.k8soperators.conductor.retry;

public enum FailureKind {

    /**
     * Timeouts and temporary unavailability. Retried with exponential backoff.
     */
    TRANSIENT,

    /**
     * Immutable field mismatch or already-exists-with-different-spec. Resolved by delete and recreate.
     */
    CONFLICT,

    /**
     * Invalid configuration, missing prerequisite or authorization denied. Never retried.
     */
    FATAL
}
