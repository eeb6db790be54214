package com.github.k8soperators.conductor.execution;

public enum PhaseStatus {

    PENDING,
    APPLYING,
    WAITING,
    SUCCEEDED,
    /**
     * Required work of an optional phase failed. Dependents still run.
     */
    FAILED,
    SKIPPED,
    FATAL;

    /**
     * Whether dependents of a phase in this status may start.
     */
    public boolean releasesDependents(boolean optionalPhase) {
        return this == SUCCEEDED || optionalPhase && (this == FAILED || this == SKIPPED);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == FATAL;
    }
}
