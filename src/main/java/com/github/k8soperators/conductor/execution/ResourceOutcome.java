package com.github.k8soperators.conductor.execution;

public enum ResourceOutcome {

    CREATED,
    UPDATED,
    UNCHANGED,
    /**
     * Deleted and created again after an immutable-field conflict.
     */
    RECREATED,
    FAILED;

    public boolean isMutation() {
        return this == CREATED || this == UPDATED || this == RECREATED;
    }
}
