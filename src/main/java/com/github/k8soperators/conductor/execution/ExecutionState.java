package com.github.k8soperators.conductor.execution;

import org.jboss.logging.Logger;

/**
 * Per-phase, per-run progress. Never persisted: a later run rebuilds it from live platform inspection.
 */
public class ExecutionState {

    private static final Logger log = Logger.getLogger(ExecutionState.class);

    private final String phaseName;
    private PhaseStatus status = PhaseStatus.PENDING;
    private int attempt;
    private String lastError;

    public ExecutionState(String phaseName) {
        this.phaseName = phaseName;
    }

    public String getPhaseName() {
        return phaseName;
    }

    public synchronized PhaseStatus getStatus() {
        return status;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized void transition(PhaseStatus next) {
        if (status != next) {
            log.infof("Phase %s: %s -> %s", phaseName, status, next);
            status = next;
        }
    }

    public synchronized void fail(PhaseStatus next, String error) {
        transition(next);
        lastError = error;
    }

    public synchronized void recordAttempt(String error) {
        attempt++;
        lastError = error;
    }

    @Override
    public synchronized String toString() {
        return String.format("ExecutionState{phase=%s, status=%s, attempt=%d, lastError=%s}", phaseName, status, attempt, lastError);
    }
}
