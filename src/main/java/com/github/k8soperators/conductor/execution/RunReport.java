package com.github.k8soperators.conductor.execution;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one {@code deploy} run, in execution order.
 */
public final class RunReport {

    private final List<PhaseResult> results;

    public RunReport(List<PhaseResult> results) {
        this.results = List.copyOf(results);
    }

    public List<PhaseResult> getResults() {
        return results;
    }

    public Optional<PhaseResult> get(String phaseName) {
        return results.stream().filter(r -> r.getPhaseName().equals(phaseName)).findFirst();
    }

    public boolean hasFatal() {
        return results.stream().anyMatch(r -> r.getStatus() == PhaseStatus.FATAL);
    }

    public int exitCode() {
        return hasFatal() ? 1 : 0;
    }
}
