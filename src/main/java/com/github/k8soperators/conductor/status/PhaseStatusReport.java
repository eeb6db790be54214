package com.github.k8soperators.conductor.status;

import com.github.k8soperators.conductor.execution.ExecutionState;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.readiness.CheckResult;

import java.util.List;

/**
 * Live view of one phase: the recomputed {@link ExecutionState} plus the observations it was derived from.
 */
public final class PhaseStatusReport {

    private final ExecutionState state;
    private final int present;
    private final List<ResourceRef> missing;
    private final List<ResourceRef> drifted;
    private final List<CheckResult> checks;

    public PhaseStatusReport(ExecutionState state, int present, List<ResourceRef> missing, List<ResourceRef> drifted, List<CheckResult> checks) {
        this.state = state;
        this.present = present;
        this.missing = List.copyOf(missing);
        this.drifted = List.copyOf(drifted);
        this.checks = List.copyOf(checks);
    }

    public ExecutionState getState() {
        return state;
    }

    public int getPresent() {
        return present;
    }

    public List<ResourceRef> getMissing() {
        return missing;
    }

    public List<ResourceRef> getDrifted() {
        return drifted;
    }

    public List<CheckResult> getChecks() {
        return checks;
    }
}
