package com.github.k8soperators.conductor.execution;

import com.github.k8soperators.conductor.readiness.GateResult;

import java.util.List;
import java.util.Optional;

public final class PhaseResult {

    private final String phaseName;
    private final PhaseStatus status;
    private final List<ResourceReport> resources;
    private final GateResult gateResult;
    private final String error;

    public PhaseResult(String phaseName, PhaseStatus status, List<ResourceReport> resources, GateResult gateResult, String error) {
        this.phaseName = phaseName;
        this.status = status;
        this.resources = List.copyOf(resources);
        this.gateResult = gateResult;
        this.error = error;
    }

    public static PhaseResult skipped(String phaseName, String reason) {
        return new PhaseResult(phaseName, PhaseStatus.SKIPPED, List.of(), null, reason);
    }

    public String getPhaseName() {
        return phaseName;
    }

    public PhaseStatus getStatus() {
        return status;
    }

    public List<ResourceReport> getResources() {
        return resources;
    }

    public Optional<GateResult> getGateResult() {
        return Optional.ofNullable(gateResult);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public long countMutations() {
        return resources.stream().filter(r -> r.getOutcome().isMutation()).count();
    }

    @Override
    public String toString() {
        return String.format("PhaseResult{phase=%s, status=%s, resources=%s, error=%s}", phaseName, status, resources, error);
    }
}
