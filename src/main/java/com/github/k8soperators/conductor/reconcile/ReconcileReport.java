package com.github.k8soperators.conductor.reconcile;

import com.github.k8soperators.conductor.execution.ResourceOutcome;
import com.github.k8soperators.conductor.execution.ResourceReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class ReconcileReport {

    private final Map<String, List<ResourceReport>> phases;

    public ReconcileReport(Map<String, List<ResourceReport>> phases) {
        this.phases = new LinkedHashMap<>(phases);
    }

    public Map<String, List<ResourceReport>> getPhases() {
        return phases;
    }

    public long count(ResourceOutcome outcome) {
        return phases.values()
                .stream()
                .flatMap(List::stream)
                .filter(r -> r.getOutcome() == outcome)
                .count();
    }

    public boolean hasFailures() {
        return count(ResourceOutcome.FAILED) > 0;
    }

    public List<ResourceReport> getFailures() {
        return phases.values()
                .stream()
                .flatMap(List::stream)
                .filter(ResourceReport::isFailed)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("created=%d, updated=%d, recreated=%d, unchanged=%d, failed=%d",
                count(ResourceOutcome.CREATED),
                count(ResourceOutcome.UPDATED),
                count(ResourceOutcome.RECREATED),
                count(ResourceOutcome.UNCHANGED),
                count(ResourceOutcome.FAILED));
    }
}
