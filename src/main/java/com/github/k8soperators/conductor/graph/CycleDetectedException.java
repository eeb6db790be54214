package com.github.k8soperators.conductor.graph;

import com.github.k8soperators.conductor.config.ConfigurationException;

import java.util.List;

public class CycleDetectedException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Phase names along the cycle, with the first name repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
