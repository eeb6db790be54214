package com.github.k8soperators.conductor.graph;

import com.github.k8soperators.conductor.model.Phase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, acyclic set of phases together with one deterministic topological order.
 */
public final class PhaseGraph {

    private final List<Phase> order;
    private final Map<String, Phase> phases;
    private final Map<String, List<String>> dependents;

    PhaseGraph(List<Phase> order, Map<String, Phase> phases, Map<String, List<String>> dependents) {
        this.order = List.copyOf(order);
        this.phases = Collections.unmodifiableMap(phases);
        this.dependents = Collections.unmodifiableMap(dependents);
    }

    public List<Phase> order() {
        return order;
    }

    public List<Phase> reverseOrder() {
        List<Phase> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        return reversed;
    }

    public Phase get(String name) {
        return Optional.ofNullable(phases.get(name))
                .orElseThrow(() -> new NoSuchElementException("Unknown phase: " + name));
    }

    public boolean contains(String name) {
        return phases.containsKey(name);
    }

    public List<String> directDependents(String name) {
        return dependents.getOrDefault(name, List.of());
    }

    /**
     * Every phase that depends on {@code name} directly or through other phases, in breadth-first order.
     */
    public Set<String> transitiveDependents(String name) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(directDependents(name));

        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (result.add(next)) {
                queue.addAll(directDependents(next));
            }
        }

        return result;
    }

    public int size() {
        return order.size();
    }
}
