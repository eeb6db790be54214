package com.github.k8soperators.conductor.graph;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.model.Phase;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Kahn's algorithm over the {@code dependsOn} edges. When several phases become eligible at the same time the
 * one declared first wins, so runs and their logs are reproducible.
 */
@ApplicationScoped
public class DependencyGraphBuilder {

    private static final Logger log = Logger.getLogger(DependencyGraphBuilder.class);

    public PhaseGraph build(List<Phase> phases) throws ConfigurationException {
        Map<String, Integer> index = new LinkedHashMap<>();

        for (Phase phase : phases) {
            if (index.putIfAbsent(phase.getName(), index.size()) != null) {
                throw ConfigurationException.forField(phase.getName(), "name", "declared more than once");
            }
        }

        for (Phase phase : phases) {
            for (String dependency : phase.getDependsOn()) {
                if (!index.containsKey(dependency)) {
                    throw ConfigurationException.forField(phase.getName(), "dependsOn",
                            String.format("references unknown phase '%s'", dependency));
                }
            }
        }

        int[] inDegree = new int[phases.size()];
        Map<String, List<String>> dependents = new HashMap<>();

        for (Phase phase : phases) {
            for (String dependency : phase.getDependsOn().stream().distinct().collect(Collectors.toList())) {
                inDegree[index.get(phase.getName())]++;
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(phase.getName());
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }

        List<Phase> order = new ArrayList<>(phases.size());

        while (!ready.isEmpty()) {
            Phase next = phases.get(ready.poll());
            order.add(next);

            for (String dependent : dependents.getOrDefault(next.getName(), List.of())) {
                int i = index.get(dependent);
                if (--inDegree[i] == 0) {
                    ready.add(i);
                }
            }
        }

        if (order.size() < phases.size()) {
            throw new CycleDetectedException(findCycle(phases, index, inDegree));
        }

        Map<String, Phase> byName = new LinkedHashMap<>();
        order.forEach(p -> byName.put(p.getName(), p));

        log.debugf("Phase order: %s", order.stream().map(Phase::getName).collect(Collectors.joining(" -> ")));

        return new PhaseGraph(order, byName, dependents);
    }

    /**
     * Walks the dependency edges of the phases left over by Kahn's algorithm until a phase repeats. Every
     * leftover phase has at least one leftover dependency, so the walk always closes a loop.
     */
    static List<String> findCycle(List<Phase> phases, Map<String, Integer> index, int[] inDegree) {
        Phase start = null;
        for (int i = 0; i < inDegree.length && start == null; i++) {
            if (inDegree[i] > 0) {
                start = phases.get(i);
            }
        }

        List<String> path = new ArrayList<>();
        Phase current = start;

        while (current != null && !path.contains(current.getName())) {
            path.add(current.getName());
            current = current.getDependsOn()
                    .stream()
                    .filter(dep -> inDegree[index.get(dep)] > 0)
                    .map(dep -> phases.get(index.get(dep)))
                    .findFirst()
                    .orElse(null);
        }

        if (current == null) {
            return path;
        }

        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(current.getName()), path.size()));
        cycle.add(current.getName());
        // walked along dependsOn edges; report in execution direction
        Collections.reverse(cycle);
        return cycle;
    }
}
