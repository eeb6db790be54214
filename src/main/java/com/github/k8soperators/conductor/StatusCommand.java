package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.execution.PhaseStatus;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.status.PhaseStatusReport;
import com.github.k8soperators.conductor.status.StatusInspector;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import javax.inject.Inject;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "status", mixinStandardHelpOptions = true, description = "Report every phase's state from live inspection")
public class StatusCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--plan", paramLabel = "FILE", description = "Phase plan file (default: conductor.plan-path)")
    Path plan;

    private final PlanService plans;
    private final StatusInspector inspector;

    @Inject
    public StatusCommand(PlanService plans, StatusInspector inspector) {
        this.plans = plans;
        this.inspector = inspector;
    }

    @Override
    public Integer call() {
        PhaseGraph graph;
        try {
            graph = plans.prepare(plan, false);
        } catch (ConfigurationException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        List<PhaseStatusReport> reports = inspector.inspect(graph);
        ReportPrinter.print(spec.commandLine().getOut(), reports);

        return reports.stream().anyMatch(r -> r.getState().getStatus() == PhaseStatus.FATAL) ? 1 : 0;
    }
}
