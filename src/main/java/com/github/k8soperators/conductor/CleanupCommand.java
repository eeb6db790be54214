package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.teardown.TeardownController;
import com.github.k8soperators.conductor.teardown.TeardownReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import javax.inject.Inject;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Delete every phase's resources in reverse order")
public class CleanupCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--plan", paramLabel = "FILE", description = "Phase plan file (default: conductor.plan-path)")
    Path plan;

    private final PlanService plans;
    private final TeardownController teardown;

    @Inject
    public CleanupCommand(PlanService plans, TeardownController teardown) {
        this.plans = plans;
        this.teardown = teardown;
    }

    @Override
    public Integer call() {
        PhaseGraph graph;
        try {
            graph = plans.prepare(plan, true);
        } catch (ConfigurationException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        TeardownReport report = teardown.teardown(graph);
        ReportPrinter.print(spec.commandLine().getOut(), report);
        return report.exitCode();
    }
}
