package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.reconcile.ConvergenceReconciler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import javax.inject.Inject;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * A single convergence pass. Failures are printed, never turned into a non-zero exit code.
 */
@Command(name = "reconcile", mixinStandardHelpOptions = true, description = "Re-apply drifted resources once")
public class ReconcileCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--plan", paramLabel = "FILE", description = "Phase plan file (default: conductor.plan-path)")
    Path plan;

    private final PlanService plans;
    private final ConvergenceReconciler reconciler;

    @Inject
    public ReconcileCommand(PlanService plans, ConvergenceReconciler reconciler) {
        this.plans = plans;
        this.reconciler = reconciler;
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

        ReportPrinter.print(spec.commandLine().getOut(), reconciler.reconcileOnce(graph));
        return 0;
    }
}
