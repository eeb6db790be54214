package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.execution.PhaseResult;
import com.github.k8soperators.conductor.execution.PhaseStatus;
import com.github.k8soperators.conductor.execution.RunReport;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.reconcile.ConvergenceReconciler;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import javax.inject.Inject;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "deploy", mixinStandardHelpOptions = true, description = "Run every phase in dependency order")
public class DeployCommand implements Callable<Integer> {

    private static final Logger log = Logger.getLogger(DeployCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = "--plan", paramLabel = "FILE", description = "Phase plan file (default: conductor.plan-path)")
    Path plan;

    @Option(names = "--watch", description = "Keep reconciling drift after the rollout until interrupted")
    boolean watch;

    private final PlanService plans;
    private final DeploymentOrchestrator orchestrator;
    private final ConvergenceReconciler reconciler;
    private final CancellationSignal cancellation;

    @Inject
    public DeployCommand(PlanService plans, DeploymentOrchestrator orchestrator, ConvergenceReconciler reconciler,
            CancellationSignal cancellation) {
        this.plans = plans;
        this.orchestrator = orchestrator;
        this.reconciler = reconciler;
        this.cancellation = cancellation;
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

        Thread hook = new Thread(() -> cancellation.cancel("interrupted by operator"), "conductor-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            RunReport report = orchestrator.deploy(graph);
            ReportPrinter.print(spec.commandLine().getOut(), report);

            if (watch && !cancellation.isCancelled()) {
                Set<String> converged = report.getResults()
                        .stream()
                        .filter(r -> r.getStatus() == PhaseStatus.SUCCEEDED)
                        .map(PhaseResult::getPhaseName)
                        .collect(Collectors.toSet());
                log.infof("Watching %d phase(s) for drift", converged.size());
                reconciler.start(graph, converged).join();
            }

            return report.exitCode();
        } finally {
            removeHook(hook);
        }
    }

    static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debugf("Shutdown in progress, hook stays registered");
        }
    }
}
