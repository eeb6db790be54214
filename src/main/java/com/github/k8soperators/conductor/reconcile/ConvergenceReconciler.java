package com.github.k8soperators.conductor.reconcile;

import com.github.k8soperators.conductor.execution.ExecutionState;
import com.github.k8soperators.conductor.execution.ResourceApplier;
import com.github.k8soperators.conductor.execution.ResourceReport;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import com.github.k8soperators.conductor.retry.CancelledException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.annotation.PreDestroy;
import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Periodically re-applies every descriptor in phase order so that drift is corrected early phases first. Passes run
 * on one dedicated thread and never overlap. A failing pass is logged and reported; the loop keeps going.
 */
@ApplicationScoped
public class ConvergenceReconciler {

    private static final Logger log = Logger.getLogger(ConvergenceReconciler.class);

    private final ResourceApplier applier;
    private final CancellationSignal cancellation;
    private final Duration interval;
    private final ExecutorService loop = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "conductor-reconciler");
        thread.setDaemon(true);
        return thread;
    });

    @Inject
    public ConvergenceReconciler(ResourceApplier applier,
            CancellationSignal cancellation,
            @ConfigProperty(name = "conductor.reconcile.interval", defaultValue = "1M") Duration interval) {
        this.applier = applier;
        this.cancellation = cancellation;
        this.interval = interval;
    }

    public ReconcileReport reconcileOnce(PhaseGraph graph) {
        return reconcileOnce(graph, graph.order().stream().map(Phase::getName).collect(Collectors.toSet()));
    }

    /**
     * One pass over the given phases, in execution order.
     */
    public ReconcileReport reconcileOnce(PhaseGraph graph, Set<String> phaseNames) {
        Map<String, List<ResourceReport>> reports = new LinkedHashMap<>();

        for (Phase phase : graph.order()) {
            if (!phaseNames.contains(phase.getName())) {
                continue;
            }

            ExecutionState state = new ExecutionState(phase.getName());
            List<ResourceReport> phaseReports = new ArrayList<>();

            for (ResourceDescriptor descriptor : phase.getResources()) {
                cancellation.throwIfCancelled();
                phaseReports.add(applier.apply(descriptor, phase.getRetryPolicy(), state));
            }

            reports.put(phase.getName(), phaseReports);
        }

        ReconcileReport report = new ReconcileReport(reports);

        if (report.hasFailures()) {
            report.getFailures().forEach(failure -> log.warnf("Reconcile: %s", failure));
        }
        log.infof("Reconcile pass complete: %s", report);
        return report;
    }

    /**
     * Runs passes until cancelled, sleeping {@code conductor.reconcile.interval} between them.
     */
    public void runContinuously(PhaseGraph graph, Set<String> phaseNames) {
        log.infof("Convergence loop started, interval %s", interval);

        try {
            while (!cancellation.isCancelled()) {
                try {
                    reconcileOnce(graph, phaseNames);
                } catch (CancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.errorf(e, "Reconcile pass failed");
                }
                cancellation.sleep(interval);
            }
        } catch (CancelledException e) {
            log.infof("Convergence loop stopped: %s", e.getMessage());
        }
    }

    public CompletableFuture<Void> start(PhaseGraph graph, Set<String> phaseNames) {
        return CompletableFuture.runAsync(() -> runContinuously(graph, phaseNames), loop);
    }

    @PreDestroy
    void stop() {
        loop.shutdownNow();
    }
}
