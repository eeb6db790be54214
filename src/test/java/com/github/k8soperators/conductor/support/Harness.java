package com.github.k8soperators.conductor.support;

import com.github.k8soperators.conductor.DeploymentOrchestrator;
import com.github.k8soperators.conductor.execution.PhaseExecutor;
import com.github.k8soperators.conductor.execution.ResourceApplier;
import com.github.k8soperators.conductor.model.RetryPolicy;
import com.github.k8soperators.conductor.readiness.ReadinessGate;
import com.github.k8soperators.conductor.readiness.ReadinessProbe;
import com.github.k8soperators.conductor.reconcile.ConvergenceReconciler;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import com.github.k8soperators.conductor.retry.RetryController;
import com.github.k8soperators.conductor.secrets.SecretsBootstrapCoordinator;
import com.github.k8soperators.conductor.status.StatusInspector;
import com.github.k8soperators.conductor.teardown.TeardownController;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The production object graph wired by hand around the in-memory fakes, with millisecond timings.
 */
public class Harness implements AutoCloseable {

    public static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0);
    public static final Duration POLL_INTERVAL = Duration.ofMillis(10);

    public final RecordingPlatformClient platform = new RecordingPlatformClient();
    public final InMemorySecretsEngine secretsEngine = new InMemorySecretsEngine();
    public final CancellationSignal cancellation = new CancellationSignal();
    public final RetryController retry = new RetryController(cancellation);
    public final ResourceApplier applier = new ResourceApplier(platform, retry, cancellation, Duration.ofMillis(1));
    public final ReadinessProbe probe = new ReadinessProbe(platform);
    public final ReadinessGate gate = new ReadinessGate(probe, cancellation, POLL_INTERVAL);
    public final SecretsBootstrapCoordinator coordinator = new SecretsBootstrapCoordinator(secretsEngine, platform, retry);
    public final ExecutorService workers = Executors.newFixedThreadPool(4);
    public final PhaseExecutor executor = new PhaseExecutor(applier, gate, coordinator, workers);
    public final DeploymentOrchestrator orchestrator = new DeploymentOrchestrator(executor, cancellation);
    public final ConvergenceReconciler reconciler = new ConvergenceReconciler(applier, cancellation, Duration.ofMillis(20));
    public final TeardownController teardown = new TeardownController(platform, retry, coordinator, cancellation, Duration.ofMillis(1));
    public final StatusInspector inspector = new StatusInspector(platform, gate);

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
