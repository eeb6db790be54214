package com.github.k8soperators.conductor.execution;

import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.readiness.GateResult;
import com.github.k8soperators.conductor.readiness.ReadinessGate;
import com.github.k8soperators.conductor.retry.CancelledException;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import com.github.k8soperators.conductor.secrets.SecretsBootstrapCoordinator;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Runs one phase: applies its descriptors concurrently on the shared worker pool, then blocks on the readiness
 * gate. A phase fails only when a required descriptor or a required check fails.
 */
@ApplicationScoped
public class PhaseExecutor {

    private static final Logger log = Logger.getLogger(PhaseExecutor.class);

    private final ResourceApplier applier;
    private final ReadinessGate gate;
    private final SecretsBootstrapCoordinator secrets;
    private final ExecutorService workers;

    @Inject
    public PhaseExecutor(ResourceApplier applier, ReadinessGate gate, SecretsBootstrapCoordinator secrets, ExecutorService workers) {
        this.applier = applier;
        this.gate = gate;
        this.secrets = secrets;
        this.workers = workers;
    }

    public PhaseResult execute(Phase phase, ExecutionState state) {
        state.transition(PhaseStatus.APPLYING);

        if (phase.isSecretsBootstrap()) {
            try {
                secrets.registerTrustAndRoles(phase, state);
            } catch (OrchestrationException e) {
                return fail(phase, state, List.of(), null, "secrets bootstrap: " + e.getMessage());
            }
        }

        List<ResourceReport> reports = applyResources(phase, state);

        Optional<ResourceReport> failedRequired = reports.stream()
                .filter(r -> r.isFailed() && r.isRequired())
                .findFirst();

        if (failedRequired.isPresent()) {
            return fail(phase, state, reports, null, failedRequired.get().getError());
        }

        reports.stream()
                .filter(ResourceReport::isFailed)
                .forEach(r -> log.warnf("Phase %s: optional resource failed: %s", phase.getName(), r.getError()));

        if (phase.isSecretsBootstrap()) {
            secrets.markDeclared(phase);
        }

        state.transition(PhaseStatus.WAITING);
        GateResult gateResult = gate.waitFor(phase.getHealthChecks(), phase.getTimeout());

        if (!gateResult.isOpen()) {
            String reason = gateResult.getFailedCheck()
                    .map(check -> String.format("%s not satisfied: %s", check.getCheck().getIdentifier(), check.getDetail()))
                    .orElse("readiness timed out");
            return fail(phase, state, reports, gateResult, reason);
        }

        if (phase.isSecretsBootstrap()) {
            secrets.markSynchronized(phase);
        }

        state.transition(PhaseStatus.SUCCEEDED);
        log.infof("Phase %s: succeeded (%d resource(s), gate %s)", phase.getName(), reports.size(), gateResult.getOutcome());
        return new PhaseResult(phase.getName(), PhaseStatus.SUCCEEDED, reports, gateResult, null);
    }

    /**
     * Applies every descriptor of the phase and waits for all of them. Per-resource failures are collected into the
     * reports; only cancellation escapes.
     */
    public List<ResourceReport> applyResources(Phase phase, ExecutionState state) {
        List<CompletableFuture<ResourceReport>> futures = new ArrayList<>();

        for (ResourceDescriptor descriptor : phase.getResources()) {
            futures.add(CompletableFuture.supplyAsync(() -> applier.apply(descriptor, phase.getRetryPolicy(), state), workers));
        }

        try {
            return futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof CancelledException) {
                throw (CancelledException) e.getCause();
            }
            throw e;
        }
    }

    PhaseResult fail(Phase phase, ExecutionState state, List<ResourceReport> reports, GateResult gateResult, String error) {
        PhaseStatus status = phase.isOptional() ? PhaseStatus.FAILED : PhaseStatus.FATAL;
        state.fail(status, error);

        if (status == PhaseStatus.FATAL) {
            log.errorf("Phase %s: fatal: %s", phase.getName(), error);
        } else {
            log.warnf("Phase %s: optional phase failed: %s", phase.getName(), error);
        }

        return new PhaseResult(phase.getName(), status, reports, gateResult, error);
    }
}
