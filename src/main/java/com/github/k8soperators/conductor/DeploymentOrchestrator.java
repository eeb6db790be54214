package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.execution.ExecutionState;
import com.github.k8soperators.conductor.execution.PhaseExecutor;
import com.github.k8soperators.conductor.execution.PhaseResult;
import com.github.k8soperators.conductor.execution.PhaseStatus;
import com.github.k8soperators.conductor.execution.RunReport;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import com.github.k8soperators.conductor.retry.CancelledException;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single control loop of a rollout. Phases run strictly in topological order; a phase starts only when every
 * dependency succeeded or is an optional phase that failed or was skipped. Anything else skips the phase, which in
 * turn skips its own dependents.
 */
@ApplicationScoped
public class DeploymentOrchestrator {

    private static final Logger log = Logger.getLogger(DeploymentOrchestrator.class);

    private final PhaseExecutor executor;
    private final CancellationSignal cancellation;

    @Inject
    public DeploymentOrchestrator(PhaseExecutor executor, CancellationSignal cancellation) {
        this.executor = executor;
        this.cancellation = cancellation;
    }

    public RunReport deploy(PhaseGraph graph) {
        Map<String, PhaseResult> results = new LinkedHashMap<>();
        String abortReason = null;

        log.infof("Deploying %d phase(s): %s", graph.size(), graph.order());

        for (Phase phase : graph.order()) {
            ExecutionState state = new ExecutionState(phase.getName());

            Optional<String> skipReason = Optional.ofNullable(abortReason)
                    .or(() -> cancellation.isCancelled() ? Optional.of("cancelled: " + cancellation.getReason()) : Optional.empty())
                    .or(() -> blockedBy(phase, graph, results));

            if (skipReason.isPresent()) {
                state.fail(PhaseStatus.SKIPPED, skipReason.get());
                log.infof("Phase %s: skipped, %s", phase.getName(), skipReason.get());
                results.put(phase.getName(), PhaseResult.skipped(phase.getName(), skipReason.get()));
                continue;
            }

            PhaseResult result;
            try {
                result = executor.execute(phase, state);
            } catch (CancelledException e) {
                String reason = "cancelled: " + e.getMessage();
                state.fail(PhaseStatus.FATAL, reason);
                log.errorf("Phase %s: %s", phase.getName(), reason);
                result = new PhaseResult(phase.getName(), PhaseStatus.FATAL, List.of(), null, reason);
            }

            results.put(phase.getName(), result);

            if (phase.isSecretsBootstrap() && result.getStatus() == PhaseStatus.FATAL) {
                abortReason = String.format("secrets bootstrap phase '%s' failed", phase.getName());
                log.errorf("Aborting rollout: %s", abortReason);
            }
        }

        RunReport report = new RunReport(new ArrayList<>(results.values()));
        log.infof("Rollout finished with exit code %d", report.exitCode());
        return report;
    }

    static Optional<String> blockedBy(Phase phase, PhaseGraph graph, Map<String, PhaseResult> results) {
        for (String dependency : phase.getDependsOn()) {
            PhaseStatus status = Optional.ofNullable(results.get(dependency))
                    .map(PhaseResult::getStatus)
                    .orElse(PhaseStatus.PENDING);

            if (!status.releasesDependents(graph.get(dependency).isOptional())) {
                return Optional.of(String.format("dependency '%s' is %s", dependency, status));
            }
        }
        return Optional.empty();
    }
}
