package com.github.k8soperators.conductor.status;

import com.github.k8soperators.conductor.execution.ExecutionState;
import com.github.k8soperators.conductor.execution.PhaseStatus;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.platform.PlatformClient;
import com.github.k8soperators.conductor.platform.ResourceDiff;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.readiness.CheckResult;
import com.github.k8soperators.conductor.readiness.ReadinessGate;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds every phase's {@link ExecutionState} from live platform state, so that the outcome of a previous run can
 * be reported after its process has exited.
 */
@ApplicationScoped
public class StatusInspector {

    private static final Logger log = Logger.getLogger(StatusInspector.class);

    private final PlatformClient platform;
    private final ReadinessGate gate;

    @Inject
    public StatusInspector(PlatformClient platform, ReadinessGate gate) {
        this.platform = platform;
        this.gate = gate;
    }

    public List<PhaseStatusReport> inspect(PhaseGraph graph) {
        Map<String, PhaseStatusReport> reports = new LinkedHashMap<>();

        for (Phase phase : graph.order()) {
            reports.put(phase.getName(), inspect(phase, graph, reports));
        }

        return new ArrayList<>(reports.values());
    }

    PhaseStatusReport inspect(Phase phase, PhaseGraph graph, Map<String, PhaseStatusReport> earlier) {
        ExecutionState state = new ExecutionState(phase.getName());
        List<ResourceRef> missing = new ArrayList<>();
        List<ResourceRef> drifted = new ArrayList<>();
        int present = 0;
        boolean requiredPresent = false;

        for (ResourceDescriptor descriptor : phase.getResources()) {
            Optional<GenericKubernetesResource> live;
            try {
                live = platform.get(descriptor.getRef());
            } catch (OrchestrationException e) {
                log.debugf("%s: lookup failed: %s", descriptor.getRef(), e.getMessage());
                state.fail(failedStatus(phase), descriptor.getRef() + ": lookup failed: " + e.getMessage());
                return new PhaseStatusReport(state, present, missing, drifted, List.of());
            }

            if (live.isEmpty()) {
                if (descriptor.isRequired()) {
                    missing.add(descriptor.getRef());
                }
                continue;
            }

            present++;
            requiredPresent |= descriptor.isRequired();
            if (!ResourceDiff.isInSync(live.get(), descriptor.toDesiredState())) {
                drifted.add(descriptor.getRef());
            }
        }

        Optional<PhaseStatusReport> blocking = phase.getDependsOn()
                .stream()
                .map(earlier::get)
                .filter(dependency -> !dependency.getState().getStatus()
                        .releasesDependents(graph.get(dependency.getState().getPhaseName()).isOptional()))
                .findFirst();

        if (blocking.isPresent() && present == 0) {
            ExecutionState dependency = blocking.get().getState();
            PhaseStatus status = dependency.getStatus() == PhaseStatus.PENDING ? PhaseStatus.PENDING : PhaseStatus.SKIPPED;
            state.fail(status, String.format("dependency '%s' is %s", dependency.getPhaseName(), dependency.getStatus()));
            return new PhaseStatusReport(state, present, missing, drifted, List.of());
        }

        if (!missing.isEmpty() && !requiredPresent) {
            state.transition(PhaseStatus.PENDING);
            return new PhaseStatusReport(state, present, missing, drifted, List.of());
        }

        if (!missing.isEmpty()) {
            state.fail(failedStatus(phase), "missing " + missing);
            return new PhaseStatusReport(state, present, missing, drifted, List.of());
        }

        List<CheckResult> checks = gate.evaluateOnce(phase.getHealthChecks());
        Optional<CheckResult> unsatisfied = checks.stream()
                .filter(check -> !check.isSatisfied() && check.getCheck().isRequired())
                .findFirst();

        if (unsatisfied.isPresent()) {
            state.fail(failedStatus(phase), unsatisfied.get().toString());
        } else {
            state.transition(PhaseStatus.SUCCEEDED);
        }

        return new PhaseStatusReport(state, present, missing, drifted, checks);
    }

    static PhaseStatus failedStatus(Phase phase) {
        return phase.isOptional() ? PhaseStatus.FAILED : PhaseStatus.FATAL;
    }
}
