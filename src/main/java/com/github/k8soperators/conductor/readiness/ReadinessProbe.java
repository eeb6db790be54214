package com.github.k8soperators.conductor.readiness;

import com.github.k8soperators.conductor.model.ReadinessCheck;
import com.github.k8soperators.conductor.platform.PlatformClient;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Evaluates a single {@link ReadinessCheck} against live state, once.
 */
@ApplicationScoped
public class ReadinessProbe {

    private static final Logger log = Logger.getLogger(ReadinessProbe.class);

    private final PlatformClient platform;

    @Inject
    public ReadinessProbe(PlatformClient platform) {
        this.platform = platform;
    }

    public CheckResult evaluate(ReadinessCheck check) {
        List<GenericKubernetesResource> targets;

        try {
            targets = targets(check);
        } catch (OrchestrationException e) {
            log.debugf("%s: lookup failed: %s", check.getIdentifier(), e.getMessage());
            return CheckResult.unsatisfied(check, "lookup failed: " + e.getMessage());
        }

        if (targets.isEmpty()) {
            return CheckResult.unsatisfied(check, "not found");
        }

        switch (check.getCondition()) {
            case EXISTS:
                return CheckResult.satisfied(check);
            case WORKLOAD_AVAILABLE:
                return all(check, targets, ReadinessProbe::workloadAvailable, "not available");
            case PODS_READY:
                return all(check, targets, r -> "True".equals(conditionStatus(r, "Ready")), "pods not ready");
            case CRD_ESTABLISHED:
                return all(check, targets, r -> "True".equals(conditionStatus(r, "Established")), "not established");
            case SECRET_MATERIALIZED:
                return all(check, targets, ReadinessProbe::secretMaterialized, "empty");
            case GITOPS_SYNCED:
                return all(check, targets, r -> "True".equals(conditionStatus(r, "Ready")), "not synced");
            default:
                throw new IllegalStateException("Unsupported condition " + check.getCondition());
        }
    }

    List<GenericKubernetesResource> targets(ReadinessCheck check) {
        if (check.isNameSelector()) {
            return platform.get(new ResourceRef(check.getApiVersion(), check.getTargetKind(), check.getNamespace(), check.getName()))
                    .map(List::of)
                    .orElseGet(List::of);
        }
        return platform.list(check.getApiVersion(), check.getTargetKind(), check.getNamespace(), check.getLabels());
    }

    static CheckResult all(ReadinessCheck check, List<GenericKubernetesResource> targets,
            Predicate<GenericKubernetesResource> ready, String problem) {
        return targets.stream()
                .filter(ready.negate())
                .findFirst()
                .map(r -> CheckResult.unsatisfied(check, String.format("%s %s", r.getMetadata().getName(), problem)))
                .orElseGet(() -> CheckResult.satisfied(check));
    }

    static boolean workloadAvailable(GenericKubernetesResource workload) {
        switch (workload.getKind()) {
            case "Deployment":
                return "True".equals(conditionStatus(workload, "Available"));
            case "StatefulSet": {
                long desired = number(field(workload, "spec", "replicas")).orElse(1L);
                long ready = number(field(workload, "status", "readyReplicas")).orElse(0L);
                return ready >= desired;
            }
            case "DaemonSet": {
                Optional<Long> desired = number(field(workload, "status", "desiredNumberScheduled"));
                long ready = number(field(workload, "status", "numberReady")).orElse(0L);
                return desired.isPresent() && ready >= desired.get();
            }
            default:
                return "True".equals(conditionStatus(workload, "Ready"))
                        || "True".equals(conditionStatus(workload, "Available"));
        }
    }

    static boolean secretMaterialized(GenericKubernetesResource secret) {
        Object data = secret.getAdditionalProperties().get("data");

        if (!(data instanceof Map)) {
            return false;
        }

        return ((Map<?, ?>) data).values()
                .stream()
                .filter(Objects::nonNull)
                .map(String::valueOf)
                .anyMatch(value -> !value.isEmpty());
    }

    static String conditionStatus(GenericKubernetesResource resource, String type) {
        Object conditions = field(resource, "status", "conditions");

        if (!(conditions instanceof List)) {
            return null;
        }

        for (Object condition : (List<?>) conditions) {
            if (condition instanceof Map && type.equals(((Map<?, ?>) condition).get("type"))) {
                return String.valueOf(((Map<?, ?>) condition).get("status"));
            }
        }

        return null;
    }

    static Object field(GenericKubernetesResource resource, String... path) {
        Object current = resource.getAdditionalProperties();

        for (String key : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(key);
        }

        return current;
    }

    static Optional<Long> number(Object value) {
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        return Optional.empty();
    }
}
