package com.github.k8soperators.conductor.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.model.RetryPolicy;
import com.github.k8soperators.conductor.platform.PlatformClient;
import com.github.k8soperators.conductor.platform.ResourceDiff;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import com.github.k8soperators.conductor.retry.CancelledException;
import com.github.k8soperators.conductor.retry.FailureClassifier;
import com.github.k8soperators.conductor.retry.FailureKind;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import com.github.k8soperators.conductor.retry.RetryController;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.time.Duration;
import java.util.Optional;

/**
 * Create-or-update of a single descriptor, shared by the phase executor and the convergence reconciler. Existing
 * objects are only replaced when they differ from the declaration; an immutable-field conflict is resolved by
 * deleting the object and creating it again.
 */
@ApplicationScoped
public class ResourceApplier {

    private static final Logger log = Logger.getLogger(ResourceApplier.class);

    private final PlatformClient platform;
    private final RetryController retry;
    private final CancellationSignal cancellation;
    private final Duration recreateDelay;

    @Inject
    public ResourceApplier(PlatformClient platform,
            RetryController retry,
            CancellationSignal cancellation,
            @ConfigProperty(name = "conductor.conflict.recreate-delay", defaultValue = "3S") Duration recreateDelay) {
        this.platform = platform;
        this.retry = retry;
        this.cancellation = cancellation;
        this.recreateDelay = recreateDelay;
    }

    public ResourceReport apply(ResourceDescriptor descriptor, RetryPolicy policy, ExecutionState state) {
        ResourceRef ref = descriptor.getRef();
        RetryController.RetryListener listener = (attempt, cause) -> state.recordAttempt(cause.getMessage());

        try {
            try {
                return ResourceReport.of(descriptor, converge(descriptor, policy, listener));
            } catch (OrchestrationException e) {
                if (!e.isKind(FailureKind.CONFLICT)) {
                    throw e;
                }
                log.warnf("%s: conflicting with live state, deleting and recreating: %s", ref, e.getMessage());
                recreate(descriptor, policy, listener);
                return ResourceReport.of(descriptor, ResourceOutcome.RECREATED);
            }
        } catch (CancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            FailureKind kind = FailureClassifier.classify(e);
            String message = String.format("%s: %s failure: %s", ref, kind, e.getMessage());
            log.errorf("%s: apply failed (%s): %s", ref, kind, e.getMessage());
            state.recordAttempt(message);
            return ResourceReport.failed(descriptor, message);
        }
    }

    ResourceOutcome converge(ResourceDescriptor descriptor, RetryPolicy policy, RetryController.RetryListener listener) {
        ResourceRef ref = descriptor.getRef();
        GenericKubernetesResource desired = descriptor.toDesiredState();

        Optional<GenericKubernetesResource> live = retry.execute("get " + ref, policy, () -> platform.get(ref), listener);

        if (live.isEmpty()) {
            retry.execute("create " + ref, policy, () -> platform.create(desired), listener);
            log.infof("%s: created", ref);
            return ResourceOutcome.CREATED;
        }

        JsonNode patch = ResourceDiff.diff(live.get(), desired);

        if (patch.isEmpty()) {
            log.tracef("%s: unchanged", ref);
            return ResourceOutcome.UNCHANGED;
        }

        if (log.isDebugEnabled()) {
            log.debugf("%s: changed =>\n%s", ref, patch.toPrettyString());
        }

        desired.getMetadata().setResourceVersion(live.get().getMetadata().getResourceVersion());
        retry.execute("update " + ref, policy, () -> platform.update(desired), listener);
        log.infof("%s: updated", ref);
        return ResourceOutcome.UPDATED;
    }

    /**
     * One delete followed by a create. The create is retried under the phase policy while the old object is still
     * terminating, which bounds the whole recovery.
     */
    void recreate(ResourceDescriptor descriptor, RetryPolicy policy, RetryController.RetryListener listener) {
        ResourceRef ref = descriptor.getRef();

        boolean deleted = retry.execute("delete " + ref, policy, () -> platform.delete(ref), listener);
        log.debugf("%s: deleted for recreation (present=%s)", ref, deleted);

        cancellation.sleep(recreateDelay);

        retry.execute("recreate " + ref, policy, () -> {
            try {
                return platform.create(descriptor.toDesiredState());
            } catch (OrchestrationException e) {
                if (e.isKind(FailureKind.CONFLICT)) {
                    throw new OrchestrationException(FailureKind.TRANSIENT, ref + " still terminating: " + e.getMessage(), e);
                }
                throw e;
            }
        }, listener);

        log.warnf("%s: recreated after conflict", ref);
    }
}
