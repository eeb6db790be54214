package com.github.k8soperators.conductor.teardown;

import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.platform.PlatformClient;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import com.github.k8soperators.conductor.retry.CancelledException;
import com.github.k8soperators.conductor.retry.RetryController;
import com.github.k8soperators.conductor.secrets.SecretsBootstrapCoordinator;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deletes every phase's descriptors in reverse dependency order. Never waits for readiness and never stops at a
 * failing item; already-absent objects count as deleted.
 */
@ApplicationScoped
public class TeardownController {

    private static final Logger log = Logger.getLogger(TeardownController.class);

    private final PlatformClient platform;
    private final RetryController retry;
    private final SecretsBootstrapCoordinator secrets;
    private final CancellationSignal cancellation;
    private final Duration gracePeriod;

    @Inject
    public TeardownController(PlatformClient platform,
            RetryController retry,
            SecretsBootstrapCoordinator secrets,
            CancellationSignal cancellation,
            @ConfigProperty(name = "conductor.teardown.grace-period", defaultValue = "2S") Duration gracePeriod) {
        this.platform = platform;
        this.retry = retry;
        this.secrets = secrets;
        this.cancellation = cancellation;
        this.gracePeriod = gracePeriod;
    }

    public TeardownReport teardown(PhaseGraph graph) {
        TeardownReport report = new TeardownReport();

        for (Phase phase : graph.reverseOrder()) {
            log.infof("Phase %s: tearing down", phase.getName());
            int deletedBefore = report.getDeleted().size();

            List<ResourceDescriptor> descriptors = new ArrayList<>(phase.getResources());
            Collections.reverse(descriptors);

            for (ResourceDescriptor descriptor : descriptors) {
                delete(phase, descriptor.getRef(), report);
            }

            if (phase.isSecretsBootstrap()) {
                try {
                    secrets.revoke(phase).forEach(report::failed);
                } catch (CancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warnf(e, "Phase %s: could not revoke secrets engine roles", phase.getName());
                    report.failed(phase.getName() + ": " + e.getMessage());
                }
            }

            if (report.getDeleted().size() > deletedBefore) {
                cancellation.sleep(gracePeriod);
            }
        }

        log.infof("Teardown finished: %s", report);
        return report;
    }

    void delete(Phase phase, ResourceRef ref, TeardownReport report) {
        try {
            if (retry.execute("delete " + ref, phase.getRetryPolicy(), () -> platform.delete(ref))) {
                log.infof("%s: deleted", ref);
                report.deleted(ref);
            } else {
                log.debugf("%s: already absent", ref);
                report.absent(ref);
            }
        } catch (CancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warnf("%s: delete failed, continuing: %s", ref, e.getMessage());
            report.failed(ref + ": " + e.getMessage());
        }
    }
}
