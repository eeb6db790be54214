package com.github.k8soperators.conductor.status;

import com.github.k8soperators.conductor.config.ConfigurationException;
import com.github.k8soperators.conductor.execution.PhaseStatus;
import com.github.k8soperators.conductor.graph.DependencyGraphBuilder;
import com.github.k8soperators.conductor.graph.PhaseGraph;
import com.github.k8soperators.conductor.model.ConditionType;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.support.Harness;
import com.github.k8soperators.conductor.support.Phases;
import com.github.k8soperators.conductor.support.Resources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class StatusInspectorTest {

    private final Harness harness = new Harness();

    private final ResourceRef storage = new ResourceRef("v1", "ConfigMap", "platform", "object-storage");
    private final ResourceRef storageSettings = new ResourceRef("v1", "ConfigMap", "kyuubi", "minio-settings");

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void nothingDeployedYetIsPending() throws ConfigurationException {
        List<PhaseStatusReport> reports = harness.inspector.inspect(graph());

        assertThat(statuses(reports)).containsExactly(
                "namespaces=PENDING", "object-storage=PENDING", "query-engine=PENDING");
        assertThat(reports.get(1).getState().getLastError()).isEqualTo("dependency 'namespaces' is PENDING");
    }

    @Test
    void deployedPlanIsSucceededAndDriftIsReported() throws ConfigurationException {
        PhaseGraph graph = graph();
        harness.orchestrator.deploy(graph);

        var live = harness.platform.find(storageSettings).orElseThrow();
        live.setAdditionalProperty("data", Map.of("endpoint", "changed"));
        harness.platform.put(live);

        List<PhaseStatusReport> reports = harness.inspector.inspect(graph);

        assertThat(statuses(reports)).containsOnly(
                "namespaces=SUCCEEDED", "object-storage=SUCCEEDED", "query-engine=SUCCEEDED");
        assertThat(reports.get(1).getDrifted()).containsExactly(storageSettings);
        assertThat(reports.get(1).getPresent()).isEqualTo(2);
        assertThat(harness.platform.mutations()).isEqualTo(4);
    }

    @Test
    void partiallyPresentPhaseIsFatal() throws ConfigurationException {
        PhaseGraph graph = graph();
        harness.orchestrator.deploy(graph);
        harness.platform.delete(storage);

        List<PhaseStatusReport> reports = harness.inspector.inspect(graph);

        PhaseStatusReport objectStorage = reports.get(1);
        assertThat(objectStorage.getState().getStatus()).isEqualTo(PhaseStatus.FATAL);
        assertThat(objectStorage.getMissing()).containsExactly(storage);
        assertThat(objectStorage.getState().getLastError()).isEqualTo("missing [" + storage + "]");
    }

    @Test
    void unsatisfiedRequiredCheckNamesTheCheckAndSkipsDependents() throws ConfigurationException {
        Phase storagePhase = Phases.configMapPhase("object-storage", "namespaces")
                .addHealthCheck(Phases.check("Deployment", "kyuubi", "minio", ConditionType.WORKLOAD_AVAILABLE,
                        Duration.ofMillis(30), true))
                .build();
        PhaseGraph graph = new DependencyGraphBuilder().build(List.of(
                Phases.configMapPhase("namespaces").build(),
                storagePhase,
                Phases.configMapPhase("query-engine", "object-storage").build()));
        harness.orchestrator.deploy(graph);

        List<PhaseStatusReport> reports = harness.inspector.inspect(graph);

        assertThat(statuses(reports)).containsExactly(
                "namespaces=SUCCEEDED", "object-storage=FATAL", "query-engine=SKIPPED");
        assertThat(reports.get(1).getState().getLastError())
                .isEqualTo("Deployment{namespace=kyuubi, name=minio} WORKLOAD_AVAILABLE: not found");
        assertThat(reports.get(2).getState().getLastError()).isEqualTo("dependency 'object-storage' is FATAL");
    }

    @Test
    void secretsBootstrapWithoutDestinationSecretReportsTheMissingSecret() throws ConfigurationException {
        harness.platform.put(Resources.reviewerSecret());
        PhaseGraph graph = new DependencyGraphBuilder().build(List.of(
                Phases.vaultBootstrapPhase(Duration.ofMillis(50)),
                Phases.configMapPhase("object-storage", "vault-bootstrap").build()));
        assertThat(harness.orchestrator.deploy(graph).exitCode()).isEqualTo(1);

        List<PhaseStatusReport> reports = harness.inspector.inspect(graph);

        assertThat(statuses(reports)).containsExactly("vault-bootstrap=FATAL", "object-storage=SKIPPED");
        assertThat(reports.get(0).getMissing()).isEmpty();
        assertThat(reports.get(0).getState().getLastError())
                .isEqualTo("Secret{namespace=kyuubi, name=minio-secret} SECRET_MATERIALIZED: not found");
        assertThat(reports.get(1).getState().getLastError()).isEqualTo("dependency 'vault-bootstrap' is FATAL");
    }

    private PhaseGraph graph() throws ConfigurationException {
        return new DependencyGraphBuilder().build(List.of(
                Phases.configMapPhase("namespaces").build(),
                Phases.configMapPhase("object-storage", "namespaces")
                        .addResource(ResourceDescriptor.of("object-storage",
                                Resources.configMap("kyuubi", "minio-settings", Map.of("endpoint", "http://minio:9000"))))
                        .build(),
                Phases.configMapPhase("query-engine", "object-storage").build()));
    }

    private static List<String> statuses(List<PhaseStatusReport> reports) {
        return reports.stream()
                .map(r -> r.getState().getPhaseName() + "=" + r.getState().getStatus())
                .collect(Collectors.toList());
    }
}
