package com.github.k8soperators.conductor.retry;

import com.github.k8soperators.conductor.secrets.VaultException;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void classifiesHttpStatuses() {
        for (int code : new int[] { 408, 429, 500, 502, 503, 504 }) {
            assertThat(FailureClassifier.classifyStatus(code, "")).as("HTTP %d", code).isEqualTo(FailureKind.TRANSIENT);
        }
        assertThat(FailureClassifier.classifyStatus(409, "AlreadyExists")).isEqualTo(FailureKind.CONFLICT);
        assertThat(FailureClassifier.classifyStatus(422, "spec.selector: Invalid value: field is immutable")).isEqualTo(FailureKind.CONFLICT);
        assertThat(FailureClassifier.classifyStatus(422, "spec.replicas: must be non-negative")).isEqualTo(FailureKind.FATAL);
        assertThat(FailureClassifier.classifyStatus(403, "forbidden")).isEqualTo(FailureKind.FATAL);
        assertThat(FailureClassifier.classifyStatus(400, "bad request")).isEqualTo(FailureKind.FATAL);
    }

    @Test
    void classifiesKubernetesClientExceptions() {
        Status immutable = new StatusBuilder()
                .withCode(422)
                .withMessage("Deployment.apps \"hive-metastore\" is invalid: spec.selector: Invalid value: field is immutable")
                .build();

        assertThat(FailureClassifier.classify(new KubernetesClientException(immutable))).isEqualTo(FailureKind.CONFLICT);
        assertThat(FailureClassifier.classify(new KubernetesClientException("unreachable", new IOException("refused"))))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new KubernetesClientException("forbidden", 403, null))).isEqualTo(FailureKind.FATAL);
    }

    @Test
    void classifiesOtherFailures() {
        assertThat(FailureClassifier.classify(new VaultException(503, "sealed"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new VaultException(403, "permission denied"))).isEqualTo(FailureKind.FATAL);
        assertThat(FailureClassifier.classify(new VaultException("GET /v1/sys/health: Connection refused",
                new ConnectException("Connection refused")))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new VaultException("GET /v1/sys/health: bad URI",
                new IllegalArgumentException("bad URI")))).isEqualTo(FailureKind.FATAL);
        assertThat(FailureClassifier.classify(new UncheckedIOException(new IOException("reset")))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new OrchestrationException(FailureKind.CONFLICT, "x"))).isEqualTo(FailureKind.CONFLICT);
        assertThat(FailureClassifier.classify(new IllegalStateException("bug"))).isEqualTo(FailureKind.FATAL);
    }
}
