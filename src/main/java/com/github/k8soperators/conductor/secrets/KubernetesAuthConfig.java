package com.github.k8soperators.conductor.secrets;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of the Kubernetes auth method. Without a reviewer token and CA the engine uses its own pod identity.
 */
public final class KubernetesAuthConfig {

    private final String kubernetesHost;
    private final String caCertificate;
    private final String reviewerToken;

    public KubernetesAuthConfig(String kubernetesHost, String caCertificate, String reviewerToken) {
        this.kubernetesHost = Objects.requireNonNull(kubernetesHost, "kubernetesHost");
        this.caCertificate = caCertificate;
        this.reviewerToken = reviewerToken;
    }

    public String getKubernetesHost() {
        return kubernetesHost;
    }

    public Optional<String> getCaCertificate() {
        return Optional.ofNullable(caCertificate);
    }

    public Optional<String> getReviewerToken() {
        return Optional.ofNullable(reviewerToken);
    }
}
