package com.github.k8soperators.conductor.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Declares that secret material at {@code secretPath} in the secrets engine is synchronised into a platform
 * Secret at {@code destination}. Later phases refer to a binding by its destination only.
 */
public final class SecretBinding {

    private final String consumerIdentity;
    private final String secretPath;
    private final String destinationNamespace;
    private final String destinationName;
    private final Duration refreshInterval;

    public SecretBinding(String consumerIdentity,
            String secretPath,
            String destinationNamespace,
            String destinationName,
            Duration refreshInterval) {
        this.consumerIdentity = Objects.requireNonNull(consumerIdentity, "consumerIdentity");
        this.secretPath = Objects.requireNonNull(secretPath, "secretPath");
        this.destinationNamespace = Objects.requireNonNull(destinationNamespace, "destinationNamespace");
        this.destinationName = Objects.requireNonNull(destinationName, "destinationName");
        this.refreshInterval = Objects.requireNonNull(refreshInterval, "refreshInterval");
    }

    public String getConsumerIdentity() {
        return consumerIdentity;
    }

    public String getSecretPath() {
        return secretPath;
    }

    public String getDestinationNamespace() {
        return destinationNamespace;
    }

    public String getDestinationName() {
        return destinationName;
    }

    public String getDestination() {
        return destinationNamespace + "/" + destinationName;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    @Override
    public String toString() {
        return String.format("SecretBinding{consumer=%s, path=%s, destination=%s}", consumerIdentity, secretPath, getDestination());
    }
}
