package com.github.k8soperators.conductor.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SecretsBootstrap {

    private final String authPath;
    private final String kubernetesHost;
    private final String reviewerSecretNamespace;
    private final String reviewerSecretName;
    private final List<String> kvMounts;
    private final List<ConsumerRole> consumers;
    private final List<SeedSecret> seedSecrets;
    private final List<SecretBinding> bindings;
    private final Duration syncTimeout;
    private final String vaultConnectionRef;

    public SecretsBootstrap(String authPath,
            String kubernetesHost,
            String reviewerSecretNamespace,
            String reviewerSecretName,
            List<String> kvMounts,
            List<ConsumerRole> consumers,
            List<SeedSecret> seedSecrets,
            List<SecretBinding> bindings,
            Duration syncTimeout,
            String vaultConnectionRef) {
        this.authPath = Objects.requireNonNull(authPath, "authPath");
        this.kubernetesHost = Objects.requireNonNull(kubernetesHost, "kubernetesHost");
        this.reviewerSecretNamespace = reviewerSecretNamespace;
        this.reviewerSecretName = reviewerSecretName;
        this.kvMounts = List.copyOf(kvMounts);
        this.consumers = List.copyOf(consumers);
        this.seedSecrets = List.copyOf(seedSecrets);
        this.bindings = List.copyOf(bindings);
        this.syncTimeout = Objects.requireNonNull(syncTimeout, "syncTimeout");
        this.vaultConnectionRef = Objects.requireNonNull(vaultConnectionRef, "vaultConnectionRef");
    }

    public String getAuthPath() {
        return authPath;
    }

    public String getKubernetesHost() {
        return kubernetesHost;
    }

    public Optional<String> getReviewerSecretNamespace() {
        return Optional.ofNullable(reviewerSecretNamespace);
    }

    public Optional<String> getReviewerSecretName() {
        return Optional.ofNullable(reviewerSecretName);
    }

    public List<String> getKvMounts() {
        return kvMounts;
    }

    public List<ConsumerRole> getConsumers() {
        return consumers;
    }

    public Optional<ConsumerRole> getConsumer(String name) {
        return consumers.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public List<SeedSecret> getSeedSecrets() {
        return seedSecrets;
    }

    public List<SecretBinding> getBindings() {
        return bindings;
    }

    public Duration getSyncTimeout() {
        return syncTimeout;
    }

    public String getVaultConnectionRef() {
        return vaultConnectionRef;
    }
}
