package com.github.k8soperators.conductor.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Unit of sequencing. Built once from the plan file at startup and never mutated during a run.
 */
public final class Phase {

    private final String name;
    private final List<ResourceDescriptor> resources;
    private final List<String> dependsOn;
    private final List<ReadinessCheck> healthChecks;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final boolean optional;
    private final SecretsBootstrap secretsBootstrap;

    Phase(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.resources = List.copyOf(builder.resources);
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.healthChecks = List.copyOf(builder.healthChecks);
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy");
        this.optional = builder.optional;
        this.secretsBootstrap = builder.secretsBootstrap;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ResourceDescriptor> getResources() {
        return resources;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public List<ReadinessCheck> getHealthChecks() {
        return healthChecks;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public boolean isOptional() {
        return optional;
    }

    public Optional<SecretsBootstrap> getSecretsBootstrap() {
        return Optional.ofNullable(secretsBootstrap);
    }

    public boolean isSecretsBootstrap() {
        return secretsBootstrap != null;
    }

    @Override
    public String toString() {
        return "Phase{" + name + "}";
    }

    public static final class Builder {
        private final String name;
        private final List<ResourceDescriptor> resources = new ArrayList<>();
        private final List<String> dependsOn = new ArrayList<>();
        private final List<ReadinessCheck> healthChecks = new ArrayList<>();
        private Duration timeout = Duration.ofMinutes(10);
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private boolean optional;
        private SecretsBootstrap secretsBootstrap;

        Builder(String name) {
            this.name = name;
        }

        public Builder addResource(ResourceDescriptor resource) {
            this.resources.add(resource);
            return this;
        }

        public Builder addResources(List<ResourceDescriptor> resources) {
            this.resources.addAll(resources);
            return this;
        }

        public Builder dependsOn(String... phaseNames) {
            this.dependsOn.addAll(List.of(phaseNames));
            return this;
        }

        public Builder dependsOn(List<String> phaseNames) {
            this.dependsOn.addAll(phaseNames);
            return this;
        }

        public Builder addHealthCheck(ReadinessCheck check) {
            this.healthChecks.add(check);
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withOptional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder withSecretsBootstrap(SecretsBootstrap secretsBootstrap) {
            this.secretsBootstrap = secretsBootstrap;
            return this;
        }

        public Phase build() {
            return new Phase(this);
        }
    }
}
