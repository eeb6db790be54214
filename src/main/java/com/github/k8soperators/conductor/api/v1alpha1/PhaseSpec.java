package com.github.k8soperators.conductor.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "name",
        "dependsOn",
        "optional",
        "timeout",
        "retryPolicy",
        "resources",
        "optionalResources",
        "healthChecks",
        "secretsBootstrap" })
public class PhaseSpec {

    private String name;

    private List<String> dependsOn;

    private Boolean optional;

    /**
     * ISO-8601 duration, e.g. {@code PT10M}.
     */
    private String timeout;

    private RetryPolicySpec retryPolicy;

    /**
     * Manifest files, relative to the plan file, holding one or more YAML documents each.
     */
    private List<String> resources;

    /**
     * Manifest files whose objects may fail to apply without failing the phase.
     */
    private List<String> optionalResources;

    private List<HealthCheckSpec> healthChecks;

    private SecretsBootstrapSpec secretsBootstrap;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public void setDependsOn(List<String> dependsOn) {
        this.dependsOn = dependsOn;
    }

    public Boolean getOptional() {
        return optional;
    }

    public void setOptional(Boolean optional) {
        this.optional = optional;
    }

    public String getTimeout() {
        return timeout;
    }

    public void setTimeout(String timeout) {
        this.timeout = timeout;
    }

    public RetryPolicySpec getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicySpec retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public List<String> getResources() {
        return resources;
    }

    public void setResources(List<String> resources) {
        this.resources = resources;
    }

    public List<String> getOptionalResources() {
        return optionalResources;
    }

    public void setOptionalResources(List<String> optionalResources) {
        this.optionalResources = optionalResources;
    }

    public List<HealthCheckSpec> getHealthChecks() {
        return healthChecks;
    }

    public void setHealthChecks(List<HealthCheckSpec> healthChecks) {
        this.healthChecks = healthChecks;
    }

    public SecretsBootstrapSpec getSecretsBootstrap() {
        return secretsBootstrap;
    }

    public void setSecretsBootstrap(SecretsBootstrapSpec secretsBootstrap) {
        this.secretsBootstrap = secretsBootstrap;
    }

}
