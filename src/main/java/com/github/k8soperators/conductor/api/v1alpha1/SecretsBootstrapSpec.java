package com.github.k8soperators.conductor.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "authPath",
        "kubernetesHost",
        "reviewerSecret",
        "kvMounts",
        "consumers",
        "seedSecrets",
        "bindings",
        "syncTimeout",
        "vaultConnectionRef" })
public class SecretsBootstrapSpec {

    private String authPath;

    private String kubernetesHost;

    /**
     * Service account token secret ({@code ca.crt} and {@code token}) Vault uses to review client tokens.
     * Vault falls back to its own pod identity when absent.
     */
    private ReviewerSecretSpec reviewerSecret;

    private List<String> kvMounts;

    private List<ConsumerSpec> consumers;

    private List<SeedSecretSpec> seedSecrets;

    private List<SecretBindingSpec> bindings;

    private String syncTimeout;

    private String vaultConnectionRef;

    public String getAuthPath() {
        return authPath;
    }

    public void setAuthPath(String authPath) {
        this.authPath = authPath;
    }

    public String getKubernetesHost() {
        return kubernetesHost;
    }

    public void setKubernetesHost(String kubernetesHost) {
        this.kubernetesHost = kubernetesHost;
    }

    public ReviewerSecretSpec getReviewerSecret() {
        return reviewerSecret;
    }

    public void setReviewerSecret(ReviewerSecretSpec reviewerSecret) {
        this.reviewerSecret = reviewerSecret;
    }

    public List<String> getKvMounts() {
        return kvMounts;
    }

    public void setKvMounts(List<String> kvMounts) {
        this.kvMounts = kvMounts;
    }

    public List<ConsumerSpec> getConsumers() {
        return consumers;
    }

    public void setConsumers(List<ConsumerSpec> consumers) {
        this.consumers = consumers;
    }

    public List<SeedSecretSpec> getSeedSecrets() {
        return seedSecrets;
    }

    public void setSeedSecrets(List<SeedSecretSpec> seedSecrets) {
        this.seedSecrets = seedSecrets;
    }

    public List<SecretBindingSpec> getBindings() {
        return bindings;
    }

    public void setBindings(List<SecretBindingSpec> bindings) {
        this.bindings = bindings;
    }

    public String getSyncTimeout() {
        return syncTimeout;
    }

    public void setSyncTimeout(String syncTimeout) {
        this.syncTimeout = syncTimeout;
    }

    public String getVaultConnectionRef() {
        return vaultConnectionRef;
    }

    public void setVaultConnectionRef(String vaultConnectionRef) {
        this.vaultConnectionRef = vaultConnectionRef;
    }

}
