package com.github.k8soperators.conductor.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A platform identity (service account) that is granted access to one key-value mount of the secrets engine.
 */
public final class ConsumerRole {

    private final String name;
    private final String serviceAccount;
    private final String namespace;
    private final String mount;
    private final AccessLevel access;
    private final Duration tokenTtl;

    public ConsumerRole(String name, String serviceAccount, String namespace, String mount, AccessLevel access, Duration tokenTtl) {
        this.name = Objects.requireNonNull(name, "name");
        this.serviceAccount = Objects.requireNonNull(serviceAccount, "serviceAccount");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.mount = Objects.requireNonNull(mount, "mount");
        this.access = Objects.requireNonNull(access, "access");
        this.tokenTtl = Objects.requireNonNull(tokenTtl, "tokenTtl");
    }

    public String getName() {
        return name;
    }

    public String getServiceAccount() {
        return serviceAccount;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getMount() {
        return mount;
    }

    public AccessLevel getAccess() {
        return access;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public String getReadPolicyName() {
        return name + "-read";
    }

    public String getWritePolicyName() {
        return name + "-write";
    }

    public String getPolicyName() {
        return access == AccessLevel.READ ? getReadPolicyName() : getWritePolicyName();
    }

    public String getRoleName() {
        return access == AccessLevel.READ ? name : name + "-rw";
    }

    public String getVaultAuthName() {
        return name + "-vault-auth";
    }
}
