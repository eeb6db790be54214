package com.github.k8soperators.conductor.support;

import com.github.k8soperators.conductor.secrets.KubernetesAuthConfig;
import com.github.k8soperators.conductor.secrets.SecretsEngineClient;
import com.github.k8soperators.conductor.secrets.VaultException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemorySecretsEngine implements SecretsEngineClient {

    public static final class Role {
        public final String serviceAccount;
        public final String namespace;
        public final List<String> policies;
        public final Duration tokenTtl;

        Role(String serviceAccount, String namespace, List<String> policies, Duration tokenTtl) {
            this.serviceAccount = serviceAccount;
            this.namespace = namespace;
            this.policies = List.copyOf(policies);
            this.tokenTtl = tokenTtl;
        }
    }

    public final Set<String> mounts = new LinkedHashSet<>();
    public final Set<String> authBackends = new LinkedHashSet<>();
    public final Map<String, KubernetesAuthConfig> authConfigs = new HashMap<>();
    public final Map<String, String> policies = new HashMap<>();
    public final Map<String, Role> roles = new HashMap<>();
    public final Map<String, Map<String, String>> secrets = new HashMap<>();
    public final List<String> writes = new ArrayList<>();

    private final AtomicInteger unreadyChecks = new AtomicInteger();
    private final AtomicInteger failingRoleWrites = new AtomicInteger();

    /**
     * Reports sealed for the next {@code times} health checks.
     */
    public void sealedFor(int times) {
        unreadyChecks.set(times);
    }

    /**
     * Answers the next {@code times} role writes with 503.
     */
    public void failRoleWritesFor(int times) {
        failingRoleWrites.set(times);
    }

    @Override
    public synchronized boolean isReady() {
        return unreadyChecks.getAndUpdate(n -> Math.max(0, n - 1)) == 0;
    }

    @Override
    public synchronized boolean ensureKvMount(String path) {
        return record(mounts.add(path), "mount " + path);
    }

    @Override
    public synchronized boolean ensureAuthBackend(String path, String type) {
        return record(authBackends.add(path), "auth " + path);
    }

    @Override
    public synchronized boolean configureKubernetesAuth(String authPath, KubernetesAuthConfig config) {
        KubernetesAuthConfig current = authConfigs.get(authPath);
        boolean changed = current == null || !current.getKubernetesHost().equals(config.getKubernetesHost());
        authConfigs.put(authPath, config);
        return record(changed, "auth config " + authPath);
    }

    @Override
    public synchronized boolean writePolicy(String name, String rules) {
        return record(!rules.equals(policies.put(name, rules)), "policy " + name);
    }

    @Override
    public synchronized void writeKubernetesRole(String authPath, String role, String serviceAccount, String namespace,
            List<String> policies, Duration tokenTtl) {
        if (failingRoleWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new VaultException(503, "PUT /v1/auth/" + authPath + "/role/" + role + ": 503 Service Unavailable");
        }
        roles.put(role, new Role(serviceAccount, namespace, policies, tokenTtl));
    }

    @Override
    public synchronized Optional<Map<String, String>> readSecret(String mount, String path) {
        return Optional.ofNullable(secrets.get(mount + "/" + path));
    }

    @Override
    public synchronized void writeSecret(String mount, String path, Map<String, String> data) {
        secrets.put(mount + "/" + path, Map.copyOf(data));
        writes.add("secret " + mount + "/" + path);
    }

    @Override
    public synchronized boolean deleteRole(String authPath, String role) {
        return roles.remove(role) != null;
    }

    @Override
    public synchronized boolean deletePolicy(String name) {
        return policies.remove(name) != null;
    }

    private boolean record(boolean changed, String write) {
        if (changed) {
            writes.add(write);
        }
        return changed;
    }
}
