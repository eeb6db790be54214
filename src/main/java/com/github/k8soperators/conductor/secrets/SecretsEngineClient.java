package com.github.k8soperators.conductor.secrets;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations the bootstrap needs from the secrets engine. Every mutating call is idempotent; the {@code boolean}
 * results report whether anything was actually changed.
 */
public interface SecretsEngineClient {

    /**
     * @return {@code true} once the engine is initialised and unsealed
     */
    boolean isReady();

    boolean ensureKvMount(String path);

    boolean ensureAuthBackend(String path, String type);

    boolean configureKubernetesAuth(String authPath, KubernetesAuthConfig config);

    boolean writePolicy(String name, String rules);

    void writeKubernetesRole(String authPath, String role, String serviceAccount, String namespace, List<String> policies, Duration tokenTtl);

    Optional<Map<String, String>> readSecret(String mount, String path);

    void writeSecret(String mount, String path, Map<String, String> data);

    boolean deleteRole(String authPath, String role);

    boolean deletePolicy(String name);
}
