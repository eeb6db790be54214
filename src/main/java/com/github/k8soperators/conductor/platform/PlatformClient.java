package com.github.k8soperators.conductor.platform;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Create/update/delete/get by kind + identifier + namespace against the orchestration platform. Implementations
 * report failures as {@link com.github.k8soperators.conductor.retry.OrchestrationException} with a classified
 * {@link com.github.k8soperators.conductor.retry.FailureKind}.
 */
public interface PlatformClient {

    Optional<GenericKubernetesResource> get(ResourceRef ref);

    List<GenericKubernetesResource> list(String apiVersion, String kind, String namespace, Map<String, String> labels);

    GenericKubernetesResource create(GenericKubernetesResource resource);

    GenericKubernetesResource update(GenericKubernetesResource resource);

    /**
     * @return {@code true} when an object was removed, {@code false} when it was already absent
     */
    boolean delete(ResourceRef ref);
}
