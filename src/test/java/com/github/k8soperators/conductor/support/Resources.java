package com.github.k8soperators.conductor.support;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Resources {

    private Resources() {
    }

    public static GenericKubernetesResource configMap(String namespace, String name, Map<String, String> data) {
        GenericKubernetesResource resource = resource("v1", "ConfigMap", namespace, name);
        resource.setAdditionalProperty("data", new LinkedHashMap<>(data));
        return resource;
    }

    public static GenericKubernetesResource secret(String namespace, String name, Map<String, String> data) {
        GenericKubernetesResource resource = resource("v1", "Secret", namespace, name);
        resource.setAdditionalProperty("data", new LinkedHashMap<>(data));
        return resource;
    }

    /**
     * The token reviewer Secret that {@link Phases#vaultBootstrapPhase} reads.
     */
    public static GenericKubernetesResource reviewerSecret() {
        return secret("vault", "vault-token-reviewer", Map.of(
                "ca.crt", base64("-----BEGIN CERTIFICATE-----"),
                "token", base64("reviewer-jwt")));
    }

    public static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    public static GenericKubernetesResource deployment(String namespace, String name, String image) {
        GenericKubernetesResource resource = resource("apps/v1", "Deployment", namespace, name);
        Map<String, Object> container = new LinkedHashMap<>();
        container.put("name", name);
        container.put("image", image);
        resource.setAdditionalProperty("spec", Map.of(
                "selector", Map.of("matchLabels", Map.of("app", name)),
                "template", Map.of("spec", Map.of("containers", List.of(container)))));
        return resource;
    }

    public static GenericKubernetesResource withCondition(GenericKubernetesResource resource, String type, String status) {
        resource.setAdditionalProperty("status", Map.of("conditions", List.of(Map.of("type", type, "status", status))));
        return resource;
    }

    public static GenericKubernetesResource resource(String apiVersion, String kind, String namespace, String name) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion(apiVersion);
        resource.setKind(kind);
        resource.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).build());
        return resource;
    }
}
