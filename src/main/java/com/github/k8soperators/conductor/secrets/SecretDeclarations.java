package com.github.k8soperators.conductor.secrets;

import com.github.k8soperators.conductor.model.ConditionType;
import com.github.k8soperators.conductor.model.ConsumerRole;
import com.github.k8soperators.conductor.model.ReadinessCheck;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.model.SecretBinding;
import com.github.k8soperators.conductor.model.SecretsBootstrap;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vault Secrets Operator objects for a bootstrap block: one {@code VaultAuth} per consumer and one
 * {@code VaultStaticSecret} per binding. The operator moves the material, these only declare it.
 */
public final class SecretDeclarations {

    public static final String API_VERSION = "secrets.hashicorp.com/v1beta1";
    public static final String KIND_VAULT_AUTH = "VaultAuth";
    public static final String KIND_VAULT_STATIC_SECRET = "VaultStaticSecret";

    private SecretDeclarations() {
    }

    public static List<ResourceDescriptor> declare(String phaseName, SecretsBootstrap bootstrap) {
        List<ResourceDescriptor> descriptors = new ArrayList<>();

        for (ConsumerRole consumer : bootstrap.getConsumers()) {
            descriptors.add(ResourceDescriptor.of(phaseName, vaultAuth(consumer, bootstrap)));
        }

        for (SecretBinding binding : bootstrap.getBindings()) {
            ConsumerRole consumer = bootstrap.getConsumer(binding.getConsumerIdentity())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown consumer " + binding.getConsumerIdentity()));
            descriptors.add(ResourceDescriptor.of(phaseName, vaultStaticSecret(binding, consumer)));
        }

        return descriptors;
    }

    /**
     * One {@link ConditionType#SECRET_MATERIALIZED} check per destination secret, bounded by the sync timeout.
     */
    public static List<ReadinessCheck> materializationChecks(SecretsBootstrap bootstrap) {
        List<ReadinessCheck> checks = new ArrayList<>();

        for (SecretBinding binding : bootstrap.getBindings()) {
            checks.add(ReadinessCheck.builder()
                    .withApiVersion("v1")
                    .withTargetKind("Secret")
                    .withNamespace(binding.getDestinationNamespace())
                    .withName(binding.getDestinationName())
                    .withCondition(ConditionType.SECRET_MATERIALIZED)
                    .withTimeout(bootstrap.getSyncTimeout())
                    .withRequired(true)
                    .build());
        }

        return checks;
    }

    static GenericKubernetesResource vaultAuth(ConsumerRole consumer, SecretsBootstrap bootstrap) {
        Map<String, Object> kubernetes = new LinkedHashMap<>();
        kubernetes.put("role", consumer.getRoleName());
        kubernetes.put("serviceAccount", consumer.getServiceAccount());

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("vaultConnectionRef", bootstrap.getVaultConnectionRef());
        spec.put("method", "kubernetes");
        spec.put("mount", bootstrap.getAuthPath());
        spec.put("kubernetes", kubernetes);

        return resource(KIND_VAULT_AUTH, consumer.getNamespace(), consumer.getVaultAuthName(), spec);
    }

    static GenericKubernetesResource vaultStaticSecret(SecretBinding binding, ConsumerRole consumer) {
        Map<String, Object> destination = new LinkedHashMap<>();
        destination.put("name", binding.getDestinationName());
        destination.put("create", true);

        String vaultAuthRef = consumer.getNamespace().equals(binding.getDestinationNamespace())
                ? consumer.getVaultAuthName()
                : consumer.getNamespace() + "/" + consumer.getVaultAuthName();

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("vaultAuthRef", vaultAuthRef);
        spec.put("mount", consumer.getMount());
        spec.put("type", "kv-v2");
        spec.put("path", binding.getSecretPath());
        spec.put("refreshAfter", goDuration(binding.getRefreshInterval()));
        spec.put("destination", destination);

        return resource(KIND_VAULT_STATIC_SECRET, binding.getDestinationNamespace(), binding.getDestinationName(), spec);
    }

    static String goDuration(Duration duration) {
        return duration.getSeconds() + "s";
    }

    private static GenericKubernetesResource resource(String kind, String namespace, String name, Map<String, Object> spec) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion(API_VERSION);
        resource.setKind(kind);
        resource.setMetadata(new ObjectMetaBuilder()
                .withNamespace(namespace)
                .withName(name)
                .build());
        resource.setAdditionalProperty("spec", spec);
        return resource;
    }
}
