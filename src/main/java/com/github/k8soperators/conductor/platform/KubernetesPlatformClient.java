package com.github.k8soperators.conductor.platform;

import com.github.k8soperators.conductor.retry.FailureClassifier;
import com.github.k8soperators.conductor.retry.FailureKind;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@ApplicationScoped
public class KubernetesPlatformClient implements PlatformClient {

    private static final Logger log = Logger.getLogger(KubernetesPlatformClient.class);

    private static final Set<String> CLUSTER_SCOPED_KINDS = Set.of(
            "Namespace",
            "CustomResourceDefinition",
            "ClusterRole",
            "ClusterRoleBinding",
            "PersistentVolume",
            "StorageClass",
            "IngressClass",
            "PriorityClass",
            "MutatingWebhookConfiguration",
            "ValidatingWebhookConfiguration");

    private final KubernetesClient client;

    @Inject
    public KubernetesPlatformClient(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<GenericKubernetesResource> get(ResourceRef ref) {
        return call("get " + ref, () -> Optional.ofNullable(resource(ref).get()));
    }

    @Override
    public List<GenericKubernetesResource> list(String apiVersion, String kind, String namespace, Map<String, String> labels) {
        ResourceDefinitionContext context = context(apiVersion, kind, namespace);
        MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation =
                client.genericKubernetesResources(context);

        return call(String.format("list %s{namespace=%s, labels=%s}", kind, namespace, labels), () -> {
            if (namespace != null && context.isNamespaceScoped()) {
                return operation.inNamespace(namespace).withLabels(labels).list().getItems();
            }
            return operation.withLabels(labels).list().getItems();
        });
    }

    @Override
    public GenericKubernetesResource create(GenericKubernetesResource resource) {
        ResourceRef ref = ResourceRef.of(resource);
        return call("create " + ref, () -> {
            GenericKubernetesResource created = operation(ref).resource(resource).create();
            log.debugf("%s: created", ref);
            return created;
        });
    }

    @Override
    public GenericKubernetesResource update(GenericKubernetesResource resource) {
        ResourceRef ref = ResourceRef.of(resource);
        return call("update " + ref, () -> {
            GenericKubernetesResource updated = operation(ref).resource(resource).replace();
            log.debugf("%s: replaced", ref);
            return updated;
        });
    }

    @Override
    public boolean delete(ResourceRef ref) {
        return call("delete " + ref, () -> {
            var details = resource(ref).delete();
            log.debugf("%s: deleted. Details: %s", ref, details);
            return details != null && !details.isEmpty();
        });
    }

    Resource<GenericKubernetesResource> resource(ResourceRef ref) {
        return operation(ref).withName(ref.getName());
    }

    NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation(ResourceRef ref) {
        ResourceDefinitionContext context = context(ref.getApiVersion(), ref.getKind(), ref.getNamespace());
        var operation = client.genericKubernetesResources(context);

        if (context.isNamespaceScoped()) {
            return operation.inNamespace(ref.getNamespace());
        }

        return operation;
    }

    static ResourceDefinitionContext context(String apiVersion, String kind, String namespace) {
        ResourceRef ref = new ResourceRef(apiVersion, kind, namespace, "_");

        return new ResourceDefinitionContext.Builder()
                .withGroup(ref.getGroup())
                .withVersion(ref.getVersion())
                .withKind(kind)
                .withPlural(plural(kind))
                .withNamespaced(!CLUSTER_SCOPED_KINDS.contains(kind) && namespace != null)
                .build();
    }

    static String plural(String kind) {
        String lower = kind.toLowerCase(Locale.ROOT);

        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("ch") || lower.endsWith("sh")) {
            return lower + "es";
        }
        if (lower.endsWith("y") && !lower.endsWith("ay") && !lower.endsWith("ey") && !lower.endsWith("oy")) {
            return lower.substring(0, lower.length() - 1) + "ies";
        }
        return lower + "s";
    }

    static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (KubernetesClientException e) {
            FailureKind kind = FailureClassifier.classify(e);
            throw new OrchestrationException(kind, String.format("%s failed (HTTP %d): %s", operation, e.getCode(), e.getMessage()), e);
        }
    }
}
