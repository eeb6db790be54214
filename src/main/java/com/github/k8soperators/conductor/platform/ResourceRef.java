package com.github.k8soperators.conductor.platform;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Objects;

/**
 * Address of a single object on the platform: kind + identifier + namespace.
 * A {@code null} namespace denotes a cluster-scoped object.
 */
public final class ResourceRef {

    private final String apiVersion;
    private final String kind;
    private final String namespace;
    private final String name;

    public ResourceRef(String apiVersion, String kind, String namespace, String name) {
        this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.namespace = namespace;
        this.name = Objects.requireNonNull(name, "name");
    }

    public static ResourceRef of(HasMetadata resource) {
        return new ResourceRef(resource.getApiVersion(),
                resource.getKind(),
                resource.getMetadata().getNamespace(),
                resource.getMetadata().getName());
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getGroup() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    public String getVersion() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
    }

    public String getKind() {
        return kind;
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isNamespaced() {
        return namespace != null;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceRef)) {
            return false;
        }
        ResourceRef other = (ResourceRef) o;
        return apiVersion.equals(other.apiVersion)
                && kind.equals(other.kind)
                && Objects.equals(namespace, other.namespace)
                && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, kind, namespace, name);
    }

    @Override
    public String toString() {
        return String.format("%s{namespace=%s, name=%s}", kind, namespace, name);
    }
}
