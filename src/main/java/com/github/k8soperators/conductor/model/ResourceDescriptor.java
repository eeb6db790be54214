package com.github.k8soperators.conductor.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.k8soperators.conductor.platform.ResourceRef;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative definition of one artifact owned by a phase. The payload is opaque apart from the
 * identifying fields and the ownership metadata stamped on it before every apply.
 */
public final class ResourceDescriptor {

    public static final String LABEL_KEY_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String CONDUCTOR = "conductor";
    public static final String LABEL_KEY_PHASE = "conductor.k8soperators.github.com/phase";
    public static final String ANNOTATION_IDEMPOTENCY_KEY = "conductor.k8soperators.github.com/idempotency-key";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String phaseName;
    private final ResourceRef ref;
    private final GenericKubernetesResource payload;
    private final String idempotencyKey;
    private final boolean required;

    private ResourceDescriptor(String phaseName, GenericKubernetesResource payload, boolean required) {
        this.phaseName = Objects.requireNonNull(phaseName, "phaseName");
        this.payload = payload;
        this.ref = ResourceRef.of(payload);
        this.idempotencyKey = idempotencyKey(phaseName, ref);
        this.required = required;
    }

    public static ResourceDescriptor of(String phaseName, GenericKubernetesResource payload, boolean required) {
        return new ResourceDescriptor(phaseName, normalize(payload), required);
    }

    public static ResourceDescriptor of(String phaseName, GenericKubernetesResource payload) {
        return of(phaseName, payload, true);
    }

    static String idempotencyKey(String phaseName, ResourceRef ref) {
        return String.join("/",
                phaseName,
                ref.getApiVersion(),
                ref.getKind(),
                Optional.ofNullable(ref.getNamespace()).orElse("_cluster"),
                ref.getName());
    }

    /**
     * Secrets declared with {@code stringData} are read back by the API server as base64 {@code data}; fold them
     * so that drift detection compares like with like.
     */
    @SuppressWarnings("unchecked")
    static GenericKubernetesResource normalize(GenericKubernetesResource source) {
        GenericKubernetesResource copy = copy(source);

        if (!"Secret".equals(copy.getKind()) || !(copy.getAdditionalProperties().get("stringData") instanceof Map)) {
            return copy;
        }

        Map<String, Object> stringData = (Map<String, Object>) copy.getAdditionalProperties().remove("stringData");
        Map<String, Object> data = Optional.ofNullable(copy.getAdditionalProperties().get("data"))
                .filter(Map.class::isInstance)
                .map(existing -> new LinkedHashMap<>((Map<String, Object>) existing))
                .orElseGet(LinkedHashMap::new);

        stringData.forEach((key, value) -> data.put(key,
                Base64.getEncoder().encodeToString(String.valueOf(value).getBytes(StandardCharsets.UTF_8))));

        copy.getAdditionalProperties().put("data", data);
        return copy;
    }

    static GenericKubernetesResource copy(GenericKubernetesResource source) {
        return MAPPER.convertValue(source, GenericKubernetesResource.class);
    }

    /**
     * A fresh copy of the payload carrying the ownership labels and the idempotency annotation.
     */
    public GenericKubernetesResource toDesiredState() {
        GenericKubernetesResource desired = copy(payload);
        ObjectMeta metadata = desired.getMetadata();

        Map<String, String> labels = new HashMap<>(Optional.ofNullable(metadata.getLabels()).orElseGet(Map::of));
        labels.put(LABEL_KEY_MANAGED_BY, CONDUCTOR);
        labels.put(LABEL_KEY_PHASE, phaseName);
        metadata.setLabels(labels);

        Map<String, String> annotations = new HashMap<>(Optional.ofNullable(metadata.getAnnotations()).orElseGet(Map::of));
        annotations.put(ANNOTATION_IDEMPOTENCY_KEY, idempotencyKey);
        metadata.setAnnotations(annotations);

        return desired;
    }

    public String getPhaseName() {
        return phaseName;
    }

    public ResourceRef getRef() {
        return ref;
    }

    public String getKind() {
        return ref.getKind();
    }

    public String getIdentifier() {
        return ref.getName();
    }

    public String getNamespace() {
        return ref.getNamespace();
    }

    public GenericKubernetesResource getPayload() {
        return copy(payload);
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public String toString() {
        return ref.toString();
    }
}
