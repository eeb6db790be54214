package com.github.k8soperators.conductor.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.k8soperators.conductor.platform.PlatformClient;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.retry.FailureKind;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory platform that records every call and can be scripted to fail specific operations.
 */
public class RecordingPlatformClient implements PlatformClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<ResourceRef, GenericKubernetesResource> objects = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final Map<String, Deque<RuntimeException>> failures = new HashMap<>();
    private final List<Consumer<GenericKubernetesResource>> createListeners = new ArrayList<>();
    private final AtomicLong resourceVersion = new AtomicLong();

    /**
     * Stores an object as if some other actor had created it.
     */
    public synchronized void put(GenericKubernetesResource resource) {
        GenericKubernetesResource stored = copy(resource);
        stored.getMetadata().setResourceVersion(Long.toString(resourceVersion.incrementAndGet()));
        objects.put(ResourceRef.of(stored), stored);
    }

    public synchronized Optional<GenericKubernetesResource> find(ResourceRef ref) {
        return Optional.ofNullable(objects.get(ref)).map(RecordingPlatformClient::copy);
    }

    public synchronized int size() {
        return objects.size();
    }

    /**
     * Makes the next {@code verb} call on {@code ref} throw {@code error}. Scripted failures queue up.
     */
    public synchronized void failNext(String verb, ResourceRef ref, RuntimeException error) {
        failures.computeIfAbsent(key(verb, ref), k -> new ArrayDeque<>()).add(error);
    }

    public synchronized void failAlways(String verb, ResourceRef ref, FailureKind kind, int times) {
        for (int i = 0; i < times; i++) {
            failNext(verb, ref, new OrchestrationException(kind, verb + " " + ref + " scripted failure"));
        }
    }

    public synchronized void onCreate(Consumer<GenericKubernetesResource> listener) {
        createListeners.add(listener);
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    public synchronized List<String> calls(String verb) {
        return calls.stream().filter(c -> c.startsWith(verb + " ")).collect(Collectors.toList());
    }

    public synchronized long mutations() {
        return calls.stream()
                .filter(c -> c.startsWith("create ") || c.startsWith("update ") || c.startsWith("delete "))
                .count();
    }

    public synchronized void clearCalls() {
        calls.clear();
    }

    @Override
    public synchronized Optional<GenericKubernetesResource> get(ResourceRef ref) {
        record("get", ref);
        return find(ref);
    }

    @Override
    public synchronized List<GenericKubernetesResource> list(String apiVersion, String kind, String namespace, Map<String, String> labels) {
        calls.add(String.format("list %s{namespace=%s, labels=%s}", kind, namespace, labels));
        return objects.values()
                .stream()
                .filter(o -> apiVersion.equals(o.getApiVersion()) && kind.equals(o.getKind()))
                .filter(o -> namespace == null || namespace.equals(o.getMetadata().getNamespace()))
                .filter(o -> labels.entrySet().stream().allMatch(l -> o.getMetadata().getLabels() != null
                        && l.getValue().equals(o.getMetadata().getLabels().get(l.getKey()))))
                .map(RecordingPlatformClient::copy)
                .collect(Collectors.toList());
    }

    @Override
    public GenericKubernetesResource create(GenericKubernetesResource resource) {
        GenericKubernetesResource stored;
        List<Consumer<GenericKubernetesResource>> listeners;

        synchronized (this) {
            ResourceRef ref = ResourceRef.of(resource);
            record("create", ref);

            if (objects.containsKey(ref)) {
                throw new OrchestrationException(FailureKind.CONFLICT, ref + " already exists");
            }
            if (resource.getMetadata().getResourceVersion() != null) {
                throw new OrchestrationException(FailureKind.FATAL, ref + ": resourceVersion should not be set on objects to be created");
            }

            put(resource);
            stored = copy(objects.get(ref));
            listeners = List.copyOf(createListeners);
        }

        listeners.forEach(listener -> listener.accept(copy(stored)));
        return stored;
    }

    @Override
    public synchronized GenericKubernetesResource update(GenericKubernetesResource resource) {
        ResourceRef ref = ResourceRef.of(resource);
        record("update", ref);

        GenericKubernetesResource live = objects.get(ref);
        if (live == null) {
            throw new OrchestrationException(FailureKind.FATAL, ref + " not found");
        }
        if (!Objects.equals(live.getMetadata().getResourceVersion(), resource.getMetadata().getResourceVersion())) {
            throw new OrchestrationException(FailureKind.CONFLICT, ref + ": the object has been modified");
        }

        put(resource);
        return copy(objects.get(ref));
    }

    @Override
    public synchronized boolean delete(ResourceRef ref) {
        record("delete", ref);
        return objects.remove(ref) != null;
    }

    private void record(String verb, ResourceRef ref) {
        calls.add(verb + " " + ref);

        Deque<RuntimeException> scripted = failures.get(key(verb, ref));
        if (scripted != null && !scripted.isEmpty()) {
            throw scripted.poll();
        }
    }

    private static String key(String verb, ResourceRef ref) {
        return verb + " " + ref;
    }

    static GenericKubernetesResource copy(GenericKubernetesResource resource) {
        return MAPPER.convertValue(resource, GenericKubernetesResource.class);
    }
}
