package com.github.k8soperators.conductor.model;

import java.util.Map;
import java.util.Objects;

/**
 * Initial key-value material written to the secrets engine only when nothing exists at the path yet.
 */
public final class SeedSecret {

    private final String mount;
    private final String path;
    private final Map<String, String> data;

    public SeedSecret(String mount, String path, Map<String, String> data) {
        this.mount = Objects.requireNonNull(mount, "mount");
        this.path = Objects.requireNonNull(path, "path");
        this.data = Map.copyOf(data);
    }

    public String getMount() {
        return mount;
    }

    public String getPath() {
        return path;
    }

    public Map<String, String> getData() {
        return data;
    }
}
