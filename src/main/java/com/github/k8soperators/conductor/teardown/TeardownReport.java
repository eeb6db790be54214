package com.github.k8soperators.conductor.teardown;

import com.github.k8soperators.conductor.platform.ResourceRef;

import java.util.ArrayList;
import java.util.List;

public final class TeardownReport {

    private final List<ResourceRef> deleted = new ArrayList<>();
    private final List<ResourceRef> absent = new ArrayList<>();
    private final List<String> failures = new ArrayList<>();

    void deleted(ResourceRef ref) {
        deleted.add(ref);
    }

    void absent(ResourceRef ref) {
        absent.add(ref);
    }

    void failed(String failure) {
        failures.add(failure);
    }

    public List<ResourceRef> getDeleted() {
        return deleted;
    }

    public List<ResourceRef> getAbsent() {
        return absent;
    }

    public List<String> getFailures() {
        return failures;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public int exitCode() {
        return isSuccessful() ? 0 : 1;
    }

    @Override
    public String toString() {
        return String.format("deleted=%d, absent=%d, failed=%d", deleted.size(), absent.size(), failures.size());
    }
}
