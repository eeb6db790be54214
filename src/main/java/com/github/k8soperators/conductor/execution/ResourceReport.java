package com.github.k8soperators.conductor.execution;

import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.platform.ResourceRef;

public final class ResourceReport {

    private final ResourceRef ref;
    private final boolean required;
    private final ResourceOutcome outcome;
    private final String error;

    private ResourceReport(ResourceRef ref, boolean required, ResourceOutcome outcome, String error) {
        this.ref = ref;
        this.required = required;
        this.outcome = outcome;
        this.error = error;
    }

    public static ResourceReport of(ResourceDescriptor descriptor, ResourceOutcome outcome) {
        return new ResourceReport(descriptor.getRef(), descriptor.isRequired(), outcome, null);
    }

    public static ResourceReport failed(ResourceDescriptor descriptor, String error) {
        return new ResourceReport(descriptor.getRef(), descriptor.isRequired(), ResourceOutcome.FAILED, error);
    }

    public ResourceRef getRef() {
        return ref;
    }

    public boolean isRequired() {
        return required;
    }

    public ResourceOutcome getOutcome() {
        return outcome;
    }

    public boolean isFailed() {
        return outcome == ResourceOutcome.FAILED;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return error == null ? ref + ": " + outcome : ref + ": " + outcome + " (" + error + ")";
    }
}
