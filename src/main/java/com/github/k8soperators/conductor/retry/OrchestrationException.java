package com.github.k8soperators.conductor.retry;

public class OrchestrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public OrchestrationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OrchestrationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isKind(FailureKind other) {
        return kind == other;
    }
}
