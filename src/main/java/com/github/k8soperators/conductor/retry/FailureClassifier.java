package com.github.k8soperators.conductor.retry;

import com.github.k8soperators.conductor.secrets.VaultException;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public final class FailureClassifier {

    private static final Set<Integer> TRANSIENT_CODES = Set.of(408, 429, 500, 502, 503, 504);

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable error) {
        if (error instanceof OrchestrationException) {
            return ((OrchestrationException) error).getKind();
        }

        if (error instanceof KubernetesClientException) {
            KubernetesClientException kce = (KubernetesClientException) error;

            if (kce.getCode() == 0 && hasIoCause(kce)) {
                return FailureKind.TRANSIENT;
            }

            return classifyStatus(kce.getCode(), describe(kce));
        }

        if (error instanceof VaultException) {
            VaultException ve = (VaultException) error;

            if (ve.getStatus() == 0 && hasIoCause(ve)) {
                return FailureKind.TRANSIENT;
            }

            return classifyStatus(ve.getStatus(), ve.getMessage());
        }

        if (hasIoCause(error)) {
            return FailureKind.TRANSIENT;
        }

        return FailureKind.FATAL;
    }

    public static FailureKind classifyStatus(int status, String message) {
        if (TRANSIENT_CODES.contains(status)) {
            return FailureKind.TRANSIENT;
        }
        if (status == 409) {
            return FailureKind.CONFLICT;
        }
        if (status == 422 && mentionsImmutableField(message)) {
            return FailureKind.CONFLICT;
        }
        return FailureKind.FATAL;
    }

    static boolean mentionsImmutableField(String message) {
        return Optional.ofNullable(message)
                .map(m -> m.toLowerCase(Locale.ROOT))
                .filter(m -> m.contains("immutable") || m.contains("may not change once set"))
                .isPresent();
    }

    static boolean hasIoCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof UncheckedIOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    static String describe(KubernetesClientException kce) {
        StringBuilder text = new StringBuilder(String.valueOf(kce.getMessage()));

        if (kce.getStatus() != null && kce.getStatus().getMessage() != null) {
            text.append(' ').append(kce.getStatus().getMessage());
        }

        return text.toString();
    }
}
