package com.github.k8soperators.conductor.model;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class ReadinessCheck {

    private final String apiVersion;
    private final String targetKind;
    private final String namespace;
    private final String name;
    private final Map<String, String> labels;
    private final ConditionType condition;
    private final Duration timeout;
    private final boolean required;

    ReadinessCheck(Builder builder) {
        this.apiVersion = Objects.requireNonNull(builder.apiVersion, "apiVersion");
        this.targetKind = Objects.requireNonNull(builder.targetKind, "targetKind");
        this.namespace = builder.namespace;
        this.name = builder.name;
        this.labels = Collections.unmodifiableMap(new TreeMap<>(builder.labels));
        this.condition = Objects.requireNonNull(builder.condition, "condition");
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        this.required = builder.required;

        if (name == null && labels.isEmpty()) {
            throw new IllegalArgumentException("ReadinessCheck for " + targetKind + " needs a name or a label selector");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getTargetKind() {
        return targetKind;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public boolean isNameSelector() {
        return name != null;
    }

    public String getSelector() {
        if (name != null) {
            return "name=" + name;
        }
        return labels.entrySet()
                .stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    public ConditionType getCondition() {
        return condition;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Stable identifier used in logs and in {@code status} output.
     */
    public String getIdentifier() {
        String target = name != null
                ? String.format("%s{namespace=%s, name=%s}", targetKind, namespace, name)
                : String.format("%s{namespace=%s, selector=%s}", targetKind, namespace, getSelector());
        return target + " " + condition;
    }

    @Override
    public String toString() {
        return getIdentifier();
    }

    public static final class Builder {
        private String apiVersion = "v1";
        private String targetKind;
        private String namespace;
        private String name;
        private Map<String, String> labels = Map.of();
        private ConditionType condition = ConditionType.EXISTS;
        private Duration timeout = Duration.ofMinutes(5);
        private boolean required = true;

        Builder() {
        }

        public Builder withApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder withTargetKind(String targetKind) {
            this.targetKind = targetKind;
            return this;
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withLabels(Map<String, String> labels) {
            this.labels = labels == null ? Map.of() : labels;
            return this;
        }

        public Builder withCondition(ConditionType condition) {
            this.condition = condition;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withRequired(boolean required) {
            this.required = required;
            return this;
        }

        public ReadinessCheck build() {
            return new ReadinessCheck(this);
        }
    }
}
