package com.github.k8soperators.conductor.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.k8soperators.conductor.api.v1alpha1.ConsumerSpec;
import com.github.k8soperators.conductor.api.v1alpha1.HealthCheckSpec;
import com.github.k8soperators.conductor.api.v1alpha1.PhasePlan;
import com.github.k8soperators.conductor.api.v1alpha1.PhaseSpec;
import com.github.k8soperators.conductor.api.v1alpha1.RetryPolicySpec;
import com.github.k8soperators.conductor.api.v1alpha1.SecretBindingSpec;
import com.github.k8soperators.conductor.api.v1alpha1.SecretsBootstrapSpec;
import com.github.k8soperators.conductor.api.v1alpha1.SeedSecretSpec;
import com.github.k8soperators.conductor.model.AccessLevel;
import com.github.k8soperators.conductor.model.ConditionType;
import com.github.k8soperators.conductor.model.ConsumerRole;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.ReadinessCheck;
import com.github.k8soperators.conductor.model.ResourceDescriptor;
import com.github.k8soperators.conductor.model.RetryPolicy;
import com.github.k8soperators.conductor.model.SecretBinding;
import com.github.k8soperators.conductor.model.SecretsBootstrap;
import com.github.k8soperators.conductor.model.SeedSecret;
import com.github.k8soperators.conductor.secrets.SecretDeclarations;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the phase plan file and the manifests it references into immutable {@link Phase} definitions. Every
 * problem is reported as a {@link ConfigurationException} naming the phase and field.
 */
@ApplicationScoped
public class PhasePlanLoader {

    private static final Logger log = Logger.getLogger(PhasePlanLoader.class);

    static final Duration DEFAULT_PHASE_TIMEOUT = Duration.ofMinutes(10);
    static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);
    static final Duration DEFAULT_SYNC_TIMEOUT = Duration.ofMinutes(5);
    static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(60);
    static final String DEFAULT_AUTH_PATH = "kubernetes";
    static final String DEFAULT_KUBERNETES_HOST = "https://kubernetes.default.svc";
    static final String DEFAULT_VAULT_CONNECTION = "default";

    private static final Map<String, String> DEFAULT_API_VERSIONS = Map.of(
            "Deployment", "apps/v1",
            "StatefulSet", "apps/v1",
            "DaemonSet", "apps/v1",
            "CustomResourceDefinition", "apiextensions.k8s.io/v1",
            "GitRepository", "source.toolkit.fluxcd.io/v1",
            "HelmRepository", "source.toolkit.fluxcd.io/v1beta2",
            "Kustomization", "kustomize.toolkit.fluxcd.io/v1",
            "HelmRelease", "helm.toolkit.fluxcd.io/v2beta1");

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final PlaceholderResolver placeholders;

    @Inject
    public PhasePlanLoader(Environment environment) {
        this.placeholders = new PlaceholderResolver(environment);
    }

    public List<Phase> load(Path planFile) throws ConfigurationException {
        PhasePlan plan = readPlan(planFile);

        if (plan == null || plan.getPhases() == null || plan.getPhases().isEmpty()) {
            throw new ConfigurationException(String.format("Plan %s declares no phases", planFile));
        }

        Path baseDirectory = Optional.ofNullable(planFile.toAbsolutePath().getParent()).orElse(planFile);
        List<Phase> phases = new ArrayList<>();

        for (int i = 0; i < plan.getPhases().size(); i++) {
            phases.add(toPhase(plan.getPhases().get(i), i, baseDirectory));
        }

        log.infof("Loaded %d phase(s) from %s", phases.size(), planFile);
        return phases;
    }

    PhasePlan readPlan(Path planFile) throws ConfigurationException {
        String text = read(planFile, "plan file " + planFile);

        try {
            return yaml.readValue(placeholders.resolve(text, planFile.toString()), PhasePlan.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(String.format("Plan %s is not valid: %s", planFile, e.getOriginalMessage()), e);
        }
    }

    Phase toPhase(PhaseSpec spec, int index, Path baseDirectory) throws ConfigurationException {
        String name = spec.getName();

        if (name == null || name.isBlank()) {
            throw ConfigurationException.forField("#" + (index + 1), "name", "is required");
        }

        Duration timeout = duration(name, "timeout", spec.getTimeout(), DEFAULT_PHASE_TIMEOUT);

        Phase.Builder builder = Phase.builder(name)
                .dependsOn(Optional.ofNullable(spec.getDependsOn()).orElseGet(List::of))
                .withOptional(Boolean.TRUE.equals(spec.getOptional()))
                .withTimeout(timeout)
                .withRetryPolicy(retryPolicy(name, spec.getRetryPolicy()));

        if (spec.getResources() == null && spec.getSecretsBootstrap() == null) {
            throw ConfigurationException.forField(name, "resources", "is required");
        }

        for (String manifest : Optional.ofNullable(spec.getResources()).orElseGet(List::of)) {
            builder.addResources(manifest(name, "resources", baseDirectory, manifest, true));
        }
        for (String manifest : Optional.ofNullable(spec.getOptionalResources()).orElseGet(List::of)) {
            builder.addResources(manifest(name, "optionalResources", baseDirectory, manifest, false));
        }

        List<HealthCheckSpec> healthChecks = Optional.ofNullable(spec.getHealthChecks()).orElseGet(List::of);
        for (int i = 0; i < healthChecks.size(); i++) {
            builder.addHealthCheck(healthCheck(name, "healthChecks[" + i + "]", healthChecks.get(i), timeout));
        }

        if (spec.getSecretsBootstrap() != null) {
            SecretsBootstrap bootstrap = secretsBootstrap(name, spec.getSecretsBootstrap());
            builder.withSecretsBootstrap(bootstrap)
                    .addResources(SecretDeclarations.declare(name, bootstrap));
            SecretDeclarations.materializationChecks(bootstrap).forEach(builder::addHealthCheck);
        }

        return builder.build();
    }

    RetryPolicy retryPolicy(String phase, RetryPolicySpec spec) throws ConfigurationException {
        if (spec == null) {
            return RetryPolicy.DEFAULT;
        }

        RetryPolicy defaults = RetryPolicy.DEFAULT;
        int maxAttempts = Optional.ofNullable(spec.getMaxAttempts()).orElse(defaults.getMaxAttempts());
        double multiplier = Optional.ofNullable(spec.getMultiplier()).orElse(defaults.getMultiplier());

        if (maxAttempts < 1) {
            throw ConfigurationException.forField(phase, "retryPolicy.maxAttempts", "must be at least 1");
        }
        if (multiplier < 1.0) {
            throw ConfigurationException.forField(phase, "retryPolicy.multiplier", "must be at least 1.0");
        }

        return new RetryPolicy(maxAttempts,
                duration(phase, "retryPolicy.initialBackoff", spec.getInitialBackoff(), defaults.getInitialBackoff()),
                duration(phase, "retryPolicy.maxBackoff", spec.getMaxBackoff(), defaults.getMaxBackoff()),
                multiplier);
    }

    List<ResourceDescriptor> manifest(String phase, String field, Path baseDirectory, String reference, boolean required)
            throws ConfigurationException {
        Path file = baseDirectory.resolve(reference).normalize();

        if (!Files.isRegularFile(file)) {
            throw ConfigurationException.forField(phase, field, String.format("manifest '%s' not found", reference));
        }

        String text = placeholders.resolve(read(file, "manifest " + file), file.toString());
        List<ResourceDescriptor> descriptors = new ArrayList<>();

        try (MappingIterator<GenericKubernetesResource> documents = yaml.readerFor(GenericKubernetesResource.class).readValues(text)) {
            while (documents.hasNextValue()) {
                GenericKubernetesResource document = documents.nextValue();

                if (document == null || document.getKind() == null && document.getMetadata() == null) {
                    continue;
                }
                if (document.getApiVersion() == null || document.getKind() == null
                        || document.getMetadata() == null || document.getMetadata().getName() == null) {
                    throw ConfigurationException.forField(phase, field,
                            String.format("manifest '%s' contains an object without apiVersion, kind or metadata.name", reference));
                }

                descriptors.add(ResourceDescriptor.of(phase, document, required));
            }
        } catch (IOException e) {
            throw ConfigurationException.forField(phase, field, String.format("manifest '%s' is not valid YAML: %s", reference, e.getMessage()));
        }

        log.debugf("Phase %s: %d object(s) read from %s", phase, descriptors.size(), reference);
        return descriptors;
    }

    ReadinessCheck healthCheck(String phase, String field, HealthCheckSpec spec, Duration phaseTimeout) throws ConfigurationException {
        if (spec.getKind() == null || spec.getKind().isBlank()) {
            throw ConfigurationException.forField(phase, field + ".kind", "is required");
        }
        if (spec.getName() == null && (spec.getLabels() == null || spec.getLabels().isEmpty())) {
            throw ConfigurationException.forField(phase, field, "needs either a name or labels");
        }

        return ReadinessCheck.builder()
                .withApiVersion(Optional.ofNullable(spec.getApiVersion())
                        .orElse(DEFAULT_API_VERSIONS.getOrDefault(spec.getKind(), "v1")))
                .withTargetKind(spec.getKind())
                .withNamespace(spec.getNamespace())
                .withName(spec.getName())
                .withLabels(spec.getLabels())
                .withCondition(condition(phase, field + ".condition", spec.getCondition()))
                .withTimeout(duration(phase, field + ".timeout", spec.getTimeout(), phaseTimeout))
                .withRequired(!Boolean.FALSE.equals(spec.getRequired()))
                .build();
    }

    SecretsBootstrap secretsBootstrap(String phase, SecretsBootstrapSpec spec) throws ConfigurationException {
        String field = "secretsBootstrap";
        List<ConsumerRole> consumers = new ArrayList<>();
        List<String> kvMounts = Optional.ofNullable(spec.getKvMounts()).orElseGet(List::of);

        for (ConsumerSpec consumer : Optional.ofNullable(spec.getConsumers()).orElseGet(List::of)) {
            String consumerField = field + ".consumers[" + consumer.getName() + "]";

            if (consumer.getName() == null || consumer.getServiceAccount() == null || consumer.getNamespace() == null) {
                throw ConfigurationException.forField(phase, consumerField, "name, serviceAccount and namespace are required");
            }

            String mount = Optional.ofNullable(consumer.getMount())
                    .or(() -> kvMounts.stream().findFirst())
                    .orElseThrow(() -> ConfigurationException.forField(phase, consumerField + ".mount", "is required when no kvMounts are declared"));

            consumers.add(new ConsumerRole(consumer.getName(),
                    consumer.getServiceAccount(),
                    consumer.getNamespace(),
                    mount,
                    access(phase, consumerField + ".access", consumer.getAccess()),
                    duration(phase, consumerField + ".tokenTtl", consumer.getTokenTtl(), DEFAULT_TOKEN_TTL)));
        }

        List<SeedSecret> seedSecrets = new ArrayList<>();
        for (SeedSecretSpec seed : Optional.ofNullable(spec.getSeedSecrets()).orElseGet(List::of)) {
            if (seed.getMount() == null || seed.getPath() == null || seed.getData() == null || seed.getData().isEmpty()) {
                throw ConfigurationException.forField(phase, field + ".seedSecrets", "mount, path and non-empty data are required");
            }
            seedSecrets.add(new SeedSecret(seed.getMount(), seed.getPath(), seed.getData()));
        }

        List<SecretBinding> bindings = new ArrayList<>();
        for (SecretBindingSpec binding : Optional.ofNullable(spec.getBindings()).orElseGet(List::of)) {
            String bindingField = field + ".bindings[" + binding.getDestination() + "]";

            if (binding.getConsumer() == null || consumers.stream().noneMatch(c -> c.getName().equals(binding.getConsumer()))) {
                throw ConfigurationException.forField(phase, bindingField + ".consumer",
                        String.format("references unknown consumer '%s'", binding.getConsumer()));
            }
            if (binding.getSecretPath() == null) {
                throw ConfigurationException.forField(phase, bindingField + ".secretPath", "is required");
            }

            String[] destination = Optional.ofNullable(binding.getDestination()).orElse("").split("/");
            if (destination.length != 2 || Arrays.stream(destination).anyMatch(String::isBlank)) {
                throw ConfigurationException.forField(phase, bindingField + ".destination", "must be <namespace>/<name>");
            }

            bindings.add(new SecretBinding(binding.getConsumer(),
                    binding.getSecretPath(),
                    destination[0],
                    destination[1],
                    duration(phase, bindingField + ".refreshInterval", binding.getRefreshInterval(), DEFAULT_REFRESH_INTERVAL)));
        }

        return new SecretsBootstrap(Optional.ofNullable(spec.getAuthPath()).orElse(DEFAULT_AUTH_PATH),
                Optional.ofNullable(spec.getKubernetesHost()).orElse(DEFAULT_KUBERNETES_HOST),
                spec.getReviewerSecret() == null ? null : spec.getReviewerSecret().getNamespace(),
                spec.getReviewerSecret() == null ? null : spec.getReviewerSecret().getName(),
                kvMounts,
                consumers,
                seedSecrets,
                bindings,
                duration(phase, field + ".syncTimeout", spec.getSyncTimeout(), DEFAULT_SYNC_TIMEOUT),
                Optional.ofNullable(spec.getVaultConnectionRef()).orElse(DEFAULT_VAULT_CONNECTION));
    }

    static ConditionType condition(String phase, String field, String value) throws ConfigurationException {
        if (value == null) {
            return ConditionType.EXISTS;
        }
        try {
            return ConditionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.forField(phase, field,
                    String.format("unknown condition '%s', expected one of %s", value, Arrays.toString(ConditionType.values())));
        }
    }

    static AccessLevel access(String phase, String field, String value) throws ConfigurationException {
        if (value == null) {
            return AccessLevel.READ;
        }
        try {
            return AccessLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.forField(phase, field,
                    String.format("unknown access '%s', expected one of %s", value, Arrays.toString(AccessLevel.values())));
        }
    }

    static Duration duration(String phase, String field, String value, Duration fallback) throws ConfigurationException {
        if (value == null) {
            return fallback;
        }

        Duration parsed;
        try {
            parsed = Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ConfigurationException.forField(phase, field, String.format("'%s' is not an ISO-8601 duration", value));
        }

        if (parsed.isNegative() || parsed.isZero()) {
            throw ConfigurationException.forField(phase, field, "must be positive");
        }
        return parsed;
    }

    static String read(Path file, String description) throws ConfigurationException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(String.format("Cannot read %s: %s", description, e.getMessage()), e);
        }
    }
}
