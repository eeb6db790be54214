package com.github.k8soperators.conductor.secrets;

import com.github.k8soperators.conductor.execution.ExecutionState;
import com.github.k8soperators.conductor.model.AccessLevel;
import com.github.k8soperators.conductor.model.ConsumerRole;
import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.RetryPolicy;
import com.github.k8soperators.conductor.model.SecretsBootstrap;
import com.github.k8soperators.conductor.model.SeedSecret;
import com.github.k8soperators.conductor.platform.PlatformClient;
import com.github.k8soperators.conductor.platform.ResourceRef;
import com.github.k8soperators.conductor.retry.FailureKind;
import com.github.k8soperators.conductor.retry.OrchestrationException;
import com.github.k8soperators.conductor.retry.RetryController;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Bridges platform identity into the secrets engine for a secrets bootstrap phase.
 * <p>
 * {@link #registerTrustAndRoles(Phase, ExecutionState)} moves the phase from {@code UNREGISTERED} to
 * {@code ROLES_CREATED}. The phase executor then applies the generated {@code VaultAuth} and
 * {@code VaultStaticSecret} objects ({@code SECRETS_DECLARED}) and waits for the destination secrets through the
 * readiness gate ({@code SECRETS_SYNCHRONIZED}).
 */
@ApplicationScoped
public class SecretsBootstrapCoordinator {

    private static final Logger log = Logger.getLogger(SecretsBootstrapCoordinator.class);

    static final String AUTH_TYPE = "kubernetes";

    private final SecretsEngineClient engine;
    private final PlatformClient platform;
    private final RetryController retry;
    private final Map<String, BootstrapState> states = new ConcurrentHashMap<>();

    @Inject
    public SecretsBootstrapCoordinator(SecretsEngineClient engine, PlatformClient platform, RetryController retry) {
        this.engine = engine;
        this.platform = platform;
        this.retry = retry;
    }

    public BootstrapState getState(String phaseName) {
        return states.getOrDefault(phaseName, BootstrapState.UNREGISTERED);
    }

    public void registerTrustAndRoles(Phase phase, ExecutionState state) {
        SecretsBootstrap bootstrap = bootstrap(phase);
        RetryPolicy policy = phase.getRetryPolicy();
        RetryController.RetryListener listener = (attempt, cause) -> state.recordAttempt(cause.getMessage());

        transition(phase, BootstrapState.UNREGISTERED);
        awaitEngine(phase, listener);

        for (String mount : bootstrap.getKvMounts()) {
            retry.execute("ensure kv mount " + mount, policy, () -> engine.ensureKvMount(mount), listener);
        }

        KubernetesAuthConfig authConfig = authConfig(bootstrap, policy, listener);
        retry.execute("enable auth " + bootstrap.getAuthPath(), policy,
                () -> engine.ensureAuthBackend(bootstrap.getAuthPath(), AUTH_TYPE), listener);
        retry.execute("configure auth " + bootstrap.getAuthPath(), policy,
                () -> engine.configureKubernetesAuth(bootstrap.getAuthPath(), authConfig), listener);
        transition(phase, BootstrapState.TRUST_REGISTERED);

        for (ConsumerRole consumer : bootstrap.getConsumers()) {
            List<String> policies = new ArrayList<>();

            retry.execute("write policy " + consumer.getReadPolicyName(), policy,
                    () -> engine.writePolicy(consumer.getReadPolicyName(), VaultPolicies.read(consumer.getMount())), listener);
            policies.add(consumer.getReadPolicyName());

            if (consumer.getAccess() == AccessLevel.READ_WRITE) {
                retry.execute("write policy " + consumer.getWritePolicyName(), policy,
                        () -> engine.writePolicy(consumer.getWritePolicyName(), VaultPolicies.write(consumer.getMount())), listener);
                policies.add(consumer.getWritePolicyName());
            }

            retry.run("write role " + consumer.getRoleName(), policy,
                    () -> engine.writeKubernetesRole(bootstrap.getAuthPath(), consumer.getRoleName(), consumer.getServiceAccount(),
                            consumer.getNamespace(), policies, consumer.getTokenTtl()), listener);
            log.infof("Phase %s: role %s bound to %s/%s", phase.getName(), consumer.getRoleName(),
                    consumer.getNamespace(), consumer.getServiceAccount());
        }

        for (SeedSecret seed : bootstrap.getSeedSecrets()) {
            Optional<Map<String, String>> existing = retry.execute("read " + seed.getMount() + "/" + seed.getPath(), policy,
                    () -> engine.readSecret(seed.getMount(), seed.getPath()), listener);

            if (existing.isEmpty()) {
                retry.run("seed " + seed.getMount() + "/" + seed.getPath(), policy,
                        () -> engine.writeSecret(seed.getMount(), seed.getPath(), seed.getData()), listener);
            } else {
                log.tracef("Vault{mount=%s, path=%s}: already present", seed.getMount(), seed.getPath());
            }
        }

        transition(phase, BootstrapState.ROLES_CREATED);
    }

    public void markDeclared(Phase phase) {
        transition(phase, BootstrapState.SECRETS_DECLARED);
    }

    public void markSynchronized(Phase phase) {
        transition(phase, BootstrapState.SECRETS_SYNCHRONIZED);
    }

    /**
     * Removes the roles and policies created for the phase's consumers. Absent ones count as removed.
     *
     * @return one message per item that could not be removed
     */
    public List<String> revoke(Phase phase) {
        SecretsBootstrap bootstrap = bootstrap(phase);
        List<String> errors = new ArrayList<>();

        for (ConsumerRole consumer : bootstrap.getConsumers()) {
            revoke(errors, "role " + consumer.getRoleName(), () -> engine.deleteRole(bootstrap.getAuthPath(), consumer.getRoleName()));
            revoke(errors, "policy " + consumer.getReadPolicyName(), () -> engine.deletePolicy(consumer.getReadPolicyName()));

            if (consumer.getAccess() == AccessLevel.READ_WRITE) {
                revoke(errors, "policy " + consumer.getWritePolicyName(), () -> engine.deletePolicy(consumer.getWritePolicyName()));
            }
        }

        states.remove(phase.getName());
        return errors;
    }

    void revoke(List<String> errors, String item, BooleanSupplier action) {
        try {
            boolean removed = action.getAsBoolean();
            log.infof("Vault{%s}: %s", item, removed ? "deleted" : "already absent");
        } catch (RuntimeException e) {
            log.warnf(e, "Vault{%s}: could not be deleted", item);
            errors.add(item + ": " + e.getMessage());
        }
    }

    void awaitEngine(Phase phase, RetryController.RetryListener listener) {
        retry.execute("secrets engine health", phase.getRetryPolicy(), () -> {
            if (!engine.isReady()) {
                throw new OrchestrationException(FailureKind.TRANSIENT, "secrets engine is sealed or not initialised");
            }
            return Boolean.TRUE;
        }, listener);
        log.debugf("Phase %s: secrets engine ready", phase.getName());
    }

    KubernetesAuthConfig authConfig(SecretsBootstrap bootstrap, RetryPolicy policy, RetryController.RetryListener listener) {
        if (bootstrap.getReviewerSecretName().isEmpty()) {
            return new KubernetesAuthConfig(bootstrap.getKubernetesHost(), null, null);
        }

        ResourceRef ref = new ResourceRef("v1", "Secret",
                bootstrap.getReviewerSecretNamespace().orElse(null),
                bootstrap.getReviewerSecretName().get());

        GenericKubernetesResource secret = retry.execute("get " + ref, policy, () -> platform.get(ref), listener)
                .orElseThrow(() -> new OrchestrationException(FailureKind.FATAL, ref + ": token reviewer secret not found"));

        return new KubernetesAuthConfig(bootstrap.getKubernetesHost(),
                decode(ref, secret, "ca.crt").orElse(null),
                decode(ref, secret, "token")
                        .orElseThrow(() -> new OrchestrationException(FailureKind.FATAL, ref + ": token reviewer secret has no token")));
    }

    static Optional<String> decode(ResourceRef ref, GenericKubernetesResource secret, String key) {
        Object data = secret.getAdditionalProperties().get("data");

        if (!(data instanceof Map)) {
            return Optional.empty();
        }

        return Optional.ofNullable(((Map<?, ?>) data).get(key))
                .map(String::valueOf)
                .map(value -> {
                    try {
                        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
                    } catch (IllegalArgumentException e) {
                        throw new OrchestrationException(FailureKind.FATAL,
                                ref + ": key '" + key + "' is not valid base64", e);
                    }
                });
    }

    void transition(Phase phase, BootstrapState next) {
        BootstrapState previous = states.put(phase.getName(), next);
        if (previous != next) {
            log.infof("Phase %s: secrets bootstrap %s", phase.getName(), next);
        }
    }

    static SecretsBootstrap bootstrap(Phase phase) {
        return phase.getSecretsBootstrap()
                .orElseThrow(() -> new IllegalArgumentException("Phase " + phase.getName() + " has no secrets bootstrap"));
    }
}
