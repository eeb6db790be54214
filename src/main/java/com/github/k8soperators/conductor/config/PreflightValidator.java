package com.github.k8soperators.conductor.config;

import com.github.k8soperators.conductor.model.Phase;
import org.jboss.logging.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that the credentials a plan needs are present before the first platform call.
 */
public class PreflightValidator {

    private static final Logger log = Logger.getLogger(PreflightValidator.class);

    public static final String VAULT_ADDR = "VAULT_ADDR";
    public static final String VAULT_TOKEN = "VAULT_TOKEN";
    public static final String KUBECONFIG = "KUBECONFIG";
    public static final String KUBERNETES_SERVICE_HOST = "KUBERNETES_SERVICE_HOST";

    private final Environment environment;

    public PreflightValidator(Environment environment) {
        this.environment = environment;
    }

    public void validate(List<Phase> phases) throws ConfigurationException {
        validate(phases, true);
    }

    /**
     * @param secretsEngineUsed whether the command talks to the secrets engine at all
     */
    public void validate(List<Phase> phases, boolean secretsEngineUsed) throws ConfigurationException {
        List<String> problems = new ArrayList<>();

        if (!hasKubernetesCredentials()) {
            problems.add(String.format("no platform credentials: set %s, provide ~/.kube/config or run in-cluster (%s)",
                    KUBECONFIG, KUBERNETES_SERVICE_HOST));
        }

        phases.stream()
                .filter(phase -> secretsEngineUsed && phase.isSecretsBootstrap())
                .findFirst()
                .ifPresent(phase -> {
                    for (String variable : List.of(VAULT_ADDR, VAULT_TOKEN)) {
                        if (!environment.isSet(variable)) {
                            problems.add(String.format("Phase '%s' needs the secrets engine but %s is not set",
                                    phase.getName(), variable));
                        }
                    }
                });

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Pre-flight validation failed: " + String.join("; ", problems));
        }

        log.debug("Pre-flight validation passed");
    }

    boolean hasKubernetesCredentials() {
        if (environment.isSet(KUBERNETES_SERVICE_HOST)) {
            return true;
        }

        return environment.get(KUBECONFIG)
                .map(value -> value.split(File.pathSeparator))
                .map(paths -> {
                    for (String path : paths) {
                        if (!path.isBlank() && Files.isRegularFile(Paths.get(path))) {
                            return true;
                        }
                    }
                    return false;
                })
                .orElseGet(() -> Files.isRegularFile(defaultKubeconfig()));
    }

    Path defaultKubeconfig() {
        return environment.getHomeDirectory().resolve(".kube").resolve("config");
    }
}
