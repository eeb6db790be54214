package com.github.k8soperators.conductor.config;

import com.github.k8soperators.conductor.model.Phase;
import com.github.k8soperators.conductor.model.SecretsBootstrap;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentTest {

    @Test
    void readsVariablesThroughConfig() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withDefaultValue("VAULT_ADDR", "http://vault.vault-system:8200")
                .withDefaultValue("VAULT_TOKEN", " ")
                .withDefaultValue("user.home", "/home/ops")
                .build();

        Environment environment = Environment.fromConfig(config);

        assertThat(environment.get("VAULT_ADDR")).contains("http://vault.vault-system:8200");
        assertThat(environment.isSet("VAULT_TOKEN")).isFalse();
        assertThat(environment.get("KUBECONFIG")).isEmpty();
        assertThat(environment.getHomeDirectory()).isEqualTo(Paths.get("/home/ops"));
    }

    @Test
    void missingVaultVariablesFromConfigFailPreflight() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withDefaultValue("KUBERNETES_SERVICE_HOST", "10.96.0.1")
                .withDefaultValue("VAULT_ADDR", "http://vault.vault-system:8200")
                .build();
        PreflightValidator validator = new PreflightValidator(Environment.fromConfig(config));

        Phase secrets = Phase.builder("vault-bootstrap")
                .withSecretsBootstrap(new SecretsBootstrap("kubernetes", "https://kubernetes.default.svc", null, null,
                        List.of("secret"), List.of(), List.of(), List.of(), Duration.ofMinutes(5), "default"))
                .build();

        assertThatThrownBy(() -> validator.validate(List.of(secrets)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Pre-flight validation failed: Phase 'vault-bootstrap' needs the secrets engine but VAULT_TOKEN is not set");
    }
}
