package com.github.k8soperators.conductor.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only view of the variables conductor reads by name ({@code VAULT_ADDR}, {@code KUBECONFIG}, plan
 * placeholders). At runtime these come from MicroProfile Config, so environment variables, system properties and
 * {@code application.properties} all apply.
 */
public final class Environment {

    private final Function<String, Optional<String>> lookup;
    private final Path homeDirectory;

    public Environment(Map<String, String> variables, Path homeDirectory) {
        Map<String, String> copy = Map.copyOf(variables);
        this.lookup = name -> Optional.ofNullable(copy.get(name));
        this.homeDirectory = homeDirectory;
    }

    Environment(Config config, Path homeDirectory) {
        this.lookup = name -> config.getOptionalValue(name, String.class);
        this.homeDirectory = homeDirectory;
    }

    public static Environment system() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static Environment fromConfig(Config config) {
        return new Environment(config, Paths.get(config.getOptionalValue("user.home", String.class)
                .orElseGet(() -> System.getProperty("user.home"))));
    }

    public Optional<String> get(String name) {
        return lookup.apply(name).filter(value -> !value.isBlank());
    }

    public boolean isSet(String name) {
        return get(name).isPresent();
    }

    public Path getHomeDirectory() {
        return homeDirectory;
    }
}
