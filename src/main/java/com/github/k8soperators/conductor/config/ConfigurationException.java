package com.github.k8soperators.conductor.config;

/**
 * Problem with the plan or the environment that is detected before any platform call is made.
 */
public class ConfigurationException extends Exception {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException forField(String phase, String field, String problem) {
        return new ConfigurationException(String.format("Phase '%s', field '%s': %s", phase, field, problem));
    }
}
