package com.github.k8soperators.conductor.secrets;

/**
 * Linear progress of a secrets bootstrap phase.
 */
public enum BootstrapState {
    UNREGISTERED,
    TRUST_REGISTERED,
    ROLES_CREATED,
    SECRETS_DECLARED,
    SECRETS_SYNCHRONIZED
}
