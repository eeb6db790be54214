package com.github.k8soperators.conductor.model;

public enum ConditionType {
    /**
     * Deployment reports {@code Available=True}; StatefulSet or DaemonSet has all replicas ready.
     */
    WORKLOAD_AVAILABLE,
    /**
     * At least one pod matches the selector and every matching pod reports {@code Ready=True}.
     */
    PODS_READY,
    CRD_ESTABLISHED,
    /**
     * Secret exists and carries at least one non-empty key.
     */
    SECRET_MATERIALIZED,
    /**
     * GitOps reconciler object (Kustomization, HelmRelease, GitRepository) reports {@code Ready=True}.
     */
    GITOPS_SYNCED,
    EXISTS
}
