package com.github.k8soperators.conductor.model;

public enum AccessLevel {
    READ,
    READ_WRITE
}
