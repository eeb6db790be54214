package com.github.k8soperators.conductor.secrets;

/**
 * Raw HTTP exchange with the secrets engine. {@code path} is relative to {@code /v1/}.
 */
public interface VaultTransport {

    /**
     * @throws VaultException with status {@code 0} when the engine cannot be reached
     */
    VaultResponse send(String method, String path, String jsonBody);
}
