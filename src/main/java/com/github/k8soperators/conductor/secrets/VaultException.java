package com.github.k8soperators.conductor.secrets;

/**
 * Non-2xx answer from the secrets engine, or a failure to reach it ({@code status == 0}).
 */
public class VaultException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public VaultException(int status, String message) {
        super(message);
        this.status = status;
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int getStatus() {
        return status;
    }
}
