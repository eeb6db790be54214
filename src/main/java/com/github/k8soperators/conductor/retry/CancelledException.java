package com.github.k8soperators.conductor.retry;

/**
 * Raised out of any wait once the global cancellation signal has fired.
 */
public class CancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CancelledException(String reason) {
        super(reason);
    }
}
