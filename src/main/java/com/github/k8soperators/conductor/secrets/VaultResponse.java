package com.github.k8soperators.conductor.secrets;

public final class VaultResponse {

    private final int status;
    private final String body;

    public VaultResponse(int status, String body) {
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
