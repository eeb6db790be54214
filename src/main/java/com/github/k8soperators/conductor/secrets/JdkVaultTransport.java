package com.github.k8soperators.conductor.secrets;

import com.github.k8soperators.conductor.retry.CancelledException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class JdkVaultTransport implements VaultTransport {

    private static final Logger log = Logger.getLogger(JdkVaultTransport.class);

    static final String TOKEN_HEADER = "X-Vault-Token";

    private final HttpClient httpClient;
    private final String address;
    private final String token;
    private final Duration requestTimeout;

    public JdkVaultTransport(String address, String token, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
        this.address = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
        this.token = token;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public VaultResponse send(String method, String path, String jsonBody) {
        HttpRequest.BodyPublisher body = jsonBody == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(jsonBody);

        HttpRequest request = HttpRequest.newBuilder(URI.create(address + "/v1/" + path))
                .timeout(requestTimeout)
                .header(TOKEN_HEADER, token)
                .header("Content-Type", "application/json")
                .method(method, body)
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.tracef("%s /v1/%s -> %d", method, path, response.statusCode());
            return new VaultResponse(response.statusCode(), response.body());
        } catch (IOException e) {
            throw new VaultException(String.format("%s /v1/%s: %s", method, path, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted during " + method + " /v1/" + path);
        }
    }
}
