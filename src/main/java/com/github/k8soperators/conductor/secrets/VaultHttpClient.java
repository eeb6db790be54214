package com.github.k8soperators.conductor.secrets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SecretsEngineClient} over the HashiCorp Vault HTTP API. Reads state before writing it so that repeated
 * bootstraps leave the engine untouched.
 */
public class VaultHttpClient implements SecretsEngineClient {

    private static final Logger log = Logger.getLogger(VaultHttpClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final VaultTransport transport;

    public VaultHttpClient(VaultTransport transport) {
        this.transport = transport;
    }

    @Override
    public boolean isReady() {
        VaultResponse response = transport.send("GET", "sys/health", null);
        // 200 active, 429 unsealed standby
        return response.getStatus() == 200 || response.getStatus() == 429;
    }

    @Override
    public boolean ensureKvMount(String path) {
        JsonNode mounts = get("sys/mounts").orElseGet(MAPPER::createObjectNode);

        if (hasMount(mounts, path)) {
            log.tracef("Vault{mount=%s}: unchanged", path);
            return false;
        }

        ObjectNode body = MAPPER.createObjectNode().put("type", "kv");
        body.putObject("options").put("version", "2");
        send("POST", "sys/mounts/" + path, body);
        log.infof("Vault{mount=%s}: created", path);
        return true;
    }

    @Override
    public boolean ensureAuthBackend(String path, String type) {
        JsonNode backends = get("sys/auth").orElseGet(MAPPER::createObjectNode);

        if (hasMount(backends, path)) {
            log.tracef("Vault{auth=%s}: unchanged", path);
            return false;
        }

        send("POST", "sys/auth/" + path, MAPPER.createObjectNode().put("type", type));
        log.infof("Vault{auth=%s}: enabled", path);
        return true;
    }

    @Override
    public boolean configureKubernetesAuth(String authPath, KubernetesAuthConfig config) {
        JsonNode current = get("auth/" + authPath + "/config").map(n -> n.path("data")).orElseGet(MAPPER::createObjectNode);

        boolean sameHost = config.getKubernetesHost().equals(current.path("kubernetes_host").asText(null));
        boolean sameCa = config.getCaCertificate()
                .map(ca -> ca.equals(current.path("kubernetes_ca_cert").asText(null)))
                .orElse(true);

        // the reviewer token is write-only, so only host and CA can be compared
        if (sameHost && sameCa) {
            log.tracef("Vault{auth=%s}: configuration unchanged", authPath);
            return false;
        }

        ObjectNode body = MAPPER.createObjectNode().put("kubernetes_host", config.getKubernetesHost());
        config.getCaCertificate().ifPresent(ca -> body.put("kubernetes_ca_cert", ca));
        config.getReviewerToken().ifPresent(token -> body.put("token_reviewer_jwt", token));

        send("POST", "auth/" + authPath + "/config", body);
        log.infof("Vault{auth=%s}: configured for %s", authPath, config.getKubernetesHost());
        return true;
    }

    @Override
    public boolean writePolicy(String name, String rules) {
        Optional<String> current = get("sys/policies/acl/" + name)
                .map(n -> n.path("data").path("policy").asText(null));

        if (current.isPresent() && rules.equals(current.get())) {
            log.tracef("Vault{policy=%s}: unchanged", name);
            return false;
        }

        send("PUT", "sys/policies/acl/" + name, MAPPER.createObjectNode().put("policy", rules));
        log.infof("Vault{policy=%s}: written", name);
        return true;
    }

    @Override
    public void writeKubernetesRole(String authPath, String role, String serviceAccount, String namespace,
            List<String> policies, Duration tokenTtl) {
        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("bound_service_account_names").add(serviceAccount);
        body.putArray("bound_service_account_namespaces").add(namespace);
        policies.forEach(body.putArray("policies")::add);
        body.put("token_ttl", tokenTtl.getSeconds());

        send("POST", "auth/" + authPath + "/role/" + role, body);
        log.debugf("Vault{auth=%s, role=%s}: bound to %s/%s with %s", authPath, role, namespace, serviceAccount, policies);
    }

    @Override
    public Optional<Map<String, String>> readSecret(String mount, String path) {
        return get(mount + "/data/" + path).map(n -> {
            Map<String, String> data = new LinkedHashMap<>();
            n.path("data").path("data").fields().forEachRemaining(e -> data.put(e.getKey(), e.getValue().asText()));
            return data;
        });
    }

    @Override
    public void writeSecret(String mount, String path, Map<String, String> data) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("data", MAPPER.valueToTree(data));
        send("POST", mount + "/data/" + path, body);
        log.infof("Vault{mount=%s, path=%s}: written", mount, path);
    }

    @Override
    public boolean deleteRole(String authPath, String role) {
        return delete("auth/" + authPath + "/role/" + role);
    }

    @Override
    public boolean deletePolicy(String name) {
        return delete("sys/policies/acl/" + name);
    }

    static boolean hasMount(JsonNode listing, String path) {
        String key = path.endsWith("/") ? path : path + "/";
        return listing.has(key) || listing.path("data").has(key);
    }

    Optional<JsonNode> get(String path) {
        VaultResponse response = transport.send("GET", path, null);

        if (response.getStatus() == 404) {
            return Optional.empty();
        }

        return Optional.of(parse(check("GET", path, response)));
    }

    JsonNode send(String method, String path, JsonNode body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request for " + path, e);
        }

        return parse(check(method, path, transport.send(method, path, json)));
    }

    boolean delete(String path) {
        VaultResponse response = transport.send("DELETE", path, null);

        if (response.getStatus() == 404) {
            return false;
        }

        check("DELETE", path, response);
        return true;
    }

    static VaultResponse check(String method, String path, VaultResponse response) {
        if (!response.isSuccessful()) {
            throw new VaultException(response.getStatus(),
                    String.format("%s /v1/%s returned %d: %s", method, path, response.getStatus(), errors(response.getBody())));
        }
        return response;
    }

    static String errors(String body) {
        try {
            JsonNode errors = MAPPER.readTree(body).path("errors");
            return errors.isArray() ? errors.toString() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    static JsonNode parse(VaultResponse response) {
        if (response.getBody().isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new VaultException(response.getStatus(), "Unreadable response from the secrets engine: " + e.getOriginalMessage());
        }
    }
}
