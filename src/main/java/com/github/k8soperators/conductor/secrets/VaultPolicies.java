package com.github.k8soperators.conductor.secrets;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ACL policy documents for a KV v2 mount.
 */
public final class VaultPolicies {

    static final List<String> READ_CAPABILITIES = List.of("read", "list");
    static final List<String> WRITE_CAPABILITIES = List.of("create", "read", "update", "delete", "list");

    private VaultPolicies() {
    }

    public static String read(String mount) {
        return rules(mount, READ_CAPABILITIES);
    }

    public static String write(String mount) {
        return rules(mount, WRITE_CAPABILITIES);
    }

    static String rules(String mount, List<String> capabilities) {
        String quoted = capabilities.stream()
                .map(c -> "\"" + c + "\"")
                .collect(Collectors.joining(", ", "[", "]"));

        return String.format("path \"%1$s/data/*\" {\n  capabilities = %2$s\n}\n\npath \"%1$s/metadata/*\" {\n  capabilities = %2$s\n}\n",
                mount, quoted);
    }
}
