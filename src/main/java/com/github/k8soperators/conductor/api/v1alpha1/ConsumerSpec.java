package com.github.k8soperators.conductor.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "name", "serviceAccount", "namespace", "mount", "access", "tokenTtl" })
public class ConsumerSpec {

    private String name;

    private String serviceAccount;

    private String namespace;

    private String mount;

    /**
     * {@code READ} or {@code READ_WRITE}.
     */
    private String access;

    private String tokenTtl;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getServiceAccount() {
        return serviceAccount;
    }

    public void setServiceAccount(String serviceAccount) {
        this.serviceAccount = serviceAccount;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getMount() {
        return mount;
    }

    public void setMount(String mount) {
        this.mount = mount;
    }

    public String getAccess() {
        return access;
    }

    public void setAccess(String access) {
        this.access = access;
    }

    public String getTokenTtl() {
        return tokenTtl;
    }

    public void setTokenTtl(String tokenTtl) {
        this.tokenTtl = tokenTtl;
    }

}
