package com.github.k8soperators.conductor.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.k8soperators.conductor.support.Resources;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceDiffTest {

    @Test
    void serverPopulatedFieldsDoNotCountAsDrift() {
        GenericKubernetesResource desired = Resources.deployment("kyuubi", "minio", "minio/minio:RELEASE.2023");
        GenericKubernetesResource live = Resources.deployment("kyuubi", "minio", "minio/minio:RELEASE.2023");

        live.getMetadata().setUid("0b9d3b8e");
        live.getMetadata().setResourceVersion("4711");
        live.getMetadata().setCreationTimestamp("2026-10-18T09:00:00Z");
        Map<String, Object> spec = new LinkedHashMap<>(spec(live));
        spec.put("replicas", 1);
        spec.put("revisionHistoryLimit", 10);
        live.setAdditionalProperty("spec", spec);
        Resources.withCondition(live, "Available", "True");

        assertThat(ResourceDiff.isInSync(live, desired)).isTrue();
    }

    @Test
    void changedValueProducesReplaceOperation() {
        GenericKubernetesResource desired = Resources.configMap("grafana", "dashboards", Map.of("title", "Platform"));
        GenericKubernetesResource live = Resources.configMap("grafana", "dashboards", Map.of("title", "Old"));

        JsonNode patch = ResourceDiff.diff(live, desired);

        assertThat(patch).hasSize(1);
        assertThat(patch.get(0).get("op").asText()).isEqualTo("replace");
        assertThat(patch.get(0).get("path").asText()).isEqualTo("/data/title");
    }

    @Test
    void missingKeyAndLabelsAreDrift() {
        GenericKubernetesResource desired = Resources.configMap("grafana", "dashboards", Map.of("title", "Platform", "theme", "dark"));
        desired.getMetadata().setLabels(Map.of("app.kubernetes.io/managed-by", "conductor"));
        GenericKubernetesResource live = Resources.configMap("grafana", "dashboards", Map.of("title", "Platform"));

        JsonNode patch = ResourceDiff.diff(live, desired);

        assertThat(patch).extracting(op -> op.get("path").asText())
                .contains("/data/theme", "/metadata/labels");
    }

    @Test
    void extraLiveLabelsAreIgnored() {
        GenericKubernetesResource desired = Resources.configMap("grafana", "dashboards", Map.of("title", "Platform"));
        desired.getMetadata().setLabels(Map.of("app", "grafana"));
        GenericKubernetesResource live = Resources.configMap("grafana", "dashboards", Map.of("title", "Platform"));
        live.getMetadata().setLabels(Map.of("app", "grafana", "pod-template-hash", "abc"));

        assertThat(ResourceDiff.isInSync(live, desired)).isTrue();
    }

    @Test
    void listLengthChangeIsDrift() {
        GenericKubernetesResource desired = Resources.resource("v1", "ConfigMap", "grafana", "sources");
        desired.setAdditionalProperty("spec", Map.of("hosts", List.of("a", "b")));
        GenericKubernetesResource live = Resources.resource("v1", "ConfigMap", "grafana", "sources");
        live.setAdditionalProperty("spec", Map.of("hosts", List.of("a")));

        assertThat(ResourceDiff.isInSync(live, desired)).isFalse();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> spec(GenericKubernetesResource resource) {
        return (Map<String, Object>) resource.getAdditionalProperties().get("spec");
    }
}
