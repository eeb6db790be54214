package com.github.k8soperators.conductor.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.zjsonpatch.JsonDiff;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Structural comparison of a declared payload against live state. Only what the payload declares is compared:
 * server-populated fields (status, uid, resourceVersion, defaulted spec fields) are projected away first, so a
 * freshly applied object is always in sync with its declaration.
 */
public final class ResourceDiff {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> IGNORED_TOP_LEVEL = Set.of("status", "metadata");
    private static final Set<String> COMPARED_METADATA = Set.of("labels", "annotations");

    private ResourceDiff() {
    }

    /**
     * JSON Patch (RFC 6902) that turns the relevant part of {@code live} into {@code desired}. Empty when in sync.
     */
    public static JsonNode diff(HasMetadata live, HasMetadata desired) {
        JsonNode liveJson = MAPPER.convertValue(live, JsonNode.class);
        JsonNode desiredJson = relevant(MAPPER.convertValue(desired, JsonNode.class));

        return JsonDiff.asJson(project(liveJson, desiredJson), desiredJson);
    }

    public static boolean isInSync(HasMetadata live, HasMetadata desired) {
        return diff(live, desired).isEmpty();
    }

    static JsonNode relevant(JsonNode desired) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();

        desired.fields().forEachRemaining(field -> {
            if (!IGNORED_TOP_LEVEL.contains(field.getKey())) {
                result.set(field.getKey(), field.getValue());
            }
        });

        JsonNode metadata = desired.path("metadata");
        ObjectNode relevantMetadata = JsonNodeFactory.instance.objectNode();
        COMPARED_METADATA.stream()
                .filter(metadata::hasNonNull)
                .forEach(key -> relevantMetadata.set(key, metadata.get(key)));
        result.set("metadata", relevantMetadata);

        return result;
    }

    /**
     * Restricts {@code live} to the shape of {@code desired}: object keys absent from {@code desired} are dropped,
     * arrays of equal length are projected element-wise, everything else is kept as-is.
     */
    static JsonNode project(JsonNode live, JsonNode desired) {
        if (live == null || live.isNull()) {
            return live;
        }

        if (live.isObject() && desired.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();

            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode liveValue = live.get(field.getKey());

                if (liveValue != null) {
                    result.set(field.getKey(), project(liveValue, field.getValue()));
                }
            }
            return result;
        }

        if (live.isArray() && desired.isArray() && live.size() == desired.size()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (int i = 0; i < live.size(); i++) {
                result.add(project(live.get(i), desired.get(i)));
            }
            return result;
        }

        return live;
    }
}
