package com.bko.stravacache.integrations.strava;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Typed views over raw Strava responses. The raw {@link JsonNode} stays the source of truth; these
 * classes only expose the fields this application reads itself.
 */
public final class StravaJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private StravaJson() {
    }

    public static ArrayNode emptyArray() {
        return JsonNodeFactory.instance.arrayNode();
    }

    public static ObjectNode emptyObject() {
        return JsonNodeFactory.instance.objectNode();
    }

    /**
     * @return the activity view, or {@code null} for a missing or JSON-null node
     */
    public static StravaActivity activity(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : MAPPER.convertValue(node, StravaActivity.class);
    }

    public static List<StravaLap> laps(JsonNode node) {
        return listOf(node, new TypeReference<List<StravaLap>>() {});
    }

    public static List<StravaComment> comments(JsonNode node) {
        return listOf(node, new TypeReference<List<StravaComment>>() {});
    }

    public static List<StravaPhoto> photos(JsonNode node) {
        return listOf(node, new TypeReference<List<StravaPhoto>>() {});
    }

    public static Map<String, StravaStream> streams(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return MAPPER.convertValue(node, new TypeReference<Map<String, StravaStream>>() {});
    }

    /**
     * Reads the activity id of a summary or detail as text, or {@code null} when there is none.
     */
    public static String activityId(JsonNode node) {
        JsonNode id = node == null ? null : node.get("id");
        if (id == null || !(id.isIntegralNumber() || id.isTextual()) || id.asText().isBlank()) {
            return null;
        }
        return id.asText();
    }

    private static <T> List<T> listOf(JsonNode node, TypeReference<List<T>> type) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return MAPPER.convertValue(node, type);
    }
}
