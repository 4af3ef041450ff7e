package com.what3words.geocoding.application.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.what3words.geocoding.domain.exception.DecodeException;
import com.what3words.geocoding.domain.model.BoundingBox;
import com.what3words.geocoding.domain.model.Coordinates;

import java.util.Optional;

/**
 * Strict accessors over a Jackson tree. Every {@code require*} method raises
 * {@link DecodeException} naming the missing or mistyped field.
 */
final class JsonFields {

    private JsonFields() {
        // Utility class
    }

    static JsonNode parse(ObjectMapper objectMapper, String body) {
        if (body == null || body.isBlank()) {
            throw new DecodeException("Response body is empty");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new DecodeException("Response body is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new DecodeException("Response body is not valid JSON", e);
        }
    }

    static JsonNode requireObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new DecodeException("Missing object field '" + field + "'");
        }
        return node;
    }

    static JsonNode requireArray(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw new DecodeException("Missing array field '" + field + "'");
        }
        return node;
    }

    static String requireText(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isTextual()) {
            throw new DecodeException("Missing text field '" + field + "'");
        }
        return node.asText();
    }

    static String requireText(JsonNode parent, String field, String expected) {
        String value = requireText(parent, field);
        if (!expected.equals(value)) {
            throw new DecodeException("Field '" + field + "' is '" + value + "', expected '" + expected + "'");
        }
        return value;
    }

    static double requireNumber(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isNumber()) {
            throw new DecodeException("Missing numeric field '" + field + "'");
        }
        return node.asDouble();
    }

    static int requireInt(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new DecodeException("Missing integer field '" + field + "'");
        }
        return node.asInt();
    }

    static Optional<JsonNode> optional(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    /**
     * Absent or null gives empty. A number, or text holding a number, is read;
     * anything else is a decode failure.
     */
    static Optional<Double> optionalNumber(JsonNode parent, String field) {
        return optional(parent, field).map(node -> {
            if (node.isNumber()) {
                return node.asDouble();
            }
            if (node.isTextual()) {
                try {
                    return Double.parseDouble(node.asText().strip());
                } catch (NumberFormatException e) {
                    throw new DecodeException("Field '" + field + "' is not numeric: " + node.asText(), e);
                }
            }
            throw new DecodeException("Field '" + field + "' is not numeric: " + node);
        });
    }

    static Optional<String> optionalText(JsonNode parent, String field) {
        return optional(parent, field).map(node -> {
            if (!node.isTextual()) {
                throw new DecodeException("Field '" + field + "' is not text: " + node);
            }
            return node.asText();
        });
    }

    /**
     * Reads {@code {"lat": .., "lng": ..}}.
     */
    static Coordinates coordinates(JsonNode node) {
        return new Coordinates(requireNumber(node, "lat"), requireNumber(node, "lng"));
    }

    /**
     * Reads {@code {"southwest": {..}, "northeast": {..}}}.
     */
    static BoundingBox square(JsonNode node) {
        return new BoundingBox(
            coordinates(requireObject(node, "southwest")),
            coordinates(requireObject(node, "northeast")));
    }

    /**
     * Reads a GeoJSON position {@code [lng, lat]}.
     */
    static Coordinates position(JsonNode node) {
        if (node == null || !node.isArray() || node.size() < 2
                || !node.get(0).isNumber() || !node.get(1).isNumber()) {
            throw new DecodeException("Malformed GeoJSON position: " + node);
        }
        return new Coordinates(node.get(1).asDouble(), node.get(0).asDouble());
    }
}
