package app.threejs.catalog.support;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads optional fields from provider JSON. Every accessor returns an explicit default
 * instead of failing when the field is missing, null or of the wrong type.
 */
public final class JsonDefaults {

    private JsonDefaults() {
    }

    public static String text(JsonNode node, String field) {
        return text(node, field, "");
    }

    public static String text(JsonNode node, String field, String fallback) {
        if (node == null) {
            return fallback;
        }
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return fallback;
        }
        return value.asText(fallback);
    }

    public static boolean bool(JsonNode node, String field) {
        if (node == null) {
            return false;
        }
        JsonNode value = node.path(field);
        return value.isBoolean() && value.booleanValue();
    }

    public static long number(JsonNode node, String field, long fallback) {
        if (node == null) {
            return fallback;
        }
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.longValue();
        }
        if (value.isTextual()) {
            try {
                return (long) Double.parseDouble(value.textValue().trim());
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
        return fallback;
    }

    public static JsonNode object(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        return value.isObject() ? value : null;
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
