package com.example.courier.shared.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalLong;

/**
 * Helpers for reading loosely typed fields out of client JSON frames.
 */
public final class JsonUtils {

    private JsonUtils() {}

    /**
     * Reads an integral id from a field that may hold a JSON number or a numeric string.
     *
     * @return the id, or empty when the field is missing, null, fractional or not numeric
     */
    public static OptionalLong readLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return OptionalLong.empty();
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return OptionalLong.of(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(value.textValue().trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    /**
     * @return the text of the field, or null when absent or not a string
     */
    public static String readText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }
}
