package com.luanvv.harvester.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

@JsonPropertyOrder({"rid", "date", "rating", "text"})
public record Review(Object rid, String date, Number rating, String text) {

    public static Review fromNode(JsonNode node) {
        return new Review(
                scalar(node.get("rid")),
                textOrNull(node.get("date")),
                node.hasNonNull("rating") && node.get("rating").isNumber() ? node.get("rating").numberValue() : null,
                node.hasNonNull("text") ? node.get("text").asText() : "");
    }

    private static Object scalar(JsonNode value) {
        if (value == null || value.isNull()) return null;
        if (value.isIntegralNumber()) return value.longValue();
        if (value.isNumber()) return value.numberValue();
        return value.asText();
    }

    private static String textOrNull(JsonNode value) {
        return value == null || value.isNull() ? null : value.asText();
    }
}
