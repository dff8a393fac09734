package com.luanvv.harvester.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.Map;

@JsonPropertyOrder({"name", "url", "price", "short_description", "image"})
public record Product(
        String name,
        String url,
        BigDecimal price,
        @JsonProperty("short_description") String shortDescription,
        String image
) {

    public static Product fromFields(Map<String, Object> fields) {
        return new Product(
                Fields.string(fields, "name"),
                Fields.string(fields, "url"),
                parsePrice(Fields.string(fields, "price")),
                Fields.string(fields, "short_description"),
                Fields.string(fields, "image"));
    }

    public boolean hasUrl() {
        return !url.isEmpty();
    }

    static BigDecimal parsePrice(String text) {
        String digits = text.replaceAll("[^0-9.\\-]", "");
        if (digits.isEmpty()) return null;
        try {
            return new BigDecimal(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
