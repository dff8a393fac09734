package com.luanvv.harvester.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

@JsonPropertyOrder({"author", "text", "rating"})
public record Testimonial(String author, String text, int rating) {

    public static Testimonial fromFields(Map<String, Object> fields) {
        return new Testimonial(
                Fields.string(fields, "author"),
                Fields.string(fields, "text"),
                Fields.integer(fields, "rating"));
    }
}
