package com.luanvv.harvester.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

final class Fixtures {
    static final String BASE = "https://web-scraping.dev";

    private Fixtures() {}

    static String read(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static JsonNode json(String name) {
        try {
            return new ObjectMapper().readTree(read(name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Bundled configuration, pointed at {@code baseUrl}. */
    static Config config(String baseUrl) {
        try {
            Config config = Config.loadDefault();
            config.setBaseUrl(baseUrl);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Config config() {
        return config(BASE);
    }
}
