package com.luanvv.harvester.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Transport {
    private static final int BODY_SNIPPET = 200;

    private final HttpClient client;
    private final Duration timeout;
    private final Map<String, String> defaultHeaders;
    private final ObjectMapper objectMapper;

    public Transport(Config.Http cfg) {
        this(cfg, new ObjectMapper());
    }

    public Transport(Config.Http cfg, ObjectMapper objectMapper) {
        this.timeout = Duration.ofSeconds(Math.max(1, cfg.getTimeoutSeconds()));
        this.defaultHeaders = cfg.getHeaders() == null ? Map.of() : Map.copyOf(cfg.getHeaders());
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(new CookieManager())
                .build();
    }

    public String fetchHtml(String url, Map<String, String> headers) {
        HttpRequest.Builder builder = newRequest(url, headers).GET();
        return send(url, builder);
    }

    public JsonNode postJson(String url, Object payload, Map<String, String> headers) {
        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.put("Content-Type", "application/json");
        merged.put("Accept", "application/json");
        if (headers != null) merged.putAll(headers);

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CrawlException("Cannot serialize request payload for " + url, e);
        }
        String response = send(url, newRequest(url, merged)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)));
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new ProtocolContractException(url, "Response is not valid JSON", response);
        }
    }

    private HttpRequest.Builder newRequest(String url, Map<String, String> headers) {
        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.putAll(defaultHeaders);
        if (headers != null) merged.putAll(headers);

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(url)).timeout(timeout);
        } catch (IllegalArgumentException e) {
            throw new TransportException(url, "invalid URL", e);
        }
        merged.forEach(builder::header);
        return builder;
    }

    private String send(String url, HttpRequest.Builder builder) {
        HttpResponse<String> resp;
        try {
            resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException(url, e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(url, "interrupted", e);
        }
        int status = resp.statusCode();
        log.debug("{} {} -> {}", resp.request().method(), url, status);
        if (status / 100 != 2) {
            String body = resp.body() == null ? "" : resp.body().strip();
            throw new TransportException(url, status,
                    body.length() > BODY_SNIPPET ? body.substring(0, BODY_SNIPPET) + "..." : body);
        }
        return resp.body();
    }
}
