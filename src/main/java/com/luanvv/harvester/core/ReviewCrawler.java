package com.luanvv.harvester.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.luanvv.harvester.model.Review;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ReviewCrawler implements SiteCrawler<Review> {
    public static final String DATASET = "reviews";

    private final Config config;
    private final Transport transport;
    private final RateLimiter limiter;
    private final Retryer retryer;
    private final String query;

    public ReviewCrawler(Config config, Transport transport, RateLimiter limiter, Retryer retryer) {
        this(config, transport, limiter, retryer, loadQuery(config.getReviews().getQuery()));
    }

    ReviewCrawler(Config config, Transport transport, RateLimiter limiter, Retryer retryer, String query) {
        this.config = config;
        this.transport = transport;
        this.limiter = limiter;
        this.retryer = retryer;
        this.query = query;
    }

    @Override
    public String dataset() {
        return DATASET;
    }

    @Override
    public List<Review> crawl() {
        Config.Reviews cfg = config.getReviews();
        String endpoint = config.absolute(cfg.getEndpoint());
        Map<String, String> headers = Map.of("Referer", config.absolute(cfg.getReferer()));

        List<Review> out = new ArrayList<>();
        String after = null;
        int pages = 0;
        while (true) {
            if (pages >= cfg.getMaxPages()) {
                log.warn("Stopping reviews after the {}-page cap with {} reviews; more pages were announced",
                        cfg.getMaxPages(), out.size());
                break;
            }
            pages++;
            log.info("Query reviews page {} (after={})", pages, after);
            Map<String, Object> payload = payload(cfg.getPageSize(), after);
            JsonNode response = limiter.throttle(
                    () -> retryer.runWithRetry("query-reviews", () -> transport.postJson(endpoint, payload, headers)));

            JsonNode reviews = reviewsConnection(endpoint, response);
            for (JsonNode edge : reviews.path("edges")) {
                JsonNode node = edge.path("node");
                if (node.isObject()) {
                    out.add(Review.fromNode(node));
                }
            }

            JsonNode pageInfo = reviews.path("pageInfo");
            if (!pageInfo.path("hasNextPage").asBoolean(false)) {
                break;
            }
            JsonNode cursor = pageInfo.get("endCursor");
            if (cursor == null || cursor.isNull() || cursor.asText().isEmpty()) {
                throw new ProtocolContractException(endpoint, "hasNextPage is true but endCursor is missing",
                        pageInfo.toString());
            }
            after = cursor.asText();
        }
        log.info("Collected {} reviews in {} page(s)", out.size(), pages);
        return out;
    }

    Map<String, Object> payload(int first, String after) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("first", first);
        variables.put("after", after);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);
        return payload;
    }

    private static JsonNode reviewsConnection(String endpoint, JsonNode response) {
        JsonNode errors = response.path("errors");
        if (isTruthy(errors)) {
            throw new ProtocolContractException(endpoint, "GraphQL errors", errors.toString());
        }
        JsonNode reviews = response.path("data").path("reviews");
        if (!reviews.isObject()) {
            throw new ProtocolContractException(endpoint, "Response has no data.reviews", response.toString());
        }
        return reviews;
    }

    // any populated or non-false "errors" member counts, not only a non-empty array
    static boolean isTruthy(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return false;
        if (node.isContainerNode()) return node.size() > 0;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber()) return node.doubleValue() != 0;
        if (node.isTextual()) return !node.textValue().isEmpty();
        return true;
    }

    static String loadQuery(String resource) {
        try (InputStream in = ReviewCrawler.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("GraphQL document not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read GraphQL document " + resource, e);
        }
    }
}
