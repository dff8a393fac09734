package com.luanvv.harvester.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.harvester.model.Testimonial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

@Slf4j
public class TestimonialCrawler implements SiteCrawler<Testimonial> {
    public static final String DATASET = "testimonials";

    private final Config config;
    private final Transport transport;
    private final RateLimiter limiter;
    private final Retryer retryer;
    private final Extractor extractor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TestimonialCrawler(Config config, Transport transport, RateLimiter limiter, Retryer retryer,
            Extractor extractor) {
        this.config = config;
        this.transport = transport;
        this.limiter = limiter;
        this.retryer = retryer;
        this.extractor = extractor;
    }

    @Override
    public String dataset() {
        return DATASET;
    }

    @Override
    public List<Testimonial> crawl() {
        Config.Testimonials cfg = config.getTestimonials();
        String initialUrl = config.absolute(cfg.getUrl());

        log.info("Fetch testimonials page: {}", initialUrl);
        String html = limiter.throttle(() -> retryer.runWithRetry("fetch-testimonials",
                () -> transport.fetchHtml(initialUrl, Map.of("Referer", config.getBaseUrl()))));
        Document doc = extractor.parse(html);

        List<Testimonial> collected = new ArrayList<>(testimonials(doc));
        Optional<String> next = nextFragment(doc);
        Map<String, String> headers = next.isPresent()
                ? fragmentHeaders(initialUrl, secretToken(initialUrl, doc))
                : Map.of();

        int pages = 0;
        while (next.isPresent()) {
            if (pages >= cfg.getMaxPages()) {
                log.warn("Stopping testimonials after the {}-fragment cap; next fragment was {}",
                        cfg.getMaxPages(), next.get());
                break;
            }
            pages++;
            String url = next.get();
            log.info("Fetch testimonial fragment {}: {}", pages, url);
            Document fragment = extractor.parse(limiter.throttle(() -> fetchFragment(url, headers)));
            List<Testimonial> items = testimonials(fragment);
            if (items.isEmpty()) {
                throw new ProtocolContractException(url,
                        "Fragment endpoint contract changed: no '" + cfg.getShape().getItemSelector() + "' nodes",
                        fragment.body().html());
            }
            collected.addAll(items);
            next = nextFragment(fragment);
        }

        List<Testimonial> unique = new ArrayList<>(new LinkedHashSet<>(collected));
        log.info("Collected {} testimonials ({} before dedup) from {} fragment(s)",
                unique.size(), collected.size(), pages);
        return unique;
    }

    private String fetchFragment(String url, Map<String, String> headers) {
        try {
            return retryer.runWithRetry("fetch-fragment", () -> transport.fetchHtml(url, headers));
        } catch (TransportException e) {
            if (e.isClientError()) {
                throw new ProtocolContractException(url,
                        "Fragment endpoint contract changed: request rejected with HTTP " + e.getStatus()
                                + ", check the fragment headers and secret token", e);
            }
            throw e;
        }
    }

    private List<Testimonial> testimonials(Document doc) {
        return extractor.extract(doc, config.getTestimonials().getShape()).stream()
                .map(Testimonial::fromFields)
                .toList();
    }

    private Optional<String> nextFragment(Document doc) {
        Config.Testimonials cfg = config.getTestimonials();
        return extractor.firstUrl(doc, cfg.getLoaderSelector(), cfg.getLoaderAttribute());
    }

    /**
     * Prefers the token embedded in the page's data block; falls back to the configured value when
     * the page does not carry one.
     */
    String secretToken(String pageUrl, Document doc) {
        Config.Testimonials cfg = config.getTestimonials();
        Optional<String> block = extractor.firstData(doc, cfg.getTokenSelector());
        if (block.isPresent() && !block.get().isBlank()) {
            JsonNode data;
            try {
                data = objectMapper.readTree(block.get());
            } catch (JsonProcessingException e) {
                throw new ProtocolContractException(pageUrl, "Token block is not valid JSON", block.get());
            }
            JsonNode token = data.get(cfg.getTokenHeader());
            if (token != null && token.isTextual() && !token.asText().isBlank()) {
                log.debug("Using secret token embedded in {}", pageUrl);
                return token.asText();
            }
        }
        if (cfg.getSecretToken() == null || cfg.getSecretToken().isBlank()) {
            throw new ProtocolContractException(pageUrl,
                    "No secret token embedded in the page and none configured");
        }
        return cfg.getSecretToken();
    }

    Map<String, String> fragmentHeaders(String referer, String token) {
        Config.Testimonials cfg = config.getTestimonials();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Referer", referer);
        headers.putAll(cfg.getFragmentHeaders());
        headers.put(cfg.getTokenHeader(), token);
        return headers;
    }
}
