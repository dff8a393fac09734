package com.luanvv.harvester.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_RESOURCE = "harvester.yaml";

    private String baseUrl = "https://web-scraping.dev";
    private int parallelism = 3;
    private long crawlTimeoutSeconds = 0;
    private Http http = new Http();
    private RateLimit rateLimit = new RateLimit();
    private Retries retries = new Retries();
    private Output output = new Output();
    private Products products = new Products();
    private Reviews reviews = new Reviews();
    private Testimonials testimonials = new Testimonials();

    @Data
    public static class Http {
        private long timeoutSeconds = 30;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    public static class RateLimit {
        private double delaySeconds = 0;
    }

    @Data
    public static class Retries {
        private int maxAttempts = 1;
        private long backoffMs = 1000;
        private long maxBackoffMs = 8000;
    }

    @Data
    public static class Output {
        private String dir = "data";
        private boolean json = true;
        private boolean csv = false;
    }

    /** Record-shape descriptor: one record per node matched by {@code itemSelector}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Shape {
        private String itemSelector;
        private List<Field> fields = new ArrayList<>();
    }

    @Data
    public static class Field {
        private String name;
        private String selector;
        private String type = "text"; // text, attr, url or count
        private String attribute;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Products {
        private boolean enabled = true;
        private String url = "/products";
        private boolean perCategory = false;
        private List<String> categories = new ArrayList<>();
        private String pagingSelector = "div.paging-meta";
        private String pagingPattern = "in\\s+(\\d+)\\s+pages";
        private Shape shape = new Shape();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reviews {
        private boolean enabled = true;
        private String endpoint = "/api/graphql";
        private String referer = "/reviews";
        private String query = "graphql/reviews.graphql";
        private int pageSize = 20;
        private int maxPages = 200;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Testimonials {
        private boolean enabled = true;
        private String url = "/testimonials";
        private String loaderSelector = "div.testimonial[hx-get]";
        private String loaderAttribute = "hx-get";
        private String tokenSelector = "script#appData";
        private String tokenHeader = "x-secret-token";
        private String secretToken;
        private int maxPages = 200;
        private Map<String, String> fragmentHeaders = new LinkedHashMap<>();
        private Shape shape = new Shape();
    }

    public String absolute(String path) {
        return UrlUtils.toAbsolute(baseUrl, path).toString();
    }

    public static Config load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static Config load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, Config.class);
    }

    public static Config loadDefault() throws IOException {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default config not found on classpath: " + DEFAULT_RESOURCE);
            }
            log.debug("Using classpath config {}", DEFAULT_RESOURCE);
            return load(in);
        }
    }
}
