package com.luanvv.harvester.core;

import com.luanvv.harvester.model.Product;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

@Slf4j
public class ProductCrawler implements SiteCrawler<Product> {
    public static final String DATASET = "products";

    private final Config config;
    private final Transport transport;
    private final RateLimiter limiter;
    private final Retryer retryer;
    private final Extractor extractor;
    private final Pattern pagingPattern;

    public ProductCrawler(Config config, Transport transport, RateLimiter limiter, Retryer retryer,
            Extractor extractor) {
        this.config = config;
        this.transport = transport;
        this.limiter = limiter;
        this.retryer = retryer;
        this.extractor = extractor;
        this.pagingPattern = Pattern.compile(config.getProducts().getPagingPattern(), Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String dataset() {
        return DATASET;
    }

    @Override
    public List<Product> crawl() {
        List<Product> products = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        for (String startUrl : startUrls()) {
            crawlListing(startUrl, products, seenUrls);
        }
        log.info("Collected {} distinct products", products.size());
        return products;
    }

    List<String> startUrls() {
        Config.Products cfg = config.getProducts();
        String listing = config.absolute(cfg.getUrl());
        List<String> urls = new ArrayList<>();
        urls.add(listing);
        if (cfg.isPerCategory()) {
            for (String category : cfg.getCategories()) {
                urls.add(UrlUtils.withQueryParam(listing, "category", category));
            }
        }
        return urls;
    }

    private void crawlListing(String startUrl, List<Product> products, Set<String> seenUrls) {
        Document first = fetch(startUrl, config.getBaseUrl(), 1, null);
        int totalPages = totalPages(first);
        log.info("Listing {} has {} page(s)", startUrl, totalPages);

        for (int page = 1; page <= totalPages; page++) {
            Document doc = page == 1
                    ? first
                    : fetch(UrlUtils.withQueryParam(startUrl, "page", page), startUrl, page, totalPages);
            int added = 0;
            for (Map<String, Object> fields : extractor.extract(doc, config.getProducts().getShape())) {
                Product product = Product.fromFields(fields);
                // without a URL there is no identity, so such items are always kept
                if (product.hasUrl() && !seenUrls.add(product.url())) {
                    continue;
                }
                products.add(product);
                added++;
            }
            log.debug("Page {} of {} added {} product(s)", page, startUrl, added);
        }
    }

    private Document fetch(String url, String referer, int page, Integer totalPages) {
        log.info("Fetch product page {}/{}: {}", page, totalPages == null ? "?" : totalPages, url);
        String html = limiter.throttle(
                () -> retryer.runWithRetry("fetch-products", () -> transport.fetchHtml(url, Map.of("Referer", referer))));
        return extractor.parse(html);
    }

    /**
     * Reads the page count from the paging summary ("... in 6 pages"). Falls back to 1 when the
     * summary node or the phrase is missing, so a wording change stops after the first page.
     */
    int totalPages(Document doc) {
        return extractor.firstText(doc, config.getProducts().getPagingSelector())
                .map(text -> parsePageCount(pagingPattern, text))
                .orElse(1);
    }

    static int parsePageCount(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            log.warn("Paging summary '{}' does not match '{}', assuming a single page", text, pattern.pattern());
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
