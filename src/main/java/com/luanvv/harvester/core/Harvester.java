package com.luanvv.harvester.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class Harvester {
    private final Config config;

    public HarvestSummary run() throws IOException {
        OutputWriters writers = new OutputWriters(config.getOutput());
        List<SiteCrawler<?>> crawlers = crawlers();
        if (crawlers.isEmpty()) {
            log.warn("No crawler enabled, nothing to do");
            return new HarvestSummary(List.of());
        }

        int threads = Math.max(1, Math.min(config.getParallelism(), crawlers.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        Map<String, Future<HarvestSummary.Outcome>> futures = new LinkedHashMap<>();
        // dataset -> System.nanoTime() when its crawler left the queue
        Map<String, Long> started = new ConcurrentHashMap<>();
        try {
            for (SiteCrawler<?> crawler : crawlers) {
                futures.put(crawler.dataset(), executor.submit(() -> {
                    started.put(crawler.dataset(), System.nanoTime());
                    return runOne(crawler, writers);
                }));
            }
            List<HarvestSummary.Outcome> outcomes = new ArrayList<>();
            for (Map.Entry<String, Future<HarvestSummary.Outcome>> e : futures.entrySet()) {
                outcomes.add(await(e.getKey(), e.getValue(), started));
            }
            HarvestSummary summary = new HarvestSummary(outcomes);
            log.info("Harvest finished:");
            summary.outcomes().forEach(o -> log.info("  {}", o));
            return summary;
        } finally {
            executor.shutdownNow();
        }
    }

    /** Crawlers in run order: products, testimonials, reviews. */
    List<SiteCrawler<?>> crawlers() {
        List<SiteCrawler<?>> crawlers = new ArrayList<>();
        if (config.getProducts().isEnabled()) {
            crawlers.add(new ProductCrawler(config, newTransport(), newLimiter(), newRetryer(), newExtractor()));
        }
        if (config.getTestimonials().isEnabled()) {
            crawlers.add(new TestimonialCrawler(config, newTransport(), newLimiter(), newRetryer(), newExtractor()));
        }
        if (config.getReviews().isEnabled()) {
            crawlers.add(new ReviewCrawler(config, newTransport(), newLimiter(), newRetryer()));
        }
        return crawlers;
    }

    private HarvestSummary.Outcome runOne(SiteCrawler<?> crawler, OutputWriters writers) {
        String dataset = crawler.dataset();
        long start = System.currentTimeMillis();
        log.info("Starting crawler: {}", dataset);
        try {
            List<?> records = crawler.crawl();
            Path file = writers.write(dataset, records);
            log.info("Crawler {} finished with {} records in {} ms", dataset, records.size(),
                    System.currentTimeMillis() - start);
            return HarvestSummary.Outcome.ok(dataset, records.size(), file);
        } catch (CrawlException | IOException e) {
            log.error("Crawler {} failed, no {} file written", dataset, dataset, e);
            return HarvestSummary.Outcome.failed(dataset, e.getMessage());
        }
    }

    private HarvestSummary.Outcome await(String dataset, Future<HarvestSummary.Outcome> future,
                                         Map<String, Long> started) {
        long timeout = config.getCrawlTimeoutSeconds();
        try {
            return timeout > 0 ? awaitDeadline(dataset, future, started, TimeUnit.SECONDS.toNanos(timeout)) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Crawler {} exceeded {} s and was cancelled", dataset, timeout);
            return HarvestSummary.Outcome.failed(dataset, "timed out after " + timeout + " s");
        } catch (ExecutionException e) {
            log.error("Crawler {} failed unexpectedly", dataset, e.getCause());
            return HarvestSummary.Outcome.failed(dataset, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return HarvestSummary.Outcome.failed(dataset, "interrupted");
        }
    }

    /**
     * Each crawler gets {@code limit} from the moment it starts running, however long the crawlers
     * awaited before it took. A crawler still queued behind others is not charged for the wait.
     */
    private static <T> T awaitDeadline(String dataset, Future<T> future, Map<String, Long> started, long limit)
            throws InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            Long start = started.get(dataset);
            long wait = start == null ? limit : start + limit - System.nanoTime();
            try {
                return future.get(Math.max(0, wait), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (start != null) throw e;
            }
        }
    }

    private Transport newTransport() {
        return new Transport(config.getHttp());
    }

    private RateLimiter newLimiter() {
        return new RateLimiter(config.getRateLimit());
    }

    private Retryer newRetryer() {
        return new Retryer(config.getRetries());
    }

    private Extractor newExtractor() {
        return new Extractor(config.getBaseUrl());
    }
}
