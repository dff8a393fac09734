package com.luanvv.harvester.core;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RateLimiter {
    private final Duration delay;
    // null until the first fetch has returned
    private Bucket bucket;

    public RateLimiter(Config.RateLimit cfg) {
        long delayMs = Math.round(Math.max(0, cfg.getDelaySeconds()) * 1000);
        this.delay = delayMs > 0 ? Duration.ofMillis(delayMs) : null;
        if (delay != null) {
            log.debug("Pausing {} ms between fetches", delayMs);
        }
    }

    /**
     * Runs one fetch. Waits until {@code delay} has passed since the previous fetch returned, then
     * starts a fresh empty bucket once this one returns, successful or not.
     */
    public <T> T throttle(Supplier<T> fetch) {
        if (delay == null) return fetch.get();
        acquire();
        try {
            return fetch.get();
        } finally {
            bucket = emptyBucket();
        }
    }

    private void acquire() {
        if (bucket == null) return;
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while waiting for rate limiter", e);
        }
    }

    private Bucket emptyBucket() {
        Bandwidth limit = Bandwidth.builder()
                .capacity(1)
                .refillIntervally(1, delay)
                .initialTokens(0)
                .build();
        return Bucket.builder().addLimit(limit).build();
    }
}
