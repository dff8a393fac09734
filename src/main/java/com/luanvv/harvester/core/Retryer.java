package com.luanvv.harvester.core;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class Retryer {
    private final Config.Retries cfg;

    public <T> T runWithRetry(String opName, Supplier<T> call) {
        int maxAttempts = Math.max(1, cfg.getMaxAttempts());
        long delay = Math.max(100, cfg.getBackoffMs());
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return call.get();
            } catch (TransportException e) {
                if (attempts >= maxAttempts) throw e;
                log.warn("{} failed on attempt {}/{}: {}", opName, attempts, maxAttempts, e.getMessage());
                sleep(delay);
                delay = Math.min(cfg.getMaxBackoffMs(), delay * 2);
            }
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while backing off", e);
        }
    }
}
