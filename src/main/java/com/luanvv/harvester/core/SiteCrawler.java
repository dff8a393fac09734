package com.luanvv.harvester.core;

import java.util.List;

/**
 * Drives one pagination style to completion and returns its records in discovery order. Either
 * the whole dataset is returned or a {@link CrawlException} is thrown.
 */
public interface SiteCrawler<T> {

    /** Dataset name, also the output file stem. */
    String dataset();

    List<T> crawl();
}
