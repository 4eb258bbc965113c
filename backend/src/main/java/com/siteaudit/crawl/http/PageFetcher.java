package com.siteaudit.crawl.http;

import com.siteaudit.crawl.model.FetchResult;

import java.time.Duration;

/**
 * Performs exactly one GET attempt. Implementations must be safe to call from many threads and
 * must return within {@code timeout}; retries belong to the caller.
 */
public interface PageFetcher {

    FetchResult fetch(String url, Duration timeout, String userAgent);
}
