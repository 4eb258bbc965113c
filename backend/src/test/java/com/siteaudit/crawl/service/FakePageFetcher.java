package com.siteaudit.crawl.service;

import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.model.FetchResult;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory site for scheduler tests. Unknown URLs answer 404; responses can be queued per URL
 * and fetches can be slowed down to keep workers busy.
 */
class FakePageFetcher implements PageFetcher {
    private final Map<String, Deque<FetchResult>> scripted = new ConcurrentHashMap<>();
    private final Map<String, FetchResult> pages = new ConcurrentHashMap<>();
    private final Map<String, Long> delaysMs = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private volatile long defaultDelayMs;

    FakePageFetcher html(String url, String body) {
        pages.put(url, success(200, body, "text/html; charset=utf-8", url));
        return this;
    }

    FakePageFetcher redirect(String url, String finalUrl, String body) {
        pages.put(url, success(200, body, "text/html", finalUrl));
        return this;
    }

    FakePageFetcher robots(String origin, String body) {
        pages.put(origin + "/robots.txt", success(200, body, "text/plain", origin + "/robots.txt"));
        return this;
    }

    FakePageFetcher respond(String url, FetchResult result) {
        pages.put(url, result);
        return this;
    }

    /**
     * Returns {@code result} for the next fetch of {@code url} before falling back to the page.
     */
    FakePageFetcher thenOnce(String url, FetchResult result) {
        scripted.computeIfAbsent(url, ignored -> new ArrayDeque<>()).addLast(result);
        return this;
    }

    FakePageFetcher delay(String url, long millis) {
        delaysMs.put(url, millis);
        return this;
    }

    FakePageFetcher delayAll(long millis) {
        defaultDelayMs = millis;
        return this;
    }

    int fetchCount(String url) {
        AtomicInteger count = fetchCounts.get(url);
        return count == null ? 0 : count.get();
    }

    int peakInFlight() {
        return peakInFlight.get();
    }

    @Override
    public FetchResult fetch(String url, Duration timeout, String userAgent) {
        fetchCounts.computeIfAbsent(url, ignored -> new AtomicInteger()).incrementAndGet();
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        try {
            long delay = delaysMs.getOrDefault(url, defaultDelayMs);
            if (delay > 0) {
                Thread.sleep(delay);
            }
            Deque<FetchResult> queue = scripted.get(url);
            if (queue != null) {
                synchronized (queue) {
                    FetchResult next = queue.pollFirst();
                    if (next != null) {
                        return next;
                    }
                }
            }
            FetchResult page = pages.get(url);
            return page != null ? page : success(404, "not found", "text/html", url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new FetchResult.NetworkError("interrupted");
        } finally {
            inFlight.decrementAndGet();
        }
    }

    static FetchResult.Success success(int status, String body, String contentType, String finalUrl) {
        return new FetchResult.Success(status, Map.of(), body, body.length(), contentType, finalUrl);
    }

    static String page(String title, String... links) {
        StringBuilder html = new StringBuilder("<html><head><title>")
            .append(title)
            .append("</title><meta name=\"description\" content=\"")
            .append("A description that is comfortably longer than fifty characters.")
            .append("\"></head><body><h1>")
            .append(title)
            .append("</h1>");
        for (String link : links) {
            html.append("<a href=\"").append(link).append("\">").append(link).append("</a>");
        }
        return html.append("</body></html>").toString();
    }
}
