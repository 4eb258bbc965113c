package com.siteaudit.crawl.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable configuration of one crawl run. {@code maxDepth} and {@code maxRunDuration} are
 * optional; null means unlimited.
 */
public record CrawlSettings(
    String seedUrl,
    int maxPages,
    int maxConcurrentFetches,
    Duration timeout,
    String userAgent,
    boolean respectRobots,
    boolean followExternal,
    boolean followNofollow,
    int maxRetries,
    Duration requestDelay,
    Integer maxDepth,
    Duration maxRunDuration
) {
    public static final String DEFAULT_USER_AGENT = "SiteAuditBot/0.1 (+https://example.com/bot)";

    public static Builder builder(String seedUrl) {
        return new Builder(seedUrl);
    }

    public CrawlSettings withSeedUrl(String url) {
        return new CrawlSettings(
            url,
            maxPages,
            maxConcurrentFetches,
            timeout,
            userAgent,
            respectRobots,
            followExternal,
            followNofollow,
            maxRetries,
            requestDelay,
            maxDepth,
            maxRunDuration
        );
    }

    /**
     * Every rule this settings object breaks; empty when the run may start. The seed URL is
     * checked separately because that needs the normalizer.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (seedUrl == null || seedUrl.isBlank()) {
            problems.add("seedUrl is required");
        }
        if (maxPages <= 0) {
            problems.add("maxPages must be > 0 (was " + maxPages + ")");
        }
        if (maxConcurrentFetches <= 0) {
            problems.add("maxConcurrentFetches must be > 0 (was " + maxConcurrentFetches + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            problems.add("timeout must be > 0 (was " + timeout + ")");
        }
        if (userAgent == null || userAgent.isBlank()) {
            problems.add("userAgent is required");
        }
        if (maxRetries < 0) {
            problems.add("maxRetries must be >= 0 (was " + maxRetries + ")");
        }
        if (requestDelay != null && requestDelay.isNegative()) {
            problems.add("requestDelay must be >= 0 (was " + requestDelay + ")");
        }
        if (maxDepth != null && maxDepth < 0) {
            problems.add("maxDepth must be >= 0 (was " + maxDepth + ")");
        }
        if (maxRunDuration != null && (maxRunDuration.isZero() || maxRunDuration.isNegative())) {
            problems.add("maxRunDuration must be > 0 (was " + maxRunDuration + ")");
        }
        return problems;
    }

    public Duration requestDelayOrZero() {
        return requestDelay == null ? Duration.ZERO : requestDelay;
    }

    public static final class Builder {
        private final String seedUrl;
        private int maxPages = 500;
        private int maxConcurrentFetches = 5;
        private Duration timeout = Duration.ofSeconds(30);
        private String userAgent = DEFAULT_USER_AGENT;
        private boolean respectRobots = true;
        private boolean followExternal;
        private boolean followNofollow;
        private int maxRetries = 3;
        private Duration requestDelay = Duration.ofMillis(500);
        private Integer maxDepth;
        private Duration maxRunDuration;

        private Builder(String seedUrl) {
            this.seedUrl = seedUrl;
        }

        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        public Builder maxConcurrentFetches(int maxConcurrentFetches) {
            this.maxConcurrentFetches = maxConcurrentFetches;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder respectRobots(boolean respectRobots) {
            this.respectRobots = respectRobots;
            return this;
        }

        public Builder followExternal(boolean followExternal) {
            this.followExternal = followExternal;
            return this;
        }

        public Builder followNofollow(boolean followNofollow) {
            this.followNofollow = followNofollow;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder requestDelay(Duration requestDelay) {
            this.requestDelay = requestDelay;
            return this;
        }

        public Builder maxDepth(Integer maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxRunDuration(Duration maxRunDuration) {
            this.maxRunDuration = maxRunDuration;
            return this;
        }

        public CrawlSettings build() {
            return new CrawlSettings(
                seedUrl,
                maxPages,
                maxConcurrentFetches,
                timeout,
                userAgent,
                respectRobots,
                followExternal,
                followNofollow,
                maxRetries,
                requestDelay,
                maxDepth,
                maxRunDuration
            );
        }
    }
}
