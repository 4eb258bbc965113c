package com.siteaudit.config;

import com.siteaudit.crawl.model.CrawlSettings;
import com.siteaudit.crawl.model.MonitoringSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "site-audit.crawler")
public class CrawlerProperties {
    private String userAgent;
    private int maxPages = 500;
    private int maxConcurrentFetches = 5;
    private int requestTimeoutSeconds = 30;
    private int requestDelayMs = 500;
    private int maxRetries = 3;
    private int retryBaseDelayMs = 500;
    private int retryMaxDelayMs = 8000;
    private int rateLimitBackoffSeconds = 30;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private int maxActiveRuns = 4;
    private boolean respectRobots = true;
    private boolean followExternal = false;
    private boolean followNofollow = false;
    private Robots robots = new Robots();
    private Monitoring monitoring = new Monitoring();

    /**
     * Settings for a run seeded at {@code seedUrl}, using these properties as defaults.
     */
    public CrawlSettings newSettings(String seedUrl) {
        return CrawlSettings.builder(seedUrl)
            .maxPages(getMaxPages())
            .maxConcurrentFetches(getMaxConcurrentFetches())
            .timeout(Duration.ofSeconds(getRequestTimeoutSeconds()))
            .userAgent(getUserAgent())
            .respectRobots(respectRobots)
            .followExternal(followExternal)
            .followNofollow(followNofollow)
            .maxRetries(getMaxRetries())
            .requestDelay(Duration.ofMillis(getRequestDelayMs()))
            .build();
    }

    public MonitoringSettings newMonitoringSettings() {
        return new MonitoringSettings(
            monitoring.getMaxPages(),
            monitoring.getMaxConcurrentFetches(),
            Duration.ofSeconds(monitoring.getRequestTimeoutSeconds()),
            getUserAgent()
        );
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getMaxConcurrentFetches() {
        return Math.max(1, maxConcurrentFetches);
    }

    public void setMaxConcurrentFetches(int maxConcurrentFetches) {
        this.maxConcurrentFetches = Math.max(1, maxConcurrentFetches);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestDelayMs() {
        return Math.max(0, requestDelayMs);
    }

    public void setRequestDelayMs(int requestDelayMs) {
        this.requestDelayMs = Math.max(0, requestDelayMs);
    }

    public int getMaxRetries() {
        return Math.max(0, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public int getRetryBaseDelayMs() {
        return Math.max(0, retryBaseDelayMs);
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public int getRetryMaxDelayMs() {
        return Math.max(0, retryMaxDelayMs);
    }

    public void setRetryMaxDelayMs(int retryMaxDelayMs) {
        this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
    }

    public int getRateLimitBackoffSeconds() {
        return Math.max(0, rateLimitBackoffSeconds);
    }

    public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
        this.rateLimitBackoffSeconds = Math.max(0, rateLimitBackoffSeconds);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    public int getMaxActiveRuns() {
        return Math.max(1, maxActiveRuns);
    }

    public void setMaxActiveRuns(int maxActiveRuns) {
        this.maxActiveRuns = Math.max(1, maxActiveRuns);
    }

    public boolean isRespectRobots() {
        return respectRobots;
    }

    public void setRespectRobots(boolean respectRobots) {
        this.respectRobots = respectRobots;
    }

    public boolean isFollowExternal() {
        return followExternal;
    }

    public void setFollowExternal(boolean followExternal) {
        this.followExternal = followExternal;
    }

    public boolean isFollowNofollow() {
        return followNofollow;
    }

    public void setFollowNofollow(boolean followNofollow) {
        this.followNofollow = followNofollow;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    public void setMonitoring(Monitoring monitoring) {
        this.monitoring = monitoring;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return CrawlSettings.DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Robots {
        private boolean failOpen = true;

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }
    }

    public static class Monitoring {
        private int maxPages = 10;
        private int maxConcurrentFetches = 3;
        private int requestTimeoutSeconds = 60;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getMaxConcurrentFetches() {
            return Math.max(1, maxConcurrentFetches);
        }

        public void setMaxConcurrentFetches(int maxConcurrentFetches) {
            this.maxConcurrentFetches = Math.max(1, maxConcurrentFetches);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }
}
