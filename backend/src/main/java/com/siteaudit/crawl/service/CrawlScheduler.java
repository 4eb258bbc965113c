package com.siteaudit.crawl.service;

import com.siteaudit.config.CrawlerProperties;
import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.http.PolitenessGate;
import com.siteaudit.crawl.model.AuditSummary;
import com.siteaudit.crawl.model.CrawlReport;
import com.siteaudit.crawl.model.CrawlRun;
import com.siteaudit.crawl.model.CrawlRunStatus;
import com.siteaudit.crawl.model.CrawlSettings;
import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.model.Issue;
import com.siteaudit.crawl.model.PageLink;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.Severity;
import com.siteaudit.crawl.page.PageAnalyzer;
import com.siteaudit.crawl.robots.RobotsTxtService;
import com.siteaudit.crawl.util.UrlNormalizationException;
import com.siteaudit.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs crawls. Each run gets its own {@link Frontier} and a fixed pool of exactly
 * {@code maxConcurrentFetches} worker threads that loop take, fetch, analyze, offer links,
 * record, complete until the frontier drains or the run is stopped.
 */
public class CrawlScheduler {
    private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

    static final String DEADLINE_REASON = "cancelled: run deadline exceeded";
    private static final Duration STOP_GRACE = Duration.ofSeconds(10);

    private final PageFetcher fetcher;
    private final PageAnalyzer analyzer;
    private final AuditAggregator aggregator;
    private final CrawlRunRegistry registry;
    private final ExecutorService crawlRunExecutor;
    private final CrawlerProperties properties;
    private final List<PageRecordSink> sinks;
    private final List<CrawlRunListener> listeners;

    public CrawlScheduler(
        PageFetcher fetcher,
        PageAnalyzer analyzer,
        AuditAggregator aggregator,
        CrawlRunRegistry registry,
        ExecutorService crawlRunExecutor,
        CrawlerProperties properties,
        List<PageRecordSink> sinks,
        List<CrawlRunListener> listeners
    ) {
        this.fetcher = fetcher;
        this.analyzer = analyzer;
        this.aggregator = aggregator;
        this.registry = registry;
        this.crawlRunExecutor = crawlRunExecutor;
        this.properties = properties;
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    /**
     * Validates the settings and starts the run in the background.
     *
     * @throws InvalidCrawlSettingsException if any setting is invalid; no run is created then
     */
    public CrawlRunHandle start(CrawlSettings settings) {
        CrawlSettings validated = validate(settings);
        CrawlRunHandle handle = new CrawlRunHandle(
            UUID.randomUUID(),
            validated,
            UrlNormalizer.extractDomain(validated.seedUrl()),
            Instant.now()
        );
        registry.register(handle);
        try {
            crawlRunExecutor.execute(() -> execute(handle));
        } catch (RejectedExecutionException e) {
            log.error("Crawl run {} could not be scheduled", handle.runId(), e);
            handle.fail("crawl scheduler is shut down");
            finish(handle);
        }
        return handle;
    }

    public CrawlReport run(CrawlSettings settings) {
        return start(settings).await();
    }

    static CrawlSettings validate(CrawlSettings settings) {
        if (settings == null) {
            throw new InvalidCrawlSettingsException(List.of("settings are required"));
        }
        List<String> violations = new ArrayList<>(settings.violations());
        String seed = null;
        if (settings.seedUrl() != null && !settings.seedUrl().isBlank()) {
            try {
                seed = UrlNormalizer.normalize(settings.seedUrl());
            } catch (UrlNormalizationException e) {
                violations.add("seedUrl is not a valid http(s) URL: " + e.getMessage());
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidCrawlSettingsException(violations);
        }
        return settings.withSeedUrl(seed);
    }

    private void execute(CrawlRunHandle handle) {
        try {
            if (!handle.isStopping()) {
                crawl(handle);
            }
        } catch (RuntimeException e) {
            log.error("Crawl run {} failed", handle.runId(), e);
            handle.fail("unexpected error: " + e.getMessage());
        }
        try {
            finish(handle);
        } catch (RuntimeException e) {
            log.error("Crawl run {} could not be finalized", handle.runId(), e);
            handle.completeExceptionally(e);
        }
    }

    private void crawl(CrawlRunHandle handle) {
        CrawlSettings settings = handle.settings();
        RobotsTxtService robots = settings.respectRobots()
            ? new RobotsTxtService(fetcher, settings.timeout(), settings.userAgent(), properties.getRobots().isFailOpen())
            : null;
        RunContext context = new RunContext(
            handle,
            handle.seedHost(),
            new PolitenessGate(settings.requestDelayOrZero()),
            robots
        );

        // The seed is exempt from robots so every run yields at least one record.
        handle.frontier().offer(settings.seedUrl(), 0);

        int workerCount = settings.maxConcurrentFetches();
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, workerThreadFactory(handle.runId()));
        handle.bindWorkers(workers);
        log.info(
            "Crawl run {} started seed={} maxPages={} workers={} respectRobots={} followExternal={}",
            handle.runId(),
            settings.seedUrl(),
            settings.maxPages(),
            workerCount,
            settings.respectRobots(),
            settings.followExternal()
        );
        try {
            for (int i = 0; i < workerCount; i++) {
                workers.execute(() -> workerLoop(context));
            }
        } catch (RejectedExecutionException e) {
            log.debug("Crawl run {} stopped before all workers started", handle.runId());
        }
        workers.shutdown();
        awaitWorkers(handle, workers);
    }

    private void awaitWorkers(CrawlRunHandle handle, ExecutorService workers) {
        Duration limit = handle.settings().maxRunDuration();
        try {
            boolean finished;
            if (limit == null) {
                finished = workers.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
            } else {
                long remainingMs = Duration.between(Instant.now(), handle.startedAt().plus(limit)).toMillis();
                finished = workers.awaitTermination(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                if (handle.cancel(DEADLINE_REASON)) {
                    log.warn("Crawl run {} exceeded its deadline of {}", handle.runId(), limit);
                }
                if (!workers.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Crawl run {} workers still busy {} after stop", handle.runId(), STOP_GRACE);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
        }
    }

    private void workerLoop(RunContext context) {
        CrawlRunHandle handle = context.handle();
        Frontier frontier = handle.frontier();
        while (!handle.isStopping()) {
            Optional<Frontier.Entry> next;
            try {
                next = frontier.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next.isEmpty()) {
                return;
            }
            Frontier.Entry entry = next.get();
            try {
                process(context, entry);
            } catch (RuntimeException e) {
                log.error("Crawl run {} worker failed on {}", handle.runId(), entry.url(), e);
                handle.fail("unexpected error: " + e.getMessage());
            } finally {
                frontier.complete(entry.url());
            }
        }
    }

    private void process(RunContext context, Frontier.Entry entry) {
        CrawlRunHandle handle = context.handle();
        String url = entry.url();
        PageRecord record;
        try {
            FetchResult result = fetchWithRetry(url, context);
            if (handle.isStopping()) {
                log.debug("Crawl run {} abandoned {} after stop", handle.runId(), url);
                return;
            }
            record = analyzer.analyze(url, result, context.siteHost()).withDepth(entry.depth());
        } catch (RuntimeException e) {
            log.warn("Crawl run {} failed to crawl {}", handle.runId(), url, e);
            record = PageRecord.failed(url, 0, Issue.of(
                "crawl_error",
                Severity.CRITICAL,
                Issue.CATEGORY_CRAWLABILITY,
                "Unexpected error crawling the page: " + e.getMessage()
            )).withDepth(entry.depth());
        }
        if (handle.isStopping()) {
            return;
        }
        discover(context, entry, record);
        handle.addRecord(record);
        emit(handle, record);
    }

    private void discover(RunContext context, Frontier.Entry entry, PageRecord record) {
        CrawlRunHandle handle = context.handle();
        CrawlSettings settings = handle.settings();
        Frontier frontier = handle.frontier();
        if (record.finalUrl() != null && !record.finalUrl().equals(record.url())) {
            frontier.markAlias(record.finalUrl());
        }
        // Pages outside the seed host are leaves.
        if (!UrlNormalizer.isInternal(record.url(), context.siteHost())) {
            return;
        }
        int childDepth = entry.depth() + 1;
        for (PageLink link : record.internalLinks()) {
            if (link.nofollow() && !settings.followNofollow()) {
                continue;
            }
            offer(context, link.url(), childDepth);
        }
        for (PageLink link : record.externalLinks()) {
            if (!settings.followExternal()) {
                frontier.reject(link.url(), Frontier.RejectReason.EXTERNAL);
                continue;
            }
            if (link.nofollow() && !settings.followNofollow()) {
                continue;
            }
            offer(context, link.url(), childDepth);
        }
    }

    private void offer(RunContext context, String url, int depth) {
        CrawlRunHandle handle = context.handle();
        Frontier frontier = handle.frontier();
        Integer maxDepth = handle.settings().maxDepth();
        if (frontier.isKnown(url) || (maxDepth != null && depth > maxDepth)) {
            return;
        }
        if (context.robots() != null && !context.robots().isAllowed(url)) {
            if (frontier.reject(url, Frontier.RejectReason.ROBOTS)) {
                log.debug("Crawl run {} skipping {} disallowed by robots.txt", handle.runId(), url);
            }
            return;
        }
        if (frontier.offer(url, depth) == Frontier.OfferOutcome.REJECTED_BUDGET) {
            log.debug("Crawl run {} page budget reached, skipping {}", handle.runId(), url);
        }
    }

    private void emit(CrawlRunHandle handle, PageRecord record) {
        for (PageRecordSink sink : sinks) {
            try {
                sink.accept(handle.runId(), record);
            } catch (RuntimeException e) {
                log.error("Crawl run {} page record sink failed on {}", handle.runId(), record.url(), e);
                handle.fail("page record sink failed: " + e.getMessage());
                return;
            }
        }
    }

    private FetchResult fetchWithRetry(String url, RunContext context) {
        CrawlSettings settings = context.handle().settings();
        String host = hostOf(url);
        int maxAttempts = 1 + settings.maxRetries();
        FetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                context.gate().awaitTurn(host);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new FetchResult.NetworkError("interrupted");
            }
            lastResult = fetcher.fetch(url, settings.timeout(), settings.userAgent());
            if (isRateLimited(lastResult)) {
                context.gate().extendBackoff(host, Duration.ofSeconds(properties.getRateLimitBackoffSeconds()));
            }
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} after {} (attempt {}/{})", url, lastResult.describe(), attempt, maxAttempts);
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    static boolean shouldRetry(FetchResult result) {
        if (result instanceof FetchResult.Timeout) {
            return true;
        }
        if (result instanceof FetchResult.NetworkError error) {
            String detail = error.detail() == null ? "" : error.detail();
            return !detail.startsWith("invalid_url") && !detail.equals("interrupted");
        }
        int status = ((FetchResult.Success) result).status();
        return status == 408 || status == 429 || status >= 500;
    }

    private static boolean isRateLimited(FetchResult result) {
        return result instanceof FetchResult.Success success
            && (success.status() == 429 || success.status() == 503);
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CrawlReport finish(CrawlRunHandle handle) {
        String reason = handle.seal();
        List<PageRecord> pages = handle.pages();
        CrawlRunStatus status = reason == null ? CrawlRunStatus.COMPLETED : CrawlRunStatus.FAILED;
        Instant finishedAt = Instant.now();
        int totalPages = Math.max(handle.frontier().acceptedCount(), pages.size());
        CrawlRun provisional = new CrawlRun(
            handle.runId(),
            handle.settings(),
            handle.startedAt(),
            finishedAt,
            status,
            handle.isCancelled(),
            reason,
            totalPages,
            pages.size(),
            0,
            null,
            Map.of()
        );
        AuditSummary summary = aggregator.aggregate(provisional, pages);
        CrawlRun run = new CrawlRun(
            handle.runId(),
            handle.settings(),
            handle.startedAt(),
            finishedAt,
            status,
            handle.isCancelled(),
            reason,
            totalPages,
            pages.size(),
            summary.indexablePages(),
            summary.siteScore(),
            summary.issuesCount()
        );
        CrawlReport report = new CrawlReport(run, pages, summary);
        handle.finish(report);
        log.info(
            "Crawl run {} finished status={} pages={} score={} duration={}",
            run.runId(),
            run.status(),
            run.crawledPages(),
            run.siteScore(),
            Duration.between(run.startedAt(), finishedAt)
        );
        for (CrawlRunListener listener : listeners) {
            try {
                listener.onRunFinished(report);
            } catch (RuntimeException e) {
                log.warn("Crawl run listener {} failed for run {}", listener.getClass().getSimpleName(), run.runId(), e);
            }
        }
        handle.complete(report);
        return report;
    }

    private static String hostOf(String url) {
        URI uri = UrlNormalizer.safeUri(url);
        return uri == null || uri.getHost() == null ? "" : uri.getHost();
    }

    private static ThreadFactory workerThreadFactory(UUID runId) {
        String prefix = "crawl-" + runId.toString().substring(0, 8) + "-worker-";
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record RunContext(
        CrawlRunHandle handle,
        String siteHost,
        PolitenessGate gate,
        RobotsTxtService robots
    ) {
    }
}
