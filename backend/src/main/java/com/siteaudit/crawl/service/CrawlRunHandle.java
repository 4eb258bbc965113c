package com.siteaudit.crawl.service;

import com.siteaudit.crawl.model.CrawlReport;
import com.siteaudit.crawl.model.CrawlRun;
import com.siteaudit.crawl.model.CrawlRunStatus;
import com.siteaudit.crawl.model.CrawlSettings;
import com.siteaudit.crawl.model.PageRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live view of one crawl run. Callers poll {@link #snapshot()}, wait on {@link #await()} or
 * stop the run with {@link #cancel()}; the scheduler drives the rest through package-private
 * methods.
 */
public class CrawlRunHandle {
    static final String CANCELLED_REASON = "cancelled";

    private final UUID runId;
    private final CrawlSettings settings;
    private final String seedHost;
    private final Instant startedAt;
    private final Frontier frontier;
    private final List<PageRecord> records = new ArrayList<>();
    private final CompletableFuture<CrawlReport> completion = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<String> failureReason = new AtomicReference<>();
    private final AtomicReference<ExecutorService> workers = new AtomicReference<>();
    private final Object outcomeLock = new Object();
    private boolean sealed;
    private volatile CrawlRun finalRun;

    CrawlRunHandle(UUID runId, CrawlSettings settings, String seedHost, Instant startedAt) {
        this.runId = runId;
        this.settings = settings;
        this.seedHost = seedHost;
        this.startedAt = startedAt;
        this.frontier = new Frontier(settings.maxPages());
    }

    public UUID runId() {
        return runId;
    }

    public CrawlSettings settings() {
        return settings;
    }

    public String seedHost() {
        return seedHost;
    }

    public CrawlRun snapshot() {
        CrawlRun done = finalRun;
        if (done != null) {
            return done;
        }
        List<PageRecord> pages = pages();
        int indexable = 0;
        for (PageRecord page : pages) {
            if (page.indexable()) {
                indexable++;
            }
        }
        return new CrawlRun(
            runId,
            settings,
            startedAt,
            null,
            CrawlRunStatus.IN_PROGRESS,
            cancelled.get(),
            failureReason.get(),
            frontier.acceptedCount(),
            pages.size(),
            indexable,
            null,
            Map.of()
        );
    }

    /**
     * Records produced so far, in completion order.
     */
    public List<PageRecord> pages() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public int queuedCount() {
        return frontier.queuedCount();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public CrawlReport await() {
        return completion.join();
    }

    public Optional<CrawlReport> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Crawl run " + runId + " failed unexpectedly", e.getCause());
        }
    }

    /**
     * Stops the run. Records already produced are kept; in-flight fetches are abandoned.
     *
     * @return false if the run had already finished or was already stopping
     */
    public boolean cancel() {
        return cancel(CANCELLED_REASON);
    }

    boolean cancel(String reason) {
        synchronized (outcomeLock) {
            if (sealed || finalRun != null || isDone() || !failureReason.compareAndSet(null, reason)) {
                return false;
            }
            cancelled.set(true);
        }
        halt();
        return true;
    }

    boolean fail(String reason) {
        synchronized (outcomeLock) {
            if (sealed || !failureReason.compareAndSet(null, reason)) {
                return false;
            }
        }
        halt();
        return true;
    }

    /**
     * Freezes the outcome before the final report is built; later cancel or fail calls are
     * no-ops.
     *
     * @return the failure reason at the moment of sealing, null for a clean run
     */
    String seal() {
        synchronized (outcomeLock) {
            sealed = true;
            return failureReason.get();
        }
    }

    boolean isStopping() {
        return failureReason.get() != null;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    Instant startedAt() {
        return startedAt;
    }

    Frontier frontier() {
        return frontier;
    }

    void addRecord(PageRecord record) {
        synchronized (records) {
            records.add(record);
        }
    }

    void bindWorkers(ExecutorService pool) {
        workers.set(pool);
        if (isStopping()) {
            pool.shutdownNow();
        }
    }

    void finish(CrawlReport report) {
        finalRun = report.run();
    }

    void complete(CrawlReport report) {
        completion.complete(report);
    }

    void completeExceptionally(Throwable error) {
        completion.completeExceptionally(error);
    }

    private void halt() {
        frontier.close();
        ExecutorService pool = workers.get();
        if (pool != null) {
            pool.shutdownNow();
        }
    }
}
