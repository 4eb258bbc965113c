package com.siteaudit.crawl.service;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * URL frontier and visited set of one crawl run, guarded by a single lock. Every URL the run
 * has ever seen has exactly one state, so a URL can never be queued, in flight and done at the
 * same time, and membership check plus insert is one atomic step.
 *
 * <p>The budget counts URLs that ever reached {@link UrlState#QUEUED}. Offers past the budget
 * are rejected, while already queued and in-flight URLs still run to completion.
 */
public class Frontier {

    public enum UrlState {
        QUEUED,
        IN_FLIGHT,
        DONE,
        REJECTED
    }

    public enum RejectReason {
        BUDGET,
        EXTERNAL,
        ROBOTS
    }

    public enum OfferOutcome {
        QUEUED,
        ALREADY_KNOWN,
        REJECTED_BUDGET,
        CLOSED
    }

    public record Entry(String url, int depth) {
    }

    private final int maxPages;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, UrlState> states = new HashMap<>();
    private final Map<RejectReason, Integer> rejections = new EnumMap<>(RejectReason.class);
    private final ArrayDeque<Entry> queue = new ArrayDeque<>();
    private int accepted;
    private int inFlight;
    private boolean closed;

    public Frontier(int maxPages) {
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be > 0");
        }
        this.maxPages = maxPages;
    }

    public OfferOutcome offer(String url, int depth) {
        lock.lock();
        try {
            if (closed) {
                return OfferOutcome.CLOSED;
            }
            if (states.containsKey(url)) {
                return OfferOutcome.ALREADY_KNOWN;
            }
            if (accepted >= maxPages) {
                markRejected(url, RejectReason.BUDGET);
                return OfferOutcome.REJECTED_BUDGET;
            }
            states.put(url, UrlState.QUEUED);
            queue.addLast(new Entry(url, depth));
            accepted++;
            changed.signal();
            return OfferOutcome.QUEUED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a terminal rejection for a URL the run has not seen yet.
     *
     * @return false if the URL already had a state
     */
    public boolean reject(String url, RejectReason reason) {
        lock.lock();
        try {
            if (states.containsKey(url)) {
                return false;
            }
            markRejected(url, reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a URL done without fetching it, e.g. the target of a redirect that was already
     * fetched under another URL. Does not count towards the budget.
     */
    public boolean markAlias(String url) {
        lock.lock();
        try {
            if (states.containsKey(url)) {
                return false;
            }
            states.put(url, UrlState.DONE);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a URL can be handed out. Returns empty once nothing is queued and nothing is
     * in flight, or after {@link #close()}.
     */
    public Optional<Entry> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    return Optional.empty();
                }
                Entry next = queue.pollFirst();
                if (next != null) {
                    states.put(next.url(), UrlState.IN_FLIGHT);
                    inFlight++;
                    return Optional.of(next);
                }
                if (inFlight == 0) {
                    changed.signalAll();
                    return Optional.empty();
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public void complete(String url) {
        lock.lock();
        try {
            if (states.get(url) != UrlState.IN_FLIGHT) {
                throw new IllegalStateException("URL is not in flight: " + url);
            }
            states.put(url, UrlState.DONE);
            inFlight--;
            if (inFlight == 0 && queue.isEmpty()) {
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isKnown(String url) {
        lock.lock();
        try {
            return states.containsKey(url);
        } finally {
            lock.unlock();
        }
    }

    public UrlState state(String url) {
        lock.lock();
        try {
            return states.get(url);
        } finally {
            lock.unlock();
        }
    }

    public int acceptedCount() {
        lock.lock();
        try {
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int rejectedCount(RejectReason reason) {
        lock.lock();
        try {
            return rejections.getOrDefault(reason, 0);
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try {
            return queue.isEmpty() && inFlight == 0;
        } finally {
            lock.unlock();
        }
    }

    private void markRejected(String url, RejectReason reason) {
        states.put(url, UrlState.REJECTED);
        rejections.merge(reason, 1, Integer::sum);
    }
}
