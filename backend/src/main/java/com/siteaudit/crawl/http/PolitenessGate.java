package com.siteaudit.crawl.http;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spaces request starts per host. One instance per crawl run; callers for the same host queue
 * up on the host's lock while the earlier caller sleeps.
 */
public class PolitenessGate {
    private final Duration minDelay;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PolitenessGate(Duration minDelay) {
        this.minDelay = minDelay == null || minDelay.isNegative() ? Duration.ZERO : minDelay;
    }

    public void awaitTurn(String host) throws InterruptedException {
        String key = normalizeHost(host);
        Object lock = hostLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(key, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(key, Instant.now().plus(minDelay));
        }
    }

    public void extendBackoff(String host, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        String key = normalizeHost(host);
        Object lock = hostLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(key, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(key, candidate);
            }
        }
    }

    Instant nextAllowedAt(String host) {
        return hostNextAllowed.get(normalizeHost(host));
    }

    private static String normalizeHost(String host) {
        return host == null ? "" : host.trim().toLowerCase(Locale.ROOT);
    }
}
