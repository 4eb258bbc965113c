package com.siteaudit.crawl.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Run handles by id, for polling. Finished handles are kept until {@link #MAX_FINISHED_RUNS}
 * newer ones push them out.
 */
@Component
public class CrawlRunRegistry {
    static final int MAX_FINISHED_RUNS = 100;

    private final Map<UUID, CrawlRunHandle> handles = new LinkedHashMap<>();

    public synchronized void register(CrawlRunHandle handle) {
        handles.put(handle.runId(), handle);
        evictFinished();
    }

    public synchronized Optional<CrawlRunHandle> find(UUID runId) {
        return Optional.ofNullable(handles.get(runId));
    }

    public synchronized List<CrawlRunHandle> activeRuns() {
        List<CrawlRunHandle> active = new ArrayList<>();
        for (CrawlRunHandle handle : handles.values()) {
            if (!handle.isDone()) {
                active.add(handle);
            }
        }
        return active;
    }

    private void evictFinished() {
        int finished = 0;
        for (CrawlRunHandle handle : handles.values()) {
            if (handle.isDone()) {
                finished++;
            }
        }
        Iterator<CrawlRunHandle> it = handles.values().iterator();
        while (finished > MAX_FINISHED_RUNS && it.hasNext()) {
            if (it.next().isDone()) {
                it.remove();
                finished--;
            }
        }
    }
}
