package com.siteaudit.crawl.service;

import com.siteaudit.crawl.model.PageRecord;

import java.util.UUID;

/**
 * Receives each page record as soon as it is produced. Called from crawl worker threads, so
 * implementations must be thread-safe. An exception thrown here fails the whole run.
 */
public interface PageRecordSink {
    void accept(UUID runId, PageRecord record);
}
