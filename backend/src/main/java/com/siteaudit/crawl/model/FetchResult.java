package com.siteaudit.crawl.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a single fetch attempt. Failures are values, not exceptions.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.Timeout, FetchResult.NetworkError {

    /**
     * Short form for log lines; never includes the body.
     */
    default String describe() {
        if (this instanceof Success success) {
            return "status=" + success.status();
        }
        if (this instanceof Timeout timeout) {
            return "timeout: " + timeout.detail();
        }
        return "network_error: " + ((NetworkError) this).detail();
    }

    record Success(
        int status,
        Map<String, List<String>> headers,
        String body,
        long sizeBytes,
        String contentType,
        String finalUrl
    ) implements FetchResult {
        public Success {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }

        public boolean is2xx() {
            return status >= 200 && status < 300;
        }
    }

    record Timeout(String detail) implements FetchResult {
    }

    record NetworkError(String detail) implements FetchResult {
    }
}
