package com.siteaudit.crawl.robots;

import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Robots decisions for one crawl run. Rules are fetched once per origin and cached for the
 * lifetime of the run.
 */
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final PageFetcher fetcher;
    private final Duration timeout;
    private final String userAgent;
    private final boolean failOpen;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(PageFetcher fetcher, Duration timeout, String userAgent, boolean failOpen) {
        this.fetcher = fetcher;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.failOpen = failOpen;
    }

    public boolean isAllowed(String url) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return true;
        }
        RobotsRules rules = getRulesForOrigin(origin(uri));
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    public RobotsRules getRulesForOrigin(String origin) {
        return cache.computeIfAbsent(origin, this::loadRules);
    }

    private RobotsRules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        FetchResult fetch = fetcher.fetch(robotsUrl, timeout, userAgent);
        if (fetch instanceof FetchResult.Success success) {
            int status = success.status();
            if (success.is2xx()) {
                RobotsRules rules = RobotsRules.parse(success.body(), userAgent);
                log.debug("Loaded robots for {} with {} rules", origin, rules.ruleCount());
                return rules;
            }
            if (status >= 400 && status < 500) {
                log.debug("No robots.txt for {} (status={}), allowing all", origin, status);
                return RobotsRules.allowAll();
            }
        }
        String decision = failOpen ? "allow_all" : "disallow_all";
        log.warn("robots fetch failed origin={} result={} decision={}", origin, fetch.describe(), decision);
        return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
    }

    private static String origin(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String origin = scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT);
        if (uri.getPort() != -1) {
            origin = origin + ":" + uri.getPort();
        }
        return origin;
    }
}
