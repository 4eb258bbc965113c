package com.siteaudit.crawl.page;

import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.model.Issue;
import com.siteaudit.crawl.model.PageLink;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.Severity;
import com.siteaudit.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns one fetch outcome into a {@link PageRecord}. Deterministic: the same input always yields
 * the same record and issue list.
 */
@Component
public class PageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PageAnalyzer.class);

    static final int TITLE_MIN_LENGTH = 10;
    static final int TITLE_MAX_LENGTH = 60;
    static final int META_DESCRIPTION_MIN_LENGTH = 50;
    static final int META_DESCRIPTION_MAX_LENGTH = 160;
    static final int ISSUE_PENALTY = 5;

    private static final List<String> SKIPPED_HREF_PREFIXES = List.of("#", "javascript:", "mailto:", "tel:", "data:");

    public PageRecord analyze(String url, FetchResult result) {
        return analyze(url, result, UrlNormalizer.extractDomain(url));
    }

    /**
     * @param siteHost host that decides whether a link is internal; usually the crawl seed's
     */
    public PageRecord analyze(String url, FetchResult result, String siteHost) {
        if (result instanceof FetchResult.Timeout timeout) {
            return PageRecord.failed(url, 0, Issue.of(
                "timeout",
                Severity.CRITICAL,
                Issue.CATEGORY_CRAWLABILITY,
                "Timed out fetching " + url + " (" + timeout.detail() + ")"
            ));
        }
        if (result instanceof FetchResult.NetworkError error) {
            return PageRecord.failed(url, 0, Issue.of(
                "fetch_error",
                Severity.CRITICAL,
                Issue.CATEGORY_CRAWLABILITY,
                "Error fetching the page: " + error.detail()
            ));
        }

        FetchResult.Success success = (FetchResult.Success) result;
        String finalUrl = UrlNormalizer.tryNormalize(success.finalUrl()).orElse(null);
        if (!success.is2xx()) {
            return PageRecord.failed(url, finalUrl, success.status(), success.contentType(), success.sizeBytes(), Issue.of(
                "http_error:" + success.status(),
                Severity.CRITICAL,
                Issue.CATEGORY_CRAWLABILITY,
                "HTTP status " + success.status() + " returned for " + url
            ));
        }
        if (!isHtml(success.contentType())) {
            return PageRecord.failed(url, finalUrl, success.status(), success.contentType(), success.sizeBytes(), Issue.of(
                "not_html",
                Severity.NOTICE,
                Issue.CATEGORY_CRAWLABILITY,
                "Not an HTML page: " + (success.contentType() == null ? "no content type" : success.contentType())
            ));
        }

        try {
            return analyzeHtml(url, finalUrl, success, siteHost);
        } catch (RuntimeException e) {
            log.warn("HTML analysis failed for {}", url, e);
            return PageRecord.failed(url, finalUrl, success.status(), success.contentType(), success.sizeBytes(), Issue.of(
                "parse_error",
                Severity.NOTICE,
                Issue.CATEGORY_CRAWLABILITY,
                "The page could not be parsed as HTML: " + e.getMessage()
            ));
        }
    }

    private PageRecord analyzeHtml(String url, String finalUrl, FetchResult.Success success, String siteHost) {
        String baseUrl = success.finalUrl() == null || success.finalUrl().isBlank() ? url : success.finalUrl();
        Document document = Jsoup.parse(success.body() == null ? "" : success.body(), baseUrl);

        String title = blankToNull(textOf(document.selectFirst("title")));
        String metaDescription = blankToNull(metaContent(document, "description"));
        String metaRobots = blankToNull(metaContent(document, "robots"));
        String canonical = blankToNull(canonicalHref(document));
        List<String> h1 = new ArrayList<>();
        for (Element heading : document.select("h1")) {
            h1.add(heading.text().trim());
        }

        List<PageLink> internalLinks = new ArrayList<>();
        List<PageLink> externalLinks = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (isSkippedHref(href)) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (absolute.isEmpty()) {
                absolute = UrlNormalizer.resolve(baseUrl, href);
            }
            Optional<String> target = UrlNormalizer.tryNormalize(absolute);
            if (target.isEmpty()) {
                log.debug("Skipping link that cannot be normalized page={} href={}", url, href);
                continue;
            }
            PageLink link = new PageLink(target.get(), anchor.text().trim(), relTokens(anchor).contains("nofollow"));
            if (UrlNormalizer.isInternal(link.url(), siteHost)) {
                internalLinks.add(link);
            } else {
                externalLinks.add(link);
            }
        }

        boolean indexable = isIndexable(url, baseUrl, metaRobots, canonical);
        List<Issue> issues = findIssues(title, metaDescription, h1);
        int score = Math.max(0, 100 - ISSUE_PENALTY * issues.size());

        return new PageRecord(
            url,
            finalUrl,
            success.status(),
            title,
            metaDescription,
            h1,
            canonical,
            metaRobots,
            success.contentType(),
            success.sizeBytes(),
            countWords(document),
            indexable,
            score,
            0,
            internalLinks,
            externalLinks,
            issues
        );
    }

    List<Issue> findIssues(String title, String metaDescription, List<String> h1) {
        List<Issue> issues = new ArrayList<>();
        if (title == null) {
            issues.add(Issue.of("missing_title", Severity.CRITICAL, Issue.CATEGORY_META_TAGS,
                "The page has no title tag"));
        } else if (length(title) < TITLE_MIN_LENGTH) {
            issues.add(Issue.of("title_too_short", Severity.WARNING, Issue.CATEGORY_META_TAGS,
                "The page title is too short (less than " + TITLE_MIN_LENGTH + " characters)"));
        } else if (length(title) > TITLE_MAX_LENGTH) {
            issues.add(Issue.of("title_too_long", Severity.WARNING, Issue.CATEGORY_META_TAGS,
                "The page title is too long (more than " + TITLE_MAX_LENGTH + " characters)"));
        }

        if (metaDescription == null) {
            issues.add(Issue.of("missing_meta_description", Severity.WARNING, Issue.CATEGORY_META_TAGS,
                "The page has no meta description"));
        } else if (length(metaDescription) < META_DESCRIPTION_MIN_LENGTH) {
            issues.add(Issue.of("meta_description_too_short", Severity.NOTICE, Issue.CATEGORY_META_TAGS,
                "The meta description is too short (less than " + META_DESCRIPTION_MIN_LENGTH + " characters)"));
        } else if (length(metaDescription) > META_DESCRIPTION_MAX_LENGTH) {
            issues.add(Issue.of("meta_description_too_long", Severity.NOTICE, Issue.CATEGORY_META_TAGS,
                "The meta description is too long (more than " + META_DESCRIPTION_MAX_LENGTH + " characters)"));
        }

        if (h1.isEmpty()) {
            issues.add(Issue.of("missing_h1", Severity.WARNING, Issue.CATEGORY_HEADINGS,
                "The page has no H1 heading"));
        } else if (h1.size() > 1) {
            issues.add(Issue.of("multiple_h1", Severity.WARNING, Issue.CATEGORY_HEADINGS,
                "The page has multiple H1 headings (" + h1.size() + ")"));
        }
        return issues;
    }

    private boolean isIndexable(String url, String baseUrl, String metaRobots, String canonical) {
        if (metaRobots != null && metaRobots.toLowerCase(Locale.ROOT).contains("noindex")) {
            return false;
        }
        if (canonical == null) {
            return true;
        }
        String resolved = UrlNormalizer.resolve(baseUrl, canonical);
        Optional<String> canonicalTarget = UrlNormalizer.tryNormalize(resolved == null ? canonical : resolved);
        if (canonicalTarget.isEmpty()) {
            return true;
        }
        String self = UrlNormalizer.tryNormalize(url).orElse(url);
        return canonicalTarget.get().equals(self);
    }

    static int countWords(Document document) {
        Document copy = document.clone();
        copy.select("script, style, noscript, template").remove();
        String text = copy.body() == null ? "" : copy.body().text().trim();
        if (text.isEmpty()) {
            return 0;
        }
        return text.split("\\s+").length;
    }

    static boolean isHtml(String contentType) {
        if (contentType == null) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("text/html") || lower.contains("application/xhtml+xml");
    }

    private static boolean isSkippedHref(String href) {
        if (href.isEmpty()) {
            return true;
        }
        String lower = href.toLowerCase(Locale.ROOT);
        for (String prefix : SKIPPED_HREF_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String metaContent(Document document, String name) {
        for (Element meta : document.select("meta[name]")) {
            if (meta.attr("name").trim().equalsIgnoreCase(name)) {
                return meta.attr("content").trim();
            }
        }
        return null;
    }

    private static String canonicalHref(Document document) {
        for (Element link : document.select("link[rel]")) {
            if (relTokens(link).contains("canonical")) {
                return link.attr("href").trim();
            }
        }
        return null;
    }

    private static List<String> relTokens(Element element) {
        String rel = element.attr("rel").trim().toLowerCase(Locale.ROOT);
        return rel.isEmpty() ? List.of() : List.of(rel.split("\\s+"));
    }

    private static String textOf(Element element) {
        return element == null ? null : element.text().trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }
}
