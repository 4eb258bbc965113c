package com.siteaudit.crawl.service;

import com.siteaudit.crawl.model.AuditSummary;
import com.siteaudit.crawl.model.CrawlRun;
import com.siteaudit.crawl.model.Issue;
import com.siteaudit.crawl.model.IssuePage;
import com.siteaudit.crawl.model.PageDetails;
import com.siteaudit.crawl.model.PageLink;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.Severity;
import com.siteaudit.crawl.util.UrlNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the page records of a finished run into the site-level summary. Pure function of its
 * inputs; the order of {@code pages} only matters for ties in issue rankings.
 */
@Component
public class AuditAggregator {
    static final int TOP_ISSUES_LIMIT = 10;
    static final int MAX_PAGE_SIZE = 500;
    static final double CRITICAL_PENALTY = 30.0;
    static final double WARNING_PENALTY = 15.0;

    private static final Comparator<Issue> ISSUE_RANKING = Comparator
        .comparing((Issue issue) -> issue.severity().isPriority() ? 0 : 1)
        .thenComparing(Issue::affectedPageCount, Comparator.reverseOrder());

    public AuditSummary aggregate(CrawlRun run, List<PageRecord> pages) {
        List<PageRecord> safePages = pages == null ? List.of() : pages;
        int indexable = 0;
        Map<Severity, Integer> issuesCount = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            issuesCount.put(severity, 0);
        }
        Map<String, Map<Severity, Integer>> categories = new LinkedHashMap<>();
        for (PageRecord page : safePages) {
            if (page.indexable()) {
                indexable++;
            }
            for (Issue issue : page.issues()) {
                issuesCount.merge(issue.severity(), 1, Integer::sum);
                categories
                    .computeIfAbsent(issue.category(), ignored -> new EnumMap<>(Severity.class))
                    .merge(issue.severity(), 1, Integer::sum);
            }
        }
        List<Issue> ranked = rankIssues(safePages);
        List<Issue> topIssues = ranked.size() > TOP_ISSUES_LIMIT
            ? List.copyOf(ranked.subList(0, TOP_ISSUES_LIMIT))
            : List.copyOf(ranked);
        return new AuditSummary(
            siteScore(safePages),
            safePages.size(),
            indexable,
            Collections.unmodifiableMap(issuesCount),
            Collections.unmodifiableMap(categories),
            topIssues
        );
    }

    /**
     * Average score of indexable pages, minus 30 points scaled by the share of pages with a
     * critical issue and 15 points scaled by the share of pages with a warning. Clamped to
     * [0, 100]; 0 when there is no indexable page.
     */
    public int siteScore(List<PageRecord> pages) {
        if (pages == null || pages.isEmpty()) {
            return 0;
        }
        int indexable = 0;
        long scoreSum = 0;
        int criticalPages = 0;
        int warningPages = 0;
        for (PageRecord page : pages) {
            if (page.indexable()) {
                indexable++;
                scoreSum += page.score();
            }
            if (page.hasIssueWithSeverity(Severity.CRITICAL)) {
                criticalPages++;
            }
            if (page.hasIssueWithSeverity(Severity.WARNING)) {
                warningPages++;
            }
        }
        if (indexable == 0) {
            return 0;
        }
        double total = pages.size();
        double score = (double) scoreSum / indexable
            - CRITICAL_PENALTY * criticalPages / total
            - WARNING_PENALTY * warningPages / total;
        long rounded = Math.round(score);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    /**
     * Distinct issues in ranking order, optionally filtered, one page of them at a time.
     *
     * @param page 1-based; values below 1 are treated as 1
     */
    public IssuePage listIssues(List<PageRecord> pages, Severity severity, String category, int page, int pageSize) {
        int safePage = Math.max(1, page);
        int safePageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
        List<Issue> filtered = new ArrayList<>();
        for (Issue issue : rankIssues(pages == null ? List.of() : pages)) {
            if (severity != null && issue.severity() != severity) {
                continue;
            }
            if (category != null && !category.isBlank() && !category.equals(issue.category())) {
                continue;
            }
            filtered.add(issue);
        }
        int totalItems = filtered.size();
        int totalPages = (totalItems + safePageSize - 1) / safePageSize;
        int from = Math.min(totalItems, (safePage - 1) * safePageSize);
        int to = Math.min(totalItems, from + safePageSize);
        return new IssuePage(List.copyOf(filtered.subList(from, to)), safePage, safePageSize, totalItems, totalPages);
    }

    public Optional<PageDetails> pageDetails(List<PageRecord> pages, String url) {
        if (pages == null || url == null) {
            return Optional.empty();
        }
        String target = UrlNormalizer.tryNormalize(url).orElse(url);
        PageRecord found = null;
        for (PageRecord page : pages) {
            if (page.url().equals(target)) {
                found = page;
                break;
            }
        }
        if (found == null) {
            return Optional.empty();
        }
        List<PageDetails.InboundLink> inbound = new ArrayList<>();
        for (PageRecord page : pages) {
            if (page.url().equals(target)) {
                continue;
            }
            PageLink link = findLinkTo(page, target);
            if (link != null) {
                inbound.add(new PageDetails.InboundLink(page.url(), page.title(), link.anchorText()));
            }
        }
        return Optional.of(new PageDetails(found, List.copyOf(inbound)));
    }

    private static PageLink findLinkTo(PageRecord page, String target) {
        for (PageLink link : page.internalLinks()) {
            if (link.url().equals(target)) {
                return link;
            }
        }
        for (PageLink link : page.externalLinks()) {
            if (link.url().equals(target)) {
                return link;
            }
        }
        return null;
    }

    private static List<Issue> rankIssues(List<PageRecord> pages) {
        Map<String, Issue> firstSeen = new LinkedHashMap<>();
        Map<String, Integer> pageCounts = new LinkedHashMap<>();
        for (PageRecord page : pages) {
            Set<String> keysOnPage = new HashSet<>();
            for (Issue issue : page.issues()) {
                String key = issue.key();
                firstSeen.putIfAbsent(key, issue);
                if (keysOnPage.add(key)) {
                    pageCounts.merge(key, 1, Integer::sum);
                }
            }
        }
        List<Issue> ranked = new ArrayList<>(firstSeen.size());
        for (Map.Entry<String, Issue> entry : firstSeen.entrySet()) {
            ranked.add(entry.getValue().withAffectedPageCount(pageCounts.get(entry.getKey())));
        }
        ranked.sort(ISSUE_RANKING);
        return ranked;
    }
}
