package com.siteaudit.crawl.service;

import com.siteaudit.crawl.model.Issue;
import com.siteaudit.crawl.model.MonitoringDiff;
import com.siteaudit.crawl.model.MonitoringReport;
import com.siteaudit.crawl.model.MonitoringSummary;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.SiteStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a stored page record with a fresh analysis of the same URL, and rolls finished
 * checks up into summaries.
 */
@Component
public class MonitoringDiffer {
    static final double CONTENT_CHANGE_THRESHOLD = 0.10;
    static final int MOST_CHANGED_LIMIT = 5;

    private static final Comparator<MonitoringReport> BY_CHECK_TIME =
        Comparator.comparing(MonitoringReport::checkedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    public MonitoringDiff diff(PageRecord baseline, PageRecord fresh) {
        MonitoringDiff.StatusChange statusChange = null;
        if (fresh.statusCode() != baseline.statusCode()) {
            statusChange = new MonitoringDiff.StatusChange(
                baseline.statusCode(),
                fresh.statusCode(),
                fresh.isSuccessful() ? null : failureDescription(fresh)
            );
        }

        List<MonitoringDiff.MetaChange> metaChanges = new ArrayList<>();
        MonitoringDiff.ContentChange contentChange = null;
        // A failed fetch has no meta or content to compare.
        if (fresh.isSuccessful()) {
            addMetaChange(metaChanges, "title", baseline.title(), fresh.title());
            addMetaChange(metaChanges, "meta_description", baseline.metaDescription(), fresh.metaDescription());
            addMetaChange(metaChanges, "h1", baseline.firstH1(), fresh.firstH1());
            contentChange = contentChange(baseline.wordCount(), fresh.wordCount());
        }
        return new MonitoringDiff(baseline.url(), contentChange, metaChanges, statusChange);
    }

    /**
     * {@code DOWN} if any page now answers 5xx, {@code ISSUES} if anything changed at all,
     * {@code UP} otherwise.
     */
    public SiteStatus siteStatus(List<MonitoringDiff> diffs) {
        boolean changed = false;
        for (MonitoringDiff diff : diffs) {
            if (diff.statusChange() != null && diff.statusChange().newStatus() >= 500) {
                return SiteStatus.DOWN;
            }
            changed |= diff.hasChanges();
        }
        return changed ? SiteStatus.ISSUES : SiteStatus.UP;
    }

    /**
     * Aggregates the checks taken at or after {@code since} (all of them when null). Every meta
     * field that changed counts as one change; pages are ranked by their change count, ties
     * keeping the order in which the pages first changed.
     */
    public MonitoringSummary summarize(List<MonitoringReport> reports, Instant since) {
        List<MonitoringReport> window = checksBetween(reports, since, null);
        Map<String, Integer> byType = new LinkedHashMap<>();
        byType.put(MonitoringSummary.CONTENT, 0);
        byType.put(MonitoringSummary.META, 0);
        byType.put(MonitoringSummary.STATUS, 0);
        if (window.isEmpty()) {
            return new MonitoringSummary(since, 0, 0.0, 0, byType, List.of());
        }

        int upChecks = 0;
        int totalChanges = 0;
        Map<String, Integer> byPage = new LinkedHashMap<>();
        for (MonitoringReport report : window) {
            if (report.status() == SiteStatus.UP) {
                upChecks++;
            }
            for (MonitoringDiff diff : report.diffs()) {
                int content = diff.contentChange() == null ? 0 : 1;
                int meta = diff.metaChanges().size();
                int status = diff.statusChange() == null ? 0 : 1;
                byType.merge(MonitoringSummary.CONTENT, content, Integer::sum);
                byType.merge(MonitoringSummary.META, meta, Integer::sum);
                byType.merge(MonitoringSummary.STATUS, status, Integer::sum);
                int pageChanges = content + meta + status;
                if (pageChanges > 0 && diff.url() != null && !diff.url().isEmpty()) {
                    byPage.merge(diff.url(), pageChanges, Integer::sum);
                    totalChanges += pageChanges;
                }
            }
        }

        List<MonitoringSummary.PageChangeCount> ranked = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : byPage.entrySet()) {
            ranked.add(new MonitoringSummary.PageChangeCount(entry.getKey(), entry.getValue()));
        }
        ranked.sort(Comparator.comparingInt(MonitoringSummary.PageChangeCount::changesCount).reversed());
        List<MonitoringSummary.PageChangeCount> top = ranked.size() > MOST_CHANGED_LIMIT
            ? ranked.subList(0, MOST_CHANGED_LIMIT)
            : ranked;
        return new MonitoringSummary(since, window.size(), percentage(upChecks, window.size()), totalChanges, byType, top);
    }

    /**
     * Checks taken inside {@code [from, to]}, newest first, at most {@code limit} of them. A
     * null bound leaves that side open.
     */
    public List<MonitoringReport> history(List<MonitoringReport> reports, Instant from, Instant to, int limit) {
        List<MonitoringReport> window = checksBetween(reports, from, to);
        window.sort(BY_CHECK_TIME.reversed());
        int safeLimit = Math.max(0, limit);
        return List.copyOf(window.size() > safeLimit ? window.subList(0, safeLimit) : window);
    }

    private static List<MonitoringReport> checksBetween(List<MonitoringReport> reports, Instant from, Instant to) {
        List<MonitoringReport> window = new ArrayList<>();
        if (reports == null) {
            return window;
        }
        for (MonitoringReport report : reports) {
            Instant checkedAt = report.checkedAt();
            if (from != null && (checkedAt == null || checkedAt.isBefore(from))) {
                continue;
            }
            if (to != null && (checkedAt == null || checkedAt.isAfter(to))) {
                continue;
            }
            window.add(report);
        }
        window.sort(BY_CHECK_TIME);
        return window;
    }

    private static double percentage(int part, int total) {
        return BigDecimal.valueOf(part * 100.0 / total)
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    static MonitoringDiff.ContentChange contentChange(int oldWordCount, int newWordCount) {
        if (oldWordCount <= 0) {
            return null;
        }
        int delta = newWordCount - oldWordCount;
        if (Math.abs(delta) <= CONTENT_CHANGE_THRESHOLD * oldWordCount) {
            return null;
        }
        double percentage = BigDecimal.valueOf(delta * 100.0 / oldWordCount)
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
        return new MonitoringDiff.ContentChange(oldWordCount, newWordCount, percentage);
    }

    private static void addMetaChange(List<MonitoringDiff.MetaChange> changes, String field, String oldValue, String newValue) {
        if (newValue == null || newValue.isEmpty() || Objects.equals(oldValue, newValue)) {
            return;
        }
        changes.add(new MonitoringDiff.MetaChange(field, oldValue, newValue));
    }

    private static String failureDescription(PageRecord fresh) {
        List<Issue> issues = fresh.issues();
        return issues.isEmpty() ? null : issues.get(0).description();
    }
}
