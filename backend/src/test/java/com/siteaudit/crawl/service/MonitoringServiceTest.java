package com.siteaudit.crawl.service;

import com.siteaudit.config.CrawlerProperties;
import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.model.MonitoringDiff;
import com.siteaudit.crawl.model.MonitoringReport;
import com.siteaudit.crawl.model.MonitoringSettings;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.SiteStatus;
import com.siteaudit.crawl.page.PageAnalyzer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonitoringServiceTest {
    private static final MonitoringSettings SETTINGS =
        new MonitoringSettings(2, 2, Duration.ofSeconds(5), "SiteAuditBot/0.1");

    @Mock
    private PageFetcher fetcher;

    @Test
    void checksTopScoredIndexablePagesOnly() {
        PageRecord best = PageRecords.withMeta("https://example.com/best", 200, "Best", "Desc", "H1", 400);
        PageRecord good = PageRecords.record("https://example.com/good", 200, true, 90, 400, List.of());
        PageRecord weak = PageRecords.record("https://example.com/weak", 200, true, 50, 400, List.of());
        PageRecord hidden = PageRecords.record("https://example.com/hidden", 200, false, 100, 400, List.of());

        List<PageRecord> targets = MonitoringService.selectTargets(List.of(weak, hidden, good, best), 2);

        assertThat(targets).containsExactly(best, good);
    }

    @Test
    void reportsDownWhenAPageNowFailsWithServerError() {
        PageRecord home = PageRecords.withMeta("https://example.com/", 200,
            "Welcome to the example site", "An example description", "Welcome", 3);
        PageRecord about = PageRecords.withMeta("https://example.com/about", 200,
            "About the example site", "About description", "About", 2);
        when(fetcher.fetch(eq("https://example.com/"), any(Duration.class), anyString()))
            .thenReturn(html("<html><head><title>Welcome to the example site</title>"
                + "<meta name=\"description\" content=\"An example description\"></head>"
                + "<body><h1>Welcome</h1><p>one two</p></body></html>", "https://example.com/"));
        when(fetcher.fetch(eq("https://example.com/about"), any(Duration.class), anyString()))
            .thenReturn(new FetchResult.Success(502, Map.of(), "bad gateway", 11, "text/html", "https://example.com/about"));

        MonitoringReport report = service().check(List.of(home, about), SETTINGS);

        assertEquals(SiteStatus.DOWN, report.status());
        assertEquals(2, report.totalPages());
        assertEquals(1, report.changedPages());
        MonitoringDiff aboutDiff = report.diffs().stream()
            .filter(diff -> diff.url().equals("https://example.com/about"))
            .findFirst()
            .orElseThrow();
        assertEquals(502, aboutDiff.statusChange().newStatus());
    }

    @Test
    void timeoutBecomesStatusZero() {
        PageRecord home = PageRecords.withMeta("https://example.com/", 200, "Title", "Desc", "H1", 10);
        when(fetcher.fetch(anyString(), any(Duration.class), anyString()))
            .thenReturn(new FetchResult.Timeout("no complete response within 5000ms"));

        MonitoringReport report = service().check(List.of(home), SETTINGS);

        MonitoringDiff diff = report.diffs().get(0);
        assertEquals(0, diff.statusChange().newStatus());
        assertThat(diff.statusChange().error()).contains("Timed out");
        assertEquals(SiteStatus.ISSUES, report.status());
    }

    @Test
    void refusesBaselineWithoutIndexablePages() {
        PageRecord hidden = PageRecords.record("https://example.com/", 200, false, 100, 10, List.of());

        assertThatThrownBy(() -> service().check(List.of(hidden), SETTINGS))
            .isInstanceOf(IllegalArgumentException.class);
        verify(fetcher, never()).fetch(anyString(), any(Duration.class), anyString());
    }

    private MonitoringService service() {
        return new MonitoringService(fetcher, new PageAnalyzer(), new MonitoringDiffer(), new CrawlerProperties());
    }

    private static FetchResult html(String body, String finalUrl) {
        return new FetchResult.Success(200, Map.of(), body, body.length(), "text/html", finalUrl);
    }
}
