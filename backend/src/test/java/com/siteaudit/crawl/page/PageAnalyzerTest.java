package com.siteaudit.crawl.page;

import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.model.Issue;
import com.siteaudit.crawl.model.PageLink;
import com.siteaudit.crawl.model.PageRecord;
import com.siteaudit.crawl.model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageAnalyzerTest {
    private static final String GOOD_DESCRIPTION =
        "A description long enough to pass the fifty character minimum check.";

    private final PageAnalyzer analyzer = new PageAnalyzer();

    @Test
    void missingTitleAndH1CostTenPoints() {
        String html = """
            <html><head>
              <meta name="description" content="%s">
            </head><body><p>Hello world</p></body></html>
            """.formatted(GOOD_DESCRIPTION);

        PageRecord record = analyzer.analyze("https://example.com/", html(html, "https://example.com/"));

        assertThat(types(record)).containsExactly("missing_title", "missing_h1");
        assertEquals(90, record.score());
        assertTrue(record.indexable());
        assertEquals(Severity.CRITICAL, record.issues().get(0).severity());
        assertEquals(Issue.CATEGORY_HEADINGS, record.issues().get(1).category());
    }

    @Test
    void extractsMetadataAndPartitionsLinks() {
        String html = """
            <html><head>
              <title>Example home page title</title>
              <meta name="Description" content="%s">
              <meta name="robots" content="index, follow">
              <link rel="canonical" href="https://www.example.com/">
            </head><body>
              <h1>Welcome</h1>
              <a href="/about/">About us</a>
              <a href="blog?page=2#comments">Blog</a>
              <a href="https://blog.example.com/post" rel="nofollow">Post</a>
              <a href="https://other.org/x">Other</a>
              <a href="#top">Top</a>
              <a href="mailto:hi@example.com">Mail</a>
              <a href="javascript:void(0)">JS</a>
              <a href="tel:+123">Call</a>
            </body></html>
            """.formatted(GOOD_DESCRIPTION);

        PageRecord record = analyzer.analyze("https://example.com/", html(html, "https://example.com/"));

        assertEquals("Example home page title", record.title());
        assertEquals(GOOD_DESCRIPTION, record.metaDescription());
        assertEquals(List.of("Welcome"), record.h1());
        assertEquals("index, follow", record.metaRobots());
        assertTrue(record.indexable());
        assertThat(record.issues()).isEmpty();
        assertEquals(100, record.score());

        Map<String, PageLink> internal = record.internalLinks().stream()
            .collect(Collectors.toMap(PageLink::url, link -> link));
        assertThat(internal).containsOnlyKeys(
            "https://example.com/about",
            "https://example.com/blog",
            "https://blog.example.com/post"
        );
        assertEquals("About us", internal.get("https://example.com/about").anchorText());
        assertTrue(internal.get("https://blog.example.com/post").nofollow());
        assertFalse(internal.get("https://example.com/about").nofollow());
        assertThat(record.externalLinks()).extracting(PageLink::url).containsExactly("https://other.org/x");
    }

    @Test
    void relativeLinksResolveAgainstFinalUrl() {
        String html = "<html><head><title>Redirected page title</title></head>"
            + "<body><h1>x</h1><a href=\"next\">Next</a></body></html>";

        PageRecord record = analyzer.analyze(
            "https://example.com/old",
            html(html, "https://example.com/new/index")
        );

        assertEquals("https://example.com/new/index", record.finalUrl());
        assertThat(record.internalLinks()).extracting(PageLink::url).containsExactly("https://example.com/new/next");
    }

    @Test
    void noindexAndForeignCanonicalMakePageNonIndexable() {
        String noindex = "<html><head><title>Some page title</title>"
            + "<meta name=\"robots\" content=\"NOINDEX,follow\"></head><body><h1>x</h1></body></html>";
        String canonical = "<html><head><title>Some page title</title>"
            + "<link rel=\"canonical\" href=\"/other\"></head><body><h1>x</h1></body></html>";
        String selfCanonical = "<html><head><title>Some page title</title>"
            + "<link rel=\"canonical\" href=\"https://www.example.com/page/\"></head><body><h1>x</h1></body></html>";

        assertFalse(analyzer.analyze("https://example.com/page", html(noindex, "https://example.com/page")).indexable());
        assertFalse(analyzer.analyze("https://example.com/page", html(canonical, "https://example.com/page")).indexable());
        assertTrue(analyzer.analyze("https://example.com/page", html(selfCanonical, "https://example.com/page")).indexable());
    }

    @Test
    void titleAndDescriptionLengthRules() {
        List<Issue> shortOnes = analyzer.findIssues("Short", "Too short", List.of("a"));
        assertThat(shortOnes).extracting(Issue::type)
            .containsExactly("title_too_short", "meta_description_too_short");
        assertThat(shortOnes).extracting(Issue::severity)
            .containsExactly(Severity.WARNING, Severity.NOTICE);

        List<Issue> longOnes = analyzer.findIssues("t".repeat(61), "d".repeat(161), List.of("a", "b"));
        assertThat(longOnes).extracting(Issue::type)
            .containsExactly("title_too_long", "meta_description_too_long", "multiple_h1");

        List<Issue> boundaries = analyzer.findIssues("t".repeat(10), "d".repeat(50), List.of("a"));
        assertThat(boundaries).isEmpty();
        assertThat(analyzer.findIssues("t".repeat(60), "d".repeat(160), List.of("a"))).isEmpty();
    }

    @Test
    void wordCountIgnoresScriptsAndStyles() {
        String html = "<html><head><title>Counting words on a page</title><style>p { color: red }</style></head>"
            + "<body><h1>One two</h1><script>var hidden = 1;</script><p>three four  five</p>"
            + "<noscript>no script text</noscript></body></html>";

        PageRecord record = analyzer.analyze("https://example.com/", html(html, "https://example.com/"));

        assertEquals(5, record.wordCount());
    }

    @Test
    void fetchFailuresYieldSingleCriticalIssue() {
        PageRecord timeout = analyzer.analyze("https://example.com/slow", new FetchResult.Timeout("30s"));
        PageRecord network = analyzer.analyze("https://example.com/x", new FetchResult.NetworkError("connection refused"));
        PageRecord notFound = analyzer.analyze(
            "https://example.com/missing",
            new FetchResult.Success(404, Map.of(), "<html></html>", 13, "text/html", "https://example.com/missing")
        );

        assertEquals(List.of("timeout"), types(timeout));
        assertEquals(List.of("fetch_error"), types(network));
        assertEquals(List.of("http_error:404"), types(notFound));
        for (PageRecord record : List.of(timeout, network, notFound)) {
            assertFalse(record.indexable());
            assertEquals(Severity.CRITICAL, record.issues().get(0).severity());
            assertThat(record.internalLinks()).isEmpty();
        }
        assertEquals(0, timeout.statusCode());
        assertEquals(404, notFound.statusCode());
    }

    @Test
    void nonHtmlContentIsANotice() {
        PageRecord record = analyzer.analyze(
            "https://example.com/report.pdf",
            new FetchResult.Success(200, Map.of(), "%PDF-1.4", 8, "application/pdf", "https://example.com/report.pdf")
        );

        assertEquals(List.of("not_html"), types(record));
        assertEquals(Severity.NOTICE, record.issues().get(0).severity());
        assertFalse(record.indexable());
        assertThat(record.internalLinks()).isEmpty();
    }

    @Test
    void identicalInputGivesIdenticalRecord() {
        String html = "<html><head><title>x</title></head><body><h1>a</h1><h1>b</h1>"
            + "<a href=\"/one\">1</a><a href=\"https://x.org\">2</a></body></html>";

        PageRecord first = analyzer.analyze("https://example.com/", html(html, "https://example.com/"));
        PageRecord second = analyzer.analyze("https://example.com/", html(html, "https://example.com/"));

        assertEquals(first, second);
        assertThat(first.score()).isBetween(0, 100);
    }

    private static FetchResult html(String body, String finalUrl) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return new FetchResult.Success(200, Map.of(), body, bytes.length, "text/html; charset=utf-8", finalUrl);
    }

    private static List<String> types(PageRecord record) {
        return record.issues().stream().map(Issue::type).collect(Collectors.toList());
    }
}
