package com.siteaudit.crawl.http;

import com.siteaudit.config.CrawlerProperties;
import com.siteaudit.crawl.model.FetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPageFetcherTest {
    private MockWebServer server;
    private ExecutorService executor;
    private HttpPageFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        CrawlerProperties properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setMaxBodyBytes(2048);
        fetcher = new HttpPageFetcher(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void returnsStatusBodyAndSendsUserAgent() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html><title>Hi</title></html>"));

        FetchResult result = fetcher.fetch(server.url("/page").toString(), Duration.ofSeconds(5), "TestBot/1.0");

        assertThat(result).isInstanceOf(FetchResult.Success.class);
        FetchResult.Success success = (FetchResult.Success) result;
        assertThat(success.status()).isEqualTo(200);
        assertThat(success.body()).contains("<title>Hi</title>");
        assertThat(success.contentType()).startsWith("text/html");
        assertThat(success.finalUrl()).endsWith("/page");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo("TestBot/1.0");
        assertThat(request.getHeader("Accept")).contains("text/html");
    }

    @Test
    void followsRedirectsAndReportsFinalUrl() {
        server.enqueue(new MockResponse()
            .setResponseCode(301)
            .setHeader("Location", server.url("/final").toString()));
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setBody("<html></html>"));

        FetchResult result = fetcher.fetch(server.url("/start").toString(), Duration.ofSeconds(5), "TestBot/1.0");

        FetchResult.Success success = (FetchResult.Success) result;
        assertThat(success.status()).isEqualTo(200);
        assertThat(success.finalUrl()).endsWith("/final");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void nonSuccessStatusIsStillASuccessValue() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        FetchResult result = fetcher.fetch(server.url("/down").toString(), Duration.ofSeconds(5), "TestBot/1.0");

        assertThat(result).isInstanceOf(FetchResult.Success.class);
        assertThat(((FetchResult.Success) result).status()).isEqualTo(503);
        assertThat(((FetchResult.Success) result).is2xx()).isFalse();
    }

    @Test
    void slowResponseBecomesTimeoutWithinBound() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setBody("<html>late</html>")
            .setHeadersDelay(3, TimeUnit.SECONDS));

        long started = System.nanoTime();
        FetchResult result = fetcher.fetch(server.url("/slow").toString(), Duration.ofMillis(300), "TestBot/1.0");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(result).isInstanceOf(FetchResult.Timeout.class);
        assertThat(elapsedMs).isLessThan(2500);
    }

    @Test
    void truncatesOversizedBodiesButReportsFullSize() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/plain")
            .setBody("a".repeat(5000)));

        FetchResult.Success success = (FetchResult.Success) fetcher.fetch(
            server.url("/big").toString(), Duration.ofSeconds(5), "TestBot/1.0");

        assertThat(success.body()).hasSize(2048);
        assertThat(success.sizeBytes()).isEqualTo(5000);
    }

    @Test
    void connectionFailureIsANetworkError() throws Exception {
        String url = server.url("/gone").toString();
        server.shutdown();
        server = null;

        FetchResult result = fetcher.fetch(url, Duration.ofSeconds(2), "TestBot/1.0");

        assertThat(result).isInstanceOf(FetchResult.NetworkError.class);
    }

    @Test
    void malformedUrlIsANetworkError() {
        FetchResult result = fetcher.fetch("http://", Duration.ofSeconds(1), "TestBot/1.0");

        assertThat(result).isInstanceOf(FetchResult.NetworkError.class);
        assertThat(((FetchResult.NetworkError) result).detail()).startsWith("invalid_url");
    }

    @Test
    void charsetComesFromContentType() {
        assertThat(HttpPageFetcher.charsetOf("text/html; charset=ISO-8859-1")).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(HttpPageFetcher.charsetOf("text/html; charset=\"nonsense\"")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(HttpPageFetcher.charsetOf(null)).isEqualTo(StandardCharsets.UTF_8);
    }
}
