package com.siteaudit.crawl.http;

import com.siteaudit.config.CrawlerProperties;
import com.siteaudit.crawl.model.FetchResult;
import com.siteaudit.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HttpClient client;
    private final int maxBodyBytes;

    public HttpPageFetcher(CrawlerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.maxBodyBytes = properties.getMaxBodyBytes();
    }

    @Override
    public FetchResult fetch(String url, Duration timeout, String userAgent) {
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return new FetchResult.NetworkError("invalid_url: URL missing host or malformed");
        }
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", CrawlerProperties.normalizeUserAgent(userAgent))
                .header("Accept", HTML_ACCEPT)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            return new FetchResult.NetworkError("invalid_url: " + e.getMessage());
        }

        CompletableFuture<HttpResponse<byte[]>> pending =
            client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            HttpResponse<byte[]> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return toSuccess(response);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return new FetchResult.Timeout("no complete response within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return new FetchResult.Timeout(cause.getMessage());
            }
            if (cause instanceof IOException) {
                return new FetchResult.NetworkError(describe(cause));
            }
            log.warn("Unexpected fetch failure url={}", url, cause);
            return new FetchResult.NetworkError(describe(cause));
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return new FetchResult.NetworkError("interrupted");
        }
    }

    private FetchResult.Success toSuccess(HttpResponse<byte[]> response) {
        byte[] bytes = response.body() == null ? new byte[0] : response.body();
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        int length = Math.min(bytes.length, maxBodyBytes);
        String body = new String(bytes, 0, length, charsetOf(contentType));
        return new FetchResult.Success(
            response.statusCode(),
            response.headers().map(),
            body,
            bytes.length,
            contentType,
            response.uri().toString()
        );
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String param = part.trim();
            if (param.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = param.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        String type = cause.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
