package com.siteaudit.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical URL form used as the crawl's dedup key: {@code scheme://host[:port]/path} with the
 * host lower-cased and without {@code www.}, default ports, dot segments, query, fragment and
 * trailing slash.
 */
public final class UrlNormalizer {
    private static final Pattern HIERARCHICAL_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");
    // "mailto:x", "tel:1", "javascript:void(0)"; a digit after the colon is a port instead
    private static final Pattern OPAQUE_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:(?!//)(?![0-9])");

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            throw new UrlNormalizationException(String.valueOf(url), "URL is blank");
        }
        String value = url.trim().replace(" ", "%20");
        if (value.startsWith("//")) {
            value = "https:" + value;
        } else if (!HIERARCHICAL_SCHEME.matcher(value).find()) {
            if (OPAQUE_SCHEME.matcher(value).find()) {
                throw new UrlNormalizationException(url, "Unsupported URL scheme");
            }
            value = "https://" + value;
        }

        URI uri;
        try {
            uri = new URI(value).normalize();
        } catch (URISyntaxException e) {
            throw new UrlNormalizationException(url, "Malformed URL (" + e.getReason() + ")");
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new UrlNormalizationException(url, "Unsupported URL scheme");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new UrlNormalizationException(url, "URL missing host");
        }
        host = stripWww(host.toLowerCase(Locale.ROOT));

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder normalized = new StringBuilder();
        normalized.append(scheme).append("://").append(host);
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            normalized.append(':').append(port);
        }
        normalized.append(path);
        return normalized.toString();
    }

    public static Optional<String> tryNormalize(String url) {
        try {
            return Optional.of(normalize(url));
        } catch (UrlNormalizationException e) {
            return Optional.empty();
        }
    }

    /**
     * True for relative URLs and for URLs whose host is {@code baseHost} or one of its
     * subdomains. {@code www.} is ignored on both sides.
     */
    public static boolean isInternal(String url, String baseHost) {
        if (url == null || url.isBlank() || baseHost == null || baseHost.isBlank()) {
            return false;
        }
        String value = url.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("//")) {
            value = "https:" + value;
        } else if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return true;
        }
        String domain = extractDomain(value);
        if (domain.isEmpty()) {
            return false;
        }
        String base = stripWww(baseHost.trim().toLowerCase(Locale.ROOT));
        return domain.equals(base) || domain.endsWith("." + base);
    }

    public static String extractDomain(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        URI uri = safeUri(url.trim().replace(" ", "%20"));
        if (uri == null || uri.getHost() == null) {
            return "";
        }
        return stripWww(uri.getHost().toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves {@code href} against {@code base}; null when either side cannot be parsed.
     */
    public static String resolve(String base, String href) {
        if (base == null || href == null || href.isBlank()) {
            return null;
        }
        try {
            URI baseUri = new URI(base.trim());
            if (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty()) {
                baseUri = baseUri.resolve("/");
            }
            return baseUri.resolve(href.trim().replace(" ", "%20")).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripWww(String host) {
        if (host.startsWith("www.") && host.length() > 4) {
            return host.substring(4);
        }
        return host;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
    }
}
