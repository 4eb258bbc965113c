package com.siteaudit.crawl.model;

public record PageLink(
    String url,
    String anchorText,
    boolean nofollow
) {
}
