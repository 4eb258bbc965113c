package com.siteaudit.crawl.model;

import java.util.List;

public record PageDetails(
    PageRecord page,
    List<InboundLink> inboundLinks
) {
    public int inboundLinksCount() {
        return inboundLinks.size();
    }

    public record InboundLink(String url, String title, String anchorText) {
    }
}
