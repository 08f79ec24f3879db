package com.researchbot.model;

import java.time.ZonedDateTime;

public class NewsItem {
    public final String title;
    public final String snippet;
    public final String url;
    public final String source;
    public final ZonedDateTime publishedAt;

    public NewsItem(String title, String snippet, String url, String source, ZonedDateTime publishedAt) {
        this.title = title == null ? "" : title.trim();
        this.snippet = snippet == null ? "" : snippet.trim();
        this.url = url == null ? "" : url.trim();
        this.source = source == null ? "" : source.trim();
        this.publishedAt = publishedAt;
    }
}
