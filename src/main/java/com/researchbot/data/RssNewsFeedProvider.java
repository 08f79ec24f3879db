package com.researchbot.data;

import com.researchbot.data.http.HttpClientEx;
import com.researchbot.data.rss.RssParser;
import com.researchbot.model.NewsItem;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * News search backed by the Google News RSS endpoint.
 */
public class RssNewsFeedProvider implements NewsFeedProvider {
    private final HttpClientEx http;
    private final String lang;
    private final String region;
    private final int timeoutSec;

    public RssNewsFeedProvider(HttpClientEx http, String lang, String region, int timeoutSec) {
        this.http = http;
        this.lang = blankTo(lang, "en");
        this.region = blankTo(region, "US").toUpperCase(Locale.ROOT);
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    @Override
    public List<NewsItem> search(String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String xml = http.getText(searchUrl(query), timeoutSec);
        return RssParser.parse(xml, limit);
    }

    String searchUrl(String query) {
        String q = URLEncoder.encode(query == null ? "" : query.trim(), StandardCharsets.UTF_8);
        return "https://news.google.com/rss/search?q=" + q
                + "&hl=" + lang + "&gl=" + region + "&ceid=" + region + ":" + lang;
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }
}
