package com.researchbot.model;

import java.util.List;

public final class ResearchRecord {
    public final String ticker;
    public final RawMetrics metrics;
    public final CompanyProfile profile;
    public final List<NewsItem> news;
    public final String summary;
    public final List<DegradedSource> degradedSources;

    public ResearchRecord(
            String ticker,
            RawMetrics metrics,
            List<NewsItem> news,
            String summary,
            List<DegradedSource> degradedSources
    ) {
        this(ticker, metrics, null, news, summary, degradedSources);
    }

    public ResearchRecord(
            String ticker,
            RawMetrics metrics,
            CompanyProfile profile,
            List<NewsItem> news,
            String summary,
            List<DegradedSource> degradedSources
    ) {
        this.ticker = ticker;
        this.metrics = metrics == null ? RawMetrics.EMPTY : metrics;
        this.profile = profile == null ? CompanyProfile.unavailable(ticker) : profile;
        this.news = news == null ? List.of() : List.copyOf(news);
        this.summary = summary;
        this.degradedSources = degradedSources == null ? List.of() : List.copyOf(degradedSources);
    }

    public ResearchRecord withSummary(String summary) {
        return new ResearchRecord(ticker, metrics, profile, news, summary, degradedSources);
    }

    public boolean isDegraded(String source) {
        for (DegradedSource d : degradedSources) {
            if (d.source().equals(source)) {
                return true;
            }
        }
        return false;
    }
}
