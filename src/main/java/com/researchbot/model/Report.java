package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class Report {
    public final String ticker;
    public final Instant reportDate;
    public final String sessionId;
    public final String executiveSummary;
    public final String researchSummary;
    public final CompanyProfile companyOverview;
    public final Recommendation recommendation;
    public final ValuationScore valuation;
    public final ValuationCategory valuationCategory;
    public final KeyMetrics keyMetrics;
    public final SentimentResult sentiment;
    public final RiskResult risk;
    public final List<NewsItem> recentNews;
    public final List<DegradedSource> degradedSources;
    /** null when no earlier report exists for the ticker */
    public final PastComparison comparisonWithPast;
}
