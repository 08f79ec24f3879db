package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class AnalysisResult {
    public final String ticker;
    public final FinancialMetrics metrics;
    public final ValuationScore valuation;
    public final ValuationCategory valuationCategory;
    public final SentimentResult sentiment;
    public final RiskResult risk;
    public final Recommendation recommendation;
}
