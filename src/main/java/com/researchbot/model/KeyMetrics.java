package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Display-formatted fundamentals as they appear in a report, e.g. {@code $2.95T} or {@code N/A}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class KeyMetrics {
    public final String peRatio;
    public final String revenue;
    public final String earnings;
    public final String marketCap;
    public final String profitMargin;
    public final String revenueGrowth;
    public final String currentPrice;
    public final String fiftyTwoWeekHigh;
    public final String fiftyTwoWeekLow;
}
