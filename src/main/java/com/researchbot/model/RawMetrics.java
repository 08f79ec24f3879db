package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Provider-supplied fundamentals exactly as received. Any field may be null or non-numeric.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class RawMetrics {
    public static final RawMetrics EMPTY = RawMetrics.builder().build();

    public final String peRatio;
    public final String marketCap;
    public final String revenue;
    public final String earnings;
    public final String profitMargin;
    public final String revenueGrowth;
    public final String currentPrice;
    public final String fiftyTwoWeekHigh;
    public final String fiftyTwoWeekLow;
}
