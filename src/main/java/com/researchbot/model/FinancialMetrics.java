package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Typed view of {@link RawMetrics}. Absent values are null; margin and growth are in percent units.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class FinancialMetrics {
    public final Double peRatio;
    public final Double marketCap;
    public final Double revenue;
    public final Double earnings;
    public final Double profitMargin;
    public final Double revenueGrowth;
    public final Double currentPrice;
    public final Double fiftyTwoWeekHigh;
    public final Double fiftyTwoWeekLow;
    public final List<String> warnings;
}
