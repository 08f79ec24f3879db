package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Difference between a new report and the most recent stored report for the same ticker.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class PastComparison {
    public final Instant previousReportDate;
    public final String previousSessionId;
    public final Action previousAction;
    public final double previousValuationScore;
    public final double scoreChange;
    public final boolean hasImproved;
    public final List<String> keyChanges;
}
