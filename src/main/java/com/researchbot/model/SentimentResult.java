package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class SentimentResult {
    public final SentimentLabel label;
    /** 0-100, two decimals */
    public final double confidence;
    public final int positiveCount;
    public final int negativeCount;
    public final int neutralCount;
    public final List<String> recentHeadlines;
}
