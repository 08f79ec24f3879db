package com.researchbot.model;

import com.researchbot.core.FailureKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Comparison across one batch. Entries and failures follow the input ticker order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class BatchSummary {
    public final int totalRequested;
    public final int successful;
    public final int failed;
    public final List<Entry> entries;
    public final List<Failure> failures;
    public final Map<Action, Integer> actionCounts;
    /** null when no ticker is favored */
    public final String topPick;
    public final List<String> topPicks;
    public final Map<RiskLevel, List<String>> riskGroups;
    public final Map<SentimentLabel, List<String>> sentimentGroups;
    public final String narrative;
    /** set when no ticker is favored over the others */
    public final String note;

    public record Entry(
            String ticker,
            Action action,
            double valuationScore,
            double confidence,
            RiskLevel riskLevel,
            SentimentLabel sentiment
    ) {
    }

    public record Failure(String ticker, FailureKind kind, String message) {
    }
}
