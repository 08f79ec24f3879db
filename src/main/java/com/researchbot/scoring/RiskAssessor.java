package com.researchbot.scoring;

import com.researchbot.model.FinancialMetrics;
import com.researchbot.model.RiskLevel;
import com.researchbot.model.RiskResult;
import com.researchbot.model.SentimentResult;
import com.researchbot.model.ValuationCategory;
import com.researchbot.model.ValuationScore;

import java.util.ArrayList;
import java.util.List;

public final class RiskAssessor {
    static final double BASE_RISK = 20.0;
    static final double VALUATION_WEIGHT = 0.4;
    static final double MISSING_FIELD_PENALTY = 10.0;
    static final double LOW_CONFIDENCE_PENALTY = 10.0;
    static final double LOW_CONFIDENCE_THRESHOLD = 50.0;

    public RiskResult assess(FinancialMetrics metrics, ValuationScore valuation, SentimentResult sentiment) {
        List<String> factors = new ArrayList<>();
        double score = BASE_RISK + VALUATION_WEIGHT * (100.0 - valuation.score);

        if (ValuationCategory.of(valuation.score) == ValuationCategory.OVERVALUED) {
            factors.add("Stock may be overvalued");
        }

        switch (sentiment.label) {
            case NEGATIVE -> {
                score += 20.0;
                factors.add("Negative news sentiment");
            }
            case NEUTRAL -> score += 5.0;
            case POSITIVE -> score -= 10.0;
        }

        if (sentiment.confidence < LOW_CONFIDENCE_THRESHOLD) {
            score += LOW_CONFIDENCE_PENALTY;
            factors.add("Mixed or uncertain market sentiment");
        }

        if (metrics.peRatio == null) {
            score += MISSING_FIELD_PENALTY;
            factors.add("P/E ratio unavailable");
        }
        if (metrics.revenueGrowth == null) {
            score += MISSING_FIELD_PENALTY;
            factors.add("Revenue growth unavailable");
        }
        if (metrics.profitMargin == null) {
            score += MISSING_FIELD_PENALTY;
            factors.add("Profit margin unavailable");
        }

        score = Math.round(Math.max(0.0, Math.min(100.0, score)) * 100.0) / 100.0;
        RiskLevel level = levelOf(score);
        return RiskResult.builder()
                .level(level)
                .score(score)
                .factors(List.copyOf(factors))
                .mitigations(mitigationsFor(level))
                .build();
    }

    static RiskLevel levelOf(double score) {
        if (score < 34.0) {
            return RiskLevel.LOW;
        }
        if (score < 67.0) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    static List<String> mitigationsFor(RiskLevel level) {
        return switch (level) {
            case HIGH -> List.of(
                    "Consider smaller position size",
                    "Use stop-loss orders",
                    "Diversify across multiple stocks"
            );
            case MEDIUM -> List.of("Monitor regularly", "Maintain balanced portfolio");
            case LOW -> List.of("Continue regular monitoring");
        };
    }
}
