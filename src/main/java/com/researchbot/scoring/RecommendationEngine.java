package com.researchbot.scoring;

import com.researchbot.model.Action;
import com.researchbot.model.Recommendation;
import com.researchbot.model.RiskResult;
import com.researchbot.model.SentimentLabel;
import com.researchbot.model.SentimentResult;
import com.researchbot.model.ValuationCategory;

import java.util.List;
import java.util.Locale;

/**
 * Maps a valuation score to an action and builds the reproducible reasoning string.
 * The optional LLM summary never feeds into this.
 */
public final class RecommendationEngine {
    static final double BUY_ABOVE = 70.0;
    static final double SELL_BELOW = 35.0;

    public Recommendation recommend(double valuationScore, SentimentResult sentiment, RiskResult risk) {
        Action action = actionFor(valuationScore);
        double confidence = confidence(valuationScore, sentiment.label, risk);
        String reasoning = String.format(
                Locale.US,
                "Valuation score %.1f: %s signal. Sentiment: %s, Risk: %s.",
                valuationScore,
                action.label(),
                sentiment.label.label(),
                risk.level.label()
        );
        List<String> keyPoints = List.of(
                String.format(Locale.US, "Valuation: %.1f/100 (%s)", valuationScore, ValuationCategory.of(valuationScore).label()),
                String.format(Locale.US, "Sentiment: %s (%.2f%% confidence)", sentiment.label.label(), sentiment.confidence),
                String.format(Locale.US, "Risk: %s (score %.1f)", risk.level.label(), risk.score)
        );
        return Recommendation.builder()
                .action(action)
                .confidence(confidence)
                .reasoning(reasoning)
                .timeHorizon(risk.level.timeHorizon())
                .keyPoints(keyPoints)
                .build();
    }

    static Action actionFor(double valuationScore) {
        if (valuationScore > BUY_ABOVE) {
            return Action.BUY;
        }
        if (valuationScore < SELL_BELOW) {
            return Action.SELL;
        }
        return Action.HOLD;
    }

    static double confidence(double valuationScore, SentimentLabel sentiment, RiskResult risk) {
        double c = 50.0 + 0.8 * Math.abs(valuationScore - 50.0);

        int direction = Double.compare(valuationScore, 50.0);
        if (direction != 0 && sentiment != SentimentLabel.NEUTRAL) {
            boolean bullish = direction > 0;
            boolean agrees = bullish == (sentiment == SentimentLabel.POSITIVE);
            c += agrees ? 10.0 : -10.0;
        }

        c -= switch (risk.level) {
            case LOW -> 0.0;
            case MEDIUM -> 5.0;
            case HIGH -> 15.0;
        };
        return Math.round(Math.max(0.0, Math.min(100.0, c)));
    }
}
