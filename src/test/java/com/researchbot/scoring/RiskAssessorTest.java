package com.researchbot.scoring;

import com.researchbot.model.FinancialMetrics;
import com.researchbot.model.RiskLevel;
import com.researchbot.model.RiskResult;
import com.researchbot.model.SentimentLabel;
import com.researchbot.model.SentimentResult;
import com.researchbot.model.ValuationScore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiskAssessorTest {
    private final RiskAssessor assessor = new RiskAssessor();

    @Test
    void assess_shouldBeLowForStrongValuationAndPositiveNews() {
        RiskResult r = assessor.assess(complete(), valuation(100.0), sentiment(SentimentLabel.POSITIVE, 100.0));

        assertEquals(10.0, r.score, 1e-9);
        assertEquals(RiskLevel.LOW, r.level);
        assertTrue(r.factors.isEmpty());
        assertEquals(List.of("Continue regular monitoring"), r.mitigations);
    }

    @Test
    void assess_shouldFlagOvervaluation() {
        RiskResult r = assessor.assess(complete(), valuation(0.0), sentiment(SentimentLabel.POSITIVE, 100.0));

        assertEquals(50.0, r.score, 1e-9);
        assertEquals(RiskLevel.MEDIUM, r.level);
        assertEquals(List.of("Stock may be overvalued"), r.factors);
    }

    @Test
    void assess_shouldPenalizeMissingFieldsAndUncertainNegativeNews() {
        FinancialMetrics missingPe = complete().toBuilder().peRatio(null).build();

        RiskResult r = assessor.assess(missingPe, valuation(50.0), sentiment(SentimentLabel.NEGATIVE, 40.0));

        assertEquals(80.0, r.score, 1e-9);
        assertEquals(RiskLevel.HIGH, r.level);
        assertTrue(r.factors.contains("Negative news sentiment"));
        assertTrue(r.factors.contains("Mixed or uncertain market sentiment"));
        assertTrue(r.factors.contains("P/E ratio unavailable"));
        assertEquals(3, r.mitigations.size());
    }

    @Test
    void assess_shouldClampToHundred() {
        FinancialMetrics empty = FinancialMetrics.builder().warnings(List.of()).build();

        RiskResult r = assessor.assess(empty, valuation(0.0), sentiment(SentimentLabel.NEGATIVE, 0.0));

        assertEquals(100.0, r.score, 1e-9);
    }

    @Test
    void levelOf_shouldUseInclusiveLowerBounds() {
        assertEquals(RiskLevel.LOW, RiskAssessor.levelOf(33.99));
        assertEquals(RiskLevel.MEDIUM, RiskAssessor.levelOf(34.0));
        assertEquals(RiskLevel.MEDIUM, RiskAssessor.levelOf(66.99));
        assertEquals(RiskLevel.HIGH, RiskAssessor.levelOf(67.0));
    }

    private static FinancialMetrics complete() {
        return FinancialMetrics.builder()
                .peRatio(20.0)
                .revenueGrowth(8.0)
                .profitMargin(18.0)
                .warnings(List.of())
                .build();
    }

    private static ValuationScore valuation(double score) {
        return ValuationScore.builder()
                .rawTotal(score)
                .score(score)
                .breakdown(List.of())
                .warnings(List.of())
                .build();
    }

    private static SentimentResult sentiment(SentimentLabel label, double confidence) {
        return SentimentResult.builder()
                .label(label)
                .confidence(confidence)
                .recentHeadlines(List.of())
                .build();
    }
}
