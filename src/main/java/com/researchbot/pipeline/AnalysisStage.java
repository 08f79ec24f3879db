package com.researchbot.pipeline;

import com.researchbot.model.AnalysisResult;
import com.researchbot.model.FinancialMetrics;
import com.researchbot.model.Recommendation;
import com.researchbot.model.ResearchRecord;
import com.researchbot.model.RiskResult;
import com.researchbot.model.SentimentResult;
import com.researchbot.model.ValuationCategory;
import com.researchbot.model.ValuationScore;
import com.researchbot.scoring.MetricsParser;
import com.researchbot.scoring.RecommendationEngine;
import com.researchbot.scoring.RiskAssessor;
import com.researchbot.scoring.SentimentClassifier;
import com.researchbot.scoring.ValuationScorer;

/**
 * Deterministic: the same record always yields the same result.
 */
public final class AnalysisStage {
    private final MetricsParser parser;
    private final ValuationScorer valuationScorer;
    private final SentimentClassifier sentimentClassifier;
    private final RiskAssessor riskAssessor;
    private final RecommendationEngine recommendationEngine;

    public AnalysisStage(double valuationBaseline) {
        this(new MetricsParser(), new ValuationScorer(valuationBaseline), new SentimentClassifier(),
                new RiskAssessor(), new RecommendationEngine());
    }

    public AnalysisStage(
            MetricsParser parser,
            ValuationScorer valuationScorer,
            SentimentClassifier sentimentClassifier,
            RiskAssessor riskAssessor,
            RecommendationEngine recommendationEngine
    ) {
        this.parser = parser;
        this.valuationScorer = valuationScorer;
        this.sentimentClassifier = sentimentClassifier;
        this.riskAssessor = riskAssessor;
        this.recommendationEngine = recommendationEngine;
    }

    public AnalysisResult analyze(ResearchRecord record) {
        FinancialMetrics metrics = parser.parse(record.metrics);
        ValuationScore valuation = valuationScorer.score(metrics);
        SentimentResult sentiment = sentimentClassifier.classify(record.news);
        RiskResult risk = riskAssessor.assess(metrics, valuation, sentiment);
        Recommendation recommendation = recommendationEngine.recommend(valuation.score, sentiment, risk);
        return AnalysisResult.builder()
                .ticker(record.ticker)
                .metrics(metrics)
                .valuation(valuation)
                .valuationCategory(ValuationCategory.of(valuation.score))
                .sentiment(sentiment)
                .risk(risk)
                .recommendation(recommendation)
                .build();
    }
}
