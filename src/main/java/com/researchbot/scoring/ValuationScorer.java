package com.researchbot.scoring;

import com.researchbot.model.FinancialMetrics;
import com.researchbot.model.ValuationScore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Bucket-based valuation score. Each metric contributes independently; a missing metric
 * contributes nothing and is flagged unavailable.
 */
public final class ValuationScorer {
    private static final Logger log = LogManager.getLogger(ValuationScorer.class);

    private final double baseline;

    public ValuationScorer() {
        this(0.0);
    }

    public ValuationScorer(double baseline) {
        this.baseline = baseline;
    }

    public ValuationScore score(FinancialMetrics metrics) {
        List<ValuationScore.Component> breakdown = new ArrayList<>(3);
        breakdown.add(component(ValuationScore.COMPONENT_PE, metrics.peRatio, peScore(metrics.peRatio)));
        breakdown.add(component(ValuationScore.COMPONENT_GROWTH, metrics.revenueGrowth, growthScore(metrics.revenueGrowth)));
        breakdown.add(component(ValuationScore.COMPONENT_MARGIN, metrics.profitMargin, marginScore(metrics.profitMargin)));

        double total = baseline;
        for (ValuationScore.Component c : breakdown) {
            total += c.points();
        }
        double clamped = clamp(total, 0.0, 100.0);
        log.debug("valuation raw={} score={} (PE={}, growth={}, margin={})",
                total, clamped, metrics.peRatio, metrics.revenueGrowth, metrics.profitMargin);

        return ValuationScore.builder()
                .rawTotal(total)
                .score(clamped)
                .breakdown(List.copyOf(breakdown))
                .warnings(metrics.warnings == null ? List.of() : metrics.warnings)
                .build();
    }

    static double peScore(Double pe) {
        if (pe == null) {
            return 0.0;
        }
        if (pe < 12.0) {
            return 25.0;
        }
        if (pe < 18.0) {
            return 15.0;
        }
        if (pe < 25.0) {
            return 5.0;
        }
        if (pe < 35.0) {
            return -10.0;
        }
        return -25.0;
    }

    static double growthScore(Double growthPct) {
        if (growthPct == null) {
            return 0.0;
        }
        if (growthPct > 20.0) {
            return 20.0;
        }
        if (growthPct >= 10.0) {
            return 10.0;
        }
        if (growthPct >= 5.0) {
            return 5.0;
        }
        if (growthPct < 0.0) {
            return -20.0;
        }
        return 0.0;
    }

    static double marginScore(Double marginPct) {
        if (marginPct == null) {
            return 0.0;
        }
        if (marginPct > 25.0) {
            return 15.0;
        }
        if (marginPct >= 15.0) {
            return 8.0;
        }
        if (marginPct >= 8.0) {
            return 3.0;
        }
        if (marginPct < 5.0) {
            return -15.0;
        }
        return 0.0;
    }

    private static ValuationScore.Component component(String name, Double input, double points) {
        return new ValuationScore.Component(name, input, points, input == null);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
