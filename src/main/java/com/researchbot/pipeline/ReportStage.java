package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.memory.MemoryBank;
import com.researchbot.model.AnalysisResult;
import com.researchbot.model.FinancialMetrics;
import com.researchbot.model.KeyMetrics;
import com.researchbot.model.MemoryEntry;
import com.researchbot.model.PastComparison;
import com.researchbot.model.Report;
import com.researchbot.model.ResearchRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the report, compares it with the latest stored report and appends it to the memory bank.
 */
public final class ReportStage {
    private static final Logger log = LogManager.getLogger(ReportStage.class);
    static final String NA = "N/A";

    private final MemoryBank memoryBank;
    private final Clock clock;

    public ReportStage(MemoryBank memoryBank) {
        this(memoryBank, Clock.systemUTC());
    }

    public ReportStage(MemoryBank memoryBank, Clock clock) {
        this.memoryBank = memoryBank;
        this.clock = clock;
    }

    public PublishedReport publish(String sessionId, ResearchRecord record, AnalysisResult analysis) {
        Instant now = clock.instant();
        Optional<MemoryEntry> previous = memoryBank.latest(record.ticker);
        Report report = Report.builder()
                .ticker(record.ticker)
                .reportDate(now)
                .sessionId(sessionId)
                .executiveSummary(executiveSummary(analysis))
                .researchSummary(record.summary)
                .companyOverview(record.profile)
                .recommendation(analysis.recommendation)
                .valuation(analysis.valuation)
                .valuationCategory(analysis.valuationCategory)
                .keyMetrics(keyMetrics(analysis.metrics))
                .sentiment(analysis.sentiment)
                .risk(analysis.risk)
                .recentNews(record.news)
                .degradedSources(record.degradedSources)
                .comparisonWithPast(previous.map(p -> compare(analysis, p)).orElse(null))
                .build();

        try {
            memoryBank.record(new MemoryEntry(sessionId, record.ticker, report, now));
            return new PublishedReport(report, null);
        } catch (ResearchException e) {
            log.warn("[{}] {} report not persisted: {}", sessionId, record.ticker, e.getMessage());
            ResearchException failure = e.kind() == FailureKind.PERSISTENCE_FAILED
                    ? e
                    : new ResearchException(FailureKind.PERSISTENCE_FAILED, e.getMessage(), e);
            return new PublishedReport(report, failure);
        }
    }

    static String executiveSummary(AnalysisResult a) {
        return a.ticker + " Analysis Summary: "
                + "Recommendation: " + a.recommendation.action.label()
                + " | Market Sentiment: " + capitalize(a.sentiment.label.label())
                + " | Risk Level: " + capitalize(a.risk.level.label());
    }

    static KeyMetrics keyMetrics(FinancialMetrics m) {
        return KeyMetrics.builder()
                .peRatio(m.peRatio == null ? NA : String.format(Locale.US, "%.2f", m.peRatio))
                .revenue(money(m.revenue))
                .earnings(money(m.earnings))
                .marketCap(money(m.marketCap))
                .profitMargin(percent(m.profitMargin))
                .revenueGrowth(percent(m.revenueGrowth))
                .currentPrice(money(m.currentPrice))
                .fiftyTwoWeekHigh(money(m.fiftyTwoWeekHigh))
                .fiftyTwoWeekLow(money(m.fiftyTwoWeekLow))
                .build();
    }

    static PastComparison compare(AnalysisResult current, MemoryEntry previousEntry) {
        Report prev = previousEntry.report();
        double now = current.valuation.score;
        double before = prev.valuation.score;
        double change = now - before;

        List<String> changes = new ArrayList<>();
        if (Math.abs(change) >= 0.05) {
            changes.add(String.format(Locale.US, "Valuation score %s %.1f (%.1f -> %.1f)",
                    change > 0 ? "up" : "down", Math.abs(change), before, now));
        }
        if (prev.recommendation.action != current.recommendation.action) {
            changes.add("Recommendation changed from " + prev.recommendation.action.label()
                    + " to " + current.recommendation.action.label());
        }
        if (prev.sentiment.label != current.sentiment.label) {
            changes.add("Sentiment changed from " + prev.sentiment.label.label()
                    + " to " + current.sentiment.label.label());
        }
        if (prev.risk.level != current.risk.level) {
            changes.add("Risk level changed from " + prev.risk.level.label()
                    + " to " + current.risk.level.label());
        }
        if (changes.isEmpty()) {
            changes.add("No material change since previous analysis");
        }

        return PastComparison.builder()
                .previousReportDate(prev.reportDate)
                .previousSessionId(previousEntry.sessionId())
                .previousAction(prev.recommendation.action)
                .previousValuationScore(before)
                .scoreChange(change)
                .hasImproved(change > 0)
                .keyChanges(List.copyOf(changes))
                .build();
    }

    static String money(Double v) {
        if (v == null) {
            return NA;
        }
        double abs = Math.abs(v);
        if (abs >= 1e12) {
            return String.format(Locale.US, "$%.2fT", v / 1e12);
        }
        if (abs >= 1e9) {
            return String.format(Locale.US, "$%.2fB", v / 1e9);
        }
        if (abs >= 1e6) {
            return String.format(Locale.US, "$%.2fM", v / 1e6);
        }
        return String.format(Locale.US, "$%,.2f", v);
    }

    static String percent(Double v) {
        return v == null ? NA : String.format(Locale.US, "%.2f%%", v);
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }
}
