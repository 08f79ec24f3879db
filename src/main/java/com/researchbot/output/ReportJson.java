package com.researchbot.output;

import com.researchbot.core.FailureKind;
import com.researchbot.model.Action;
import com.researchbot.model.BatchSummary;
import com.researchbot.model.CompanyProfile;
import com.researchbot.model.DegradedSource;
import com.researchbot.model.KeyMetrics;
import com.researchbot.model.MemoryEntry;
import com.researchbot.model.NewsItem;
import com.researchbot.model.PastComparison;
import com.researchbot.model.Recommendation;
import com.researchbot.model.Report;
import com.researchbot.model.RiskLevel;
import com.researchbot.model.RiskResult;
import com.researchbot.model.SentimentLabel;
import com.researchbot.model.SentimentResult;
import com.researchbot.model.ValuationCategory;
import com.researchbot.model.ValuationScore;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of reports, memory entries and batch summaries. Field names are an external contract.
 */
public final class ReportJson {

    private ReportJson() {
    }

    public static JSONObject toJson(Report r) {
        JSONObject root = new JSONObject();
        root.put("ticker", r.ticker);
        root.put("report_date", instant(r.reportDate));
        root.put("executive_summary", r.executiveSummary);
        root.put("llm_research_summary", r.researchSummary == null ? JSONObject.NULL : r.researchSummary);
        root.put("company_overview", companyOverview(r.companyOverview, r.ticker));

        Recommendation rec = r.recommendation;
        root.put("recommendation", new JSONObject()
                .put("action", rec.action.label())
                .put("confidence_score", round2(rec.confidence))
                .put("reasoning", rec.reasoning)
                .put("time_horizon", rec.timeHorizon)
                .put("key_points", new JSONArray(rec.keyPoints)));

        JSONObject breakdown = new JSONObject();
        for (ValuationScore.Component c : r.valuation.breakdown) {
            breakdown.put(c.name(), new JSONObject()
                    .put("input", c.input() == null ? JSONObject.NULL : round2(c.input()))
                    .put("points", c.points())
                    .put("unavailable", c.unavailable()));
        }
        KeyMetrics km = r.keyMetrics;
        root.put("financial_analysis", new JSONObject()
                .put("valuation_score", round2(r.valuation.score))
                .put("raw_valuation_score", round2(r.valuation.rawTotal))
                .put("valuation_category", r.valuationCategory.label())
                .put("score_breakdown", breakdown)
                .put("warnings", new JSONArray(r.valuation.warnings))
                .put("key_metrics", new JSONObject()
                        .put("pe_ratio", km.peRatio)
                        .put("revenue", km.revenue)
                        .put("earnings", km.earnings)
                        .put("market_cap", km.marketCap)
                        .put("profit_margin", km.profitMargin)
                        .put("revenue_growth", km.revenueGrowth)
                        .put("current_price", orNa(km.currentPrice))
                        .put("52_week_high", orNa(km.fiftyTwoWeekHigh))
                        .put("52_week_low", orNa(km.fiftyTwoWeekLow))));

        SentimentResult s = r.sentiment;
        root.put("sentiment_analysis", new JSONObject()
                .put("overall_sentiment", s.label.label())
                .put("confidence", round2(s.confidence))
                .put("positive_count", s.positiveCount)
                .put("negative_count", s.negativeCount)
                .put("neutral_count", s.neutralCount)
                .put("recent_headlines", new JSONArray(s.recentHeadlines)));

        RiskResult risk = r.risk;
        root.put("risk_assessment", new JSONObject()
                .put("risk_level", risk.level.label())
                .put("risk_score", round2(risk.score))
                .put("risk_factors", new JSONArray(risk.factors))
                .put("mitigation_suggestions", new JSONArray(risk.mitigations)));

        JSONArray news = new JSONArray();
        for (NewsItem n : r.recentNews) {
            news.put(new JSONObject()
                    .put("title", n.title)
                    .put("snippet", n.snippet)
                    .put("url", n.url)
                    .put("source", n.source)
                    .put("published_at", n.publishedAt == null
                            ? JSONObject.NULL
                            : n.publishedAt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)));
        }
        root.put("recent_news", news);
        root.put("comparison_with_past", r.comparisonWithPast == null ? JSONObject.NULL : comparison(r.comparisonWithPast));

        JSONArray degraded = new JSONArray();
        for (DegradedSource d : r.degradedSources) {
            degraded.put(new JSONObject()
                    .put("source", d.source())
                    .put("kind", d.kind().name())
                    .put("message", d.message() == null ? "" : d.message()));
        }
        root.put("metadata", new JSONObject()
                .put("session_id", r.sessionId)
                .put("generated_at", instant(r.reportDate))
                .put("degraded_sources", degraded));
        return root;
    }

    public static Report reportFromJson(JSONObject root) {
        JSONObject rec = obj(root, "recommendation");
        JSONObject fin = obj(root, "financial_analysis");
        JSONObject km = obj(fin, "key_metrics");
        JSONObject sent = obj(root, "sentiment_analysis");
        JSONObject risk = obj(root, "risk_assessment");
        JSONObject meta = obj(root, "metadata");

        List<ValuationScore.Component> breakdown = new ArrayList<>();
        JSONObject bd = obj(fin, "score_breakdown");
        for (String name : List.of(ValuationScore.COMPONENT_PE, ValuationScore.COMPONENT_GROWTH, ValuationScore.COMPONENT_MARGIN)) {
            JSONObject c = bd.optJSONObject(name);
            if (c == null) {
                continue;
            }
            Double input = c.isNull("input") ? null : c.optDouble("input");
            breakdown.add(new ValuationScore.Component(name, input, c.optDouble("points", 0.0), c.optBoolean("unavailable", input == null)));
        }
        double score = fin.optDouble("valuation_score", 0.0);

        List<NewsItem> news = new ArrayList<>();
        JSONArray newsArr = root.optJSONArray("recent_news");
        if (newsArr != null) {
            for (int i = 0; i < newsArr.length(); i++) {
                JSONObject n = newsArr.optJSONObject(i);
                if (n == null) {
                    continue;
                }
                news.add(new NewsItem(
                        n.optString("title", ""),
                        n.optString("snippet", ""),
                        n.optString("url", ""),
                        n.optString("source", ""),
                        zoned(n.optString("published_at", ""))
                ));
            }
        }

        List<DegradedSource> degraded = new ArrayList<>();
        JSONArray degradedArr = meta.optJSONArray("degraded_sources");
        if (degradedArr != null) {
            for (int i = 0; i < degradedArr.length(); i++) {
                JSONObject d = degradedArr.optJSONObject(i);
                if (d != null) {
                    degraded.add(new DegradedSource(
                            d.optString("source", ""),
                            failureKind(d.optString("kind", "")),
                            d.optString("message", "")
                    ));
                }
            }
        }

        JSONObject cmp = root.optJSONObject("comparison_with_past");
        return Report.builder()
                .ticker(root.optString("ticker", ""))
                .reportDate(parseInstant(root.optString("report_date", meta.optString("generated_at", ""))))
                .sessionId(meta.optString("session_id", ""))
                .executiveSummary(root.optString("executive_summary", ""))
                .researchSummary(root.isNull("llm_research_summary") ? null : root.optString("llm_research_summary"))
                .companyOverview(companyOverviewFromJson(root.optJSONObject("company_overview"), root.optString("ticker", "")))
                .recommendation(Recommendation.builder()
                        .action(Action.fromLabel(rec.optString("action")))
                        .confidence(rec.optDouble("confidence_score", 0.0))
                        .reasoning(rec.optString("reasoning", ""))
                        .timeHorizon(rec.optString("time_horizon", ""))
                        .keyPoints(strings(rec.optJSONArray("key_points")))
                        .build())
                .valuation(ValuationScore.builder()
                        .score(score)
                        .rawTotal(fin.optDouble("raw_valuation_score", score))
                        .breakdown(List.copyOf(breakdown))
                        .warnings(strings(fin.optJSONArray("warnings")))
                        .build())
                .valuationCategory(ValuationCategory.fromLabel(fin.optString("valuation_category")))
                .keyMetrics(KeyMetrics.builder()
                        .peRatio(km.optString("pe_ratio", "N/A"))
                        .revenue(km.optString("revenue", "N/A"))
                        .earnings(km.optString("earnings", "N/A"))
                        .marketCap(km.optString("market_cap", "N/A"))
                        .profitMargin(km.optString("profit_margin", "N/A"))
                        .revenueGrowth(km.optString("revenue_growth", "N/A"))
                        .currentPrice(km.optString("current_price", "N/A"))
                        .fiftyTwoWeekHigh(km.optString("52_week_high", "N/A"))
                        .fiftyTwoWeekLow(km.optString("52_week_low", "N/A"))
                        .build())
                .sentiment(SentimentResult.builder()
                        .label(SentimentLabel.fromLabel(sent.optString("overall_sentiment")))
                        .confidence(sent.optDouble("confidence", 0.0))
                        .positiveCount(sent.optInt("positive_count", 0))
                        .negativeCount(sent.optInt("negative_count", 0))
                        .neutralCount(sent.optInt("neutral_count", 0))
                        .recentHeadlines(strings(sent.optJSONArray("recent_headlines")))
                        .build())
                .risk(RiskResult.builder()
                        .level(RiskLevel.fromLabel(risk.optString("risk_level")))
                        .score(risk.optDouble("risk_score", 0.0))
                        .factors(strings(risk.optJSONArray("risk_factors")))
                        .mitigations(strings(risk.optJSONArray("mitigation_suggestions")))
                        .build())
                .recentNews(List.copyOf(news))
                .degradedSources(List.copyOf(degraded))
                .comparisonWithPast(cmp == null ? null : comparisonFromJson(cmp))
                .build();
    }

    public static JSONObject toJson(MemoryEntry entry) {
        return new JSONObject()
                .put("session_id", entry.sessionId())
                .put("ticker", entry.ticker())
                .put("stored_at", instant(entry.storedAt()))
                .put("report", toJson(entry.report()));
    }

    public static MemoryEntry entryFromJson(JSONObject o) {
        Report report = reportFromJson(obj(o, "report"));
        return new MemoryEntry(
                o.optString("session_id", report.sessionId),
                o.optString("ticker", report.ticker),
                report,
                parseInstant(o.optString("stored_at", ""))
        );
    }

    public static JSONObject toJson(BatchSummary s) {
        JSONArray entries = new JSONArray();
        for (BatchSummary.Entry e : s.entries) {
            entries.put(new JSONObject()
                    .put("ticker", e.ticker())
                    .put("action", e.action().label())
                    .put("valuation_score", round2(e.valuationScore()))
                    .put("confidence_score", round2(e.confidence()))
                    .put("risk_level", e.riskLevel().label())
                    .put("overall_sentiment", e.sentiment().label()));
        }
        JSONArray failures = new JSONArray();
        for (BatchSummary.Failure f : s.failures) {
            failures.put(new JSONObject()
                    .put("ticker", f.ticker())
                    .put("reason", f.kind().label())
                    .put("message", f.message() == null ? "" : f.message()));
        }
        JSONObject actions = new JSONObject();
        for (Map.Entry<Action, Integer> e : s.actionCounts.entrySet()) {
            actions.put(e.getKey().label(), e.getValue());
        }
        JSONObject risk = new JSONObject();
        for (Map.Entry<RiskLevel, List<String>> e : s.riskGroups.entrySet()) {
            risk.put(e.getKey().label(), new JSONArray(e.getValue()));
        }
        JSONObject sentiment = new JSONObject();
        for (Map.Entry<SentimentLabel, List<String>> e : s.sentimentGroups.entrySet()) {
            sentiment.put(e.getKey().label(), new JSONArray(e.getValue()));
        }
        return new JSONObject()
                .put("total_requested", s.totalRequested)
                .put("successful", s.successful)
                .put("failed", s.failed)
                .put("comparison", entries)
                .put("failures", failures)
                .put("action_counts", actions)
                .put("top_pick", s.topPick == null ? JSONObject.NULL : s.topPick)
                .put("top_picks", new JSONArray(s.topPicks))
                .put("risk_groups", risk)
                .put("sentiment_groups", sentiment)
                .put("summary", s.narrative)
                .put("note", s.note == null ? JSONObject.NULL : s.note);
    }

    private static JSONObject companyOverview(CompanyProfile p, String ticker) {
        CompanyProfile profile = p == null ? CompanyProfile.unavailable(ticker) : p;
        return new JSONObject()
                .put("name", orNa(profile.name))
                .put("sector", orNa(profile.sector))
                .put("industry", orNa(profile.industry))
                .put("description", orNa(profile.description))
                .put("website", orNa(profile.website))
                .put("sources", new JSONArray(profile.sources == null ? List.of() : profile.sources));
    }

    private static CompanyProfile companyOverviewFromJson(JSONObject o, String ticker) {
        if (o == null) {
            return CompanyProfile.unavailable(ticker);
        }
        return CompanyProfile.builder()
                .name(o.optString("name", CompanyProfile.NA))
                .sector(o.optString("sector", CompanyProfile.NA))
                .industry(o.optString("industry", CompanyProfile.NA))
                .description(o.optString("description", CompanyProfile.NA))
                .website(o.optString("website", CompanyProfile.NA))
                .sources(strings(o.optJSONArray("sources")))
                .build();
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    private static JSONObject comparison(PastComparison c) {
        return new JSONObject()
                .put("previous_report_date", instant(c.previousReportDate))
                .put("previous_session_id", c.previousSessionId == null ? "" : c.previousSessionId)
                .put("previous_action", c.previousAction.label())
                .put("previous_valuation_score", round2(c.previousValuationScore))
                .put("score_change", round2(c.scoreChange))
                .put("has_improved", c.hasImproved)
                .put("key_changes", new JSONArray(c.keyChanges));
    }

    private static PastComparison comparisonFromJson(JSONObject c) {
        return PastComparison.builder()
                .previousReportDate(parseInstant(c.optString("previous_report_date", "")))
                .previousSessionId(c.optString("previous_session_id", ""))
                .previousAction(Action.fromLabel(c.optString("previous_action")))
                .previousValuationScore(c.optDouble("previous_valuation_score", 0.0))
                .scoreChange(c.optDouble("score_change", 0.0))
                .hasImproved(c.optBoolean("has_improved", false))
                .keyChanges(strings(c.optJSONArray("key_changes")))
                .build();
    }

    private static JSONObject obj(JSONObject parent, String key) {
        JSONObject o = parent == null ? null : parent.optJSONObject(key);
        return o == null ? new JSONObject() : o;
    }

    private static List<String> strings(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(arr.optString(i, ""));
        }
        return List.copyOf(out);
    }

    private static FailureKind failureKind(String name) {
        for (FailureKind k : FailureKind.values()) {
            if (k.name().equalsIgnoreCase(name)) {
                return k;
            }
        }
        return FailureKind.PROVIDER_UNAVAILABLE;
    }

    private static Object instant(Instant t) {
        return t == null ? JSONObject.NULL : t.toString();
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static ZonedDateTime zoned(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(raw.trim(), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
