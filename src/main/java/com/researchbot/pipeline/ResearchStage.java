package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.core.RunTelemetry;
import com.researchbot.data.FinancialDataProvider;
import com.researchbot.data.NewsFeedProvider;
import com.researchbot.data.SummarizationService;
import com.researchbot.model.CompanyProfile;
import com.researchbot.model.DegradedSource;
import com.researchbot.model.NewsItem;
import com.researchbot.model.RawMetrics;
import com.researchbot.model.ResearchRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects fundamentals, company profile, news and an optional summary for one ticker.
 * A failing source degrades to empty data; the run fails only when nothing usable remains.
 */
public final class ResearchStage {
    private static final Logger log = LogManager.getLogger(ResearchStage.class);

    public static final String SOURCE_FINANCIAL = "financial_data";
    public static final String SOURCE_NEWS = "news";
    public static final String SOURCE_PROFILE = "company_profile";
    public static final String SUMMARY_UNAVAILABLE = "Summary unavailable";

    private final FinancialDataProvider financialData;
    private final NewsFeedProvider newsFeed;
    private final SummarizationService summarizer;
    private final RetryPolicy retry;
    private final RetryPolicy summaryRetry;
    private final int newsLimit;

    public ResearchStage(
            FinancialDataProvider financialData,
            NewsFeedProvider newsFeed,
            SummarizationService summarizer,
            RetryPolicy retry,
            int newsLimit
    ) {
        this(financialData, newsFeed, summarizer, retry, retry, newsLimit);
    }

    /**
     * @param summaryRetry policy for the summarizer, which usually needs a longer timeout than data fetches
     */
    public ResearchStage(
            FinancialDataProvider financialData,
            NewsFeedProvider newsFeed,
            SummarizationService summarizer,
            RetryPolicy retry,
            RetryPolicy summaryRetry,
            int newsLimit
    ) {
        this.financialData = financialData;
        this.newsFeed = newsFeed;
        this.summarizer = summarizer;
        this.retry = retry;
        this.summaryRetry = summaryRetry == null ? retry : summaryRetry;
        this.newsLimit = Math.max(1, newsLimit);
    }

    static String newsQuery(String ticker) {
        return ticker + " stock news latest";
    }

    /**
     * @param checkpoint session liveness check, run before every collaborator call
     * @throws ResearchException RESEARCH_FAILED, or the checkpoint's session failure
     */
    public ResearchRecord research(String sessionId, String ticker, Runnable checkpoint, RunTelemetry telemetry) {
        List<DegradedSource> degraded = new ArrayList<>();

        RawMetrics metrics = RawMetrics.EMPTY;
        long t0 = System.currentTimeMillis();
        try {
            metrics = retry.call(SOURCE_FINANCIAL, FailureKind.PROVIDER_UNAVAILABLE, checkpoint, () -> financialData.fetch(ticker));
            telemetry.recordStep(RunTelemetry.STEP_FINANCIAL_FETCH, System.currentTimeMillis() - t0, false);
        } catch (ResearchException e) {
            telemetry.recordStep(RunTelemetry.STEP_FINANCIAL_FETCH, System.currentTimeMillis() - t0, true);
            if (e.kind().isSessionFailure()) {
                throw e;
            }
            if (e.kind() == FailureKind.TICKER_NOT_FOUND) {
                throw new ResearchException(FailureKind.RESEARCH_FAILED, "ticker not found: " + ticker, e);
            }
            log.warn("[{}] {} financial data degraded: {}", sessionId, ticker, e.getMessage());
            degraded.add(new DegradedSource(SOURCE_FINANCIAL, e.kind(), e.getMessage()));
        }

        boolean financialOk = degraded.isEmpty();

        List<NewsItem> news = List.of();
        t0 = System.currentTimeMillis();
        try {
            List<NewsItem> fetched = retry.call(SOURCE_NEWS, FailureKind.PROVIDER_UNAVAILABLE, checkpoint,
                    () -> newsFeed.search(newsQuery(ticker), newsLimit));
            news = fetched == null ? List.of() : fetched;
            telemetry.recordStep(RunTelemetry.STEP_NEWS_FETCH, System.currentTimeMillis() - t0, false);
        } catch (ResearchException e) {
            telemetry.recordStep(RunTelemetry.STEP_NEWS_FETCH, System.currentTimeMillis() - t0, true);
            if (e.kind().isSessionFailure()) {
                throw e;
            }
            log.warn("[{}] {} news degraded: {}", sessionId, ticker, e.getMessage());
            degraded.add(new DegradedSource(SOURCE_NEWS, e.kind(), e.getMessage()));
        }

        if (degraded.size() == 2) {
            throw new ResearchException(
                    FailureKind.RESEARCH_FAILED,
                    "all data sources failed for " + ticker + ": " + degraded.get(0).kind().label()
                            + ", " + degraded.get(1).kind().label()
            );
        }

        CompanyProfile profile = financialOk
                ? profile(sessionId, ticker, checkpoint, telemetry)
                : CompanyProfile.unavailable(ticker);

        ResearchRecord record = new ResearchRecord(ticker, metrics, profile, news, null, degraded);
        log.info("[{}] {} research collected: news={} degraded={}", sessionId, ticker, news.size(), degraded.size());
        return record.withSummary(summarize(sessionId, record, checkpoint, telemetry));
    }

    /**
     * Best-effort: a missing profile never degrades the run.
     */
    private CompanyProfile profile(String sessionId, String ticker, Runnable checkpoint, RunTelemetry telemetry) {
        long t0 = System.currentTimeMillis();
        try {
            CompanyProfile profile = retry.call(SOURCE_PROFILE, FailureKind.PROVIDER_UNAVAILABLE, checkpoint,
                    () -> financialData.profile(ticker));
            telemetry.recordStep(RunTelemetry.STEP_PROFILE_FETCH, System.currentTimeMillis() - t0, false);
            return profile == null ? CompanyProfile.unavailable(ticker) : profile;
        } catch (ResearchException e) {
            telemetry.recordStep(RunTelemetry.STEP_PROFILE_FETCH, System.currentTimeMillis() - t0, true);
            if (e.kind().isSessionFailure()) {
                throw e;
            }
            log.info("[{}] {} company profile unavailable: {}", sessionId, ticker, e.getMessage());
            return CompanyProfile.unavailable(ticker);
        }
    }

    private String summarize(String sessionId, ResearchRecord record, Runnable checkpoint, RunTelemetry telemetry) {
        if (summarizer == null) {
            return SUMMARY_UNAVAILABLE;
        }
        long t0 = System.currentTimeMillis();
        try {
            String summary = summaryRetry.call("summary", FailureKind.SERVICE_UNAVAILABLE, checkpoint, () -> summarizer.summarize(record));
            telemetry.recordStep(RunTelemetry.STEP_AI_SUMMARY, System.currentTimeMillis() - t0, false);
            return summary == null || summary.isBlank() ? SUMMARY_UNAVAILABLE : summary.trim();
        } catch (ResearchException e) {
            telemetry.recordStep(RunTelemetry.STEP_AI_SUMMARY, System.currentTimeMillis() - t0, true);
            if (e.kind().isSessionFailure()) {
                throw e;
            }
            log.info("[{}] {} summary unavailable: {}", sessionId, record.ticker, e.getMessage());
            return SUMMARY_UNAVAILABLE;
        }
    }
}
