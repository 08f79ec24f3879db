package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.core.RunTelemetry;
import com.researchbot.data.SummarizationService;
import com.researchbot.model.CompanyProfile;
import com.researchbot.model.RawMetrics;
import com.researchbot.model.ResearchRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResearchStageTest {
    private static final Runnable LIVE = () -> {
    };

    private final RetryPolicy retry = new RetryPolicy(0, 0L, Duration.ofSeconds(2));
    private final RunTelemetry telemetry = new RunTelemetry("s1", "SINGLE", Instant.now());

    @AfterEach
    void tearDown() {
        retry.close();
    }

    @Test
    void research_shouldCollectMetricsAndNews() {
        RawMetrics m = FakeProviders.metrics("20.5", "12%", "18%");
        FakeProviders.NewsFeed news = new FakeProviders.NewsFeed()
                .with("AAPL", List.of(FakeProviders.news("Apple beats estimates"), FakeProviders.news("Apple launch")));
        ResearchStage stage = new ResearchStage(new FakeProviders.FinancialData().with("AAPL", m), news, null, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertSame(m, record.metrics);
        assertEquals(2, record.news.size());
        assertTrue(record.degradedSources.isEmpty());
        assertEquals(ResearchStage.SUMMARY_UNAVAILABLE, record.summary);
    }

    @Test
    void research_shouldDegradeFailedFinancialSource() {
        FakeProviders.FinancialData financial = new FakeProviders.FinancialData()
                .failing("AAPL", FailureKind.PROVIDER_UNAVAILABLE);
        FakeProviders.NewsFeed news = new FakeProviders.NewsFeed()
                .with("AAPL", List.of(FakeProviders.news("Apple beats estimates")));
        ResearchStage stage = new ResearchStage(financial, news, null, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertSame(RawMetrics.EMPTY, record.metrics);
        assertTrue(record.isDegraded(ResearchStage.SOURCE_FINANCIAL));
        assertEquals(1, record.news.size());
        assertEquals(1, telemetry.errorsTotal());
    }

    @Test
    void research_shouldDegradeFailedNewsSource() {
        FakeProviders.NewsFeed news = new FakeProviders.NewsFeed();
        news.failWith = FailureKind.RATE_LIMITED;
        ResearchStage stage = new ResearchStage(
                new FakeProviders.FinancialData().with("MSFT", FakeProviders.metrics("30", "15%", "35%")),
                news, null, retry, 5);

        ResearchRecord record = stage.research("s1", "MSFT", LIVE, telemetry);

        assertTrue(record.news.isEmpty());
        assertEquals(FailureKind.RATE_LIMITED, record.degradedSources.get(0).kind());
    }

    @Test
    void research_shouldFailWhenEverySourceFails() {
        FakeProviders.NewsFeed news = new FakeProviders.NewsFeed();
        news.failWith = FailureKind.PROVIDER_UNAVAILABLE;
        ResearchStage stage = new ResearchStage(
                new FakeProviders.FinancialData().failing("AAPL", FailureKind.PROVIDER_UNAVAILABLE),
                news, null, retry, 5);

        ResearchException e = assertThrows(ResearchException.class, () -> stage.research("s1", "AAPL", LIVE, telemetry));

        assertEquals(FailureKind.RESEARCH_FAILED, e.kind());
        assertTrue(e.getMessage().startsWith("all data sources failed for AAPL"));
    }

    @Test
    void research_shouldFailFastForUnknownTicker() {
        FakeProviders.NewsFeed news = new FakeProviders.NewsFeed();
        ResearchStage stage = new ResearchStage(new FakeProviders.FinancialData(), news, null, retry, 5);

        ResearchException e = assertThrows(ResearchException.class, () -> stage.research("s1", "ZZZZ", LIVE, telemetry));

        assertEquals(FailureKind.RESEARCH_FAILED, e.kind());
        assertEquals("ticker not found: ZZZZ", e.getMessage());
        assertEquals(0, news.calls.get());
    }

    @Test
    void research_shouldUseSummaryWhenServiceResponds() {
        SummarizationService summarizer = record -> "  " + record.ticker + " looks steady.  ";
        ResearchStage stage = new ResearchStage(
                new FakeProviders.FinancialData().with("AAPL", FakeProviders.metrics("20", "5%", "10%")),
                new FakeProviders.NewsFeed(), summarizer, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertEquals("AAPL looks steady.", record.summary);
    }

    @Test
    void research_shouldFallBackWhenSummaryFails() {
        SummarizationService summarizer = record -> {
            throw new ResearchException(FailureKind.SERVICE_UNAVAILABLE, "model offline");
        };
        ResearchStage stage = new ResearchStage(
                new FakeProviders.FinancialData().with("AAPL", FakeProviders.metrics("20", "5%", "10%")),
                new FakeProviders.NewsFeed(), summarizer, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertEquals(ResearchStage.SUMMARY_UNAVAILABLE, record.summary);
        assertTrue(record.degradedSources.isEmpty());
    }

    @Test
    void research_shouldAbortWhenSessionIsGone() {
        FakeProviders.FinancialData financial = new FakeProviders.FinancialData()
                .with("AAPL", FakeProviders.metrics("20", "5%", "10%"));
        ResearchStage stage = new ResearchStage(financial, new FakeProviders.NewsFeed(), null, retry, 5);
        Runnable closed = () -> {
            throw new ResearchException(FailureKind.SESSION_NOT_FOUND, "session not found: s1");
        };

        ResearchException e = assertThrows(ResearchException.class, () -> stage.research("s1", "AAPL", closed, telemetry));

        assertEquals(FailureKind.SESSION_NOT_FOUND, e.kind());
        assertEquals(0, financial.calls.get());
    }

    @Test
    void research_shouldCarryCompanyProfile() {
        CompanyProfile apple = FakeProviders.profile("Apple Inc.", "Technology");
        FakeProviders.FinancialData financial = new FakeProviders.FinancialData()
                .with("AAPL", FakeProviders.metrics("20", "5%", "10%"))
                .withProfile("AAPL", apple);
        ResearchStage stage = new ResearchStage(financial, new FakeProviders.NewsFeed(), null, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertSame(apple, record.profile);
        assertTrue(record.profile.isAvailable());
    }

    @Test
    void research_shouldKeepGoingWhenProfileFails() {
        FakeProviders.FinancialData financial = new FakeProviders.FinancialData()
                .with("AAPL", FakeProviders.metrics("20", "5%", "10%"));
        financial.profileFailure = FailureKind.PROVIDER_UNAVAILABLE;
        ResearchStage stage = new ResearchStage(financial, new FakeProviders.NewsFeed(), null, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertFalse(record.profile.isAvailable());
        assertEquals("AAPL", record.profile.name);
        assertTrue(record.degradedSources.isEmpty());
    }

    @Test
    void research_shouldSkipProfileWhenFinancialSourceIsDown() {
        FakeProviders.FinancialData financial = new FakeProviders.FinancialData()
                .failing("AAPL", FailureKind.PROVIDER_UNAVAILABLE);
        FakeProviders.NewsFeed news = new FakeProviders.NewsFeed()
                .with("AAPL", List.of(FakeProviders.news("Apple beats estimates")));
        ResearchStage stage = new ResearchStage(financial, news, null, retry, 5);

        ResearchRecord record = stage.research("s1", "AAPL", LIVE, telemetry);

        assertEquals(0, financial.profileCalls.get());
        assertFalse(record.profile.isAvailable());
    }

    @Test
    void research_shouldGiveSummaryItsOwnTimeout() {
        SummarizationService slow = record -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ResearchException(FailureKind.SERVICE_UNAVAILABLE, "interrupted", e);
            }
            return "slow but complete";
        };
        FakeProviders.FinancialData financial = new FakeProviders.FinancialData()
                .with("AAPL", FakeProviders.metrics("20", "5%", "10%"));
        RetryPolicy fetchRetry = new RetryPolicy(0, 0L, Duration.ofMillis(100));
        try {
            ResearchStage shared = new ResearchStage(financial, new FakeProviders.NewsFeed(), slow, fetchRetry, 5);
            ResearchStage separate = new ResearchStage(financial, new FakeProviders.NewsFeed(), slow, fetchRetry, retry, 5);

            assertEquals(ResearchStage.SUMMARY_UNAVAILABLE, shared.research("s1", "AAPL", LIVE, telemetry).summary);
            assertEquals("slow but complete", separate.research("s1", "AAPL", LIVE, telemetry).summary);
        } finally {
            fetchRetry.close();
        }
    }
}
