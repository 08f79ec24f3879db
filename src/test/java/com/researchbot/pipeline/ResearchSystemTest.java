package com.researchbot.pipeline;

import com.researchbot.config.Config;
import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.memory.MemoryBank;
import com.researchbot.model.Action;
import com.researchbot.model.BatchSummary;
import com.researchbot.model.MemoryEntry;
import com.researchbot.model.Report;
import com.researchbot.session.Session;
import com.researchbot.session.SessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResearchSystemTest {
    private SessionManager sessions;
    private MemoryBank bank;
    private FakeProviders.FinancialData financial;
    private FakeProviders.NewsFeed news;
    private ResearchSystem system;

    @BeforeEach
    void setUp() {
        sessions = new SessionManager(Duration.ofMinutes(10), 4);
        bank = new MemoryBank();
        financial = new FakeProviders.FinancialData()
                .with("AAPL", FakeProviders.metrics("10.5", "25%", "30%"))
                .with("MSFT", FakeProviders.metrics("30", "15%", "20%"))
                .with("INTC", FakeProviders.metrics("40", "-3%", "2%"));
        news = new FakeProviders.NewsFeed()
                .with("AAPL", List.of(FakeProviders.news("Apple shares rally")))
                .with("INTC", List.of(FakeProviders.news("Intel announces layoffs")));
        RetryPolicy retry = new RetryPolicy(0, 0L, Duration.ofSeconds(5));
        ResearchStage research = new ResearchStage(financial, news, null, retry, 5);
        system = new ResearchSystem(sessions, bank, research, new AnalysisStage(0.0), 3, retry);
    }

    @AfterEach
    void tearDown() {
        system.close();
    }

    @Test
    void researchSingle_shouldReturnStoredReportAndCloseSession() {
        Report report = system.researchSingle(" aapl ");

        assertEquals("AAPL", report.ticker);
        assertEquals(Action.HOLD, report.recommendation.action);
        assertEquals(ResearchStage.SUMMARY_UNAVAILABLE, report.researchSummary);
        assertEquals(0, sessions.activeCount());
        assertEquals(1, bank.size());
        assertEquals(report.sessionId, bank.latest("AAPL").orElseThrow().sessionId());
    }

    @Test
    void researchSingle_shouldFailForUnknownTicker() {
        ResearchException e = assertThrows(ResearchException.class, () -> system.researchSingle("ZZZZ"));

        assertEquals(FailureKind.RESEARCH_FAILED, e.kind());
        assertEquals(0, bank.size());
        assertEquals(0, sessions.activeCount());
    }

    @Test
    void researchSingle_shouldRejectBlankTicker() {
        assertThrows(IllegalArgumentException.class, () -> system.researchSingle("  "));
    }

    @Test
    void researchSingle_shouldRejectClosedSession() {
        Session session = sessions.createSession();
        sessions.close(session.id);

        ResearchException e = assertThrows(ResearchException.class, () -> system.researchSingle(session.id, "AAPL"));

        assertEquals(FailureKind.SESSION_NOT_FOUND, e.kind());
    }

    @Test
    void researchSingle_shouldCompareWithEarlierRun() {
        system.researchSingle("AAPL");
        Report second = system.researchSingle("AAPL");

        assertNotNull(second.comparisonWithPast);
        assertEquals(0.0, second.comparisonWithPast.scoreChange, 1e-9);
        assertEquals(2, system.analysisHistory("aapl", 5).size());
        assertEquals(second.sessionId, system.pastAnalysis("AAPL").orElseThrow().sessionId);
    }

    @Test
    void researchBatch_shouldKeepInputOrderAndIsolateFailures() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        financial.gatedTicker = "AAPL";
        financial.gate = gate;
        ExecutorService caller = Executors.newSingleThreadExecutor();
        BatchCoordinator.BatchResult result;
        try {
            Future<BatchCoordinator.BatchResult> pending =
                    caller.submit(() -> system.researchBatch(List.of("aapl", "ZZZZ", "msft", "intc")));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (bank.size() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            assertEquals(2, bank.size());
            assertTrue(bank.latest("AAPL").isEmpty());
            gate.countDown();

            result = pending.get(10, TimeUnit.SECONDS);
        } finally {
            gate.countDown();
            caller.shutdownNow();
        }

        List<TickerOutcome> outcomes = result.outcomes();
        assertEquals(List.of("AAPL", "ZZZZ", "MSFT", "INTC"),
                outcomes.stream().map(o -> o.ticker).toList());
        assertEquals(List.of("AAPL", "MSFT", "INTC"),
                result.summary().entries.stream().map(BatchSummary.Entry::ticker).toList());
        assertTrue(outcomes.get(0).succeeded());
        assertFalse(outcomes.get(1).succeeded());
        assertEquals(FailureKind.RESEARCH_FAILED, outcomes.get(1).failureKind);
        assertEquals(3, result.summary().successful);
        assertEquals(1, result.summary().failed);
        assertEquals(3, result.reports().size());
        assertEquals("AAPL", result.summary().topPick);
        assertEquals(Action.SELL, outcomes.get(3).report().recommendation.action);

        List<MemoryEntry> stored = system.sessionHistory(result.sessionId());
        assertEquals(3, stored.size());
        assertEquals("AAPL", stored.get(2).ticker());
        assertEquals(0, sessions.activeCount());
    }

    @Test
    void researchBatch_shouldSummarizeWhenEveryTickerFails() {
        BatchCoordinator.BatchResult result = system.researchBatch(List.of("ZZZZ", "QQQQ"));

        assertTrue(result.reports().isEmpty());
        assertEquals(2, result.summary().failed);
        assertNull(result.summary().topPick);
        assertEquals("No clear favorite: no ticker completed successfully.", result.summary().note);
    }

    @Test
    void researchBatch_shouldCancelRunsWhenSessionCloses() throws Exception {
        Session session = sessions.createSession();
        CountDownLatch gate = new CountDownLatch(1);
        financial.gate = gate;
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<BatchCoordinator.BatchResult> pending =
                    caller.submit(() -> system.researchBatch(session.id, List.of("AAPL", "MSFT")));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (financial.calls.get() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            sessions.close(session.id);
            gate.countDown();

            BatchCoordinator.BatchResult result = pending.get(10, TimeUnit.SECONDS);

            for (TickerOutcome o : result.outcomes()) {
                assertFalse(o.succeeded());
                assertEquals(FailureKind.SESSION_NOT_FOUND, o.failureKind);
            }
            assertEquals(0, bank.size());
        } finally {
            gate.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void researchBatch_shouldRejectCapacityOverflow() {
        for (int i = 0; i < 4; i++) {
            sessions.createSession();
        }

        ResearchException e = assertThrows(ResearchException.class, () -> system.researchBatch(List.of("AAPL")));

        assertEquals(FailureKind.CAPACITY_EXCEEDED, e.kind());
    }

    @Test
    void configSnapshot_shouldReportEffectiveValuesAndSources() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of(
                "batch", Map.of("size_limit", 3),
                "ai", Map.of("timeout_sec", 90)
        ));

        Map<String, Config.ResolvedValue> byKey = new LinkedHashMap<>();
        for (Config.ResolvedValue v : ResearchSystem.configSnapshot(config)) {
            byKey.put(v.key(), v);
        }

        assertEquals(ResearchSystem.CONFIG_SNAPSHOT_KEYS, List.copyOf(byKey.keySet()));
        assertEquals("3", byKey.get("batch.size_limit").value());
        assertEquals("override", byKey.get("batch.size_limit").source());
        assertEquals("90", byKey.get("ai.timeout_sec").value());
        assertEquals("3600", byKey.get("session.timeout_sec").value());
        assertEquals("default", byKey.get("session.timeout_sec").source());
    }
}
