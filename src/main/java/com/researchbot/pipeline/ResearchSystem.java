package com.researchbot.pipeline;

import com.researchbot.config.Config;
import com.researchbot.core.ResearchException;
import com.researchbot.core.RunTelemetry;
import com.researchbot.data.LangChainSummaryService;
import com.researchbot.data.RssNewsFeedProvider;
import com.researchbot.data.SummarizationService;
import com.researchbot.data.YahooFinancialDataProvider;
import com.researchbot.data.http.HttpClientEx;
import com.researchbot.memory.MemoryBank;
import com.researchbot.model.MemoryEntry;
import com.researchbot.model.Report;
import com.researchbot.session.Session;
import com.researchbot.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for single and batch research. Calls without a session id open a private
 * session and close it when the call returns.
 */
public final class ResearchSystem implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ResearchSystem.class);

    static final List<String> CONFIG_SNAPSHOT_KEYS = List.of(
            "session.timeout_sec",
            "session.max_concurrent",
            "batch.size_limit",
            "fetch.timeout_sec",
            "fetch.retry.max",
            "fetch.retry.backoff_ms",
            "news.results_per_search",
            "valuation.baseline",
            "memory.path",
            "ai.enabled",
            "ai.timeout_sec",
            "ai.retry.max"
    );

    private final SessionManager sessions;
    private final MemoryBank memoryBank;
    private final TickerPipeline pipeline;
    private final BatchCoordinator batch;
    private final List<RetryPolicy> retryPolicies;

    /**
     * @param retryPolicies policies owned by this system, shut down on {@link #close()}
     */
    public ResearchSystem(
            SessionManager sessions,
            MemoryBank memoryBank,
            ResearchStage research,
            AnalysisStage analysis,
            int batchSizeLimit,
            RetryPolicy... retryPolicies
    ) {
        this.sessions = sessions;
        this.memoryBank = memoryBank;
        this.pipeline = new TickerPipeline(sessions, research, analysis, new ReportStage(memoryBank));
        this.batch = new BatchCoordinator(pipeline, batchSizeLimit);
        this.retryPolicies = retryPolicies == null ? List.of() : List.of(retryPolicies);
    }

    /**
     * Wires the HTTP-backed providers, the memory bank and the session table from configuration.
     */
    public static ResearchSystem fromConfig(Config config) {
        SessionManager sessions = new SessionManager(
                config.getSeconds("session.timeout_sec"),
                config.getInt("session.max_concurrent")
        );
        Path memoryPath = config.getPath("memory.path");
        return fromConfig(config, sessions, memoryPath == null ? new MemoryBank() : MemoryBank.open(memoryPath));
    }

    public static ResearchSystem fromConfig(Config config, SessionManager sessions, MemoryBank memoryBank) {
        for (Config.ResolvedValue v : configSnapshot(config)) {
            log.info("config {}={} ({})", v.key(), v.value(), v.source());
        }
        int fetchTimeoutSec = config.getInt("fetch.timeout_sec");
        long backoffMs = config.getLong("fetch.retry.backoff_ms", 500L);
        HttpClientEx http = new HttpClientEx();
        RetryPolicy retry = new RetryPolicy(
                config.getInt("fetch.retry.max"),
                backoffMs,
                config.getSeconds("fetch.timeout_sec")
        );
        RetryPolicy summaryRetry = new RetryPolicy(
                config.getInt("ai.retry.max"),
                backoffMs,
                config.getSeconds("ai.timeout_sec")
        );
        LangChainSummaryService ai = new LangChainSummaryService(config);
        SummarizationService summarizer = ai.isEnabled() ? ai : null;

        ResearchStage research = new ResearchStage(
                new YahooFinancialDataProvider(http, fetchTimeoutSec),
                new RssNewsFeedProvider(http, config.getString("news.lang", "en"), config.getString("news.region", "US"), fetchTimeoutSec),
                summarizer,
                retry,
                summaryRetry,
                config.getInt("news.results_per_search")
        );
        return new ResearchSystem(
                sessions,
                memoryBank,
                research,
                new AnalysisStage(config.getDouble("valuation.baseline")),
                config.getInt("batch.size_limit"),
                retry,
                summaryRetry
        );
    }

    /**
     * Effective values of the settings that shape a run, with where each one came from.
     */
    static List<Config.ResolvedValue> configSnapshot(Config config) {
        List<Config.ResolvedValue> out = new ArrayList<>(CONFIG_SNAPSHOT_KEYS.size());
        for (String key : CONFIG_SNAPSHOT_KEYS) {
            out.add(config.resolve(key));
        }
        return out;
    }

    public SessionManager sessions() {
        return sessions;
    }

    public MemoryBank memoryBank() {
        return memoryBank;
    }

    public Report researchSingle(String ticker) {
        Session session = sessions.createSession();
        try {
            session.putMetadata("mode", "single");
            return researchSingle(session.id, ticker);
        } finally {
            sessions.close(session.id);
        }
    }

    /**
     * @throws ResearchException session failures, or the ticker's own failure (RESEARCH_FAILED)
     */
    public Report researchSingle(String sessionId, String ticker) {
        String symbol = normalizeTicker(ticker);
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("ticker is required");
        }
        sessions.get(sessionId);
        RunTelemetry telemetry = new RunTelemetry(sessionId, "SINGLE", Instant.now());
        telemetry.setTickersRequested(1);
        TickerOutcome outcome = pipeline.run(sessionId, symbol, telemetry);
        telemetry.finish();
        log.info("[{}] run summary\n{}", sessionId, telemetry.getSummary());
        if (!outcome.succeeded()) {
            throw outcome.toException();
        }
        if (!outcome.published.persisted()) {
            log.warn("[{}] {} returned without persistence: {}", sessionId, symbol,
                    outcome.published.persistenceFailure().getMessage());
        }
        return outcome.report();
    }

    public BatchCoordinator.BatchResult researchBatch(List<String> tickers) {
        Session session = sessions.createSession();
        try {
            session.putMetadata("mode", "batch");
            session.putMetadata("tickers", String.join(",", normalizeTickers(tickers)));
            session.putMetadata("start_time", Instant.now().toString());
            BatchCoordinator.BatchResult result = researchBatch(session.id, tickers);
            session.putMetadata("end_time", Instant.now().toString());
            session.putMetadata("successful", String.valueOf(result.summary().successful));
            session.putMetadata("failed", String.valueOf(result.summary().failed));
            return result;
        } finally {
            sessions.close(session.id);
        }
    }

    /**
     * Never fails because of individual tickers; only an unusable session id raises.
     */
    public BatchCoordinator.BatchResult researchBatch(String sessionId, List<String> tickers) {
        sessions.get(sessionId);
        List<String> symbols = normalizeTickers(tickers);
        RunTelemetry telemetry = new RunTelemetry(sessionId, "BATCH", Instant.now());
        BatchCoordinator.BatchResult result = batch.run(sessionId, symbols, telemetry);
        telemetry.finish();
        log.info("[{}] run summary\n{}", sessionId, telemetry.getSummary());
        return result;
    }

    public Optional<Report> pastAnalysis(String ticker) {
        return memoryBank.latest(normalizeTicker(ticker)).map(MemoryEntry::report);
    }

    public List<MemoryEntry> analysisHistory(String ticker, int limit) {
        return memoryBank.query(normalizeTicker(ticker), limit);
    }

    public List<MemoryEntry> sessionHistory(String sessionId) {
        return memoryBank.querySession(sessionId);
    }

    static String normalizeTicker(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }

    static List<String> normalizeTickers(List<String> tickers) {
        List<String> out = new ArrayList<>();
        if (tickers == null) {
            return out;
        }
        for (String t : tickers) {
            String symbol = normalizeTicker(t);
            if (!symbol.isEmpty()) {
                out.add(symbol);
            }
        }
        return out;
    }

    @Override
    public void close() {
        for (RetryPolicy policy : retryPolicies) {
            if (policy != null) {
                policy.close();
            }
        }
    }
}
